/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Names the backing table and its columns. Since these names are spliced
 * into SQL text, they must be plain identifiers (optionally schema-qualified
 * for the table).
 *
 * <h2>Metadata Columns</h2>
 * <p>
 * Session metadata is stored in either (or both) of 2 ways. <em>Key
 * columns</em> hold the value of the metadata key of the same name;
 * whatever keys remain go to the JSON-encoded {@linkplain #metaColumn()
 * meta column}, if present. A metadata key with nowhere to go fails the
 * write.
 * </p>
 *
 * @param table         table name, e.g. {@code stdout_stream} or {@code logs.stdout_stream}
 * @param seqColumn     sequence column (storage-assigned identity)
 * @param payloadColumn text payload column
 * @param metaColumn    optional JSON-encoded metadata column
 * @param keyColumns    metadata keys stored in columns of the same name
 */
public record TableLayout(
    String table,
    String seqColumn,
    String payloadColumn,
    Optional<String> metaColumn,
    List<String> keyColumns) {

  public final static String DEFAULT_SEQ = "seq";
  public final static String DEFAULT_PAYLOAD = "payload";
  public final static String DEFAULT_META = "meta";

  private final static Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");


  /**
   * Returns the default layout for the given table:
   * {@code seq}, {@code payload}, {@code meta} columns, no key columns.
   */
  public static TableLayout defaultLayout(String table) {
    return new TableLayout(
        table, DEFAULT_SEQ, DEFAULT_PAYLOAD, Optional.of(DEFAULT_META), List.of());
  }


  public TableLayout {
    checkTableName(table);
    checkIdentifier(seqColumn, "seq column");
    checkIdentifier(payloadColumn, "payload column");
    if (metaColumn == null)
      metaColumn = Optional.empty();
    metaColumn.ifPresent(c -> checkIdentifier(c, "meta column"));
    keyColumns = List.copyOf(keyColumns);

    var names = new ArrayList<String>();
    names.add(seqColumn.toLowerCase());
    names.add(payloadColumn.toLowerCase());
    metaColumn.ifPresent(c -> names.add(c.toLowerCase()));
    for (var key : keyColumns) {
      checkIdentifier(key, "key column");
      if (names.contains(key.toLowerCase()))
        throw new IllegalArgumentException("duplicate column name: " + key);
      names.add(key.toLowerCase());
    }
    if (names.size() != names.stream().distinct().count())
      throw new IllegalArgumentException("duplicate column names: " + names);
  }


  /**
   * Checks the given table name is a plain, optionally schema-qualified,
   * SQL identifier and returns it.
   *
   * @throws IllegalArgumentException if not
   */
  public static String checkTableName(String table) throws IllegalArgumentException {
    Objects.requireNonNull(table, "null table");
    int dot = table.indexOf('.');
    if (dot == -1)
      checkIdentifier(table, "table");
    else {
      checkIdentifier(table.substring(0, dot), "table schema");
      checkIdentifier(table.substring(dot + 1), "table");
    }
    return table;
  }

  private static void checkIdentifier(String name, String what) {
    Objects.requireNonNull(name, "null " + what);
    if (!IDENTIFIER.matcher(name).matches())
      throw new IllegalArgumentException("illegal " + what + " name: '" + name + "'");
  }


  /** Returns a copy of this instance using the given key columns. */
  public TableLayout keyColumns(List<String> keys) {
    return new TableLayout(table, seqColumn, payloadColumn, metaColumn, keys);
  }

  /** Returns a copy of this instance using the given meta column, if any. */
  public TableLayout metaColumn(Optional<String> column) {
    return new TableLayout(table, seqColumn, payloadColumn, column, keyColumns);
  }


  /**
   * Returns all column names in insertion order, sequence column excluded:
   * payload, meta (if any), then key columns.
   */
  public List<String> insertColumns() {
    var cols = new ArrayList<String>(2 + keyColumns.size());
    cols.add(payloadColumn);
    metaColumn.ifPresent(cols::add);
    cols.addAll(keyColumns);
    return cols;
  }

  /** Returns all column names, sequence column first. */
  public List<String> selectColumns() {
    var cols = new ArrayList<String>(3 + keyColumns.size());
    cols.add(seqColumn);
    cols.addAll(insertColumns());
    return cols;
  }

  /** Returns the table name sans any schema qualifier. */
  public String simpleTableName() {
    int dot = table.indexOf('.');
    return dot == -1 ? table : table.substring(dot + 1);
  }

  /** Returns the schema qualifier, if any. */
  public Optional<String> schema() {
    int dot = table.indexOf('.');
    return dot == -1 ? Optional.empty() : Optional.of(table.substring(0, dot));
  }

}
