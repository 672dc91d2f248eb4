/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A backend row as column-name/value pairs, in column order. Lookups
 * ignore case, since SQL engines fold unquoted identifiers (H2 to upper,
 * PostgreSQL to lower, ..). Values may be {@code null} (SQL {@code NULL}).
 */
public final class RawRow {

  private final Map<String, Object> columns;


  /**
   * @param columns column-name/value pairs (copied; iteration order preserved)
   */
  public RawRow(Map<String, ?> columns) {
    var copy = new LinkedHashMap<String, Object>();
    for (var e : columns.entrySet()) {
      String name = Objects.requireNonNull(e.getKey(), "null column name");
      String key = name.toLowerCase();
      if (copy.containsKey(key))
        throw new IllegalArgumentException("duplicate column: " + name);
      copy.put(key, e.getValue());
    }
    this.columns = Collections.unmodifiableMap(copy);
  }


  /** Returns {@code true} iff the row has the named column (even if its value is null). */
  public boolean has(String column) {
    return columns.containsKey(column.toLowerCase());
  }

  /**
   * Returns the value of the named column.
   *
   * @return empty if the column is missing, or if its value is {@code null}
   */
  public Optional<Object> get(String column) {
    return Optional.ofNullable(columns.get(column.toLowerCase()));
  }

  /** Returns the column values keyed by (lower-cased) column name, in column order. */
  public Map<String, Object> columns() {
    return columns;
  }


  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof RawRow other && other.columns.equals(columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "RawRow" + columns;
  }

}
