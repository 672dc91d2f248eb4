/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import io.crums.dbstream.Cursors;
import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.TableLayout;

/**
 * DDL for stream and cursor tables. As with most things here, the aim is
 * a <em>portable</em> schema: the generated SQL avoids vendor-specific
 * types, so it works as-is on H2, PostgreSQL, and the like. Where it
 * doesn't, create the tables by hand; only the column names matter once
 * the tables exist.
 *
 * <h2>Stream Table</h2>
 * <pre>
 *
 * {@code CREATE TABLE IF NOT EXISTS} <em>table</em>
 *  {@code (seq BIGINT GENERATED BY DEFAULT AS IDENTITY,
 *   payload VARCHAR(65535) NOT NULL,
 *   meta VARCHAR(4096),
 *   }<em>key_column</em>{@code  VARCHAR(256), ..
 *   PRIMARY KEY (seq)
 *  )}</pre>
 *
 * <h2>Cursor Table</h2>
 * <pre>
 *
 * {@code CREATE TABLE IF NOT EXISTS} <em>table</em>
 *  {@code (stream_table VARCHAR(256) NOT NULL,
 *   reader VARCHAR(128) NOT NULL,
 *   last_seq BIGINT NOT NULL,
 *   PRIMARY KEY (stream_table, reader)
 *  )}</pre>
 *
 * <h2>Lock Table</h2>
 * <p>
 * One row per stream table. Appends lock their stream table's row until they
 * commit, so sequence numbers are handed out in commit order.
 * {@linkplain #createTable(Connection, TableLayout, String) createTable}
 * creates this table along with the stream table and seeds its row.
 * </p>
 * <pre>
 *
 * {@code CREATE TABLE IF NOT EXISTS} <em>table</em>
 *  {@code (stream_table VARCHAR(256) NOT NULL,
 *   appends BIGINT NOT NULL,
 *   PRIMARY KEY (stream_table)
 *  )}</pre>
 *
 * @see SqlStoragePort
 * @see SqlCursorStore
 */
public class StreamSchema {

  // no one calls
  private StreamSchema() {  }


  public final static String DEFAULT_CURSOR_TABLE = "dbstream_cursors";
  public final static String DEFAULT_LOCK_TABLE = "dbstream_locks";

  public final static String STREAM_TABLE = "stream_table";
  public final static String READER = "reader";
  public final static String LAST_SEQ = "last_seq";
  /** Lock table column counting appends (the value is informational). */
  public final static String APPENDS = "appends";

  /** Default max payload chars. */
  public final static int MAX_PAYLOAD = 65535;
  /** Max chars in the JSON meta column. */
  public final static int MAX_META = 4096;
  /** Max chars in a key column. */
  public final static int MAX_KEY_VALUE = 256;

  private final static String SOFT_TAB = "  ";


  /** Returns the {@code CREATE TABLE} statement for the given layout. */
  public static String createTableSql(TableLayout layout) {
    return createTableSql(layout, MAX_PAYLOAD);
  }


  /**
   * Returns the {@code CREATE TABLE} statement for the given layout.
   *
   * @param maxPayload  max payload chars (the payload column's VARCHAR length)
   */
  public static String createTableSql(TableLayout layout, int maxPayload) {
    if (maxPayload < 1)
      throw new IllegalArgumentException("maxPayload " + maxPayload);
    var sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(layout.table()).append(" (\n");
    sql.append(SOFT_TAB).append(layout.seqColumn())
        .append(" BIGINT GENERATED BY DEFAULT AS IDENTITY,\n");
    sql.append(SOFT_TAB).append(layout.payloadColumn())
        .append(" VARCHAR(").append(maxPayload).append(") NOT NULL,\n");
    layout.metaColumn().ifPresent(
        meta -> sql.append(SOFT_TAB).append(meta)
            .append(" VARCHAR(").append(MAX_META).append("),\n"));
    for (var key : layout.keyColumns())
      sql.append(SOFT_TAB).append(key)
          .append(" VARCHAR(").append(MAX_KEY_VALUE).append("),\n");
    sql.append(SOFT_TAB).append("PRIMARY KEY (").append(layout.seqColumn()).append(") )");
    return sql.toString();
  }


  /** Returns the {@code CREATE TABLE} statement for a cursor table. */
  public static String createCursorTableSql(String cursorTable) {
    return
        """
        CREATE TABLE IF NOT EXISTS %s (
          %s VARCHAR(256) NOT NULL,
          %s VARCHAR(%d) NOT NULL,
          %s BIGINT NOT NULL,
          PRIMARY KEY (%s, %s) )"""
        .formatted(
            TableLayout.checkTableName(cursorTable),
            STREAM_TABLE,
            READER, Cursors.MAX_READER_LENGTH,
            LAST_SEQ,
            STREAM_TABLE, READER);
  }


  /** Returns the {@code CREATE TABLE} statement for an append-lock table. */
  public static String createLockTableSql(String lockTable) {
    return
        """
        CREATE TABLE IF NOT EXISTS %s (
          %s VARCHAR(256) NOT NULL,
          %s BIGINT NOT NULL,
          PRIMARY KEY (%s) )"""
        .formatted(
            TableLayout.checkTableName(lockTable),
            STREAM_TABLE,
            APPENDS,
            STREAM_TABLE);
  }


  /**
   * Creates the stream table and the {@linkplain #DEFAULT_LOCK_TABLE default}
   * lock table, if they don't already exist.
   *
   * @throws StorageUnavailableException on a database error
   */
  public static void createTable(Connection con, TableLayout layout)
      throws StorageUnavailableException {
    createTable(con, layout, DEFAULT_LOCK_TABLE);
  }


  /**
   * Creates the stream table and the lock table, if they don't already
   * exist, and seeds the stream table's lock row.
   *
   * @param lockTable   the lock table appends to this stream serialize on
   *
   * @throws StorageUnavailableException on a database error
   */
  public static void createTable(Connection con, TableLayout layout, String lockTable)
      throws StorageUnavailableException {
    executeDdl(con, createTableSql(layout), layout.table());
    executeDdl(con, createLockTableSql(lockTable), lockTable);
    seedLockRow(con, lockTable, layout.table());
  }


  private static void seedLockRow(Connection con, String lockTable, String streamTable) {
    String select =
        "SELECT COUNT(*) FROM " + lockTable + " WHERE " + STREAM_TABLE + " = ?";
    String insert =
        "INSERT INTO " + lockTable + " (" + STREAM_TABLE + ", " + APPENDS + ") VALUES (?, 0)";
    try (PreparedStatement count = con.prepareStatement(select)) {
      count.setString(1, streamTable);
      boolean seeded;
      try (var rs = count.executeQuery()) {
        seeded = rs.next() && rs.getLong(1) > 0;
      }
      if (!seeded) {
        try (PreparedStatement stmt = con.prepareStatement(insert)) {
          stmt.setString(1, streamTable);
          stmt.executeUpdate();
        }
      }
      if (!con.getAutoCommit())
        con.commit();
    } catch (SQLException sx) {
      if (SqlErrors.isConstraintViolation(sx)) {
        // seeded concurrently
        SqlConstants.getLogger().log(
            Level.DEBUG, "lock row for {0} already in {1}", streamTable, lockTable);
        return;
      }
      throw new StorageUnavailableException(
          "on seeding lock row [" + lockTable + "]: " + sx.getMessage(), sx);
    }
  }


  /**
   * Creates the cursor table, if it doesn't already exist.
   *
   * @throws StorageUnavailableException on a database error
   */
  public static void createCursorTable(Connection con, String cursorTable)
      throws StorageUnavailableException {
    executeDdl(con, createCursorTableSql(cursorTable), cursorTable);
  }


  private static void executeDdl(Connection con, String sql, String table) {
    SqlConstants.getLogger().log(Level.INFO, "Executing SQL DDL:%n%s".formatted(sql));
    try (var stmt = con.createStatement()) {
      stmt.execute(sql);
      if (!con.getAutoCommit())
        con.commit();
    } catch (SQLException sx) {
      throw new StorageUnavailableException(
          "on create table [" + table + "]: " + sx.getMessage(), sx);
    }
  }

}
