/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

import io.crums.dbstream.RawRow;
import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.StoragePort;
import io.crums.dbstream.StreamException;
import io.crums.dbstream.TableLayout;
import io.crums.dbstream.TableMissingException;

/**
 * A {@linkplain StoragePort} on a JDBC connection. The table must already
 * exist (see {@linkplain StreamSchema}); its sequence column must be an
 * identity (auto-increment) column, since sequence numbers are whatever the
 * database generates on insert.
 *
 * <h2>Commit Order</h2>
 * <p>
 * The engine hands out a sequence number when the row is inserted, but other
 * connections only see the row once it's committed. Left alone, a reader
 * could see a later append commit first, move past it, and never see the
 * earlier one. So each append first locks the stream table's row in the
 * {@linkplain Options#lockTable() lock table} and holds it until commit:
 * sequence numbers are then assigned in commit order. Rows inserted by
 * other means (bypassing the lock) get no such guarantee.
 * </p>
 *
 * <p>
 * Instances own the connection and close it on {@linkplain #close()}. Methods
 * are synchronized, so an instance may be shared across threads, but
 * concurrent writers are better served by separate instances (connections).
 * </p>
 */
public class SqlStoragePort implements StoragePort {

  /**
   * Connection options.
   *
   * <h2>Append Lock</h2>
   * <p>
   * Appends serialize on the stream table's row in {@code lockTable}, held
   * until the append commits. In auto-commit mode that's the end of each
   * append; otherwise it's the next {@linkplain SqlStoragePort#flush() flush},
   * and other writers on the table wait (up to the engine's lock timeout)
   * until then.
   * </p>
   *
   * @param autoCommit    if {@code false}, appends are committed on
   *                      {@linkplain SqlStoragePort#flush() flush}
   * @param queryTimeout  per-statement timeout in seconds; 0 for none
   * @param lockTable     the append-lock table
   *                      (see {@linkplain StreamSchema#createLockTableSql(String)})
   */
  public record Options(boolean autoCommit, int queryTimeout, String lockTable) {

    /** Auto-commit, no timeout, default lock table. */
    public final static Options DEFAULT = new Options(true, 0);

    public Options {
      if (queryTimeout < 0)
        throw new IllegalArgumentException("negative queryTimeout: " + queryTimeout);
      TableLayout.checkTableName(lockTable);
    }

    /** Uses the {@linkplain StreamSchema#DEFAULT_LOCK_TABLE default lock table}. */
    public Options(boolean autoCommit, int queryTimeout) {
      this(autoCommit, queryTimeout, StreamSchema.DEFAULT_LOCK_TABLE);
    }
  }


  /**
   * Returns a new instance using {@linkplain Options#DEFAULT default options}.
   *
   * @param con     the instance takes ownership (but not on failure)
   * @param layout  the table's layout
   *
   * @throws TableMissingException if the table does not exist
   */
  public static SqlStoragePort open(Connection con, TableLayout layout)
      throws TableMissingException, StreamException {
    return new SqlStoragePort(con, layout, Options.DEFAULT);
  }




  private final Connection con;
  private final TableLayout layout;
  private final Options options;

  private final PreparedStatement insertStmt;
  private final PreparedStatement scanStmt;
  private final PreparedStatement maxStmt;

  /** Lock row statements; prepared on first append. */
  private PreparedStatement lockStmt;
  private PreparedStatement seedLockStmt;

  private boolean closed;


  /**
   * Creates a new instance. Verifies the table exists and matches the
   * layout. The connection is not closed on failure.
   *
   * @param con     the instance takes ownership (but not on failure)
   * @param layout  the table's layout
   * @param options connection options
   *
   * @throws TableMissingException
   *         if the table does not exist
   * @throws StorageUnavailableException
   *         on any other database error
   * @throws StreamException
   *         if the table's columns do not match {@code layout}
   */
  public SqlStoragePort(Connection con, TableLayout layout, Options options)
      throws TableMissingException, StreamException {

    this.con = Objects.requireNonNull(con, "null con");
    this.layout = Objects.requireNonNull(layout, "null layout");
    this.options = Objects.requireNonNull(options, "null options");

    final String table = layout.table();
    final String cols = String.join(", ", layout.selectColumns());

    PreparedStatement insert = null;
    PreparedStatement scan = null;
    PreparedStatement max = null;
    try {
      if (con.isClosed())
        throw new IllegalArgumentException("connection closed: " + con);

      verifyTable(cols);

      if (con.getAutoCommit() != options.autoCommit())
        con.setAutoCommit(options.autoCommit());
      if (con.isReadOnly())
        SqlConstants.getLogger().log(
            Level.WARNING,
            "read-only database connection (appends to {0} will fail): {1}", table, con);

      var insertCols = layout.insertColumns();
      String sql =
          "INSERT INTO " + table + " (" + String.join(", ", insertCols) + ") VALUES (" +
          String.join(", ", insertCols.stream().map(c -> "?").toList()) + ")";
      insert = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
      scan = con.prepareStatement(
          "SELECT " + cols + " FROM " + table +
          " WHERE " + layout.seqColumn() + " > ? ORDER BY " + layout.seqColumn());
      max = con.prepareStatement(
          "SELECT MAX(" + layout.seqColumn() + ") FROM " + table);

      if (options.queryTimeout() > 0) {
        insert.setQueryTimeout(options.queryTimeout());
        scan.setQueryTimeout(options.queryTimeout());
        max.setQueryTimeout(options.queryTimeout());
      }

    } catch (SQLException sx) {
      closeQuietly(insert, sx);
      closeQuietly(scan, sx);
      closeQuietly(max, sx);
      throw SqlErrors.toStreamException("on <init>", table, sx);
    }

    this.insertStmt = insert;
    this.scanStmt = scan;
    this.maxStmt = max;

    SqlConstants.getLogger().log(
        Level.DEBUG, "opened storage port on {0} (autocommit={1})", table, options.autoCommit());
  }


  private static void closeQuietly(Statement stmt, SQLException primary) {
    if (stmt == null)
      return;
    try {
      stmt.close();
    } catch (SQLException sx) {
      primary.addSuppressed(sx);
    }
  }


  /**
   * Probes the table with an empty select. On failure, distinguishes a
   * missing table from one that doesn't match the layout.
   */
  private void verifyTable(String cols) throws SQLException, StreamException {
    String probe = "SELECT " + cols + " FROM " + layout.table() + " WHERE 1 = 0";
    try (var stmt = con.createStatement()) {
      stmt.executeQuery(probe).close();
    } catch (SQLException sx) {
      if (SqlErrors.isTableMissing(sx) || !tableExists(con.getMetaData(), layout))
        throw new TableMissingException(layout.table(), sx);
      throw new StreamException(
          "table " + layout.table() + " does not match layout " +
          layout.selectColumns() + ": " + sx.getMessage(), sx);
    }
  }


  /**
   * Looks the table up in the database metadata, trying the name as given,
   * upper-cased, and lower-cased (engines fold unquoted names differently).
   */
  static boolean tableExists(DatabaseMetaData meta, TableLayout layout) throws SQLException {
    return
        tableExists(meta, layout.schema().orElse(null), layout.simpleTableName()) ||
        tableExists(meta, upper(layout.schema().orElse(null)), upper(layout.simpleTableName())) ||
        tableExists(meta, lower(layout.schema().orElse(null)), lower(layout.simpleTableName()));
  }

  private static boolean tableExists(DatabaseMetaData meta, String schema, String name)
      throws SQLException {
    try (ResultSet rs = meta.getTables(null, schema, name, null)) {
      return rs.next();
    }
  }

  private static String upper(String name) {
    return name == null ? null : name.toUpperCase();
  }

  private static String lower(String name) {
    return name == null ? null : name.toLowerCase();
  }


  @Override
  public TableLayout layout() {
    return layout;
  }

  /** Returns the connection options. */
  public Options options() {
    return options;
  }


  /**
   * Returns a new cursor store that persists positions in the given table,
   * using this instance's connection. The store does not close the
   * connection; this instance does.
   *
   * @param cursorTable an existing table (see {@linkplain StreamSchema#createCursorTable(Connection, String)})
   */
  public synchronized SqlCursorStore newCursorStore(String cursorTable) throws StreamException {
    checkOpen();
    return new SqlCursorStore(con, this, cursorTable, layout.table(), options.queryTimeout());
  }


  /**
   * {@inheritDoc}
   *
   * <p>
   * Locks the stream's row in the lock table before inserting. In auto-commit
   * mode the lock and the insert run in their own transaction, committed
   * before returning; otherwise both wait on {@linkplain #flush()}.
   * </p>
   *
   * @throws TableMissingException
   *         if the stream table or the lock table does not exist
   */
  @Override
  public synchronized long append(RawRow row) {
    checkOpen();
    try {
      if (!options.autoCommit())
        return lockAndInsert(row);

      con.setAutoCommit(false);
      long seq;
      try {
        seq = lockAndInsert(row);
        con.commit();
      } catch (SQLException | RuntimeException x) {
        rollback(x);
        throw x;
      }
      con.setAutoCommit(true);
      return seq;

    } catch (SQLException sx) {
      throw SqlErrors.toStreamException("on append", layout.table(), sx);
    }
  }


  /** Rolls back the append's transaction and restores auto-commit. */
  private void rollback(Exception primary) {
    try {
      con.rollback();
    } catch (SQLException sx) {
      primary.addSuppressed(sx);
    }
    try {
      con.setAutoCommit(true);
    } catch (SQLException sx) {
      primary.addSuppressed(sx);
    }
  }


  private long lockAndInsert(RawRow row) throws SQLException {
    lockAppends();
    var cols = layout.insertColumns();
    for (int index = 0; index < cols.size(); ++index) {
      Object value = row.get(cols.get(index)).orElse(null);
      if (value == null)
        insertStmt.setNull(index + 1, Types.VARCHAR);
      else
        insertStmt.setString(index + 1, value.toString());
    }
    int count = insertStmt.executeUpdate();
    if (count != 1)
      throw new StorageUnavailableException(
          "on append [" + layout.table() + "]: update count " + count);

    try (ResultSet keys = insertStmt.getGeneratedKeys()) {
      if (!keys.next())
        throw new StorageUnavailableException(
            "on append [" + layout.table() + "]: no generated key returned");
      return keys.getMetaData().getColumnCount() == 1 ?
          keys.getLong(1) : keys.getLong(layout.seqColumn());
    }
  }


  /**
   * Locks the stream table's row in the lock table (held until the
   * transaction ends), inserting the row if it's not there.
   */
  private void lockAppends() throws SQLException {
    final String lockTable = options.lockTable();
    try {
      if (lockStmt == null)
        prepareLockStatements(lockTable);
      if (lockStmt.executeUpdate() > 0)
        return;
      try {
        seedLockStmt.executeUpdate();
      } catch (SQLException sx) {
        if (!SqlErrors.isConstraintViolation(sx))
          throw sx;
        // another writer seeded it first
        SqlConstants.getLogger().log(
            Level.DEBUG, "lock row race on [{0}:{1}]; retrying", lockTable, layout.table());
        if (lockStmt.executeUpdate() == 0)
          throw new StorageUnavailableException(
              "on append [" + lockTable + "]: lock row for " + layout.table() + " vanished", sx);
      }
    } catch (SQLException sx) {
      if (SqlErrors.isTableMissing(sx))
        throw new TableMissingException(lockTable, sx);
      throw sx;
    }
  }


  private void prepareLockStatements(String lockTable) throws SQLException {
    var lock = con.prepareStatement(
        "UPDATE " + lockTable + " SET " + StreamSchema.APPENDS + " = " +
        StreamSchema.APPENDS + " + 1 WHERE " + StreamSchema.STREAM_TABLE + " = ?");
    PreparedStatement seed;
    try {
      seed = con.prepareStatement(
          "INSERT INTO " + lockTable + " (" + StreamSchema.STREAM_TABLE + ", " +
          StreamSchema.APPENDS + ") VALUES (?, 1)");
    } catch (SQLException sx) {
      closeQuietly(lock, sx);
      throw sx;
    }
    lock.setString(1, layout.table());
    seed.setString(1, layout.table());
    if (options.queryTimeout() > 0) {
      lock.setQueryTimeout(options.queryTimeout());
      seed.setQueryTimeout(options.queryTimeout());
    }
    lockStmt = lock;
    seedLockStmt = seed;
  }


  @Override
  public synchronized List<RawRow> scanFrom(long afterSeq, int limit) {
    if (limit < 1)
      throw new IllegalArgumentException("limit " + limit);
    checkOpen();
    var cols = layout.selectColumns();
    try {
      scanStmt.setLong(1, afterSeq);
      scanStmt.setMaxRows(limit == Integer.MAX_VALUE ? 0 : limit);
      var rows = new ArrayList<RawRow>();
      try (ResultSet rs = scanStmt.executeQuery()) {
        while (rs.next()) {
          var row = new LinkedHashMap<String, Object>();
          row.put(cols.get(0), rs.getObject(1));
          for (int index = 1; index < cols.size(); ++index)
            row.put(cols.get(index), rs.getString(index + 1));
          rows.add(new RawRow(row));
        }
      }
      SqlConstants.getLogger().log(
          Level.TRACE, "scanned {0} row(s) after [{1}] from {2}", rows.size(), afterSeq, layout.table());
      return rows;
    } catch (SQLException sx) {
      throw SqlErrors.toStreamException("on scanFrom(" + afterSeq + ")", layout.table(), sx);
    }
  }


  @Override
  public synchronized OptionalLong maxSequence() {
    checkOpen();
    try (ResultSet rs = maxStmt.executeQuery()) {
      if (!rs.next())
        throw new StorageUnavailableException(
            "on maxSequence [" + layout.table() + "]: empty result");
      long max = rs.getLong(1);
      return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(max);
    } catch (SQLException sx) {
      throw SqlErrors.toStreamException("on maxSequence", layout.table(), sx);
    }
  }


  /** Commits, if not in auto-commit mode. */
  @Override
  public synchronized void flush() {
    checkOpen();
    if (options.autoCommit())
      return;
    try {
      con.commit();
    } catch (SQLException sx) {
      throw SqlErrors.toStreamException("on flush", layout.table(), sx);
    }
  }


  /**
   * Closes the prepared statements and the connection. Uncommitted appends
   * (if not in auto-commit mode) are left to the driver's close behavior;
   * {@linkplain #flush()} first.
   */
  @Override
  public synchronized void close() {
    if (closed)
      return;
    closed = true;
    SQLException error = close(insertStmt, null);
    error = close(scanStmt, error);
    error = close(maxStmt, error);
    if (lockStmt != null) {
      error = close(lockStmt, error);
      error = close(seedLockStmt, error);
    }
    try {
      con.close();
    } catch (SQLException sx) {
      error = chain(sx, error);
    }
    if (error != null)
      throw new StorageUnavailableException(
          "on close [" + layout.table() + "]: " + error.getMessage(), error);
  }


  private static SQLException close(Statement stmt, SQLException error) {
    try {
      stmt.close();
      return error;
    } catch (SQLException sx) {
      return chain(sx, error);
    }
  }

  private static SQLException chain(SQLException sx, SQLException error) {
    if (error == null)
      return sx;
    error.addSuppressed(sx);
    return error;
  }


  /** Returns {@code true} until {@linkplain #close()} is invoked. */
  public synchronized boolean isOpen() {
    return !closed;
  }


  private void checkOpen() throws StorageUnavailableException {
    if (closed)
      throw new StorageUnavailableException("storage port closed: " + layout.table());
  }

}
