/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import static io.crums.dbstream.sql.StreamSchema.*;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.OptionalLong;

import io.crums.dbstream.CursorStore;
import io.crums.dbstream.Cursors;
import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.StreamException;
import io.crums.dbstream.TableLayout;
import io.crums.dbstream.TableMissingException;

/**
 * Stored cursors: reader positions persisted in a cursor table, keyed by
 * stream table and reader name, so they survive the stream (and the
 * process). Instances are created by
 * {@linkplain SqlStoragePort#newCursorStore(String)} and share the port's
 * connection (and its monitor); closing an instance does not close the
 * connection.
 *
 * <p>
 * Positions only ever move forward: the update is conditioned on the
 * stored position being lower. If the connection is not in auto-commit
 * mode, each advance is committed (along with anything else pending on
 * the connection).
 * </p>
 *
 * @see StreamSchema#createCursorTableSql(String)
 */
public class SqlCursorStore implements CursorStore {

  private final Connection con;
  private final Object mutex;
  private final String cursorTable;
  private final String streamTable;

  private final PreparedStatement selectStmt;
  private final PreparedStatement updateStmt;
  private final PreparedStatement insertStmt;

  private boolean closed;


  /**
   * @param con           not closed by this instance
   * @param mutex         the connection's owner, synchronized on
   * @param cursorTable   existing cursor table
   * @param streamTable   the stream table whose readers are tracked
   * @param queryTimeout  seconds; 0 for none
   *
   * @throws TableMissingException if the cursor table does not exist
   */
  SqlCursorStore(
      Connection con, Object mutex, String cursorTable, String streamTable, int queryTimeout)
      throws TableMissingException, StreamException {
    this.con = Objects.requireNonNull(con, "null con");
    this.mutex = Objects.requireNonNull(mutex, "null mutex");
    this.cursorTable = TableLayout.checkTableName(cursorTable);
    this.streamTable = TableLayout.checkTableName(streamTable);

    final String where = " WHERE " + STREAM_TABLE + " = ? AND " + READER + " = ?";
    PreparedStatement select = null;
    PreparedStatement update = null;
    PreparedStatement insert = null;
    try {
      select = con.prepareStatement(
          "SELECT " + LAST_SEQ + " FROM " + cursorTable + where);
      update = con.prepareStatement(
          "UPDATE " + cursorTable + " SET " + LAST_SEQ + " = ?" + where +
          " AND " + LAST_SEQ + " < ?");
      insert = con.prepareStatement(
          "INSERT INTO " + cursorTable + " (" + STREAM_TABLE + ", " + READER + ", " +
          LAST_SEQ + ") VALUES (?, ?, ?)");
      if (queryTimeout > 0) {
        select.setQueryTimeout(queryTimeout);
        update.setQueryTimeout(queryTimeout);
        insert.setQueryTimeout(queryTimeout);
      }
    } catch (SQLException sx) {
      closeQuietly(select, sx);
      closeQuietly(update, sx);
      closeQuietly(insert, sx);
      throw SqlErrors.toStreamException("on cursor store <init>", cursorTable, sx);
    }
    this.selectStmt = select;
    this.updateStmt = update;
    this.insertStmt = insert;
  }


  private static void closeQuietly(PreparedStatement stmt, SQLException primary) {
    if (stmt == null)
      return;
    try {
      stmt.close();
    } catch (SQLException sx) {
      primary.addSuppressed(sx);
    }
  }


  /** Returns the cursor table's name. */
  public String cursorTable() {
    return cursorTable;
  }

  /** Returns the name of the stream table whose readers are tracked. */
  public String streamTable() {
    return streamTable;
  }


  @Override
  public long positionOf(String reader) throws StreamException {
    Cursors.checkReader(reader);
    synchronized (mutex) {
      checkOpen();
      try {
        return selectPosition(reader).orElse(Cursors.NONE);
      } catch (SQLException sx) {
        throw SqlErrors.toStreamException("on positionOf(" + reader + ")", cursorTable, sx);
      }
    }
  }


  @Override
  public long advance(String reader, long seq) throws StreamException {
    Cursors.checkReader(reader);
    if (seq < 0)
      throw new IllegalArgumentException("negative seq: " + seq);
    synchronized (mutex) {
      checkOpen();
      try {
        long position;
        try {
          position = tryAdvance(reader, seq);
        } catch (SQLException sx) {
          if (!SqlErrors.isConstraintViolation(sx))
            throw sx;
          // another process inserted this reader's row first
          SqlConstants.getLogger().log(
              Level.DEBUG, "cursor insert race on [{0}:{1}]; retrying", streamTable, reader);
          position = tryAdvance(reader, seq);
        }
        if (!con.getAutoCommit())
          con.commit();
        return position;
      } catch (SQLException sx) {
        throw SqlErrors.toStreamException(
            "on advance(" + reader + ", " + seq + ")", cursorTable, sx);
      }
    }
  }


  private long tryAdvance(String reader, long seq) throws SQLException {
    updateStmt.setLong(1, seq);
    updateStmt.setString(2, streamTable);
    updateStmt.setString(3, reader);
    updateStmt.setLong(4, seq);
    if (updateStmt.executeUpdate() > 0)
      return seq;

    var stored = selectPosition(reader);
    if (stored.isPresent())
      return stored.getAsLong();

    insertStmt.setString(1, streamTable);
    insertStmt.setString(2, reader);
    insertStmt.setLong(3, seq);
    insertStmt.executeUpdate();
    return seq;
  }


  private OptionalLong selectPosition(String reader) throws SQLException {
    selectStmt.setString(1, streamTable);
    selectStmt.setString(2, reader);
    try (ResultSet rs = selectStmt.executeQuery()) {
      return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
    }
  }


  /** Closes the prepared statements; the connection stays open. */
  @Override
  public void close() throws StorageUnavailableException {
    SQLException error = null;
    synchronized (mutex) {
      if (closed)
        return;
      closed = true;
      for (var stmt : new PreparedStatement[] { selectStmt, updateStmt, insertStmt }) {
        try {
          stmt.close();
        } catch (SQLException sx) {
          if (error == null)
            error = sx;
          else
            error.addSuppressed(sx);
        }
      }
    }
    if (error != null)
      throw new StorageUnavailableException(
          "on close [" + cursorTable + "]: " + error.getMessage(), error);
  }


  private void checkOpen() {
    if (closed)
      throw new StorageUnavailableException("cursor store closed: " + cursorTable);
  }

}
