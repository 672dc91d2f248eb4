/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.sql.SQLException;
import java.util.Set;

import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.StreamException;
import io.crums.dbstream.TableMissingException;

/**
 * Maps {@code SQLException}s onto the stream exception taxonomy.
 * Missing tables are recognized by SQLState (and a few vendor codes);
 * everything else is treated as the storage being unavailable.
 */
class SqlErrors {

  private SqlErrors() {  }


  /** SQLStates for "no such table": standard, H2 variants, PostgreSQL. */
  private final static Set<String> TABLE_MISSING_STATES =
      Set.of("42S02", "42S03", "42S04", "42P01");

  /** H2 ({@code 4210x}) and MySQL ({@code 1146}) vendor codes for the same. */
  private final static Set<Integer> TABLE_MISSING_CODES =
      Set.of(42102, 42103, 42104, 1146);


  /**
   * Returns {@code true} if the exception, or one in its chain, reports a
   * missing table.
   */
  static boolean isTableMissing(SQLException sx) {
    for (Throwable t = sx; t != null; t = t.getCause()) {
      if (!(t instanceof SQLException s))
        continue;
      String state = s.getSQLState();
      if (state != null && TABLE_MISSING_STATES.contains(state.toUpperCase()))
        return true;
      if (TABLE_MISSING_CODES.contains(s.getErrorCode()))
        return true;
      String msg = s.getMessage();
      // SQLite reports everything as a generic error
      if (msg != null && msg.contains("no such table"))
        return true;
    }
    return false;
  }


  /**
   * Returns {@code true} if the exception reports a unique / primary key
   * violation (SQLState class {@code 23}).
   */
  static boolean isConstraintViolation(SQLException sx) {
    String state = sx.getSQLState();
    return state != null && state.startsWith("23");
  }


  /**
   * Returns the exception to throw for the given {@code SQLException}.
   *
   * @param context   what was being done (for the message)
   * @param table     the table operated on
   * @param sx        the cause
   */
  static StreamException toStreamException(String context, String table, SQLException sx) {
    if (isTableMissing(sx))
      return new TableMissingException(table, sx);
    return new StorageUnavailableException(
        context + " [" + table + "]: " + sx.getMessage(), sx);
  }

}
