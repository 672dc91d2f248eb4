/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * The stream's backing table does not exist. Tables are provisioned
 * outside the stream; this is not retried.
 */
@SuppressWarnings("serial")
public class TableMissingException extends StreamException {

  private final String table;

  public TableMissingException(String table) {
    this(table, null);
  }

  public TableMissingException(String table, Throwable cause) {
    super("table not found: " + table, cause);
    this.table = table;
  }

  /** Returns the name of the missing table. */
  public String table() {
    return table;
  }

}
