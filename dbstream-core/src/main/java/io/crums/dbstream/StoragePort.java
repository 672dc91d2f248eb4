/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.List;
import java.util.OptionalLong;

/**
 * The operations a stream needs from its backing engine, scoped to a single
 * table. Implementations own their connection.
 *
 * <h2>Sequence Numbers</h2>
 * <p>
 * Sequence numbers are assigned by the engine on {@linkplain #append(RawRow)
 * append}, atomically with the insert: no 2 appends, from whatever process,
 * ever receive the same number, and a row appended after another completed
 * gets a greater one. Gaps are allowed.
 * </p>
 * <h2>Errors</h2>
 * <p>
 * Every operation (except {@linkplain #close()} on an already-closed
 * instance) may fail with a {@linkplain TableMissingException} if the table
 * does not exist, or a {@linkplain StorageUnavailableException} on any other
 * backend failure. Implementations never create the table and never retry.
 * </p>
 */
public interface StoragePort extends AutoCloseable {

  /** Returns the layout of the table this port serves. */
  TableLayout layout();


  /**
   * Inserts the given row and returns its storage-assigned sequence number.
   *
   * @param row encoded per {@linkplain #layout()}; the sequence column, if
   *            present, is ignored
   */
  long append(RawRow row) throws TableMissingException, StorageUnavailableException;


  /**
   * Returns the rows with sequence numbers greater than {@code afterSeq}, in
   * ascending sequence order, as of the time of the call. Rows appended
   * while the scan runs may or may not be included.
   *
   * @param afterSeq exclusive lower bound ({@code -1} for all rows)
   */
  default List<RawRow> scanFrom(long afterSeq)
      throws TableMissingException, StorageUnavailableException {
    return scanFrom(afterSeq, Integer.MAX_VALUE);
  }


  /**
   * Returns at most {@code limit} rows with sequence numbers greater than
   * {@code afterSeq}, in ascending sequence order.
   *
   * @param afterSeq exclusive lower bound ({@code -1} for all rows)
   * @param limit    &ge; 1
   */
  List<RawRow> scanFrom(long afterSeq, int limit)
      throws TableMissingException, StorageUnavailableException;


  /**
   * Returns the highest sequence number in the table, or empty if the table
   * is empty.
   */
  OptionalLong maxSequence() throws TableMissingException, StorageUnavailableException;


  /**
   * Makes previously appended rows durable and visible to other connections,
   * if they aren't already. Defaults to noop (auto-commit engines).
   */
  default void flush() throws StorageUnavailableException {  }


  /**
   * Releases the underlying connection. Idempotent.
   *
   * @throws StorageUnavailableException
   *         if releasing the connection fails (reported once)
   */
  @Override
  void close() throws StorageUnavailableException;

}
