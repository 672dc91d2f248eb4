/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.List;
import java.util.Optional;

/**
 * Read capability. Each named reader has its own position in the stream
 * and sees every record exactly once, in write order, regardless of what
 * other readers do (broadcast, not competing-consumer, semantics).
 *
 * <h2>Errors</h2>
 * <p>
 * Read methods throw {@linkplain StorageUnavailableException} and
 * {@linkplain TableMissingException} as is. A row that fails to decode
 * aborts the read with a {@linkplain CorruptRecordException} and the
 * reader's position is left unchanged.
 * </p>
 */
public interface ReadableStream extends RecordStream {

  /**
   * Returns the payloads of the records the given reader has not yet seen,
   * in write order, and advances the reader past them. Calling it again
   * with no intervening writes returns an empty list.
   */
  default List<String> readNew(String reader) throws StreamException {
    return readNewRecords(reader).stream().map(StreamRecord::payload).toList();
  }

  /** Reads as the {@linkplain Cursors#DEFAULT_READER default reader}. */
  default List<String> readNew() throws StreamException {
    return readNew(Cursors.DEFAULT_READER);
  }

  /**
   * Returns the records the given reader has not yet seen, in sequence
   * order, and advances the reader past them.
   */
  List<StreamRecord> readNewRecords(String reader) throws StreamException;

  /**
   * Consumes and returns the next record's payload, if any.
   */
  Optional<String> readLine(String reader) throws StreamException;

  /** Reads a line as the {@linkplain Cursors#DEFAULT_READER default reader}. */
  default Optional<String> readLine() throws StreamException {
    return readLine(Cursors.DEFAULT_READER);
  }

  /**
   * Returns {@code true} if there are records the reader has not yet seen.
   * Does not move the reader.
   */
  boolean hasNew(String reader) throws StreamException;

  /**
   * Returns the sequence number of the last record the reader consumed, or
   * {@linkplain Cursors#NONE}.
   */
  long position(String reader) throws StreamException;

  /**
   * Returns the sequence number of the last record written, or
   * {@linkplain Cursors#NONE} if the stream is empty. Moves no reader.
   */
  long lastSequence() throws StreamException;

  /**
   * Skips the reader past every record written so far; it will only see
   * records written afterward.
   *
   * @return the reader's new position
   */
  long seekToEnd(String reader) throws StreamException;

  /**
   * Returns a handle bound to the given reader name.
   */
  default StreamReader reader(String name) {
    return new StreamReader(this, name);
  }

}
