/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Append-only write capability.
 */
public interface WritableStream extends RecordStream {

  /**
   * Appends the given text as a new record tagged with this stream's
   * session metadata.
   *
   * @param text  not {@code null}
   *
   * @return the record's storage-assigned sequence number
   *
   * @throws EncodingException        if {@code text} is not well-formed text
   * @throws WriteException           on storage failure
   * @throws TableMissingException    if the table no longer exists
   * @throws StreamClosedException    if closed
   */
  long write(String text)
      throws EncodingException, WriteException, TableMissingException, StreamClosedException;


  /**
   * Makes written records durable and visible to others, if they aren't
   * already.
   *
   * @throws WriteException           on storage failure
   * @throws StreamClosedException    if closed
   */
  void flush() throws WriteException, StreamClosedException;


  /** Returns the metadata attached to every record written by this stream. */
  SessionMetadata sessionMetadata();

}
