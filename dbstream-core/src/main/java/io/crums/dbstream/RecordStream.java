/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Base stream interface: a table viewed as an append-only sequence of
 * text records. A stream is either open or closed; once closed, every
 * operation except {@linkplain #close()} fails with a
 * {@linkplain StreamClosedException}.
 *
 * @see WritableStream
 * @see ReadableStream
 */
public interface RecordStream extends AutoCloseable {

  /** Returns the mode the stream was opened in. */
  StreamMode mode();

  /** Returns {@code true} until {@linkplain #close()} is invoked. */
  boolean isOpen();

  /**
   * Releases the stream's storage connection. Idempotent: closing a
   * closed stream is a noop.
   *
   * @throws StreamException
   *         if releasing a resource fails (reported once; the stream is
   *         closed regardless)
   */
  @Override
  void close() throws StreamException;

}
