/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Use of a stream after it was closed. Always a programming error.
 */
@SuppressWarnings("serial")
public class StreamClosedException extends IllegalStateException {

  public StreamClosedException() {
    super("I/O operation on closed stream");
  }

  public StreamClosedException(String message) {
    super(message);
  }

}
