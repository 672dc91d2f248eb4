/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Base class of the exceptions raised by streams and their storage ports.
 * Unchecked; checked backend exceptions (usually {@code SQLException}s)
 * travel as the cause.
 */
@SuppressWarnings("serial")
public class StreamException extends RuntimeException {

  public StreamException() {
  }

  public StreamException(String message) {
    super(message);
  }

  public StreamException(Throwable cause) {
    super(cause);
  }

  public StreamException(String message, Throwable cause) {
    super(message, cause);
  }

}
