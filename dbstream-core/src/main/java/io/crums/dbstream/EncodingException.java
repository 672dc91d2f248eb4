/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Thrown on write when the payload (or a metadata entry) cannot be
 * represented as text in the backing row. Not retryable.
 */
@SuppressWarnings("serial")
public class EncodingException extends StreamException {

  public EncodingException(String message) {
    super(message);
  }

  public EncodingException(String message, Throwable cause) {
    super(message, cause);
  }

}
