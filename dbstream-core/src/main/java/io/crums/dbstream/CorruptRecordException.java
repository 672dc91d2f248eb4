/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Thrown when a stored row cannot be decoded into a {@linkplain StreamRecord}.
 * The read that encounters it is aborted: no row is ever skipped silently.
 */
@SuppressWarnings("serial")
public class CorruptRecordException extends StreamException {

  public CorruptRecordException(String message) {
    super(message);
  }

  public CorruptRecordException(String message, Throwable cause) {
    super(message, cause);
  }

}
