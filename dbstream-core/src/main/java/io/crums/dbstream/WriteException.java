/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * A {@linkplain WritableStream#write(String) write} failed in the storage
 * layer. The cause is always a {@linkplain StorageUnavailableException}.
 * Whether the row landed is unknown; retrying may duplicate it.
 */
@SuppressWarnings("serial")
public class WriteException extends StreamException {

  public WriteException(String message, StorageUnavailableException cause) {
    super(message, cause);
  }

  @Override
  public synchronized StorageUnavailableException getCause() {
    return (StorageUnavailableException) super.getCause();
  }

}
