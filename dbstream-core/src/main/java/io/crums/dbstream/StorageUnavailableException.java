/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;

/**
 * Transient backend failure: broken connection, timeout, or any other
 * error the storage engine reports. The caller may retry the whole
 * operation; nothing is retried internally.
 */
@SuppressWarnings("serial")
public class StorageUnavailableException extends StreamException {

  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(Throwable cause) {
    this("storage unavailable: " + cause, cause);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

}
