/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.Objects;

/**
 * What a stream is opened for.
 */
public enum StreamMode {

  /** Read-only (a {@code stdin} replacement). */
  READ(true, false),
  /** Write-only (a {@code stdout} / {@code stderr} replacement). */
  WRITE(false, true),
  /** Both. */
  READ_WRITE(true, true);


  private final boolean readable;
  private final boolean writable;

  private StreamMode(boolean readable, boolean writable) {
    this.readable = readable;
    this.writable = writable;
  }


  public boolean readable() {
    return readable;
  }

  public boolean writable() {
    return writable;
  }


  /**
   * Parses a mode string. Accepts the file-style {@code r}, {@code w},
   * {@code rw} (also {@code r+} and {@code w+}), or the names {@code read},
   * {@code write}, {@code read-write} (case-insensitive, {@code _} or
   * {@code -} separated).
   *
   * @throws IllegalArgumentException if not recognized
   */
  public static StreamMode parse(String mode) throws IllegalArgumentException {
    String m = Objects.requireNonNull(mode, "null mode").trim().toLowerCase().replace('_', '-');
    switch (m) {
    case "r":
    case "read":
      return READ;
    case "w":
    case "write":
      return WRITE;
    case "rw":
    case "r+":
    case "w+":
    case "read-write":
      return READ_WRITE;
    default:
      throw new IllegalArgumentException("unrecognized stream mode: '" + mode + "'");
    }
  }

}
