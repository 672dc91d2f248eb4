/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.Objects;

/**
 * Cursor constants and argument checks.
 */
public class Cursors {

  // no one calls
  private Cursors() {  }


  /**
   * Position of a reader that has consumed nothing. Lower than any valid
   * sequence number.
   */
  public final static long NONE = -1;

  /**
   * Name of the implicit reader used by the no-argument read methods.
   */
  public final static String DEFAULT_READER = "default";

  /** Maximum reader name length (so it fits a stored cursor's key column). */
  public final static int MAX_READER_LENGTH = 128;


  /**
   * Checks and returns the given reader name.
   *
   * @throws IllegalArgumentException if blank or too long
   */
  public static String checkReader(String reader) throws IllegalArgumentException {
    Objects.requireNonNull(reader, "null reader");
    if (reader.isBlank())
      throw new IllegalArgumentException("blank reader name");
    if (reader.length() > MAX_READER_LENGTH)
      throw new IllegalArgumentException(
          "reader name longer than " + MAX_READER_LENGTH + " chars: " + reader);
    return reader;
  }

}
