/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


/**
 * Tracks the last sequence number each reader has consumed. Readers are
 * identified by name; distinct names have fully independent positions.
 *
 * @see InMemoryCursorStore
 * @see Cursors
 */
public interface CursorStore extends AutoCloseable {

  /**
   * Returns the reader's last consumed sequence number, or
   * {@linkplain Cursors#NONE} if it has consumed nothing.
   */
  long positionOf(String reader) throws StreamException;


  /**
   * Advances the reader's position to {@code seq}, unless it is already
   * at or beyond it. Positions never regress.
   *
   * @return the reader's position after the call
   */
  long advance(String reader, long seq) throws StreamException;


  /** Releases any resources. Idempotent. */
  @Override
  void close() throws StreamException;

}
