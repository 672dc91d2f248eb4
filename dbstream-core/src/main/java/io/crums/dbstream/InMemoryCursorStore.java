/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeral cursors: positions live as long as this object (usually, as
 * long as the stream that owns it). Thread-safe.
 */
public class InMemoryCursorStore implements CursorStore {

  private final ConcurrentHashMap<String, Long> positions = new ConcurrentHashMap<>();


  @Override
  public long positionOf(String reader) {
    return positions.getOrDefault(Cursors.checkReader(reader), Cursors.NONE);
  }


  @Override
  public long advance(String reader, long seq) {
    Cursors.checkReader(reader);
    if (seq < 0)
      throw new IllegalArgumentException("negative seq: " + seq);
    return positions.merge(reader, seq, Math::max);
  }


  /** Forgets all positions. */
  @Override
  public void close() {
    positions.clear();
  }

}
