/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.Objects;

/**
 * A row in the stream: its storage-assigned sequence number, the text
 * written, and the writer's session metadata.
 *
 * @param sequence  non-negative; assigned by storage on insert
 * @param payload   the text written (opaque)
 * @param metadata  the writer's session metadata
 */
public record StreamRecord(long sequence, String payload, SessionMetadata metadata) {

  public StreamRecord {
    if (sequence < 0)
      throw new IllegalArgumentException("negative sequence: " + sequence);
    Objects.requireNonNull(payload, "null payload");
    Objects.requireNonNull(metadata, "null metadata");
  }

}
