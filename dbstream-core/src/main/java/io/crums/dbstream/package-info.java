/*
 * Copyright 2026 Babak Farhang
 */
/**
 * A relational table as a file-like append / read stream of text records.
 *
 * <h2>Model</h2>
 * <p>
 * Writers {@linkplain io.crums.dbstream.WritableStream#write(String) append}
 * lines of text, each tagged with the writer's
 * {@linkplain io.crums.dbstream.SessionMetadata session metadata}. The
 * storage engine numbers every row with a strictly increasing sequence
 * number. Readers, identified by name, consume only the rows they have not
 * yet seen, in sequence order, as if reading lines from a growing file.
 * </p>
 * <h2>Layers</h2>
 * <ol>
 * <li>{@linkplain io.crums.dbstream.StreamRecord Records} and their
 * {@linkplain io.crums.dbstream.RecordCodec codec}.</li>
 * <li>The {@linkplain io.crums.dbstream.StoragePort storage port}: append,
 * ordered scan, max-sequence. Backends live in other modules.</li>
 * <li>{@linkplain io.crums.dbstream.CursorStore Cursors}: each reader's last
 * consumed sequence number. Ephemeral by default.</li>
 * <li>The {@linkplain io.crums.dbstream.TableStream stream} tying these
 * together.</li>
 * </ol>
 */
package io.crums.dbstream;
