/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@linkplain StoragePort}-backed stream. Instances own their port (and
 * cursor store) and close them on {@linkplain #close()}.
 *
 * <h2>Consumption Tracking</h2>
 * <p>
 * A read asks the {@linkplain CursorStore} for the reader's position,
 * scans the port for rows after it, decodes <em>all</em> of them, and only
 * then advances the reader to the highest sequence returned. So a row that
 * fails to decode aborts the read without consuming anything, and a failed
 * scan leaves the position unchanged.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Multiple writers should use separate instances (separate connections)
 * against the same table; ordering across them is the storage engine's
 * business. Calls into the same instance from multiple threads are safe only
 * if the port is. Cursor positions never regress, so racing reads under the
 * same reader name may see a record twice but never un-consume one.
 * </p>
 */
public class TableStream implements WritableStream, ReadableStream {

  private final static Logger LOG = DbStreamConstants.getLogger();


  /**
   * Opens a write-only stream.
   *
   * @param port      the stream takes ownership
   * @param metadata  attached to every record written
   */
  public static WritableStream openWriter(StoragePort port, SessionMetadata metadata) {
    return new TableStream(port, StreamMode.WRITE, metadata, new InMemoryCursorStore());
  }

  /**
   * Opens a read-only stream with ephemeral (in-memory) cursors.
   *
   * @param port      the stream takes ownership
   */
  public static ReadableStream openReader(StoragePort port) {
    return openReader(port, new InMemoryCursorStore());
  }

  /**
   * Opens a read-only stream using the given cursor store.
   *
   * @param port      the stream takes ownership
   * @param cursors   the stream takes ownership
   */
  public static ReadableStream openReader(StoragePort port, CursorStore cursors) {
    return new TableStream(port, StreamMode.READ, SessionMetadata.EMPTY, cursors);
  }

  /**
   * Opens a stream in the given mode with ephemeral cursors.
   *
   * @param port      the stream takes ownership
   * @param mode      read, write, or both
   * @param metadata  attached to every record written
   */
  public static TableStream open(StoragePort port, StreamMode mode, SessionMetadata metadata) {
    return new TableStream(port, mode, metadata, new InMemoryCursorStore());
  }




  private final StoragePort port;
  private final StreamMode mode;
  private final SessionMetadata metadata;
  private final CursorStore cursors;
  private final RecordCodec codec;

  private volatile boolean closed;


  /**
   * Full constructor.
   *
   * @param port      the stream takes ownership
   * @param mode      read, write, or both
   * @param metadata  attached to every record written
   * @param cursors   the stream takes ownership
   */
  public TableStream(
      StoragePort port, StreamMode mode, SessionMetadata metadata, CursorStore cursors) {
    this.port = Objects.requireNonNull(port, "null port");
    this.mode = Objects.requireNonNull(mode, "null mode");
    this.metadata = Objects.requireNonNull(metadata, "null metadata");
    this.cursors = Objects.requireNonNull(cursors, "null cursors");
    this.codec = new RecordCodec(port.layout());
    LOG.log(Level.DEBUG, "opened {0} stream on table {1}", mode, port.layout().table());
  }


  @Override
  public StreamMode mode() {
    return mode;
  }

  @Override
  public boolean isOpen() {
    return !closed;
  }

  @Override
  public SessionMetadata sessionMetadata() {
    return metadata;
  }

  /** Returns the layout of the backing table. */
  public TableLayout layout() {
    return port.layout();
  }


  //   W R I T E

  @Override
  public long write(String text) {
    checkWrite();
    RawRow row = codec.encode(Objects.requireNonNull(text, "null text"), metadata);
    try {
      long seq = port.append(row);
      LOG.log(Level.TRACE, "appended [{0}] to {1}", seq, port.layout().table());
      return seq;
    } catch (StorageUnavailableException sux) {
      throw new WriteException("on write(): " + sux.getMessage(), sux);
    }
  }


  @Override
  public void flush() {
    checkOpen();
    if (!mode.writable())
      return;
    try {
      port.flush();
    } catch (StorageUnavailableException sux) {
      throw new WriteException("on flush(): " + sux.getMessage(), sux);
    }
  }


  //   R E A D

  @Override
  public List<StreamRecord> readNewRecords(String reader) {
    checkRead();
    Cursors.checkReader(reader);
    final long pos = cursors.positionOf(reader);
    List<StreamRecord> records = decode(pos, port.scanFrom(pos));
    if (!records.isEmpty()) {
      long last = records.get(records.size() - 1).sequence();
      cursors.advance(reader, last);
      LOG.log(
          Level.TRACE, "reader ''{0}'' consumed {1} record(s) ({2}, {3}]",
          reader, records.size(), pos, last);
    }
    return records;
  }


  @Override
  public Optional<String> readLine(String reader) {
    checkRead();
    Cursors.checkReader(reader);
    final long pos = cursors.positionOf(reader);
    List<StreamRecord> next = decode(pos, port.scanFrom(pos, 1));
    if (next.isEmpty())
      return Optional.empty();
    var record = next.get(0);
    cursors.advance(reader, record.sequence());
    return Optional.of(record.payload());
  }


  /**
   * Decodes the rows, verifying their sequence numbers ascend strictly
   * from {@code afterSeq}.
   */
  private List<StreamRecord> decode(long afterSeq, List<RawRow> rows) {
    var records = new ArrayList<StreamRecord>(rows.size());
    long prev = afterSeq;
    for (var row : rows) {
      StreamRecord record = codec.decode(row);
      if (record.sequence() <= prev)
        throw new CorruptRecordException(
            "out-of-order sequence [" + record.sequence() + "] after [" + prev +
            "] scanning " + port.layout().table());
      prev = record.sequence();
      records.add(record);
    }
    return List.copyOf(records);
  }


  @Override
  public boolean hasNew(String reader) {
    checkRead();
    long pos = cursors.positionOf(reader);
    return port.maxSequence().orElse(Cursors.NONE) > pos;
  }


  @Override
  public long position(String reader) {
    checkRead();
    return cursors.positionOf(reader);
  }


  @Override
  public long lastSequence() {
    checkRead();
    return port.maxSequence().orElse(Cursors.NONE);
  }


  @Override
  public long seekToEnd(String reader) {
    checkRead();
    Cursors.checkReader(reader);
    var max = port.maxSequence();
    return max.isPresent() ? cursors.advance(reader, max.getAsLong()) : cursors.positionOf(reader);
  }


  //   C L O S E

  @Override
  public void close() {
    synchronized (this) {
      if (closed)
        return;
      closed = true;
    }
    StreamException error = null;
    try {
      cursors.close();
    } catch (StreamException sx) {
      error = sx;
    }
    try {
      if (mode.writable())
        port.flush();
    } catch (StreamException sx) {
      if (error == null)
        error = sx;
      else
        error.addSuppressed(sx);
    } finally {
      try {
        port.close();
      } catch (StreamException sx) {
        if (error == null)
          error = sx;
        else
          error.addSuppressed(sx);
      }
    }
    LOG.log(Level.DEBUG, "closed {0} stream on table {1}", mode, port.layout().table());
    if (error != null)
      throw error;
  }


  private void checkOpen() throws StreamClosedException {
    if (closed)
      throw new StreamClosedException();
  }

  private void checkRead() throws StreamClosedException, UnsupportedOperationException {
    checkOpen();
    if (!mode.readable())
      throw new UnsupportedOperationException("stream not readable (mode " + mode + ")");
  }

  private void checkWrite() throws StreamClosedException, UnsupportedOperationException {
    checkOpen();
    if (!mode.writable())
      throw new UnsupportedOperationException("stream not writable (mode " + mode + ")");
  }

}
