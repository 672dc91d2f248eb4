/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A file-handle-like view of a {@linkplain ReadableStream} bound to one
 * reader name.
 */
public final class StreamReader {

  private final ReadableStream stream;
  private final String name;


  StreamReader(ReadableStream stream, String name) {
    this.stream = Objects.requireNonNull(stream, "null stream");
    this.name = Cursors.checkReader(name);
  }


  public String name() {
    return name;
  }

  /** @see ReadableStream#readNew(String) */
  public List<String> readNew() throws StreamException {
    return stream.readNew(name);
  }

  /** @see ReadableStream#readNewRecords(String) */
  public List<StreamRecord> readNewRecords() throws StreamException {
    return stream.readNewRecords(name);
  }

  /** @see ReadableStream#readLine(String) */
  public Optional<String> readLine() throws StreamException {
    return stream.readLine(name);
  }

  /** @see ReadableStream#hasNew(String) */
  public boolean hasNew() throws StreamException {
    return stream.hasNew(name);
  }

  /** @see ReadableStream#position(String) */
  public long position() throws StreamException {
    return stream.position(name);
  }

  /** @see ReadableStream#seekToEnd(String) */
  public long seekToEnd() throws StreamException {
    return stream.seekToEnd(name);
  }

  /**
   * Returns a {@code Reader} view under this name. Closing it does not
   * close the stream.
   */
  public LineReader lineReader() {
    return new LineReader(stream, name, false);
  }

  @Override
  public String toString() {
    return "StreamReader[" + name + "]";
  }

}
