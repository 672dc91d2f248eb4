/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Adapts a {@linkplain ReadableStream} to a {@code Reader} bound to one
 * reader name: a {@code stdin} replacement, and the reading counterpart of
 * {@linkplain LineWriter}. As a character stream, each record reads as its
 * payload followed by {@code '\n'}; wrap it in a {@code BufferedReader} for
 * line-at-a-time reading.
 *
 * <h2>Consumption</h2>
 * <p>
 * Records are consumed whole, one at a time: the reader's position advances
 * past a record as soon as any of it is read. The size, limit, and hint
 * arguments of the record-level methods bound how many records are
 * consumed, never split one. A record partially read through the
 * {@code Reader} methods is finished by the next record-level call.
 * </p>
 * <h2>End of Stream</h2>
 * <p>
 * {@linkplain #read(char[], int, int)} returns {@code -1} once the reader
 * has caught up. Unlike a file's, this end is provisional: later reads
 * return records written in the meantime.
 * </p>
 * <p>
 * Stream failures are rethrown as {@code IOException}s
 * ({@code UncheckedIOException}s from the iterator).
 * </p>
 */
public class LineReader extends Reader implements Iterable<String> {

  private final ReadableStream stream;
  private final String name;
  private final boolean closeStream;

  /** The record being read as characters (terminator included), if any. */
  private String current;
  private int offset;

  private boolean closed;


  /**
   * Creates an instance that closes the stream when it is closed.
   */
  public LineReader(ReadableStream stream, String reader) {
    this(stream, reader, true);
  }

  /**
   * @param stream        the stream read from
   * @param reader        the reader name consumption is tracked under
   * @param closeStream   if {@code true}, {@linkplain #close()} closes the stream also
   */
  public LineReader(ReadableStream stream, String reader, boolean closeStream) {
    this.stream = Objects.requireNonNull(stream, "null stream");
    this.name = Cursors.checkReader(reader);
    this.closeStream = closeStream;
  }


  /** Returns the reader name consumption is tracked under. */
  public String readerName() {
    return name;
  }


  @Override
  public int read(char[] cbuf, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, cbuf.length);
    synchronized (lock) {
      ensureOpen();
      if (len == 0)
        return 0;
      if (current == null) {
        var next = fetch();
        if (next.isEmpty())
          return -1;
        current = next.get() + '\n';
        offset = 0;
      }
      int count = Math.min(len, current.length() - offset);
      current.getChars(offset, offset + count, cbuf, off);
      offset += count;
      if (offset == current.length())
        current = null;
      return count;
    }
  }


  /** Returns {@code true} if there's a partially read record or an unread one. */
  @Override
  public boolean ready() throws IOException {
    synchronized (lock) {
      ensureOpen();
      if (current != null)
        return true;
      try {
        return stream.hasNew(name);
      } catch (StreamException | StreamClosedException x) {
        throw new IOException("on ready() [" + name + "]: " + x.getMessage(), x);
      }
    }
  }


  /**
   * Consumes whole records until the text read reaches {@code size}
   * characters, or the reader catches up. Each record contributes its
   * payload and a {@code '\n'}, so the returned text may run past
   * {@code size}.
   *
   * @param size  characters at which to stop; negative for no bound
   *
   * @return the text read; empty if {@code size} is zero or there's nothing new
   */
  public String readText(int size) throws IOException {
    synchronized (lock) {
      ensureOpen();
      var text = new StringBuilder();
      while (size < 0 || text.length() < size) {
        var line = nextRecord();
        if (line.isEmpty())
          break;
        text.append(line.get()).append('\n');
      }
      return text.toString();
    }
  }


  /**
   * Consumes and returns the next record's payload, if any.
   */
  public Optional<String> readLine() throws IOException {
    return readLine(-1);
  }


  /**
   * Consumes the next record and returns at most {@code limit} characters of
   * its payload. The rest of the record is discarded, not left for the next
   * read.
   *
   * @param limit max characters returned; negative for no limit
   */
  public Optional<String> readLine(int limit) throws IOException {
    synchronized (lock) {
      ensureOpen();
      var line = nextRecord();
      if (limit < 0 || line.isEmpty() || line.get().length() <= limit)
        return line;
      return Optional.of(line.get().substring(0, limit));
    }
  }


  /**
   * Consumes records until their combined payload length reaches
   * {@code hint}, or the reader catches up.
   *
   * @param hint  payload characters at which to stop; zero or negative for
   *              no bound
   *
   * @return the payloads read, in write order
   */
  public List<String> readLines(int hint) throws IOException {
    synchronized (lock) {
      ensureOpen();
      var lines = new ArrayList<String>();
      long total = 0;
      while (hint <= 0 || total < hint) {
        var line = nextRecord();
        if (line.isEmpty())
          break;
        lines.add(line.get());
        total += line.get().length();
      }
      return lines;
    }
  }


  /** Consumes every new record and returns their payloads. */
  public List<String> readLines() throws IOException {
    return readLines(0);
  }


  /**
   * Returns an iterator over new records' payloads. {@code hasNext()}
   * consumes the record it looks ahead to. Iteration ends when the reader
   * catches up.
   */
  @Override
  public Iterator<String> iterator() {
    return new Iterator<>() {

      private String next;

      @Override
      public boolean hasNext() {
        if (next == null) {
          try {
            next = readLine().orElse(null);
          } catch (IOException iox) {
            throw new UncheckedIOException(iox);
          }
        }
        return next != null;
      }

      @Override
      public String next() {
        if (!hasNext())
          throw new NoSuchElementException();
        String line = next;
        next = null;
        return line;
      }
    };
  }


  /**
   * Returns the rest of the partially read record (sans terminator), if
   * any text of it remains; otherwise, the next record from the stream.
   */
  private Optional<String> nextRecord() throws IOException {
    if (current != null) {
      int end = current.length() - 1;
      String rest = offset < end ? current.substring(offset, end) : null;
      current = null;
      if (rest != null)
        return Optional.of(rest);
    }
    return fetch();
  }


  private Optional<String> fetch() throws IOException {
    try {
      return stream.readLine(name);
    } catch (StreamException | StreamClosedException x) {
      throw new IOException("on reading [" + name + "]: " + x.getMessage(), x);
    }
  }


  private void ensureOpen() throws IOException {
    if (closed)
      throw new IOException("reader closed");
  }


  /**
   * Discards any partially read record and (if so configured) closes the
   * stream.
   */
  @Override
  public void close() throws IOException {
    synchronized (lock) {
      if (closed)
        return;
      closed = true;
      current = null;
      if (!closeStream)
        return;
      try {
        stream.close();
      } catch (StreamException x) {
        throw new IOException("on close: " + x.getMessage(), x);
      }
    }
  }

}
