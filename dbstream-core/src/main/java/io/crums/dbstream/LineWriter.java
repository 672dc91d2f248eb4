/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Adapts a {@linkplain WritableStream} to a {@code Writer}, writing one
 * record per line of text. Line terminators ({@code \n}, {@code \r\n}, or a
 * lone {@code \r}) are not stored. Wrap it in a {@code PrintWriter} to use a
 * table as a {@code stdout} / {@code stderr} replacement.
 *
 * <p>
 * {@linkplain #flush()} does not break a pending partial line into a record;
 * only a line terminator or {@linkplain #close()} does. Stream failures are
 * rethrown as {@code IOException}s.
 * </p>
 */
public class LineWriter extends Writer {

  private final WritableStream stream;
  private final boolean closeStream;
  private final StringBuilder line = new StringBuilder();

  private boolean pendingCr;
  private boolean closed;


  /**
   * Creates an instance that closes the stream when it is closed.
   */
  public LineWriter(WritableStream stream) {
    this(stream, true);
  }

  /**
   * @param stream        the stream written to
   * @param closeStream   if {@code true}, {@linkplain #close()} closes the stream also
   */
  public LineWriter(WritableStream stream, boolean closeStream) {
    this.stream = Objects.requireNonNull(stream, "null stream");
    this.closeStream = closeStream;
  }


  @Override
  public void write(char[] cbuf, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, cbuf.length);
    synchronized (lock) {
      ensureOpen();
      for (int index = off, end = off + len; index < end; ++index) {
        char c = cbuf[index];
        if (pendingCr) {
          pendingCr = false;
          if (c == '\n')
            continue;
        }
        if (c == '\n')
          emitLine();
        else if (c == '\r') {
          emitLine();
          pendingCr = true;
        } else
          line.append(c);
      }
    }
  }


  private void emitLine() throws IOException {
    String text = line.toString();
    line.setLength(0);
    try {
      stream.write(text);
    } catch (StreamException | StreamClosedException x) {
      throw new IOException("on writing line: " + x.getMessage(), x);
    }
  }


  private void ensureOpen() throws IOException {
    if (closed)
      throw new IOException("writer closed");
  }


  @Override
  public void flush() throws IOException {
    synchronized (lock) {
      ensureOpen();
      try {
        stream.flush();
      } catch (StreamException | StreamClosedException x) {
        throw new IOException("on flush: " + x.getMessage(), x);
      }
    }
  }


  /**
   * Writes any pending partial line as a record, flushes, and (if so
   * configured) closes the stream. The stream is flushed (or closed) even if
   * writing the partial line fails; the first failure is thrown, later ones
   * are suppressed in it.
   */
  @Override
  public void close() throws IOException {
    synchronized (lock) {
      if (closed)
        return;
      closed = true;
      IOException error = null;
      try {
        if (line.length() > 0)
          emitLine();
      } catch (IOException iox) {
        error = iox;
      } finally {
        try {
          if (closeStream)
            stream.close();
          else
            stream.flush();
        } catch (StreamException | StreamClosedException x) {
          if (error == null)
            error = new IOException("on close: " + x.getMessage(), x);
          else
            error.addSuppressed(x);
        }
      }
      if (error != null)
        throw error;
    }
  }

}
