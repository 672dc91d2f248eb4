/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class LineWriterTest {


  @Test
  public void testOneRecordPerLine() throws IOException {
    var port = new MemoryStoragePort();
    var stream = TableStream.open(port, StreamMode.READ_WRITE, SessionMetadata.EMPTY);
    var writer = new LineWriter(stream, false);
    writer.write("Line1 stdout\nLine2");
    writer.write(" stdout\r\n\r\nLine4\rLine5");
    writer.flush();
    // partial line is held back on flush
    assertEquals(List.of("Line1 stdout", "Line2 stdout", "", "Line4"), stream.readNew());
    writer.close();
    assertEquals(List.of("Line5"), stream.readNew());
    assertTrue(stream.isOpen());
    assertThrows(IOException.class, () -> writer.write("x"));
    stream.close();
  }


  @Test
  public void testPrintWriterClosesStream() {
    var port = new MemoryStoragePort();
    var stream = TableStream.openWriter(port, SessionMetadata.forCurrentProcess());
    try (var out = new PrintWriter(new LineWriter(stream))) {
      out.println("Error message");
      out.printf("%d items%n", 3);
    }
    assertFalse(stream.isOpen());
    assertEquals(2, port.size());
  }


  @Test
  public void testStreamFailureSurfacesAsIOException() {
    var port = new MemoryStoragePort();
    var stream = TableStream.openWriter(port, SessionMetadata.EMPTY);
    var writer = new LineWriter(stream);
    port.unavailable = true;
    var iox = assertThrows(IOException.class, () -> writer.write("boom\n"));
    assertInstanceOf(WriteException.class, iox.getCause());
    port.unavailable = false;
  }


  @Test
  public void testCloseKeepsFirstFailure() throws IOException {
    var port = new MemoryStoragePort();
    var stream = TableStream.openWriter(port, SessionMetadata.EMPTY);
    var writer = new LineWriter(stream);
    writer.write("partial");
    port.unavailable = true;
    port.failOnClose = true;

    var iox = assertThrows(IOException.class, writer::close);
    // the partial line's write failed first; the stream's close failed after
    assertInstanceOf(WriteException.class, iox.getCause());
    assertEquals(1, iox.getSuppressed().length);
    assertInstanceOf(StreamException.class, iox.getSuppressed()[0]);
    assertFalse(stream.isOpen());
    assertEquals(1, port.closeCount);
    assertEquals(0, port.size());

    // closed regardless
    writer.close();
  }

}
