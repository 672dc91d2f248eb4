/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.dbstream.Cursors;
import io.crums.dbstream.SessionMetadata;
import io.crums.dbstream.StreamMode;
import io.crums.dbstream.TableLayout;
import io.crums.dbstream.TableMissingException;
import io.crums.dbstream.TableStream;

/**
 *
 */
public class SqlCursorStoreTest extends BaseTestCase {

  private final static TableLayout LAYOUT = TableLayout.defaultLayout(STREAM_TABLE);
  private final static String CURSORS = StreamSchema.DEFAULT_CURSOR_TABLE;


  private Connection newDatabaseWithCursors(Object label) throws Exception {
    var con = newStreamDatabase(label);
    StreamSchema.createCursorTable(con, CURSORS);
    return con;
  }


  private TableStream openStream(Connection con) {
    var port = SqlStoragePort.open(con, LAYOUT);
    return new TableStream(
        port, StreamMode.READ_WRITE, SessionMetadata.EMPTY, port.newCursorStore(CURSORS));
  }


  @Test
  public void testPositionsSurviveReopen() throws Exception {
    final Object label = new Object() { };
    Connection con = newDatabaseWithCursors(label);

    try (var stream = openStream(con)) {
      stream.write("a");
      stream.write("b");
      assertEquals(List.of("a", "b"), stream.readNew("r"));
    }
    assertTrue(con.isClosed());

    try (var stream = openStream(DriverManager.getConnection(memUrl(label)))) {
      assertTrue(stream.readNew("r").isEmpty());
      stream.write("c");
      assertEquals(List.of("c"), stream.readNew("r"));
      assertEquals(List.of("a", "b", "c"), stream.readNew("other"));
    }
  }


  @Test
  public void testMonotonicAdvance() throws Exception {
    final Object label = new Object() { };
    try (Connection con = newDatabaseWithCursors(label);
         var cursors = new SqlCursorStore(con, con, CURSORS, STREAM_TABLE, 0)) {

      assertEquals(Cursors.NONE, cursors.positionOf("r"));
      assertEquals(5, cursors.advance("r", 5));
      assertEquals(5, cursors.advance("r", 3));
      assertEquals(5, cursors.positionOf("r"));
      assertEquals(9, cursors.advance("r", 9));
      assertEquals(9, cursors.positionOf("r"));

      assertThrows(IllegalArgumentException.class, () -> cursors.advance("r", -1));
      assertThrows(IllegalArgumentException.class, () -> cursors.positionOf(" "));
      assertThrows(
          IllegalArgumentException.class,
          () -> cursors.positionOf("x".repeat(Cursors.MAX_READER_LENGTH + 1)));
    }
  }


  @Test
  public void testKeyedByStreamTable() throws Exception {
    final Object label = new Object() { };
    try (Connection con = newDatabaseWithCursors(label);
         var stdout = new SqlCursorStore(con, con, CURSORS, STREAM_TABLE, 0);
         var stderr = new SqlCursorStore(con, con, CURSORS, "stderr_stream", 0)) {

      stdout.advance("r", 4);
      assertEquals(Cursors.NONE, stderr.positionOf("r"));
      stderr.advance("r", 2);
      assertEquals(4, stdout.positionOf("r"));
      assertEquals(2, stderr.positionOf("r"));
    }
  }


  @Test
  public void testMissingCursorTable() throws Exception {
    final Object label = new Object() { };
    try (var port = SqlStoragePort.open(newStreamDatabase(label), LAYOUT)) {
      var tmx = assertThrows(TableMissingException.class, () -> port.newCursorStore(CURSORS));
      printExpected(label, tmx);
    }
  }


  @Test
  public void testCloseLeavesConnectionOpen() throws Exception {
    final Object label = new Object() { };
    try (Connection con = newDatabaseWithCursors(label)) {
      var cursors = new SqlCursorStore(con, con, CURSORS, STREAM_TABLE, 0);
      cursors.advance("r", 1);
      cursors.close();
      cursors.close();
      assertFalse(con.isClosed());
    }
  }

}
