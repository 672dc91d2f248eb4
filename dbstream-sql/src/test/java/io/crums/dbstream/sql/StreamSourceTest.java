/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import io.crums.dbstream.Cursors;
import io.crums.dbstream.SessionMetadata;
import io.crums.dbstream.StreamMode;
import io.crums.dbstream.TableMissingException;

/**
 *
 */
public class StreamSourceTest extends BaseTestCase {

  private StreamConfig config(Object label, boolean storedCursors) {
    var props = new Properties();
    props.setProperty(StreamConfig.JDBC_URL, memUrl(label));
    props.setProperty(StreamConfig.TABLE, STREAM_TABLE);
    props.setProperty(StreamConfig.POOL_SIZE, "4");
    if (storedCursors)
      props.setProperty(StreamConfig.CURSOR_TABLE, StreamSchema.DEFAULT_CURSOR_TABLE);
    return StreamConfig.fromProperties(props);
  }


  @Test
  public void testConcurrentWriters() throws Exception {
    final Object label = new Object() { };
    final int writers = 4;
    final int linesPerWriter = 25;

    try (var source = new StreamSource(config(label, false))) {
      source.createTables();

      var executor = Executors.newFixedThreadPool(writers);
      try {
        var futures = new ArrayList<Future<List<Long>>>();
        for (int w = 0; w < writers; ++w) {
          final String name = "w" + w;
          Callable<List<Long>> task = () -> {
            var seqs = new ArrayList<Long>();
            try (var stream = source.open(
                StreamMode.WRITE, SessionMetadata.EMPTY.with("writer", name))) {
              for (int n = 0; n < linesPerWriter; ++n)
                seqs.add(stream.write(name + ":" + n));
            }
            return seqs;
          };
          futures.add(executor.submit(task));
        }

        var all = new HashSet<Long>();
        for (var future : futures) {
          List<Long> seqs = future.get();
          for (int i = 1; i < seqs.size(); ++i)
            assertTrue(seqs.get(i - 1) < seqs.get(i));
          all.addAll(seqs);
        }
        assertEquals(writers * linesPerWriter, all.size());

      } finally {
        executor.shutdown();
      }

      try (var stream = source.open(StreamMode.READ)) {
        var records = stream.readNewRecords(Cursors.DEFAULT_READER);
        assertEquals(writers * linesPerWriter, records.size());
        for (int i = 1; i < records.size(); ++i)
          assertTrue(records.get(i - 1).sequence() < records.get(i).sequence());
        // per-writer order preserved
        for (int w = 0; w < writers; ++w) {
          final String writer = "w" + w;
          var lines = records.stream()
              .filter(r -> r.metadata().get("writer").orElse("").equals(writer))
              .map(r -> r.payload())
              .toList();
          assertEquals(linesPerWriter, lines.size());
          for (int n = 0; n < linesPerWriter; ++n)
            assertEquals(writer + ":" + n, lines.get(n));
        }
      }
    }
  }


  @Test
  public void testMissingTableReleasesConnection() throws Exception {
    final Object label = new Object() { };
    try (var source = new StreamSource(config(label, false))) {
      // more attempts than pooled connections
      for (int i = 0; i < 6; ++i)
        assertThrows(TableMissingException.class, source::open);
      source.createTables();
      try (var stream = source.open()) {
        stream.write("hello");
        assertEquals(List.of("hello"), stream.readNew());
      }
    }
  }


  @Test
  public void testStoredCursors() throws Exception {
    final Object label = new Object() { };
    try (var source = new StreamSource(config(label, true))) {
      source.createTables();
      try (var stream = source.open()) {
        stream.write("one");
        stream.write("two");
        assertEquals(List.of("one", "two"), stream.readNew());
      }
      try (var stream = source.open()) {
        assertTrue(stream.readNew().isEmpty());
        stream.write("three");
        assertEquals(List.of("three"), stream.readNew());
      }
    }
  }


  @Test
  public void testClose() throws Exception {
    final Object label = new Object() { };
    var source = new StreamSource(config(label, false));
    assertTrue(source.isOpen());
    source.close();
    assertFalse(source.isOpen());
    source.close();
  }

}
