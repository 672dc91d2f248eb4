/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class RecordCodecTest {

  private final RecordCodec codec = new RecordCodec(TableLayout.defaultLayout("stdout_stream"));


  private static RawRow row(Object... kvs) {
    var map = new HashMap<String, Object>();
    for (int index = 0; index < kvs.length; index += 2)
      map.put((String) kvs[index], kvs[index + 1]);
    return new RawRow(map);
  }


  @Test
  public void testEncodeDefaultLayout() {
    var meta = new SessionMetadata(Map.of("pid", "7", "hostname", "box"));
    RawRow row = codec.encode("hello\n", meta);
    assertEquals(List.of("payload", "meta"), List.copyOf(row.columns().keySet()));
    assertEquals(Optional.of("hello\n"), row.get("payload"));
    // keys sorted: deterministic
    assertEquals(Optional.of("{\"hostname\":\"box\",\"pid\":\"7\"}"), row.get("meta"));
    assertEquals(row, codec.encode("hello\n", meta));
  }


  @Test
  public void testDecodeFoldsColumnCase() {
    // as H2 reports them
    var record = codec.decode(row("SEQ", 12L, "PAYLOAD", "x", "META", "{\"a\":\"b\"}"));
    assertEquals(12L, record.sequence());
    assertEquals("x", record.payload());
    assertEquals(Optional.of("b"), record.metadata().get("a"));
  }


  @Test
  public void testDecodeNumericTypes() {
    assertEquals(3L, codec.decode(row("seq", 3, "payload", "", "meta", null)).sequence());
    assertEquals(4L, codec.decode(row("seq", new BigDecimal("4"), "payload", "", "meta", null)).sequence());
    assertEquals(5L, codec.decode(row("seq", "5", "payload", "", "meta", null)).sequence());
    assertTrue(codec.decode(row("seq", 0L, "payload", "", "meta", null)).metadata().isEmpty());
  }


  @Test
  public void testKeyColumns() {
    var layout = TableLayout.defaultLayout("stdout_stream")
        .metaColumn(Optional.empty())
        .keyColumns(List.of("session_ts", "hostname", "pid"));
    var keyCodec = new RecordCodec(layout);

    var meta = SessionMetadata.forCurrentProcess();
    RawRow row = keyCodec.encode("line", meta);
    assertEquals(List.of("payload", "session_ts", "hostname", "pid"), List.copyOf(row.columns().keySet()));

    var stored = new HashMap<String, Object>(row.columns());
    stored.put("seq", 1L);
    var record = keyCodec.decode(new RawRow(stored));
    assertEquals(meta, record.metadata());

    // a NULL key column means the key is absent (rows inserted by others)
    stored.put("hostname", null);
    assertTrue(keyCodec.decode(new RawRow(stored)).metadata().get("hostname").isEmpty());

    // no place for an extra key
    var extra = meta.with("tag", "x");
    assertThrows(EncodingException.class, () -> keyCodec.encode("line", extra));
  }


  @Test
  public void testEncodingErrors() {
    var meta = SessionMetadata.EMPTY;
    assertThrows(EncodingException.class, () -> codec.encode("nul\0char", meta));
    assertThrows(EncodingException.class, () -> codec.encode("lone \uDC00", meta));
    assertThrows(
        EncodingException.class,
        () -> codec.encode("ok", new SessionMetadata(Map.of("k", "\uD800"))));
    // a proper surrogate pair is fine
    assertEquals(Optional.of("😀"), codec.encode("😀", meta).get("payload"));
  }


  @Test
  public void testCorruptRows() {
    assertCorrupt(row("payload", "x", "meta", null));
    assertCorrupt(row("seq", null, "payload", "x", "meta", null));
    assertCorrupt(row("seq", -1L, "payload", "x", "meta", null));
    assertCorrupt(row("seq", "one", "payload", "x", "meta", null));
    assertCorrupt(row("seq", new BigDecimal("1.5"), "payload", "x", "meta", null));
    assertCorrupt(row("seq", 1.0d, "payload", "x", "meta", null));
    assertCorrupt(row("seq", 1L, "meta", null));
    assertCorrupt(row("seq", 1L, "payload", null, "meta", null));
    assertCorrupt(row("seq", 1L, "payload", new byte[] { 1 }, "meta", null));
    assertCorrupt(row("seq", 1L, "payload", "x"));
    assertCorrupt(row("seq", 1L, "payload", "x", "meta", "[1, 2]"));
    assertCorrupt(row("seq", 1L, "payload", "x", "meta", "{\"n\": 3}"));
    assertCorrupt(row("seq", 1L, "payload", "x", "meta", "{oops"));
  }


  private void assertCorrupt(RawRow row) {
    var cx = assertThrows(CorruptRecordException.class, () -> codec.decode(row));
    assertNotNull(cx.getMessage());
  }


  @Test
  public void testLayoutRejectsInjection() {
    assertThrows(IllegalArgumentException.class, () -> TableLayout.defaultLayout("t; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableLayout.defaultLayout(""));
    assertThrows(
        IllegalArgumentException.class,
        () -> TableLayout.defaultLayout("t").keyColumns(List.of("payload")));
    assertEquals("t", TableLayout.defaultLayout("app.t").simpleTableName());
    assertEquals(Optional.of("app"), TableLayout.defaultLayout("app.t").schema());
  }

}
