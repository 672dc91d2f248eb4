/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Encodes records into {@linkplain RawRow}s and decodes them back, per a
 * {@linkplain TableLayout}. Stateless; safe to share.
 */
public class RecordCodec {

  private final TableLayout layout;


  public RecordCodec(TableLayout layout) {
    this.layout = Objects.requireNonNull(layout, "null layout");
  }


  public TableLayout layout() {
    return layout;
  }


  /**
   * Encodes a row for insertion. The returned row has the layout's
   * {@linkplain TableLayout#insertColumns() insert columns}; the sequence
   * column is left to storage.
   *
   * @param payload   not {@code null}
   * @param metadata  not {@code null}
   *
   * @throws EncodingException
   *         if the payload, or a metadata key or value, is not well-formed
   *         text (unpaired surrogates, NUL chars); or if a metadata key maps
   *         to no column
   */
  public RawRow encode(String payload, SessionMetadata metadata)
      throws EncodingException {

    Objects.requireNonNull(payload, "null payload");
    checkText(payload, "payload");

    var remaining = new TreeMap<String, String>();
    for (var e : metadata.entries().entrySet()) {
      checkText(e.getKey(), "metadata key");
      checkText(e.getValue(), "metadata value for '" + e.getKey() + "'");
      remaining.put(e.getKey(), e.getValue());
    }

    var row = new LinkedHashMap<String, Object>();
    row.put(layout.payloadColumn(), payload);

    var keyValues = new LinkedHashMap<String, Object>();
    for (var key : layout.keyColumns())
      keyValues.put(key, remaining.remove(key));

    if (layout.metaColumn().isPresent())
      row.put(layout.metaColumn().get(), JSONObject.toJSONString(remaining));
    else if (!remaining.isEmpty())
      throw new EncodingException(
          "no column for metadata keys " + remaining.keySet() + " in table " + layout.table());

    row.putAll(keyValues);
    return new RawRow(row);
  }


  private final static ThreadLocal<CharsetEncoder> UTF8 =
      ThreadLocal.withInitial(StandardCharsets.UTF_8::newEncoder);


  private static void checkText(String text, String what) throws EncodingException {
    if (text.indexOf('\0') != -1)
      throw new EncodingException(what + " contains NUL char");
    if (!UTF8.get().canEncode(text))
      throw new EncodingException(what + " is not well-formed text (unpaired surrogate?)");
  }


  /**
   * Decodes the given backend row.
   *
   * @throws CorruptRecordException
   *         if a required column is missing, the sequence is not a non-negative
   *         integer, the payload is not text, or the metadata does not parse
   */
  public StreamRecord decode(RawRow row) throws CorruptRecordException {

    final long seq = decodeSequence(row);

    String seqCol = layout.seqColumn();
    String payloadCol = layout.payloadColumn();
    if (!row.has(payloadCol))
      throw new CorruptRecordException(
          "[" + seqCol + "=" + seq + "]: missing payload column '" + payloadCol + "': " + row);
    Object payload = row.get(payloadCol).orElseThrow(
        () -> new CorruptRecordException(
            "[" + seqCol + "=" + seq + "]: null payload: " + row));
    if (!(payload instanceof CharSequence))
      throw new CorruptRecordException(
          "[" + seqCol + "=" + seq + "]: payload is not text (" +
          payload.getClass().getName() + "): " + row);

    var meta = new TreeMap<String, String>();

    if (layout.metaColumn().isPresent()) {
      String metaCol = layout.metaColumn().get();
      if (!row.has(metaCol))
        throw new CorruptRecordException(
            "[" + seqCol + "=" + seq + "]: missing meta column '" + metaCol + "': " + row);
      var json = row.get(metaCol);
      if (json.isPresent())
        meta.putAll(parseMeta(seq, json.get()));
    }

    for (var key : layout.keyColumns()) {
      if (!row.has(key))
        throw new CorruptRecordException(
            "[" + seqCol + "=" + seq + "]: missing metadata column '" + key + "': " + row);
      row.get(key).ifPresent(value -> meta.put(key, value.toString()));
    }

    return new StreamRecord(seq, payload.toString(), new SessionMetadata(meta));
  }


  /**
   * Decodes just the sequence number.
   *
   * @throws CorruptRecordException
   *         if missing or not a non-negative integer
   */
  public long decodeSequence(RawRow row) throws CorruptRecordException {
    String seqCol = layout.seqColumn();
    Object value = row.get(seqCol).orElseThrow(
        () -> new CorruptRecordException("missing sequence column '" + seqCol + "': " + row));

    long seq;
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
      seq = ((Number) value).longValue();
    else if (value instanceof BigInteger big) {
      if (big.bitLength() > 63)
        throw new CorruptRecordException("sequence out of range: " + row);
      seq = big.longValue();
    } else if (value instanceof BigDecimal dec) {
      try {
        seq = dec.longValueExact();
      } catch (ArithmeticException ax) {
        throw new CorruptRecordException("sequence not an integer: " + row, ax);
      }
    } else if (value instanceof CharSequence chars) {
      try {
        seq = Long.parseLong(chars.toString().trim());
      } catch (NumberFormatException nfx) {
        throw new CorruptRecordException("sequence not an integer: " + row, nfx);
      }
    } else
      throw new CorruptRecordException(
          "sequence not an integer (" + value.getClass().getName() + "): " + row);

    if (seq < 0)
      throw new CorruptRecordException("negative sequence: " + row);
    return seq;
  }


  private Map<String, String> parseMeta(long seq, Object json) throws CorruptRecordException {
    String metaCol = layout.metaColumn().get();
    Object parsed;
    try {
      parsed = new JSONParser().parse(json.toString());
    } catch (ParseException px) {
      throw new CorruptRecordException(
          "[" + layout.seqColumn() + "=" + seq + "]: malformed JSON in '" + metaCol + "': " + json, px);
    }
    if (!(parsed instanceof JSONObject jObj))
      throw new CorruptRecordException(
          "[" + layout.seqColumn() + "=" + seq + "]: '" + metaCol + "' is not a JSON object: " + json);

    var meta = new TreeMap<String, String>();
    for (Object entry : jObj.entrySet()) {
      var e = (Map.Entry<?, ?>) entry;
      if (!(e.getValue() instanceof String value))
        throw new CorruptRecordException(
            "[" + layout.seqColumn() + "=" + seq + "]: non-string metadata value for '" +
            e.getKey() + "': " + json);
      meta.put(e.getKey().toString(), value);
    }
    return meta;
  }

}
