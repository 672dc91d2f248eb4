/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream;


import java.lang.System.Logger.Level;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable key/value context attached to every record a stream writes.
 * Keys and values are non-null strings; iteration is in key order.
 *
 * @see #forCurrentProcess()
 */
public record SessionMetadata(Map<String, String> entries) {

  /** Session timestamp (ISO-8601 instant) key. */
  public final static String SESSION_TS = "session_ts";
  /** Host name key. */
  public final static String HOSTNAME = "hostname";
  /** Process ID key. */
  public final static String PID = "pid";

  /** No entries. */
  public final static SessionMetadata EMPTY = new SessionMetadata(Map.of());


  /**
   * Returns a new instance tagged with this process's session info:
   * {@value #SESSION_TS} (now), {@value #HOSTNAME}, and {@value #PID}.
   */
  public static SessionMetadata forCurrentProcess() {
    var entries = new TreeMap<String, String>();
    entries.put(SESSION_TS, Instant.now().toString());
    entries.put(HOSTNAME, hostname());
    entries.put(PID, Long.toString(ProcessHandle.current().pid()));
    return new SessionMetadata(entries);
  }


  private static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException uhx) {
      DbStreamConstants.getLogger().log(
          Level.WARNING,
          "local host name not resolved (using 'localhost'): " + uhx);
      return "localhost";
    }
  }


  public SessionMetadata {
    Objects.requireNonNull(entries, "null entries");
    var sorted = new TreeMap<String, String>();
    for (var e : entries.entrySet()) {
      String key = Objects.requireNonNull(e.getKey(), "null key");
      if (key.isBlank())
        throw new IllegalArgumentException("blank metadata key");
      sorted.put(key, Objects.requireNonNull(e.getValue(), "null value for key " + key));
    }
    entries = Collections.unmodifiableMap(sorted);
  }


  /**
   * Returns a new instance with the given entry added (or replaced).
   */
  public SessionMetadata with(String key, String value) {
    var copy = new TreeMap<>(entries);
    copy.put(key, value);
    return new SessionMetadata(copy);
  }

  /**
   * Returns a new instance with the given entries added (or replaced).
   */
  public SessionMetadata withAll(Map<String, String> more) {
    if (more.isEmpty())
      return this;
    var copy = new TreeMap<>(entries);
    copy.putAll(more);
    return new SessionMetadata(copy);
  }


  public Optional<String> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

}
