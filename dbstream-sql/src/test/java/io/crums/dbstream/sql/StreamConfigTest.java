/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.FileWriter;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.dbstream.SessionMetadata;
import io.crums.dbstream.StreamMode;

/**
 *
 */
public class StreamConfigTest {

  @TempDir
  File dir;


  private static Properties minimal() {
    var props = new Properties();
    props.setProperty(StreamConfig.JDBC_URL, "jdbc:h2:mem:config");
    props.setProperty(StreamConfig.TABLE, "stdout_stream");
    return props;
  }


  @Test
  public void testDefaults() {
    var config = StreamConfig.fromProperties(minimal());
    assertEquals("jdbc:h2:mem:config", config.jdbcUrl());
    assertEquals("stdout_stream", config.layout().table());
    assertEquals("seq", config.layout().seqColumn());
    assertEquals("payload", config.layout().payloadColumn());
    assertEquals(Optional.of("meta"), config.layout().metaColumn());
    assertTrue(config.layout().keyColumns().isEmpty());
    assertEquals(StreamMode.READ_WRITE, config.mode());
    assertTrue(config.autoCommit());
    assertEquals(0, config.queryTimeout());
    assertTrue(config.cursorTable().isEmpty());
    assertEquals(StreamSchema.DEFAULT_LOCK_TABLE, config.lockTable());
    assertTrue(config.metadata().isEmpty());
    assertEquals(StreamConfig.DEFAULT_POOL_SIZE, config.poolSize());
    assertEquals(SqlStoragePort.Options.DEFAULT, config.storageOptions());
  }


  @Test
  public void testLoadFile() throws Exception {
    var file = new File(dir, "stream.properties");
    try (var out = new FileWriter(file)) {
      out.write("""
          dbstream.jdbc.url=jdbc:h2:${dbstream.base.dir}/streams
          dbstream.table=logs.stderr_stream
          dbstream.column.payload=content
          dbstream.column.meta=
          dbstream.column.keys=session_ts, hostname ,pid
          dbstream.mode=w
          dbstream.autocommit=false
          dbstream.query.timeout=30
          dbstream.cursor.table=logs.cursors
          dbstream.lock.table=logs.locks
          dbstream.meta.app=unit-test
          dbstream.pool.size=2
          """);
    }
    var config = StreamConfig.load(file);
    assertEquals("jdbc:h2:" + dir.getAbsolutePath() + "/streams", config.jdbcUrl());
    assertEquals("logs.stderr_stream", config.layout().table());
    assertEquals("content", config.layout().payloadColumn());
    assertTrue(config.layout().metaColumn().isEmpty());
    assertEquals(List.of("session_ts", "hostname", "pid"), config.layout().keyColumns());
    assertEquals(StreamMode.WRITE, config.mode());
    assertEquals(new SqlStoragePort.Options(false, 30, "logs.locks"), config.storageOptions());
    assertEquals(Optional.of("logs.cursors"), config.cursorTable());
    assertEquals(2, config.poolSize());

    SessionMetadata meta = config.sessionMetadata();
    assertEquals(Optional.of("unit-test"), meta.get("app"));
    assertTrue(meta.get(SessionMetadata.PID).isPresent());
    assertTrue(meta.get(SessionMetadata.HOSTNAME).isPresent());

    var hikari = config.toHikariConfig();
    assertEquals(config.jdbcUrl(), hikari.getJdbcUrl());
    assertEquals(2, hikari.getMaximumPoolSize());
    assertFalse(hikari.isAutoCommit());
  }


  @Test
  public void testConfiguredMetadataWins() {
    var props = minimal();
    props.setProperty(StreamConfig.META_PREFIX + SessionMetadata.HOSTNAME, "fixed");
    var meta = StreamConfig.fromProperties(props).sessionMetadata();
    assertEquals(Optional.of("fixed"), meta.get(SessionMetadata.HOSTNAME));
  }


  @Test
  public void testMissingFile() {
    assertThrows(
        IllegalArgumentException.class,
        () -> StreamConfig.load(new File(dir, "nope.properties")));
  }


  @Test
  public void testMalformed() {
    assertMalformed(StreamConfig.JDBC_URL, null);
    assertMalformed(StreamConfig.TABLE, "");
    assertMalformed(StreamConfig.TABLE, "bad table");
    assertMalformed(StreamConfig.MODE, "append");
    assertMalformed(StreamConfig.AUTOCOMMIT, "maybe");
    assertMalformed(StreamConfig.QUERY_TIMEOUT, "-1");
    assertMalformed(StreamConfig.QUERY_TIMEOUT, "soon");
    assertMalformed(StreamConfig.POOL_SIZE, "0");
    assertMalformed(StreamConfig.CURSOR_TABLE, "x;y");
    assertMalformed(StreamConfig.LOCK_TABLE, "locks--");
    assertMalformed(StreamConfig.JDBC_PASSWORD, "secret");

    var props = minimal();
    props.setProperty(StreamConfig.JDBC_URL, "jdbc:h2:" + StreamConfig.BASE_DIR_VAR + "/db");
    assertThrows(IllegalArgumentException.class, () -> StreamConfig.fromProperties(props));
  }


  private void assertMalformed(String key, String value) {
    var props = minimal();
    if (value == null)
      props.remove(key);
    else
      props.setProperty(key, value);
    var iax = assertThrows(IllegalArgumentException.class, () -> StreamConfig.fromProperties(props));
    if (!key.equals(StreamConfig.TABLE))
      assertTrue(iax.getMessage().contains(key), iax.getMessage());
  }


  @Test
  public void testToStringOmitsPassword() {
    var props = minimal();
    props.setProperty(StreamConfig.JDBC_USERNAME, "sa");
    props.setProperty(StreamConfig.JDBC_PASSWORD, "secret");
    var config = StreamConfig.fromProperties(props);
    assertEquals(Optional.of("secret"), config.password());
    assertFalse(config.toString().contains("secret"));
  }

}
