/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.cli;


import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileWriter;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

/**
 * Runs the commands in-process against a file-backed h2 database.
 */
public class DbstreamTest {

  @TempDir
  File dir;

  private File config;

  private StringWriter out;
  private StringWriter err;


  @BeforeEach
  public void writeConfig() throws Exception {
    config = writeConfig("stream.properties", "rw");
  }


  private File writeConfig(String name, String mode) throws Exception {
    var file = new File(dir, name);
    try (var writer = new FileWriter(file)) {
      writer.write("""
          dbstream.jdbc.url=jdbc:h2:${dbstream.base.dir}/streams
          dbstream.table=stdout_stream
          dbstream.cursor.table=dbstream_cursors
          dbstream.pool.size=2
          dbstream.mode=%s
          """.formatted(mode));
    }
    return file;
  }


  private int run(Dbstream dbstream, String... args) {
    out = new StringWriter();
    err = new StringWriter();
    var cmd = new CommandLine(dbstream);
    cmd.setOut(new PrintWriter(out, true));
    cmd.setErr(new PrintWriter(err, true));
    return cmd.execute(args);
  }

  private int run(String... args) {
    return run(new Dbstream(), args);
  }

  private List<String> outLines() {
    return out.toString().lines().toList();
  }

  private String cfg() {
    return config.getPath();
  }


  @Test
  public void testCreateWriteRead() {
    assertEquals(0, run("-c", cfg(), "create"));
    assertTrue(out.toString().contains("stdout_stream"));
    assertTrue(out.toString().contains("dbstream_locks"));
    // idempotent
    assertEquals(0, run("-c", cfg(), "create"));

    assertEquals(0, run("-c", cfg(), "write", "alpha", "beta"));
    assertEquals(0, run("-c", cfg(), "read"));
    assertEquals(List.of("alpha", "beta"), outLines());

    assertEquals(0, run("-c", cfg(), "read"));
    assertTrue(outLines().isEmpty());

    assertEquals(0, run("-c", cfg(), "write", "gamma"));
    assertEquals(0, run("-c", cfg(), "read"));
    assertEquals(List.of("gamma"), outLines());

    assertEquals(0, run("-c", cfg(), "read", "-r", "other"));
    assertEquals(List.of("alpha", "beta", "gamma"), outLines());

    // --all neither uses nor moves a reader
    assertEquals(0, run("-c", cfg(), "read", "--all"));
    assertEquals(List.of("alpha", "beta", "gamma"), outLines());
    assertEquals(0, run("-c", cfg(), "read"));
    assertTrue(outLines().isEmpty());
  }


  @Test
  public void testWriteStdin() {
    assertEquals(0, run("-c", cfg(), "create"));
    var dbstream = new Dbstream();
    dbstream.stdin = new ByteArrayInputStream(
        "one\ntwo\r\nthree".getBytes(StandardCharsets.UTF_8));
    assertEquals(0, run(dbstream, "-c", cfg(), "write"));
    assertEquals(0, run("-c", cfg(), "read", "--all"));
    assertEquals(List.of("one", "two", "three"), outLines());
  }


  @Test
  public void testStatus() {
    assertEquals(0, run("-c", cfg(), "create"));
    assertEquals(0, run("-c", cfg(), "status"));
    assertTrue(out.toString().contains("last seq: -"), out.toString());
    assertTrue(out.toString().contains("pending: no"), out.toString());

    assertEquals(0, run("-c", cfg(), "write", "a", "b"));
    assertEquals(0, run("-c", cfg(), "status", "-r", "tail"));
    assertTrue(out.toString().contains("position: -"), out.toString());
    assertTrue(out.toString().contains("pending: yes"), out.toString());

    assertEquals(0, run("-c", cfg(), "read", "-r", "tail"));
    assertEquals(0, run("-c", cfg(), "status", "-r", "tail"));
    assertTrue(out.toString().contains("pending: no"), out.toString());
  }


  @Test
  public void testMissingTable() {
    assertEquals(Dbstream.ERR_NO_TABLE, run("-c", cfg(), "write", "lost"));
    assertTrue(err.toString().contains("ERROR"), err.toString());
    assertEquals(Dbstream.ERR_NO_TABLE, run("-c", cfg(), "read", "--all"));
  }


  @Test
  public void testBadConfig() throws Exception {
    assertEquals(
        CommandLine.ExitCode.USAGE,
        run("-c", new File(dir, "nope.properties").getPath(), "status"));

    var readOnly = writeConfig("read-only.properties", "r");
    assertEquals(0, run("-c", readOnly.getPath(), "create"));
    assertEquals(CommandLine.ExitCode.USAGE, run("-c", readOnly.getPath(), "write", "x"));
    assertTrue(err.toString().contains("read-only"), err.toString());
  }

}
