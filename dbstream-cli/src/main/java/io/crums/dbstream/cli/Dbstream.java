/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.cli;


import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.Callable;

import io.crums.dbstream.Cursors;
import io.crums.dbstream.LineWriter;
import io.crums.dbstream.ReadableStream;
import io.crums.dbstream.StreamException;
import io.crums.dbstream.StreamMode;
import io.crums.dbstream.TableMissingException;
import io.crums.dbstream.TableStream;
import io.crums.dbstream.sql.SqlStoragePort;
import io.crums.dbstream.sql.StreamConfig;
import io.crums.dbstream.sql.StreamSource;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command line tool for writing to and reading from table streams.
 */
@Command(
    name = "dbstream",
    mixinStandardHelpOptions = true,
    version = "dbstream 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "Writes text records to, and reads them back from, a database table.",
        "",
        "The table, its database, and its columns are set in a properties file",
        "(@|fg(yellow) -c|@ option). Readers are tracked by name; positions survive across",
        "invocations only if a cursor table (@|bold dbstream.cursor.table|@) is configured.",
        "",
        "@|bold Usage:|@",
        "",
        "  @|bold dbstream|@ @|fg(yellow) -c|@ CONFIG COMMAND",
        "  @|bold dbstream help|@ COMMAND",
        "  @|bold dbstream|@ [@|fg(yellow) -hV|@]",
        "",
        },
    subcommands = {
        HelpCommand.class,
        Create.class,
        Write.class,
        Read.class,
        Status.class,
    })
public class Dbstream {

  /** Exit code on a storage (database) error. */
  final static int ERR_STORAGE = 1;
  /** Exit code on a bad argument or configuration. */
  final static int ERR_CONFIG = 2;
  /** Exit code when the table does not exist. */
  final static int ERR_NO_TABLE = 3;


  public static void main(String[] args) {
    int exitCode = new CommandLine(new Dbstream()).execute(args);
    System.exit(exitCode);
  }


  @Spec
  private CommandSpec spec;

  private StreamConfig config;

  /** Lines to {@linkplain Write} with no arguments come from here. */
  InputStream stdin = System.in;


  @Option(
      names = { "-c", "--config" },
      paramLabel = "CONFIG",
      required = true,
      description = {
          "Properties file (see @|bold dbstream.*|@ keys)",
      })
  public void setConfig(File file) {
    try {
      this.config = StreamConfig.load(file);
    } catch (IllegalArgumentException iax) {
      throw new ParameterException(spec.commandLine(), iax.getMessage(), iax);
    }
  }


  public StreamConfig getConfig() {
    return config;
  }


  PrintWriter out() {
    return spec.commandLine().getOut();
  }

  PrintWriter err() {
    return spec.commandLine().getErr();
  }


  /**
   * Prints the error and returns the exit code for it.
   */
  int printError(StreamException error) {
    err().println(Ansi.AUTO.string("[@|fg(red),bold ERROR|@]: " + error.getMessage()));
    if (error instanceof TableMissingException) {
      err().println(Ansi.AUTO.string("Try @|fg(yellow) create|@ first."));
      return ERR_NO_TABLE;
    }
    return ERR_STORAGE;
  }

}


@Command(
    name = Create.NAME,
    description = {
        "Creates the stream table (and the cursor table, if configured)",
        "if not already created.",
    })
class Create implements Callable<Integer> {

  final static String NAME = "create";

  @ParentCommand
  private Dbstream dbstream;

  @Override
  public Integer call() {
    var config = dbstream.getConfig();
    try (var source = new StreamSource(config)) {
      source.createTables();
      dbstream.out().println("table " + config.layout().table() + " ready");
      dbstream.out().println("lock table " + config.lockTable() + " ready");
      config.cursorTable().ifPresent(
          t -> dbstream.out().println("cursor table " + t + " ready"));
      return 0;
    } catch (StreamException sx) {
      return dbstream.printError(sx);
    }
  }
}


@Command(
    name = Write.NAME,
    description = {
        "Writes each @|fg(yellow) TEXT|@ argument as a record. With no arguments, each line",
        "read from standard input is written as a record.",
    })
class Write implements Callable<Integer> {

  final static String NAME = "write";

  @ParentCommand
  private Dbstream dbstream;

  @Spec
  private CommandSpec spec;

  @Parameters(
      arity = "0..*",
      paramLabel = "TEXT",
      description = "Record text")
  private List<String> texts;


  @Override
  public Integer call() throws IOException {
    var config = dbstream.getConfig();
    if (!config.mode().writable())
      throw new ParameterException(
          spec.commandLine(), "configured mode is read-only: " + config.mode());

    try (var source = new StreamSource(config);
         var stream = source.open(StreamMode.WRITE)) {

      if (texts == null || texts.isEmpty()) {
        try (var writer = new LineWriter(stream, false)) {
          new InputStreamReader(dbstream.stdin, StandardCharsets.UTF_8).transferTo(writer);
        }
      } else {
        long seq = Cursors.NONE;
        for (var text : texts)
          seq = stream.write(text);
        dbstream.out().println(
            texts.size() + (texts.size() == 1 ? " record" : " records") +
            " written (last seq " + seq + ")");
      }
      return 0;

    } catch (StreamException sx) {
      return dbstream.printError(sx);
    }
  }
}


@Command(
    name = Read.NAME,
    description = {
        "Prints records new to the reader, one per line, and advances the reader.",
    })
class Read implements Callable<Integer> {

  final static String NAME = "read";

  @ParentCommand
  private Dbstream dbstream;

  @Option(
      names = { "-r", "--reader" },
      paramLabel = "READER",
      description = "Reader name (default: ${DEFAULT-VALUE})")
  private String reader = Cursors.DEFAULT_READER;

  @Option(
      names = "--all",
      description = "Prints all records; the reader's position is neither used nor advanced")
  private boolean all;


  @Override
  public Integer call() {
    var config = dbstream.getConfig();
    try {
      if (all) {
        try (var stream = TableStream.openReader(openPort(config))) {
          print(stream, Cursors.DEFAULT_READER);
        }
      } else {
        try (var source = new StreamSource(config);
             var stream = source.open(StreamMode.READ)) {
          print(stream, reader);
        }
      }
      return 0;
    } catch (StreamException sx) {
      return dbstream.printError(sx);
    }
  }


  /** Unpooled port; cursors are ephemeral when reading {@code --all}. */
  private SqlStoragePort openPort(StreamConfig config) {
    Connection con = config.openConnection();
    try {
      return new SqlStoragePort(con, config.layout(), config.storageOptions());
    } catch (StreamException sx) {
      try {
        con.close();
      } catch (SQLException closeError) {
        sx.addSuppressed(closeError);
      }
      throw sx;
    }
  }


  private void print(ReadableStream stream, String name) {
    var out = dbstream.out();
    for (var line : stream.readNew(name))
      out.println(line);
    out.flush();
  }
}


@Command(
    name = Status.NAME,
    description = {
        "Prints the table's last sequence number and the reader's position.",
    })
class Status implements Callable<Integer> {

  final static String NAME = "status";

  @ParentCommand
  private Dbstream dbstream;

  @Option(
      names = { "-r", "--reader" },
      paramLabel = "READER",
      description = "Reader name (default: ${DEFAULT-VALUE})")
  private String reader = Cursors.DEFAULT_READER;


  @Override
  public Integer call() {
    var config = dbstream.getConfig();
    try (var source = new StreamSource(config);
         var stream = source.open(StreamMode.READ)) {

      long last = stream.lastSequence();
      long position = stream.position(reader);
      var out = dbstream.out();
      out.println("   table: " + config.layout().table());
      out.println("last seq: " + (last == Cursors.NONE ? "-" : Long.toString(last)));
      out.println("  reader: " + reader + (config.cursorTable().isPresent() ? "" : " (not stored)"));
      out.println("position: " + (position == Cursors.NONE ? "-" : Long.toString(position)));
      out.println(" pending: " + (stream.hasNew(reader) ? "yes" : "no"));
      return 0;

    } catch (StreamException sx) {
      return dbstream.printError(sx);
    }
  }
}
