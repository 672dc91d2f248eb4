/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;

import io.crums.dbstream.CursorStore;
import io.crums.dbstream.InMemoryCursorStore;
import io.crums.dbstream.SessionMetadata;
import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.StreamException;
import io.crums.dbstream.StreamMode;
import io.crums.dbstream.TableMissingException;
import io.crums.dbstream.TableStream;

/**
 * Pooled source of {@linkplain TableStream}s on the configured table. Each
 * stream opened is bound to its own connection from a HikariCP pool, so
 * streams from the same source may be used concurrently (e.g. one per
 * writer thread). Closing a stream returns its connection to the pool;
 * closing this instance closes the pool.
 */
public class StreamSource implements AutoCloseable {

  private final StreamConfig config;
  private final HikariDataSource dataSource;


  /**
   * Creates a new instance with its own connection pool.
   *
   * @throws StorageUnavailableException
   *         if the pool fails to initialize
   */
  public StreamSource(StreamConfig config) throws StorageUnavailableException {
    this.config = Objects.requireNonNull(config, "null config");
    try {
      this.dataSource = new HikariDataSource(config.toHikariConfig());
    } catch (RuntimeException rx) {
      throw new StorageUnavailableException(
          "failed to initialize connection pool for " + config.jdbcUrl() + ": " + rx.getMessage(),
          rx);
    }
    SqlConstants.getLogger().log(Level.INFO, "opened stream source: {0}", config);
  }


  /** Returns the configuration. */
  public StreamConfig config() {
    return config;
  }


  /**
   * Creates the stream table, its lock table (and cursor table, if
   * configured), if they don't already exist.
   */
  public void createTables() throws StorageUnavailableException {
    try (Connection con = getConnection()) {
      StreamSchema.createTable(con, config.layout(), config.lockTable());
      if (config.cursorTable().isPresent())
        StreamSchema.createCursorTable(con, config.cursorTable().get());
    } catch (SQLException sx) {
      throw new StorageUnavailableException("on releasing connection: " + sx.getMessage(), sx);
    }
  }


  /** Opens a stream in the configured mode and session metadata. */
  public TableStream open() throws TableMissingException, StreamException {
    return open(config.mode());
  }

  /** Opens a stream in the given mode, using the configured session metadata. */
  public TableStream open(StreamMode mode) throws TableMissingException, StreamException {
    return open(mode, config.sessionMetadata());
  }


  /**
   * Opens a stream on a pooled connection.
   *
   * @param mode      read, write, or both
   * @param metadata  attached to every record written
   *
   * @throws TableMissingException
   *         if the stream table (or configured cursor table) does not exist
   * @throws StorageUnavailableException
   *         if no connection could be had
   */
  public TableStream open(StreamMode mode, SessionMetadata metadata)
      throws TableMissingException, StreamException {

    Objects.requireNonNull(mode, "null mode");
    Objects.requireNonNull(metadata, "null metadata");

    Connection con = getConnection();
    SqlStoragePort port;
    try {
      port = new SqlStoragePort(con, config.layout(), config.storageOptions());
    } catch (RuntimeException rx) {
      closeOnFail(con, rx);
      throw rx;
    }

    CursorStore cursors;
    try {
      cursors = config.cursorTable().isPresent() ?
          port.newCursorStore(config.cursorTable().get()) :
          new InMemoryCursorStore();
    } catch (RuntimeException rx) {
      try {
        port.close();
      } catch (StreamException sx) {
        rx.addSuppressed(sx);
      }
      throw rx;
    }
    return new TableStream(port, mode, metadata, cursors);
  }


  private Connection getConnection() throws StorageUnavailableException {
    try {
      return dataSource.getConnection();
    } catch (SQLException sx) {
      throw new StorageUnavailableException(
          "failed to get connection from pool: " + sx.getMessage(), sx);
    }
  }


  private static void closeOnFail(Connection con, RuntimeException primary) {
    try {
      con.close();
    } catch (SQLException sx) {
      primary.addSuppressed(sx);
    }
  }


  /** Returns {@code true} until {@linkplain #close()} is invoked. */
  public boolean isOpen() {
    return !dataSource.isClosed();
  }


  /** Closes the connection pool. Idempotent. */
  @Override
  public void close() {
    if (dataSource.isClosed())
      return;
    dataSource.close();
    SqlConstants.getLogger().log(Level.INFO, "closed stream source: {0}", config);
  }

}
