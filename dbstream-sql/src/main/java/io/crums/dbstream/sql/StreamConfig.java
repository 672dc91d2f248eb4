/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.dbstream.sql;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

import com.zaxxer.hikari.HikariConfig;

import io.crums.dbstream.SessionMetadata;
import io.crums.dbstream.StorageUnavailableException;
import io.crums.dbstream.StreamMode;
import io.crums.dbstream.TableLayout;

/**
 * Stream configuration, usually loaded from a properties file.
 *
 * <h2>Properties</h2>
 * <p>
 * Every property is prefixed with {@value #ROOT}. Only the JDBC URL and the
 * table name are required.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * When loaded from a file, occurrences of {@value #BASE_DIR_VAR} in the JDBC
 * URL are replaced with the absolute path of the file's parent directory.
 * E.g. {@code jdbc:h2:${dbstream.base.dir}/streams}.
 * </p>
 *
 * @param jdbcUrl       JDBC URL
 * @param driverClass   optional JDBC driver class name
 * @param username      optional database user
 * @param password      optional database password
 * @param layout        table layout
 * @param mode          stream mode
 * @param autoCommit    JDBC auto-commit setting
 * @param queryTimeout  per-statement timeout (seconds); 0 for none
 * @param cursorTable   if present, cursors are stored in this table
 * @param lockTable     appends serialize on this table
 *                      (defaults to {@value StreamSchema#DEFAULT_LOCK_TABLE})
 * @param metadata      extra session metadata written with every record
 * @param poolSize      max pooled connections (see {@linkplain StreamSource})
 */
public record StreamConfig(
    String jdbcUrl,
    Optional<String> driverClass,
    Optional<String> username,
    Optional<String> password,
    TableLayout layout,
    StreamMode mode,
    boolean autoCommit,
    int queryTimeout,
    Optional<String> cursorTable,
    String lockTable,
    SessionMetadata metadata,
    int poolSize) {


  /** Every property name begins with this prefix. */
  public final static String ROOT = "dbstream.";

  /**
   * Set to the configuration file's parent directory on load.
   * Not meant to be set in the file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /** Placeholder for {@linkplain #BASE_DIR} in the JDBC URL. */
  public final static String BASE_DIR_VAR = "${" + BASE_DIR + "}";

  public final static String JDBC_URL = ROOT + "jdbc.url";
  public final static String JDBC_DRIVER = ROOT + "jdbc.driver";
  public final static String JDBC_USERNAME = ROOT + "jdbc.username";
  public final static String JDBC_PASSWORD = ROOT + "jdbc.password";

  public final static String TABLE = ROOT + "table";
  public final static String COLUMN_SEQ = ROOT + "column.seq";
  public final static String COLUMN_PAYLOAD = ROOT + "column.payload";
  /** If set to the empty string, the table has no meta column. */
  public final static String COLUMN_META = ROOT + "column.meta";
  /** Comma-separated list of key columns. */
  public final static String COLUMN_KEYS = ROOT + "column.keys";

  public final static String MODE = ROOT + "mode";
  public final static String AUTOCOMMIT = ROOT + "autocommit";
  public final static String QUERY_TIMEOUT = ROOT + "query.timeout";
  public final static String CURSOR_TABLE = ROOT + "cursor.table";
  public final static String LOCK_TABLE = ROOT + "lock.table";
  public final static String POOL_SIZE = ROOT + "pool.size";

  /** Prefix of session metadata entries: {@code dbstream.meta.<key>=<value>}. */
  public final static String META_PREFIX = ROOT + "meta.";

  public final static int DEFAULT_POOL_SIZE = 4;

  /** Properties known to this class (sans {@linkplain #META_PREFIX}'ed ones). */
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      JDBC_URL, JDBC_DRIVER, JDBC_USERNAME, JDBC_PASSWORD,
      TABLE, COLUMN_SEQ, COLUMN_PAYLOAD, COLUMN_META, COLUMN_KEYS,
      MODE, AUTOCOMMIT, QUERY_TIMEOUT, CURSOR_TABLE, LOCK_TABLE, POOL_SIZE);



  /**
   * Loads an instance from the given properties file.
   *
   * @throws IllegalArgumentException
   *         if the file cannot be read or any property is malformed
   */
  public static StreamConfig load(File propertiesFile) throws IllegalArgumentException {
    return fromProperties(loadProperties(propertiesFile));
  }


  private static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getAbsolutePath());
    return props;
  }


  /**
   * Parses an instance from the given properties.
   *
   * @throws IllegalArgumentException
   *         if a required property is missing or any property is malformed
   */
  public static StreamConfig fromProperties(Properties props) throws IllegalArgumentException {

    String url = required(props, JDBC_URL);
    String baseDir = props.getProperty(BASE_DIR);
    if (baseDir != null)
      url = url.replace(BASE_DIR_VAR, baseDir);
    else if (url.contains(BASE_DIR_VAR))
      throw new IllegalArgumentException(
          BASE_DIR_VAR + " used in " + JDBC_URL + " but not loaded from file");

    var username = optional(props, JDBC_USERNAME);
    var password = optional(props, JDBC_PASSWORD);
    if (password.isPresent() && username.isEmpty())
      throw new IllegalArgumentException(JDBC_PASSWORD + " set without " + JDBC_USERNAME);

    TableLayout layout;
    try {
      String meta = props.getProperty(COLUMN_META, TableLayout.DEFAULT_META).trim();
      layout = new TableLayout(
          required(props, TABLE),
          props.getProperty(COLUMN_SEQ, TableLayout.DEFAULT_SEQ).trim(),
          props.getProperty(COLUMN_PAYLOAD, TableLayout.DEFAULT_PAYLOAD).trim(),
          meta.isEmpty() ? Optional.empty() : Optional.of(meta),
          parseList(props.getProperty(COLUMN_KEYS, "")));
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException("table layout: " + iax.getMessage(), iax);
    }

    StreamMode mode;
    try {
      mode = StreamMode.parse(props.getProperty(MODE, "rw"));
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(MODE + ": " + iax.getMessage(), iax);
    }

    var cursorTable = optional(props, CURSOR_TABLE);
    try {
      cursorTable.ifPresent(TableLayout::checkTableName);
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(CURSOR_TABLE + ": " + iax.getMessage(), iax);
    }

    String lockTable = optional(props, LOCK_TABLE).orElse(StreamSchema.DEFAULT_LOCK_TABLE);
    try {
      TableLayout.checkTableName(lockTable);
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(LOCK_TABLE + ": " + iax.getMessage(), iax);
    }

    var meta = new TreeMap<String, String>();
    for (var name : props.stringPropertyNames()) {
      if (!name.startsWith(META_PREFIX))
        continue;
      String key = name.substring(META_PREFIX.length());
      if (key.isBlank())
        throw new IllegalArgumentException("empty metadata key: " + name);
      meta.put(key, props.getProperty(name));
    }

    return new StreamConfig(
        url,
        optional(props, JDBC_DRIVER),
        username,
        password,
        layout,
        mode,
        parseBoolean(props, AUTOCOMMIT, true),
        parseInt(props, QUERY_TIMEOUT, 0, 0),
        cursorTable,
        lockTable,
        new SessionMetadata(meta),
        parseInt(props, POOL_SIZE, DEFAULT_POOL_SIZE, 1));
  }


  private static String required(Properties props, String name) {
    var value = optional(props, name);
    if (value.isEmpty())
      throw new IllegalArgumentException("missing required property " + name);
    return value.get();
  }

  private static Optional<String> optional(Properties props, String name) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return Optional.empty();
    return Optional.of(value.trim());
  }

  private static List<String> parseList(String value) {
    var list = new ArrayList<String>();
    for (var token : value.split(",")) {
      token = token.trim();
      if (!token.isEmpty())
        list.add(token);
    }
    return list;
  }

  private static boolean parseBoolean(Properties props, String name, boolean defaultValue) {
    var value = optional(props, name);
    if (value.isEmpty())
      return defaultValue;
    switch (value.get().toLowerCase()) {
    case "true":
    case "yes":
      return true;
    case "false":
    case "no":
      return false;
    default:
      throw new IllegalArgumentException(name + ": not a boolean: '" + value.get() + "'");
    }
  }

  private static int parseInt(Properties props, String name, int defaultValue, int min) {
    var value = optional(props, name);
    if (value.isEmpty())
      return defaultValue;
    int n;
    try {
      n = Integer.parseInt(value.get());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + ": not a number: '" + value.get() + "'");
    }
    if (n < min)
      throw new IllegalArgumentException(name + ": " + n + " < " + min);
    return n;
  }




  public StreamConfig {
    Objects.requireNonNull(jdbcUrl, "null jdbcUrl");
    Objects.requireNonNull(driverClass, "null driverClass");
    Objects.requireNonNull(username, "null username");
    Objects.requireNonNull(password, "null password");
    Objects.requireNonNull(layout, "null layout");
    Objects.requireNonNull(mode, "null mode");
    Objects.requireNonNull(cursorTable, "null cursorTable");
    TableLayout.checkTableName(lockTable);
    Objects.requireNonNull(metadata, "null metadata");
    if (queryTimeout < 0)
      throw new IllegalArgumentException("queryTimeout " + queryTimeout);
    if (poolSize < 1)
      throw new IllegalArgumentException("poolSize " + poolSize);
  }


  /**
   * Returns the configured session metadata together with the current
   * process's ({@linkplain SessionMetadata#forCurrentProcess()}). Configured
   * entries take precedence.
   */
  public SessionMetadata sessionMetadata() {
    return SessionMetadata.forCurrentProcess().withAll(metadata.entries());
  }


  /** Returns the storage port options. */
  public SqlStoragePort.Options storageOptions() {
    return new SqlStoragePort.Options(autoCommit, queryTimeout, lockTable);
  }


  /**
   * Opens a new (unpooled) connection.
   *
   * @throws StorageUnavailableException if the connection fails
   * @throws IllegalArgumentException if the driver class is not found
   */
  public Connection openConnection() throws StorageUnavailableException {
    loadDriver();
    try {
      return username.isPresent() ?
          DriverManager.getConnection(jdbcUrl, username.get(), password.orElse(null)) :
          DriverManager.getConnection(jdbcUrl);
    } catch (SQLException sx) {
      throw new StorageUnavailableException(
          "failed to connect to " + jdbcUrl + ": " + sx.getMessage(), sx);
    }
  }


  private void loadDriver() {
    if (driverClass.isEmpty())
      return;
    try {
      Class.forName(driverClass.get());
    } catch (ClassNotFoundException cnfx) {
      throw new IllegalArgumentException(
          JDBC_DRIVER + ": class not found: " + driverClass.get(), cnfx);
    }
  }


  /** Returns a HikariCP configuration for a connection pool. */
  public HikariConfig toHikariConfig() {
    var config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    driverClass.ifPresent(config::setDriverClassName);
    username.ifPresent(config::setUsername);
    password.ifPresent(config::setPassword);
    config.setAutoCommit(autoCommit);
    config.setMaximumPoolSize(poolSize);
    config.setMinimumIdle(0);
    config.setPoolName("dbstream-" + layout.table());
    return config;
  }


  /** Returns this instance's properties (the password omitted). */
  @Override
  public String toString() {
    return
        "StreamConfig[" + jdbcUrl + ", table=" + layout.table() + ", mode=" + mode +
        ", autoCommit=" + autoCommit + ", cursorTable=" + cursorTable.orElse("-") + "]";
  }

}
