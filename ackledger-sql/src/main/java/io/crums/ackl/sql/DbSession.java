/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import java.lang.System.Logger.Level;
import java.nio.channels.Channel;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import io.crums.ackl.LedgerConstants;
import io.crums.ackl.sql.config.DbConnection;
import io.crums.ackl.sql.config.LedgerConfig;

/**
 * A database connection, and the ledger stores bound to it. Closing the
 * session closes the connection (and so, its stores).
 */
public class DbSession implements Channel {

  /**
   * Opens a read/write session.
   */
  public static DbSession newInstance(DbConnection dbConn)
      throws SqlLedgerException {
    return newInstance(dbConn, false);
  }

  /**
   * Opens a session using the configured connection.
   */
  public static DbSession newInstance(LedgerConfig config, boolean readOnly)
      throws SqlLedgerException {
    return newInstance(config.getDbConnection(), readOnly);
  }


  /**
   * Opens a session.
   *
   * @param dbConn    connection parameters
   * @param readOnly  if {@code true}, the connection is marked read-only
   */
  public static DbSession newInstance(DbConnection dbConn, boolean readOnly)
      throws SqlLedgerException {

    if (dbConn.driverClass().isPresent()) {
      String driver = dbConn.driverClass().get();
      try {
        Class.forName(driver);
      } catch (ClassNotFoundException cnfx) {
        throw new SqlLedgerException(
            "Driver class %s not found".formatted(driver), cnfx);
      }
    }

    try {

      String url = dbConn.url();
      Connection con;
      if (dbConn.creds().isPresent()) {
        var creds = dbConn.creds().get();
        con = DriverManager.getConnection(
            url, creds.username(), creds.password());
      } else
        con = DriverManager.getConnection(url);

      if (readOnly)
        con.setReadOnly(true);

      return new DbSession(con, readOnly);


    } catch (SQLException sx) {
      throw new SqlLedgerException(
          "failed to connect to %s: %s".formatted(dbConn.url(), sx), sx);
    }
  }

  protected final Connection connection;
  private final boolean readOnly;


  /**
   * @param connection  open connection
   * @param readOnly    if {@code true}, no tables are created thru this session
   *                    (drivers may treat the connection's own read-only flag
   *                    as a mere hint)
   */
  protected DbSession(Connection connection, boolean readOnly) throws SQLException {
    this.connection = connection;
    this.readOnly = readOnly;
    if (connection.isClosed())
      throw new IllegalArgumentException(
          "database connection closed: " + connection);
  }


  /** Returns {@code true} iff this session was opened read-only. */
  public boolean isReadOnly() {
    return readOnly;
  }


  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException sx) {
      LedgerConstants.getLogger().log(
          Level.WARNING,
          "ignoring error on closing database connection ({0}): {1}",
          connection, sx);
    }
  }

  @Override
  public boolean isOpen() throws SqlLedgerException {
    try {
      return !connection.isClosed();
    } catch (SQLException sx) {
      throw new SqlLedgerException(sx);
    }
  }


  /**
   * Creates the ledger table (and trigger) and returns the store bound
   * to this session.
   *
   * @throws SqlLedgerException
   *         if the session is read-only, or the table could not be created
   *         (e.g. it already exists)
   */
  public SqlLedgerStore declareLedger(LedgerSchema schema) throws SqlLedgerException {
    if (isReadOnly())
      throw new SqlLedgerException("read-only session cannot create " + schema);
    return SqlLedgerStore.declareNewInstance(connection, schema);
  }


  /**
   * Returns the store backed by the existing ledger table, bound to this
   * session.
   *
   * @throws SqlLedgerException
   *         if the table does not exist (or is not as expected)
   */
  public SqlLedgerStore openLedger(LedgerSchema schema) throws SqlLedgerException {
    return new SqlLedgerStore(schema, connection);
  }

}
