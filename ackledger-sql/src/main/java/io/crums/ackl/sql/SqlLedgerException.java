/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;

import java.sql.SQLException;

import io.crums.ackl.LedgerException;

/**
 * Usually wraps an {@linkplain SQLException}.
 */
@SuppressWarnings("serial")
public class SqlLedgerException extends LedgerException {

  public SqlLedgerException(String message) {
    super(message);
  }

  public SqlLedgerException(Throwable cause) {
    super(cause);
  }

  public SqlLedgerException(String message, Throwable cause) {
    super(message, cause);
  }

}
