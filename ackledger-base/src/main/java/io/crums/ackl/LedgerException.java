/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


/**
 * Base exception in the <code>ackledger</code> modules.
 */
@SuppressWarnings("serial")
public class LedgerException extends RuntimeException {

  public LedgerException(String message) {
    super(message);
  }

  public LedgerException(Throwable cause) {
    super(cause);
  }

  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }

}
