/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


/**
 * Signing key material is missing, malformed, or inconsistent. Fatal at
 * startup for any process that must append records.
 */
@SuppressWarnings("serial")
public class InvalidKeyMaterialException extends LedgerException {

  public InvalidKeyMaterialException(String message) {
    super(message);
  }

  public InvalidKeyMaterialException(String message, Throwable cause) {
    super(message, cause);
  }

}
