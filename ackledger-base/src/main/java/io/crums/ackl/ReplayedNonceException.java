/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


/**
 * Thrown when a caller-supplied nonce is already recorded in the ledger.
 */
@SuppressWarnings("serial")
public class ReplayedNonceException extends LedgerException {
  
  private final String nonce;

  public ReplayedNonceException(String nonce) {
    this(nonce, null);
  }

  public ReplayedNonceException(String nonce, Throwable cause) {
    super("nonce already used: " + nonce, cause);
    this.nonce = nonce;
  }
  
  
  public String nonce() {
    return nonce;
  }

}
