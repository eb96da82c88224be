/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


/**
 * Thrown when the ledger already holds a record for a given
 * subject / signer pair. This is final: retrying the same fact
 * will fail the same way.
 */
@SuppressWarnings("serial")
public class AlreadyAcknowledgedException extends LedgerException {
  
  private final String subjectId;
  private final String signerId;

  public AlreadyAcknowledgedException(String subjectId, String signerId) {
    this(subjectId, signerId, null);
  }

  public AlreadyAcknowledgedException(
      String subjectId, String signerId, Throwable cause) {
    super(
        "subject '%s' already acknowledged by signer '%s'"
        .formatted(subjectId, signerId),
        cause);
    this.subjectId = subjectId;
    this.signerId = signerId;
  }
  
  
  public String subjectId() {
    return subjectId;
  }
  
  
  public String signerId() {
    return signerId;
  }

}
