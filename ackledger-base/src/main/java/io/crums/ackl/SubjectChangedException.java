/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


/**
 * Thrown when the subject (document) no longer matches the checksum the
 * caller meant to acknowledge. The caller should re-fetch the subject and
 * attest again.
 */
@SuppressWarnings("serial")
public class SubjectChangedException extends LedgerException {
  
  private final String subjectId;
  private final String expectedChecksum;
  private final String currentChecksum;

  public SubjectChangedException(
      String subjectId, String expectedChecksum, String currentChecksum) {
    super(
        "subject '%s' changed: expected checksum %s; current is %s"
        .formatted(subjectId, expectedChecksum, currentChecksum));
    this.subjectId = subjectId;
    this.expectedChecksum = expectedChecksum;
    this.currentChecksum = currentChecksum;
  }
  
  
  public String subjectId() {
    return subjectId;
  }
  
  /** The checksum the caller attested to. */
  public String expectedChecksum() {
    return expectedChecksum;
  }
  
  /** The checksum the document collaborator reports now. */
  public String currentChecksum() {
    return currentChecksum;
  }

}
