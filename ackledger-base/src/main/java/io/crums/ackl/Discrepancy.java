/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.Objects;

/**
 * A single verification failure at a specific record.
 * 
 * @param recordId  the offending record's id
 * @param kind      what went wrong
 * @param detail    human readable detail
 * 
 * @see VerificationReport
 */
public record Discrepancy(long recordId, Kind kind, String detail) {
  
  /**
   * Failure modes. Hash-chain failures and signature failures are reported
   * separately: the first suggests storage corruption or link tampering;
   * the second, stored-signature tampering or a key mismatch.
   */
  public enum Kind {
    /**
     * The stored payload hash does not match the hash recomputed from the
     * record's fields.
     */
    HASH_MISMATCH,
    /**
     * The record's {@code prev_hash} does not match its predecessor's payload
     * hash (stored or recomputed), or is missing.
     */
    LINK_MISMATCH,
    /**
     * The first record of the ledger has a {@code prev_hash}.
     */
    GENESIS_LINKED,
    /**
     * The signature does not verify against the recomputed hash and the
     * public key.
     */
    SIGNATURE_INVALID,
    /**
     * The record's fields no longer form a valid fact, so it cannot be
     * re-encoded.
     */
    UNENCODABLE,
    /**
     * No record found at an id within the ledger's range.
     */
    MISSING_RECORD;
    
    
    /** Returns {@code true} for the hash-chain failure kinds. */
    public boolean isChainFailure() {
      return this != SIGNATURE_INVALID;
    }
  }
  
  
  public Discrepancy {
    Objects.requireNonNull(kind, "null kind");
    if (detail == null)
      detail = "";
  }
  
  
  @Override
  public String toString() {
    return "[" + recordId + "] " + kind + (detail.isEmpty() ? "" : ": " + detail);
  }

}
