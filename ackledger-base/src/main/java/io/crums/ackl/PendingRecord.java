/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A hashed and signed fact, ready to be linked to the chain tail. The store
 * fills in the rest ({@code id}, {@code prev_hash}, {@code created_at}).
 * Equality is by value (array components by content).
 * 
 * @param fact          the attested fact, with nonce set
 * @param signerName    display name (not signed)
 * @param payloadHash   SHA-256 of the fact's canonical encoding
 * @param signature     Ed25519 signature over {@code payloadHash}
 * 
 * @see LedgerStore#insertLinked(PendingRecord)
 */
public record PendingRecord(
    AttestationFact fact,
    Optional<String> signerName,
    byte[] payloadHash,
    byte[] signature) {
  
  public PendingRecord {
    Objects.requireNonNull(fact, "null fact");
    if (!fact.hasNonce())
      throw new IllegalArgumentException("fact has no nonce: " + fact);
    if (signerName == null)
      signerName = Optional.empty();
    if (payloadHash.length != LedgerConstants.HASH_WIDTH)
      throw new IllegalArgumentException("payloadHash length " + payloadHash.length);
    if (signature.length != LedgerConstants.SIGNATURE_WIDTH)
      throw new IllegalArgumentException("signature length " + signature.length);
    payloadHash = payloadHash.clone();
    signature = signature.clone();
  }
  
  
  /**
   * Returns the stored record this pending one becomes once linked.
   * 
   * @param id        the store-assigned id
   * @param prevHash  the tail's payload hash; empty for the first record
   * @param createdAt the store-assigned insertion time
   */
  public SignatureRecord toRecord(
      long id, Optional<byte[]> prevHash, Instant createdAt) {
    return new SignatureRecord(
        id,
        fact.subjectId(),
        fact.signerId(),
        fact.normalizedEmail(),
        signerName,
        fact.signedAt(),
        fact.nonce().get(),
        fact.subjectChecksum(),
        payloadHash,
        signature,
        prevHash,
        createdAt);
  }
  
  
  @Override
  public byte[] payloadHash() {
    return payloadHash.clone();
  }
  
  
  @Override
  public byte[] signature() {
    return signature.clone();
  }
  
  
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    return
        o instanceof PendingRecord other &&
        fact.equals(other.fact) &&
        signerName.equals(other.signerName) &&
        Arrays.equals(payloadHash, other.payloadHash) &&
        Arrays.equals(signature, other.signature);
  }
  
  
  @Override
  public int hashCode() {
    return fact.hashCode() * 31 + Arrays.hashCode(payloadHash);
  }

}
