/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A persisted ledger entry. Never mutated once stored.
 * 
 * <p>
 * Records form a singly linked, append-only list ordered by {@code id}:
 * the {@code prevHash} of record <em>n</em> is the {@code payloadHash} of
 * record <em>n - 1</em>; the first record has none.
 * </p>
 * <p>
 * The hash fields are held as given: this class does not check them. That's
 * the {@linkplain ChainVerifier}'s job.
 * </p>
 * <p>
 * Equality is by value: the byte array components are compared by content.
 * </p>
 * 
 * @param id              store-assigned, monotonically increasing (&ge; 1)
 * @param subjectId       document id
 * @param signerId        signer id
 * @param signerEmail     signer email, as stored (normalized on append)
 * @param signerName      display name; not part of the signed payload
 * @param signedAt        moment of acknowledgment
 * @param nonce           anti-replay nonce
 * @param subjectChecksum document checksum, if attested to
 * @param payloadHash     SHA-256 of the canonical encoding (32 bytes, as stored)
 * @param signature       Ed25519 signature over {@code payloadHash} (as stored)
 * @param prevHash        the predecessor's payload hash; empty for the first record
 * @param createdAt       store-assigned insertion time (write-once)
 */
public record SignatureRecord(
    long id,
    String subjectId,
    String signerId,
    String signerEmail,
    Optional<String> signerName,
    Instant signedAt,
    String nonce,
    Optional<String> subjectChecksum,
    byte[] payloadHash,
    byte[] signature,
    Optional<byte[]> prevHash,
    Instant createdAt) {
  
  public SignatureRecord {
    if (id < 1)
      throw new IllegalArgumentException("id " + id);
    Objects.requireNonNull(subjectId, "null subjectId");
    Objects.requireNonNull(signerId, "null signerId");
    Objects.requireNonNull(signerEmail, "null signerEmail");
    Objects.requireNonNull(signedAt, "null signedAt");
    Objects.requireNonNull(nonce, "null nonce");
    Objects.requireNonNull(payloadHash, "null payloadHash");
    Objects.requireNonNull(signature, "null signature");
    Objects.requireNonNull(createdAt, "null createdAt");
    if (signerName == null)
      signerName = Optional.empty();
    if (subjectChecksum == null)
      subjectChecksum = Optional.empty();
    if (prevHash == null)
      prevHash = Optional.empty();
    
    payloadHash = payloadHash.clone();
    signature = signature.clone();
    prevHash = prevHash.map(byte[]::clone);
  }
  
  
  /**
   * Returns the attested fact, as recorded. Its
   * {@linkplain CanonicalEncoder#encode(AttestationFact) encoding} is what's
   * hashed.
   * 
   * @throws IllegalArgumentException
   *         if the stored fields are no longer a valid fact (tampering)
   */
  public AttestationFact fact() {
    return new AttestationFact(
        subjectId, signerId, signerEmail, signedAt,
        Optional.of(nonce), subjectChecksum);
  }
  
  
  /** Returns {@code true} iff this record has no predecessor. */
  public boolean isGenesis() {
    return prevHash.isEmpty();
  }
  
  
  /** Returns a copy of the stored payload hash. */
  @Override
  public byte[] payloadHash() {
    return payloadHash.clone();
  }
  
  
  /** Returns a copy of the stored signature. */
  @Override
  public byte[] signature() {
    return signature.clone();
  }
  
  
  /** Returns a copy of the stored previous hash, if any. */
  @Override
  public Optional<byte[]> prevHash() {
    return prevHash.map(byte[]::clone);
  }
  
  
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof SignatureRecord other))
      return false;
    return
        id == other.id &&
        subjectId.equals(other.subjectId) &&
        signerId.equals(other.signerId) &&
        signerEmail.equals(other.signerEmail) &&
        signerName.equals(other.signerName) &&
        signedAt.equals(other.signedAt) &&
        nonce.equals(other.nonce) &&
        subjectChecksum.equals(other.subjectChecksum) &&
        Arrays.equals(payloadHash, other.payloadHash) &&
        Arrays.equals(signature, other.signature) &&
        prevHashEquals(other.prevHash) &&
        createdAt.equals(other.createdAt);
  }
  
  
  private boolean prevHashEquals(Optional<byte[]> otherPrev) {
    if (prevHash.isEmpty() || otherPrev.isEmpty())
      return prevHash.isEmpty() && otherPrev.isEmpty();
    return Arrays.equals(prevHash.get(), otherPrev.get());
  }
  
  
  @Override
  public int hashCode() {
    return Long.hashCode(id) * 31 + Arrays.hashCode(payloadHash);
  }
  
  
  @Override
  public String toString() {
    return
        "SignatureRecord[id=" + id + ", subjectId=" + subjectId +
        ", signerId=" + signerId + ", signedAt=" + signedAt +
        ", payloadHash=" + ByteEncoding.BASE64.encode(payloadHash) + "]";
  }

}
