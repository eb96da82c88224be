/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The facts being attested: which signer acknowledged which subject, and
 * when. Immutable.
 * 
 * <h2>Field Constraints</h2>
 * <p>
 * Each field ends up on its own line in the
 * {@linkplain CanonicalEncoder canonical encoding}, so none may contain a line
 * break. The ids and email may not be blank.
 * </p>
 * 
 * @param subjectId       the document (subject) id
 * @param signerId        the authenticated signer's id (e.g. OAuth subject)
 * @param signerEmail     the signer's email (case-insensitive)
 * @param signedAt        the moment of acknowledgment
 * @param nonce           anti-replay nonce; if empty, one is generated on append
 * @param subjectChecksum checksum of the document version being acknowledged
 *                        (optional)
 * 
 * @see CanonicalEncoder#encode(AttestationFact)
 */
public record AttestationFact(
    String subjectId,
    String signerId,
    String signerEmail,
    Instant signedAt,
    Optional<String> nonce,
    Optional<String> subjectChecksum) {
  
  
  public AttestationFact {
    checkField(subjectId, "subjectId");
    checkField(signerId, "signerId");
    checkField(signerEmail, "signerEmail");
    Objects.requireNonNull(signedAt, "null signedAt");
    
    if (nonce == null)
      nonce = Optional.empty();
    else if (nonce.filter(String::isBlank).isPresent())
      nonce = Optional.empty();
    nonce.ifPresent(n -> checkField(n, "nonce"));
    
    if (subjectChecksum == null)
      subjectChecksum = Optional.empty();
    else if (subjectChecksum.filter(String::isBlank).isPresent())
      subjectChecksum = Optional.empty();
    subjectChecksum.ifPresent(c -> checkField(c, "subjectChecksum"));
  }
  
  
  /**
   * Creates an instance with no nonce and no subject checksum.
   */
  public AttestationFact(
      String subjectId, String signerId, String signerEmail, Instant signedAt) {
    this(subjectId, signerId, signerEmail, signedAt, null, null);
  }
  
  
  /**
   * Creates an instance with no nonce.
   * 
   * @param subjectChecksum may be {@code null}
   */
  public AttestationFact(
      String subjectId, String signerId, String signerEmail, Instant signedAt,
      String subjectChecksum) {
    this(
        subjectId, signerId, signerEmail, signedAt,
        null, Optional.ofNullable(subjectChecksum));
  }
  
  
  private static void checkField(String value, String name) {
    Objects.requireNonNull(value, "null " + name);
    if (value.isBlank())
      throw new IllegalArgumentException("blank " + name);
    if (value.indexOf('\n') != -1 || value.indexOf('\r') != -1)
      throw new IllegalArgumentException(
          name + " contains line break: " + value.strip());
  }
  
  
  /**
   * Returns a copy of this instance with the given nonce.
   */
  public AttestationFact withNonce(String nonce) {
    return new AttestationFact(
        subjectId, signerId, signerEmail, signedAt,
        Optional.of(nonce), subjectChecksum);
  }
  
  
  /** Returns {@code true} iff the nonce is set. */
  public boolean hasNonce() {
    return nonce.isPresent();
  }
  
  
  /**
   * Returns the signer email in normalized form.
   * 
   * @see CanonicalEncoder#normalizeEmail(String)
   */
  public String normalizedEmail() {
    return CanonicalEncoder.normalizeEmail(signerEmail);
  }

}
