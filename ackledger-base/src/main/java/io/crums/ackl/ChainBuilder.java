/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.lang.System.Logger.Level;
import java.util.Objects;
import java.util.Optional;

/**
 * Hashes, signs, and appends attestations to the ledger.
 * 
 * <h2>Append Steps</h2>
 * <ol>
 * <li>Fail fast if the custodian cannot sign.</li>
 * <li>Reject if the subject / signer pair is already recorded.</li>
 * <li>If the fact carries a subject checksum, reject if the document
 * collaborator reports a different current checksum.</li>
 * <li>Generate a nonce, if the fact has none.</li>
 * <li>Encode, hash (SHA-256), sign (Ed25519).</li>
 * <li>Hand off to the store, which links to the tail and inserts atomically.</li>
 * </ol>
 * <p>
 * Steps 1 through 5 take no locks and do not touch the ledger's tail. The
 * pre-check in step 2 is an optimization; the store's uniqueness constraint
 * decides races. Instances are safe to share across threads.
 * </p>
 */
public class ChainBuilder {
  
  private final KeyCustodian custodian;
  private final LedgerStore store;
  private final SubjectChecksums checksums;
  
  
  /**
   * Creates an instance with no document collaborator.
   */
  public ChainBuilder(KeyCustodian custodian, LedgerStore store) {
    this(custodian, store, SubjectChecksums.NONE);
  }

  /**
   * Full constructor.
   * 
   * @param custodian   signs payload hashes
   * @param store       the ledger
   * @param checksums   document collaborator (for subject-changed checks)
   */
  public ChainBuilder(
      KeyCustodian custodian, LedgerStore store, SubjectChecksums checksums) {
    this.custodian = Objects.requireNonNull(custodian, "null custodian");
    this.store = Objects.requireNonNull(store, "null store");
    this.checksums = Objects.requireNonNull(checksums, "null checksums");
  }
  
  
  /**
   * Appends the given fact with no signer display name.
   * 
   * @see #append(AttestationFact, String)
   */
  public SignatureRecord append(AttestationFact fact)
      throws AlreadyAcknowledgedException, SubjectChangedException,
        InvalidKeyMaterialException, ReplayedNonceException {
    return append(fact, null);
  }
  
  
  /**
   * Appends the given fact to the ledger and returns the stored record.
   * On failure, the ledger is unchanged.
   * 
   * @param fact        the fact attested (if it has no nonce, one is generated)
   * @param signerName  display name stored alongside (not signed); may be
   *                    {@code null}
   * 
   * @return the stored record, with its assigned id, prev-hash and creation time
   * 
   * @throws AlreadyAcknowledgedException
   *         if the signer already acknowledged the subject
   * @throws SubjectChangedException
   *         if the subject's current checksum differs from the fact's
   * @throws InvalidKeyMaterialException
   *         if the custodian is verify-only
   * @throws ReplayedNonceException
   *         if the fact's nonce was already used
   */
  public SignatureRecord append(AttestationFact fact, String signerName)
      throws AlreadyAcknowledgedException, SubjectChangedException,
        InvalidKeyMaterialException, ReplayedNonceException {
    
    Objects.requireNonNull(fact, "null fact");
    final var log = LedgerConstants.getLogger();
    
    if (!custodian.canSign())
      throw new InvalidKeyMaterialException(
          "cannot append: key custodian is verify-only");
    
    if (store.exists(fact.subjectId(), fact.signerId())) {
      log.log(Level.DEBUG,
          "append rejected: [{0}] already acknowledged by [{1}]",
          fact.subjectId(), fact.signerId());
      throw new AlreadyAcknowledgedException(fact.subjectId(), fact.signerId());
    }
    
    checkSubject(fact);
    
    if (!fact.hasNonce())
      fact = fact.withNonce(Nonces.generate());
    
    byte[] payloadHash = CanonicalEncoder.payloadHash(fact);
    byte[] signature = custodian.sign(payloadHash);
    
    var pending = new PendingRecord(
        fact, Optional.ofNullable(signerName).filter(s -> !s.isBlank()),
        payloadHash, signature);
    
    SignatureRecord record = store.insertLinked(pending);
    
    log.log(Level.INFO,
        "appended [{0}]: subject [{1}] signer [{2}]{3}",
        record.id(), record.subjectId(), record.signerId(),
        record.isGenesis() ? " (genesis)" : "");
    
    return record;
  }
  
  
  private void checkSubject(AttestationFact fact) throws SubjectChangedException {
    if (fact.subjectChecksum().isEmpty())
      return;
    
    String expected = fact.subjectChecksum().get();
    Optional<String> current = checksums.currentChecksum(fact.subjectId());
    if (current.isEmpty()) {
      LedgerConstants.getLogger().log(Level.DEBUG,
          "no current checksum on record for subject [{0}]; skipping check",
          fact.subjectId());
      return;
    }
    if (!expected.equalsIgnoreCase(current.get().strip()))
      throw new SubjectChangedException(fact.subjectId(), expected, current.get());
  }
  
  
  /** Returns the ledger. */
  public LedgerStore store() {
    return store;
  }
  
  
  /** Returns the custodian's public key (32 bytes). */
  public byte[] publicKey() {
    return custodian.publicKey();
  }
  
  
  /**
   * Returns a verifier for this instance's public key.
   */
  public ChainVerifier verifier() {
    return new ChainVerifier(custodian);
  }
  
  
  /**
   * Verifies the chain over the given range.
   * 
   * @see LedgerStore#verifyChain(ChainVerifier, long, long)
   */
  public VerificationReport verifyChain(long fromId, long toId) {
    return store.verifyChain(verifier(), fromId, toId);
  }

}
