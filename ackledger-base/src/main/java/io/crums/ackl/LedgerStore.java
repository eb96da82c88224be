/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for {@linkplain SignatureRecord}s.
 * 
 * <h2>Contract</h2>
 * <ul>
 * <li>Records are never updated or deleted through this interface.</li>
 * <li>Ids are assigned by the store, starting at 1, increasing by 1 with each
 * insert.</li>
 * <li>At most one record per {@code (subjectId, signerId)} pair; at most one
 * per nonce. These must be enforced by the storage layer itself, not merely
 * checked beforehand.</li>
 * <li>{@linkplain #insertLinked(PendingRecord)} reads the tail and inserts the
 * new record as a single atomic unit with respect to other inserts.</li>
 * <li>Read methods may run concurrently with inserts. They only see
 * committed records.</li>
 * </ul>
 */
public interface LedgerStore extends AutoCloseable {
  
  
  /**
   * Links the given pending record to the current chain tail and stores it.
   * The tail read and the insert are atomic: no other insert interleaves.
   * Either the record is committed in full, or nothing is.
   * 
   * @return the stored record with its assigned {@code id}, {@code prevHash},
   *         and {@code createdAt}
   * 
   * @throws AlreadyAcknowledgedException
   *         if a record for the same subject / signer pair exists
   * @throws ReplayedNonceException
   *         if the nonce is already in the ledger
   */
  SignatureRecord insertLinked(PendingRecord pending)
      throws AlreadyAcknowledgedException, ReplayedNonceException;
  
  
  /**
   * Returns the number of records in the ledger. Since ids are contiguous,
   * this is also the id of the tail.
   */
  long size();
  
  
  /**
   * Returns the last record inserted, if any.
   */
  default Optional<SignatureRecord> tail() {
    long size = size();
    return size == 0 ? Optional.empty() : findById(size);
  }
  
  
  /**
   * Returns the record with the given id, if it exists.
   */
  Optional<SignatureRecord> findById(long id);
  
  
  /**
   * Returns the records with ids in the given range, in ascending id order.
   * 
   * @param fromId  inclusive, &ge; 1
   * @param toId    inclusive
   */
  List<SignatureRecord> range(long fromId, long toId);
  
  
  /**
   * Returns the record for the given subject and signer, if any.
   */
  Optional<SignatureRecord> find(String subjectId, String signerId);
  
  
  /**
   * Returns {@code true} iff the given signer has acknowledged the given subject.
   */
  default boolean exists(String subjectId, String signerId) {
    return find(subjectId, signerId).isPresent();
  }
  
  
  /**
   * Returns {@code true} iff the subject is acknowledged by a signer matching
   * the given identifier. The identifier matches either the signer id, or
   * (case insensitively) the signer's email.
   */
  boolean isAcknowledged(String subjectId, String signerIdOrEmail);
  
  
  /**
   * Returns the records for the given subject, newest first.
   */
  List<SignatureRecord> listBySubject(String subjectId);
  
  
  /**
   * Returns the given signer's records, newest first.
   */
  List<SignatureRecord> listBySigner(String signerId);
  
  
  /**
   * Replays the chain over the given id range and reports any discrepancies.
   * Performs no mutation.
   * 
   * @param verifier  carries the public key
   * @param fromId    inclusive, &ge; 1
   * @param toId      inclusive; clipped to {@linkplain #size()}
   * 
   * @see ChainVerifier#verifyChain(LedgerStore, long, long)
   */
  default VerificationReport verifyChain(
      ChainVerifier verifier, long fromId, long toId) {
    return verifier.verifyChain(this, fromId, toId);
  }
  
  
  /**
   * Releases any backing resources. Does not throw checked exceptions.
   */
  @Override
  void close();

}
