/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-side overlay on a {@linkplain LedgerStore}: records may be swapped
 * out or hidden. Simulates storage-level tampering.
 */
public class TamperedStore implements LedgerStore {
  
  private final LedgerStore store;
  private final Map<Long, Optional<SignatureRecord>> overrides = new HashMap<>();
  
  
  public TamperedStore(LedgerStore store) {
    this.store = store;
  }
  
  
  public void replace(SignatureRecord record) {
    overrides.put(record.id(), Optional.of(record));
  }
  
  
  public void hide(long id) {
    overrides.put(id, Optional.empty());
  }
  
  
  private Optional<SignatureRecord> overlay(SignatureRecord record) {
    return overrides.getOrDefault(record.id(), Optional.of(record));
  }
  

  @Override
  public SignatureRecord insertLinked(PendingRecord pending) {
    return store.insertLinked(pending);
  }

  @Override
  public long size() {
    return store.size();
  }

  @Override
  public Optional<SignatureRecord> findById(long id) {
    return store.findById(id).flatMap(this::overlay);
  }

  @Override
  public List<SignatureRecord> range(long fromId, long toId) {
    return store.range(fromId, toId).stream()
        .map(this::overlay).flatMap(Optional::stream)
        .collect(Collectors.toList());
  }

  @Override
  public Optional<SignatureRecord> find(String subjectId, String signerId) {
    return store.find(subjectId, signerId).flatMap(this::overlay);
  }

  @Override
  public boolean isAcknowledged(String subjectId, String signerIdOrEmail) {
    return store.isAcknowledged(subjectId, signerIdOrEmail);
  }

  @Override
  public List<SignatureRecord> listBySubject(String subjectId) {
    return store.listBySubject(subjectId);
  }

  @Override
  public List<SignatureRecord> listBySigner(String signerId) {
    return store.listBySigner(signerId);
  }

  @Override
  public void close() {
    store.close();
  }
  
  
  
  public static byte[] flipBit(byte[] bytes, int index) {
    byte[] copy = bytes.clone();
    copy[index] ^= 1;
    return copy;
  }
  
  
  public static SignatureRecord withPayloadHash(SignatureRecord r, byte[] payloadHash) {
    return new SignatureRecord(
        r.id(), r.subjectId(), r.signerId(), r.signerEmail(), r.signerName(),
        r.signedAt(), r.nonce(), r.subjectChecksum(),
        payloadHash, r.signature(), r.prevHash(), r.createdAt());
  }
  
  
  public static SignatureRecord withSignature(SignatureRecord r, byte[] signature) {
    return new SignatureRecord(
        r.id(), r.subjectId(), r.signerId(), r.signerEmail(), r.signerName(),
        r.signedAt(), r.nonce(), r.subjectChecksum(),
        r.payloadHash(), signature, r.prevHash(), r.createdAt());
  }
  
  
  public static SignatureRecord withPrevHash(SignatureRecord r, Optional<byte[]> prevHash) {
    return new SignatureRecord(
        r.id(), r.subjectId(), r.signerId(), r.signerEmail(), r.signerName(),
        r.signedAt(), r.nonce(), r.subjectChecksum(),
        r.payloadHash(), r.signature(), prevHash, r.createdAt());
  }
  
  
  public static SignatureRecord withSubjectId(SignatureRecord r, String subjectId) {
    return new SignatureRecord(
        r.id(), subjectId, r.signerId(), r.signerEmail(), r.signerName(),
        r.signedAt(), r.nonce(), r.subjectChecksum(),
        r.payloadHash(), r.signature(), r.prevHash(), r.createdAt());
  }

}
