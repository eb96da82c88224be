/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@linkplain LedgerStore}. Inserts are serialized on a single lock;
 * reads take none.
 */
public class VolatileLedgerStore implements LedgerStore {
  
  private final Object lock = new Object();
  
  private final Clock clock;
  
  /** Index {@code i} holds the record with id {@code i + 1}. */
  private final CopyOnWriteArrayList<SignatureRecord> records = new CopyOnWriteArrayList<>();
  
  private final Map<List<String>, SignatureRecord> bySubjectSigner = new ConcurrentHashMap<>();
  private final Map<String, Long> nonces = new ConcurrentHashMap<>();
  
  
  /**
   * Creates an empty instance using the UTC system clock.
   */
  public VolatileLedgerStore() {
    this(Clock.systemUTC());
  }
  
  /**
   * Creates an empty instance.
   * 
   * @param clock  source of {@code createdAt} times
   */
  public VolatileLedgerStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  
  
  private static List<String> key(String subjectId, String signerId) {
    return List.of(subjectId, signerId);
  }
  

  @Override
  public SignatureRecord insertLinked(PendingRecord pending)
      throws AlreadyAcknowledgedException, ReplayedNonceException {
    
    final var fact = pending.fact();
    final var key = key(fact.subjectId(), fact.signerId());
    final String nonce = fact.nonce().get();
    
    synchronized (lock) {
      if (bySubjectSigner.containsKey(key))
        throw new AlreadyAcknowledgedException(fact.subjectId(), fact.signerId());
      if (nonces.containsKey(nonce))
        throw new ReplayedNonceException(nonce);
      
      final int size = records.size();
      Optional<byte[]> prevHash =
          size == 0 ?
              Optional.empty() :
                Optional.of(records.get(size - 1).payloadHash());
      
      SignatureRecord record =
          pending.toRecord(size + 1, prevHash, Instant.now(clock));
      
      bySubjectSigner.put(key, record);
      nonces.put(nonce, record.id());
      records.add(record);
      return record;
    }
  }

  @Override
  public long size() {
    return records.size();
  }

  @Override
  public Optional<SignatureRecord> findById(long id) {
    var snapshot = records;
    return
        id < 1 || id > snapshot.size() ?
            Optional.empty() :
              Optional.of(snapshot.get((int) id - 1));
  }

  @Override
  public List<SignatureRecord> range(long fromId, long toId) {
    if (fromId < 1)
      throw new IllegalArgumentException("fromId " + fromId);
    List<SignatureRecord> snapshot = List.copyOf(records);
    long end = Math.min(toId, snapshot.size());
    if (end < fromId)
      return List.of();
    return snapshot.subList((int) fromId - 1, (int) end);
  }

  @Override
  public Optional<SignatureRecord> find(String subjectId, String signerId) {
    return Optional.ofNullable(bySubjectSigner.get(key(subjectId, signerId)));
  }

  @Override
  public boolean isAcknowledged(String subjectId, String signerIdOrEmail) {
    String email = CanonicalEncoder.normalizeEmail(signerIdOrEmail);
    return records.stream().anyMatch(
        r -> r.subjectId().equals(subjectId) &&
            (r.signerId().equals(signerIdOrEmail) || r.signerEmail().equals(email)));
  }

  @Override
  public List<SignatureRecord> listBySubject(String subjectId) {
    return newestFirst(
        records.stream().filter(r -> r.subjectId().equals(subjectId)).toList());
  }

  @Override
  public List<SignatureRecord> listBySigner(String signerId) {
    return newestFirst(
        records.stream().filter(r -> r.signerId().equals(signerId)).toList());
  }
  
  
  private static List<SignatureRecord> newestFirst(List<SignatureRecord> list) {
    var copy = new ArrayList<>(list);
    Collections.reverse(copy);
    return copy;
  }

  /** No-op. */
  @Override
  public void close() {
  }

}
