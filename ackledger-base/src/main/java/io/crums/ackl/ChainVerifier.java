/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.lang.System.Logger.Level;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import io.crums.ackl.Discrepancy.Kind;

/**
 * Replays the hash chain and checks signatures. Needs only the public key.
 * 
 * <h2>Checks</h2>
 * <p>
 * For every record in range, the payload hash is <em>recomputed</em> from the
 * record's fields (the stored hash is not trusted), then
 * </p>
 * <ol>
 * <li>the stored payload hash is compared against the recomputed one
 *     ({@linkplain Kind#HASH_MISMATCH});</li>
 * <li>the signature is verified against the recomputed hash
 *     ({@linkplain Kind#SIGNATURE_INVALID});</li>
 * <li>the record's {@code prev_hash} is compared against both the stored and
 *     the recomputed payload hash of its predecessor
 *     ({@linkplain Kind#LINK_MISMATCH}); the first record in the ledger must
 *     have none ({@linkplain Kind#GENESIS_LINKED}).</li>
 * </ol>
 * <p>
 * Scanning does not stop at the first failure. Instances are immutable and
 * safe to share; verification takes no locks.
 * </p>
 */
public class ChainVerifier {
  
  /** Number of records read from the store at a time. */
  public final static int DEFAULT_PAGE_SIZE = 256;
  
  
  /**
   * Verifies a single record's payload hash and signature (link checks
   * require its predecessor and are not performed).
   * 
   * @param publicKey 32-byte Ed25519 public key
   * 
   * @return {@code true} iff the stored hash matches the recomputed one and
   *         the signature verifies
   */
  public static boolean verifyRecord(byte[] publicKey, SignatureRecord record) {
    byte[] hash;
    try {
      hash = CanonicalEncoder.payloadHash(record.fact());
    } catch (IllegalArgumentException iax) {
      return false;
    }
    return
        MessageDigest.isEqual(hash, record.payloadHash()) &&
        KeyCustodian.verify(publicKey, hash, record.signature());
  }
  
  
  
  private final byte[] publicKey;
  private final int pageSize;
  
  
  /**
   * Creates an instance with the given public key.
   * 
   * @param publicKey 32-byte Ed25519 public key
   */
  public ChainVerifier(byte[] publicKey) {
    this(publicKey, DEFAULT_PAGE_SIZE);
  }
  
  /**
   * Full constructor.
   * 
   * @param publicKey 32-byte Ed25519 public key
   * @param pageSize  number of records read at a time (&ge; 1)
   */
  public ChainVerifier(byte[] publicKey, int pageSize) {
    if (publicKey.length != LedgerConstants.PUBLIC_KEY_WIDTH)
      throw new IllegalArgumentException("publicKey length " + publicKey.length);
    if (pageSize < 1)
      throw new IllegalArgumentException("pageSize " + pageSize);
    this.publicKey = publicKey.clone();
    this.pageSize = pageSize;
  }
  
  
  /**
   * Creates an instance using the custodian's public key.
   */
  public ChainVerifier(KeyCustodian custodian) {
    this(custodian.publicKey());
  }
  
  
  /** Returns a copy of the public key. */
  public byte[] publicKey() {
    return publicKey.clone();
  }
  
  
  /**
   * Verifies the given record's hash and signature.
   * 
   * @see #verifyRecord(byte[], SignatureRecord)
   */
  public boolean verifyRecord(SignatureRecord record) {
    return verifyRecord(publicKey, record);
  }
  
  
  /**
   * Replays the chain in the given store over the given range of ids.
   * 
   * @param store   the ledger
   * @param fromId  inclusive, &ge; 1
   * @param toId    inclusive, &ge; {@code fromId}; clipped to the ledger size
   * 
   * @throws CancellationException if the thread is interrupted mid-scan
   */
  public VerificationReport verifyChain(LedgerStore store, long fromId, long toId) {
    if (fromId < 1)
      throw new IllegalArgumentException("fromId " + fromId);
    if (toId < fromId)
      throw new IllegalArgumentException(
          "toId (%d) < fromId (%d)".formatted(toId, fromId));
    
    final long size = store.size();
    final long lastId = Math.min(toId, size);
    
    List<Discrepancy> discrepancies = new ArrayList<>();
    
    Link prev = null;
    if (fromId > 1 && fromId <= lastId) {
      Optional<SignatureRecord> predecessor = store.findById(fromId - 1);
      if (predecessor.isPresent())
        prev = new Link(predecessor.get(), recompute(predecessor.get()));
    }
    
    long checked = 0;
    for (long pageStart = fromId; pageStart <= lastId; pageStart += pageSize) {
      if (Thread.currentThread().isInterrupted())
        throw new CancellationException(
            "chain verification interrupted at id " + pageStart);
      
      long pageEnd = Math.min(lastId, pageStart + pageSize - 1);
      long expectedId = pageStart;
      for (var record : store.range(pageStart, pageEnd)) {
        for (; expectedId < record.id(); ++expectedId) {
          discrepancies.add(
              new Discrepancy(expectedId, Kind.MISSING_RECORD, "no record at id"));
          prev = null;
        }
        prev = check(record, prev, discrepancies);
        ++checked;
        expectedId = record.id() + 1;
      }
      for (; expectedId <= pageEnd; ++expectedId) {
        discrepancies.add(
            new Discrepancy(expectedId, Kind.MISSING_RECORD, "no record at id"));
        prev = null;
      }
    }
    
    var report = new VerificationReport(fromId, lastId, checked, discrepancies);
    if (report.isClean())
      LedgerConstants.getLogger().log(
          Level.INFO,
          "chain verified [{0}, {1}]: {2} records, no discrepancies",
          fromId, lastId, checked);
    else
      LedgerConstants.getLogger().log(
          Level.WARNING,
          "chain verification [{0}, {1}]: {2} discrepancies in {3} records; first at id {4}",
          fromId, lastId, discrepancies.size(), checked, report.firstFailedId());
    return report;
  }
  
  
  /** Payload hash state of the previous record. */
  private record Link(SignatureRecord record, byte[] recomputed) {  }
  
  
  /** Returns the recomputed hash, or {@code null}, if unencodable. */
  private byte[] recompute(SignatureRecord record) {
    try {
      return CanonicalEncoder.payloadHash(record.fact());
    } catch (IllegalArgumentException iax) {
      return null;
    }
  }
  
  
  private Link check(
      SignatureRecord record, Link prev, List<Discrepancy> discrepancies) {
    
    final long id = record.id();
    final byte[] recomputed = recompute(record);
    final byte[] stored = record.payloadHash();
    
    if (recomputed == null)
      discrepancies.add(
          new Discrepancy(id, Kind.UNENCODABLE, "fields do not form a valid fact"));
    
    else if (!MessageDigest.isEqual(recomputed, stored))
      discrepancies.add(
          new Discrepancy(id, Kind.HASH_MISMATCH,
              "stored %s; recomputed %s".formatted(enc(stored), enc(recomputed))));
    
    
    Optional<byte[]> prevHash = record.prevHash();
    
    if (id == 1) {
      if (prevHash.isPresent())
        discrepancies.add(
            new Discrepancy(id, Kind.GENESIS_LINKED,
                "first record has prev_hash " + enc(prevHash.get())));
    
    } else if (prevHash.isEmpty()) {
      discrepancies.add(
          new Discrepancy(id, Kind.LINK_MISMATCH, "missing prev_hash"));
    
    } else if (prev == null) {
      discrepancies.add(
          new Discrepancy(id, Kind.LINK_MISMATCH,
              "predecessor [%d] not found".formatted(id - 1)));
    
    } else {
      byte[] link = prevHash.get();
      boolean storedOk = MessageDigest.isEqual(link, prev.record().payloadHash());
      boolean recomputedOk =
          prev.recomputed() == null || MessageDigest.isEqual(link, prev.recomputed());
      if (!storedOk || !recomputedOk)
        discrepancies.add(
            new Discrepancy(id, Kind.LINK_MISMATCH,
                "prev_hash %s; predecessor [%d] stored %s, recomputed %s".formatted(
                    enc(link),
                    prev.record().id(),
                    enc(prev.record().payloadHash()),
                    prev.recomputed() == null ? "n/a" : enc(prev.recomputed()))));
    }
    
    if (recomputed != null &&
        !KeyCustodian.verify(publicKey, recomputed, record.signature()))
      discrepancies.add(
          new Discrepancy(id, Kind.SIGNATURE_INVALID,
              "signature does not verify over recomputed hash"));
    
    return new Link(record, recomputed);
  }
  
  
  private static String enc(byte[] bytes) {
    return ByteEncoding.BASE64.encode(bytes);
  }

}
