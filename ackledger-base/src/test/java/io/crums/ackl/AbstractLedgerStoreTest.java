/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * {@linkplain LedgerStore} implementations are tested by subclassing this
 * class. The tests go thru a {@linkplain ChainBuilder}.
 */
public abstract class AbstractLedgerStoreTest {
  
  public final static Instant MOCK_SIGNED_AT = Instant.parse("2026-03-01T09:30:00.25Z");
  
  @TempDir
  protected Path tempDir;
  
  
  /**
   * Returns a new, empty store.
   * 
   * @param testDir per-method, existing test directory
   * @param label   unique per test method (usable as a db name)
   */
  protected abstract LedgerStore declareNewInstance(Path testDir, String label) throws Exception;
  
  
  
  protected LedgerStore declareNewInstance(Object methodLabel) throws Exception {
    String label = methodLabel.getClass().getEnclosingMethod().getName();
    return declareNewInstance(tempDir, label);
  }
  
  
  public static AttestationFact mockFact(int index) {
    return new AttestationFact(
        "doc-" + index,
        "user-" + index,
        "User" + index + "@Example.com",
        MOCK_SIGNED_AT.plusMillis(index));
  }
  
  
  @Test
  public void testEmpty() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      assertEquals(0, store.size());
      assertTrue(store.tail().isEmpty());
      assertTrue(store.findById(1).isEmpty());
      assertTrue(store.range(1, 10).isEmpty());
      assertFalse(store.exists("doc-1", "alice"));
      
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      var report = builder.verifyChain(1, 10);
      assertTrue(report.isClean());
      assertEquals(0, report.recordsChecked());
    }
  }
  
  
  @Test
  public void testOne() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      var custodian = KeyCustodian.generate();
      var builder = new ChainBuilder(custodian, store);
      var fact = new AttestationFact("doc-1", "alice", "Alice@Example.com ", MOCK_SIGNED_AT);
      
      SignatureRecord record = builder.append(fact, "Alice A.");
      assertEquals(1L, record.id());
      assertTrue(record.isGenesis());
      assertEquals("alice@example.com", record.signerEmail());
      assertEquals(Optional.of("Alice A."), record.signerName());
      assertEquals(MOCK_SIGNED_AT, record.signedAt());
      assertEquals(Nonces.NONCE_LENGTH, record.nonce().length());
      assertTrue(ChainVerifier.verifyRecord(custodian.publicKey(), record));
      
      assertEquals(1, store.size());
      var stored = store.findById(1).get();
      assertArrayEquals(record.payloadHash(), stored.payloadHash());
      assertArrayEquals(record.signature(), stored.signature());
      assertEquals(record.nonce(), stored.nonce());
      assertEquals(record.signedAt(), stored.signedAt());
      assertTrue(stored.prevHash().isEmpty());
      assertEquals(stored.id(), store.tail().get().id());
      
      var again = new AttestationFact("doc-1", "alice", "alice@example.com", Instant.now());
      var aax = assertThrows(AlreadyAcknowledgedException.class, () -> builder.append(again));
      assertEquals("doc-1", aax.subjectId());
      assertEquals("alice", aax.signerId());
      assertEquals(1, store.size());
      
      var report = builder.verifyChain(1, 1);
      assertTrue(report.isClean());
      assertEquals(1, report.recordsChecked());
    }
  }
  
  
  @Test
  public void testChain() throws Exception {
    final Object label = new Object() {  };
    final int count = 40;
    
    try (var store = declareNewInstance(label)) {
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      for (int index = 1; index <= count; ++index)
        assertEquals(index, builder.append(mockFact(index)).id());
      
      assertEquals(count, store.size());
      List<SignatureRecord> records = store.range(1, count);
      assertEquals(count, records.size());
      for (int index = 1; index < count; ++index) {
        var prev = records.get(index - 1);
        var record = records.get(index);
        assertEquals(index + 1, record.id());
        assertArrayEquals(prev.payloadHash(), record.prevHash().get());
      }
      
      assertTrue(builder.verifyChain(1, count).isClean());
      var partial = builder.verifyChain(7, 11);
      assertTrue(partial.isClean());
      assertEquals(5, partial.recordsChecked());
      
      var clipped = builder.verifyChain(30, count + 100);
      assertTrue(clipped.isClean());
      assertEquals(count, clipped.toId());
      assertEquals(count - 29, clipped.recordsChecked());
      
      var small = new ChainVerifier(builder.publicKey(), 3).verifyChain(store, 1, count);
      assertTrue(small.isClean());
      assertEquals(count, small.recordsChecked());
      
      assertEquals(List.of(), store.range(count + 1, count + 5));
      assertEquals(3, store.range(count - 2, count + 5).size());
    }
  }
  
  
  @Test
  public void testQueries() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      builder.append(new AttestationFact("doc-1", "alice", "alice@example.com", MOCK_SIGNED_AT));
      builder.append(new AttestationFact("doc-1", "bob", "Bob@Example.com", MOCK_SIGNED_AT));
      builder.append(new AttestationFact("doc-2", "alice", "alice@example.com", MOCK_SIGNED_AT));
      
      var bySubject = store.listBySubject("doc-1");
      assertEquals(2, bySubject.size());
      assertEquals("bob", bySubject.get(0).signerId());
      assertEquals("alice", bySubject.get(1).signerId());
      
      var bySigner = store.listBySigner("alice");
      assertEquals(2, bySigner.size());
      assertEquals("doc-2", bySigner.get(0).subjectId());
      assertEquals("doc-1", bySigner.get(1).subjectId());
      
      assertTrue(store.listBySubject("doc-3").isEmpty());
      
      assertTrue(store.isAcknowledged("doc-1", "bob"));
      assertTrue(store.isAcknowledged("doc-1", "BOB@example.COM"));
      assertFalse(store.isAcknowledged("doc-2", "bob"));
      assertFalse(store.isAcknowledged("doc-2", "bob@example.com"));
      
      assertEquals(2L, store.find("doc-1", "bob").get().id());
      assertTrue(store.find("doc-2", "bob").isEmpty());
    }
  }
  
  
  @Test
  public void testSubjectChanged() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      SubjectChecksums checksums =
          subjectId -> subjectId.equals("doc-1") ? Optional.of("ABC123") : Optional.empty();
      var builder = new ChainBuilder(KeyCustodian.generate(), store, checksums);
      
      var stale = new AttestationFact("doc-1", "alice", "a@example.com", MOCK_SIGNED_AT, "999");
      var scx = assertThrows(SubjectChangedException.class, () -> builder.append(stale));
      assertEquals("999", scx.expectedChecksum());
      assertEquals("ABC123", scx.currentChecksum());
      assertEquals(0, store.size());
      
      var fresh = new AttestationFact("doc-1", "alice", "a@example.com", MOCK_SIGNED_AT, "abc123");
      var record = builder.append(fresh);
      assertEquals(Optional.of("abc123"), record.subjectChecksum());
      
      var unknown = new AttestationFact("doc-2", "alice", "a@example.com", MOCK_SIGNED_AT, "777");
      assertEquals(2L, builder.append(unknown).id());
      
      var unchecked = new AttestationFact("doc-1", "bob", "b@example.com", MOCK_SIGNED_AT);
      assertEquals(3L, builder.append(unchecked).id());
      
      assertTrue(builder.verifyChain(1, 3).isClean());
    }
  }
  
  
  @Test
  public void testReplayedNonce() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      String nonce = Nonces.generate();
      builder.append(mockFact(1).withNonce(nonce));
      var rnx = assertThrows(
          ReplayedNonceException.class,
          () -> builder.append(mockFact(2).withNonce(nonce)));
      assertEquals(nonce, rnx.nonce());
      assertEquals(1, store.size());
      assertEquals(2L, builder.append(mockFact(2)).id());
    }
  }
  
  
  @Test
  public void testVerifyOnlyCannotAppend() throws Exception {
    final Object label = new Object() {  };
    
    try (var store = declareNewInstance(label)) {
      var verifier = KeyCustodian.verifyOnly(KeyCustodian.generate().publicKey());
      var builder = new ChainBuilder(verifier, store);
      assertThrows(InvalidKeyMaterialException.class, () -> builder.append(mockFact(1)));
      assertEquals(0, store.size());
    }
  }
  
  
  @Test
  public void testConcurrentSamePair() throws Exception {
    final Object label = new Object() {  };
    final int threads = 16;
    
    try (var store = declareNewInstance(label)) {
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      var fact = new AttestationFact("doc-1", "alice", "alice@example.com", MOCK_SIGNED_AT);
      
      List<Future<SignatureRecord>> results =
          runConcurrently(threads, index -> builder.append(fact));
      
      int successes = 0;
      for (var result : results) {
        try {
          result.get();
          ++successes;
        } catch (ExecutionException x) {
          assertInstanceOf(AlreadyAcknowledgedException.class, x.getCause());
        }
      }
      assertEquals(1, successes);
      assertEquals(1, store.size());
      assertTrue(builder.verifyChain(1, 1).isClean());
    }
  }
  
  
  @Test
  public void testConcurrentDistinct() throws Exception {
    final Object label = new Object() {  };
    final int threads = 32;
    
    try (var store = declareNewInstance(label)) {
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      
      List<Future<SignatureRecord>> results =
          runConcurrently(threads, index -> builder.append(mockFact(index)));
      
      var ids = new HashSet<Long>();
      for (var result : results)
        ids.add(result.get().id());
      assertEquals(threads, ids.size());
      assertEquals(threads, store.size());
      
      var prevHashes = new HashSet<String>();
      var records = store.range(1, threads);
      for (var record : records) {
        if (record.id() == 1)
          assertTrue(record.isGenesis());
        else
          assertTrue(prevHashes.add(Base64.getEncoder().encodeToString(record.prevHash().get())));
      }
      assertEquals(threads - 1, prevHashes.size());
      assertTrue(builder.verifyChain(1, threads).isClean());
    }
  }
  
  
  
  @FunctionalInterface
  protected interface Task {
    SignatureRecord run(int index) throws Exception;
  }
  
  
  /**
   * Runs the given task on as many threads, released together.
   */
  protected static List<Future<SignatureRecord>> runConcurrently(int threads, Task task)
      throws InterruptedException {
    
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      CountDownLatch ready = new CountDownLatch(threads);
      CountDownLatch go = new CountDownLatch(1);
      List<Future<SignatureRecord>> results = new ArrayList<>();
      for (int index = 1; index <= threads; ++index) {
        final int i = index;
        Callable<SignatureRecord> call = () -> {
          ready.countDown();
          go.await();
          return task.run(i);
        };
        results.add(executor.submit(call));
      }
      assertTrue(ready.await(30, TimeUnit.SECONDS));
      go.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

}
