/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import io.crums.ackl.AbstractLedgerStoreTest;
import io.crums.ackl.AlreadyAcknowledgedException;
import io.crums.ackl.AttestationFact;
import io.crums.ackl.ChainBuilder;
import io.crums.ackl.KeyCustodian;
import io.crums.ackl.LedgerStore;
import io.crums.ackl.SignatureRecord;

/**
 * Runs the store tests against an embedded H2 database.
 */
public class SqlLedgerStoreTest extends AbstractLedgerStoreTest {

  @Override
  protected LedgerStore declareNewInstance(Path testDir, String label) throws Exception {
    var con = SqlTestHarness.newDatabase(testDir, label);
    return SqlLedgerStore.declareNewInstance(con, SqlTestHarness.newSchema());
  }
  
  
  @Test
  public void testReopen() throws Exception {
    final Object label = new Object() {  };
    final String dbName = "testReopen";
    final int count = 5;
    var custodian = KeyCustodian.generate();
    
    try (var store = (SqlLedgerStore) declareNewInstance(label)) {
      var builder = new ChainBuilder(custodian, store);
      for (int index = 1; index <= count; ++index)
        builder.append(mockFact(index));
    }
    
    var con = SqlTestHarness.newDatabase(tempDir, dbName);
    try (var store = new SqlLedgerStore(SqlTestHarness.newSchema(), con)) {
      assertEquals(count, store.size());
      var builder = new ChainBuilder(custodian, store);
      assertEquals(count + 1, builder.append(mockFact(count + 1)).id());
      assertTrue(builder.verifyChain(1, count + 1).isClean());
    }
  }
  
  
  @Test
  public void testDeclareTwice() throws Exception {
    final Object label = new Object() {  };
    try (var store = declareNewInstance(label)) {
      var con = SqlTestHarness.newDatabase(tempDir, "testDeclareTwice");
      try {
        assertThrows(
            SqlLedgerException.class,
            () -> SqlLedgerStore.declareNewInstance(con, SqlTestHarness.newSchema()));
      } finally {
        con.close();
      }
    }
  }
  
  
  @Test
  public void testNoTable() throws Exception {
    var con = SqlTestHarness.newDatabase(tempDir, "testNoTable");
    try {
      assertThrows(
          SqlLedgerException.class,
          () -> new SqlLedgerStore(SqlTestHarness.newSchema(), con));
    } finally {
      con.close();
    }
  }
  
  
  /** Opens a second store on the given database, thru its own connection. */
  private SqlLedgerStore openSecond(String dbName) throws Exception {
    var con = SqlTestHarness.newDatabase(tempDir, dbName);
    return new SqlLedgerStore(SqlTestHarness.newSchema(), con);
  }
  
  
  @Test
  public void testTwoWritersDistinct() throws Exception {
    final Object label = new Object() {  };
    final int threads = 32;
    var custodian = KeyCustodian.generate();
    
    try (var first = declareNewInstance(label);
         var second = openSecond("testTwoWritersDistinct")) {
      
      var builders = new ChainBuilder[] {
          new ChainBuilder(custodian, first),
          new ChainBuilder(custodian, second),
      };
      
      List<Future<SignatureRecord>> results =
          runConcurrently(threads, index -> builders[index % 2].append(mockFact(index)));
      
      var ids = new HashSet<Long>();
      for (var result : results)
        ids.add(result.get().id());
      assertEquals(threads, ids.size());
      assertEquals(threads, first.size());
      assertEquals(threads, second.size());
      
      var prevHashes = new HashSet<String>();
      for (var record : second.range(1, threads)) {
        if (record.id() == 1)
          assertTrue(record.isGenesis());
        else
          assertTrue(prevHashes.add(Base64.getEncoder().encodeToString(record.prevHash().get())));
      }
      assertEquals(threads - 1, prevHashes.size());
      assertTrue(builders[0].verifyChain(1, threads).isClean());
      
      // both instances see the same rows
      assertEquals(first.range(1, threads), second.range(1, threads));
    }
  }
  
  
  @Test
  public void testTwoWritersSamePair() throws Exception {
    final Object label = new Object() {  };
    final int threads = 16;
    var custodian = KeyCustodian.generate();
    
    try (var first = declareNewInstance(label);
         var second = openSecond("testTwoWritersSamePair")) {
      
      var builders = new ChainBuilder[] {
          new ChainBuilder(custodian, first),
          new ChainBuilder(custodian, second),
      };
      var fact = new AttestationFact("doc-1", "alice", "alice@example.com", MOCK_SIGNED_AT);
      
      List<Future<SignatureRecord>> results =
          runConcurrently(threads, index -> builders[index % 2].append(fact));
      
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
      assertEquals(1, first.size());
      assertEquals(1, second.size());
      assertTrue(builders[1].verifyChain(1, 1).isClean());
    }
  }
  
  
  @Test
  public void testTwoWritersInterleaved() throws Exception {
    final Object label = new Object() {  };
    var custodian = KeyCustodian.generate();
    
    try (var first = declareNewInstance(label);
         var second = openSecond("testTwoWritersInterleaved")) {
      
      var a = new ChainBuilder(custodian, first);
      var b = new ChainBuilder(custodian, second);
      assertEquals(1, a.append(mockFact(1)).id());
      var record = b.append(mockFact(2));
      assertEquals(2, record.id());
      assertArrayEquals(first.findById(1).get().payloadHash(), record.prevHash().get());
      assertEquals(3, a.append(mockFact(3)).id());
      assertTrue(b.verifyChain(1, 3).isClean());
    }
  }
  
  
  /**
   * Returns a connection that throws an unchecked exception on its first
   * {@code commit()}.
   */
  private static Connection failFirstCommit(Connection con) {
    var failed = new AtomicBoolean();
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[] { Connection.class },
        (proxy, method, args) -> {
          if (method.getName().equals("commit") && failed.compareAndSet(false, true))
            throw new IllegalStateException("commit failure");
          try {
            return method.invoke(con, args);
          } catch (InvocationTargetException itx) {
            throw itx.getCause();
          }
        });
  }
  
  
  @Test
  public void testUncheckedFailureRollsBack() throws Exception {
    final Object label = new Object() {  };
    final String dbName = "testUncheckedFailureRollsBack";
    declareNewInstance(label).close();
    
    var con = failFirstCommit(SqlTestHarness.newDatabase(tempDir, dbName));
    try (var store = new SqlLedgerStore(SqlTestHarness.newSchema(), con);
         var observer = openSecond(dbName)) {
      
      var builder = new ChainBuilder(KeyCustodian.generate(), store);
      assertThrows(IllegalStateException.class, () -> builder.append(mockFact(1)));
      assertEquals(0, store.size());
      
      var record = builder.append(mockFact(2));
      assertEquals(1, record.id());
      assertTrue(record.isGenesis());
      assertEquals(1, observer.size());
      assertTrue(observer.find("doc-1", "user-1").isEmpty());
      assertTrue(builder.verifyChain(1, 1).isClean());
    }
  }

}
