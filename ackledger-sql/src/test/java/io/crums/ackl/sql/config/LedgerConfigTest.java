/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql.config;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.ackl.InvalidKeyMaterialException;
import io.crums.ackl.KeyCustodian;
import io.crums.ackl.LedgerConstants;
import io.crums.ackl.sql.Dialect;

/**
 * 
 */
public class LedgerConfigTest {
  
  @TempDir
  Path tempDir;
  
  
  private static Properties props(String... keyValues) {
    Properties props = new Properties();
    for (int index = 0; index < keyValues.length; index += 2)
      props.setProperty(keyValues[index], keyValues[index + 1]);
    return props;
  }
  
  
  private File write(Properties props, String filename) throws Exception {
    File file = tempDir.resolve(filename).toFile();
    try (var out = new FileOutputStream(file)) {
      props.store(out, null);
    }
    return file;
  }
  
  
  @Test
  public void testMinimal() {
    var config = new LedgerConfig(
        props(LedgerConfig.JDBC_URL, "jdbc:h2:mem:minimal"), Map.of());
    assertEquals("jdbc:h2:mem:minimal", config.getDbConnection().url());
    assertTrue(config.getDbConnection().creds().isEmpty());
    assertEquals("signatures", config.getSchema().getTable());
    assertEquals(Dialect.H2, config.getSchema().getDialect());
    assertFalse(config.hasKey());
    assertTrue(config.getKeyCustodian().isEphemeral());
    assertThrows(IllegalStateException.class, config::getChainVerifier);
    assertTrue(LedgerConfig.PROP_NAMES.containsAll(config.getProperties().keySet()));
  }
  
  
  @Test
  public void testMissingUrl() {
    var iax = assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(props(LedgerConfig.TABLE, "acks"), Map.of()));
    assertTrue(iax.getMessage().contains(LedgerConfig.JDBC_URL));
  }
  
  
  @Test
  public void testBadValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(props(LedgerConfig.JDBC_URL, "http://example.com"), Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(props(LedgerConfig.JDBC_URL, "jdbc:sqlite:x.db"), Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(
            props(LedgerConfig.JDBC_URL, "jdbc:h2:mem:x", LedgerConfig.TABLE, "bad name"),
            Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(
            props(LedgerConfig.JDBC_URL, "jdbc:h2:mem:x", LedgerConfig.JDBC_PASSWORD, "secret"),
            Map.of()));
  }
  
  
  @Test
  public void testPostgres() {
    var config = new LedgerConfig(
        props(
            LedgerConfig.JDBC_URL, "jdbc:postgresql://db:5432/ackl",
            LedgerConfig.JDBC_DRIVER, "org.postgresql.Driver",
            LedgerConfig.JDBC_USERNAME, "ackl",
            LedgerConfig.JDBC_PASSWORD, "s3cret",
            LedgerConfig.TABLE, "acks"),
        Map.of());
    assertEquals(Dialect.POSTGRESQL, config.getSchema().getDialect());
    assertEquals("ackl", config.getDbConnection().creds().get().username());
    assertEquals("s3cret", config.getDbConnection().creds().get().password());
    assertFalse(config.getProperties().containsKey(LedgerConfig.JDBC_PASSWORD));
    assertFalse(config.getDbConnection().creds().get().toString().contains("s3cret"));
  }
  
  
  @Test
  public void testSigningKeyProperty() {
    var custodian = KeyCustodian.generate();
    var config = new LedgerConfig(
        props(
            LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
            LedgerConfig.SIGNING_KEY, custodian.exportSecret()),
        Map.of());
    assertTrue(config.hasKey());
    assertEquals(custodian.publicKeyBase64(), config.getKeyCustodian().publicKeyBase64());
    assertArrayEquals(custodian.publicKey(), config.getChainVerifier().publicKey());
    assertFalse(config.getProperties().containsKey(LedgerConfig.SIGNING_KEY));
  }
  
  
  @Test
  public void testRelativeKeyFile() throws Exception {
    var custodian = KeyCustodian.generate();
    Files.createDirectory(tempDir.resolve("keys"));
    Files.writeString(
        tempDir.resolve("keys/ledger.key"), custodian.exportSecret() + "\n",
        StandardCharsets.US_ASCII);
    
    File file = write(
        props(
            LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
            LedgerConfig.SIGNING_KEY_FILE, "keys/ledger.key"),
        "ackl.properties");
    
    var config = new LedgerConfig(file);
    assertEquals(tempDir.toFile().getAbsoluteFile(), config.getBaseDir());
    assertEquals(
        tempDir.resolve("keys/ledger.key").toFile().getAbsoluteFile(),
        config.getSigningKeyFile().get());
    assertEquals(custodian.publicKeyBase64(), config.getKeyCustodian().publicKeyBase64());
  }
  
  
  @Test
  public void testMissingKeyFile() throws Exception {
    var config = new LedgerConfig(
        props(
            LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
            LedgerConfig.BASE_DIR, tempDir.toString(),
            LedgerConfig.SIGNING_KEY_FILE, "nope.key"),
        Map.of());
    assertThrows(IllegalArgumentException.class, config::getKeyCustodian);
  }
  
  
  @Test
  public void testEnvironmentFallback() {
    var custodian = KeyCustodian.generate();
    var config = new LedgerConfig(
        props(LedgerConfig.JDBC_URL, "jdbc:h2:mem:x"),
        Map.of(LedgerConstants.KEY_ENV_VAR, custodian.exportSecret()));
    assertFalse(config.getKeyCustodian().isEphemeral());
    assertEquals(custodian.publicKeyBase64(), config.getKeyCustodian().publicKeyBase64());
  }
  
  
  @Test
  public void testVerifyOnly() {
    var custodian = KeyCustodian.generate();
    var config = new LedgerConfig(
        props(
            LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
            LedgerConfig.VERIFY_KEY, custodian.publicKeyBase64()),
        Map.of());
    assertTrue(config.hasKey());
    assertFalse(config.getKeyCustodian().canSign());
    assertArrayEquals(custodian.publicKey(), config.getChainVerifier().publicKey());
  }
  
  
  @Test
  public void testMismatchedVerifyKey() {
    var config = new LedgerConfig(
        props(
            LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
            LedgerConfig.SIGNING_KEY, KeyCustodian.generate().exportSecret(),
            LedgerConfig.VERIFY_KEY, KeyCustodian.generate().publicKeyBase64()),
        Map.of());
    assertThrows(InvalidKeyMaterialException.class, config::getKeyCustodian);
  }
  
  
  @Test
  public void testBothKeySources() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LedgerConfig(
            props(
                LedgerConfig.JDBC_URL, "jdbc:h2:mem:x",
                LedgerConfig.SIGNING_KEY, "abc",
                LedgerConfig.SIGNING_KEY_FILE, "x.key"),
            Map.of()));
  }

}
