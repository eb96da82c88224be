/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import static org.junit.jupiter.api.Assertions.*;

import java.util.Base64;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class KeyCustodianTest {
  
  private static byte[] mockHash(long seed) {
    byte[] hash = new byte[LedgerConstants.HASH_WIDTH];
    new Random(seed).nextBytes(hash);
    return hash;
  }
  
  
  @Test
  public void testSignVerify() {
    var custodian = KeyCustodian.generate();
    assertTrue(custodian.canSign());
    assertFalse(custodian.isEphemeral());
    byte[] hash = mockHash(1);
    byte[] sig = custodian.sign(hash);
    assertEquals(LedgerConstants.SIGNATURE_WIDTH, sig.length);
    assertTrue(custodian.verify(hash, sig));
    assertTrue(KeyCustodian.verify(custodian.publicKey(), hash, sig));
    
    byte[] other = mockHash(2);
    assertFalse(custodian.verify(other, sig));
    
    sig[5] ^= 1;
    assertFalse(custodian.verify(hash, sig));
  }
  
  
  @Test
  public void testDeterministic() {
    var custodian = KeyCustodian.generate();
    byte[] hash = mockHash(3);
    assertArrayEquals(custodian.sign(hash), custodian.sign(hash));
  }
  
  
  @Test
  public void testExportLoad() {
    var custodian = KeyCustodian.generate();
    String secret = custodian.exportSecret();
    assertEquals(LedgerConstants.SECRET_WIDTH, Base64.getDecoder().decode(secret).length);
    
    var loaded = KeyCustodian.load(secret);
    assertFalse(loaded.isEphemeral());
    assertArrayEquals(custodian.publicKey(), loaded.publicKey());
    assertEquals(custodian.publicKeyBase64(), loaded.publicKeyBase64());
    
    byte[] hash = mockHash(4);
    assertTrue(custodian.verify(hash, loaded.sign(hash)));
  }
  
  
  @Test
  public void testEphemeral() {
    var a = KeyCustodian.load(null);
    var b = KeyCustodian.load("  ");
    assertTrue(a.isEphemeral());
    assertTrue(b.isEphemeral());
    assertTrue(a.canSign());
    assertNotEquals(a.publicKeyBase64(), b.publicKeyBase64());
  }
  
  
  @Test
  public void testInvalidSecret() {
    assertThrows(InvalidKeyMaterialException.class, () -> KeyCustodian.load("not base64!"));
    
    String tooShort = Base64.getEncoder().encodeToString(new byte[32]);
    assertThrows(InvalidKeyMaterialException.class, () -> KeyCustodian.load(tooShort));
    
    byte[] secret = Base64.getDecoder().decode(KeyCustodian.generate().exportSecret());
    secret[LedgerConstants.SECRET_WIDTH - 1] ^= 1;
    String mismatched = Base64.getEncoder().encodeToString(secret);
    assertThrows(InvalidKeyMaterialException.class, () -> KeyCustodian.load(mismatched));
  }
  
  
  @Test
  public void testVerifyOnly() {
    var custodian = KeyCustodian.generate();
    var verifier = KeyCustodian.verifyOnly(custodian.publicKeyBase64());
    assertFalse(verifier.canSign());
    
    byte[] hash = mockHash(5);
    assertTrue(verifier.verify(hash, custodian.sign(hash)));
    assertThrows(InvalidKeyMaterialException.class, () -> verifier.sign(hash));
    assertThrows(InvalidKeyMaterialException.class, () -> verifier.exportSecret());
    assertThrows(InvalidKeyMaterialException.class, () -> KeyCustodian.verifyOnly(new byte[31]));
  }
  
  
  @Test
  public void testRejectsBadHash() {
    var custodian = KeyCustodian.generate();
    assertThrows(IllegalArgumentException.class, () -> custodian.sign(new byte[0]));
    assertThrows(IllegalArgumentException.class, () -> custodian.sign(new byte[31]));
  }
  
  
  @Test
  public void testVerifyBadInput() {
    var custodian = KeyCustodian.generate();
    byte[] hash = mockHash(6);
    byte[] sig = custodian.sign(hash);
    assertFalse(KeyCustodian.verify(new byte[3], hash, sig));
    assertFalse(custodian.verify(hash, new byte[10]));
    assertFalse(custodian.verify(null, sig));
  }

}
