/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.lang.System.Logger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Library constants.
 */
public class LedgerConstants {
  // no-one calls
  private LedgerConstants() {  }
  
  
  /** Logger name used across the library. */
  public final static String LOG_NAME = "io.crums.ackl";
  
  /**
   * Returns the library's logger.
   */
  public static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  /** Payload hash algorithm. */
  public final static String HASH_ALGO = "SHA-256";
  
  /** Payload hash width in bytes (32). */
  public final static int HASH_WIDTH = 32;
  
  /** Ed25519 signature width in bytes (64). */
  public final static int SIGNATURE_WIDTH = 64;
  
  /** Ed25519 public key width in bytes (32). */
  public final static int PUBLIC_KEY_WIDTH = 32;
  
  /** Ed25519 seed (private key) width in bytes (32). */
  public final static int SEED_WIDTH = 32;
  
  /**
   * Width of the persisted signing secret: the seed followed by
   * its public key (64 bytes).
   */
  public final static int SECRET_WIDTH = SEED_WIDTH + PUBLIC_KEY_WIDTH;
  
  /** Number of random bytes in a generated nonce (16). */
  public final static int NONCE_BYTES = 16;
  
  
  /**
   * Environment variable consulted for the base64-encoded signing secret,
   * if it's not otherwise configured.
   */
  public final static String KEY_ENV_VAR = "ACKL_ED25519_PRIVATE_KEY";
  
  
  /**
   * Returns a new SHA-256 digest.
   */
  public static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(HASH_ALGO);
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + HASH_ALGO, nsax);
    }
  }
  
  
  /**
   * Returns the SHA-256 hash of the given bytes.
   * 
   * @return 32 bytes
   */
  public static byte[] hash(byte[] bytes) {
    return newDigest().digest(bytes);
  }

}
