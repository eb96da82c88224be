/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.security.SecureRandom;
import java.util.Base64;

/**
 * Anti-replay nonce generation.
 */
public class Nonces {
  // no-one calls
  private Nonces() {  }
  
  private final static SecureRandom RANDOM = new SecureRandom();
  
  private final static Base64.Encoder ENCODER =
      Base64.getUrlEncoder().withoutPadding();
  
  /** Length of a generated nonce in chars (22). */
  public final static int NONCE_LENGTH = 22;
  
  
  /**
   * Returns a new nonce: {@linkplain LedgerConstants#NONCE_BYTES 16} bytes
   * from a {@linkplain SecureRandom}, unpadded URL-safe base64 encoded.
   * 
   * @return 22 chars
   */
  public static String generate() {
    byte[] nonce = new byte[LedgerConstants.NONCE_BYTES];
    RANDOM.nextBytes(nonce);
    return ENCODER.encodeToString(nonce);
  }

}
