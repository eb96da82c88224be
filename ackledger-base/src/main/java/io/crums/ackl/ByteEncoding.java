/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import java.util.Base64;
import java.util.HexFormat;

/**
 * ASCII encodings for hashes, signatures and keys.
 */
public enum ByteEncoding {
  /**
   * Standard (padded) base64. 44 chars represent a 32-byte hash;
   * 88 chars, a 64-byte signature. This is the stored form.
   */
  BASE64,
  /**
   * Lowercase hexadecimal.
   */
  HEX;
  
  
  /**
   * Returns the given bytes in encoded form.
   */
  public String encode(byte[] bytes) {
    return
        this == HEX ?
            HexFormat.of().formatHex(bytes) :
            Base64.getEncoder().encodeToString(bytes);
  }
  
  
  /**
   * Decodes the given string.
   * 
   * @throws IllegalArgumentException if malformed
   */
  public byte[] decode(CharSequence encoded) {
    String str = encoded.toString().strip();
    return
        this == HEX ?
            HexFormat.of().parseHex(str) :
            Base64.getDecoder().decode(str);
  }
  
  
  /**
   * Decodes the given string and checks its length.
   * 
   * @param width expected number of bytes
   * 
   * @throws IllegalArgumentException if malformed or not {@code width} bytes
   */
  public byte[] decode(CharSequence encoded, int width) {
    byte[] bytes = decode(encoded);
    if (bytes.length != width)
      throw new IllegalArgumentException(
          "expected %d bytes; decoded %d from '%s'"
          .formatted(width, bytes.length, encoded));
    return bytes;
  }
  
  
  /**
   * Length of the ASCII string representing the given number of bytes.
   */
  public int length(int width) {
    return this == HEX ? width * 2 : ((width + 2) / 3) * 4;
  }

}
