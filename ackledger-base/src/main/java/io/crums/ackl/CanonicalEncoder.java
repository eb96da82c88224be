/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import static java.time.temporal.ChronoField.NANO_OF_SECOND;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Deterministic serialization of an {@linkplain AttestationFact}. The
 * encoding is the exact input to the payload hash.
 * 
 * <h2>Format</h2>
 * <p>
 * UTF-8 text, one {@code key=value} line per field, each line terminated by
 * a newline ({@code '\n'}), in this fixed order:
 * </p>
 * <pre>
 * doc_id=<em>subject id</em>
 * user_sub=<em>signer id</em>
 * user_email=<em>lower-cased, trimmed signer email</em>
 * signed_at=<em>RFC 3339 UTC timestamp</em>
 * nonce=<em>nonce</em>
 * doc_checksum=<em>subject checksum</em>   (only if present)
 * </pre>
 * <p>
 * The timestamp is always written in UTC ({@code Z} suffix). Its fractional
 * seconds carry up to 9 digits with trailing zeroes dropped; a whole second
 * has no fraction. So equal instants encode equally, regardless the zone
 * they were expressed in.
 * </p>
 * <p>
 * Stateless and side-effect free.
 * </p>
 */
public class CanonicalEncoder {
  // no-one calls
  private CanonicalEncoder() {  }
  
  
  public final static String SUBJECT_KEY = "doc_id";
  public final static String SIGNER_KEY = "user_sub";
  public final static String EMAIL_KEY = "user_email";
  public final static String SIGNED_AT_KEY = "signed_at";
  public final static String NONCE_KEY = "nonce";
  public final static String CHECKSUM_KEY = "doc_checksum";
  
  
  /**
   * RFC 3339 UTC timestamp formatter with nanosecond precision and trailing
   * zeroes in the fraction trimmed.
   */
  public final static DateTimeFormatter TIMESTAMP_FORMAT =
      new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
      .appendFraction(NANO_OF_SECOND, 0, 9, true)
      .appendLiteral('Z')
      .toFormatter(Locale.ROOT)
      .withZone(ZoneOffset.UTC);
  
  
  /**
   * Returns the canonical encoding of the given fact.
   * 
   * @param fact  with nonce set
   * 
   * @throws IllegalArgumentException if {@code fact} has no nonce
   */
  public static byte[] encode(AttestationFact fact) {
    if (!fact.hasNonce())
      throw new IllegalArgumentException("fact has no nonce: " + fact);
    
    StringBuilder payload = new StringBuilder(256);
    appendLine(payload, SUBJECT_KEY, fact.subjectId());
    appendLine(payload, SIGNER_KEY, fact.signerId());
    appendLine(payload, EMAIL_KEY, fact.normalizedEmail());
    appendLine(payload, SIGNED_AT_KEY, formatTimestamp(fact.signedAt()));
    appendLine(payload, NONCE_KEY, fact.nonce().get());
    fact.subjectChecksum().ifPresent(c -> appendLine(payload, CHECKSUM_KEY, c));
    
    return payload.toString().getBytes(StandardCharsets.UTF_8);
  }
  
  
  /**
   * Returns the SHA-256 hash of the canonical encoding of the given fact.
   * 
   * @param fact  with nonce set
   * @return 32 bytes
   */
  public static byte[] payloadHash(AttestationFact fact) {
    return LedgerConstants.hash(encode(fact));
  }
  
  
  private static void appendLine(StringBuilder payload, String key, String value) {
    payload.append(key).append('=').append(value).append('\n');
  }
  
  
  /**
   * Normalizes the given email address: surrounding whitespace is stripped,
   * and it's lower-cased.
   */
  public static String normalizeEmail(String email) {
    return email.strip().toLowerCase(Locale.ROOT);
  }
  
  
  /**
   * Returns the instant in canonical RFC 3339 form.
   * 
   * @see #TIMESTAMP_FORMAT
   */
  public static String formatTimestamp(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }
  
  
  /**
   * Parses an RFC 3339 timestamp. Any zone offset is accepted.
   * 
   * @throws IllegalArgumentException if malformed
   */
  public static Instant parseTimestamp(String timestamp) {
    try {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(timestamp, Instant::from);
    } catch (DateTimeParseException dtpx) {
      throw new IllegalArgumentException(
          "malformed timestamp: " + timestamp, dtpx);
    }
  }

}
