/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl;


import static io.crums.ackl.LedgerConstants.HASH_WIDTH;
import static io.crums.ackl.LedgerConstants.PUBLIC_KEY_WIDTH;
import static io.crums.ackl.LedgerConstants.SECRET_WIDTH;
import static io.crums.ackl.LedgerConstants.SEED_WIDTH;

import java.lang.System.Logger.Level;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Owns the Ed25519 signing key for the life of the process. Immutable, and
 * so may be shared across threads without synchronization.
 * 
 * <h2>Key Material</h2>
 * <p>
 * The persisted secret is 64 bytes: the 32-byte seed followed by the 32-byte
 * public key derived from it. It's configured in standard base64.
 * </p>
 * <h2>Modes</h2>
 * <ol>
 * <li><em>Persistent.</em> Loaded from a configured secret. Signatures
 * verify against the same public key across restarts.</li>
 * <li><em>Ephemeral.</em> No secret was configured, so one was generated and
 * lives only in memory. Works, but past signatures won't verify against the
 * next restart's key. A warning is logged.</li>
 * <li><em>Verify-only.</em> Built from a public key alone. Signing fails with
 * {@linkplain InvalidKeyMaterialException}.</li>
 * </ol>
 * 
 * @see #load(String)
 * @see #verifyOnly(byte[])
 */
public final class KeyCustodian {
  
  
  /**
   * Loads the key pair from the given base64-encoded secret. If the secret is
   * {@code null} or blank, then an ephemeral key pair is generated instead and
   * a warning is logged.
   * 
   * @param base64Secret  base64 encoded 64 bytes (seed + public key), or
   *                      {@code null}
   * 
   * @throws InvalidKeyMaterialException
   *         if the secret cannot be decoded, has the wrong length, or its
   *         public key does not match its seed
   */
  public static KeyCustodian load(String base64Secret)
      throws InvalidKeyMaterialException {
    
    if (base64Secret == null || base64Secret.isBlank()) {
      KeyCustodian ephemeral = newInstance(newSeed(), true);
      LedgerConstants.getLogger().log(
          Level.WARNING,
          "Ed25519 signing key not configured (set {0}): using EPHEMERAL key {1}. " +
          "Signatures made now will NOT verify against the key of a future restart.",
          LedgerConstants.KEY_ENV_VAR,
          ephemeral.publicKeyBase64());
      return ephemeral;
    }
    
    byte[] secret;
    try {
      secret = ByteEncoding.BASE64.decode(base64Secret);
    } catch (IllegalArgumentException iax) {
      throw new InvalidKeyMaterialException(
          "signing key secret is not valid base64", iax);
    }
    if (secret.length != SECRET_WIDTH)
      throw new InvalidKeyMaterialException(
          "signing key secret must decode to %d bytes; actual was %d"
          .formatted(SECRET_WIDTH, secret.length));
    
    try {
      byte[] seed = Arrays.copyOf(secret, SEED_WIDTH);
      KeyCustodian custodian = newInstance(seed, false);
      byte[] declaredPub = Arrays.copyOfRange(secret, SEED_WIDTH, SECRET_WIDTH);
      if (!MessageDigest.isEqual(declaredPub, custodian.publicKey))
        throw new InvalidKeyMaterialException(
            "public key half of signing key secret does not match its seed");
      return custodian;
    } finally {
      Arrays.fill(secret, (byte) 0);
    }
  }
  
  
  /**
   * Loads the key pair from the secret in the {@value LedgerConstants#KEY_ENV_VAR}
   * environment variable, or generates an ephemeral one, if not set.
   * 
   * @see #load(String)
   */
  public static KeyCustodian fromEnvironment() throws InvalidKeyMaterialException {
    return load(System.getenv(LedgerConstants.KEY_ENV_VAR));
  }
  
  
  /**
   * Generates a new key pair with no warning. Intended for minting a
   * secret to be persisted (see {@linkplain #exportSecret()}), and for tests.
   */
  public static KeyCustodian generate() {
    return newInstance(newSeed(), false);
  }
  
  
  /**
   * Returns a custodian that can only verify.
   * 
   * @param publicKey 32-byte Ed25519 public key
   * 
   * @throws InvalidKeyMaterialException
   *         if not 32 bytes, or not a valid curve point
   */
  public static KeyCustodian verifyOnly(byte[] publicKey)
      throws InvalidKeyMaterialException {
    
    if (Objects.requireNonNull(publicKey, "null publicKey").length != PUBLIC_KEY_WIDTH)
      throw new InvalidKeyMaterialException(
          "public key must be %d bytes; actual was %d"
          .formatted(PUBLIC_KEY_WIDTH, publicKey.length));
    try {
      return new KeyCustodian(null, new Ed25519PublicKeyParameters(publicKey, 0), false);
    } catch (IllegalArgumentException iax) {
      throw new InvalidKeyMaterialException("invalid Ed25519 public key", iax);
    }
  }
  
  
  /**
   * Returns a custodian that can only verify.
   * 
   * @param base64PublicKey base64-encoded 32-byte Ed25519 public key
   * 
   * @see #verifyOnly(byte[])
   */
  public static KeyCustodian verifyOnly(String base64PublicKey)
      throws InvalidKeyMaterialException {
    byte[] publicKey;
    try {
      publicKey = ByteEncoding.BASE64.decode(base64PublicKey);
    } catch (IllegalArgumentException iax) {
      throw new InvalidKeyMaterialException("public key is not valid base64", iax);
    }
    return verifyOnly(publicKey);
  }
  
  
  /**
   * Verifies an Ed25519 signature over a payload hash. Does not throw on
   * bad input; returns {@code false} instead.
   * 
   * @param publicKey   32-byte public key
   * @param hash        the signed payload hash
   * @param signature   64-byte signature
   */
  public static boolean verify(byte[] publicKey, byte[] hash, byte[] signature) {
    if (publicKey == null || publicKey.length != PUBLIC_KEY_WIDTH)
      return false;
    Ed25519PublicKeyParameters pub;
    try {
      pub = new Ed25519PublicKeyParameters(publicKey, 0);
    } catch (IllegalArgumentException iax) {
      return false;
    }
    return verify(pub, hash, signature);
  }
  
  
  private static boolean verify(
      Ed25519PublicKeyParameters pub, byte[] hash, byte[] signature) {
    if (hash == null || signature == null ||
        signature.length != LedgerConstants.SIGNATURE_WIDTH)
      return false;
    var verifier = new Ed25519Signer();
    verifier.init(false, pub);
    verifier.update(hash, 0, hash.length);
    return verifier.verifySignature(signature);
  }
  
  
  
  private static byte[] newSeed() {
    byte[] seed = new byte[SEED_WIDTH];
    new SecureRandom().nextBytes(seed);
    return seed;
  }
  
  
  private static KeyCustodian newInstance(byte[] seed, boolean ephemeral) {
    var priv = new Ed25519PrivateKeyParameters(seed, 0);
    Arrays.fill(seed, (byte) 0);
    return new KeyCustodian(priv, priv.generatePublicKey(), ephemeral);
  }
  
  
  
  
  //   I N S T A N C E    M E M B E R S
  
  
  private final Ed25519PrivateKeyParameters privateKey;
  private final Ed25519PublicKeyParameters pubParams;
  private final byte[] publicKey;
  private final boolean ephemeral;
  
  
  private KeyCustodian(
      Ed25519PrivateKeyParameters privateKey,
      Ed25519PublicKeyParameters pubParams,
      boolean ephemeral) {
    this.privateKey = privateKey;
    this.pubParams = pubParams;
    this.publicKey = pubParams.getEncoded();
    this.ephemeral = ephemeral;
  }
  
  
  /**
   * Signs the given payload hash.
   * 
   * @param hash  32-byte payload hash
   * @return      64-byte Ed25519 signature
   * 
   * @throws IllegalArgumentException if {@code hash} is empty or not 32 bytes
   * @throws InvalidKeyMaterialException if this instance is verify-only
   */
  public byte[] sign(byte[] hash) throws InvalidKeyMaterialException {
    if (Objects.requireNonNull(hash, "null hash").length == 0)
      throw new IllegalArgumentException("empty hash");
    if (hash.length != HASH_WIDTH)
      throw new IllegalArgumentException(
          "expected %d-byte hash; actual was %d bytes".formatted(HASH_WIDTH, hash.length));
    if (privateKey == null)
      throw new InvalidKeyMaterialException(
          "verify-only key custodian: no private key to sign with");
    
    var signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(hash, 0, hash.length);
    return signer.generateSignature();
  }
  
  
  /**
   * Verifies the given signature against this instance's public key.
   * 
   * @see #verify(byte[], byte[], byte[])
   */
  public boolean verify(byte[] hash, byte[] signature) {
    return verify(pubParams, hash, signature);
  }
  
  
  /**
   * Returns the 32-byte public key (a copy).
   */
  public byte[] publicKey() {
    return publicKey.clone();
  }
  
  
  /**
   * Returns the public key in standard base64.
   */
  public String publicKeyBase64() {
    return ByteEncoding.BASE64.encode(publicKey);
  }
  
  
  /** Returns {@code true} iff this instance holds a private key. */
  public boolean canSign() {
    return privateKey != null;
  }
  
  
  /**
   * Returns {@code true} iff the key was generated in lieu of a configured one.
   * 
   * @see #load(String)
   */
  public boolean isEphemeral() {
    return ephemeral;
  }
  
  
  /**
   * Returns the base64-encoded 64-byte secret (seed + public key) this
   * instance can be {@linkplain #load(String) load}ed from. <em>Secret!</em>
   * 
   * @throws InvalidKeyMaterialException if this instance is verify-only
   */
  public String exportSecret() throws InvalidKeyMaterialException {
    if (privateKey == null)
      throw new InvalidKeyMaterialException("verify-only key custodian");
    byte[] secret = new byte[SECRET_WIDTH];
    privateKey.encode(secret, 0);
    System.arraycopy(publicKey, 0, secret, SEED_WIDTH, PUBLIC_KEY_WIDTH);
    try {
      return ByteEncoding.BASE64.encode(secret);
    } finally {
      Arrays.fill(secret, (byte) 0);
    }
  }
  
  
  @Override
  public String toString() {
    return
        KeyCustodian.class.getSimpleName() + "[" + publicKeyBase64() +
        (privateKey == null ? ", verify-only" : ephemeral ? ", ephemeral" : "") +
        "]";
  }

}
