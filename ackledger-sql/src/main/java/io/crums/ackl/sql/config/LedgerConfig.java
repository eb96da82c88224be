/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql.config;


import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import io.crums.ackl.ChainVerifier;
import io.crums.ackl.InvalidKeyMaterialException;
import io.crums.ackl.KeyCustodian;
import io.crums.ackl.LedgerConstants;
import io.crums.ackl.sql.Dialect;
import io.crums.ackl.sql.LedgerSchema;

/**
 * Ledger configuration.
 *
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Every property
 * is prefixed with {@value #ROOT}.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * The signing key file may be specified in either absolute or relative form.
 * Relative paths are resolved relative to the location of the configuration
 * file.
 * </p>
 * <h3>Signing Key</h3>
 * <p>
 * The signing key is looked up in the following order:
 * </p>
 * <ol>
 * <li>{@value #SIGNING_KEY} (the base64 secret itself),</li>
 * <li>{@value #SIGNING_KEY_FILE} (a file containing the secret),</li>
 * <li>the {@value LedgerConstants#KEY_ENV_VAR} environment variable.</li>
 * </ol>
 * <p>
 * If none is set, then {@value #VERIFY_KEY} (a public key) makes for a
 * verify-only deployment. Failing that, an ephemeral key is generated (with
 * a logged warning).
 * </p>
 */
public class LedgerConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "ackl.";

  /**
   * The name of the base directory path. <em>This value should not be set in the properties file.</em>
   * It is set dynamically to the parent directory of the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /**
   * The name of the JDBC connection URL to the database the ledger lives in. Required property.
   */
  public final static String JDBC_URL = ROOT + "jdbc.url";
  /**
   * The name of the fully-qualified classname of the JDBC driver. If not provided, then it's
   * assumed a suitable driver is already registered for the given {@linkplain #JDBC_URL} value.
   */
  public final static String JDBC_DRIVER = ROOT + "jdbc.driver";
  public final static String JDBC_USERNAME = ROOT + "jdbc.username";
  public final static String JDBC_PASSWORD = ROOT + "jdbc.password";
  /**
   * The name of the ledger table. Defaults to {@value LedgerSchema#DEFAULT_TABLE}.
   */
  public final static String TABLE = ROOT + "table";
  /**
   * {@code H2} or {@code POSTGRESQL}. Inferred from the JDBC URL, if not set.
   */
  public final static String DIALECT = ROOT + "dialect";
  /**
   * Base64 encoded 64-byte signing key secret (seed followed by public key).
   */
  public final static String SIGNING_KEY = ROOT + "signing.key";
  /**
   * Path to a file containing the signing key secret.
   */
  public final static String SIGNING_KEY_FILE = ROOT + "signing.key.file";
  /**
   * Base64 encoded 32-byte public key, for verify-only deployments.
   */
  public final static String VERIFY_KEY = ROOT + "verify.key";


  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      JDBC_URL,
      JDBC_DRIVER,
      JDBC_USERNAME,
      JDBC_PASSWORD,
      TABLE,
      DIALECT,
      SIGNING_KEY,
      SIGNING_KEY_FILE,
      VERIFY_KEY);


  private static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getPath());
    return props;
  }



  private final File baseDir;
  private final DbConnection dbConnection;
  private final LedgerSchema schema;

  private final String signingKey;
  private final File signingKeyFile;
  private final String verifyKey;

  private final Map<String, String> env;


  /**
   * Loads the configuration from the given properties file.
   */
  public LedgerConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }

  /**
   * Creates an instance using the given properties and the process environment.
   * If {@value #BASE_DIR} is not set, relative paths are resolved against the
   * current working directory.
   */
  public LedgerConfig(Properties props) {
    this(props, System.getenv());
  }

  /**
   * @param props   configuration properties
   * @param env     environment variables (for the signing key fallback)
   */
  LedgerConfig(Properties props, Map<String, String> env) {
    this.env = Objects.requireNonNull(env, "null env");
    this.baseDir = getBaseDir(props);

    String url = trimmed(props, JDBC_URL);
    enforceRequired(JDBC_URL, url);

    String username = trimmed(props, JDBC_USERNAME);
    String password = props.getProperty(JDBC_PASSWORD);
    if (!isSet(username) && isSet(password))
      throw new IllegalArgumentException(JDBC_PASSWORD + " set while " + JDBC_USERNAME + " is not");

    try {
      this.dbConnection = new DbConnection(
          url,
          trimmed(props, JDBC_DRIVER),
          isSet(username) ? new DbCredentials(username, password) : null);
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(JDBC_URL + ": " + iax.getMessage(), iax);
    }

    String dialectName = trimmed(props, DIALECT);
    Dialect dialect;
    try {
      dialect = isSet(dialectName) ? Dialect.forName(dialectName) : Dialect.forUrl(url);
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(
          DIALECT + ": " + (isSet(dialectName) ? dialectName : iax.getMessage()), iax);
    }

    String table = trimmed(props, TABLE);
    try {
      this.schema = new LedgerSchema(isSet(table) ? table : LedgerSchema.DEFAULT_TABLE, dialect);
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(TABLE + ": " + table, iax);
    }

    this.signingKey = trimmed(props, SIGNING_KEY);
    String keyPath = trimmed(props, SIGNING_KEY_FILE);
    if (isSet(this.signingKey) && isSet(keyPath))
      throw new IllegalArgumentException(
          "only one of " + SIGNING_KEY + " and " + SIGNING_KEY_FILE + " may be set");
    this.signingKeyFile = isSet(keyPath) ? resolve(keyPath) : null;

    this.verifyKey = trimmed(props, VERIFY_KEY);
  }


  private File getBaseDir(Properties props) {
    String baseDir = props.getProperty(BASE_DIR);
    File base = new File(isSet(baseDir) ? baseDir : ".");
    if (!base.isDirectory())
      throw new IllegalArgumentException(BASE_DIR + ": " + baseDir + " not a directory");
    return base.getAbsoluteFile();
  }


  private File resolve(String path) {
    File file = new File(path);
    return file.isAbsolute() ? file : new File(baseDir, path);
  }


  private static String trimmed(Properties props, String name) {
    String value = props.getProperty(name);
    return value == null ? null : value.strip();
  }


  private void enforceRequired(String name, String value) {
    if (!isSet(value))
      throw new IllegalArgumentException("required property not set: " + name);
  }


  private static boolean isSet(String value) {
    return value != null && !value.isEmpty();
  }



  public File getBaseDir() {
    return baseDir;
  }


  public DbConnection getDbConnection() {
    return dbConnection;
  }


  public LedgerSchema getSchema() {
    return schema;
  }


  /**
   * Returns the signing key file, if configured.
   */
  public Optional<File> getSigningKeyFile() {
    return Optional.ofNullable(signingKeyFile);
  }


  /**
   * Returns the configured signing key secret (base64), if any. Checks the
   * properties, then the key file, then the environment.
   *
   * @throws IllegalArgumentException if the key file cannot be read
   */
  public Optional<String> getSigningSecret() {
    if (isSet(signingKey))
      return Optional.of(signingKey);
    if (signingKeyFile != null) {
      try {
        return Optional.of(
            Files.readString(signingKeyFile.toPath(), StandardCharsets.US_ASCII).strip());
      } catch (IOException iox) {
        throw new IllegalArgumentException(
            SIGNING_KEY_FILE + ": failed to read " + signingKeyFile, iox);
      }
    }
    return Optional.ofNullable(env.get(LedgerConstants.KEY_ENV_VAR))
        .map(String::strip).filter(s -> !s.isEmpty());
  }


  /**
   * Returns {@code true} iff a signing or verify key is configured.
   */
  public boolean hasKey() {
    return getSigningSecret().isPresent() || isSet(verifyKey);
  }


  /**
   * Returns the key custodian. If no signing secret is configured, then
   * the instance is verify-only if {@value #VERIFY_KEY} is set; ephemeral,
   * otherwise.
   *
   * @throws InvalidKeyMaterialException if the configured key is malformed
   */
  public KeyCustodian getKeyCustodian() throws InvalidKeyMaterialException {
    var secret = getSigningSecret();
    if (secret.isPresent()) {
      var custodian = KeyCustodian.load(secret.get());
      if (isSet(verifyKey) && !verifyKey.equals(custodian.publicKeyBase64()))
        throw new InvalidKeyMaterialException(
            VERIFY_KEY + " does not match the configured signing key's public key");
      return custodian;
    }
    return isSet(verifyKey) ? KeyCustodian.verifyOnly(verifyKey) : KeyCustodian.load(null);
  }


  /**
   * Returns a chain verifier for the configured key.
   *
   * @throws IllegalStateException
   *         if no key is configured (an ephemeral key cannot verify past records)
   * @throws InvalidKeyMaterialException if the configured key is malformed
   */
  public ChainVerifier getChainVerifier() throws InvalidKeyMaterialException {
    if (!hasKey())
      throw new IllegalStateException(
          "no key configured: set " + VERIFY_KEY + ", " + SIGNING_KEY + ", " +
          SIGNING_KEY_FILE + ", or " + LedgerConstants.KEY_ENV_VAR);
    return new ChainVerifier(getKeyCustodian());
  }


  /**
   * Returns the configuration as properties. Secrets (the signing key and
   * the database password) are omitted.
   */
  public Properties getProperties() {
    Properties props = new Properties();
    props.put(BASE_DIR, baseDir.getPath());
    props.put(JDBC_URL, dbConnection.url());
    dbConnection.driverClass().ifPresent(d -> props.put(JDBC_DRIVER, d));
    dbConnection.creds().ifPresent(c -> props.put(JDBC_USERNAME, c.username()));
    props.put(TABLE, schema.getTable());
    props.put(DIALECT, schema.getDialect().name());
    if (signingKeyFile != null)
      props.put(SIGNING_KEY_FILE, signingKeyFile.getPath());
    if (isSet(verifyKey))
      props.put(VERIFY_KEY, verifyKey);
    return props;
  }

}
