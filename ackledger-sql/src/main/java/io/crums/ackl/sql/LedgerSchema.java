/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import io.crums.ackl.ByteEncoding;
import io.crums.ackl.LedgerConstants;

/**
 * Schema for the SQL TABLE backing a {@linkplain SqlLedgerStore}.
 * 
 * <h2>Schema</h2>
 * <p>
 * One table, one row per signature record.
 * </p>
 * <pre>
 * 
 * {@code CREATE TABLE} <em>table</em>
 *  {@code (id BIGINT NOT NULL,
 *   subject_id VARCHAR NOT NULL,
 *   signer_id VARCHAR NOT NULL,
 *   signer_email VARCHAR NOT NULL,
 *   signer_name VARCHAR,
 *   signed_at VARCHAR(40) NOT NULL,
 *   nonce VARCHAR(64) NOT NULL,
 *   subject_checksum VARCHAR,
 *   payload_hash VARCHAR(44) NOT NULL,
 *   signature VARCHAR(88) NOT NULL,
 *   prev_hash VARCHAR(44),
 *   created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
 *   PRIMARY KEY (id),
 *   UNIQUE (subject_id, signer_id),
 *   UNIQUE (nonce),
 *   UNIQUE (prev_hash)
 *  )}
 * </pre>
 * <h3>Rationale</h3>
 * <ol>
 * <li>{@code id} <em>not</em> auto-generated. It's assigned by the application
 * as the tail's id plus one, in the same transaction that reads the tail. Two
 * inserts that read the same tail collide on the primary key (and on
 * {@code prev_hash}), so the chain cannot fork.</li>
 * <li>Hash and signature columns hold standard base64 (44 and 88 chars). More
 * readable than binary types, and portable.</li>
 * <li>{@code signed_at} holds the timestamp's canonical text, exactly as
 * hashed. Re-encoding is then byte-exact regardless of the database's
 * timestamp precision.</li>
 * <li>{@code created_at} is set by the database and write-once: a
 * {@code BEFORE UPDATE} trigger rejects any change to it.</li>
 * </ol>
 * <p>
 * Only one secondary index ({@code signer_id}) is declared; the subject lookups
 * use the unique constraint's index.
 * </p>
 * 
 * @see Dialect
 */
public class LedgerSchema {
  
  public final static String DEFAULT_TABLE = "signatures";
  
  public final static String ID = "id";
  public final static String SUBJECT_ID = "subject_id";
  public final static String SIGNER_ID = "signer_id";
  public final static String SIGNER_EMAIL = "signer_email";
  public final static String SIGNER_NAME = "signer_name";
  public final static String SIGNED_AT = "signed_at";
  public final static String NONCE = "nonce";
  public final static String SUBJECT_CHECKSUM = "subject_checksum";
  public final static String PAYLOAD_HASH = "payload_hash";
  public final static String SIGNATURE = "signature";
  public final static String PREV_HASH = "prev_hash";
  public final static String CREATED_AT = "created_at";
  
  /** Columns in select order. */
  public final static List<String> COLUMNS = List.of(
      ID,
      SUBJECT_ID,
      SIGNER_ID,
      SIGNER_EMAIL,
      SIGNER_NAME,
      SIGNED_AT,
      NONCE,
      SUBJECT_CHECKSUM,
      PAYLOAD_HASH,
      SIGNATURE,
      PREV_HASH,
      CREATED_AT);
  
  
  private final static Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
  
  private final static int HASH_CHARS =
      ByteEncoding.BASE64.length(LedgerConstants.HASH_WIDTH);
  private final static int SIG_CHARS =
      ByteEncoding.BASE64.length(LedgerConstants.SIGNATURE_WIDTH);
  
  
  
  private final String table;
  private final Dialect dialect;
  
  
  /**
   * Creates an H2 instance with the {@linkplain #DEFAULT_TABLE default} table name.
   */
  public LedgerSchema() {
    this(DEFAULT_TABLE, Dialect.H2);
  }
  
  
  /**
   * @param table     unquoted SQL identifier
   * @param dialect   determines the trigger DDL
   */
  public LedgerSchema(String table, Dialect dialect) {
    this.table = Objects.requireNonNull(table, "null table").strip();
    this.dialect = Objects.requireNonNull(dialect, "null dialect");
    if (!TABLE_NAME.matcher(this.table).matches())
      throw new IllegalArgumentException("illegal table name: " + table);
  }
  
  
  public String getTable() {
    return table;
  }
  
  
  public Dialect getDialect() {
    return dialect;
  }
  
  
  /**
   * Returns the comma-separated column list, in {@linkplain #COLUMNS} order.
   */
  public String columnList() {
    return String.join(", ", COLUMNS);
  }
  
  
  public String getTableSchema() {
    return
        "CREATE TABLE " + table + " (\n" +
        "  " + ID + " BIGINT NOT NULL,\n" +
        "  " + SUBJECT_ID + " VARCHAR(1024) NOT NULL,\n" +
        "  " + SIGNER_ID + " VARCHAR(1024) NOT NULL,\n" +
        "  " + SIGNER_EMAIL + " VARCHAR(1024) NOT NULL,\n" +
        "  " + SIGNER_NAME + " VARCHAR(1024),\n" +
        "  " + SIGNED_AT + " VARCHAR(40) NOT NULL,\n" +
        "  " + NONCE + " VARCHAR(128) NOT NULL,\n" +
        "  " + SUBJECT_CHECKSUM + " VARCHAR(1024),\n" +
        "  " + PAYLOAD_HASH + " VARCHAR(" + HASH_CHARS + ") NOT NULL,\n" +
        "  " + SIGNATURE + " VARCHAR(" + SIG_CHARS + ") NOT NULL,\n" +
        "  " + PREV_HASH + " VARCHAR(" + HASH_CHARS + "),\n" +
        "  " + CREATED_AT + " TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL,\n" +
        "  CONSTRAINT " + table + "_pk PRIMARY KEY (" + ID + "),\n" +
        "  CONSTRAINT " + table + "_subject_signer_uq UNIQUE (" + SUBJECT_ID + ", " + SIGNER_ID + "),\n" +
        "  CONSTRAINT " + table + "_nonce_uq UNIQUE (" + NONCE + "),\n" +
        "  CONSTRAINT " + table + "_prev_hash_uq UNIQUE (" + PREV_HASH + ")\n" +
        ")";
  }
  
  
  public String getSignerIndexSchema() {
    return
        "CREATE INDEX " + table + "_signer_idx ON " + table + " (" + SIGNER_ID + ")";
  }
  
  
  /**
   * Returns the name of the write-once {@code created_at} trigger.
   */
  public String getTriggerName() {
    return table + "_created_at_guard";
  }
  
  
  /**
   * Returns the statements that install the write-once {@code created_at}
   * trigger, in order.
   */
  public List<String> getTriggerSchema() {
    switch (dialect) {
    case H2:
      return List.of(
          "CREATE TRIGGER " + getTriggerName() +
          " BEFORE UPDATE ON " + table +
          " FOR EACH ROW CALL '" + CreatedAtGuard.class.getName() + "'");
    case POSTGRESQL:
      String function = table + "_prevent_created_at_update";
      return List.of(
          "CREATE OR REPLACE FUNCTION " + function + "()\n" +
          "RETURNS TRIGGER AS $$\n" +
          "BEGIN\n" +
          "  IF OLD." + CREATED_AT + " IS DISTINCT FROM NEW." + CREATED_AT + " THEN\n" +
          "    RAISE EXCEPTION '" + CreatedAtGuard.MESSAGE + "';\n" +
          "  END IF;\n" +
          "  RETURN NEW;\n" +
          "END;\n" +
          "$$ LANGUAGE plpgsql",
          "CREATE TRIGGER " + getTriggerName() +
          " BEFORE UPDATE ON " + table +
          " FOR EACH ROW EXECUTE FUNCTION " + function + "()");
    default:
      throw new AssertionError("unhandled dialect: " + dialect);
    }
  }
  
  
  /**
   * Returns all the DDL statements, in order.
   */
  public List<String> getSchemaStatements() {
    var statements = new ArrayList<String>();
    statements.add(getTableSchema());
    statements.add(getSignerIndexSchema());
    statements.addAll(getTriggerSchema());
    return statements;
  }
  
  
  @Override
  public String toString() {
    return LedgerSchema.class.getSimpleName() + "[" + table + ", " + dialect + "]";
  }

}
