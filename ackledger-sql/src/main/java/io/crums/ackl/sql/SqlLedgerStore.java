/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.sql;


import static io.crums.ackl.sql.LedgerSchema.*;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.ackl.AlreadyAcknowledgedException;
import io.crums.ackl.ByteEncoding;
import io.crums.ackl.CanonicalEncoder;
import io.crums.ackl.LedgerConstants;
import io.crums.ackl.LedgerStore;
import io.crums.ackl.PendingRecord;
import io.crums.ackl.ReplayedNonceException;
import io.crums.ackl.SignatureRecord;

/**
 * A {@linkplain LedgerStore} that lives in an SQL database.
 *
 * <h2>Concurrency</h2>
 * <p>
 * An instance owns a single JDBC connection, and access to it is serialized.
 * {@linkplain #insertLinked(PendingRecord)} reads the tail, inserts the new row
 * with {@code id = tail + 1} and {@code prev_hash = tail.payload_hash}, and
 * commits, all under the same lock. Across processes (or instances), the
 * primary key and the unique {@code prev_hash} constraint reject a second
 * insert on the same tail; the loser's transaction is rolled back.
 * </p>
 *
 * @see LedgerSchema
 */
public class SqlLedgerStore implements LedgerStore {

  /**
   * Creates the backing table (and its trigger) and returns a new instance.
   *
   * @param con       db connection (read/write)
   * @param schema    table name and dialect
   */
  public static SqlLedgerStore declareNewInstance(Connection con, LedgerSchema schema) {
    Objects.requireNonNull(schema, "null schema");
    try {
      if (con.getAutoCommit())
        con.setAutoCommit(false);

      try (Statement stmt = con.createStatement()) {
        for (String sql : schema.getSchemaStatements())
          stmt.execute(sql);
      }
      con.commit();

      LedgerConstants.getLogger().log(Level.INFO, "created ledger table {0}", schema);

      return new SqlLedgerStore(schema, con);

    } catch (SQLException sqx) {
      rollback(con, "declareNewInstance(" + schema + ")");
      throw new SqlLedgerException("on declareNewInstance(" + schema + "): " + sqx, sqx);
    }
  }



  private static boolean rollback(Connection con, String op) {
    try {
      con.rollback();
      return true;
    } catch (SQLException sqx) {
      LedgerConstants.getLogger().log(
          Level.ERROR, "rollback failed on {0}: {1}", op, sqx);
      return false;
    }
  }




  //   I N S T A N C E    M E M B E R S


  private final Object lock = new Object();

  private final LedgerSchema schema;
  private final Connection con;

  private final PreparedStatement sizeStmt;
  private final PreparedStatement tailStmt;
  private final PreparedStatement selectByIdStmt;
  private final PreparedStatement selectRangeStmt;
  private final PreparedStatement selectByPairStmt;
  private final PreparedStatement selectBySubjectStmt;
  private final PreparedStatement selectBySignerStmt;
  private final PreparedStatement acknowledgedStmt;
  private final PreparedStatement nonceStmt;
  private final PreparedStatement createdAtStmt;

  private PreparedStatement insertStmt;


  /**
   * On demand initialization returns an 11-parameter prepared insert statement.
   * The parameter values are (in order)
   * <ol>
   * <li>id</li>
   * <li>subject_id</li>
   * <li>signer_id</li>
   * <li>signer_email</li>
   * <li>signer_name</li>
   * <li>signed_at</li>
   * <li>nonce</li>
   * <li>subject_checksum</li>
   * <li>payload_hash</li>
   * <li>signature</li>
   * <li>prev_hash</li>
   * </ol>
   * <p>
   * Implemented this way, so that you can pass in a read-only database
   * connection at construction.
   * </p>
   */
  private PreparedStatement getInsertStmt() throws SQLException {
    if (insertStmt == null) {
      String sql =
          "INSERT INTO " + schema.getTable() + " (" +
          ID + ", " + SUBJECT_ID + ", " + SIGNER_ID + ", " + SIGNER_EMAIL + ", " +
          SIGNER_NAME + ", " + SIGNED_AT + ", " + NONCE + ", " + SUBJECT_CHECKSUM + ", " +
          PAYLOAD_HASH + ", " + SIGNATURE + ", " + PREV_HASH +
          ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
      insertStmt = con.prepareStatement(sql);
    }
    return insertStmt;
  }


  /**
   * Creates a new instance from an already existing table on the backing database.
   *
   * @param schema    describes the existing backing table
   * @param con       the database the table lives in. If read-only, then
   *                  the instance is read-only.
   */
  public SqlLedgerStore(LedgerSchema schema, Connection con) {
    this.schema = Objects.requireNonNull(schema, "null schema");
    this.con = Objects.requireNonNull(con, "null con");
    try {
      if (!con.isValid(5))
        throw new IllegalArgumentException("connection not valid: " + con);

      if (!con.isReadOnly() && con.getAutoCommit())
        con.setAutoCommit(false);

      final String table = schema.getTable();
      final String select = "SELECT " + schema.columnList() + " FROM " + table;

      this.sizeStmt = con.prepareStatement(
          "SELECT COALESCE(MAX(" + ID + "), 0) FROM " + table);

      this.tailStmt = con.prepareStatement(
          "SELECT " + ID + ", " + PAYLOAD_HASH + " FROM " + table +
          " ORDER BY " + ID + " DESC FETCH FIRST 1 ROWS ONLY");

      this.selectByIdStmt = con.prepareStatement(
          select + " WHERE " + ID + " = ?");

      this.selectRangeStmt = con.prepareStatement(
          select + " WHERE " + ID + " >= ? AND " + ID + " <= ? ORDER BY " + ID);

      this.selectByPairStmt = con.prepareStatement(
          select + " WHERE " + SUBJECT_ID + " = ? AND " + SIGNER_ID + " = ?");

      this.selectBySubjectStmt = con.prepareStatement(
          select + " WHERE " + SUBJECT_ID + " = ? ORDER BY " + ID + " DESC");

      this.selectBySignerStmt = con.prepareStatement(
          select + " WHERE " + SIGNER_ID + " = ? ORDER BY " + ID + " DESC");

      this.acknowledgedStmt = con.prepareStatement(
          "SELECT COUNT(*) FROM " + table + " WHERE " + SUBJECT_ID + " = ? AND (" +
          SIGNER_ID + " = ? OR " + SIGNER_EMAIL + " = ?)");

      this.nonceStmt = con.prepareStatement(
          "SELECT " + ID + " FROM " + table + " WHERE " + NONCE + " = ?");

      this.createdAtStmt = con.prepareStatement(
          "SELECT " + CREATED_AT + " FROM " + table + " WHERE " + ID + " = ?");

    } catch (SQLException sqx) {
      throw new SqlLedgerException("on <init>(" + schema + "): " + sqx, sqx);
    }
  }


  /** Returns the schema this instance was created with. */
  public LedgerSchema getSchema() {
    return schema;
  }


  @Override
  public void close() {
    synchronized (lock) {
      try {
        con.close();
      } catch (SQLException x) {
        throw new SqlLedgerException("on close(): " + x, x);
      }
    }
  }



  /**
   * Maximum number of times an insert is attempted when another writer on
   * the same table (thru another connection) links to the tail first.
   */
  public final static int MAX_LINK_ATTEMPTS = 64;


  /**
   * {@inheritDoc}
   *
   * <p>
   * Appends thru this instance are serialized. Other writers on the same table
   * (other instances, other processes) are detected by the primary key and
   * {@code prev_hash} unique constraints: the losing insert is rolled back and
   * relinked to the new tail, up to {@value #MAX_LINK_ATTEMPTS} times.
   * </p>
   */
  @Override
  public SignatureRecord insertLinked(PendingRecord pending)
      throws AlreadyAcknowledgedException, ReplayedNonceException {

    Objects.requireNonNull(pending, "null pending");
    final var fact = pending.fact();
    final var log = LedgerConstants.getLogger();

    synchronized (lock) {
      for (int attempt = 1; ; ++attempt) {
        try {

          return linkToTail(pending);

        } catch (SQLException sqx) {
          boolean rb = rollback(con, "insertLinked");

          String state = sqx.getSQLState();
          boolean conflict = isWriteConflict(state);
          if (rb && conflict) {
            if (findUnlocked(fact.subjectId(), fact.signerId()).isPresent())
              throw new AlreadyAcknowledgedException(fact.subjectId(), fact.signerId(), sqx);
            if (nonceExists(fact.nonce().get()))
              throw new ReplayedNonceException(fact.nonce().get(), sqx);
            if (attempt < MAX_LINK_ATTEMPTS) {
              log.log(Level.DEBUG,
                  "tail moved under concurrent writer; relinking (attempt {0}): {1}",
                  attempt, sqx.getMessage());
              continue;
            }
            log.log(Level.WARNING,
                "giving up on insert after {0} attempts (concurrent writers): {1}",
                attempt, sqx);
          }
          String msg = "on insertLinked " + fact;
          if (!rb)
            msg += " (rollback failed!)";
          msg += " -- " + sqx;
          throw new SqlLedgerException(msg, sqx);

        } catch (RuntimeException rx) {
          rollback(con, "insertLinked");
          throw rx;
        }
      }
    }
  }


  /**
   * SQLSTATE class 23 (integrity constraint violation), class 40 (transaction
   * rollback: serialization failure, deadlock), or H2's lock timeout.
   */
  private static boolean isWriteConflict(String sqlState) {
    return
        sqlState != null &&
        (sqlState.startsWith("23") || sqlState.startsWith("40") || sqlState.equals("HYT00"));
  }


  /**
   * Reads the tail, inserts the pending record after it, and commits. Invoked
   * under the instance lock; the caller rolls back on failure.
   */
  private SignatureRecord linkToTail(PendingRecord pending) throws SQLException {
    final var fact = pending.fact();

    long tailId = 0;
    Optional<byte[]> prevHash = Optional.empty();
    try (ResultSet rs = tailStmt.executeQuery()) {
      if (rs.next()) {
        tailId = rs.getLong(1);
        String tailHash = rs.getString(2);
        try {
          prevHash = Optional.of(
              ByteEncoding.BASE64.decode(tailHash, LedgerConstants.HASH_WIDTH));
        } catch (IllegalArgumentException iax) {
          throw new SqlLedgerException(
              "tail [" + tailId + "] " + PAYLOAD_HASH + " is unreadable: " +
              tailHash + " -- refusing to link to it", iax);
        }
      }
    }
    LedgerConstants.getLogger().log(Level.TRACE, "tail id {0}", tailId);

    final long id = tailId + 1;

    PreparedStatement insert = getInsertStmt();
    insert.setLong(1, id);
    insert.setString(2, fact.subjectId());
    insert.setString(3, fact.signerId());
    insert.setString(4, fact.normalizedEmail());
    setOptional(insert, 5, pending.signerName());
    insert.setString(6, CanonicalEncoder.formatTimestamp(fact.signedAt()));
    insert.setString(7, fact.nonce().get());
    setOptional(insert, 8, fact.subjectChecksum());
    insert.setString(9, encode(pending.payloadHash()));
    insert.setString(10, encode(pending.signature()));
    setOptional(insert, 11, prevHash.map(SqlLedgerStore::encode));

    int count = insert.executeUpdate();
    if (count != 1) {
      throw new SqlLedgerException(
          "INSERT did not yield expected update count 1; actual was " + count);
    }

    Instant createdAt;
    createdAtStmt.setLong(1, id);
    try (ResultSet rs = createdAtStmt.executeQuery()) {
      if (!rs.next())
        throw new SqlLedgerException("inserted row [" + id + "] not found");
      createdAt = toInstant(rs, 1);
    }

    con.commit();

    return pending.toRecord(id, prevHash, createdAt);
  }


  private void setOptional(PreparedStatement stmt, int index, Optional<String> value)
      throws SQLException {
    if (value.isPresent())
      stmt.setString(index, value.get());
    else
      stmt.setNull(index, Types.VARCHAR);
  }


  private boolean nonceExists(String nonce) throws SqlLedgerException {
    try {
      nonceStmt.setString(1, nonce);
      try (ResultSet rs = nonceStmt.executeQuery()) {
        return rs.next();
      }
    } catch (SQLException sqx) {
      throw new SqlLedgerException("on nonceExists(" + nonce + "): " + sqx, sqx);
    }
  }



  @Override
  public long size() {
    synchronized (lock) {
      try (ResultSet rs = sizeStmt.executeQuery()) {
        if (rs.next())
          return rs.getLong(1);

        throw new SqlLedgerException("empty result set on size()");

      } catch (SQLException sqx) {
        throw new SqlLedgerException("on size(): " + sqx, sqx);
      }
    }
  }


  @Override
  public Optional<SignatureRecord> findById(long id) {
    synchronized (lock) {
      try {
        selectByIdStmt.setLong(1, id);
        return first(selectByIdStmt);
      } catch (SQLException sqx) {
        throw new SqlLedgerException("on findById(" + id + "): " + sqx, sqx);
      }
    }
  }


  @Override
  public List<SignatureRecord> range(long fromId, long toId) {
    if (fromId < 1)
      throw new IllegalArgumentException("fromId " + fromId);
    if (toId < fromId)
      return List.of();
    synchronized (lock) {
      try {
        selectRangeStmt.setLong(1, fromId);
        selectRangeStmt.setLong(2, toId);
        return list(selectRangeStmt);
      } catch (SQLException sqx) {
        throw new SqlLedgerException(
            "on range(" + fromId + ", " + toId + "): " + sqx, sqx);
      }
    }
  }


  @Override
  public Optional<SignatureRecord> find(String subjectId, String signerId) {
    synchronized (lock) {
      return findUnlocked(subjectId, signerId);
    }
  }


  private Optional<SignatureRecord> findUnlocked(String subjectId, String signerId) {
    try {
      selectByPairStmt.setString(1, subjectId);
      selectByPairStmt.setString(2, signerId);
      return first(selectByPairStmt);
    } catch (SQLException sqx) {
      throw new SqlLedgerException(
          "on find(" + subjectId + ", " + signerId + "): " + sqx, sqx);
    }
  }


  @Override
  public boolean isAcknowledged(String subjectId, String signerIdOrEmail) {
    synchronized (lock) {
      try {
        acknowledgedStmt.setString(1, subjectId);
        acknowledgedStmt.setString(2, signerIdOrEmail);
        acknowledgedStmt.setString(3, CanonicalEncoder.normalizeEmail(signerIdOrEmail));
        try (ResultSet rs = acknowledgedStmt.executeQuery()) {
          return rs.next() && rs.getLong(1) > 0;
        }
      } catch (SQLException sqx) {
        throw new SqlLedgerException(
            "on isAcknowledged(" + subjectId + ", " + signerIdOrEmail + "): " + sqx, sqx);
      }
    }
  }


  @Override
  public List<SignatureRecord> listBySubject(String subjectId) {
    synchronized (lock) {
      try {
        selectBySubjectStmt.setString(1, subjectId);
        return list(selectBySubjectStmt);
      } catch (SQLException sqx) {
        throw new SqlLedgerException("on listBySubject(" + subjectId + "): " + sqx, sqx);
      }
    }
  }


  @Override
  public List<SignatureRecord> listBySigner(String signerId) {
    synchronized (lock) {
      try {
        selectBySignerStmt.setString(1, signerId);
        return list(selectBySignerStmt);
      } catch (SQLException sqx) {
        throw new SqlLedgerException("on listBySigner(" + signerId + "): " + sqx, sqx);
      }
    }
  }



  private Optional<SignatureRecord> first(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
    }
  }


  private List<SignatureRecord> list(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      List<SignatureRecord> records = new ArrayList<>();
      while (rs.next())
        records.add(toRecord(rs));
      return records;
    }
  }


  /**
   * Reads the current row, with columns in {@linkplain LedgerSchema#COLUMNS} order.
   * Stored hashes that do not decode are read as empty byte arrays (so that
   * verification reports them); a {@code signed_at} that does not parse
   * cannot be represented, and fails.
   */
  private SignatureRecord toRecord(ResultSet rs) throws SQLException {
    final long id = rs.getLong(1);

    Instant signedAt;
    String signedAtText = rs.getString(6);
    try {
      signedAt = CanonicalEncoder.parseTimestamp(signedAtText);
    } catch (IllegalArgumentException iax) {
      throw new SqlLedgerException(
          "record [" + id + "] has unreadable " + SIGNED_AT + ": " + signedAtText, iax);
    }

    String prevHash = rs.getString(11);

    return new SignatureRecord(
        id,
        rs.getString(2),
        rs.getString(3),
        rs.getString(4),
        Optional.ofNullable(rs.getString(5)),
        signedAt,
        rs.getString(7),
        Optional.ofNullable(rs.getString(8)),
        decode(id, PAYLOAD_HASH, rs.getString(9)),
        decode(id, SIGNATURE, rs.getString(10)),
        prevHash == null ? Optional.empty() : Optional.of(decode(id, PREV_HASH, prevHash)),
        toInstant(rs, 12));
  }


  private static Instant toInstant(ResultSet rs, int column) throws SQLException {
    OffsetDateTime time = rs.getObject(column, OffsetDateTime.class);
    if (time == null)
      throw new SqlLedgerException("null " + CREATED_AT);
    return time.toInstant();
  }


  private static String encode(byte[] bytes) {
    return ByteEncoding.BASE64.encode(bytes);
  }


  private static byte[] decode(long id, String column, String value) {
    if (value == null)
      return new byte[0];
    try {
      return ByteEncoding.BASE64.decode(value);
    } catch (IllegalArgumentException iax) {
      LedgerConstants.getLogger().log(
          Level.WARNING,
          "record [{0}] {1} is not valid base64: {2}", id, column, value);
      return new byte[0];
    }
  }

}
