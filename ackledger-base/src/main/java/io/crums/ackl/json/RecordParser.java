/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.json;


import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import io.crums.ackl.ByteEncoding;
import io.crums.ackl.CanonicalEncoder;
import io.crums.ackl.SignatureRecord;

/**
 * {@linkplain SignatureRecord} JSON parser. Hashes and signatures are
 * standard base64; timestamps are RFC 3339 UTC. The tag names follow the
 * persisted column names.
 */
public class RecordParser {
  
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
  
  
  /**
   * Instances are stateless.
   */
  public final static RecordParser INSTANCE = new RecordParser();
  
  
  private final static ByteEncoding ENC = ByteEncoding.BASE64;
  
  
  
  @SuppressWarnings("unchecked")
  public JSONObject toJsonObject(SignatureRecord record) {
    JSONObject jObj = new JSONObject();
    jObj.put(ID, record.id());
    jObj.put(SUBJECT_ID, record.subjectId());
    jObj.put(SIGNER_ID, record.signerId());
    jObj.put(SIGNER_EMAIL, record.signerEmail());
    record.signerName().ifPresent(name -> jObj.put(SIGNER_NAME, name));
    jObj.put(SIGNED_AT, CanonicalEncoder.formatTimestamp(record.signedAt()));
    jObj.put(NONCE, record.nonce());
    record.subjectChecksum().ifPresent(c -> jObj.put(SUBJECT_CHECKSUM, c));
    jObj.put(PAYLOAD_HASH, ENC.encode(record.payloadHash()));
    jObj.put(SIGNATURE, ENC.encode(record.signature()));
    jObj.put(PREV_HASH, record.prevHash().map(ENC::encode).orElse(null));
    jObj.put(CREATED_AT, CanonicalEncoder.formatTimestamp(record.createdAt()));
    return jObj;
  }
  
  
  @SuppressWarnings("unchecked")
  public JSONArray toJsonArray(List<SignatureRecord> records) {
    JSONArray jArray = new JSONArray();
    for (var record : records)
      jArray.add(toJsonObject(record));
    return jArray;
  }
  
  
  public SignatureRecord toRecord(String json) throws JsonParsingException {
    try {
      return toRecord((JSONObject) new JSONParser().parse(json));
    } catch (ParseException | ClassCastException x) {
      throw new JsonParsingException("malformed json: " + json, x);
    }
  }
  
  
  public SignatureRecord toRecord(JSONObject jObj) throws JsonParsingException {
    try {
      String prevHash = JsonUtils.getString(jObj, PREV_HASH, false);
      return new SignatureRecord(
          JsonUtils.getLong(jObj, ID),
          JsonUtils.getString(jObj, SUBJECT_ID, true),
          JsonUtils.getString(jObj, SIGNER_ID, true),
          JsonUtils.getString(jObj, SIGNER_EMAIL, true),
          Optional.ofNullable(JsonUtils.getString(jObj, SIGNER_NAME, false)),
          timestamp(jObj, SIGNED_AT),
          JsonUtils.getString(jObj, NONCE, true),
          Optional.ofNullable(JsonUtils.getString(jObj, SUBJECT_CHECKSUM, false)),
          ENC.decode(JsonUtils.getString(jObj, PAYLOAD_HASH, true)),
          ENC.decode(JsonUtils.getString(jObj, SIGNATURE, true)),
          Optional.ofNullable(prevHash).map(ENC::decode),
          timestamp(jObj, CREATED_AT));
    
    } catch (JsonParsingException jpx) {
      throw jpx;
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
  }
  
  
  private Instant timestamp(JSONObject jObj, String name) {
    return CanonicalEncoder.parseTimestamp(JsonUtils.getString(jObj, name, true));
  }

}
