/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.json;


import java.util.ArrayList;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import io.crums.ackl.Discrepancy;
import io.crums.ackl.VerificationReport;

/**
 * {@linkplain VerificationReport} JSON parser.
 */
public class ReportParser {
  
  public final static String FROM = "from";
  public final static String TO = "to";
  public final static String CHECKED = "checked";
  public final static String CLEAN = "clean";
  public final static String DISCREPANCIES = "discrepancies";
  
  public final static String ID = "id";
  public final static String KIND = "kind";
  public final static String DETAIL = "detail";
  
  
  public final static ReportParser INSTANCE = new ReportParser();
  
  
  @SuppressWarnings("unchecked")
  public JSONObject toJsonObject(VerificationReport report) {
    JSONObject jObj = new JSONObject();
    jObj.put(FROM, report.fromId());
    jObj.put(TO, report.toId());
    jObj.put(CHECKED, report.recordsChecked());
    jObj.put(CLEAN, report.isClean());
    
    JSONArray jArray = new JSONArray();
    for (var d : report.discrepancies()) {
      JSONObject jD = new JSONObject();
      jD.put(ID, d.recordId());
      jD.put(KIND, d.kind().name());
      jD.put(DETAIL, d.detail());
      jArray.add(jD);
    }
    jObj.put(DISCREPANCIES, jArray);
    return jObj;
  }
  
  
  public VerificationReport toReport(String json) throws JsonParsingException {
    try {
      return toReport((JSONObject) new JSONParser().parse(json));
    } catch (ParseException | ClassCastException x) {
      throw new JsonParsingException("malformed json: " + json, x);
    }
  }
  
  
  public VerificationReport toReport(JSONObject jObj) throws JsonParsingException {
    JSONArray jArray = JsonUtils.getJsonArray(jObj, DISCREPANCIES, true);
    List<Discrepancy> discrepancies = new ArrayList<>(jArray.size());
    try {
      for (Object element : jArray) {
        JSONObject jD = (JSONObject) element;
        discrepancies.add(
            new Discrepancy(
                JsonUtils.getLong(jD, ID),
                Discrepancy.Kind.valueOf(JsonUtils.getString(jD, KIND, true)),
                JsonUtils.getString(jD, DETAIL, false)));
      }
      var report = new VerificationReport(
          JsonUtils.getLong(jObj, FROM),
          JsonUtils.getLong(jObj, TO),
          JsonUtils.getLong(jObj, CHECKED),
          discrepancies);
      if (jObj.containsKey(CLEAN) && JsonUtils.getBoolean(jObj, CLEAN) != report.isClean())
        throw new JsonParsingException(
            "'" + CLEAN + "' contradicts discrepancies: " + jObj.get(CLEAN));
      return report;
    } catch (ClassCastException | IllegalArgumentException x) {
      throw new JsonParsingException("illegal report: " + x.getMessage(), x);
    }
  }

}
