/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Typed getters for {@linkplain JSONObject} members.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  public static Number getNumber(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected numeral '" + name + "' missing");
      return null;
    }
    if (!(value instanceof Number))
      throw new JsonParsingException("'" + name + "' expects a numeral: " + value);
    return (Number) value;
  }
  
  
  public static long getLong(JSONObject jObj, String name) throws JsonParsingException {
    return getNumber(jObj, name, true).longValue();
  }
  
  
  public static boolean getBoolean(JSONObject jObj, String name) throws JsonParsingException {
    Object value = jObj.get(name);
    if (!(value instanceof Boolean))
      throw new JsonParsingException("'" + name + "' expects a boolean: " + value);
    return (Boolean) value;
  }
  
  
  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    if (!(value instanceof JSONArray))
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value);
    return (JSONArray) value;
  }

}
