/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import org.json.simple.JSONObject;

import io.crums.gvl.Hashing;

/**
 * Typed getters over json-simple objects.
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


  /**
   * Returns the named hex-encoded bytes.
   */
  public static byte[] getHex(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    String hex = getString(jObj, name, require);
    if (hex == null)
      return null;
    try {
      return Hashing.fromHex(hex);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("'" + name + "' expects hex: " + hex, iax);
    }
  }


  public static JSONObject getJsonObject(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    if (!(value instanceof JSONObject))
      throw new JsonParsingException("'" + name + "' expects a JSON object: " + value);
    return (JSONObject) value;
  }



  @SuppressWarnings("unchecked")
  public static boolean addIfPresent(JSONObject jObj, String name, Object value) {
    if (value == null)
      return false;
    jObj.put(name, value);
    return true;
  }

}
