/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.rec;


import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.json.simple.JSONValue;

/**
 * Canonical JSON form of structured values. Two structurally equal values
 * always map to the same string, regardless of map iteration order or
 * the numeric type a number happens to be boxed in.
 *
 * <h2>Rules</h2>
 * <ul>
 * <li>Maps must have string keys; keys are sorted (natural {@code String} order).</li>
 * <li>Lists and arrays keep their order.</li>
 * <li>Numbers with no fractional part are written as plain integers ({@code 100.0}
 * and {@code 100} are the same value). Other finite numbers are written as
 * a stripped {@code BigDecimal}. NaN and infinities are rejected.</li>
 * <li>Strings, booleans and {@code null} are written as is. Characters and enums
 * are written as strings.</li>
 * <li>Sets (no defined order), non-string map keys, and any other type are rejected.</li>
 * </ul>
 */
public class Canonical {

  private Canonical() {  }


  /**
   * Returns the canonical JSON for the given value.
   *
   * @throws InputException if the value cannot be put in canonical form
   */
  public static String toJson(Object value) throws InputException {
    return JSONValue.toJSONString(normalize(value, "$"));
  }


  /**
   * Returns the UTF-8 bytes of the {@linkplain #toJson(Object) canonical JSON}.
   */
  public static byte[] toBytes(Object value) throws InputException {
    return toJson(value).getBytes(StandardCharsets.UTF_8);
  }



  private static Object normalize(Object value, String path) {

    if (value == null || value instanceof String || value instanceof Boolean)
      return value;

    if (value instanceof Character || value instanceof Enum)
      return value.toString();

    if (value instanceof Number)
      return normalizeNumber((Number) value, path);

    if (value instanceof Map) {
      var sorted = new TreeMap<String, Object>();
      for (var e : ((Map<?, ?>) value).entrySet()) {
        if (!(e.getKey() instanceof String))
          throw new InputException(
              "non-string key (" + typeName(e.getKey()) + ") at " + path);
        String key = (String) e.getKey();
        sorted.put(key, normalize(e.getValue(), path + "." + key));
      }
      return sorted;
    }

    if (value instanceof Set)
      throw new InputException("unordered set at " + path + " cannot be canonicalized");

    if (value instanceof List) {
      var list = (List<?>) value;
      var out = new ArrayList<Object>(list.size());
      for (int index = 0; index < list.size(); ++index)
        out.add(normalize(list.get(index), path + "[" + index + "]"));
      return out;
    }

    if (value.getClass().isArray()) {
      final int len = Array.getLength(value);
      var out = new ArrayList<Object>(len);
      for (int index = 0; index < len; ++index)
        out.add(normalize(Array.get(value, index), path + "[" + index + "]"));
      return out;
    }

    throw new InputException(
        "type " + typeName(value) + " at " + path + " cannot be canonicalized");
  }



  private static Object normalizeNumber(Number n, String path) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte)
      return n.longValue();

    if (n instanceof BigInteger)
      return n;

    final BigDecimal decimal;
    if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d))
        throw new InputException("non-finite number " + d + " at " + path);
      // Float.toString keeps a float's short form
      decimal = new BigDecimal(n instanceof Float ? Float.toString(n.floatValue()) : Double.toString(d));
    } else if (n instanceof BigDecimal) {
      decimal = (BigDecimal) n;
    } else
      throw new InputException("number type " + typeName(n) + " at " + path + " not supported");

    var stripped = decimal.stripTrailingZeros();
    if (stripped.scale() <= 0)
      return stripped.toBigIntegerExact();
    return stripped;
  }


  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }

}
