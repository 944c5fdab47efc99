/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.rec;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class CanonicalTest {


  @Test
  public void testKeysSorted() {
    var a = new LinkedHashMap<String, Object>();
    a.put("b", 1);
    a.put("a", List.of(1, 2.5));
    var b = new LinkedHashMap<String, Object>();
    b.put("a", List.of(1L, new BigDecimal("2.50")));
    b.put("b", 1L);
    assertEquals("{\"a\":[1,2.5],\"b\":1}", Canonical.toJson(a));
    assertEquals(Canonical.toJson(a), Canonical.toJson(b));
  }


  @Test
  public void testIntegralDoubles() {
    assertEquals(Canonical.toJson(Map.of("x", 100)), Canonical.toJson(Map.of("x", 100.0)));
  }


  @Test
  public void testNested() {
    var value = Map.of("outer", Map.of("z", "last", "m", true, "a", "first"));
    assertEquals(
        "{\"outer\":{\"a\":\"first\",\"m\":true,\"z\":\"last\"}}",
        Canonical.toJson(value));
  }


  @Test
  public void testRejectsSets() {
    assertThrows(InputException.class, () -> Canonical.toJson(Map.of("s", Set.of(1, 2))));
  }


  @Test
  public void testRejectsNaN() {
    assertThrows(InputException.class, () -> Canonical.toJson(List.of(Double.NaN)));
    assertThrows(
        InputException.class,
        () -> Canonical.toJson(Map.of("x", Double.POSITIVE_INFINITY)));
  }


  @Test
  public void testRejectsNonStringKeys() {
    assertThrows(InputException.class, () -> Canonical.toJson(Map.of(1, "one")));
  }


  @Test
  public void testRejectsUnknownTypes() {
    assertThrows(InputException.class, () -> Canonical.toJson(List.of(new Object())));
  }

}
