/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class CriticalityTest {

  @Test
  public void testOrdering() {
    assertTrue(Criticality.MAJOR.atLeast(Criticality.MAJOR));
    assertTrue(Criticality.CATASTROPHIC.atLeast(Criticality.MAJOR));
    assertFalse(Criticality.MINOR.atLeast(Criticality.MAJOR));
    assertTrue(Criticality.NO_EFFECT.atLeast(Criticality.NO_EFFECT));
  }

  @Test
  public void testParse() {
    assertEquals(Criticality.NO_EFFECT, Criticality.parse("no-effect"));
    assertEquals(Criticality.HAZARDOUS, Criticality.parse(" Hazardous "));
    assertEquals(Criticality.MAJOR, Criticality.parse("2"));
    assertThrows(IllegalArgumentException.class, () -> Criticality.parse("severe"));
    assertThrows(IllegalArgumentException.class, () -> Criticality.parse("7"));
  }

  @Test
  public void testLevels() {
    for (var c : Criticality.values())
      assertEquals(c, Criticality.forLevel(c.level()));
    assertThrows(ByteFormatException.class, () -> Criticality.forLevel(-1));
  }

}
