/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.util.Locale;

/**
 * Severity classification of a record. Ordered from least to most severe,
 * following the aerospace failure-condition categories. Whether a record
 * requires human approval before it is appended is decided by comparing its
 * criticality against an oversight threshold.
 * 
 * @see #atLeast(Criticality)
 */
public enum Criticality {
  
  NO_EFFECT(0),
  MINOR(1),
  MAJOR(2),
  HAZARDOUS(3),
  CATASTROPHIC(4);
  
  
  private final int level;
  
  private Criticality(int level) {
    this.level = level;
  }
  
  
  /**
   * Returns the numeric level. This is the value written in serial form.
   */
  public int level() {
    return level;
  }
  
  
  /**
   * Returns {@code true} iff this criticality meets or exceeds the given
   * {@code threshold} (inclusive).
   */
  public boolean atLeast(Criticality threshold) {
    return level >= threshold.level;
  }
  
  
  /**
   * Returns the instance with the given level.
   * 
   * @throws ByteFormatException if out of range
   */
  public static Criticality forLevel(int level) throws ByteFormatException {
    for (var c : values())
      if (c.level == level)
        return c;
    throw new ByteFormatException("unknown criticality level " + level);
  }
  
  
  /**
   * Parses the given name (case- and dash-insensitive), or numeric level.
   * 
   * @throws IllegalArgumentException if not recognized
   */
  public static Criticality parse(String value) {
    String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if (!v.isEmpty() && Character.isDigit(v.charAt(0))) {
      try {
        return forLevel(Integer.parseInt(v));
      } catch (NumberFormatException | ByteFormatException x) {
        throw new IllegalArgumentException("unknown criticality: " + value, x);
      }
    }
    return valueOf(v);
  }

}
