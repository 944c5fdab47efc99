/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.rec;


import java.util.List;
import java.util.Map;

import io.crums.gvl.Criticality;

/**
 * A completed computation, as handed to the {@linkplain RecordBuilder}. The
 * solver that produced the ranked results is a black box; this only names it.
 * 
 * @param inputs          the input parameters (must be canonicalizable)
 * @param rankedResults   result candidates, best first (must be canonicalizable)
 * @param solverIdentity  solver name and version, e.g. {@code "solverX-1.0"}
 * @param lifecyclePhase  the lifecycle phase the record is created in
 * @param criticality     severity classification
 * @param category        e.g. {@code "structures"}; may be empty
 * @param recordType      e.g. {@code "trade-study"}; may be empty
 * @param upstreamRef     the upstream record (design state, decision, ..) this record authorizes
 * 
 * @see Canonical
 */
public record Computation(
    Map<String, ?> inputs,
    List<?> rankedResults,
    String solverIdentity,
    String lifecyclePhase,
    Criticality criticality,
    String category,
    String recordType,
    String upstreamRef) {
  
  
  /**
   * Returns a copy of this instance with the given criticality.
   */
  public Computation criticality(Criticality level) {
    return new Computation(
        inputs, rankedResults, solverIdentity, lifecyclePhase,
        level, category, recordType, upstreamRef);
  }
  
  
  /**
   * Returns a copy of this instance with the given lifecycle phase.
   */
  public Computation lifecyclePhase(String phase) {
    return new Computation(
        inputs, rankedResults, solverIdentity, phase,
        criticality, category, recordType, upstreamRef);
  }

}
