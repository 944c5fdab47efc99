/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.Objects;

import io.crums.gvl.Criticality;

/**
 * Decides which records need human approval.
 *
 * @param threshold records at or above this criticality (inclusive) are escalated
 */
public record OversightPolicy(Criticality threshold) {

  /** Escalates {@linkplain Criticality#MAJOR} and above. */
  public final static OversightPolicy DEFAULT = new OversightPolicy(Criticality.MAJOR);

  public OversightPolicy {
    Objects.requireNonNull(threshold, "null threshold");
  }


  public boolean requiresApproval(Criticality criticality) {
    return criticality.atLeast(threshold);
  }

}
