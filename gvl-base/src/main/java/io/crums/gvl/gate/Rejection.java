/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.Objects;

import io.crums.gvl.Criticality;
import io.crums.gvl.GovernanceTuple;

/**
 * A rejection log entry. Rejections are diagnostics only: they are not
 * chained, and never enter the ledger.
 *
 * @param recordId        the rejected record's ID
 * @param partition       the gate's partition
 * @param stoppedAt       the state admission stopped at
 * @param reason          why
 * @param detail          human-readable detail
 * @param rejectedAt      UTC millis
 * @param signerId        the record's claimed signer
 * @param lifecyclePhase  the record's phase
 * @param criticality     the record's criticality
 */
public record Rejection(
    String recordId,
    String partition,
    AdmissionState stoppedAt,
    RejectionReason reason,
    String detail,
    long rejectedAt,
    String signerId,
    String lifecyclePhase,
    Criticality criticality) {


  public Rejection {
    Objects.requireNonNull(recordId, "null recordId");
    Objects.requireNonNull(partition, "null partition");
    Objects.requireNonNull(stoppedAt, "null stoppedAt");
    Objects.requireNonNull(reason, "null reason");
    Objects.requireNonNull(criticality, "null criticality");
    if (detail == null)
      detail = "";
    if (stoppedAt.isTerminal())
      throw new IllegalArgumentException("stoppedAt " + stoppedAt);
  }


  /**
   * Creates an instance from the given record.
   */
  public Rejection(
      GovernanceTuple tuple, String partition, AdmissionState stoppedAt,
      RejectionReason reason, String detail, long rejectedAt) {
    this(
        tuple.id(), partition, stoppedAt, reason, detail, rejectedAt,
        tuple.signerId(), tuple.lifecyclePhase(), tuple.criticality());
  }

}
