/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.Objects;

import io.crums.gvl.GovernanceTuple;

/**
 * The persisted state of an escalated record waiting on a human decision.
 *
 * @param ticketId      the approval channel's ticket
 * @param partition     the gate's partition
 * @param tuple         the record
 * @param requestedAt   UTC millis the approval was requested (informational)
 * @param waitedMillis  monotonic time already spent waiting, as of the last save
 */
public record PendingApproval(
    String ticketId, String partition, GovernanceTuple tuple,
    long requestedAt, long waitedMillis) {

  public PendingApproval {
    Objects.requireNonNull(ticketId, "null ticketId");
    Objects.requireNonNull(partition, "null partition");
    Objects.requireNonNull(tuple, "null tuple");
    if (ticketId.isEmpty())
      throw new IllegalArgumentException("empty ticketId");
    if (waitedMillis < 0)
      throw new IllegalArgumentException("waitedMillis " + waitedMillis);
  }


  /** Returns a copy with the given waited time. */
  public PendingApproval waited(long millis) {
    return new PendingApproval(ticketId, partition, tuple, requestedAt, millis);
  }

}
