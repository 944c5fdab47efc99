/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import io.crums.gvl.Criticality;

/**
 * The external human-decision collaborator. Implementations talk to whatever
 * ticketing or sign-off system the organization uses.
 * <p>
 * Both methods may fail with unchecked exceptions. A failed request rejects
 * the record; a failed poll is logged and retried on the next poll, until the
 * approval times out.
 * </p>
 */
public interface ApprovalChannel {

  /**
   * Opens an approval request and returns its ticket ID.
   *
   * @param summary     human-readable description of the record
   * @param criticality the record's criticality
   */
  String requestApproval(String summary, Criticality criticality);

  /**
   * Returns the current status of the given ticket.
   */
  ApprovalStatus pollDecision(String ticketId);

}
