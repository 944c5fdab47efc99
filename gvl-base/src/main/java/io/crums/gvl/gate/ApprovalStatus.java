/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.Objects;

/**
 * What the approval channel reports for a ticket.
 *
 * @param decision  pending, approved, or rejected
 * @param approver  who decided (empty while pending)
 * @param note      the approver's note, or the rejection reason
 */
public record ApprovalStatus(Decision decision, String approver, String note) {

  public enum Decision {
    PENDING,
    APPROVED,
    REJECTED;
  }

  /** The no-decision-yet status. */
  public final static ApprovalStatus PENDING = new ApprovalStatus(Decision.PENDING, "", "");


  public static ApprovalStatus approved(String approver, String note) {
    return new ApprovalStatus(Decision.APPROVED, approver, note);
  }

  public static ApprovalStatus rejected(String approver, String reason) {
    return new ApprovalStatus(Decision.REJECTED, approver, reason);
  }


  public ApprovalStatus {
    Objects.requireNonNull(decision, "null decision");
    if (approver == null)
      approver = "";
    if (note == null)
      note = "";
  }

}
