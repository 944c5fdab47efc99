/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A human approval attached to a ledger entry. Only entries escalated for
 * oversight carry one.
 * 
 * @param ticketId    the approval channel's ticket
 * @param approver    who approved (as reported by the channel)
 * @param decidedAt   UTC millis the decision was observed
 * @param note        free-form, possibly empty
 */
public record ApprovalDecision(
    String ticketId, String approver, long decidedAt, String note) {
  
  public ApprovalDecision {
    Objects.requireNonNull(ticketId, "null ticketId");
    Objects.requireNonNull(approver, "null approver");
    if (note == null)
      note = "";
    if (ticketId.isEmpty())
      throw new IllegalArgumentException("empty ticketId");
  }
  
  
  public int serialSize() {
    return
        Serials.stringSize(ticketId) +
        Serials.stringSize(approver) +
        8 +
        Serials.stringSize(note);
  }
  
  
  public ByteBuffer writeTo(ByteBuffer out) {
    Serials.putString(out, ticketId);
    Serials.putString(out, approver);
    out.putLong(decidedAt);
    return Serials.putString(out, note);
  }
  
  
  /**
   * Loads and returns an instance from its serial form. On return the
   * buffer's position is advanced past the instance's bytes.
   */
  public static ApprovalDecision load(ByteBuffer in) throws ByteFormatException {
    try {
      String ticketId = Serials.getString(in);
      String approver = Serials.getString(in);
      long decidedAt = in.getLong();
      String note = Serials.getString(in);
      return new ApprovalDecision(ticketId, approver, decidedAt, note);
    } catch (BufferUnderflowException | IllegalArgumentException x) {
      throw new ByteFormatException("malformed approval decision: " + x.getMessage(), x);
    }
  }

}
