/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


/**
 * States of a record's admission. {@linkplain #APPENDED} and
 * {@linkplain #REJECTED} are terminal.
 *
 * <pre>
 * RECEIVED -> SIGNATURE_VERIFIED -> LIFECYCLE_CHECKED -> (AWAITING_APPROVAL | APPROVED)
 * AWAITING_APPROVAL -> APPROVED
 * APPROVED -> APPENDED
 * any non-terminal state, except APPROVED -> REJECTED
 * </pre>
 */
public enum AdmissionState {

  RECEIVED,
  SIGNATURE_VERIFIED,
  LIFECYCLE_CHECKED,
  AWAITING_APPROVAL,
  APPROVED,
  APPENDED,
  REJECTED;


  /**
   * Tests whether a transition from this state to {@code next} is legal.
   */
  public boolean canTransitionTo(AdmissionState next) {
    switch (this) {
    case RECEIVED:            return next == SIGNATURE_VERIFIED || next == REJECTED;
    case SIGNATURE_VERIFIED:  return next == LIFECYCLE_CHECKED || next == REJECTED;
    case LIFECYCLE_CHECKED:
      return next == AWAITING_APPROVAL || next == APPROVED || next == REJECTED;
    case AWAITING_APPROVAL:   return next == APPROVED || next == REJECTED;
    case APPROVED:            return next == APPENDED;
    default:                  return false;
    }
  }


  public boolean isTerminal() {
    return this == APPENDED || this == REJECTED;
  }


  /**
   * Tests whether the submitter may still withdraw. Once escalated for
   * approval, withdrawal must go through the approval channel.
   */
  public boolean isWithdrawable() {
    return this == RECEIVED || this == SIGNATURE_VERIFIED || this == LIFECYCLE_CHECKED;
  }

}
