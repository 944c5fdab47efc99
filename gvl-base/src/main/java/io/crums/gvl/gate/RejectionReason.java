/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;

/**
 * Why an admission ended in {@linkplain AdmissionState#REJECTED}.
 */
public enum RejectionReason {

  /** Signature does not verify, or the signer is unknown. */
  INVALID_SIGNATURE,
  /** Lifecycle phase unknown or closed. */
  LIFECYCLE_CLOSED,
  /** No human decision before the approval timeout. */
  APPROVAL_TIMEOUT,
  /** Rejected through the approval channel. */
  APPROVAL_REJECTED,
  /** Withdrawn by the submitter before escalation. */
  WITHDRAWN;

}
