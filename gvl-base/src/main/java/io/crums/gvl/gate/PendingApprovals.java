/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.List;

/**
 * Persistence for escalated records awaiting a decision, so a restart resumes
 * polling instead of losing them. Keyed by ticket ID.
 *
 * @see VolatilePendingApprovals
 * @see PendingApprovalsDir
 */
public interface PendingApprovals {

  /**
   * Saves (or overwrites) the given pending approval.
   */
  void save(PendingApproval pending);

  /**
   * Removes the pending approval with the given ticket ID, if any.
   */
  void remove(String ticketId);

  /**
   * Returns all the pending approvals.
   */
  List<PendingApproval> list();

}
