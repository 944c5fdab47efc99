/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@linkplain PendingApprovals}. Does not survive a restart.
 */
public class VolatilePendingApprovals implements PendingApprovals {

  private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();

  @Override
  public void save(PendingApproval p) {
    pending.put(p.ticketId(), p);
  }

  @Override
  public void remove(String ticketId) {
    pending.remove(ticketId);
  }

  @Override
  public List<PendingApproval> list() {
    return new ArrayList<>(pending.values());
  }

}
