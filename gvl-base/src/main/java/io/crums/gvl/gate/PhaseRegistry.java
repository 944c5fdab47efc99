/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import static io.crums.gvl.GvlConstants.getLogger;

import java.lang.System.Logger.Level;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The lifecycle phases known to a partition, and whether each is open for
 * new records. Phases may be opened and closed at runtime.
 */
public class PhaseRegistry {

  private final Map<String, Boolean> phases = new ConcurrentHashMap<>();


  /**
   * Creates an instance with the given phases open.
   */
  public PhaseRegistry(String... openPhases) {
    this(List.of(openPhases));
  }


  public PhaseRegistry(Collection<String> openPhases) {
    for (var phase : openPhases)
      open(phase);
  }


  /**
   * Opens the given phase, registering it if new.
   */
  public void open(String phase) {
    checkName(phase);
    if (phases.put(phase, Boolean.TRUE) != Boolean.TRUE)
      getLogger().log(Level.INFO, "lifecycle phase '" + phase + "' opened");
  }


  /**
   * Closes the given phase. Closing an unknown phase registers it as closed.
   */
  public void close(String phase) {
    checkName(phase);
    if (phases.put(phase, Boolean.FALSE) != Boolean.FALSE)
      getLogger().log(Level.INFO, "lifecycle phase '" + phase + "' closed");
  }


  public boolean isOpen(String phase) {
    return phase != null && phases.getOrDefault(phase, Boolean.FALSE);
  }


  public boolean isKnown(String phase) {
    return phase != null && phases.containsKey(phase);
  }


  /**
   * Returns the open phases, in alphabetical order.
   */
  public SortedSet<String> openPhases() {
    var open = new TreeSet<String>();
    phases.forEach((phase, isOpen) -> { if (isOpen) open.add(phase); });
    return Collections.unmodifiableSortedSet(open);
  }


  /**
   * Checks the given phase is open.
   *
   * @throws LifecycleException if the phase is unknown or closed
   */
  public void check(String phase) throws LifecycleException {
    Boolean open = phase == null ? null : phases.get(phase);
    if (open == null)
      throw new LifecycleException("unknown lifecycle phase '" + phase + "'");
    if (!open)
      throw new LifecycleException("lifecycle phase '" + phase + "' is closed");
  }


  private void checkName(String phase) {
    if (phase == null || phase.isBlank())
      throw new IllegalArgumentException("blank phase name: " + phase);
  }

}
