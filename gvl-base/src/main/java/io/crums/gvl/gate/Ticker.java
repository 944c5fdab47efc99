/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;

/**
 * Monotonic time source. Approval timeouts are measured on this, not on the
 * wall clock.
 */
@FunctionalInterface
public interface Ticker {

  /** {@code System.nanoTime()}. */
  Ticker SYSTEM = System::nanoTime;

  /**
   * Returns nanoseconds elapsed since some fixed but arbitrary origin.
   */
  long nanos();

}
