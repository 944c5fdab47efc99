/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff, used for persistence failures
 * on append.
 * 
 * @param maxRetries      retries after the first attempt (&ge; 0)
 * @param initialBackoff  wait before the first retry
 * @param maxBackoff      cap on any single wait
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff) {
  
  /** 3 retries, starting at 100ms, capped at 2s. */
  public final static RetryPolicy DEFAULT =
      new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(2));
  
  /** No retries. */
  public final static RetryPolicy NONE =
      new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
  
  
  public RetryPolicy {
    if (maxRetries < 0)
      throw new IllegalArgumentException("maxRetries " + maxRetries);
    Objects.requireNonNull(initialBackoff, "null initialBackoff");
    Objects.requireNonNull(maxBackoff, "null maxBackoff");
    if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0)
      throw new IllegalArgumentException(
          "initialBackoff " + initialBackoff + ", maxBackoff " + maxBackoff);
  }
  
  
  /**
   * Returns the wait before the given retry.
   * 
   * @param retry &ge; 1
   */
  public Duration backoff(int retry) {
    if (retry < 1)
      throw new IllegalArgumentException("retry " + retry);
    Duration wait = initialBackoff;
    for (int r = 1; r < retry && wait.compareTo(maxBackoff) < 0; ++r)
      wait = wait.multipliedBy(2);
    return wait.compareTo(maxBackoff) > 0 ? maxBackoff : wait;
  }

}
