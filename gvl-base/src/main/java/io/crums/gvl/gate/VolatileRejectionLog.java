/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory {@linkplain RejectionLog}.
 */
public class VolatileRejectionLog implements RejectionLog {

  private final List<Rejection> rejections = new ArrayList<>();

  @Override
  public synchronized void record(Rejection rejection) {
    rejections.add(Objects.requireNonNull(rejection, "null rejection"));
  }

  @Override
  public synchronized List<Rejection> list() {
    return List.copyOf(rejections);
  }

  @Override
  public synchronized int size() {
    return rejections.size();
  }

}
