/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.List;

/**
 * The non-chained log of rejected admissions.
 *
 * @see VolatileRejectionLog
 * @see RejectionLogFile
 */
public interface RejectionLog {

  /**
   * Records the given rejection.
   */
  void record(Rejection rejection);

  /**
   * Returns the rejections recorded, in the order recorded.
   */
  List<Rejection> list();

  /**
   * Returns the number of rejections recorded.
   */
  default int size() {
    return list().size();
  }

}
