/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.util.Arrays;

/**
 * Append-only, ascending list of sequence indices. Thread-safe.
 */
class SeqList {
  
  private long[] seqNos = new long[8];
  private int size;
  
  
  synchronized void add(long seqNo) {
    if (size > 0 && seqNos[size - 1] >= seqNo)
      throw new IllegalArgumentException(
          "seqNo " + seqNo + " not greater than last " + seqNos[size - 1]);
    if (size == seqNos.length)
      seqNos = Arrays.copyOf(seqNos, size * 2);
    seqNos[size++] = seqNo;
  }
  
  
  /**
   * Returns the indices less than {@code bound}, in ascending order.
   */
  synchronized long[] head(long bound) {
    int index = Arrays.binarySearch(seqNos, 0, size, bound);
    int end = index < 0 ? -index - 1 : index;
    return Arrays.copyOf(seqNos, end);
  }
  
  
  synchronized int size() {
    return size;
  }

}
