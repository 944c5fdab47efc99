/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.nio.ByteBuffer;

import io.crums.gvl.Hashing;

/**
 * A sealed window of consecutive entries and its Merkle root. Immutable.
 * 
 * @param batchNo     zero-based batch number
 * @param firstSeqNo  sequence index of the first entry in the batch
 * @param size        number of entries in the batch
 * @param root        Merkle root over the batch's entries
 */
public record MerkleBatch(long batchNo, long firstSeqNo, int size, ByteBuffer root) {
  
  public MerkleBatch {
    if (batchNo < 0 || firstSeqNo < 0 || size < 1)
      throw new IllegalArgumentException(
          "batchNo " + batchNo + ", firstSeqNo " + firstSeqNo + ", size " + size);
    root = Hashing.checkHash(root);
  }
  
  @Override
  public ByteBuffer root() {
    return root.duplicate();
  }
  
  /** Sequence index one beyond the last entry in the batch. */
  public long endSeqNo() {
    return firstSeqNo + size;
  }
  
  public boolean contains(long seqNo) {
    return seqNo >= firstSeqNo && seqNo < endSeqNo();
  }

}
