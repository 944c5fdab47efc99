/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static io.crums.gvl.GvlConstants.HASH_WIDTH;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

import io.crums.gvl.Hashing;

/**
 * Inclusion proof for an entry in a sealed {@linkplain MerkleBatch}. Its size
 * is logarithmic in the batch size.
 * 
 * @param seqNo       the entry's sequence index
 * @param batchNo     the sealed batch the entry belongs to
 * @param path        audit path, leaf to root
 * @param root        the batch's sealed root
 * 
 * @see MerkleTree
 */
public record MerkleProof(long seqNo, long batchNo, List<Step> path, ByteBuffer root)
    implements EntryProof {
  
  
  /**
   * A step in the audit path.
   * 
   * @param sibling       the sibling node's hash
   * @param siblingOnLeft {@code true} iff the sibling is the left child
   */
  public record Step(ByteBuffer sibling, boolean siblingOnLeft) {
    public Step {
      sibling = Hashing.checkHash(sibling);
    }
    @Override
    public ByteBuffer sibling() {
      return sibling.duplicate();
    }
  }
  
  
  public MerkleProof {
    if (seqNo < 0 || batchNo < 0)
      throw new IllegalArgumentException("seqNo " + seqNo + ", batchNo " + batchNo);
    path = List.copyOf(Objects.requireNonNull(path, "null path"));
    root = Hashing.checkHash(root);
  }
  
  
  @Override
  public ByteBuffer root() {
    return root.duplicate();
  }
  
  
  /**
   * Recomputes the root from the given entry bytes and the audit path.
   */
  public ByteBuffer computeRoot(ByteBuffer entryBytes) {
    return MerkleTree.rootFromPath(MerkleTree.leafHash(entryBytes), path);
  }
  

  @Override
  public boolean verify(ByteBuffer entryBytes) {
    return computeRoot(entryBytes).equals(root);
  }
  

  @Override
  public int serialSize() {
    return 1 + 8 + 8 + 4 + path.size() * (1 + HASH_WIDTH) + HASH_WIDTH;
  }
  

  @Override
  public ByteBuffer writeTo(ByteBuffer out) {
    out.put(MERKLE_TYPE).putLong(seqNo).putLong(batchNo).putInt(path.size());
    for (var step : path)
      out.put((byte) (step.siblingOnLeft() ? 1 : 0)).put(step.sibling());
    return out.put(root());
  }

}
