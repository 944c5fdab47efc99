/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.gvl.Hashing;

/**
 * Merkle tree hashing over a batch of entries. Leaves and internal nodes
 * are domain-separated by a one-byte prefix:
 * <pre>
 *   leaf = SHA-256(0x00 || serialize(entry))
 *   node = SHA-256(0x01 || left || right)
 * </pre>
 * <p>
 * Levels are built bottom up, pairing nodes left to right; an unpaired last
 * node is promoted to the next level unchanged.
 * </p>
 */
public class MerkleTree {
  
  final static byte LEAF_PREFIX = 0;
  final static byte NODE_PREFIX = 1;
  
  // static only
  private MerkleTree() {  }
  
  
  /**
   * Returns the leaf hash of the given entry bytes.
   */
  public static ByteBuffer leafHash(ByteBuffer entryBytes) {
    return Hashing.hash(ByteBuffer.wrap(new byte[] { LEAF_PREFIX }), entryBytes);
  }
  
  
  /**
   * Returns the internal node hash of the given children.
   */
  public static ByteBuffer nodeHash(ByteBuffer left, ByteBuffer right) {
    return Hashing.hash(ByteBuffer.wrap(new byte[] { NODE_PREFIX }), left, right);
  }
  
  
  /**
   * Returns the root of the tree with the given leaf hashes.
   * 
   * @param leaves not empty
   */
  public static ByteBuffer root(List<ByteBuffer> leaves) {
    checkLeaves(leaves);
    List<ByteBuffer> level = leaves;
    while (level.size() > 1)
      level = nextLevel(level);
    return level.get(0);
  }
  
  
  /**
   * Returns the audit path for the leaf at the given index. The path's steps
   * run from the leaf up; levels at which the node is promoted (has no
   * sibling) contribute no step.
   * 
   * @param leaves      leaf hashes
   * @param leafIndex   index of the leaf to prove
   */
  public static List<MerkleProof.Step> auditPath(List<ByteBuffer> leaves, int leafIndex) {
    checkLeaves(leaves);
    Objects.checkIndex(leafIndex, leaves.size());
    
    var path = new ArrayList<MerkleProof.Step>();
    List<ByteBuffer> level = leaves;
    int index = leafIndex;
    while (level.size() > 1) {
      boolean isRight = (index & 1) == 1;
      if (isRight)
        path.add(new MerkleProof.Step(level.get(index - 1), true));
      else if (index + 1 < level.size())
        path.add(new MerkleProof.Step(level.get(index + 1), false));
      level = nextLevel(level);
      index >>= 1;
    }
    return path;
  }
  
  
  /**
   * Computes the root from a leaf hash and its audit path.
   */
  public static ByteBuffer rootFromPath(ByteBuffer leafHash, List<MerkleProof.Step> path) {
    ByteBuffer hash = leafHash;
    for (var step : path)
      hash = step.siblingOnLeft() ?
          nodeHash(step.sibling(), hash) :
            nodeHash(hash, step.sibling());
    return hash;
  }
  
  
  
  private static List<ByteBuffer> nextLevel(List<ByteBuffer> level) {
    final int size = level.size();
    var next = new ArrayList<ByteBuffer>((size + 1) / 2);
    for (int index = 0; index + 1 < size; index += 2)
      next.add(nodeHash(level.get(index), level.get(index + 1)));
    if ((size & 1) == 1)
      next.add(level.get(size - 1));
    return next;
  }
  
  
  private static void checkLeaves(List<ByteBuffer> leaves) {
    if (leaves.isEmpty())
      throw new IllegalArgumentException("empty leaves");
  }

}
