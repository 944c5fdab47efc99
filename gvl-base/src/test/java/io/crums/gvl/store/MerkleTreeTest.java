/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class MerkleTreeTest {


  private List<ByteBuffer> randomEntries(int count, long seed) {
    var random = new Random(seed);
    var entries = new ArrayList<ByteBuffer>(count);
    for (int index = 0; index < count; ++index) {
      byte[] bytes = new byte[20 + random.nextInt(40)];
      random.nextBytes(bytes);
      entries.add(ByteBuffer.wrap(bytes));
    }
    return entries;
  }

  private List<ByteBuffer> leaves(List<ByteBuffer> entries) {
    var leaves = new ArrayList<ByteBuffer>(entries.size());
    for (var e : entries)
      leaves.add(MerkleTree.leafHash(e));
    return leaves;
  }


  @Test
  public void testSingleLeaf() {
    var entries = randomEntries(1, 1L);
    var leaves = leaves(entries);
    assertEquals(leaves.get(0), MerkleTree.root(leaves));
    assertTrue(MerkleTree.auditPath(leaves, 0).isEmpty());
  }


  @Test
  public void testTwoLeaves() {
    var leaves = leaves(randomEntries(2, 2L));
    assertEquals(
        MerkleTree.nodeHash(leaves.get(0), leaves.get(1)),
        MerkleTree.root(leaves));
  }


  @Test
  public void testOddPromoted() {
    var leaves = leaves(randomEntries(3, 3L));
    var expected = MerkleTree.nodeHash(
        MerkleTree.nodeHash(leaves.get(0), leaves.get(1)), leaves.get(2));
    assertEquals(expected, MerkleTree.root(leaves));
  }


  @Test
  public void testAllPaths() {
    for (int count : new int[] { 1, 2, 5, 8, 13 }) {
      var entries = randomEntries(count, count);
      var leaves = leaves(entries);
      var root = MerkleTree.root(leaves);
      for (int index = 0; index < count; ++index) {
        var proof = new MerkleProof(index, 0, MerkleTree.auditPath(leaves, index), root);
        assertTrue(proof.verify(entries.get(index)), "count " + count + ", index " + index);
      }
    }
  }


  @Test
  public void testBitFlip() {
    var entries = randomEntries(6, 6L);
    var leaves = leaves(entries);
    var root = MerkleTree.root(leaves);
    var proof = new MerkleProof(4, 0, MerkleTree.auditPath(leaves, 4), root);

    byte[] tampered = new byte[entries.get(4).remaining()];
    entries.get(4).duplicate().get(tampered);
    tampered[3] ^= 1;
    assertFalse(proof.verify(ByteBuffer.wrap(tampered)));
    assertFalse(proof.verify(entries.get(3)));
  }


  @Test
  public void testLeafNodeDomainsSeparate() {
    var leaves = leaves(randomEntries(2, 9L));
    var concat = ByteBuffer.allocate(64).put(leaves.get(0).duplicate())
        .put(leaves.get(1).duplicate()).flip();
    assertNotEquals(MerkleTree.root(leaves), MerkleTree.leafHash(concat));
  }

}
