/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.nio.ByteBuffer;

/**
 * Verification artifact for a single ledger entry.
 * 
 * @see MerkleProof
 * @see ChainSegmentProof
 */
public interface EntryProof {
  
  /** Type byte for {@linkplain MerkleProof}s in serial form. */
  byte MERKLE_TYPE = 1;
  /** Type byte for {@linkplain ChainSegmentProof}s in serial form. */
  byte CHAIN_TYPE = 2;
  
  
  /**
   * Sequence index of the entry this proof is about.
   */
  long seqNo();
  
  
  /**
   * Returns {@code true} iff the given entry bytes (the entry's serial form)
   * check out against this proof.
   */
  boolean verify(ByteBuffer entryBytes);
  
  
  /** Byte size of the serial form, including the type byte. */
  int serialSize();
  
  
  /**
   * Writes the serial form, starting with the type byte.
   */
  ByteBuffer writeTo(ByteBuffer out);

}
