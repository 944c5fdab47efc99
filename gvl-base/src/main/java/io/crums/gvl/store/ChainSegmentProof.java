/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static io.crums.gvl.GvlConstants.HASH_WIDTH;

import java.nio.ByteBuffer;

import io.crums.gvl.Hashing;
import io.crums.gvl.LedgerEntry;

/**
 * Chain-segment hint for an entry not (yet) in a sealed batch: the previous
 * entry's bytes and chain hash, and the entry's stored chain hash. Verifying
 * recomputes the entry's chain hash. The claimed chain hash links forward to
 * the ledger's head, which a verifier may walk or compare against an anchor.
 *
 * @param seqNo           the entry's sequence index
 * @param prevEntryBytes  serial form of entry {@code seqNo - 1} (empty if first)
 * @param prevChainHash   chain hash of entry {@code seqNo - 1} (sentinel if first)
 * @param chainHash       the entry's stored chain hash
 */
public record ChainSegmentProof(
    long seqNo, ByteBuffer prevEntryBytes, ByteBuffer prevChainHash, ByteBuffer chainHash)
    implements EntryProof {

  public ChainSegmentProof {
    if (seqNo < 0)
      throw new IllegalArgumentException("seqNo " + seqNo);
    prevEntryBytes = prevEntryBytes.slice().asReadOnlyBuffer();
    prevChainHash = Hashing.checkHash(prevChainHash);
    chainHash = Hashing.checkHash(chainHash);
    if (seqNo == 0 && prevEntryBytes.hasRemaining())
      throw new IllegalArgumentException("first entry has no predecessor");
  }


  @Override
  public ByteBuffer prevEntryBytes() {
    return prevEntryBytes.duplicate();
  }

  @Override
  public ByteBuffer prevChainHash() {
    return prevChainHash.duplicate();
  }

  @Override
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }


  @Override
  public boolean verify(ByteBuffer entryBytes) {
    return
        LedgerEntry.chainHash(entryBytes, prevEntryBytes, prevChainHash)
        .equals(chainHash);
  }


  @Override
  public int serialSize() {
    return 1 + 8 + 4 + prevEntryBytes.remaining() + HASH_WIDTH + HASH_WIDTH;
  }


  @Override
  public ByteBuffer writeTo(ByteBuffer out) {
    out.put(CHAIN_TYPE).putLong(seqNo);
    out.putInt(prevEntryBytes.remaining()).put(prevEntryBytes());
    return out.put(prevChainHash()).put(chainHash());
  }

}
