/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.verify;


import java.nio.ByteBuffer;

import io.crums.gvl.Hashing;
import io.crums.gvl.store.LedgerStore;

/**
 * A trusted (ledger size, head chain hash) pair, recorded out-of-band. A
 * ledger that no longer reaches the anchored size, or whose entry at that
 * position has a different chain hash, was truncated or rewritten.
 *
 * @param size      number of entries when anchored
 * @param chainHash chain hash of entry {@code size - 1} (sentinel if {@code size} is zero)
 */
public record ChainAnchor(long size, ByteBuffer chainHash) {

  public ChainAnchor {
    if (size < 0)
      throw new IllegalArgumentException("size " + size);
    chainHash = Hashing.checkHash(chainHash);
  }


  @Override
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }


  /**
   * Anchors the given store's current head.
   */
  public static ChainAnchor of(LedgerStore store) {
    long size = store.size();
    return new ChainAnchor(
        size, size == 0 ? Hashing.sentinelHash() : store.rawEntry(size - 1).chainHash());
  }


  /**
   * Parses the {@linkplain #toString() string form} {@code size:hex}.
   *
   * @throws IllegalArgumentException if malformed
   */
  public static ChainAnchor parse(String anchor) {
    int colon = anchor.indexOf(':');
    if (colon < 1)
      throw new IllegalArgumentException("expected size:hex, got " + anchor);
    long size = Long.parseLong(anchor.substring(0, colon).trim());
    return new ChainAnchor(
        size, ByteBuffer.wrap(Hashing.fromHex(anchor.substring(colon + 1).trim())));
  }


  @Override
  public String toString() {
    return size + ":" + Hashing.toHex(chainHash);
  }

}
