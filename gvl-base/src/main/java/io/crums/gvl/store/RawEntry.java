/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.nio.ByteBuffer;

import io.crums.gvl.ByteFormatException;
import io.crums.gvl.Hashing;
import io.crums.gvl.LedgerEntry;

/**
 * An entry as stored: its serial form and its stored chain hash. Neither is
 * validated here; the integrity verifier works at this level.
 * 
 * @param seqNo       sequence index it was read from
 * @param entryBytes  serial form of the entry (sans chain hash)
 * @param chainHash   the stored chain hash (32 bytes)
 */
public record RawEntry(long seqNo, ByteBuffer entryBytes, ByteBuffer chainHash) {
  
  public RawEntry {
    entryBytes = entryBytes.slice().asReadOnlyBuffer();
    chainHash = Hashing.checkHash(chainHash);
  }
  
  @Override
  public ByteBuffer entryBytes() {
    return entryBytes.duplicate();
  }
  
  @Override
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }
  
  
  /**
   * Parses and returns the entry.
   * 
   * @throws ByteFormatException if the bytes are malformed, or if the
   *         sequence index written in the bytes is not {@linkplain #seqNo()}
   */
  public LedgerEntry toEntry() throws ByteFormatException {
    var entry = LedgerEntry.load(entryBytes(), chainHash());
    if (entry.seqNo() != seqNo)
      throw new ByteFormatException(
          "entry stored at [" + seqNo + "] claims seqNo " + entry.seqNo());
    return entry;
  }

}
