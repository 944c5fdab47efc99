/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;

import io.crums.gvl.Hashing;

/**
 * In-memory {@linkplain EntryLog}. Useful for tests and for ledgers
 * that are rebuilt from elsewhere.
 */
public class VolatileEntryLog implements EntryLog {

  private final List<RawEntry> entries = new ArrayList<>();
  private final List<ByteBuffer> roots = new ArrayList<>();



  @Override
  public synchronized long size() {
    return entries.size();
  }


  @Override
  public synchronized long append(long index, ByteBuffer entryBytes, ByteBuffer chainHash) {
    if (index != entries.size())
      throw new ConcurrentModificationException(
          "on index " + index + "; size " + entries.size());
    entries.add(new RawEntry(index, copy(entryBytes), copy(Hashing.checkHash(chainHash))));
    return entries.size();
  }


  @Override
  public synchronized RawEntry read(long index) {
    if (index < 0 || index >= entries.size())
      throw new IllegalArgumentException(
          "index " + index + " out of bounds; size " + entries.size());
    return entries.get((int) index);
  }


  @Override
  public synchronized long batchCount() {
    return roots.size();
  }


  @Override
  public synchronized void appendBatchRoot(long batchNo, ByteBuffer root) {
    if (batchNo != roots.size())
      throw new ConcurrentModificationException(
          "on batchNo " + batchNo + "; batch count " + roots.size());
    roots.add(copy(Hashing.checkHash(root)));
  }


  @Override
  public synchronized ByteBuffer batchRoot(long batchNo) {
    if (batchNo < 0 || batchNo >= roots.size())
      throw new IllegalArgumentException(
          "batchNo " + batchNo + " out of bounds; batch count " + roots.size());
    return roots.get((int) batchNo).duplicate();
  }


  /** No-op. */
  @Override
  public void close() {  }


  private ByteBuffer copy(ByteBuffer buffer) {
    var b = buffer.duplicate();
    return ByteBuffer.allocate(b.remaining()).put(b).flip().asReadOnlyBuffer();
  }

}
