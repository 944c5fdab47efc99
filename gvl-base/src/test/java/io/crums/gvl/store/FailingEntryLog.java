/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test decorator that fails a set number of appends. A failure can happen
 * either before the write (nothing appended) or after it (appended, but
 * reported as failed).
 */
public class FailingEntryLog implements EntryLog {

  private final EntryLog base;
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private volatile boolean failAfterWrite;
  private volatile boolean failSeals;


  public FailingEntryLog(EntryLog base) {
    this.base = base;
  }


  /** Fails the next {@code count} appends before writing. */
  public FailingEntryLog failNext(int count) {
    failAfterWrite = false;
    failuresLeft.set(count);
    return this;
  }

  /** Fails the next {@code count} appends after writing. */
  public FailingEntryLog failNextAfterWrite(int count) {
    failAfterWrite = true;
    failuresLeft.set(count);
    return this;
  }

  public FailingEntryLog failSeals(boolean fail) {
    failSeals = fail;
    return this;
  }


  @Override
  public long size() {
    return base.size();
  }

  @Override
  public long append(long index, ByteBuffer entryBytes, ByteBuffer chainHash) {
    if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      if (failAfterWrite)
        base.append(index, entryBytes, chainHash);
      throw new UncheckedIOException(new IOException("disk on fire at [" + index + "]"));
    }
    return base.append(index, entryBytes, chainHash);
  }

  @Override
  public RawEntry read(long index) {
    return base.read(index);
  }

  @Override
  public long batchCount() {
    return base.batchCount();
  }

  @Override
  public void appendBatchRoot(long batchNo, ByteBuffer root) {
    if (failSeals)
      throw new UncheckedIOException(new IOException("batch file on fire"));
    base.appendBatchRoot(batchNo, root);
  }

  @Override
  public ByteBuffer batchRoot(long batchNo) {
    return base.batchRoot(batchNo);
  }

  @Override
  public void close() {
    base.close();
  }

}
