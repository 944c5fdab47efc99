/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.ConcurrentModificationException;

/**
 * Persistence substrate for the ledger store: an atomic-append,
 * index-addressable log of entries, plus a small table of sealed Merkle
 * batch roots. Implementations know nothing about hashing; they store
 * what they're given.
 *
 * <h2>Atomicity</h2>
 * <p>
 * {@linkplain #append(long, ByteBuffer, ByteBuffer)} is all-or-nothing: either
 * the entry and its chain hash are confirmed and {@linkplain #size()} grows by
 * one, or nothing observable changes. A file-based implementation discards an
 * unconfirmed append when it is next opened.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Appends are serialized by the caller (the ledger store's writer lock).
 * Reads of confirmed indices may proceed concurrently with appends.
 * </p>
 *
 * @see VolatileEntryLog
 * @see EntryLogDir
 */
public interface EntryLog extends AutoCloseable {


  /**
   * Returns the number of confirmed entries.
   */
  long size();


  /**
   * Appends an entry and its chain hash.
   *
   * @param index       the expected index of the new entry; must equal {@linkplain #size()}
   * @param entryBytes  serial form of the entry (remaining bytes)
   * @param chainHash   32 remaining bytes
   *
   * @return the new size
   *
   * @throws ConcurrentModificationException if {@code index != size()}
   * @throws UncheckedIOException on I/O failure (nothing appended)
   */
  long append(long index, ByteBuffer entryBytes, ByteBuffer chainHash)
      throws ConcurrentModificationException, UncheckedIOException;


  /**
   * Reads the entry at the given index.
   *
   * @param index &ge; 0 and &lt; {@linkplain #size()}
   */
  RawEntry read(long index) throws UncheckedIOException;


  /**
   * Returns the number of sealed batch roots.
   */
  long batchCount();


  /**
   * Appends a sealed batch root.
   *
   * @param batchNo must equal {@linkplain #batchCount()}
   */
  void appendBatchRoot(long batchNo, ByteBuffer root)
      throws ConcurrentModificationException, UncheckedIOException;


  /**
   * Returns the root of the given sealed batch.
   *
   * @param batchNo &ge; 0 and &lt; {@linkplain #batchCount()}
   * @return 32 remaining bytes
   */
  ByteBuffer batchRoot(long batchNo) throws UncheckedIOException;


  /**
   * Closes the log. Idempotent. Does not throw checked exceptions.
   */
  @Override
  void close() throws UncheckedIOException;

}
