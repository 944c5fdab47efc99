/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static io.crums.gvl.GvlConstants.DEF_BATCH_SIZE;
import static io.crums.gvl.GvlConstants.getLogger;

import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import io.crums.gvl.ApprovalDecision;
import io.crums.gvl.ByteFormatException;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.Hashing;
import io.crums.gvl.IntegrityException;
import io.crums.gvl.LedgerEntry;
import io.crums.gvl.NotFoundException;
import io.crums.gvl.PersistenceException;

/**
 * The durable, append-only, hash-chained sequence of ledger entries for one
 * partition. Maintains secondary {@linkplain LedgerIndex indices} and seals
 * a {@linkplain MerkleBatch} every time a window of {@linkplain #batchSize()}
 * entries completes.
 *
 * <h2>Concurrency</h2>
 * <p>
 * Appends are serialized by a single writer lock; this is the only mutable
 * shared resource. The size is published only after the entry is durable and
 * indexed, so readers (queries, proofs) work against a consistent snapshot
 * bounded by the size they observed. Indices and batch leaves are derived
 * and are not separately locked.
 * </p>
 * <h2>Failure</h2>
 * <p>
 * A persistence failure on append is retried per the {@linkplain RetryPolicy};
 * if it still fails, a {@linkplain PersistenceException} is thrown and the
 * store refuses further appends (an approved record must never be silently
 * lost, nor the chain forked). There is no delete path.
 * </p>
 */
public class LedgerStore implements AutoCloseable {

  /**
   * Creates and returns an in-memory instance with default settings.
   */
  public static LedgerStore inMemory() {
    return new LedgerStore(new VolatileEntryLog());
  }

  private final static int LEAF_CACHE_SIZE = 4;


  private final String partition;
  private final EntryLog log;
  private final int batchSize;
  private final RetryPolicy retryPolicy;

  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile LedgerIndex index = new LedgerIndex();
  private final List<BatchSealedListener> listeners = new CopyOnWriteArrayList<>();

  @SuppressWarnings("serial")
  private final Map<Long, List<ByteBuffer>> leafCache = Collections.synchronizedMap(
      new LinkedHashMap<>(LEAF_CACHE_SIZE * 2, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, List<ByteBuffer>> eldest) {
          return size() > LEAF_CACHE_SIZE;
        }
      });

  // guarded by writeLock
  private ByteBuffer lastEntryBytes;
  private ByteBuffer lastChainHash;
  private List<ByteBuffer> openLeaves = new ArrayList<>();

  private volatile long size;
  private volatile boolean failed;



  /**
   * Creates an instance over the given log with default settings.
   */
  public LedgerStore(EntryLog log) {
    this("default", log, DEF_BATCH_SIZE, RetryPolicy.DEFAULT);
  }


  /**
   * Creates an instance over the given log with the given batch size.
   */
  public LedgerStore(EntryLog log, int batchSize) {
    this("default", log, batchSize, RetryPolicy.DEFAULT);
  }


  /**
   * Full constructor. Loads the log's state, rebuilds the indices, and seals
   * any batch whose root didn't make it to storage.
   *
   * @param partition   name of the ledger partition
   * @param log         the storage substrate
   * @param batchSize   Merkle batch size (&ge; 1)
   * @param retryPolicy persistence retry policy
   *
   * @throws IntegrityException if the log holds more sealed batches than entries
   *         allow, or an entry is unreadable
   */
  public LedgerStore(String partition, EntryLog log, int batchSize, RetryPolicy retryPolicy) {
    this.partition = Objects.requireNonNull(partition, "null partition");
    this.log = Objects.requireNonNull(log, "null log");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "null retryPolicy");
    if (batchSize < 1)
      throw new IllegalArgumentException("batchSize " + batchSize);
    this.batchSize = batchSize;

    writeLock.lock();
    try {
      long sz = log.size();
      long batches = log.batchCount();
      if (batches > sz / batchSize)
        throw new IntegrityException(
            batches + " sealed batches recorded for only " + sz + " entries (batch size " +
            batchSize + ") in partition " + partition);

      this.size = sz;
      if (sz == 0) {
        lastEntryBytes = ByteBuffer.allocate(0).asReadOnlyBuffer();
        lastChainHash = Hashing.sentinelHash();
      } else {
        var last = log.read(sz - 1);
        lastEntryBytes = last.entryBytes();
        lastChainHash = last.chainHash();
      }
      rebuildIndexesImpl();
      sealPending();
    } finally {
      writeLock.unlock();
    }
  }


  /** Returns the partition name. */
  public String partition() {
    return partition;
  }

  /** Returns the Merkle batch size. */
  public int batchSize() {
    return batchSize;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** Returns the storage substrate. */
  public EntryLog log() {
    return log;
  }

  /**
   * Returns the secondary indices. A {@linkplain #rebuildIndexes() rebuild}
   * replaces the instance; one already handed out stays intact.
   */
  public LedgerIndex index() {
    return index;
  }


  /**
   * Returns the number of committed entries. The next entry appended gets this
   * sequence index.
   */
  public long size() {
    return size;
  }


  /**
   * Returns {@code true} if a persistence failure disabled appends.
   */
  public boolean isFailed() {
    return failed;
  }


  public void addListener(BatchSealedListener listener) {
    listeners.add(Objects.requireNonNull(listener, "null listener"));
  }


  public boolean removeListener(BatchSealedListener listener) {
    return listeners.remove(listener);
  }



  /**
   * Appends a record with no approval decision.
   *
   * @see #append(GovernanceTuple, Optional)
   */
  public LedgerEntry append(GovernanceTuple tuple) throws PersistenceException {
    return append(tuple, Optional.empty());
  }


  /**
   * Appends the given record. The sequence index is assigned here, under the
   * writer lock. Validation is not this class's concern: the admission gate
   * only hands over approved records.
   *
   * @param tuple     the record
   * @param decision  the human approval, if the record was escalated
   *
   * @return the committed entry
   *
   * @throws PersistenceException if the entry could not be made durable after
   *         the configured retries (the store then refuses further appends)
   */
  public LedgerEntry append(GovernanceTuple tuple, Optional<ApprovalDecision> decision)
      throws PersistenceException {

    Objects.requireNonNull(tuple, "null tuple");
    Objects.requireNonNull(decision, "null decision");

    final LedgerEntry entry;
    final List<MerkleBatch> sealed;

    writeLock.lock();
    try {
      if (failed)
        throw new PersistenceException(
            "partition " + partition + " disabled by an earlier persistence failure");

      final long seqNo = size;
      var entryBytes = LedgerEntry.serialize(seqNo, tuple, decision);
      var chainHash = LedgerEntry.chainHash(entryBytes, lastEntryBytes, lastChainHash);

      persist(seqNo, entryBytes, chainHash);

      entry = new LedgerEntry(seqNo, tuple, decision, chainHash);
      lastEntryBytes = entryBytes;
      lastChainHash = chainHash;
      index.add(entry);
      addLeaf(seqNo, entryBytes);
      size = seqNo + 1;

      sealed = sealPending();

    } finally {
      writeLock.unlock();
    }

    for (var batch : sealed)
      fireSealed(batch);

    return entry;
  }


  private void persist(long seqNo, ByteBuffer entryBytes, ByteBuffer chainHash) {
    for (int retry = 0; ; ++retry) {
      try {
        log.append(seqNo, entryBytes, chainHash);
        return;

      } catch (UncheckedIOException | PersistenceException x) {

        if (confirmed(seqNo, chainHash))
          return;

        if (retry >= retryPolicy.maxRetries()) {
          failed = true;
          getLogger().log(Level.ERROR,
              "append of [" + seqNo + "] in partition " + partition + " failed after " +
              (retry + 1) + " attempts; appends disabled", x);
          throw new PersistenceException(
              "failed to persist entry [" + seqNo + "] in partition " + partition +
              " after " + (retry + 1) + " attempts: " + x.getMessage(), x);
        }

        var wait = retryPolicy.backoff(retry + 1);
        getLogger().log(Level.WARNING,
            "append of [" + seqNo + "] in partition " + partition + " failed (" +
            x.getMessage() + "); retry " + (retry + 1) + " in " + wait.toMillis() + "ms");
        try {
          Thread.sleep(wait.toMillis());
        } catch (InterruptedException ix) {
          Thread.currentThread().interrupt();
          failed = true;
          throw new PersistenceException(
              "interrupted retrying append of [" + seqNo + "] in partition " + partition, ix);
        }
      } catch (ConcurrentModificationException cmx) {
        failed = true;
        throw new PersistenceException(
            "log size diverged from store at [" + seqNo + "] in partition " + partition, cmx);
      }
    }
  }


  /**
   * Checks whether a failed append actually made it (e.g. the failure was
   * on reporting, not writing).
   */
  private boolean confirmed(long seqNo, ByteBuffer chainHash) {
    try {
      return log.size() == seqNo + 1 && log.read(seqNo).chainHash().equals(chainHash);
    } catch (RuntimeException x) {
      getLogger().log(Level.DEBUG, "confirm check failed on [" + seqNo + "]: " + x);
      return false;
    }
  }


  private void addLeaf(long seqNo, ByteBuffer entryBytes) {
    openLeaves.add(MerkleTree.leafHash(entryBytes));
    if (openLeaves.size() == batchSize) {
      leafCache.put(seqNo / batchSize, List.copyOf(openLeaves));
      openLeaves = new ArrayList<>();
    }
  }


  /**
   * Seals every completed window whose root is not yet stored. A failure to
   * store a root is not fatal (the root is derived); it is retried on the
   * next append, or on reopening.
   */
  private List<MerkleBatch> sealPending() {
    List<MerkleBatch> sealed = new ArrayList<>(1);
    final long expected = size / batchSize;
    long batchNo = log.batchCount();
    while (batchNo < expected) {
      var leaves = leavesFromCacheOrLog(batchNo);
      var root = MerkleTree.root(leaves);
      try {
        log.appendBatchRoot(batchNo, root);
      } catch (UncheckedIOException uiox) {
        getLogger().log(Level.WARNING,
            "failed to seal batch " + batchNo + " in partition " + partition +
            "; will retry: " + uiox.getMessage());
        break;
      }
      var batch = new MerkleBatch(batchNo, batchNo * batchSize, batchSize, root);
      sealed.add(batch);
      getLogger().log(Level.INFO,
          "sealed batch " + batchNo + " [" + batch.firstSeqNo() + ", " + batch.endSeqNo() +
          ") in partition " + partition + "; root " + Hashing.toHex(root));
      ++batchNo;
    }
    return sealed;
  }


  private void fireSealed(MerkleBatch batch) {
    for (var listener : listeners) {
      try {
        listener.batchSealed(batch);
      } catch (RuntimeException x) {
        getLogger().log(Level.WARNING,
            "batch-sealed listener " + listener + " failed on batch " + batch.batchNo(), x);
      }
    }
  }



  /**
   * Reads the entry at the given sequence index. O(1).
   *
   * @throws NotFoundException if {@code seqNo} is not in {@code [0, size())}
   */
  public LedgerEntry read(long seqNo) throws NotFoundException {
    return rawEntry(seqNo).toEntry();
  }


  /**
   * Reads the entry at the given sequence index, as stored.
   *
   * @throws NotFoundException if {@code seqNo} is not in {@code [0, size())}
   */
  public RawEntry rawEntry(long seqNo) throws NotFoundException {
    checkSeqNo(seqNo, size);
    return log.read(seqNo);
  }


  /**
   * Returns the entry with the given record ID, if any.
   */
  public Optional<LedgerEntry> findById(String id) {
    var seqNo = index.seqNoOf(id, size);
    return seqNo.isPresent() ? Optional.of(read(seqNo.getAsLong())) : Optional.empty();
  }


  /**
   * Returns the chain hash of the last entry (the sentinel hash if empty).
   */
  public ByteBuffer lastChainHash() {
    writeLock.lock();
    try {
      return lastChainHash.duplicate();
    } finally {
      writeLock.unlock();
    }
  }


  /**
   * Returns the number of sealed batches.
   */
  public long sealedBatchCount() {
    return log.batchCount();
  }


  /**
   * Returns the given sealed batch.
   *
   * @throws NotFoundException if not sealed
   */
  public MerkleBatch batch(long batchNo) throws NotFoundException {
    if (batchNo < 0 || batchNo >= sealedBatchCount())
      throw new NotFoundException(
          "batch " + batchNo + " not sealed in partition " + partition);
    return new MerkleBatch(batchNo, batchNo * batchSize, batchSize, log.batchRoot(batchNo));
  }


  /**
   * Tests whether the entry at the given sequence index is in a sealed batch.
   */
  public boolean isSealed(long seqNo) {
    return seqNo >= 0 && seqNo / batchSize < sealedBatchCount();
  }


  /**
   * Returns a Merkle inclusion proof for the entry at the given sequence index.
   * The entry's batch window must be complete. If the batch's root is not
   * stored yet (its seal is pending a retry), the proof carries the root
   * recomputed from the entries; it's the same root the seal will store.
   *
   * @throws NotFoundException if the entry does not exist, or its batch window
   *         is not complete
   * @throws IntegrityException if the batch's recomputed root does not match
   *         its sealed root
   */
  public MerkleProof merkleProof(long seqNo) throws NotFoundException, IntegrityException {
    final long sz = size;
    checkSeqNo(seqNo, sz);
    final long batchNo = seqNo / batchSize;
    final long first = batchNo * batchSize;
    if (first + batchSize > sz)
      throw new NotFoundException(
          "entry [" + seqNo + "] in partition " + partition + " is in open batch " + batchNo);

    final List<ByteBuffer> leaves;
    final ByteBuffer root;
    if (batchNo < sealedBatchCount()) {
      var batch = batch(batchNo);
      leaves = leaves(batch);
      root = batch.root();
    } else {
      leaves = leavesFromCacheOrLog(batchNo);
      root = MerkleTree.root(leaves);
    }
    int leafIndex = (int) (seqNo - first);
    return new MerkleProof(seqNo, batchNo, MerkleTree.auditPath(leaves, leafIndex), root);
  }


  /**
   * Returns a chain-segment proof for the entry at the given sequence index.
   *
   * @throws NotFoundException if the entry does not exist
   */
  public ChainSegmentProof chainSegmentProof(long seqNo) throws NotFoundException {
    var raw = rawEntry(seqNo);
    if (seqNo == 0)
      return new ChainSegmentProof(
          0, ByteBuffer.allocate(0), Hashing.sentinelHash(), raw.chainHash());
    var prev = log.read(seqNo - 1);
    return new ChainSegmentProof(seqNo, prev.entryBytes(), prev.chainHash(), raw.chainHash());
  }



  private List<ByteBuffer> leaves(MerkleBatch batch) throws IntegrityException {
    var leaves = leafCache.get(batch.batchNo());
    if (leaves != null)
      return leaves;
    leaves = leavesFromLog(batch.batchNo());
    var root = MerkleTree.root(leaves);
    if (!root.equals(batch.root()))
      throw new IntegrityException(
          "batch " + batch.batchNo() + " in partition " + partition +
          ": recomputed root " + Hashing.toHex(root) + " != sealed root " +
          Hashing.toHex(batch.root()));
    leafCache.put(batch.batchNo(), leaves);
    return leaves;
  }


  private List<ByteBuffer> leavesFromCacheOrLog(long batchNo) {
    var leaves = leafCache.get(batchNo);
    if (leaves == null) {
      leaves = leavesFromLog(batchNo);
      leafCache.put(batchNo, leaves);
    }
    return leaves;
  }


  private List<ByteBuffer> leavesFromLog(long batchNo) {
    final long first = batchNo * batchSize;
    var leaves = new ArrayList<ByteBuffer>(batchSize);
    for (long seqNo = first; seqNo < first + batchSize; ++seqNo)
      leaves.add(MerkleTree.leafHash(log.read(seqNo).entryBytes()));
    return List.copyOf(leaves);
  }



  /**
   * Rebuilds the secondary indices from the entry log. Indices are derived
   * state; this is the remedy if they are suspect.
   */
  public void rebuildIndexes() {
    writeLock.lock();
    try {
      rebuildIndexesImpl();
    } finally {
      writeLock.unlock();
    }
  }


  private void rebuildIndexesImpl() {
    var rebuilt = new LedgerIndex();
    openLeaves = new ArrayList<>();
    final long sz = size;
    final long openStart = (sz / batchSize) * batchSize;
    for (long seqNo = 0; seqNo < sz; ++seqNo) {
      var raw = log.read(seqNo);
      try {
        rebuilt.add(raw.toEntry());
      } catch (ByteFormatException bfx) {
        throw new IntegrityException(
            "entry [" + seqNo + "] in partition " + partition + " is unreadable: " +
            bfx.getMessage(), bfx);
      }
      if (seqNo >= openStart)
        openLeaves.add(MerkleTree.leafHash(raw.entryBytes()));
    }
    // readers holding the old instance never see it emptied
    index = rebuilt;
  }


  private void checkSeqNo(long seqNo, long bound) throws NotFoundException {
    if (seqNo < 0 || seqNo >= bound)
      throw new NotFoundException(
          "no entry [" + seqNo + "] in partition " + partition + " (size " + bound + ")");
  }


  /**
   * Closes the underlying log.
   */
  @Override
  public void close() {
    writeLock.lock();
    try {
      log.close();
    } finally {
      writeLock.unlock();
    }
  }


  @Override
  public String toString() {
    return "LedgerStore[" + partition + ", size " + size + "]";
  }

}
