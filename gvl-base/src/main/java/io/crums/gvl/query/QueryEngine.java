/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;


import static io.crums.gvl.GvlConstants.getLogger;

import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

import io.crums.gvl.GvlException;
import io.crums.gvl.IntegrityException;
import io.crums.gvl.LedgerEntry;
import io.crums.gvl.NotFoundException;
import io.crums.gvl.store.EntryProof;
import io.crums.gvl.store.LedgerIndex;
import io.crums.gvl.store.LedgerIndex.Dimension;
import io.crums.gvl.store.LedgerStore;

/**
 * Read-only, paged, filtered access to a {@linkplain LedgerStore}. Every
 * result carries a proof: a {@linkplain io.crums.gvl.store.MerkleProof} if the
 * entry's batch window is complete within the query's snapshot, a
 * {@linkplain io.crums.gvl.store.ChainSegmentProof} otherwise.
 * <p>
 * Queries never take the store's writer lock. They run against the snapshot
 * size observed on the first page (carried forward in the page token), so
 * repeating a query with the same token yields the same page.
 * </p>
 */
public class QueryEngine {

  private final LedgerStore store;


  public QueryEngine(LedgerStore store) {
    this.store = Objects.requireNonNull(store, "null store");
  }


  public LedgerStore store() {
    return store;
  }


  /**
   * Runs the given query.
   *
   * @throws InvalidQueryException if the page token does not belong to this
   *         query or ledger
   * @throws ProofUnavailableException if a proof cannot be built for a matching entry
   */
  public QueryPage query(LedgerQuery query)
      throws InvalidQueryException, ProofUnavailableException {

    final long fingerprint = query.fingerprint();
    final long snapshot;
    final long start;

    var token = query.token();
    if (token.isPresent()) {
      var t = token.get();
      if (t.fingerprint() != fingerprint)
        throw new InvalidQueryException("page token was issued for a different query");
      if (t.snapshotSize() > store.size())
        throw new InvalidQueryException(
            "page token snapshot " + t.snapshotSize() + " exceeds ledger size " + store.size());
      snapshot = t.snapshotSize();
      start = t.nextSeqNo();
    } else {
      snapshot = store.size();
      start = 0;
    }

    long[] candidates = candidates(query, snapshot);
    final int pageSize = query.pageSize();
    var entries = new ArrayList<ProvenEntry>(Math.min(pageSize, 64));
    Optional<PageToken> next = Optional.empty();

    final int count = candidates == null ? -1 : candidates.length;
    int index = candidates == null ? 0 : firstIndex(candidates, start);
    long seqNo = candidates == null ? start : 0;

    while (true) {
      if (candidates == null) {
        if (seqNo >= snapshot)
          break;
      } else {
        if (index >= count)
          break;
        seqNo = candidates[index++];
      }

      var entry = store.read(seqNo);
      if (query.matches(entry.tuple())) {
        if (entries.size() == pageSize) {
          next = Optional.of(new PageToken(snapshot, seqNo, fingerprint));
          break;
        }
        entries.add(new ProvenEntry(entry, proof(entry, snapshot)));
      }
      if (candidates == null)
        ++seqNo;
    }

    return new QueryPage(snapshot, entries, next);
  }


  /**
   * Returns the ascending candidate sequence indices from the most selective
   * index, or {@code null} if no indexed filter is set (full scan).
   */
  private long[] candidates(LedgerQuery query, long snapshot) {
    LedgerIndex index = store.index();
    long[] best = null;
    if (query.category().isPresent())
      best = smaller(best, index.lookup(Dimension.CATEGORY, query.category().get(), snapshot));
    if (query.phase().isPresent())
      best = smaller(best, index.lookup(Dimension.PHASE, query.phase().get(), snapshot));
    if (query.recordType().isPresent())
      best = smaller(best, index.lookup(Dimension.RECORD_TYPE, query.recordType().get(), snapshot));
    if (query.criticalities().isPresent() && query.criticalities().get().size() == 1) {
      var c = query.criticalities().get().iterator().next();
      best = smaller(best, index.lookup(Dimension.CRITICALITY, c.name(), snapshot));
    }
    if (query.fromTime().isPresent() && query.toTime().isPresent()) {
      best = smaller(best,
          index.lookupDays(
              LedgerIndex.dayOf(query.fromTime().get()),
              LedgerIndex.dayOf(query.toTime().get()),
              snapshot));
    }
    return best;
  }


  private long[] smaller(long[] a, long[] b) {
    return a == null || b.length < a.length ? b : a;
  }


  private int firstIndex(long[] candidates, long start) {
    int lo = 0, hi = candidates.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (candidates[mid] < start)
        lo = mid + 1;
      else
        hi = mid;
    }
    return lo;
  }



  /**
   * Returns the entry at the given sequence index with its proof.
   *
   * @throws NotFoundException if there is no such entry
   */
  public ProvenEntry entry(long seqNo) throws NotFoundException, ProofUnavailableException {
    final long snapshot = store.size();
    if (seqNo < 0 || seqNo >= snapshot)
      throw new NotFoundException("no entry [" + seqNo + "] (size " + snapshot + ")");
    var entry = store.read(seqNo);
    return new ProvenEntry(entry, proof(entry, snapshot));
  }


  /**
   * Returns the entry with the given record ID with its proof.
   *
   * @throws NotFoundException if there is no such entry
   */
  public ProvenEntry findById(String id) throws NotFoundException, ProofUnavailableException {
    final long snapshot = store.size();
    var seqNo = store.index().seqNoOf(id, snapshot);
    if (seqNo.isEmpty())
      throw new NotFoundException("no entry with record ID " + id);
    var entry = store.read(seqNo.getAsLong());
    return new ProvenEntry(entry, proof(entry, snapshot));
  }


  private EntryProof proof(LedgerEntry entry, long snapshot) throws ProofUnavailableException {
    final long seqNo = entry.seqNo();
    final long batchNo = seqNo / store.batchSize();
    // decided by the snapshot alone, not by when the batch root got stored
    boolean batchInSnapshot = (batchNo + 1) * store.batchSize() <= snapshot;
    try {
      return batchInSnapshot ? store.merkleProof(seqNo) : store.chainSegmentProof(seqNo);
    } catch (IntegrityException ix) {
      getLogger().log(Level.ERROR, "proof for entry [" + seqNo + "] failed integrity check", ix);
      throw new ProofUnavailableException(
          "no proof for entry [" + seqNo + "]: " + ix.getMessage(), ix);
    } catch (GvlException | UncheckedIOException x) {
      throw new ProofUnavailableException(
          "no proof for entry [" + seqNo + "]: " + x.getMessage(), x);
    }
  }

}
