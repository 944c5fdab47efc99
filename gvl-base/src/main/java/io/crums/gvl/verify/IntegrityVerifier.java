/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.verify;


import static io.crums.gvl.GvlConstants.getLogger;

import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.gvl.Hashing;
import io.crums.gvl.LedgerEntry;
import io.crums.gvl.sig.TupleVerifier;
import io.crums.gvl.sig.VerificationException;
import io.crums.gvl.store.EntryLog;
import io.crums.gvl.store.MerkleTree;
import io.crums.gvl.verify.VerificationReport.Issue;
import io.crums.gvl.verify.VerificationReport.Kind;

/**
 * Recomputes a ledger's hash chain and sealed batch roots from the stored
 * entries and compares them against the stored values. Optionally re-verifies
 * record signatures and checks the head against a trusted
 * {@linkplain ChainAnchor}.
 * <p>
 * Works directly on the {@linkplain EntryLog}, not on a store, since a store
 * won't open over some kinds of damage. Reports; never corrects: correcting a
 * ledger takes a trust decision this code has no authority to make.
 * </p>
 * <h2>Chain checks</h2>
 * <p>
 * Each entry's chain hash is recomputed from its own bytes and the
 * <em>stored</em> previous entry and chain hash. This localizes damage: a
 * single altered entry at index <em>i</em> shows up as a
 * {@linkplain VerificationReport.Kind#CHAIN_MISMATCH} at <em>i</em> and
 * <em>i + 1</em> (whose input changed), not at every index after it. The
 * chain only vouches for a prefix, however, so no entry at or past the first
 * mismatch is covered by an intact chain back to the start. See
 * {@linkplain VerificationReport#intactPrefix()}.
 * </p>
 */
public class IntegrityVerifier {

  private final EntryLog log;
  private final int batchSize;
  private final Optional<TupleVerifier> signatures;
  private final Optional<ChainAnchor> anchor;


  /**
   * Creates an instance that checks chain hashes, sequence indices and batch
   * roots only.
   *
   * @param log       the entry log
   * @param batchSize the ledger's Merkle batch size
   */
  public IntegrityVerifier(EntryLog log, int batchSize) {
    this(log, batchSize, Optional.empty(), Optional.empty());
  }


  /**
   * Full constructor.
   *
   * @param signatures if present, record signatures are checked too
   * @param anchor     if present, the head is checked against it
   */
  public IntegrityVerifier(
      EntryLog log, int batchSize,
      Optional<TupleVerifier> signatures, Optional<ChainAnchor> anchor) {
    this.log = Objects.requireNonNull(log, "null log");
    if (batchSize < 1)
      throw new IllegalArgumentException("batchSize " + batchSize);
    this.batchSize = batchSize;
    this.signatures = Objects.requireNonNull(signatures, "null signatures");
    this.anchor = Objects.requireNonNull(anchor, "null anchor");
  }


  /** Returns a copy of this instance that also checks signatures. */
  public IntegrityVerifier withSignatures(TupleVerifier verifier) {
    return new IntegrityVerifier(log, batchSize, Optional.of(verifier), anchor);
  }


  /** Returns a copy of this instance that also checks the given anchor. */
  public IntegrityVerifier withAnchor(ChainAnchor anchor) {
    return new IntegrityVerifier(log, batchSize, signatures, Optional.of(anchor));
  }



  /**
   * Runs the checks and returns the report.
   */
  public VerificationReport verify() {
    final long size = log.size();
    var issues = new ArrayList<Issue>();

    ByteBuffer prevBytes = ByteBuffer.allocate(0);
    ByteBuffer prevHash = Hashing.sentinelHash();

    for (long index = 0; index < size; ++index) {
      ByteBuffer entryBytes;
      ByteBuffer chainHash;
      try {
        var raw = log.read(index);
        entryBytes = raw.entryBytes();
        chainHash = raw.chainHash();
      } catch (RuntimeException x) {
        issue(issues, Kind.UNREADABLE, index, "read failed: " + x.getMessage());
        // the chain can't be followed past this point
        break;
      }

      var expected = LedgerEntry.chainHash(entryBytes, prevBytes, prevHash);
      if (!expected.equals(chainHash))
        issue(issues, Kind.CHAIN_MISMATCH, index,
            "stored " + Hashing.toHex(chainHash) + ", computed " + Hashing.toHex(expected));

      if (entryBytes.remaining() < 8)
        issue(issues, Kind.UNREADABLE, index, "entry too short (" + entryBytes.remaining() + " bytes)");
      else {
        long embedded = entryBytes.getLong(entryBytes.position());
        if (embedded != index)
          issue(issues, Kind.SEQNO_MISMATCH, index, "entry claims sequence index " + embedded);
      }

      if (signatures.isPresent())
        checkSignature(issues, index, entryBytes, chainHash);

      prevBytes = entryBytes;
      prevHash = chainHash;
    }

    long batches = checkBatches(issues, size);
    checkAnchor(issues, size);

    if (issues.isEmpty())
      getLogger().log(Level.INFO,
          "verified " + size + " entries, " + batches + " sealed batches: OK");
    else
      getLogger().log(Level.WARNING,
          "verified " + size + " entries, " + batches + " sealed batches: " +
          issues.size() + " issue(s)");

    return new VerificationReport(size, batches, issues);
  }


  private void checkSignature(
      List<Issue> issues, long index, ByteBuffer entryBytes, ByteBuffer chainHash) {
    final LedgerEntry entry;
    try {
      entry = LedgerEntry.load(entryBytes, chainHash);
    } catch (RuntimeException x) {
      issue(issues, Kind.UNREADABLE, index, "unparseable entry: " + x.getMessage());
      return;
    }
    try {
      signatures.get().verify(entry.tuple());
    } catch (VerificationException vx) {
      issue(issues, Kind.BAD_SIGNATURE, index, vx.getMessage());
    }
  }


  private long checkBatches(List<Issue> issues, long size) {
    final long count = log.batchCount();
    for (long batchNo = 0; batchNo < count; ++batchNo) {
      final long first = batchNo * batchSize;
      if (first + batchSize > size) {
        issue(issues, Kind.EXCESS_BATCH, batchNo,
            "batch [" + first + ", " + (first + batchSize) + ") exceeds ledger size " + size);
        continue;
      }
      try {
        var leaves = new ArrayList<ByteBuffer>(batchSize);
        for (long seqNo = first; seqNo < first + batchSize; ++seqNo)
          leaves.add(MerkleTree.leafHash(log.read(seqNo).entryBytes()));
        var computed = MerkleTree.root(leaves);
        var sealed = log.batchRoot(batchNo);
        if (!computed.equals(sealed))
          issue(issues, Kind.BATCH_ROOT_MISMATCH, batchNo,
              "sealed " + Hashing.toHex(sealed) + ", computed " + Hashing.toHex(computed));
      } catch (RuntimeException x) {
        issue(issues, Kind.BATCH_ROOT_MISMATCH, batchNo, "unreadable batch: " + x.getMessage());
      }
    }
    return count;
  }


  private void checkAnchor(List<Issue> issues, long size) {
    if (anchor.isEmpty())
      return;
    var a = anchor.get();
    if (a.size() > size) {
      issue(issues, Kind.TRUNCATED, size,
          "ledger size " + size + " is less than anchored size " + a.size());
      return;
    }
    if (a.size() == 0)
      return;
    ByteBuffer stored;
    try {
      stored = log.read(a.size() - 1).chainHash();
    } catch (RuntimeException x) {
      issue(issues, Kind.UNREADABLE, a.size() - 1, "read failed: " + x.getMessage());
      return;
    }
    if (!stored.equals(a.chainHash()))
      issue(issues, Kind.ANCHOR_MISMATCH, a.size() - 1,
          "anchored " + Hashing.toHex(a.chainHash()) + ", stored " + Hashing.toHex(stored));
  }


  private void issue(List<Issue> issues, Kind kind, long index, String message) {
    getLogger().log(Level.WARNING, kind + " at [" + index + "]: " + message);
    issues.add(new Issue(kind, index, message));
  }

}
