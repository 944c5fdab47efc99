/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.verify;


import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of an {@linkplain IntegrityVerifier} run. Lists every problem
 * found, in the order found.
 *
 * @param entriesChecked  number of entries checked
 * @param batchesChecked  number of sealed batches checked
 * @param issues          problems found (empty if the ledger checks out)
 */
public record VerificationReport(long entriesChecked, long batchesChecked, List<Issue> issues) {

  /** Kinds of {@linkplain Issue}. */
  public enum Kind {
    /** Recomputed chain hash differs from the stored one. */
    CHAIN_MISMATCH,
    /** Sequence index embedded in the entry differs from its position. */
    SEQNO_MISMATCH,
    /** Entry could not be read or parsed. */
    UNREADABLE,
    /** Record signature does not verify (or unknown signer). */
    BAD_SIGNATURE,
    /** Recomputed batch root differs from the sealed root. */
    BATCH_ROOT_MISMATCH,
    /** A batch root is recorded for entries that don't exist. */
    EXCESS_BATCH,
    /** Ledger is shorter than the trusted anchor. */
    TRUNCATED,
    /** Chain hash at the anchored position differs from the anchor. */
    ANCHOR_MISMATCH;
  }


  /**
   * A problem found.
   *
   * @param kind    what kind
   * @param index   the entry's sequence index (or batch number, for batch kinds)
   * @param message human-readable detail
   */
  public record Issue(Kind kind, long index, String message) {
    public Issue {
      Objects.requireNonNull(kind, "null kind");
    }

    /** Tests whether {@linkplain #index()} is an entry index. */
    public boolean isEntryIssue() {
      return kind != Kind.BATCH_ROOT_MISMATCH && kind != Kind.EXCESS_BATCH;
    }
  }


  public VerificationReport {
    issues = List.copyOf(issues);
  }


  /** Returns {@code true} iff no issues were found. */
  public boolean isValid() {
    return issues.isEmpty();
  }


  /**
   * Returns the lowest entry index whose chain hash does not check, if any.
   */
  public OptionalLong firstChainMismatch() {
    return issues.stream()
        .filter(i -> i.kind() == Kind.CHAIN_MISMATCH)
        .mapToLong(Issue::index)
        .min();
  }


  /**
   * Returns the number of leading entries covered by an intact chain back to
   * the first entry. Entries at or past this index are not (even those that
   * checked out individually). Equals {@linkplain #entriesChecked()} if no
   * chain hash mismatched.
   */
  public long intactPrefix() {
    return firstChainMismatch().orElse(entriesChecked);
  }


  /**
   * Returns the lowest entry index with any entry-level issue, if any.
   */
  public OptionalLong firstBadEntry() {
    return issues.stream()
        .filter(Issue::isEntryIssue)
        .mapToLong(Issue::index)
        .min();
  }

}
