/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;


import java.util.Objects;

import io.crums.gvl.LedgerEntry;
import io.crums.gvl.store.EntryProof;

/**
 * A ledger entry with the proof it belongs to the ledger.
 */
public record ProvenEntry(LedgerEntry entry, EntryProof proof) {

  public ProvenEntry {
    Objects.requireNonNull(entry, "null entry");
    Objects.requireNonNull(proof, "null proof");
    if (entry.seqNo() != proof.seqNo())
      throw new IllegalArgumentException(
          "entry [" + entry.seqNo() + "] / proof [" + proof.seqNo() + "] mismatch");
  }


  /**
   * Checks the proof against the entry's serial form.
   */
  public boolean verify() {
    return proof.verify(entry.serialize());
  }

}
