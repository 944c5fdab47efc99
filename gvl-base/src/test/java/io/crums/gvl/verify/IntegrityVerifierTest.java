/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.verify;


import static io.crums.gvl.GvlConstants.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.GvlTestCase;
import io.crums.gvl.Hashing;
import io.crums.gvl.store.EntryLogDir;
import io.crums.gvl.store.LedgerStore;
import io.crums.gvl.store.VolatileEntryLog;
import io.crums.gvl.verify.VerificationReport.Issue;
import io.crums.gvl.verify.VerificationReport.Kind;

/**
 * 
 */
public class IntegrityVerifierTest extends GvlTestCase {

  private final static int BATCH_SIZE = 4;


  private void populate(File dir, int count) {
    try (var store = new LedgerStore(new EntryLogDir(dir), BATCH_SIZE)) {
      for (int n = 0; n < count; ++n)
        store.append(record(n));
    }
  }


  /** Flips a bit in the stored bytes of the given entry. */
  private void flipEntryByte(File dir, long seqNo, int byteIndex) throws Exception {
    long offset;
    try (var offsets = new RandomAccessFile(new File(dir, OFFSETS_FILE), "r")) {
      offsets.seek(seqNo * 8);
      offset = offsets.readLong();
    }
    try (var data = new RandomAccessFile(new File(dir, ENTRIES_FILE), "rw")) {
      long pos = offset + 4 + byteIndex;
      data.seek(pos);
      int b = data.read();
      data.seek(pos);
      data.write(b ^ 1);
    }
  }


  @Test
  public void testClean() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    populate(dir, 10);
    try (var log = new EntryLogDir(dir, true)) {
      var report = new IntegrityVerifier(log, BATCH_SIZE).withSignatures(verifier()).verify();
      assertTrue(report.isValid(), report.issues().toString());
      assertEquals(10, report.entriesChecked());
      assertEquals(2, report.batchesChecked());
      assertTrue(report.firstChainMismatch().isEmpty());
      assertEquals(10, report.intactPrefix());
    }
  }


  @Test
  public void testTamperedEntry() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    populate(dir, 10);
    // past the sequence index, inside the record
    flipEntryByte(dir, 5, 30);

    try (var log = new EntryLogDir(dir, true)) {
      var report = new IntegrityVerifier(log, BATCH_SIZE).verify();
      assertFalse(report.isValid());
      assertEquals(5, report.firstChainMismatch().getAsLong());
      assertEquals(5, report.firstBadEntry().getAsLong());
      assertTrue(
          report.issues().stream().anyMatch(
              i -> i.kind() == Kind.BATCH_ROOT_MISMATCH && i.index() == 1));
      assertEquals(
          List.of(5L, 6L),
          report.issues().stream()
              .filter(i -> i.kind() == Kind.CHAIN_MISMATCH)
              .map(Issue::index)
              .toList());
      assertEquals(5, report.intactPrefix());
    }
  }


  @Test
  public void testTamperedSeqNo() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    populate(dir, 3);
    flipEntryByte(dir, 2, 7);
    try (var log = new EntryLogDir(dir, true)) {
      var report = new IntegrityVerifier(log, BATCH_SIZE).verify();
      assertTrue(
          report.issues().stream().anyMatch(
              i -> i.kind() == Kind.SEQNO_MISMATCH && i.index() == 2));
      assertEquals(2, report.firstChainMismatch().getAsLong());
    }
  }


  @Test
  public void testBadSignature() {
    var store = new LedgerStore(new VolatileEntryLog(), BATCH_SIZE);
    store.append(record(0));
    var t = record(1);
    var forged = new GovernanceTuple(
        t.id(), t.seed(), t.inputHash(), t.solverIdentity(), t.rankedResults(),
        t.resultHash(), t.lifecyclePhase(), t.criticality(), t.timestamp() + 1, t.signerId(),
        t.category(), t.recordType(), t.upstreamRef(), t.signature());
    store.append(forged);
    store.append(record(2));

    var verifier = new IntegrityVerifier(store.log(), BATCH_SIZE);
    assertTrue(verifier.verify().isValid());

    var report = verifier.withSignatures(verifier()).verify();
    assertEquals(1, report.issues().size());
    assertEquals(Kind.BAD_SIGNATURE, report.issues().get(0).kind());
    assertEquals(1, report.issues().get(0).index());
  }


  @Test
  public void testAnchor() {
    var store = new LedgerStore(new VolatileEntryLog(), BATCH_SIZE);
    for (int n = 0; n < 10; ++n)
      store.append(record(n));
    var anchor = ChainAnchor.of(store);
    assertEquals(anchor, ChainAnchor.parse(anchor.toString()));

    var verifier = new IntegrityVerifier(store.log(), BATCH_SIZE);
    assertTrue(verifier.withAnchor(anchor).verify().isValid());

    // a truncated copy of the log
    var truncated = new VolatileEntryLog();
    for (long seqNo = 0; seqNo < 8; ++seqNo) {
      var raw = store.rawEntry(seqNo);
      truncated.append(seqNo, raw.entryBytes(), raw.chainHash());
    }
    var report = new IntegrityVerifier(truncated, BATCH_SIZE).withAnchor(anchor).verify();
    assertEquals(1, report.issues().size());
    assertEquals(Kind.TRUNCATED, report.issues().get(0).kind());

    var wrong = new ChainAnchor(5, ByteBuffer.wrap(new byte[HASH_WIDTH]));
    report = verifier.withAnchor(wrong).verify();
    assertEquals(Kind.ANCHOR_MISMATCH, report.issues().get(0).kind());
    assertEquals(4, report.issues().get(0).index());

    var empty = new ChainAnchor(0, Hashing.sentinelHash());
    assertTrue(verifier.withAnchor(empty).verify().isValid());
  }


  @Test
  public void testExcessBatch() {
    var log = new VolatileEntryLog();
    var store = new LedgerStore(log, BATCH_SIZE);
    for (int n = 0; n < 5; ++n)
      store.append(record(n));
    log.appendBatchRoot(1, Hashing.sentinelHash());
    var report = new IntegrityVerifier(log, BATCH_SIZE).verify();
    assertEquals(1, report.issues().size());
    assertEquals(Kind.EXCESS_BATCH, report.issues().get(0).kind());
    assertTrue(report.firstBadEntry().isEmpty());
  }

}
