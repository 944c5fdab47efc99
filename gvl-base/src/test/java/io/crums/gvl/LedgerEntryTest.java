/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class LedgerEntryTest extends GvlTestCase {


  @Test
  public void testFirstChainHash() {
    var tuple = record(0);
    var bytes = LedgerEntry.serialize(0, tuple, Optional.empty());
    var expected = Hashing.hash(bytes, ByteBuffer.allocate(0), ByteBuffer.allocate(32));
    assertEquals(
        expected,
        LedgerEntry.chainHash(bytes, ByteBuffer.allocate(0), Hashing.sentinelHash()));
  }


  @Test
  public void testLoad() {
    var tuple = record(4);
    var decision = new ApprovalDecision("TCK-9", "j.doe", TEST_UTC + 5, "ok");
    var bytes = LedgerEntry.serialize(7, tuple, Optional.of(decision));
    var hash = LedgerEntry.chainHash(bytes, ByteBuffer.allocate(0), Hashing.sentinelHash());
    var entry = LedgerEntry.load(bytes, hash);

    assertEquals(7, entry.seqNo());
    assertEquals(tuple.id(), entry.tuple().id());
    assertEquals(tuple.payloadHash(), entry.tuple().payloadHash());
    assertEquals(decision, entry.decision().get());
    assertEquals(bytes, entry.serialize());
    assertEquals(new LedgerEntry(7, tuple, Optional.of(decision), hash), entry);
    assertTrue(verifier().isValid(entry.tuple()));
  }


  @Test
  public void testTruncated() {
    var bytes = LedgerEntry.serialize(0, record(1), Optional.empty());
    var truncated = bytes.duplicate().limit(bytes.limit() - 5);
    assertThrows(
        ByteFormatException.class,
        () -> LedgerEntry.load(truncated, Hashing.sentinelHash()));
  }


  @Test
  public void testTrailingBytes() {
    var bytes = LedgerEntry.serialize(0, record(1), Optional.empty());
    var padded = ByteBuffer.allocate(bytes.remaining() + 1).put(bytes.duplicate());
    padded.put((byte) 0).flip();
    assertThrows(
        ByteFormatException.class,
        () -> LedgerEntry.load(padded, Hashing.sentinelHash()));
  }

}
