/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static io.crums.gvl.GvlConstants.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.ConcurrentModificationException;
import java.util.Random;

import org.junit.jupiter.api.Test;

import io.crums.gvl.ByteFormatException;
import io.crums.gvl.GvlTestCase;
import io.crums.gvl.Hashing;

/**
 * 
 */
public class EntryLogDirTest extends GvlTestCase {


  private ByteBuffer randomEntry(Random random) {
    byte[] bytes = new byte[16 + random.nextInt(100)];
    random.nextBytes(bytes);
    return ByteBuffer.wrap(bytes);
  }

  private ByteBuffer randomHash(Random random) {
    byte[] bytes = new byte[HASH_WIDTH];
    random.nextBytes(bytes);
    return ByteBuffer.wrap(bytes);
  }


  @Test
  public void testEmpty() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    try (var log = new EntryLogDir(dir)) {
      assertEquals(0, log.size());
      assertEquals(0, log.batchCount());
    }
    try (var log = new EntryLogDir(dir)) {
      assertEquals(0, log.size());
    }
  }


  @Test
  public void testAppendReopen() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var random = new Random(11);
    var entries = new ByteBuffer[5];
    var hashes = new ByteBuffer[5];
    try (var log = new EntryLogDir(dir)) {
      for (int index = 0; index < 5; ++index) {
        entries[index] = randomEntry(random);
        hashes[index] = randomHash(random);
        assertEquals(index + 1, log.append(index, entries[index], hashes[index]));
      }
      log.appendBatchRoot(0, randomHash(random));
    }
    try (var log = new EntryLogDir(dir)) {
      assertEquals(5, log.size());
      assertEquals(1, log.batchCount());
      for (int index = 0; index < 5; ++index) {
        var raw = log.read(index);
        assertEquals(index, raw.seqNo());
        assertEquals(entries[index], raw.entryBytes());
        assertEquals(hashes[index], raw.chainHash());
      }
    }
  }


  @Test
  public void testWrongIndex() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var random = new Random(12);
    try (var log = new EntryLogDir(dir)) {
      log.append(0, randomEntry(random), randomHash(random));
      assertThrows(
          ConcurrentModificationException.class,
          () -> log.append(0, randomEntry(random), randomHash(random)));
      assertThrows(
          ConcurrentModificationException.class,
          () -> log.appendBatchRoot(1, randomHash(random)));
      assertEquals(1, log.size());
    }
  }


  @Test
  public void testPartialTailDiscarded() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var random = new Random(13);
    try (var log = new EntryLogDir(dir)) {
      for (int index = 0; index < 3; ++index)
        log.append(index, randomEntry(random), randomHash(random));
    }
    // simulate a crash mid-append: a torn frame and a torn offset slot
    try (var data = new RandomAccessFile(new File(dir, ENTRIES_FILE), "rw");
         var offsets = new RandomAccessFile(new File(dir, OFFSETS_FILE), "rw")) {
      data.seek(data.length());
      data.writeInt(500);
      data.write(new byte[17]);
      offsets.seek(offsets.length());
      offsets.write(new byte[] { 0, 0, 1 });
    }
    var next = randomEntry(random);
    var nextHash = randomHash(random);
    try (var log = new EntryLogDir(dir)) {
      assertEquals(3, log.size());
      assertEquals(4, log.append(3, next, nextHash));
    }
    try (var log = new EntryLogDir(dir)) {
      assertEquals(4, log.size());
      assertEquals(next, log.read(3).entryBytes());
      assertEquals(nextHash, log.read(3).chainHash());
    }
  }


  @Test
  public void testUnconfirmedFrameDiscarded() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var random = new Random(14);
    long dataLength;
    try (var log = new EntryLogDir(dir)) {
      log.append(0, randomEntry(random), randomHash(random));
      log.append(1, randomEntry(random), randomHash(random));
      dataLength = new File(dir, ENTRIES_FILE).length();
    }
    // a complete frame whose offset slot never made it
    var frame = randomEntry(random);
    try (var data = new RandomAccessFile(new File(dir, ENTRIES_FILE), "rw")) {
      data.seek(data.length());
      data.writeInt(frame.remaining());
      data.write(frame.array());
      data.write(new byte[HASH_WIDTH]);
    }
    try (var log = new EntryLogDir(dir)) {
      assertEquals(2, log.size());
    }
    assertEquals(dataLength, new File(dir, ENTRIES_FILE).length());
  }


  @Test
  public void testReadOnly() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var random = new Random(15);
    try (var log = new EntryLogDir(dir)) {
      log.append(0, randomEntry(random), randomHash(random));
    }
    try (var log = new EntryLogDir(dir, true)) {
      assertTrue(log.isReadOnly());
      assertEquals(1, log.size());
      assertThrows(
          UncheckedIOException.class,
          () -> log.append(1, randomEntry(random), randomHash(random)));
      assertThrows(
          UncheckedIOException.class,
          () -> log.appendBatchRoot(0, Hashing.sentinelHash()));
    }
  }


  @Test
  public void testReadOnlyMissingDir() {
    final Object label = new Object() {  };
    File dir = getMethodOutputFilepath(label);
    assertThrows(IllegalArgumentException.class, () -> new EntryLogDir(dir, true));
  }


  @Test
  public void testNotALedger() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    try (var data = new RandomAccessFile(new File(dir, ENTRIES_FILE), "rw")) {
      data.write("JUNK".getBytes());
    }
    assertThrows(ByteFormatException.class, () -> new EntryLogDir(dir));
  }

}
