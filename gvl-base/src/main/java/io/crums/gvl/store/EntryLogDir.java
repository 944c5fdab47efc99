/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import static io.crums.gvl.GvlConstants.BATCHES_FILE;
import static io.crums.gvl.GvlConstants.ENTRIES_FILE;
import static io.crums.gvl.GvlConstants.HASH_WIDTH;
import static io.crums.gvl.GvlConstants.OFFSETS_FILE;
import static io.crums.gvl.GvlConstants.VERSION_BYTE;
import static io.crums.gvl.GvlConstants.getLogger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.ConcurrentModificationException;

import io.crums.gvl.ByteFormatException;
import io.crums.gvl.Hashing;
import io.crums.gvl.Serials;

/**
 * File-based {@linkplain EntryLog}, laid out in a directory.
 *
 * <h2>Files</h2>
 * <ul>
 * <li>{@value io.crums.gvl.GvlConstants#ENTRIES_FILE}: a 4-byte header
 * ({@code 'G' 'V' 'L' version}) followed by entry frames. A frame is a 4-byte
 * length, the entry bytes, then the 32-byte chain hash.</li>
 * <li>{@value io.crums.gvl.GvlConstants#OFFSETS_FILE}: one 8-byte frame offset per
 * confirmed entry. An entry is confirmed once its offset slot is written and
 * forced.</li>
 * <li>{@value io.crums.gvl.GvlConstants#BATCHES_FILE}: one 32-byte root per sealed
 * Merkle batch.</li>
 * </ul>
 * <h2>Recovery</h2>
 * <p>
 * On opening, anything past the last confirmed frame (a partially written
 * frame, a torn offset slot, an offset slot pointing past the end of the data)
 * is discarded. The log then resumes from the last confirmed index.
 * </p>
 */
public class EntryLogDir implements EntryLog {

  /** Size of the entries file header. */
  public final static int HEADER_SIZE = 4;

  private final static int OFFSET_WIDTH = 8;

  private final static int LEN_WIDTH = 4;


  private static ByteBuffer header() {
    return ByteBuffer.wrap(new byte[] { 'G', 'V', 'L', VERSION_BYTE });
  }


  private final File dir;
  private final boolean readOnly;
  private final FileChannel data;
  private final FileChannel offsets;
  private final FileChannel batches;

  private volatile long size;
  private long dataEnd;

  private boolean closed;


  /**
   * Opens an existing log, or creates a new one in the given directory (which
   * is created, if necessary).
   */
  public EntryLogDir(File dir) throws UncheckedIOException {
    this(dir, false);
  }


  /**
   * @param dir       ledger directory
   * @param readOnly  if {@code true}, then the directory must already exist,
   *                  and no recovery writes are made (unconfirmed tails are
   *                  ignored, not truncated)
   */
  public EntryLogDir(File dir, boolean readOnly) throws UncheckedIOException {
    this.dir = dir;
    this.readOnly = readOnly;
    try {
      if (readOnly) {
        if (!dir.isDirectory())
          throw new IllegalArgumentException("not a directory: " + dir);
      } else if (!dir.isDirectory() && !dir.mkdirs())
        throw new IOException("failed to create directory " + dir);

      this.data = open(ENTRIES_FILE, readOnly);
      this.offsets = open(OFFSETS_FILE, readOnly);
      this.batches = open(BATCHES_FILE, readOnly);

      initHeader(readOnly);
      recover(readOnly);

    } catch (IOException iox) {
      throw new UncheckedIOException("on opening " + dir, iox);
    }
  }


  private FileChannel open(String name, boolean readOnly) throws IOException {
    var path = new File(dir, name).toPath();
    if (readOnly)
      return FileChannel.open(path, StandardOpenOption.READ);
    return FileChannel.open(
        path,
        StandardOpenOption.CREATE,
        StandardOpenOption.READ,
        StandardOpenOption.WRITE);
  }


  private void initHeader(boolean readOnly) throws IOException {
    if (data.size() < HEADER_SIZE) {
      if (readOnly) {
        if (data.size() != 0)
          throw new ByteFormatException("truncated header in " + file(ENTRIES_FILE));
        return;
      }
      data.truncate(0);
      writeFully(data, header(), 0);
      data.force(true);
      return;
    }
    var head = readFully(data, ByteBuffer.allocate(HEADER_SIZE), 0).flip();
    var expected = header();
    if (head.get(0) != expected.get(0) ||
        head.get(1) != expected.get(1) ||
        head.get(2) != expected.get(2))
      throw new ByteFormatException("not a ledger file: " + file(ENTRIES_FILE));
    if (head.get(3) != VERSION_BYTE)
      throw new ByteFormatException(
          "unsupported version " + head.get(3) + " in " + file(ENTRIES_FILE));
  }


  private void recover(boolean readOnly) throws IOException {

    long offsetsSize = offsets.size();
    long count = offsetsSize / OFFSET_WIDTH;
    if (offsetsSize % OFFSET_WIDTH != 0)
      discardTail(readOnly, offsets, count * OFFSET_WIDTH, "torn offset slot");

    long end = HEADER_SIZE;
    final long dataSize = Math.max(data.size(), HEADER_SIZE);

    while (count > 0) {
      long offset = readOffset(count - 1);
      long frameEnd = -1;
      if (offset >= HEADER_SIZE && offset + LEN_WIDTH <= dataSize) {
        int len = readFully(data, ByteBuffer.allocate(LEN_WIDTH), offset).flip().getInt();
        if (len >= 0 && len <= Serials.MAX_FIELD_SIZE)
          frameEnd = offset + LEN_WIDTH + len + HASH_WIDTH;
      }
      if (frameEnd != -1 && frameEnd <= dataSize) {
        end = frameEnd;
        break;
      }
      // the slot points to a frame that never made it
      --count;
      discardTail(readOnly, offsets, count * OFFSET_WIDTH, "dangling offset slot [" + count + "]");
    }

    if (dataSize > end && data.size() > HEADER_SIZE)
      discardTail(readOnly, data, end, "unconfirmed entry bytes");

    long batchesSize = batches.size();
    if (batchesSize % HASH_WIDTH != 0)
      discardTail(
          readOnly, batches, (batchesSize / HASH_WIDTH) * HASH_WIDTH, "torn batch root");

    this.dataEnd = end;
    this.size = count;
  }


  private void discardTail(boolean readOnly, FileChannel ch, long newSize, String what)
      throws IOException {

    long oldSize = ch.size();
    if (oldSize <= newSize)
      return;
    if (readOnly) {
      getLogger().log(Level.WARNING,
          "ignoring " + what + " in " + dir + " (" + (oldSize - newSize) + " bytes)");
      return;
    }
    getLogger().log(Level.WARNING,
        "discarding " + what + " in " + dir + " (" + (oldSize - newSize) + " bytes)");
    ch.truncate(newSize);
    ch.force(true);
  }


  /** Returns the ledger directory. */
  public File getDir() {
    return dir;
  }


  public boolean isReadOnly() {
    return readOnly;
  }


  private File file(String name) {
    return new File(dir, name);
  }



  @Override
  public long size() {
    return size;
  }


  @Override
  public synchronized long append(long index, ByteBuffer entryBytes, ByteBuffer chainHash) {
    checkWritable();
    if (index != size)
      throw new ConcurrentModificationException("on index " + index + "; size " + size);

    var entry = entryBytes.duplicate();
    var hash = Hashing.checkHash(chainHash);

    final long offset = dataEnd;
    final int len = entry.remaining();
    var frame = ByteBuffer.allocate(LEN_WIDTH + len + HASH_WIDTH);
    frame.putInt(len).put(entry).put(hash).flip();

    try {
      writeFully(data, frame, offset);
      data.force(false);
      var slot = ByteBuffer.allocate(OFFSET_WIDTH).putLong(offset).flip();
      writeFully(offsets, slot, index * OFFSET_WIDTH);
      offsets.force(false);

    } catch (IOException iox) {
      rollback(index, offset);
      throw new UncheckedIOException(
          "on append: index " + index + ", offset " + offset + " in " + dir, iox);
    }

    dataEnd = offset + frame.capacity();
    size = index + 1;
    return size;
  }


  private void rollback(long index, long offset) {
    try {
      offsets.truncate(index * OFFSET_WIDTH);
      data.truncate(offset);
    } catch (IOException iox) {
      // recovery on reopen will discard whatever remains
      getLogger().log(Level.ERROR,
          "failed to roll back append at index " + index + " in " + dir +
          ": " + iox.getMessage());
    }
  }



  @Override
  public RawEntry read(long index) {
    final long sz = size;
    if (index < 0 || index >= sz)
      throw new IllegalArgumentException("index " + index + " out of bounds; size " + sz);
    try {
      long offset = readOffset(index);
      int len = readFully(data, ByteBuffer.allocate(LEN_WIDTH), offset).flip().getInt();
      if (len < 0 || len > Serials.MAX_FIELD_SIZE)
        throw new ByteFormatException(
            "illegal frame length " + len + " at index " + index + " in " + dir);
      var frame = readFully(data, ByteBuffer.allocate(len + HASH_WIDTH), offset + LEN_WIDTH).flip();
      var entryBytes = frame.duplicate().limit(len);
      var hash = frame.duplicate().position(len);
      return new RawEntry(index, entryBytes, hash);

    } catch (IOException iox) {
      throw new UncheckedIOException("on read(" + index + ") in " + dir, iox);
    }
  }


  private long readOffset(long index) throws IOException {
    var slot = readFully(offsets, ByteBuffer.allocate(OFFSET_WIDTH), index * OFFSET_WIDTH);
    return slot.flip().getLong();
  }



  @Override
  public long batchCount() {
    try {
      return batches.size() / HASH_WIDTH;
    } catch (IOException iox) {
      throw new UncheckedIOException("on batchCount() in " + dir, iox);
    }
  }


  @Override
  public synchronized void appendBatchRoot(long batchNo, ByteBuffer root) {
    checkWritable();
    long count = batchCount();
    if (batchNo != count)
      throw new ConcurrentModificationException(
          "on batchNo " + batchNo + "; batch count " + count);
    try {
      writeFully(batches, Hashing.checkHash(root), batchNo * HASH_WIDTH);
      batches.force(false);
    } catch (IOException iox) {
      try {
        batches.truncate(batchNo * HASH_WIDTH);
      } catch (IOException suppressed) {
        iox.addSuppressed(suppressed);
      }
      throw new UncheckedIOException("on appendBatchRoot(" + batchNo + ") in " + dir, iox);
    }
  }


  @Override
  public ByteBuffer batchRoot(long batchNo) {
    long count = batchCount();
    if (batchNo < 0 || batchNo >= count)
      throw new IllegalArgumentException(
          "batchNo " + batchNo + " out of bounds; batch count " + count);
    try {
      return readFully(batches, ByteBuffer.allocate(HASH_WIDTH), batchNo * HASH_WIDTH)
          .flip().asReadOnlyBuffer();
    } catch (IOException iox) {
      throw new UncheckedIOException("on batchRoot(" + batchNo + ") in " + dir, iox);
    }
  }



  @Override
  public synchronized void close() {
    if (closed)
      return;
    closed = true;
    IOException error = null;
    for (var ch : new FileChannel[] { data, offsets, batches }) {
      try {
        ch.close();
      } catch (IOException iox) {
        if (error == null)
          error = iox;
        else
          error.addSuppressed(iox);
      }
    }
    if (error != null)
      throw new UncheckedIOException("on closing " + dir, error);
  }


  private void checkWritable() {
    if (closed)
      throw new IllegalStateException("closed: " + dir);
    if (readOnly)
      throw new UncheckedIOException(new IOException("opened read-only: " + dir));
  }


  @Override
  public String toString() {
    return "EntryLogDir[" + dir + ", size " + size + "]";
  }



  private static void writeFully(FileChannel ch, ByteBuffer buffer, long position)
      throws IOException {
    var b = buffer.duplicate();
    while (b.hasRemaining())
      position += ch.write(b, position);
  }


  private static ByteBuffer readFully(FileChannel ch, ByteBuffer buffer, long position)
      throws IOException {
    while (buffer.hasRemaining()) {
      int amt = ch.read(buffer, position);
      if (amt == -1)
        throw new ByteFormatException(
            "unexpected end of file at position " + position);
      position += amt;
    }
    return buffer;
  }

}
