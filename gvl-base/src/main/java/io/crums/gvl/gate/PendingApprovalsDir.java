/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import static io.crums.gvl.GvlConstants.getLogger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.gvl.Hashing;
import io.crums.gvl.json.JsonParsingException;
import io.crums.gvl.json.PendingApprovalParser;

/**
 * {@linkplain PendingApprovals} kept as one JSON file per ticket in a
 * directory. Files are replaced atomically (written to a temp file, then
 * moved), so a crash leaves either the old or the new state.
 */
public class PendingApprovalsDir implements PendingApprovals {

  private final static String EXT = ".json";
  private final static String TMP_EXT = ".tmp";

  private final File dir;
  private final PendingApprovalParser parser = PendingApprovalParser.INSTANCE;


  /**
   * Creates an instance, creating the directory if it doesn't exist.
   */
  public PendingApprovalsDir(File dir) throws UncheckedIOException {
    this.dir = Objects.requireNonNull(dir, "null dir");
    if (!dir.isDirectory() && !dir.mkdirs())
      throw new UncheckedIOException(new IOException("failed to create " + dir));
  }


  public File getDir() {
    return dir;
  }


  /**
   * Ticket IDs are opaque, so file names are derived from their hash.
   */
  private File fileFor(String ticketId) {
    String name = Hashing.toHex(Hashing.hash(ticketId.getBytes(StandardCharsets.UTF_8)));
    return new File(dir, name.substring(0, 32) + EXT);
  }


  @Override
  public synchronized void save(PendingApproval pending) throws UncheckedIOException {
    var file = fileFor(pending.ticketId());
    var tmp = new File(dir, file.getName() + TMP_EXT);
    byte[] json = parser.toJsonObject(pending).toJSONString().getBytes(StandardCharsets.UTF_8);
    try {
      Files.write(tmp.toPath(), json);
      Files.move(
          tmp.toPath(), file.toPath(),
          StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException iox) {
      throw new UncheckedIOException(
          "on saving pending approval " + pending.ticketId() + " to " + file + ": " + iox, iox);
    }
  }


  @Override
  public synchronized void remove(String ticketId) throws UncheckedIOException {
    var file = fileFor(ticketId);
    try {
      Files.deleteIfExists(file.toPath());
    } catch (IOException iox) {
      throw new UncheckedIOException("on deleting " + file + ": " + iox, iox);
    }
  }


  @Override
  public synchronized List<PendingApproval> list() throws UncheckedIOException {
    File[] files = dir.listFiles((d, name) -> name.endsWith(EXT));
    if (files == null)
      throw new UncheckedIOException(new IOException("failed to list " + dir));
    var pending = new ArrayList<PendingApproval>(files.length);
    for (var file : files) {
      try {
        pending.add(parser.toEntity(file));
      } catch (JsonParsingException jpx) {
        getLogger().log(Level.WARNING,
            "skipping malformed pending approval " + file + ": " + jpx.getMessage());
      }
    }
    return pending;
  }

}
