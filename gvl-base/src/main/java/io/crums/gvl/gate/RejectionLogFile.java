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
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crums.gvl.json.JsonParsingException;
import io.crums.gvl.json.RejectionParser;

/**
 * {@linkplain RejectionLog} backed by a JSON-lines file: one
 * {@linkplain RejectionParser JSON object} per line, appended.
 * <p>
 * A malformed line (e.g. torn by a crash mid-write) is skipped on read, with a
 * warning.
 * </p>
 */
public class RejectionLogFile implements RejectionLog {

  private final File file;
  private final RejectionParser parser = RejectionParser.INSTANCE;


  /**
   * @param file the JSON-lines file (created on first write)
   */
  public RejectionLogFile(File file) {
    this.file = Objects.requireNonNull(file, "null file");
    if (file.isDirectory())
      throw new IllegalArgumentException("directory: " + file);
  }


  public File getFile() {
    return file;
  }


  @Override
  public synchronized void record(Rejection rejection) throws UncheckedIOException {
    String line = parser.toJsonObject(rejection).toJSONString() + "\n";
    try {
      Files.write(
          file.toPath(),
          line.getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND,
          StandardOpenOption.WRITE);
    } catch (IOException iox) {
      throw new UncheckedIOException(
          "on appending rejection of " + rejection.recordId() + " to " + file + ": " + iox, iox);
    }
  }


  @Override
  public synchronized List<Rejection> list() throws UncheckedIOException {
    if (!file.exists())
      return List.of();
    final List<String> lines;
    try {
      lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    } catch (IOException iox) {
      throw new UncheckedIOException("on reading " + file + ": " + iox, iox);
    }
    var rejections = new ArrayList<Rejection>(lines.size());
    for (int index = 0; index < lines.size(); ++index) {
      String line = lines.get(index).trim();
      if (line.isEmpty())
        continue;
      try {
        rejections.add(parser.toEntity(line));
      } catch (JsonParsingException jpx) {
        getLogger().log(Level.WARNING,
            "skipping malformed line " + (index + 1) + " in " + file + ": " + jpx.getMessage());
      }
    }
    return rejections;
  }

}
