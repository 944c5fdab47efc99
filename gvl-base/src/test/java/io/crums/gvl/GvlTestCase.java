/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.crums.gvl.rec.Computation;
import io.crums.gvl.rec.RecordBuilder;
import io.crums.gvl.sig.KeyPairSigner;
import io.crums.gvl.sig.KeyRing;
import io.crums.gvl.sig.TupleVerifier;

/**
 * Base class for tests that write to the file system, or need signed records.
 * Per-method output goes under {@code target/test-outputs}; the method is
 * identified by an anonymous label object created in its body:
 * <pre>
 *   final Object label = new Object() {  };
 * </pre>
 */
public abstract class GvlTestCase {

  public final static File TEST_OUTPUT_ROOT = new File("target", "test-outputs");

  public final static String SIGNER_ID = "solver-host";

  public final static long TEST_UTC = 1_780_000_000_000L;

  private static KeyPairSigner signer;


  /** Returns the shared Ed25519 test signer (generated once per JVM). */
  protected static synchronized KeyPairSigner signer() {
    if (signer == null)
      signer = KeyPairSigner.newEd25519(SIGNER_ID);
    return signer;
  }

  protected static KeyRing keyRing() {
    return new KeyRing().register(signer());
  }

  protected static TupleVerifier verifier() {
    return new TupleVerifier(keyRing());
  }

  protected static RecordBuilder recordBuilder() {
    return new RecordBuilder(signer());
  }


  /** Returns a trade-study computation with the given attributes. */
  protected static Computation computation(
      String phase, Criticality criticality, String category, Object... inputPairs) {
    var inputs = new TreeMap<String, Object>();
    for (int index = 0; index + 1 < inputPairs.length; index += 2)
      inputs.put((String) inputPairs[index], inputPairs[index + 1]);
    return new Computation(
        inputs,
        List.of(Map.of("rank", 1, "design", "A"), Map.of("rank", 2, "design", "B")),
        "solverX-1.0",
        phase,
        criticality,
        category,
        "trade-study",
        "design-state:17");
  }


  /** Builds a signed record; distinct {@code n} yield distinct records. */
  protected static GovernanceTuple record(
      String phase, Criticality criticality, String category, int n) {
    return recordBuilder().build(
        computation(phase, criticality, category, "n", n), TEST_UTC + n * 1000L);
  }


  protected static GovernanceTuple record(int n) {
    return record("design", Criticality.MINOR, "structures", n);
  }



  protected String method(Object label) {
    return label.getClass().getEnclosingMethod().getName();
  }


  protected File getClassOutputDir() {
    return new File(TEST_OUTPUT_ROOT, getClass().getSimpleName());
  }


  /**
   * Returns the (not yet existing) output path for the labeled test method.
   * Output left over from an earlier run is deleted.
   */
  protected File getMethodOutputFilepath(Object label) {
    File path = new File(getClassOutputDir(), method(label));
    delete(path.toPath());
    getClassOutputDir().mkdirs();
    return path;
  }


  /** Returns a new, empty directory for the labeled test method. */
  protected File makeTestDir(Object label) {
    File dir = getMethodOutputFilepath(label);
    if (!dir.mkdirs())
      throw new UncheckedIOException(new IOException("failed to create " + dir));
    return dir;
  }


  private static void delete(Path path) {
    if (!Files.exists(path))
      return;
    try (var walk = Files.walk(path)) {
      for (var p : walk.sorted(Comparator.reverseOrder()).toList())
        Files.delete(p);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }

}
