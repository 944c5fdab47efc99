/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.rec;


import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.Hashing;
import io.crums.gvl.sig.Signer;
import io.crums.gvl.sig.SigningException;

/**
 * Turns a {@linkplain Computation} into a signed, reproducible
 * {@linkplain GovernanceTuple}.
 *
 * <h2>Reproducibility</h2>
 * <p>
 * Identical inputs and an identical (millisecond-truncated) timestamp always
 * yield the same seed and input hash. The seed is coupled to the timestamp:
 * the same inputs at a different time yield a different seed. Whether the
 * solver can reproduce its ranked results from the inputs and seed is the
 * solver's obligation; the record only commits to the solver's identity and
 * the input hash.
 * </p>
 * <p>
 * Side effects are limited to reading the clock and using the signing key.
 * Instances are safe to use concurrently, if the signer is.
 * </p>
 */
public class RecordBuilder {


  /**
   * Returns {@code SHA-256(canonicalInputs)}.
   *
   * @return read-only, 32 remaining bytes
   */
  public static ByteBuffer inputHash(byte[] canonicalInputs) {
    return ByteBuffer.wrap(Hashing.hash(canonicalInputs)).asReadOnlyBuffer();
  }


  /**
   * Returns the first 64 bits of {@code SHA-256(canonicalInputs || timestamp)}, the
   * timestamp written as an 8-byte big-endian long.
   */
  public static long seed(byte[] canonicalInputs, long timestamp) {
    var digest = Hashing.newDigest();
    digest.update(canonicalInputs);
    digest.update(ByteBuffer.allocate(8).putLong(timestamp).flip());
    return ByteBuffer.wrap(digest.digest()).getLong();
  }



  private final Signer signer;
  private final Clock clock;


  /**
   * Creates an instance using the system UTC clock.
   */
  public RecordBuilder(Signer signer) {
    this(signer, Clock.systemUTC());
  }


  /**
   * @param signer  signs every record built
   * @param clock   wall clock timestamps are read from
   */
  public RecordBuilder(Signer signer, Clock clock) {
    this.signer = Objects.requireNonNull(signer, "null signer");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }


  public Signer signer() {
    return signer;
  }


  /**
   * Builds a record timestamped now.
   *
   * @throws InputException if the inputs or results cannot be canonicalized,
   *         or a required field is missing
   * @throws SigningException if the signer fails
   */
  public GovernanceTuple build(Computation comp)
      throws InputException, SigningException {
    return build(comp, clock.millis());
  }


  /**
   * Builds a record with the given time (truncated to milliseconds).
   */
  public GovernanceTuple build(Computation comp, Instant time)
      throws InputException, SigningException {
    return build(comp, time.toEpochMilli());
  }


  /**
   * Builds a record with the given timestamp.
   *
   * @param timestamp UTC millis
   */
  public GovernanceTuple build(Computation comp, long timestamp)
      throws InputException, SigningException {

    checkFields(comp);

    byte[] canonicalInputs = Canonical.toBytes(comp.inputs());
    String rankedResults = Canonical.toJson(comp.rankedResults());

    ByteBuffer inputHash = inputHash(canonicalInputs);
    long seed = seed(canonicalInputs, timestamp);
    ByteBuffer resultHash = ByteBuffer.wrap(
        Hashing.hash(rankedResults.getBytes(StandardCharsets.UTF_8)))
        .asReadOnlyBuffer();

    ByteBuffer payloadHash = GovernanceTuple.payloadHash(
        seed, inputHash, comp.solverIdentity(), resultHash,
        comp.lifecyclePhase(), timestamp);

    byte[] payload = new byte[payloadHash.remaining()];
    payloadHash.get(payload);

    byte[] signature = sign(payload);

    String id = UUID.nameUUIDFromBytes(payload).toString();

    return new GovernanceTuple(
        id,
        seed,
        inputHash,
        comp.solverIdentity(),
        rankedResults,
        resultHash,
        comp.lifecyclePhase(),
        comp.criticality(),
        timestamp,
        signer.signerId(),
        nonNull(comp.category()),
        nonNull(comp.recordType()),
        comp.upstreamRef(),
        ByteBuffer.wrap(signature));
  }


  private byte[] sign(byte[] payload) throws SigningException {
    final byte[] signature;
    try {
      signature = signer.sign(payload);
    } catch (SigningException sx) {
      throw sx;
    } catch (RuntimeException rx) {
      throw new SigningException(
          "signer " + signer.signerId() + " failed: " + rx.getMessage(), rx);
    }
    if (signature == null || signature.length == 0)
      throw new SigningException(
          "signer " + signer.signerId() + " returned an empty signature");
    return signature;
  }


  private void checkFields(Computation comp) throws InputException {
    if (comp.inputs() == null)
      throw new InputException("null inputs");
    if (comp.rankedResults() == null)
      throw new InputException("null rankedResults");
    checkText(comp.solverIdentity(), "solverIdentity");
    checkText(comp.lifecyclePhase(), "lifecyclePhase");
    checkText(comp.upstreamRef(), "upstreamRef");
    if (comp.criticality() == null)
      throw new InputException("null criticality");
  }


  private void checkText(String value, String name) {
    if (value == null || value.isBlank())
      throw new InputException("missing " + name);
  }


  private String nonNull(String value) {
    return value == null ? "" : value;
  }

}
