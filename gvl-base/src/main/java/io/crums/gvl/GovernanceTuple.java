/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import static io.crums.gvl.GvlConstants.SEED_WIDTH;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * The signed record of a computation (or governance decision). Immutable.
 *
 * <h2>Hash Relations</h2>
 * <p>
 * Instances are created by the record builder, which establishes the following
 * (instances loaded from storage are not re-checked here):
 * </p>
 * <ul>
 * <li>{@code inputHash = SHA-256(canonical(inputs))}</li>
 * <li>{@code seed} is the first 64 bits of {@code SHA-256(canonical(inputs) || timestamp)}</li>
 * <li>{@code resultHash = SHA-256(rankedResults)} ({@code rankedResults} is already canonical JSON)</li>
 * <li>{@code signature} is over {@linkplain #payloadHash()}</li>
 * </ul>
 *
 * @param id              name-based UUID over the payload hash
 * @param seed            deterministic seed handed to the solver
 * @param inputHash       hash of the canonical inputs (32 bytes)
 * @param solverIdentity  names the solver (and version) that produced the results
 * @param rankedResults   the ranked results, in canonical JSON
 * @param resultHash      hash of {@code rankedResults} (32 bytes)
 * @param lifecyclePhase  the phase the record was created in
 * @param criticality     decides whether human approval is required
 * @param timestamp       UTC millis
 * @param signerId        names the key that signed the record
 * @param category        query dimension
 * @param recordType      query dimension
 * @param upstreamRef     the one upstream record this record authorizes
 * @param signature       signature bytes
 */
public record GovernanceTuple(
    String id,
    long seed,
    ByteBuffer inputHash,
    String solverIdentity,
    String rankedResults,
    ByteBuffer resultHash,
    String lifecyclePhase,
    Criticality criticality,
    long timestamp,
    String signerId,
    String category,
    String recordType,
    String upstreamRef,
    ByteBuffer signature) {


  public GovernanceTuple {
    Objects.requireNonNull(id, "null id");
    inputHash = Hashing.checkHash(inputHash);
    requireText(solverIdentity, "solverIdentity");
    Objects.requireNonNull(rankedResults, "null rankedResults");
    resultHash = Hashing.checkHash(resultHash);
    requireText(lifecyclePhase, "lifecyclePhase");
    Objects.requireNonNull(criticality, "null criticality");
    requireText(signerId, "signerId");
    Objects.requireNonNull(category, "null category");
    Objects.requireNonNull(recordType, "null recordType");
    requireText(upstreamRef, "upstreamRef");
    if (!signature.hasRemaining())
      throw new IllegalArgumentException("empty signature");
    signature = copy(signature);
  }


  private static void requireText(String value, String name) {
    Objects.requireNonNull(value, "null " + name);
    if (value.isBlank())
      throw new IllegalArgumentException("blank " + name);
  }

  private static ByteBuffer copy(ByteBuffer buffer) {
    var b = buffer.duplicate();
    return ByteBuffer.allocate(b.remaining()).put(b).flip().asReadOnlyBuffer();
  }



  @Override
  public ByteBuffer inputHash() {
    return inputHash.duplicate();
  }

  @Override
  public ByteBuffer resultHash() {
    return resultHash.duplicate();
  }

  @Override
  public ByteBuffer signature() {
    return signature.duplicate();
  }


  /** Returns the signature as a new byte array. */
  public byte[] signatureBytes() {
    var sig = signature();
    byte[] bytes = new byte[sig.remaining()];
    sig.get(bytes);
    return bytes;
  }


  /**
   * Returns the hash the signature is made over.
   *
   * @see #payloadHash(long, ByteBuffer, String, ByteBuffer, String, long)
   */
  public ByteBuffer payloadHash() {
    return payloadHash(
        seed, inputHash, solverIdentity, resultHash, lifecyclePhase, timestamp);
  }


  /**
   * Returns {@code SHA-256(seed || inputHash || solverIdentity || resultHash || lifecyclePhase || timestamp)}.
   * The seed and timestamp are written as 8-byte big-endian longs; strings are
   * length-prefixed UTF-8.
   */
  public static ByteBuffer payloadHash(
      long seed, ByteBuffer inputHash, String solverIdentity,
      ByteBuffer resultHash, String lifecyclePhase, long timestamp) {

    int size =
        SEED_WIDTH + GvlConstants.HASH_WIDTH +
        Serials.stringSize(solverIdentity) +
        GvlConstants.HASH_WIDTH +
        Serials.stringSize(lifecyclePhase) + 8;

    var payload = ByteBuffer.allocate(size);
    payload.putLong(seed).put(inputHash.duplicate());
    Serials.putString(payload, solverIdentity);
    payload.put(resultHash.duplicate());
    Serials.putString(payload, lifecyclePhase);
    payload.putLong(timestamp);
    assert !payload.hasRemaining();

    return Hashing.hash(payload.flip());
  }


  /**
   * Returns a one-line summary, suitable for an approval request.
   */
  public String summary() {
    return
        "record " + id + " [" + recordType + "/" + category + "] phase " +
        lifecyclePhase + ", " + criticality + ", solver " + solverIdentity +
        ", upstream " + upstreamRef;
  }



  public int serialSize() {
    return
        Serials.stringSize(id) +
        SEED_WIDTH +
        GvlConstants.HASH_WIDTH +
        Serials.stringSize(solverIdentity) +
        Serials.stringSize(rankedResults) +
        GvlConstants.HASH_WIDTH +
        Serials.stringSize(lifecyclePhase) +
        1 +
        8 +
        Serials.stringSize(signerId) +
        Serials.stringSize(category) +
        Serials.stringSize(recordType) +
        Serials.stringSize(upstreamRef) +
        4 + signature.remaining();
  }


  public ByteBuffer writeTo(ByteBuffer out) {
    Serials.putString(out, id);
    out.putLong(seed).put(inputHash());
    Serials.putString(out, solverIdentity);
    Serials.putString(out, rankedResults);
    out.put(resultHash());
    Serials.putString(out, lifecyclePhase);
    out.put((byte) criticality.level()).putLong(timestamp);
    Serials.putString(out, signerId);
    Serials.putString(out, category);
    Serials.putString(out, recordType);
    Serials.putString(out, upstreamRef);
    return out.putInt(signature.remaining()).put(signature());
  }


  public ByteBuffer serialize() {
    var out = ByteBuffer.allocate(serialSize());
    return writeTo(out).flip().asReadOnlyBuffer();
  }


  /**
   * Loads and returns an instance from its serial form. On return the
   * buffer's position is advanced past the instance's bytes.
   */
  public static GovernanceTuple load(ByteBuffer in) throws ByteFormatException {
    try {
      String id = Serials.getString(in);
      long seed = in.getLong();
      ByteBuffer inputHash = Serials.getHash(in);
      String solverIdentity = Serials.getString(in);
      String rankedResults = Serials.getString(in);
      ByteBuffer resultHash = Serials.getHash(in);
      String phase = Serials.getString(in);
      Criticality criticality = Criticality.forLevel(in.get());
      long timestamp = in.getLong();
      String signerId = Serials.getString(in);
      String category = Serials.getString(in);
      String recordType = Serials.getString(in);
      String upstreamRef = Serials.getString(in);
      byte[] signature = Serials.getBytes(in);
      return new GovernanceTuple(
          id, seed, inputHash, solverIdentity, rankedResults, resultHash,
          phase, criticality, timestamp, signerId, category, recordType,
          upstreamRef, ByteBuffer.wrap(signature));

    } catch (BufferUnderflowException | IllegalArgumentException | NullPointerException x) {
      throw new ByteFormatException("malformed governance tuple: " + x.getMessage(), x);
    }
  }

}
