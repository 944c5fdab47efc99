/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@linkplain GovernanceTuple} as committed to the ledger. Instances are
 * created by the ledger store on append (or on read); they are never mutated.
 *
 * <h2>Chain Hash</h2>
 * <p>
 * The entry at sequence index <em>i</em> is bound to its predecessors via
 * </p>
 * <pre>
 *   chain_hash[i] = SHA-256(serialize(entry[i]) || serialize(entry[i-1]) || chain_hash[i-1])
 * </pre>
 * <p>
 * where {@code chain_hash[-1]} is 32 zero bytes and {@code serialize(entry[-1])}
 * is empty. The previous entry's bytes are redundant (its chain hash already
 * commits to them) but are included anyway.
 * </p>
 *
 * @see #chainHash(ByteBuffer, ByteBuffer, ByteBuffer)
 * @see #serialize()
 */
public final class LedgerEntry {

  /**
   * Computes and returns a chain hash.
   *
   * @param entryBytes      serial form of the entry
   * @param prevEntryBytes  serial form of the previous entry (empty if first)
   * @param prevChainHash   chain hash of the previous entry (sentinel if first)
   *
   * @return read-only, 32 remaining bytes
   */
  public static ByteBuffer chainHash(
      ByteBuffer entryBytes, ByteBuffer prevEntryBytes, ByteBuffer prevChainHash) {
    return Hashing.hash(entryBytes, prevEntryBytes, Hashing.checkHash(prevChainHash));
  }


  private final long seqNo;
  private final GovernanceTuple tuple;
  private final Optional<ApprovalDecision> decision;
  private final ByteBuffer chainHash;
  private final ByteBuffer serial;


  /**
   * Full constructor.
   *
   * @param seqNo     sequence index (&ge; 0)
   * @param tuple     the committed record
   * @param decision  present only if the record was escalated and approved
   * @param chainHash the entry's chain hash (32 bytes)
   */
  public LedgerEntry(
      long seqNo, GovernanceTuple tuple,
      Optional<ApprovalDecision> decision, ByteBuffer chainHash) {

    if (seqNo < 0)
      throw new IllegalArgumentException("seqNo " + seqNo);
    this.seqNo = seqNo;
    this.tuple = Objects.requireNonNull(tuple, "null tuple");
    this.decision = Objects.requireNonNull(decision, "null decision");
    this.chainHash = Hashing.checkHash(chainHash);
    this.serial = serialize(seqNo, tuple, decision);
  }


  /** Sequence index. Zero-based, gapless. */
  public long seqNo() {
    return seqNo;
  }

  public GovernanceTuple tuple() {
    return tuple;
  }

  /** Present iff the record went through human approval. */
  public Optional<ApprovalDecision> decision() {
    return decision;
  }

  /** @return read-only, 32 remaining bytes */
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }


  /**
   * Returns the serial form of the entry, sans chain hash. This is the
   * {@code serialize(entry)} term in the chain hash relation.
   *
   * @return read-only buffer
   */
  public ByteBuffer serialize() {
    return serial.duplicate();
  }


  /**
   * Returns the serial form of an entry (sans chain hash).
   */
  public static ByteBuffer serialize(
      long seqNo, GovernanceTuple tuple, Optional<ApprovalDecision> decision) {

    int size = 8 + tuple.serialSize() + 1;
    if (decision.isPresent())
      size += decision.get().serialSize();
    var out = ByteBuffer.allocate(size);
    out.putLong(seqNo);
    tuple.writeTo(out);
    out.put((byte) (decision.isPresent() ? 1 : 0));
    decision.ifPresent(d -> d.writeTo(out));
    assert !out.hasRemaining();
    return out.flip().asReadOnlyBuffer();
  }


  /**
   * Loads an entry from its serial form and its (stored) chain hash. The
   * chain hash is not validated here.
   *
   * @param entryBytes  remaining bytes exactly the serial form
   */
  public static LedgerEntry load(ByteBuffer entryBytes, ByteBuffer chainHash)
      throws ByteFormatException {

    var in = entryBytes.duplicate();
    try {
      long seqNo = in.getLong();
      if (seqNo < 0)
        throw new ByteFormatException("negative seqNo " + seqNo);
      var tuple = GovernanceTuple.load(in);
      byte flag = in.get();
      Optional<ApprovalDecision> decision;
      switch (flag) {
      case 0:   decision = Optional.empty(); break;
      case 1:   decision = Optional.of(ApprovalDecision.load(in)); break;
      default:
        throw new ByteFormatException("illegal decision flag " + flag + " at seqNo " + seqNo);
      }
      if (in.hasRemaining())
        throw new ByteFormatException(
            in.remaining() + " trailing bytes in entry at seqNo " + seqNo);
      return new LedgerEntry(seqNo, tuple, decision, chainHash);

    } catch (BufferUnderflowException bux) {
      throw new ByteFormatException("truncated entry", bux);
    }
  }


  /** Equality is based on the serial form and chain hash. */
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof LedgerEntry other &&
        other.serial.equals(serial) &&
        other.chainHash.equals(chainHash);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(seqNo) ^ chainHash.hashCode();
  }

  @Override
  public String toString() {
    return "[" + seqNo + "] " + tuple.id() + " " + Hashing.toHex(chainHash).substring(0, 16);
  }

}
