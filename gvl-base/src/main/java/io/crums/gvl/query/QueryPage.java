/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;


import static io.crums.gvl.GvlConstants.HASH_WIDTH;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One page of query results, in ascending sequence order.
 *
 * @param snapshotSize  the ledger size the query ran against
 * @param entries       matching entries, each with its proof
 * @param next          the token for the next page, if there are more matches
 */
public record QueryPage(long snapshotSize, List<ProvenEntry> entries, Optional<PageToken> next) {

  public QueryPage {
    entries = List.copyOf(entries);
    Objects.requireNonNull(next, "null next");
  }


  public boolean hasNext() {
    return next.isPresent();
  }


  /**
   * Returns the page in serial form. Deterministic: the same ledger state,
   * filters, and token yield the same bytes.
   * <pre>
   *  SNAPSHOT_SIZE   (8)
   *  COUNT           (4)
   *  ENTRY*          (COUNT): [4 LEN][entry bytes][32 chain hash][proof]
   *  HAS_NEXT        (1)
   *  NEXT            (8 snapshot, 8 next seqNo, 8 fingerprint), if HAS_NEXT
   * </pre>
   */
  public ByteBuffer serialize() {
    int size = 8 + 4 + 1 + (next.isPresent() ? 24 : 0);
    for (var e : entries)
      size += 4 + e.entry().serialize().remaining() + HASH_WIDTH + e.proof().serialSize();

    var out = ByteBuffer.allocate(size);
    out.putLong(snapshotSize).putInt(entries.size());
    for (var e : entries) {
      var bytes = e.entry().serialize();
      out.putInt(bytes.remaining()).put(bytes).put(e.entry().chainHash());
      e.proof().writeTo(out);
    }
    if (next.isPresent()) {
      var token = next.get();
      out.put((byte) 1).putLong(token.snapshotSize())
          .putLong(token.nextSeqNo()).putLong(token.fingerprint());
    } else
      out.put((byte) 0);

    return out.flip().asReadOnlyBuffer();
  }

}
