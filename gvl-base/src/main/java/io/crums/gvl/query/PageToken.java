/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;


import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * Opaque continuation token. Carries the snapshot size fixed at the first
 * call, so every page of a query is drawn from the same snapshot, and later
 * appends are invisible to it.
 *
 * @param snapshotSize  ledger size at the first call
 * @param nextSeqNo     sequence index to resume scanning from
 * @param fingerprint   the issuing query's {@linkplain LedgerQuery#fingerprint() fingerprint}
 */
public record PageToken(long snapshotSize, long nextSeqNo, long fingerprint) {

  private final static byte VERSION = 1;
  private final static int BYTES = 1 + 8 + 8 + 8;


  public PageToken {
    if (snapshotSize < 0 || nextSeqNo < 0 || nextSeqNo > snapshotSize)
      throw new IllegalArgumentException(
          "snapshotSize " + snapshotSize + ", nextSeqNo " + nextSeqNo);
  }


  /**
   * Returns the token's string form (URL-safe base64).
   */
  public String encode() {
    var buffer = ByteBuffer.allocate(BYTES)
        .put(VERSION).putLong(snapshotSize).putLong(nextSeqNo).putLong(fingerprint);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
  }


  /**
   * Parses the given {@linkplain #encode() encoded} token.
   *
   * @throws InvalidQueryException if malformed
   */
  public static PageToken decode(String token) throws InvalidQueryException {
    try {
      var buffer = ByteBuffer.wrap(Base64.getUrlDecoder().decode(token.trim()));
      if (buffer.remaining() != BYTES || buffer.get() != VERSION)
        throw new InvalidQueryException("malformed page token: " + token);
      return new PageToken(buffer.getLong(), buffer.getLong(), buffer.getLong());
    } catch (IllegalArgumentException | BufferUnderflowException x) {
      throw new InvalidQueryException("malformed page token: " + token, x);
    }
  }


  @Override
  public String toString() {
    return encode();
  }

}
