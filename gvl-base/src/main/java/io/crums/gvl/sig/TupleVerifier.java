/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.util.Objects;

import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.Hashing;

/**
 * Verifies a record's signature against its claimed signer's public key.
 */
public class TupleVerifier {

  private final KeyRing keys;
  private final SignatureVerifier verifier;


  public TupleVerifier(KeyRing keys) {
    this(keys, JcaSignatures.INSTANCE);
  }

  public TupleVerifier(KeyRing keys, SignatureVerifier verifier) {
    this.keys = Objects.requireNonNull(keys, "null keys");
    this.verifier = Objects.requireNonNull(verifier, "null verifier");
  }


  public KeyRing keyRing() {
    return keys;
  }


  /**
   * Verifies the given record's signature.
   *
   * @throws VerificationException if the signer is unknown, or the signature
   *         does not verify over the record's payload hash
   */
  public void verify(GovernanceTuple tuple) throws VerificationException {
    var key = keys.publicKey(tuple.signerId()).orElseThrow(
        () -> new VerificationException(
            "unknown signer '" + tuple.signerId() + "' on record " + tuple.id()));

    var payload = tuple.payloadHash();
    byte[] bytes = new byte[payload.remaining()];
    payload.get(bytes);

    if (!verifier.verify(key, bytes, tuple.signatureBytes()))
      throw new VerificationException(
          "signature by '" + tuple.signerId() + "' does not verify on record " +
          tuple.id() + " (payload " + Hashing.toHex(bytes) + ")");
  }


  /**
   * Returns {@code true} iff {@linkplain #verify(GovernanceTuple)} would
   * not throw.
   */
  public boolean isValid(GovernanceTuple tuple) {
    try {
      verify(tuple);
      return true;
    } catch (VerificationException vx) {
      return false;
    }
  }

}
