/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.security.PublicKey;

/**
 * Verification side of the signer contract.
 */
@FunctionalInterface
public interface SignatureVerifier {
  
  /**
   * Returns {@code true} iff the signature is valid for the given payload and
   * public key. Malformed signatures verify {@code false}; they do not throw.
   */
  boolean verify(PublicKey key, byte[] payload, byte[] signature);

}
