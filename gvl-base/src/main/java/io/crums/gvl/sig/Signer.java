/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.security.PublicKey;

/**
 * Signing side of the signer contract. Key custody is the implementation's
 * business.
 * 
 * @see SignatureVerifier
 */
public interface Signer {
  
  /**
   * Names the key. Records carry this so that the admission gate can
   * look up the matching public key.
   */
  String signerId();
  
  
  /**
   * Returns the public key matching this signer's private key.
   */
  PublicKey publicKey();
  
  
  /**
   * Signs the given payload and returns the signature.
   * 
   * @throws SigningException if the payload is rejected or signing fails
   */
  byte[] sign(byte[] payload) throws SigningException;

}
