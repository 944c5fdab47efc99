/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

/**
 * {@linkplain Signer} holding its key pair in memory. Fine for tests and
 * small deployments; an HSM-backed signer implements the same interface.
 * 
 * @see #newEd25519(String)
 */
public class KeyPairSigner implements Signer {
  
  /**
   * Generates a new Ed25519 key pair and returns a signer using it.
   */
  public static KeyPairSigner newEd25519(String signerId) {
    try {
      var pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
      return new KeyPairSigner(signerId, pair);
    } catch (NoSuchAlgorithmException nsax) {
      throw new IllegalStateException("platform lacks Ed25519", nsax);
    }
  }
  
  
  private final String signerId;
  private final KeyPair keyPair;
  private final String algo;

  /**
   * @param signerId  not blank
   * @param keyPair   Ed25519, EC or RSA
   */
  public KeyPairSigner(String signerId, KeyPair keyPair) {
    this.signerId = Objects.requireNonNull(signerId, "null signerId");
    this.keyPair = Objects.requireNonNull(keyPair, "null keyPair");
    if (signerId.isBlank())
      throw new IllegalArgumentException("blank signerId");
    this.algo = JcaSignatures.signatureAlgo(keyPair.getPrivate().getAlgorithm());
  }

  @Override
  public String signerId() {
    return signerId;
  }

  @Override
  public PublicKey publicKey() {
    return keyPair.getPublic();
  }

  @Override
  public byte[] sign(byte[] payload) throws SigningException {
    try {
      var signer = Signature.getInstance(algo);
      signer.initSign(keyPair.getPrivate());
      signer.update(payload);
      return signer.sign();
    } catch (GeneralSecurityException gsx) {
      throw new SigningException(
          "signer " + signerId + " failed on " + algo + ": " + gsx.getMessage(), gsx);
    }
  }
  
  
  @Override
  public String toString() {
    return "KeyPairSigner[" + signerId + ", " + algo + "]";
  }

}
