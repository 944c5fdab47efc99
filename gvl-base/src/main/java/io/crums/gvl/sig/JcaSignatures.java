/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;

/**
 * {@linkplain SignatureVerifier} backed by the platform's JCA providers. The
 * signature algorithm is chosen by the key's algorithm: Ed25519 keys use
 * {@code Ed25519}, EC keys {@code SHA256withECDSA}, RSA keys
 * {@code SHA256withRSA}.
 */
public class JcaSignatures implements SignatureVerifier {
  
  public final static JcaSignatures INSTANCE = new JcaSignatures();
  
  
  /**
   * Returns the JCA signature algorithm name for the given key algorithm.
   * 
   * @throws IllegalArgumentException if not supported
   */
  public static String signatureAlgo(String keyAlgo) {
    switch (keyAlgo) {
    case "Ed25519":
    case "EdDSA":
      return "Ed25519";
    case "EC":
      return "SHA256withECDSA";
    case "RSA":
      return "SHA256withRSA";
    default:
      throw new IllegalArgumentException("unsupported key algorithm: " + keyAlgo);
    }
  }
  
  

  @Override
  public boolean verify(PublicKey key, byte[] payload, byte[] signature) {
    final String algo;
    try {
      algo = signatureAlgo(key.getAlgorithm());
    } catch (IllegalArgumentException iax) {
      return false;
    }
    try {
      var verifier = Signature.getInstance(algo);
      verifier.initVerify(key);
      verifier.update(payload);
      return verifier.verify(signature);
    } catch (SignatureException sx) {
      // malformed signature bytes
      return false;
    } catch (NoSuchAlgorithmException nsax) {
      throw new IllegalStateException("platform lacks " + algo, nsax);
    } catch (GeneralSecurityException gsx) {
      throw new VerificationException(
          "on verifying with " + algo + " key: " + gsx.getMessage(), gsx);
    }
  }

}
