/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;

import org.junit.jupiter.api.Test;

import io.crums.gvl.GvlTestCase;

/**
 * 
 */
public class KeyRingTest extends GvlTestCase {


  @Test
  public void testSaveLoad() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);

    var other = KeyPairSigner.newEd25519("reviewer");
    KeyRing.save(dir, SIGNER_ID, signer().publicKey());
    KeyRing.save(dir, other.signerId(), other.publicKey());

    var ring = KeyRing.load(dir);
    assertEquals(2, ring.signerIds().size());
    assertArrayEquals(
        signer().publicKey().getEncoded(), ring.publicKey(SIGNER_ID).get().getEncoded());
    assertArrayEquals(
        other.publicKey().getEncoded(), ring.publicKey("reviewer").get().getEncoded());
    assertTrue(new TupleVerifier(ring).isValid(record(3)));
  }


  @Test
  public void testEmpty() {
    var ring = new KeyRing();
    assertTrue(ring.isEmpty());
    assertFalse(ring.contains(SIGNER_ID));
    assertTrue(ring.publicKey(SIGNER_ID).isEmpty());
  }


  @Test
  public void testBlankId() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new KeyRing().register(" ", signer().publicKey()));
  }

}
