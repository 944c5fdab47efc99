/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import static io.crums.gvl.GvlConstants.HASH_ALGO;
import static io.crums.gvl.GvlConstants.HASH_WIDTH;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hashing utilities. The point is there's only one place where the hashing
 * algorithm is named.
 */
public class Hashing {
  
  private final static ByteBuffer SENTINEL =
      ByteBuffer.allocate(HASH_WIDTH).asReadOnlyBuffer();
  
  private final static HexFormat HEX = HexFormat.of();
  
  // static only
  private Hashing() {  }
  
  
  /**
   * Creates and returns a new {@code MessageDigest}.
   */
  public static MessageDigest newDigest() {
    try {
      MessageDigest digest = MessageDigest.getInstance(HASH_ALGO);
      assert digest.getDigestLength() == HASH_WIDTH;
      return digest;
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + HASH_ALGO, nsax);
    }
  }
  
  
  /**
   * Returns a read-only buffer of zeroes with {@linkplain GvlConstants#HASH_WIDTH}
   * remaining bytes. This is the chain hash of the (imaginary) entry before the
   * first.
   */
  public static ByteBuffer sentinelHash() {
    return SENTINEL.duplicate();
  }
  
  
  /**
   * Returns the hash of the concatenation of the remaining bytes in the
   * given buffers. The buffers' positions are not modified.
   * 
   * @return read-only buffer with 32 remaining bytes
   */
  public static ByteBuffer hash(ByteBuffer... parts) {
    var digest = newDigest();
    for (var part : parts)
      digest.update(part.duplicate());
    return ByteBuffer.wrap(digest.digest()).asReadOnlyBuffer();
  }
  
  
  /**
   * Returns the SHA-256 hash of the given bytes.
   */
  public static byte[] hash(byte[] bytes) {
    return newDigest().digest(bytes);
  }
  
  
  /**
   * Checks the given buffer has exactly {@linkplain GvlConstants#HASH_WIDTH}
   * remaining bytes and returns a read-only slice of it.
   */
  public static ByteBuffer checkHash(ByteBuffer hash) {
    if (hash.remaining() != HASH_WIDTH)
      throw new IllegalArgumentException(
          "expected " + HASH_WIDTH + " remaining bytes: " + hash);
    return hash.slice().asReadOnlyBuffer();
  }
  
  
  /** Returns the remaining bytes as lowercase hex. */
  public static String toHex(ByteBuffer bytes) {
    var b = bytes.duplicate();
    byte[] array = new byte[b.remaining()];
    b.get(array);
    return HEX.formatHex(array);
  }
  
  
  public static String toHex(byte[] bytes) {
    return HEX.formatHex(bytes);
  }
  
  
  public static byte[] fromHex(String hex) {
    return HEX.parseHex(hex);
  }

}
