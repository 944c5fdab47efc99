/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for the length-prefixed binary forms used in hashed payloads
 * and on disk. Strings are written as a 4-byte big-endian length followed
 * by their UTF-8 bytes; byte arrays likewise.
 */
public class Serials {
  
  /**
   * Sanity bound on a single string or byte array field.
   */
  public final static int MAX_FIELD_SIZE = 16 * 1024 * 1024;
  
  private Serials() {  }
  
  
  public static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
  
  
  /** Returns the number of bytes {@linkplain #putString(ByteBuffer, String)} writes. */
  public static int stringSize(String value) {
    return 4 + utf8(value).length;
  }
  
  
  public static ByteBuffer putString(ByteBuffer out, String value) {
    return putBytes(out, utf8(value));
  }
  
  
  public static ByteBuffer putBytes(ByteBuffer out, byte[] value) {
    return out.putInt(value.length).put(value);
  }
  
  
  public static String getString(ByteBuffer in) throws ByteFormatException {
    return new String(getBytes(in), StandardCharsets.UTF_8);
  }
  
  
  public static byte[] getBytes(ByteBuffer in) throws ByteFormatException {
    try {
      int len = in.getInt();
      if (len < 0 || len > MAX_FIELD_SIZE || len > in.remaining())
        throw new ByteFormatException(
            "field length " + len + " out of bounds; remaining " + in.remaining());
      byte[] value = new byte[len];
      in.get(value);
      return value;
    } catch (BufferUnderflowException bux) {
      throw new ByteFormatException("truncated field", bux);
    }
  }
  
  
  /**
   * Reads a hash-width field.
   * 
   * @return read-only, 32 remaining bytes
   */
  public static ByteBuffer getHash(ByteBuffer in) throws ByteFormatException {
    if (in.remaining() < GvlConstants.HASH_WIDTH)
      throw new ByteFormatException("truncated hash; remaining " + in.remaining());
    byte[] hash = new byte[GvlConstants.HASH_WIDTH];
    in.get(hash);
    return ByteBuffer.wrap(hash).asReadOnlyBuffer();
  }

}
