/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


/**
 * When nonsensical binary data is encountered, this exception is thrown.
 */
@SuppressWarnings("serial")
public class ByteFormatException extends GvlException {

  public ByteFormatException(String message) {
    super(message);
  }

  public ByteFormatException(Throwable cause) {
    super(cause);
  }

  public ByteFormatException(String message, Throwable cause) {
    super(message, cause);
  }

}
