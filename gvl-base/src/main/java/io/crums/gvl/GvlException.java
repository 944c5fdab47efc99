/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


/**
 * Base exception in the <code>govledger</code> modules.
 */
@SuppressWarnings("serial")
public class GvlException extends RuntimeException {

  public GvlException(String message) {
    super(message);
  }

  public GvlException(Throwable cause) {
    super(cause);
  }

  public GvlException(String message, Throwable cause) {
    super(message, cause);
  }

}
