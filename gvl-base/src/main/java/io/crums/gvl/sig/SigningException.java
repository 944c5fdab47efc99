/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;

import io.crums.gvl.GvlException;

/**
 * Thrown when the signer rejects, or fails to sign, a payload.
 */
@SuppressWarnings("serial")
public class SigningException extends GvlException {

  public SigningException(String message) {
    super(message);
  }

  public SigningException(String message, Throwable cause) {
    super(message, cause);
  }

}
