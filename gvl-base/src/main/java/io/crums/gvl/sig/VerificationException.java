/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.sig;

import io.crums.gvl.GvlException;

/**
 * Bad or tampered signature, or a signature by an unknown signer.
 */
@SuppressWarnings("serial")
public class VerificationException extends GvlException {

  public VerificationException(String message) {
    super(message);
  }

  public VerificationException(String message, Throwable cause) {
    super(message, cause);
  }

}
