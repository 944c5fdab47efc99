/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


/**
 * Indicates a recomputed hash (chain hash or Merkle root) does not match
 * the stored one. Reported, never corrected automatically.
 */
@SuppressWarnings("serial")
public class IntegrityException extends GvlException {

  public IntegrityException(String message) {
    super(message);
  }

  public IntegrityException(Throwable cause) {
    super(cause);
  }

  public IntegrityException(String message, Throwable cause) {
    super(message, cause);
  }

}
