/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;

/**
 * An integrity proof could not be produced for a matching entry.
 */
@SuppressWarnings("serial")
public class ProofUnavailableException extends QueryException {

  public ProofUnavailableException(String message) {
    super(message);
  }

  public ProofUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

}
