/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


/**
 * The storage substrate is unavailable, or an append could not be made
 * durable after the configured retries.
 */
@SuppressWarnings("serial")
public class PersistenceException extends GvlException {

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(Throwable cause) {
    super(cause);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }

}
