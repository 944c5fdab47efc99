/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;

/**
 * Malformed filters or page token.
 */
@SuppressWarnings("serial")
public class InvalidQueryException extends QueryException {

  public InvalidQueryException(String message) {
    super(message);
  }

  public InvalidQueryException(String message, Throwable cause) {
    super(message, cause);
  }

}
