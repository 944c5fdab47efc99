/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;

import io.crums.gvl.GvlException;

/**
 * Base query failure. Subclasses distinguish the outcomes.
 */
@SuppressWarnings("serial")
public class QueryException extends GvlException {

  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }

}
