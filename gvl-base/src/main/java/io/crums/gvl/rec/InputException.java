/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.rec;

import io.crums.gvl.GvlException;

/**
 * Thrown when record inputs (or results) cannot be put in canonical form.
 */
@SuppressWarnings("serial")
public class InputException extends GvlException {

  public InputException(String message) {
    super(message);
  }

  public InputException(String message, Throwable cause) {
    super(message, cause);
  }

}
