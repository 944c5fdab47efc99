/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;

import io.crums.gvl.GvlException;

/**
 * Thrown when a record's lifecycle phase is unknown or not open.
 */
@SuppressWarnings("serial")
public class LifecycleException extends GvlException {

  public LifecycleException(String message) {
    super(message);
  }

  public LifecycleException(String message, Throwable cause) {
    super(message, cause);
  }

}
