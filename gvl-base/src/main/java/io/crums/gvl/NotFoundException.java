/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;

/**
 * No entry exists at the requested sequence index (or with the given id).
 */
@SuppressWarnings("serial")
public class NotFoundException extends GvlException {

  public NotFoundException(String message) {
    super(message);
  }

}
