/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;

import io.crums.gvl.GvlException;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends GvlException {

  public JsonParsingException(String message) {
    super(message);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
