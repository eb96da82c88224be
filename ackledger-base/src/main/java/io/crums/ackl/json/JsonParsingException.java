/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ackl.json;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException(String s) {
    super(s);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
