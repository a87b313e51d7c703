package com.gentoro.reformat.exception;

/** A component was used before it was initialized or after it was closed. */
public class StateException extends ReformatException {
  public StateException(String message) {
    super(ReformatErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ReformatErrorCode.STATE_ERROR, message, cause);
  }
}
