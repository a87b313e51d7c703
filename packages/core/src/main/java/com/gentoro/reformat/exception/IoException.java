package com.gentoro.reformat.exception;

/** Unchecked wrapper for filesystem failures. */
public class IoException extends ReformatException {
  public IoException(String message) {
    super(ReformatErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(ReformatErrorCode.IO_ERROR, message, cause);
  }
}
