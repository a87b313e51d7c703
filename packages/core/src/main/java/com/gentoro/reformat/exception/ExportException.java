package com.gentoro.reformat.exception;

/** Fatal orchestration errors that abort a whole export run before tasks are submitted. */
public class ExportException extends ReformatException {
  public ExportException(String message) {
    super(ReformatErrorCode.EXPORT_ERROR, message);
  }

  public ExportException(String message, Throwable cause) {
    super(ReformatErrorCode.EXPORT_ERROR, message, cause);
  }
}
