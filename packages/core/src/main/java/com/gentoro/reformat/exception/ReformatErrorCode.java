package com.gentoro.reformat.exception;

/** Coarse error categories attached to every {@link ReformatException}. */
public enum ReformatErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  EXPORT_ERROR,
  CODEC_ERROR,
  IO_ERROR,
  STATE_ERROR
}
