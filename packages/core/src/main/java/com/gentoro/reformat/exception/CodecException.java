package com.gentoro.reformat.exception;

/** Decode, encode or pixel operation failures raised by an image codec. */
public class CodecException extends ReformatException {
  public CodecException(String message) {
    super(ReformatErrorCode.CODEC_ERROR, message);
  }

  public CodecException(String message, Throwable cause) {
    super(ReformatErrorCode.CODEC_ERROR, message, cause);
  }
}
