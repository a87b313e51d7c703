package com.gentoro.reformat.exception;

/** Invalid or unreadable configuration. */
public class ConfigurationException extends ReformatException {
  public ConfigurationException(String message) {
    super(ReformatErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ReformatErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
