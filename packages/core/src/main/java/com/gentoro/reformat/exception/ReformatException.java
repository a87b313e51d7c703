package com.gentoro.reformat.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the project. Carries an error code and an optional context map that
 * ends up in {@link ErrorDetails} and in log output.
 */
public class ReformatException extends RuntimeException {
  private final ReformatErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ReformatException(ReformatErrorCode code, String message) {
    super(message);
    this.code = code == null ? ReformatErrorCode.UNKNOWN : code;
  }

  public ReformatException(ReformatErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ReformatErrorCode.UNKNOWN : code;
  }

  public ReformatErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception, for fluent throw sites. */
  public ReformatException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
