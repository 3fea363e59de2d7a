package com.gentoro.endnotemcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception carrying a stable {@link EndnoteMcpErrorCode} and an optional,
 * unmodifiable context map for diagnostics.
 */
public class EndnoteMcpException extends RuntimeException {
  private final EndnoteMcpErrorCode code;
  private final Map<String, Object> context;

  public EndnoteMcpException(EndnoteMcpErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public EndnoteMcpException(EndnoteMcpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public EndnoteMcpException(
      EndnoteMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public EndnoteMcpErrorCode getCode() {
    return code;
  }

  /** Key/value details that help diagnose the error, e.g. the store path or SQL involved. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>(input);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
