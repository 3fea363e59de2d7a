package com.gentoro.endnotemcp.exception;

import java.util.function.Function;

/** Helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Single-line summary of the top stack frames of {@code t}, joined in call order.
   *
   * <p>Example: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param maxFrames frames to include; {@code <= 0} includes all of them
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /** Message of {@code t}, falling back to its simple class name when the message is empty. */
  public static String describe(Throwable t) {
    if (t == null) return "unknown error";
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  public static EndnoteMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, EndnoteMcpException> supplier) {
    if (t instanceof EndnoteMcpException ex) {
      return ex;
    }
    return supplier.apply(t);
  }
}
