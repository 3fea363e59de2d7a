package com.gentoro.endnotemcp.document;

import java.util.Objects;

/**
 * Text of a whole document, or the single message explaining why it could not be read. Never
 * both.
 */
public record ExtractionResult(String text, String error) {

  public ExtractionResult {
    if ((text == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of text or error must be set");
    }
  }

  public static ExtractionResult success(String text) {
    return new ExtractionResult(Objects.requireNonNull(text, "text"), null);
  }

  public static ExtractionResult failure(String error) {
    return new ExtractionResult(null, Objects.requireNonNull(error, "error"));
  }

  /** Failure for a document that is not on disk, or whose name has no valid local path. */
  public static ExtractionResult notFound(Object location) {
    return failure("Error: File not found at %s.".formatted(location));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** What goes into the {@code text} field of a {@code read_paper} response. */
  public String content() {
    return isSuccess() ? text : error;
  }
}
