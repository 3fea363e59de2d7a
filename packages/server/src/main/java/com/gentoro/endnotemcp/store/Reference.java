package com.gentoro.endnotemcp.store;

/**
 * One bibliographic entry of the EndNote library ({@code refs} row plus its attached file).
 *
 * <p>All fields except {@code id} are optional. {@code year} is kept as text because EndNote
 * accepts free-form years ("in press", "2019a"). {@code keywords} is null when the library schema
 * has no such column. {@code filepath} is the raw {@code file_res.file_path} value, usually
 * prefixed with {@code internal-pdf://}; it is not checked against the filesystem.
 */
public record Reference(
    long id,
    String title,
    String author,
    String year,
    String journal,
    String abstractText,
    String keywords,
    String filepath) {

  /** A null, empty or whitespace-only {@code filepath} means no document is attached. */
  public boolean hasDocument() {
    return filepath != null && !filepath.isBlank();
  }
}
