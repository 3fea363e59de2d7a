package com.gentoro.endnotemcp.document;

import com.gentoro.endnotemcp.config.StoreConfig;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps the {@code file_res.file_path} value of a reference to a file under {@code <data
 * folder>/PDF/}. EndNote stores these as {@code internal-pdf://<folder>/<name>.pdf}; the scheme
 * marker is dropped and the remainder treated as relative. Pure path arithmetic: the result may
 * not exist.
 */
public class DocumentResolver {
  public static final String PDF_FOLDER = "PDF";

  private static final Pattern SCHEME_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*://");
  private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[/\\\\]+");

  private final Path pdfRoot;

  public DocumentResolver(StoreConfig config) {
    this.pdfRoot = config.dataFolder().resolve(PDF_FOLDER);
  }

  public Path resolve(String storedPath) {
    Objects.requireNonNull(storedPath, "storedPath");
    String relative = SCHEME_PREFIX.matcher(storedPath.trim()).replaceFirst("").trim();
    relative = LEADING_SEPARATORS.matcher(relative).replaceFirst("");
    return pdfRoot.resolve(relative).normalize();
  }
}
