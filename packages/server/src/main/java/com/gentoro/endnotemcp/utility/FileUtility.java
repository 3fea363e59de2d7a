package com.gentoro.endnotemcp.utility;

import com.gentoro.endnotemcp.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileUtility {

  /**
   * Copy {@code source} over {@code target}, replacing it and carrying over file attributes such
   * as the last-modified time. Returns the size of the written file.
   */
  public static long copyFile(Path source, Path target) {
    try {
      if (target.getParent() != null) Files.createDirectories(target.getParent());
      Files.copy(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
      return Files.size(target);
    } catch (IOException e) {
      throw new IoException(
          "Failed to copy file: %s to: %s (%s)".formatted(source, target, describe(e)), e);
    }
  }

  private static String describe(IOException e) {
    String name = e.getClass().getSimpleName();
    return e.getMessage() == null ? name : name + ": " + e.getMessage();
  }
}
