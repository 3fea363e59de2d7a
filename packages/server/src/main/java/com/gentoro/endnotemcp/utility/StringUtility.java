package com.gentoro.endnotemcp.utility;

public class StringUtility {

  /** Escape character used together with {@link #escapeLike(String)} in SQL {@code LIKE}. */
  public static final char LIKE_ESCAPE = '\\';

  /**
   * Escape {@code %}, {@code _} and the escape character itself so the value is matched
   * literally inside a {@code LIKE ... ESCAPE '\'} pattern.
   */
  public static String escapeLike(String input) {
    if (input == null || input.isEmpty()) return "";
    StringBuilder sb = new StringBuilder(input.length() + 8);
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        sb.append(LIKE_ESCAPE);
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /** Substring pattern for {@code LIKE}: {@code %<escaped input>%}. */
  public static String containsPattern(String input) {
    return "%" + escapeLike(input) + "%";
  }
}
