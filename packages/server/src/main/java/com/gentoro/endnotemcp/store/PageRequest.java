package com.gentoro.endnotemcp.store;

import java.util.OptionalInt;

/**
 * Sanitized paging window. Offsets that are negative or not integers become {@value
 * #DEFAULT_OFFSET}; limits that are non-positive or not integers become {@value #DEFAULT_LIMIT}.
 */
public record PageRequest(int offset, int limit) {
  public static final int DEFAULT_OFFSET = 0;
  public static final int DEFAULT_LIMIT = 10;

  public PageRequest {
    if (offset < 0) offset = DEFAULT_OFFSET;
    if (limit <= 0) limit = DEFAULT_LIMIT;
  }

  /** Build from loosely typed tool arguments; anything that is not an integer falls back. */
  public static PageRequest of(Object offset, Object limit) {
    return new PageRequest(
        asInt(offset).orElse(DEFAULT_OFFSET), asInt(limit).orElse(DEFAULT_LIMIT));
  }

  public static PageRequest first() {
    return new PageRequest(DEFAULT_OFFSET, DEFAULT_LIMIT);
  }

  private static OptionalInt asInt(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return OptionalInt.of(((Number) value).intValue());
    }
    if (value instanceof Long l) {
      if (l > Integer.MAX_VALUE) return OptionalInt.of(Integer.MAX_VALUE);
      if (l < Integer.MIN_VALUE) return OptionalInt.empty();
      return OptionalInt.of(l.intValue());
    }
    return OptionalInt.empty();
  }
}
