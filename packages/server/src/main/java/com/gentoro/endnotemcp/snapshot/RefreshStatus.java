package com.gentoro.endnotemcp.snapshot;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RefreshStatus {
  SUCCESS,
  SKIPPED,
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
