package com.gentoro.endnotemcp.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response of {@code refresh_backup}. {@code filesize} is only set on {@link
 * RefreshStatus#SUCCESS}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RefreshResult(RefreshStatus status, String message, String timestamp, Long filesize) {

  public boolean isSuccess() {
    return status == RefreshStatus.SUCCESS;
  }
}
