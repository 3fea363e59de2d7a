package com.gentoro.endnotemcp.exception;

/** A startup or runtime step could not be carried out. */
public class ExecutionException extends EndnoteMcpException {
  public ExecutionException(String message) {
    super(EndnoteMcpErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.EXECUTION_ERROR, message, cause);
  }
}
