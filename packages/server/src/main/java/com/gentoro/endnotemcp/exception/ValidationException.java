package com.gentoro.endnotemcp.exception;

/** Invalid command line argument or tool input. */
public class ValidationException extends EndnoteMcpException {
  public ValidationException(String message) {
    super(EndnoteMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
