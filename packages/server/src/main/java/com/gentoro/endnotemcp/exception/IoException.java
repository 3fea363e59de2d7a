package com.gentoro.endnotemcp.exception;

/** Filesystem operation failed (snapshot copy, document access). */
public class IoException extends EndnoteMcpException {
  public IoException(String message) {
    super(EndnoteMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.IO_ERROR, message, cause);
  }
}
