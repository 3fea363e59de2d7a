package com.gentoro.endnotemcp.exception;

/** Component used before it was initialized, or after shutdown. */
public class StateException extends EndnoteMcpException {
  public StateException(String message) {
    super(EndnoteMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
