package com.gentoro.endnotemcp.exception;

/** HTTP listener could not be created or started. */
public class NetworkException extends EndnoteMcpException {
  public NetworkException(String message) {
    super(EndnoteMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
