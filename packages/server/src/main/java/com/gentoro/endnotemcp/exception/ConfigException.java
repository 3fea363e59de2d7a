package com.gentoro.endnotemcp.exception;

/** Configuration or startup parameter problem detected while building the server. */
public class ConfigException extends EndnoteMcpException {
  public ConfigException(String message) {
    super(EndnoteMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
