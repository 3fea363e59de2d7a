package com.gentoro.endnotemcp.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends EndnoteMcpException {
  public SerializationException(String message) {
    super(EndnoteMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(EndnoteMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
