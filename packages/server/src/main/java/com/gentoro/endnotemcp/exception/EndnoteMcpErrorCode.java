package com.gentoro.endnotemcp.exception;

/**
 * Stable error codes for the EndNote MCP server. Codes are safe to surface in logs and tool
 * responses; pick the one closest to where the failure originated.
 */
public enum EndnoteMcpErrorCode {
  // Generic
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,
  EXECUTION_ERROR,

  // Reference store
  STORE_CONNECTION_ERROR,
  STORE_QUERY_ERROR,
}
