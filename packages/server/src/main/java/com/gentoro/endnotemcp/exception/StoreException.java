package com.gentoro.endnotemcp.exception;

import java.util.Map;

/**
 * Failure talking to the reference store. The code tells apart a store that could not be opened
 * at all ({@link EndnoteMcpErrorCode#STORE_CONNECTION_ERROR}) from a query that failed on an open
 * connection ({@link EndnoteMcpErrorCode#STORE_QUERY_ERROR}).
 */
public class StoreException extends EndnoteMcpException {

  private StoreException(
      EndnoteMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(code, message, context, cause);
  }

  public static StoreException connection(String storePath, Throwable cause) {
    return new StoreException(
        EndnoteMcpErrorCode.STORE_CONNECTION_ERROR,
        "Could not open reference store: " + storePath,
        Map.of("store", String.valueOf(storePath)),
        cause);
  }

  public static StoreException query(String operation, String storePath, Throwable cause) {
    return new StoreException(
        EndnoteMcpErrorCode.STORE_QUERY_ERROR,
        "%s failed: %s".formatted(operation, cause == null ? "unknown" : cause.getMessage()),
        Map.of("operation", operation, "store", String.valueOf(storePath)),
        cause);
  }

  public boolean isConnectionFailure() {
    return getCode() == EndnoteMcpErrorCode.STORE_CONNECTION_ERROR;
  }
}
