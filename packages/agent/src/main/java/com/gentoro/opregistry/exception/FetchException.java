package com.gentoro.opregistry.exception;

import java.util.Map;

/**
 * The manifest could not be retrieved: transport failure, timeout, non-success status or an
 * unexpected content type. Recoverable; the next poll tries again.
 */
public class FetchException extends OperationRegistryException {
  public FetchException(String message, Map<String, ?> context) {
    super(RegistryErrorCode.NETWORK_ERROR, message, context);
  }

  public FetchException(String message, Map<String, ?> context, Throwable cause) {
    super(RegistryErrorCode.NETWORK_ERROR, message, context, cause);
  }
}
