package com.gentoro.opregistry.exception;

import java.util.Map;

/** A lifecycle call that the agent, plugin or server cannot honour in its current state. */
public class StateException extends OperationRegistryException {
  public StateException(String message) {
    super(RegistryErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(RegistryErrorCode.FAILED_PRECONDITION, message, cause);
  }

  public StateException(String message, Map<String, ?> context) {
    super(RegistryErrorCode.FAILED_PRECONDITION, message, context);
  }

  /** The agent for {@code serviceId} has been closed and accepts no more work. */
  public static StateException agentClosed(String serviceId, Throwable cause) {
    StateException ex =
        new StateException("Operation registry agent is closed", Map.of("serviceId", serviceId));
    if (cause != null) {
      ex.initCause(cause);
    }
    return ex;
  }
}
