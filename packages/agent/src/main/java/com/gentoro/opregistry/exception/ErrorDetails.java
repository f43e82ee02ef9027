package com.gentoro.opregistry.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Failure of the most recent manifest check, as shown by {@code /actuator/registry}.
 *
 * @param retryable true when the next poll may succeed without operator action (network and
 *     upstream errors); false for configuration or state problems and unknown failures
 */
public record ErrorDetails(
    String type,
    String message,
    RegistryErrorCode code,
    Map<String, Object> context,
    Instant timestamp,
    boolean retryable) {}
