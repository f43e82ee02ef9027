package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.exception.ErrorDetails;
import java.time.Instant;

/**
 * Point-in-time view of an agent, used by the actuator endpoint.
 *
 * @param lastSuccessfulCheck null until the first successful check
 * @param lastError failure of the most recent check, null after a success
 */
public record AgentStatus(
    CheckState state,
    boolean running,
    String manifestUrl,
    Instant lastSuccessfulCheck,
    ErrorDetails lastError,
    int timesChecked,
    int knownOperations,
    String lastETag) {}
