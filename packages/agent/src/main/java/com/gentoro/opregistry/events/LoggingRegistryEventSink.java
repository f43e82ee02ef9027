package com.gentoro.opregistry.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Reports agent events through SLF4J.
 *
 * <p>Diagnostic events are written at INFO when {@code debug} is enabled and at DEBUG otherwise, so
 * the agent's debug flag works without touching the logback configuration. Loss of sync is a WARN,
 * failures are ERROR.
 */
public class LoggingRegistryEventSink implements RegistryEventSink {
  private final Logger log;
  private final Level diagnosticLevel;

  public LoggingRegistryEventSink(Logger logger, boolean debug) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.diagnosticLevel = debug ? Level.INFO : Level.DEBUG;
  }

  @Override
  public void checkStarted(String manifestUrl) {
    diagnostic("Checking for manifest changes at {}", manifestUrl);
  }

  @Override
  public void manifestUnchanged() {
    diagnostic("The published manifest was the same as the previous attempt.");
  }

  @Override
  public void operationAdded(String signature) {
    diagnostic("Incoming manifest ADDs: {}", signature);
  }

  @Override
  public void operationRemoved(String signature) {
    diagnostic("Incoming manifest REMOVEs: {}", signature);
  }

  @Override
  public void syncLost(Instant lastSuccess, Duration threshold) {
    log.warn(
        "More than {} seconds has elapsed since a successful fetch of the manifest. (Last success: {})",
        threshold.toSeconds(),
        lastSuccess == null ? "never" : lastSuccess);
  }

  @Override
  public void cacheUpdateFailed(String key, Throwable error) {
    log.error("Failed to update cache entry {}", key, error);
  }

  @Override
  public void checkFailed(Throwable error, boolean initial) {
    if (initial) {
      log.error(
          "Could not begin serving requests immediately because the operation manifest could not be fetched. "
              + "Attempts will continue to fetch the manifest, but all requests will be forbidden until it is fetched: {}",
          error.getMessage(),
          error);
    } else {
      log.error("Operation manifest update failed: {}", error.getMessage(), error);
    }
  }

  private void diagnostic(String format, Object... args) {
    log.atLevel(diagnosticLevel).log(format, args);
  }
}
