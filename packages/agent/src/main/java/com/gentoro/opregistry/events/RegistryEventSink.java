package com.gentoro.opregistry.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Observer for the registry agent.
 *
 * <p>Decouples the agent (producer of events) from how they are reported. Events fall into three
 * levels: diagnostic ({@link #checkStarted}, {@link #manifestUnchanged}, {@link #operationAdded},
 * {@link #operationRemoved}), warning ({@link #syncLost}) and error ({@link #cacheUpdateFailed},
 * {@link #checkFailed}). Implementations must be cheap and must not throw.
 */
public interface RegistryEventSink {

  /** A manifest fetch is about to be issued against {@code manifestUrl}. */
  void checkStarted(String manifestUrl);

  /** The server answered "not modified" for the last known ETag. */
  void manifestUnchanged();

  void operationAdded(String signature);

  void operationRemoved(String signature);

  /**
   * No successful check happened within {@code threshold}.
   *
   * @param lastSuccess instant of the last successful check, or {@code null} if there never was one
   */
  void syncLost(Instant lastSuccess, Duration threshold);

  /** A cache write or delete failed; reconciliation carried on with the remaining keys. */
  void cacheUpdateFailed(String key, Throwable error);

  /**
   * A check failed outside of a caller that could handle it.
   *
   * @param initial true when the failure happened during the startup check
   */
  void checkFailed(Throwable error, boolean initial);
}
