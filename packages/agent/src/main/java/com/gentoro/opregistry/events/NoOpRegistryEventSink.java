package com.gentoro.opregistry.events;

import java.time.Duration;
import java.time.Instant;

/** No-op implementation used when event reporting is disabled. */
public class NoOpRegistryEventSink implements RegistryEventSink {
  @Override
  public void checkStarted(String manifestUrl) {}

  @Override
  public void manifestUnchanged() {}

  @Override
  public void operationAdded(String signature) {}

  @Override
  public void operationRemoved(String signature) {}

  @Override
  public void syncLost(Instant lastSuccess, Duration threshold) {}

  @Override
  public void cacheUpdateFailed(String key, Throwable error) {}

  @Override
  public void checkFailed(Throwable error, boolean initial) {}
}
