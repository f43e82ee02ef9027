package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.cache.KeyValueCache;
import com.gentoro.opregistry.events.LoggingRegistryEventSink;
import com.gentoro.opregistry.events.RegistryEventSink;
import com.gentoro.opregistry.exception.ErrorDetails;
import com.gentoro.opregistry.exception.ExceptionUtil;
import com.gentoro.opregistry.exception.StateException;
import com.gentoro.opregistry.http.ManifestHttpClient;
import com.gentoro.opregistry.logging.LoggingService;
import com.gentoro.opregistry.manifest.ManifestParser;
import com.gentoro.opregistry.manifest.OperationManifest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the {@code apq:} namespace of a {@link KeyValueCache} in sync with the published operation
 * manifest of one service and schema.
 *
 * <p>{@link #start()} runs a first check before returning and then polls every {@code pollSeconds}
 * on a single daemon thread. At most one check runs at a time: {@link #checkForUpdate()} called
 * while a check is pending returns that same pending future, so concurrent callers share one
 * network request and one result.
 *
 * <p>All state lives in memory for the lifetime of the agent; a new agent always starts with a full
 * fetch.
 */
public class OperationRegistryAgent implements AutoCloseable {
  /** A warning is emitted when no check succeeded for longer than this. */
  public static final Duration SYNC_WARN_THRESHOLD = Duration.ofSeconds(60);

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(OperationRegistryAgent.class);

  private final AgentConfig config;
  private final RegistryEventSink events;
  private final Clock clock;
  private final ManifestReconciler reconciler;
  private final ManifestFetcher fetcher;
  private final ScheduledExecutorService executor;

  private final Object lock = new Object();
  private CheckState state = CheckState.IDLE;
  private CompletableFuture<Boolean> pending;
  private ScheduledFuture<?> timer;
  private boolean closed;

  private volatile Instant lastSuccessfulCheck;
  private volatile ErrorDetails lastError;

  public OperationRegistryAgent(
      AgentConfig config, ManifestHttpClient client, KeyValueCache cache) {
    this(
        config,
        client,
        cache,
        new LoggingRegistryEventSink(log, Objects.requireNonNull(config, "config").debug()),
        Clock.systemUTC());
  }

  public OperationRegistryAgent(
      AgentConfig config,
      ManifestHttpClient client,
      KeyValueCache cache,
      RegistryEventSink events,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.reconciler = new ManifestReconciler(cache, events);
    this.fetcher = new ManifestFetcher(config, client, reconciler, new ManifestParser(), events);
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread thread = new Thread(r, "operation-registry-agent");
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Run one check, then arm the polling timer. A failing first check is reported and does not
   * prevent the timer from starting: requests are served without a manifest until a later tick
   * succeeds.
   */
  public void start() {
    synchronized (lock) {
      if (closed) {
        throw StateException.agentClosed(config.serviceId(), null);
      }
    }

    try {
      checkForUpdate().join();
    } catch (CompletionException | CancellationException e) {
      events.checkFailed(ExceptionUtil.unwrap(e), true);
    }

    synchronized (lock) {
      if (timer == null && !closed) {
        long intervalMs = config.pollInterval().toMillis();
        timer =
            executor.scheduleAtFixedRate(
                this::pulse, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info(
            "Operation registry agent polling every {}s for service '{}'",
            config.pollSeconds(),
            config.serviceId());
      }
    }
  }

  /** Cancel future ticks. A check already running is left to finish. */
  public void stop() {
    synchronized (lock) {
      if (timer != null) {
        timer.cancel(false);
        timer = null;
        log.info("Operation registry agent stopped");
      }
    }
  }

  /** Stop polling and release the worker thread once the current check, if any, has finished. */
  @Override
  public void close() {
    stop();
    synchronized (lock) {
      closed = true;
    }
    executor.shutdown();
  }

  /**
   * Fetch the manifest and reconcile the cache, unless a check is already pending, in which case
   * the pending future is returned.
   *
   * @return future completing with true when a new manifest was applied and false when it was
   *     unchanged; it completes exceptionally with the failure of the check, after the agent is
   *     ready to run the next one
   */
  public CompletableFuture<Boolean> checkForUpdate() {
    warnWhenLossOfSync();

    CompletableFuture<Boolean> result;
    synchronized (lock) {
      if (state == CheckState.CHECKING) {
        return pending;
      }
      result = new CompletableFuture<>();
      state = CheckState.CHECKING;
      pending = result;
    }

    try {
      executor.execute(() -> runCheck(result));
    } catch (RejectedExecutionException e) {
      finishCheck();
      result.completeExceptionally(StateException.agentClosed(config.serviceId(), e));
    }
    return result;
  }

  /** Apply a manifest directly, bypassing the network. */
  public ReconciliationResult updateManifest(OperationManifest manifest) {
    return reconciler.updateManifest(manifest);
  }

  /** The check currently in flight, if any. */
  public Optional<CompletableFuture<Boolean>> pendingCheck() {
    synchronized (lock) {
      return Optional.ofNullable(pending);
    }
  }

  public int timesChecked() {
    return fetcher.timesChecked();
  }

  /** Signatures present after the last applied manifest. */
  public Set<String> knownSignatures() {
    return reconciler.knownSignatures();
  }

  public AgentConfig config() {
    return config;
  }

  public AgentStatus status() {
    CheckState current;
    boolean running;
    synchronized (lock) {
      current = state;
      running = timer != null;
    }
    return new AgentStatus(
        current,
        running,
        fetcher.manifestUrl(),
        lastSuccessfulCheck,
        lastError,
        fetcher.timesChecked(),
        reconciler.knownSignatures().size(),
        fetcher.lastSuccessfulETag());
  }

  private void runCheck(CompletableFuture<Boolean> result) {
    boolean changed;
    try {
      changed = fetcher.tryUpdate();
    } catch (Throwable t) {
      lastError = ExceptionUtil.toErrorDetails(t, clock.instant());
      finishCheck();
      result.completeExceptionally(t);
      return;
    }
    lastSuccessfulCheck = clock.instant();
    lastError = null;
    finishCheck();
    result.complete(changed);
  }

  private void finishCheck() {
    synchronized (lock) {
      state = CheckState.IDLE;
      pending = null;
    }
  }

  // runs on the timer; must never throw or the executor drops the schedule
  private void pulse() {
    try {
      checkForUpdate()
          .whenComplete(
              (changed, error) -> {
                if (error != null) {
                  events.checkFailed(ExceptionUtil.unwrap(error), false);
                }
              });
    } catch (RuntimeException e) {
      events.checkFailed(e, false);
    }
  }

  private void warnWhenLossOfSync() {
    Instant last = lastSuccessfulCheck;
    if (last == null
        || Duration.between(last, clock.instant()).compareTo(SYNC_WARN_THRESHOLD) > 0) {
      events.syncLost(last, SYNC_WARN_THRESHOLD);
    }
  }
}
