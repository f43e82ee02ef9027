package com.gentoro.opregistry.plugin;

import com.gentoro.opregistry.agent.AgentConfig;
import com.gentoro.opregistry.agent.OperationRegistryAgent;
import com.gentoro.opregistry.cache.CacheKeys;
import com.gentoro.opregistry.cache.KeyValueCache;
import com.gentoro.opregistry.events.RegistryEventSink;
import com.gentoro.opregistry.exception.ConfigException;
import com.gentoro.opregistry.exception.StateException;
import com.gentoro.opregistry.http.ManifestHttpClient;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Host-facing glue: the host calls {@link #serverWillStart} once it knows the schema hash and
 * service id, and {@link #serverWillStop} on shutdown. Lookups answer whether an operation is
 * currently allowed, based solely on what the agent has written to the cache.
 */
public class OperationRegistryPlugin {
  public static final String PLUGIN_NAME = "operation-registry";

  private static final org.slf4j.Logger log =
      com.gentoro.opregistry.logging.LoggingService.getLogger(OperationRegistryPlugin.class);

  private final AgentConfig.Builder settings;
  private final ManifestHttpClient client;
  private final KeyValueCache cache;
  private final RegistryEventSink events;
  private final Clock clock;

  private volatile OperationRegistryAgent agent;

  /**
   * @param settings poll interval, debug flag and base URL; service id and schema hash are filled
   *     in at server start on a copy, so the caller's builder is never modified
   * @param events event sink for the agent, or {@code null} for the default logging sink
   */
  public OperationRegistryPlugin(
      AgentConfig.Builder settings,
      ManifestHttpClient client,
      KeyValueCache cache,
      RegistryEventSink events,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.client = Objects.requireNonNull(client, "client");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.events = events;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Build the agent for this schema and service, run its first check and start polling. */
  public synchronized void serverWillStart(String schemaHash, String serviceId) {
    if (agent != null) {
      throw new StateException(
          PLUGIN_NAME + ": already started",
          Map.of("serviceId", agent.config().serviceId()));
    }
    if (serviceId == null || serviceId.isBlank()) {
      throw new ConfigException(
          "serviceId",
          PLUGIN_NAME + ": The Engine API key must be set to use the operation registry.");
    }
    AgentConfig config = settings.copy().schemaHash(schemaHash).serviceId(serviceId).build();
    OperationRegistryAgent created =
        events == null
            ? new OperationRegistryAgent(config, client, cache)
            : new OperationRegistryAgent(config, client, cache, events, clock);
    log.info("{}: starting for schema {} of service '{}'", PLUGIN_NAME, schemaHash, serviceId);
    this.agent = created;
    created.start();
  }

  public synchronized void serverWillStop() {
    OperationRegistryAgent current = agent;
    if (current != null) {
      current.close();
      agent = null;
    }
  }

  /** Registered document for {@code signature}, if the current manifest allows it. */
  public Optional<String> lookup(String signature) {
    if (signature == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.get(CacheKeys.forSignature(signature)));
  }

  public boolean isAllowed(String signature) {
    return lookup(signature).isPresent();
  }

  public Optional<OperationRegistryAgent> agent() {
    return Optional.ofNullable(agent);
  }
}
