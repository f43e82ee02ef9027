package com.gentoro.opregistry;

import com.gentoro.opregistry.actuator.ActuatorService;
import com.gentoro.opregistry.agent.AgentConfig;
import com.gentoro.opregistry.agent.OperationRegistryAgent;
import com.gentoro.opregistry.cache.InMemoryKeyValueCache;
import com.gentoro.opregistry.exception.ExceptionUtil;
import com.gentoro.opregistry.exception.OperationRegistryException;
import com.gentoro.opregistry.exception.RegistryErrorCode;
import com.gentoro.opregistry.exception.StateException;
import com.gentoro.opregistry.http.EmbeddedJettyServer;
import com.gentoro.opregistry.http.ManifestHttpClient;
import com.gentoro.opregistry.http.OkHttpManifestClient;
import com.gentoro.opregistry.logging.LoggingService;
import com.gentoro.opregistry.plugin.OperationRegistryPlugin;
import java.time.Clock;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Standalone host for the operation registry agent.
 *
 * <p>Wires configuration, logging, the OkHttp manifest client, an in-memory cache, the registry
 * plugin and the actuator endpoints. In {@code server} mode the agent keeps polling until a
 * shutdown signal arrives; in {@code once} mode a single check is run and its outcome logged.
 */
public class OperationRegistry {

  private static final org.slf4j.Logger log = LoggingService.getLogger(OperationRegistry.class);

  private final StartupParameters startupParameters;
  private final ManifestHttpClient manifestClient;
  private ConfigurationProvider configurationProvider;
  private EmbeddedJettyServer httpServer;
  private InMemoryKeyValueCache cache;
  private OperationRegistryPlugin plugin;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public OperationRegistry(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), new OkHttpManifestClient());
  }

  public OperationRegistry(StartupParameters startupParameters, ManifestHttpClient manifestClient) {
    this.startupParameters = startupParameters;
    this.manifestClient = manifestClient;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    AgentConfig.Builder settings = AgentConfig.fromConfiguration(configuration());
    String serviceId =
        startupParameters
            .getOptionalParameter("service-id", String.class)
            .orElse(AgentConfig.configuredValue(configuration(), "registry.serviceId"));
    String schemaHash =
        startupParameters
            .getOptionalParameter("schema-hash", String.class)
            .orElse(AgentConfig.configuredValue(configuration(), "registry.schemaHash"));

    this.cache = new InMemoryKeyValueCache();

    switch (startupParameters.mode()) {
      case "once":
        runOnce(settings.serviceId(serviceId).schemaHash(schemaHash).build());
        break;
      case "server":
        startServer(settings, schemaHash, serviceId);
        break;
      default:
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void runOnce(AgentConfig config) {
    try (OperationRegistryAgent agent = new OperationRegistryAgent(config, manifestClient, cache)) {
      boolean changed = agent.checkForUpdate().join();
      log.info(
          "Manifest {} ({} operations registered)",
          changed ? "applied" : "unchanged",
          agent.knownSignatures().size());
    } catch (CompletionException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          ExceptionUtil.unwrap(e),
          ex ->
              new OperationRegistryException(
                  RegistryErrorCode.UNKNOWN, "Manifest check failed", ex));
    } finally {
      shutdownLatch.countDown();
    }
  }

  private void startServer(AgentConfig.Builder settings, String schemaHash, String serviceId) {
    this.plugin =
        new OperationRegistryPlugin(settings, manifestClient, cache, null, Clock.systemUTC());
    this.httpServer = new EmbeddedJettyServer(configuration());
    new ActuatorService(httpServer, plugin).register();
    httpServer.start();

    try {
      plugin.serverWillStart(schemaHash, serviceId);
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "operation-registry-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (plugin != null) {
          plugin.serverWillStop();
        }
        if (httpServer != null) {
          httpServer.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("OperationRegistry not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public InMemoryKeyValueCache cache() {
    return cache;
  }

  public OperationRegistryPlugin plugin() {
    return plugin;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
