package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.exception.ConfigException;
import java.time.Duration;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable settings of an {@link OperationRegistryAgent}.
 *
 * <p>{@code serviceId} and {@code schemaHash} are mandatory; {@link Builder#build()} fails with
 * {@link ConfigException} without them, before anything touches the network.
 */
public final class AgentConfig {
  public static final int DEFAULT_POLL_SECONDS = 30;
  public static final String DEFAULT_MANIFEST_BASE_URL =
      "https://storage.googleapis.com/engine-op-manifest-storage-prod";

  private final String serviceId;
  private final String schemaHash;
  private final int pollSeconds;
  private final boolean debug;
  private final String manifestBaseUrl;

  private AgentConfig(Builder builder) {
    this.serviceId = builder.serviceId;
    this.schemaHash = builder.schemaHash;
    this.pollSeconds = builder.pollSeconds;
    this.debug = builder.debug;
    this.manifestBaseUrl = builder.manifestBaseUrl;
  }

  public String serviceId() {
    return serviceId;
  }

  public String schemaHash() {
    return schemaHash;
  }

  public int pollSeconds() {
    return pollSeconds;
  }

  public Duration pollInterval() {
    return Duration.ofSeconds(pollSeconds);
  }

  /** Three poll intervals: tolerates one slow round but stays bounded. */
  public Duration fetchTimeout() {
    return Duration.ofSeconds(pollSeconds * 3L);
  }

  public boolean debug() {
    return debug;
  }

  public String manifestBaseUrl() {
    return manifestBaseUrl;
  }

  public Builder toBuilder() {
    return builder()
        .serviceId(serviceId)
        .schemaHash(schemaHash)
        .pollSeconds(pollSeconds)
        .debug(debug)
        .manifestBaseUrl(manifestBaseUrl);
  }

  /**
   * Read settings from the {@code registry.*} keys of the application configuration. Values that
   * still hold an unresolved {@code ${...}} placeholder count as missing.
   */
  public static Builder fromConfiguration(Configuration cfg) {
    Objects.requireNonNull(cfg, "cfg");
    Builder builder =
        builder()
            .serviceId(configuredValue(cfg, "registry.serviceId"))
            .schemaHash(configuredValue(cfg, "registry.schemaHash"))
            .debug(cfg.getBoolean("registry.debug", false));
    try {
      builder.pollSeconds(cfg.getInt("registry.pollSeconds", DEFAULT_POLL_SECONDS));
    } catch (RuntimeException e) {
      throw new ConfigException("registry.pollSeconds", "registry.pollSeconds must be an integer", e);
    }
    String baseUrl = configuredValue(cfg, "registry.manifestBaseUrl");
    if (baseUrl != null) {
      builder.manifestBaseUrl(baseUrl);
    }
    return builder;
  }

  /** Trimmed value of {@code key}, or null when blank or still an unresolved placeholder. */
  public static String configuredValue(Configuration cfg, String key) {
    String value = cfg.getString(key, null);
    if (value == null || value.isBlank() || value.startsWith("${")) {
      return null;
    }
    return value.trim();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "AgentConfig{"
        + "serviceId='"
        + serviceId
        + '\''
        + ", schemaHash='"
        + schemaHash
        + '\''
        + ", pollSeconds="
        + pollSeconds
        + ", debug="
        + debug
        + ", manifestBaseUrl='"
        + manifestBaseUrl
        + '\''
        + '}';
  }

  public static final class Builder {
    private String serviceId;
    private String schemaHash;
    private int pollSeconds = DEFAULT_POLL_SECONDS;
    private boolean debug;
    private String manifestBaseUrl = DEFAULT_MANIFEST_BASE_URL;

    private Builder() {}

    /** Independent builder holding the same values. */
    public Builder copy() {
      Builder copy = new Builder();
      copy.serviceId = serviceId;
      copy.schemaHash = schemaHash;
      copy.pollSeconds = pollSeconds;
      copy.debug = debug;
      copy.manifestBaseUrl = manifestBaseUrl;
      return copy;
    }

    public Builder serviceId(String serviceId) {
      this.serviceId = serviceId;
      return this;
    }

    public Builder schemaHash(String schemaHash) {
      this.schemaHash = schemaHash;
      return this;
    }

    public Builder pollSeconds(int pollSeconds) {
      this.pollSeconds = pollSeconds;
      return this;
    }

    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Builder manifestBaseUrl(String manifestBaseUrl) {
      this.manifestBaseUrl = manifestBaseUrl;
      return this;
    }

    public AgentConfig build() {
      if (schemaHash == null || schemaHash.isBlank()) {
        throw new ConfigException("schemaHash", "`schemaHash` must be passed to the Agent.");
      }
      if (serviceId == null || serviceId.isBlank()) {
        throw new ConfigException("serviceId", "`serviceId` must be passed to the Agent.");
      }
      if (pollSeconds <= 0) {
        throw new ConfigException(
            "pollSeconds", "`pollSeconds` must be positive, got " + pollSeconds);
      }
      if (manifestBaseUrl == null || manifestBaseUrl.isBlank()) {
        throw new ConfigException("manifestBaseUrl", "`manifestBaseUrl` must not be blank");
      }
      return new AgentConfig(this);
    }
  }
}
