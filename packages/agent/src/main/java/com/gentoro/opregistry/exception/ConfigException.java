package com.gentoro.opregistry.exception;

import java.util.Map;

/**
 * Missing or invalid configuration, detected while building the agent or the application. When
 * the offending setting is known its name is carried in the context under {@code key}.
 */
public class ConfigException extends OperationRegistryException {
  public ConfigException(String message) {
    super(RegistryErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(RegistryErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(String key, String message) {
    super(RegistryErrorCode.CONFIGURATION_ERROR, message, Map.of("key", key));
  }

  public ConfigException(String key, String message, Throwable cause) {
    super(RegistryErrorCode.CONFIGURATION_ERROR, message, Map.of("key", key), cause);
  }

  /** Name of the offending setting, or null when not tied to one. */
  public String getKey() {
    Object key = getContext().get("key");
    return key == null ? null : key.toString();
  }
}
