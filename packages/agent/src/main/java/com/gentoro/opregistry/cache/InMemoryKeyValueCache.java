package com.gentoro.opregistry.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link KeyValueCache} backed by a {@link ConcurrentHashMap}; used by the standalone app. */
public class InMemoryKeyValueCache implements KeyValueCache {
  private static final org.slf4j.Logger log =
      com.gentoro.opregistry.logging.LoggingService.getLogger(InMemoryKeyValueCache.class);
  private final Map<String, String> memory = new ConcurrentHashMap<>();

  @Override
  public String get(String key) {
    try {
      return memory.get(key);
    } finally {
      log.trace("InMemoryKeyValueCache: get {}", key);
    }
  }

  @Override
  public void set(String key, String value) {
    memory.put(key, value);
    log.trace("InMemoryKeyValueCache: set {}", key);
  }

  @Override
  public void delete(String key) {
    memory.remove(key);
    log.trace("InMemoryKeyValueCache: delete {}", key);
  }

  public Map<String, String> snapshot() {
    return Map.copyOf(memory);
  }

  public int size() {
    return memory.size();
  }
}
