package com.gentoro.opregistry.cache;

/**
 * Key-value store owned by the host. The registry agent is the only writer of the {@link
 * CacheKeys#PREFIX} namespace but does not manage the store's lifecycle.
 *
 * <p>Implementations must tolerate concurrent calls; no transactional guarantees are expected.
 */
public interface KeyValueCache {

  /** Returns the stored value, or {@code null} when the key is absent. */
  String get(String key);

  void set(String key, String value);

  void delete(String key);
}
