package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.cache.CacheKeys;
import com.gentoro.opregistry.cache.KeyValueCache;
import com.gentoro.opregistry.events.RegistryEventSink;
import com.gentoro.opregistry.exception.ManifestFormatException;
import com.gentoro.opregistry.manifest.ManifestEntry;
import com.gentoro.opregistry.manifest.OperationManifest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies the minimal set of cache writes and deletes that makes the {@code apq:} namespace match
 * an incoming manifest.
 *
 * <p>Documents are content-addressed by signature, so a signature already known is never rewritten.
 * The set of known signatures is replaced as a whole after every applied manifest; a rejected
 * manifest leaves it and the cache untouched.
 *
 * <p>Manifests are applied one at a time: a direct {@link #updateManifest} call and a scheduled check
 * never interleave their cache writes.
 */
public class ManifestReconciler {
  private final KeyValueCache cache;
  private final RegistryEventSink events;

  private volatile Set<String> knownSignatures = Set.of();

  public ManifestReconciler(KeyValueCache cache, RegistryEventSink events) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.events = Objects.requireNonNull(events, "events");
  }

  public synchronized ReconciliationResult updateManifest(OperationManifest manifest) {
    Map<String, String> incoming = validate(manifest);
    Set<String> previous = knownSignatures;

    List<String> added = new ArrayList<>();
    int retained = 0;
    for (Map.Entry<String, String> op : incoming.entrySet()) {
      if (previous.contains(op.getKey())) {
        retained++;
        continue;
      }
      events.operationAdded(op.getKey());
      String key = CacheKeys.forSignature(op.getKey());
      try {
        cache.set(key, op.getValue());
        added.add(op.getKey());
      } catch (RuntimeException e) {
        events.cacheUpdateFailed(key, e);
      }
    }

    List<String> removed = new ArrayList<>();
    for (String signature : previous) {
      if (incoming.containsKey(signature)) {
        continue;
      }
      events.operationRemoved(signature);
      String key = CacheKeys.forSignature(signature);
      try {
        cache.delete(key);
        removed.add(signature);
      } catch (RuntimeException e) {
        events.cacheUpdateFailed(key, e);
      }
    }

    // the next manifest is diffed against this one, even when nothing changed
    knownSignatures = Set.copyOf(incoming.keySet());
    return new ReconciliationResult(List.copyOf(added), List.copyOf(removed), retained);
  }

  /** Signatures present after the last applied manifest. */
  public Set<String> knownSignatures() {
    return knownSignatures;
  }

  /** Returns signature to document, last entry winning for a repeated signature. */
  private static Map<String, String> validate(OperationManifest manifest) {
    if (manifest == null
        || manifest.version() != OperationManifest.SUPPORTED_VERSION
        || manifest.operations() == null) {
      throw new ManifestFormatException("Invalid manifest format.");
    }
    Map<String, String> incoming = new LinkedHashMap<>();
    for (ManifestEntry entry : manifest.operations()) {
      if (entry == null || entry.signature() == null || entry.document() == null) {
        throw new ManifestFormatException("Invalid manifest format.");
      }
      incoming.put(entry.signature(), entry.document());
    }
    return incoming;
  }
}
