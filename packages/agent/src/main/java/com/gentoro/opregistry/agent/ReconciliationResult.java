package com.gentoro.opregistry.agent;

import java.util.List;

/**
 * Outcome of applying one manifest to the cache.
 *
 * @param added signatures written to the cache
 * @param removed signatures deleted from the cache
 * @param retained number of signatures present before and after, left untouched
 */
public record ReconciliationResult(List<String> added, List<String> removed, int retained) {
  public boolean hasChanges() {
    return !added.isEmpty() || !removed.isEmpty();
  }
}
