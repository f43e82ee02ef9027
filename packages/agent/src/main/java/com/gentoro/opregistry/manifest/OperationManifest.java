package com.gentoro.opregistry.manifest;

import java.util.List;

/**
 * Versioned list of allowed operations published by the control plane. Only {@link
 * #SUPPORTED_VERSION} is understood; shape validation happens when the manifest is applied.
 */
public record OperationManifest(int version, List<ManifestEntry> operations) {
  public static final int SUPPORTED_VERSION = 1;
}
