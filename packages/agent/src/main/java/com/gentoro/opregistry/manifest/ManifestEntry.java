package com.gentoro.opregistry.manifest;

/**
 * One allowed operation.
 *
 * @param signature stable identifier of the operation; dedup key within a manifest
 * @param document GraphQL document registered under that signature
 */
public record ManifestEntry(String signature, String document) {}
