package com.gentoro.opregistry.agent;

import com.gentoro.opregistry.events.RegistryEventSink;
import com.gentoro.opregistry.exception.FetchException;
import com.gentoro.opregistry.http.ManifestHttpClient;
import com.gentoro.opregistry.http.ManifestHttpResponse;
import com.gentoro.opregistry.manifest.ManifestParser;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Conditional GET of the operation manifest.
 *
 * <p>The last ETag is replayed as {@code If-None-Match} so an unchanged manifest costs a {@code 304}
 * instead of a full download. The token is opaque and stored exactly as received.
 */
public class ManifestFetcher {
  static final String EXPECTED_CONTENT_TYPE = "application/json";

  private final AgentConfig config;
  private final ManifestHttpClient client;
  private final ManifestReconciler reconciler;
  private final ManifestParser parser;
  private final RegistryEventSink events;
  private final AtomicInteger timesChecked = new AtomicInteger();

  private volatile String manifestUrl;
  private volatile String lastSuccessfulETag;

  public ManifestFetcher(
      AgentConfig config,
      ManifestHttpClient client,
      ManifestReconciler reconciler,
      ManifestParser parser,
      RegistryEventSink events) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.events = Objects.requireNonNull(events, "events");
  }

  /**
   * Fetch the manifest and apply it.
   *
   * @return true when a new manifest was applied, false when the server reported it unchanged
   * @throws FetchException when the manifest could not be retrieved
   * @throws com.gentoro.opregistry.exception.ManifestFormatException when the payload is malformed
   */
  public boolean tryUpdate() {
    String url = manifestUrl();
    events.checkStarted(url);
    timesChecked.incrementAndGet();

    String etag = lastSuccessfulETag;
    Map<String, String> headers = etag == null ? Map.of() : Map.of("If-None-Match", etag);

    ManifestHttpResponse response;
    try {
      response = client.get(url, headers, config.fetchTimeout());
    } catch (IOException e) {
      throw new FetchException(
          "Unable to fetch operation manifest for "
              + config.schemaHash()
              + " in '"
              + config.serviceId()
              + "': "
              + e.getMessage(),
          Map.of("url", url),
          e);
    }

    if (response.isNotModified()) {
      events.manifestUnchanged();
      return false;
    }

    if (!response.isSuccessful()) {
      throw new FetchException(
          "Could not fetch manifest " + response.body(),
          Map.of("url", url, "status", response.status()));
    }

    String contentType = response.contentType();
    if (contentType != null && !EXPECTED_CONTENT_TYPE.equals(contentType)) {
      throw new FetchException(
          "Unexpected 'Content-Type' header: " + contentType,
          Map.of("url", url, "status", response.status(), "contentType", contentType));
    }

    reconciler.updateManifest(parser.parse(response.body()));

    if (response.etag() != null && !response.etag().isEmpty()) {
      lastSuccessfulETag = response.etag();
    }
    return true;
  }

  /** Manifest URL for the configured service and schema; the service id is hashed once. */
  public String manifestUrl() {
    String url = manifestUrl;
    if (url == null) {
      url =
          ManifestLocation.manifestUrl(
              config.manifestBaseUrl(),
              ManifestLocation.hashServiceId(config.serviceId()),
              config.schemaHash());
      manifestUrl = url;
    }
    return url;
  }

  public String lastSuccessfulETag() {
    return lastSuccessfulETag;
  }

  public int timesChecked() {
    return timesChecked.get();
  }
}
