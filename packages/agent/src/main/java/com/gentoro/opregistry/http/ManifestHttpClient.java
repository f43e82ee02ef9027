package com.gentoro.opregistry.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/** Transport used by the agent to GET the operation manifest. */
public interface ManifestHttpClient {

  /**
   * Issue a GET request.
   *
   * @param url absolute manifest URL
   * @param headers extra request headers (for instance {@code If-None-Match})
   * @param timeout upper bound for the whole call
   * @throws IOException on transport failure or timeout
   */
  ManifestHttpResponse get(String url, Map<String, String> headers, Duration timeout)
      throws IOException;
}
