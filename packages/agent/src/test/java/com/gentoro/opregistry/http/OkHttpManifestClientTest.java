package com.gentoro.opregistry.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.opregistry.agent.AgentConfig;
import com.gentoro.opregistry.agent.ManifestLocation;
import com.gentoro.opregistry.agent.OperationRegistryAgent;
import com.gentoro.opregistry.cache.InMemoryKeyValueCache;
import com.gentoro.opregistry.support.RecordingEventSink;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the OkHttp client and the agent against an in-process manifest server. */
class OkHttpManifestClientTest {

  private static final String MANIFEST =
      "{\"version\":1,\"operations\":[{\"signature\":\"a\",\"document\":\"docA\"}]}";
  private static final String ETAG = "\"manifest-v1\"";

  private HttpServer server;
  private String baseUrl;
  private final List<String> ifNoneMatch = new CopyOnWriteArrayList<>();
  private final List<String> userAgents = new CopyOnWriteArrayList<>();
  private final OkHttpManifestClient client = new OkHttpManifestClient();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/manifests/", this::serveManifest);
    server.createContext(
        "/broken",
        exchange -> send(exchange, 500, "text/plain", null, "storage unavailable"));
    server.createContext(
        "/moved",
        exchange -> {
          exchange.getResponseHeaders().add("Location", "/manifests/x/y");
          exchange.sendResponseHeaders(302, -1);
          exchange.close();
        });
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(2_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          send(exchange, 200, "application/json", null, MANIFEST);
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void serveManifest(HttpExchange exchange) throws IOException {
    userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
    String validator = exchange.getRequestHeaders().getFirst("If-None-Match");
    ifNoneMatch.add(validator == null ? "" : validator);
    if (ETAG.equals(validator)) {
      exchange.sendResponseHeaders(304, -1);
      exchange.close();
      return;
    }
    send(exchange, 200, "application/json", ETAG, MANIFEST);
  }

  private static void send(
      HttpExchange exchange, int status, String contentType, String etag, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", contentType);
    if (etag != null) {
      exchange.getResponseHeaders().add("ETag", etag);
    }
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @Test
  void returnsStatusHeadersAndBody() throws IOException {
    ManifestHttpResponse response =
        client.get(baseUrl + "/manifests/x/y", Map.of(), Duration.ofSeconds(5));

    assertEquals(200, response.status());
    assertEquals("application/json", response.contentType());
    assertEquals(ETAG, response.etag());
    assertEquals(MANIFEST, response.body());
    assertEquals(List.of(OkHttpFactory.USER_AGENT), userAgents);
  }

  @Test
  void redirectsAreNotFollowed() throws IOException {
    ManifestHttpResponse response = client.get(baseUrl + "/moved", Map.of(), Duration.ofSeconds(5));

    assertEquals(302, response.status());
    assertFalse(response.isSuccessful());
    assertTrue(userAgents.isEmpty());
  }

  @Test
  void forwardsConditionalHeader() throws IOException {
    ManifestHttpResponse response =
        client.get(baseUrl + "/manifests/x/y", Map.of("If-None-Match", ETAG), Duration.ofSeconds(5));

    assertTrue(response.isNotModified());
    assertEquals(List.of(ETAG), ifNoneMatch);
  }

  @Test
  void errorStatusIsReturnedNotThrown() throws IOException {
    ManifestHttpResponse response = client.get(baseUrl + "/broken", Map.of(), Duration.ofSeconds(5));

    assertFalse(response.isSuccessful());
    assertEquals("storage unavailable", response.body());
  }

  @Test
  void callTimeoutBoundsSlowResponses() {
    assertThrows(
        IOException.class, () -> client.get(baseUrl + "/slow", Map.of(), Duration.ofMillis(200)));
  }

  @Test
  void agentFetchesThenRevalidatesWithETag() throws Exception {
    AgentConfig config =
        AgentConfig.builder()
            .serviceId("svc")
            .schemaHash("schema1")
            .manifestBaseUrl(baseUrl + "/manifests")
            .build();
    InMemoryKeyValueCache cache = new InMemoryKeyValueCache();

    try (OperationRegistryAgent agent =
        new OperationRegistryAgent(
            config, client, cache, new RecordingEventSink(), Clock.systemUTC())) {
      assertTrue(agent.checkForUpdate().get(5, TimeUnit.SECONDS));
      assertFalse(agent.checkForUpdate().get(5, TimeUnit.SECONDS));

      assertEquals(Map.of("apq:a", "docA"), cache.snapshot());
      assertEquals(List.of("", ETAG), ifNoneMatch);
      assertEquals(
          baseUrl + "/manifests/" + ManifestLocation.hashServiceId("svc") + "/schema1",
          agent.status().manifestUrl());
    }
  }
}
