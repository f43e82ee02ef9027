package com.gentoro.opregistry.plugin;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.opregistry.agent.AgentConfig;
import com.gentoro.opregistry.cache.InMemoryKeyValueCache;
import com.gentoro.opregistry.exception.ConfigException;
import com.gentoro.opregistry.exception.StateException;
import com.gentoro.opregistry.http.ManifestHttpClient;
import com.gentoro.opregistry.support.RecordingEventSink;
import com.gentoro.opregistry.support.ScriptedManifestClient;
import java.time.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperationRegistryPluginTest {

  private static final String MANIFEST =
      "{\"version\":1,\"operations\":[{\"signature\":\"a\",\"document\":\"docA\"}]}";

  private ScriptedManifestClient client;
  private InMemoryKeyValueCache cache;
  private OperationRegistryPlugin plugin;

  @BeforeEach
  void setUp() {
    client = new ScriptedManifestClient();
    cache = new InMemoryKeyValueCache();
    plugin =
        new OperationRegistryPlugin(
            AgentConfig.builder().manifestBaseUrl("http://manifests.test"),
            client,
            cache,
            new RecordingEventSink(),
            Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    plugin.serverWillStop();
  }

  @Test
  void missingServiceIdFailsBeforeAnyRequest() {
    ManifestHttpClient network = mock(ManifestHttpClient.class);
    OperationRegistryPlugin withMock =
        new OperationRegistryPlugin(
            AgentConfig.builder(), network, cache, new RecordingEventSink(), Clock.systemUTC());

    ConfigException ex =
        assertThrows(ConfigException.class, () -> withMock.serverWillStart("schema1", null));

    assertTrue(ex.getMessage().contains("The Engine API key must be set"));
    verifyNoInteractions(network);
    assertTrue(withMock.agent().isEmpty());
  }

  @Test
  void startRegistersOperationsFromManifest() {
    client.respond(ScriptedManifestClient.json(MANIFEST, "e1"));

    plugin.serverWillStart("schema1", "svc");

    assertTrue(plugin.isAllowed("a"));
    assertEquals("docA", plugin.lookup("a").orElseThrow());
    assertFalse(plugin.isAllowed("b"));
    assertFalse(plugin.isAllowed(null));
    assertEquals("schema1", plugin.agent().orElseThrow().config().schemaHash());
  }

  @Test
  void secondStartIsRejected() {
    client.respond(ScriptedManifestClient.notModified());
    plugin.serverWillStart("schema1", "svc");

    assertThrows(StateException.class, () -> plugin.serverWillStart("schema1", "svc"));
  }

  @Test
  void stopReleasesAgentAndIsRepeatable() {
    client.respond(ScriptedManifestClient.notModified());
    plugin.serverWillStart("schema1", "svc");

    plugin.serverWillStop();
    plugin.serverWillStop();

    assertTrue(plugin.agent().isEmpty());
  }

  @Test
  void failedStartLeavesSettingsUntouched() {
    AgentConfig.Builder settings = AgentConfig.builder().manifestBaseUrl("http://manifests.test");
    OperationRegistryPlugin shared =
        new OperationRegistryPlugin(
            settings, client, cache, new RecordingEventSink(), Clock.systemUTC());

    assertThrows(ConfigException.class, () -> shared.serverWillStart(null, "svc"));

    ConfigException ex =
        assertThrows(ConfigException.class, () -> settings.schemaHash("schema1").build());
    assertTrue(ex.getMessage().contains("serviceId"));
    assertTrue(shared.agent().isEmpty());
    assertEquals(0, client.calls());
  }
}
