package com.gentoro.opregistry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.opregistry.exception.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:test-registry.yaml").config();

    assertEquals("acme-graph", cfg.getString("registry.serviceId"));
    assertEquals(0, cfg.getInt("http.port"));
  }

  @Test
  void loadsFileFromPathAndUri(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("registry.yaml");
    Files.writeString(file, "registry:\n  serviceId: from-file\n  pollSeconds: 12\n");

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals("from-file", byPath.getString("registry.serviceId"));
    assertEquals(12, byUri.getInt("registry.pollSeconds"));
  }

  @Test
  void missingLocationsFail(@TempDir Path dir) {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider("classpath:does-not-exist.yaml"));
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("missing.yaml").toString()));
  }

  @Test
  void unresolvedEnvironmentPlaceholderIsKeptVerbatim() {
    Configuration cfg = new ConfigurationProvider("classpath:unresolved-registry.yaml").config();

    assertEquals(
        "${env:OPERATION_REGISTRY_TEST_UNSET_VARIABLE}", cfg.getString("registry.serviceId"));
  }
}
