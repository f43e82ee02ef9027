package com.gentoro.opregistry;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToServerModeAndClasspathConfig() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesNamedArguments() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "once", "--config-file", "/etc/registry.yaml", "--service-id", "svc"});

    assertEquals("once", params.mode());
    assertEquals("/etc/registry.yaml", params.configFile());
    assertEquals("svc", params.getParameter("service-id", String.class));
    assertTrue(params.getOptionalParameter("schema-hash", String.class).isEmpty());
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "interactive"}));
  }

  @Test
  void flagWithoutValueIsRejectedForConfigFile() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--mode", "once"}));
  }
}
