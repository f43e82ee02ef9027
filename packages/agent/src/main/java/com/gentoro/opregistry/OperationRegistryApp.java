package com.gentoro.opregistry;

public class OperationRegistryApp {

  private static final org.slf4j.Logger log =
      com.gentoro.opregistry.logging.LoggingService.getLogger(OperationRegistryApp.class);

  private static final String USAGE =
      """
      Usage: operation-registry [--config-file <location>] [--mode server|once|help]
                                [--service-id <id>] [--schema-hash <hash>]
      """;

  public static void main(String[] args) {
    OperationRegistry app;
    try {
      app = new OperationRegistry(args);
      if ("help".equals(app.startupParameters().mode())) {
        System.out.print(USAGE);
        return;
      }
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
      return;
    }
    app.waitShutdownSignal();
  }
}
