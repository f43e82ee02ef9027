package com.gentoro.opregistry.actuator;

import com.gentoro.opregistry.agent.AgentStatus;
import com.gentoro.opregistry.agent.OperationRegistryAgent;
import com.gentoro.opregistry.http.EmbeddedJettyServer;
import com.gentoro.opregistry.plugin.OperationRegistryPlugin;
import com.gentoro.opregistry.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Optional;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health and registry status endpoints in the style of Spring Boot's actuator.
 *
 * <p>{@code /actuator/health} always answers {@code {"status":"UP"}} once the listener is up.
 * {@code /actuator/registry} reports the agent's {@link AgentStatus}, or {@code 503} before the
 * host has started the plugin.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.opregistry.logging.LoggingService.getLogger(ActuatorService.class);

  private final EmbeddedJettyServer httpServer;
  private final OperationRegistryPlugin plugin;

  public ActuatorService(EmbeddedJettyServer httpServer, OperationRegistryPlugin plugin) {
    this.httpServer = httpServer;
    this.plugin = plugin;
  }

  /** Register the actuator servlets with the shared Jetty context handler. */
  public void register() {
    httpServer
        .getContextHandler()
        .addServlet(new ServletHolder(new HealthServlet()), "/actuator/health");
    httpServer
        .getContextHandler()
        .addServlet(new ServletHolder(new RegistryStatusServlet(plugin)), "/actuator/registry");
    log.info("Actuator endpoints registered at /actuator/health and /actuator/registry");
  }

  private static void writeJson(HttpServletResponse resp, int status, Object payload)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    try (PrintWriter out = resp.getWriter()) {
      out.println(JacksonUtility.toJson(payload));
    }
  }

  private static class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      writeJson(resp, 200, Map.of("status", "UP"));
    }
  }

  private static class RegistryStatusServlet extends HttpServlet {
    private final transient OperationRegistryPlugin plugin;

    RegistryStatusServlet(OperationRegistryPlugin plugin) {
      this.plugin = plugin;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      Optional<OperationRegistryAgent> agent = plugin.agent();
      if (agent.isEmpty()) {
        writeJson(resp, 503, Map.of("status", "NOT_STARTED"));
        return;
      }
      writeJson(resp, 200, agent.get().status());
    }
  }
}
