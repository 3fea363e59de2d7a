package com.gentoro.endnotemcp.actuator;

import com.gentoro.endnotemcp.EndnoteMcp;
import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint at {@code /actuator/health}, in the style of Spring Boot's actuator.
 *
 * <p>Response body: {@code {"status":"UP","store":"...","storeAvailable":true,
 * "snapshotMode":false}}. {@code storeAvailable} only says whether the active store file exists.
 * The server stays UP either way; tools report store failures in their own responses.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final EndnoteMcp app;

  public ActuatorService(EndnoteMcp app) {
    this.app = app;
  }

  public void register() {
    app.httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet()), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  Map<String, Object> health() {
    StoreConfig store = app.storeConfig();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "UP");
    payload.put("store", store.activeStorePath().toString());
    payload.put("storeAvailable", Files.isRegularFile(store.activeStorePath()));
    payload.put("snapshotMode", store.snapshotMode());
    return payload;
  }

  private class ActuatorServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(health()));
      }
    }
  }
}
