package com.gentoro.endnotemcp.http;

import com.gentoro.endnotemcp.EndnoteMcp;
import com.gentoro.endnotemcp.exception.ConfigException;
import com.gentoro.endnotemcp.exception.ExceptionUtil;
import com.gentoro.endnotemcp.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}, used in {@code server} mode.
 * Other components register their servlets on {@link #getContextHandler()} between {@link
 * #prepare()} and {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String ANY_HOST = "0.0.0.0";

  private final EndnoteMcp app;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(EndnoteMcp app) {
    this.app = app;
  }

  /** Create the Jetty server and root context without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      String hostname;
      try {
        port = app.configuration().getInt("http.port", 8080);
        hostname = app.configuration().getString("http.hostname", ANY_HOST);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port/http.hostname configuration", e);
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();

      try {
        if (!hostname.equals(ANY_HOST)) {
          server = new Server();
          ServerConnector connector = new ServerConnector(server);
          connector.setHost(hostname);
          connector.setPort(port);
          server.addConnector(connector);
        } else {
          server = new Server(port);
        }

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        server = null;
        throw new NetworkException(
            "Could not initialize the HTTP server on %s:%d".formatted(hostname, port), e);
      }
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Could not start the HTTP server; check that the configured port is free", ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // logged only, so the remaining shutdown steps still run
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return app.configuration().getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
