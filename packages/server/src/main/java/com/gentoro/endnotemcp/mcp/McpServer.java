package com.gentoro.endnotemcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.endnotemcp.EndnoteMcp;
import com.gentoro.endnotemcp.exception.StateException;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Binds {@link PaperTools} to an MCP transport using the official MCP Java SDK.
 *
 * <p>Two transports are supported:
 *
 * <ul>
 *   <li>{@link #startStdio()}: JSON-RPC over stdin/stdout, the way desktop MCP clients launch the
 *       server. Stdout belongs to the protocol; logging goes to stderr.
 *   <li>{@link #registerHttp()}: Streamable HTTP servlet mounted on the shared Jetty context.
 * </ul>
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> (string) name reported to clients; default "EndNote Library
 *       Reader"
 *   <li><b>http.mcp.server.version</b> (string) version reported to clients; default "1.0.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(McpServer.class);

  private final EndnoteMcp app;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(EndnoteMcp app) {
    this.app = app;
  }

  /** Serve over stdin/stdout. Returns immediately; the transport reads on its own threads. */
  public void startStdio() {
    ensureNotStarted();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(
                new StdioServerTransportProvider(jsonMapper()))
            .serverInfo(serverName(), serverVersion())
            .capabilities(capabilities())
            .tools(new PaperTools(app.queryFacade()).specifications())
            .build();
    log.info("MCP server listening on stdio");
  }

  /** Register the MCP servlet on the shared Jetty context without managing Jetty's lifecycle. */
  public void registerHttp() {
    ensureNotStarted();
    String endpoint =
        normalizeEndpoint(app.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = app.configuration().getBoolean("http.mcp.disallow-delete", false);

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(jsonMapper())
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName(), serverVersion())
            .capabilities(capabilities())
            .tools(new PaperTools(app.queryFacade()).specifications())
            .build();

    app.httpServer().getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info(
        "MCP servlet registered at http://localhost:{}{}", app.httpServer().getPort(), endpoint);
  }

  private String serverName() {
    return app.configuration().getString("http.mcp.server.name", "EndNote Library Reader");
  }

  private String serverVersion() {
    return app.configuration().getString("http.mcp.server.version", "1.0.0");
  }

  private static McpSchema.ServerCapabilities capabilities() {
    return McpSchema.ServerCapabilities.builder().tools(true).logging().build();
  }

  private static JacksonMcpJsonMapper jsonMapper() {
    return new JacksonMcpJsonMapper(new ObjectMapper());
  }

  private void ensureNotStarted() {
    if (mcpServer != null) {
      throw new StateException("MCP server already started");
    }
  }

  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully();
      }
    } finally {
      mcpServer = null;
      if (servletTransport != null) {
        servletTransport.destroy();
        servletTransport = null;
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
