package com.gentoro.endnotemcp;

import com.gentoro.endnotemcp.actuator.ActuatorService;
import com.gentoro.endnotemcp.config.StoreConfig;
import com.gentoro.endnotemcp.document.DocumentResolver;
import com.gentoro.endnotemcp.document.TextExtractor;
import com.gentoro.endnotemcp.exception.ExecutionException;
import com.gentoro.endnotemcp.exception.StateException;
import com.gentoro.endnotemcp.facade.QueryFacade;
import com.gentoro.endnotemcp.http.EmbeddedJettyServer;
import com.gentoro.endnotemcp.logging.LoggingService;
import com.gentoro.endnotemcp.mcp.McpServer;
import com.gentoro.endnotemcp.mcp.PaperTools;
import com.gentoro.endnotemcp.snapshot.SnapshotManager;
import com.gentoro.endnotemcp.store.ReferenceRepository;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root: reads startup parameters and YAML configuration, builds the store components
 * once and hands them to the selected MCP transport.
 */
public class EndnoteMcp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(EndnoteMcp.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private StoreConfig storeConfig;
  private SnapshotManager snapshotManager;
  private QueryFacade queryFacade;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public EndnoteMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public String mode() {
    return startupParameters
        .getOptionalParameter(StartupParameters.MODE, String.class)
        .orElseGet(
            () ->
                configurationProvider == null
                    ? "stdio"
                    : configuration().getString("mcp.mode", "stdio"));
  }

  public boolean isHelpMode() {
    return "help".equals(mode());
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if (isHelpMode()) {
      System.err.println(StartupParameters.usage());
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    this.storeConfig = StoreConfig.from(startupParameters, configuration());
    if (storeConfig.verboseLogging()) {
      LoggingService.enableVerbose();
    }

    this.snapshotManager = new SnapshotManager(storeConfig);
    snapshotManager.ensureFresh();

    this.queryFacade =
        new QueryFacade(
            new ReferenceRepository(storeConfig),
            new DocumentResolver(storeConfig),
            new TextExtractor(),
            snapshotManager);

    logStartup();

    String mode = mode();
    try {
      switch (mode) {
        case "stdio" -> {
          this.mcpServer = new McpServer(this);
          mcpServer.startStdio();
        }
        case "server" -> {
          this.httpServer = new EmbeddedJettyServer(this);
          httpServer.prepare();
          new ActuatorService(this).register();
          this.mcpServer = new McpServer(this);
          mcpServer.registerHttp();
          httpServer.start();
        }
        default -> throw new IllegalArgumentException("Invalid mode: " + mode);
      }
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start MCP transport in mode " + mode, e);
    }
    log.info("Server is ready and waiting for client connections...");
  }

  private void logStartup() {
    log.info("EndNote MCP Server is starting...");
    log.info("ENL file: {}", storeConfig.enlFile());
    log.info("Active store: {}", storeConfig.activeStorePath());
    log.info("Data folder: {}", storeConfig.dataFolder());
    log.info("Snapshot mode: {}", storeConfig.snapshotMode());
    log.info("Verbose logging: {}", storeConfig.verboseLogging());
    log.info("Registered tools:");
    PaperTools.SIGNATURES.forEach(signature -> log.info("- {}", signature));
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM
   * termination), then release resources via {@link #shutdown()}.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "endnote-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (mcpServer != null) mcpServer.close();
      } catch (Exception e) {
        log.warn("Error closing MCP server", e);
      } finally {
        if (httpServer != null) httpServer.close();
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("EndnoteMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public StoreConfig storeConfig() {
    if (storeConfig == null) {
      throw new StateException("EndnoteMcp not initialized. Call initialize() first.");
    }
    return storeConfig;
  }

  public SnapshotManager snapshotManager() {
    return snapshotManager;
  }

  public QueryFacade queryFacade() {
    return queryFacade;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
