package com.gentoro.endnotemcp;

public class EndnoteMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.endnotemcp.logging.LoggingService.getLogger(EndnoteMcpApp.class);

  public static void main(String[] args) {
    EndnoteMcp app;
    try {
      app = new EndnoteMcp(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.err.println(StartupParameters.usage());
      System.exit(1);
      return;
    }
    if (!app.isHelpMode()) {
      app.waitShutdownSignal();
    }
  }
}
