package com.gentoro.clicky;

import com.gentoro.clicky.loop.HeadlessRenderer;

public class ClickyApp {

  private static final org.slf4j.Logger log =
      com.gentoro.clicky.logging.LoggingService.getLogger(ClickyApp.class);

  public static void main(String[] args) {
    try {
      Clicky app = new Clicky(args);
      app.initialize();
      Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "clicky-shutdown-hook"));
      app.run(new HeadlessRenderer());
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
