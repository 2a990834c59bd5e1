package com.gentoro.clicky;

import com.gentoro.clicky.async.DeliveryQueue;
import com.gentoro.clicky.async.ForegroundPump;
import com.gentoro.clicky.async.TaskDispatcher;
import com.gentoro.clicky.async.WorkerThreadFactory;
import com.gentoro.clicky.exception.StateException;
import com.gentoro.clicky.logging.LoggingService;
import com.gentoro.clicky.loop.FrameLoop;
import com.gentoro.clicky.loop.FrameRenderer;
import com.gentoro.clicky.query.QueryExecutor;
import com.gentoro.clicky.status.StatusBoard;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root. Owns the configuration and the async core and hands them to the components
 * that need them; nothing here is reachable through static state.
 */
public class Clicky {

  private static final org.slf4j.Logger log = LoggingService.getLogger(Clicky.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private DeliveryQueue deliveryQueue;
  private TaskDispatcher dispatcher;
  private QueryExecutor queryExecutor;
  private ForegroundPump pump;
  private StatusBoard statusBoard;
  private volatile FrameLoop frameLoop;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public Clicky(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Build the core. The calling thread becomes the foreground thread. */
  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    Configuration config = configuration();
    this.deliveryQueue = new DeliveryQueue();
    this.dispatcher =
        new TaskDispatcher(
            deliveryQueue,
            new WorkerThreadFactory(
                config.getString("async.worker.threadNamePrefix", "clicky-worker")));
    this.queryExecutor =
        new QueryExecutor(
            deliveryQueue,
            new WorkerThreadFactory(config.getString("async.query.threadName", "clicky-query")));
    this.pump = new ForegroundPump(deliveryQueue);
    this.statusBoard = new StatusBoard();
    log.info(
        "{} initialized on foreground thread {}",
        config.getString("app.name", "Clicky"),
        pump.foregroundThread().getName());
  }

  /** Run the frame loop on the calling thread until the renderer closes or shutdown. */
  public void run(FrameRenderer renderer) {
    FrameLoop loop =
        new FrameLoop(
            pump(),
            renderer,
            Duration.ofMillis(configuration().getLong("loop.frameIntervalMillis", 16L)));
    this.frameLoop = loop;
    if (shuttingDown.get()) {
      return;
    }
    loop.run();
  }

  /** Release resources. Safe to call multiple times and from any thread; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down");
    FrameLoop loop = frameLoop;
    if (loop != null) {
      loop.stop();
    }
    if (queryExecutor != null && queryExecutor.cancelCurrent()) {
      log.info("Cancelled running query during shutdown");
    }
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Clicky not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public DeliveryQueue deliveryQueue() {
    return initialized(deliveryQueue);
  }

  public TaskDispatcher dispatcher() {
    return initialized(dispatcher);
  }

  public QueryExecutor queryExecutor() {
    return initialized(queryExecutor);
  }

  public ForegroundPump pump() {
    return initialized(pump);
  }

  public StatusBoard statusBoard() {
    return initialized(statusBoard);
  }

  private static <T> T initialized(T component) {
    if (component == null) {
      throw new StateException("Clicky not initialized. Call initialize() first.");
    }
    return component;
  }
}
