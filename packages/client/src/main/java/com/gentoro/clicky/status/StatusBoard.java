package com.gentoro.clicky.status;

import com.gentoro.clicky.exception.ExceptionUtil;
import com.gentoro.clicky.logging.LoggingService;
import com.gentoro.clicky.query.QueryExecutor;
import com.gentoro.clicky.query.TaskRecord;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Holds the status line of the application and notifies presentation listeners when it
 * changes. One instance is owned by the application root and passed to the components that
 * report status. Intended for use from the foreground thread, i.e. inside continuations.
 */
public final class StatusBoard {
  private static final Logger log = LoggingService.getLogger(StatusBoard.class);

  private final List<Consumer<StatusMessage>> listeners = new CopyOnWriteArrayList<>();
  private volatile StatusMessage current;

  public void show(String text, boolean error) {
    StatusMessage message = new StatusMessage(text == null ? "" : text, error, Instant.now());
    current = message;
    if (error) {
      log.info("Status (error): {}", message.text());
    } else {
      log.debug("Status: {}", message.text());
    }
    for (Consumer<StatusMessage> listener : listeners) {
      try {
        listener.accept(message);
      } catch (RuntimeException e) {
        log.error("Status listener failed: {}", ExceptionUtil.extractErrorMessage(e));
      }
    }
  }

  public void showInfo(String text) {
    show(text, false);
  }

  public void showError(String text) {
    show(text, true);
  }

  public Optional<StatusMessage> current() {
    return Optional.ofNullable(current);
  }

  public void addListener(Consumer<StatusMessage> listener) {
    listeners.add(listener);
  }

  public void removeListener(Consumer<StatusMessage> listener) {
    listeners.remove(listener);
  }

  /** Failure continuation for {@code TaskDispatcher.submit} that reports on this board. */
  public Consumer<Throwable> errorReporter(String prefix) {
    return e -> showError(prefix + ": " + ExceptionUtil.extractErrorMessage(e));
  }

  /** Report the terminal state of a query task. Non-terminal records are ignored. */
  public void showTaskOutcome(TaskRecord<?> record) {
    switch (record.status()) {
      case COMPLETED -> showInfo(
          String.format(
              Locale.ROOT, "Query completed in %.2fs", QueryExecutor.seconds(record.elapsed())));
      case FAILED -> showError("Query failed: " + record.error().orElse("Unknown error"));
      case CANCELLED -> showInfo("Query cancelled");
      default -> log.debug("Ignoring non-terminal task {}", record);
    }
  }
}
