package com.gentoro.clicky.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clicky.exception.ClickyErrorCode;
import com.gentoro.clicky.exception.ErrorDetails;
import com.gentoro.clicky.exception.StateException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskRecordTest {

  @Test
  void followsLifecycle() {
    TaskRecord<String> r = new TaskRecord<>(1);
    assertEquals(TaskStatus.PENDING, r.status());
    assertFalse(r.isTerminal());

    r.markRunning();
    assertEquals(TaskStatus.RUNNING, r.status());

    assertTrue(r.completeUnlessCancelled("rows", Duration.ofMillis(5)));
    assertEquals(TaskStatus.COMPLETED, r.status());
    assertTrue(r.isTerminal());
    assertEquals("rows", r.result().orElseThrow());
    assertEquals(Duration.ofMillis(5), r.elapsed());
  }

  @Test
  @DisplayName("A cancel accepted after the work returned turns completion into cancellation")
  void cancelAfterReturnWins() {
    TaskRecord<String> r = new TaskRecord<>(2);
    r.markRunning();

    assertTrue(r.requestCancel());
    assertFalse(r.completeUnlessCancelled("rows", Duration.ofMillis(3)));

    assertEquals(TaskStatus.CANCELLED, r.status());
    assertTrue(r.result().isEmpty());
    assertEquals(Duration.ofMillis(3), r.elapsed());
  }

  @Test
  @DisplayName("A finished task refuses the cancellation signal")
  void cancelAfterTerminalRefused() {
    TaskRecord<String> r = new TaskRecord<>(3);
    r.markRunning();
    r.completeUnlessCancelled("rows", Duration.ZERO);

    assertFalse(r.requestCancel());
    assertFalse(r.isCancelRequested());
    assertEquals(TaskStatus.COMPLETED, r.status());
  }

  @Test
  void terminalStatesAreFinal() {
    TaskRecord<String> r = new TaskRecord<>(4);
    r.markRunning();
    ErrorDetails details =
        new ErrorDetails(
            "IllegalStateException", "boom", ClickyErrorCode.TASK_ERROR, null, Instant.now());
    r.markFailed("IllegalStateException: boom", details, Duration.ZERO);

    assertThrows(StateException.class, () -> r.completeUnlessCancelled("late", Duration.ZERO));
    assertThrows(StateException.class, () -> r.markCancelled(Duration.ZERO));
    assertEquals(TaskStatus.FAILED, r.status());
    assertEquals("IllegalStateException: boom", r.error().orElseThrow());
    assertSame(details, r.errorDetails().orElseThrow());
  }

  @Test
  void cannotSkipRunning() {
    TaskRecord<String> r = new TaskRecord<>(5);
    assertThrows(StateException.class, () -> r.completeUnlessCancelled("x", Duration.ZERO));
    assertEquals(TaskStatus.PENDING, r.status());
  }

  @Test
  void cancelSignal() {
    TaskRecord<String> r = new TaskRecord<>(6);
    assertFalse(r.isCancelRequested());
    assertTrue(r.requestCancel());
    assertTrue(r.isCancelRequested());
  }
}
