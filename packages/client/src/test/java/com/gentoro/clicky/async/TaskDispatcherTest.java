package com.gentoro.clicky.async;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clicky.exception.ClickyErrorCode;
import com.gentoro.clicky.exception.ClickyException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskDispatcherTest {

  DeliveryQueue queue;
  ForegroundPump pump;
  TaskDispatcher dispatcher;

  @BeforeEach
  void setup() {
    queue = new DeliveryQueue();
    pump = new ForegroundPump(queue);
    dispatcher = new TaskDispatcher(queue);
  }

  @Test
  @DisplayName("Result is handed to the success continuation after one pump")
  void deliversResult() throws Exception {
    AtomicReference<Integer> captured = new AtomicReference<>();
    AtomicInteger errors = new AtomicInteger();

    Thread t = dispatcher.submit(() -> 42, captured::set, e -> errors.incrementAndGet());
    t.join(2000);
    pump.pump();

    assertEquals(42, captured.get());
    assertEquals(0, errors.get());
    assertFalse(dispatcher.isBusy());
    assertEquals(0, dispatcher.inFlightCount());
  }

  @Test
  @DisplayName("Failure is handed to the error continuation only")
  void deliversFailure() throws Exception {
    AtomicInteger successes = new AtomicInteger();
    AtomicReference<Throwable> captured = new AtomicReference<>();

    Thread t =
        dispatcher.submit(
            () -> {
              throw new IllegalArgumentException("x");
            },
            r -> successes.incrementAndGet(),
            captured::set);
    t.join(2000);
    pump.pump();

    assertNotNull(captured.get());
    assertTrue(captured.get().getMessage().contains("x"));
    assertEquals(0, successes.get());
    assertFalse(dispatcher.isBusy());
  }

  @Test
  @DisplayName("Dispatcher is busy from submission until the work finishes")
  void busyWhileRunning() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    AtomicReference<String> captured = new AtomicReference<>();
    assertFalse(dispatcher.isBusy());

    Thread t =
        dispatcher.submit(
            () -> {
              release.await(5, TimeUnit.SECONDS);
              return "done";
            },
            captured::set,
            e -> fail("unexpected failure " + e));
    assertTrue(dispatcher.isBusy());
    assertEquals(1, dispatcher.inFlightCount());
    assertEquals(0, pump.pump());

    release.countDown();
    t.join(2000);
    // idle once the continuation is enqueued, before it is pumped
    assertFalse(dispatcher.isBusy());
    assertEquals(1, queue.size());
    assertNull(captured.get());
    assertEquals(1, pump.pump());
    assertEquals("done", captured.get());
  }

  @Test
  @DisplayName("100 concurrent tasks all deliver, on the pumping thread only")
  void manyConcurrentTasks() throws Exception {
    int n = 100;
    CountDownLatch start = new CountDownLatch(1);
    Set<Integer> results = ConcurrentHashMap.newKeySet();
    Set<Thread> continuationThreads = ConcurrentHashMap.newKeySet();
    List<Thread> workers = new ArrayList<>();

    for (int i = 0; i < n; i++) {
      int id = i;
      workers.add(
          dispatcher.submit(
              () -> {
                start.await(5, TimeUnit.SECONDS);
                return id;
              },
              r -> {
                continuationThreads.add(Thread.currentThread());
                results.add(r);
              },
              e -> fail("unexpected failure " + e)));
    }
    assertEquals(n, dispatcher.inFlightCount());
    start.countDown();
    for (Thread w : workers) w.join(5000);

    assertEquals(n, pump.pump());
    assertEquals(n, results.size());
    assertEquals(Set.of(Thread.currentThread()), continuationThreads);
    assertFalse(dispatcher.isBusy());
  }

  @Test
  @DisplayName("Worker threads are daemons")
  void daemonThreads() throws Exception {
    Thread t = dispatcher.submit(() -> "x", r -> {});
    assertTrue(t.isDaemon());
    assertTrue(t.getName().startsWith("clicky-worker-"));
    t.join(2000);
    pump.pump();
  }

  @Test
  @DisplayName("A thread that cannot be started still reports through the error continuation")
  void threadCreationFailure() {
    TaskDispatcher broken =
        new TaskDispatcher(
            queue,
            r -> {
              throw new IllegalStateException("no threads left");
            });
    AtomicReference<Throwable> captured = new AtomicReference<>();

    assertNull(broken.submit(() -> 1, r -> fail("should not succeed"), captured::set));
    assertFalse(broken.isBusy());
    assertEquals(1, pump.pump());
    ClickyException failure = assertInstanceOf(ClickyException.class, captured.get());
    assertEquals(ClickyErrorCode.TASK_ERROR, failure.getCode());
    assertEquals("no threads left", failure.getCause().getMessage());
    assertTrue(failure.getMessage().contains("no threads left"));
  }
}
