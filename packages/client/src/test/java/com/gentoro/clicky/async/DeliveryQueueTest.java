package com.gentoro.clicky.async;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeliveryQueueTest {

  @Test
  @DisplayName("Draining an empty queue is a no-op")
  void emptyDrain() {
    DeliveryQueue queue = new DeliveryQueue();
    assertEquals(0, queue.drainAndRun());
    assertTrue(queue.isEmpty());
  }

  @Test
  @DisplayName("Continuations run in push order")
  void fifoOrder() {
    DeliveryQueue queue = new DeliveryQueue();
    List<Integer> seen = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      int n = i;
      queue.push(() -> seen.add(n));
    }
    assertEquals(5, queue.size());

    assertEquals(5, queue.drainAndRun());
    assertEquals(List.of(0, 1, 2, 3, 4), seen);
    assertTrue(queue.isEmpty());
  }

  @Test
  @DisplayName("Continuations pushed during a drain run in the same drain")
  void nestedPushes() {
    DeliveryQueue queue = new DeliveryQueue();
    List<String> seen = new ArrayList<>();
    queue.push(
        () -> {
          seen.add("outer");
          queue.push(
              () -> {
                seen.add("inner");
                queue.push(() -> seen.add("innermost"));
              });
        });
    queue.push(() -> seen.add("second"));

    assertEquals(4, queue.drainAndRun());
    assertEquals(List.of("outer", "second", "inner", "innermost"), seen);
    assertTrue(queue.isEmpty());
  }

  @Test
  @DisplayName("A failing continuation does not block the ones after it")
  void failureIsolated() {
    DeliveryQueue queue = new DeliveryQueue();
    List<String> seen = new ArrayList<>();
    queue.push(() -> seen.add("a"));
    queue.push(
        () -> {
          throw new IllegalStateException("broken continuation");
        });
    queue.push(() -> seen.add("c"));

    assertEquals(3, queue.drainAndRun());
    assertEquals(List.of("a", "c"), seen);
    assertEquals(1, queue.failureCount());
  }

  @Test
  void rejectsNull() {
    DeliveryQueue queue = new DeliveryQueue();
    assertThrows(NullPointerException.class, () -> queue.push(null));
  }
}
