package playlog.buffer;

import org.junit.jupiter.api.Test;
import playlog.PlayEvent;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBufferTest {

  @Test
  void rejectsInvalidLimits() {
    assertThrows(IllegalArgumentException.class, () -> new EventBuffer(0, 10));
    assertThrows(IllegalArgumentException.class, () -> new EventBuffer(10, 5));
  }

  @Test
  void reportsCapacityWhenThresholdReached() {
    EventBuffer buffer = new EventBuffer(3, 100);
    assertEquals(EventBuffer.Append.ACCEPTED, buffer.add(event(1)));
    assertEquals(EventBuffer.Append.ACCEPTED, buffer.add(event(2)));
    assertEquals(EventBuffer.Append.AT_CAPACITY, buffer.add(event(3)));
    assertEquals(EventBuffer.Append.AT_CAPACITY, buffer.add(event(4)));
    assertEquals(4, buffer.size());
  }

  @Test
  void drainSwapsPendingListInOrder() {
    EventBuffer buffer = new EventBuffer(10, 100);
    buffer.add(event(1));
    buffer.add(event(2));

    List<PlayEvent> drained = buffer.drain();

    assertEquals(List.of(1L, 2L), ids(drained));
    assertTrue(buffer.isEmpty());
    assertEquals(List.of(), buffer.drain());
  }

  @Test
  void requeuedBatchGoesAheadOfNewerEvents() {
    EventBuffer buffer = new EventBuffer(10, 100);
    buffer.add(event(1));
    buffer.add(event(2));
    List<PlayEvent> batch = buffer.drain();
    buffer.add(event(3));

    buffer.requeue(batch);

    assertEquals(List.of(1L, 2L, 3L), ids(buffer.snapshot()));
  }

  @Test
  void closedBufferRefusesAddsButAcceptsRequeue() {
    EventBuffer buffer = new EventBuffer(10, 100);
    buffer.add(event(1));
    List<PlayEvent> batch = buffer.drain();
    buffer.close();

    assertEquals(EventBuffer.Append.CLOSED, buffer.add(event(2)));
    buffer.requeue(batch);

    assertTrue(buffer.isClosed());
    assertEquals(List.of(1L), ids(buffer.snapshot()));
  }

  @Test
  void overflowDropsOldestAndReportsCount() {
    List<Integer> drops = new ArrayList<>();
    EventBuffer buffer = new EventBuffer(2, 3, drops::add);
    for (long i = 1; i <= 5; i++) {
      buffer.add(event(i));
    }

    assertEquals(List.of(3L, 4L, 5L), ids(buffer.snapshot()));
    assertEquals(List.of(1, 1), drops);
  }

  @Test
  void requeueOverflowDropsOldestOfTheBatch() {
    List<Integer> drops = new ArrayList<>();
    EventBuffer buffer = new EventBuffer(2, 3, drops::add);
    buffer.add(event(1));
    buffer.add(event(2));
    buffer.add(event(3));
    List<PlayEvent> batch = buffer.drain();
    buffer.add(event(4));
    buffer.add(event(5));

    buffer.requeue(batch);

    assertEquals(List.of(3L, 4L, 5L), ids(buffer.snapshot()));
    assertEquals(List.of(2), drops);
  }

  @Test
  void failingDropCallbackDoesNotBreakAdd() {
    EventBuffer buffer = new EventBuffer(1, 1, count -> {
      throw new IllegalStateException("callback");
    });
    buffer.add(event(1));
    assertEquals(EventBuffer.Append.AT_CAPACITY, buffer.add(event(2)));
    assertEquals(List.of(2L), ids(buffer.snapshot()));
  }

  static PlayEvent event(long id) {
    return new PlayEvent("g", "u", "t" + id, "a", null, 0, id);
  }

  static List<Long> ids(List<PlayEvent> events) {
    return events.stream().map(PlayEvent::queuedAtEpochMs).toList();
  }
}
