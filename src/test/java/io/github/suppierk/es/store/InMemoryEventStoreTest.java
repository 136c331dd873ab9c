package io.github.suppierk.es.store;

import static io.github.suppierk.test.AccountsFixtures.newEvents;
import static io.github.suppierk.test.AccountsFixtures.registered;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.AccountsEventTypes;
import io.github.suppierk.es.accounts.tenant.TenantEvent;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.event.RecordedEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryEventStoreTest {
  InMemoryEventStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
  }

  @Nested
  class Append {
    @Test
    void when_stream_does_not_exist_it_is_created_with_version_of_appended_events() {
      final var result =
          store.append(
              "user-U1",
              ExpectedVersion.NO_STREAM,
              newEvents(registered("U1", "T1"), new UserEvent.UserDeactivated("U1", "T1")));

      assertEquals(2L, result.newVersion());
      assertEquals(2L, store.currentVersion("user-U1"));
      assertEquals(List.of(1L, 2L), result.events().stream().map(RecordedEvent::version).toList());
    }

    @Test
    void when_expected_version_is_stale_conflict_is_reported_and_nothing_is_written() {
      store.append("user-U1", 0L, newEvents(registered("U1", "T1")));

      final var conflict =
          assertThrows(
              ConcurrencyConflictException.class,
              () -> store.append("user-U1", 0L, newEvents(registered("U1", "T1"))));

      assertEquals("user-U1", conflict.getStreamId());
      assertEquals(0L, conflict.getExpectedVersion());
      assertEquals(1L, conflict.getActualVersion());
      assertTrue(conflict.getMessage().contains("version 0 was expected"));
      assertEquals(1L, store.currentVersion("user-U1"));
    }

    @Test
    void when_expected_version_is_any_check_is_skipped() {
      store.append("user-U1", 0L, newEvents(registered("U1", "T1")));

      final var result =
          store.append(
              "user-U1", ExpectedVersion.ANY, newEvents(new UserEvent.UserDeactivated("U1", "T1")));

      assertEquals(2L, result.newVersion());
    }

    @Test
    void when_arguments_are_invalid_illegal_argument_exception_is_thrown() {
      final var events = newEvents(registered("U1", "T1"));

      assertThrows(IllegalArgumentException.class, () -> store.append(null, 0L, events));
      assertThrows(IllegalArgumentException.class, () -> store.append(" ", 0L, events));
      assertThrows(IllegalArgumentException.class, () -> store.append("user-U1", 0L, null));
      assertThrows(IllegalArgumentException.class, () -> store.append("user-U1", 0L, List.of()));
      assertThrows(IllegalArgumentException.class, () -> store.append("user-U1", -2L, events));
    }

    @Test
    void when_two_writers_race_with_the_same_expected_version_exactly_one_wins() throws Exception {
      store.append(
          "user-U1",
          0L,
          newEvents(
              registered("U1", "T1"),
              new UserEvent.UserDeactivated("U1", "T1"),
              new UserEvent.UserReactivated("U1", "T1")));

      final int writers = 8;
      final ExecutorService executor = Executors.newFixedThreadPool(writers);
      final CountDownLatch start = new CountDownLatch(1);
      final AtomicInteger conflicts = new AtomicInteger();

      try {
        final List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
          final Callable<Boolean> writer =
              () -> {
                start.await();
                try {
                  store.append(
                      "user-U1", 3L, newEvents(new UserEvent.UserDeactivated("U1", "T1")));
                  return true;
                } catch (ConcurrencyConflictException e) {
                  conflicts.incrementAndGet();
                  return false;
                }
              };
          futures.add(executor.submit(writer));
        }

        start.countDown();

        int successes = 0;
        for (Future<Boolean> future : futures) {
          if (future.get(10, TimeUnit.SECONDS)) {
            successes++;
          }
        }

        assertEquals(1, successes);
        assertEquals(writers - 1, conflicts.get());
        assertEquals(4L, store.currentVersion("user-U1"));
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  class Read {
    @BeforeEach
    void setUp() {
      store.append("user-U1", 0L, newEvents(registered("U1", "T1")));
      store.append("user-U2", 0L, newEvents(registered("U2", "T1")));
      store.append("user-U1", 1L, newEvents(new UserEvent.UserDeactivated("U1", "T1")));
      store.append(
          "tenant-T1",
          0L,
          newEvents(new TenantEvent.TenantCreated("T1", "Acme", "owner@acme.com", null)));
    }

    @Test
    void stream_is_read_in_version_order_after_given_version() {
      try (var events = store.readStream("user-U1", 1L)) {
        final var read = events.toList();
        assertEquals(1, read.size());
        assertEquals(2L, read.get(0).version());
      }

      try (var events = store.readStream("user-U1")) {
        assertEquals(2L, events.count());
      }
    }

    @Test
    void when_stream_does_not_exist_it_is_empty() {
      try (var events = store.readStream("user-missing")) {
        assertEquals(0L, events.count());
      }
      assertEquals(0L, store.currentVersion("user-missing"));
    }

    @Test
    void all_events_are_read_in_gap_free_global_order() {
      try (var events = store.readAll(EventFilter.all())) {
        final var positions = events.map(RecordedEvent::globalPosition).toList();
        assertEquals(List.of(1L, 2L, 3L, 4L), positions);
      }
    }

    @Test
    void filter_selects_by_position_type_prefix_and_limit() {
      try (var events = store.readAll(EventFilter.all().after(2L))) {
        assertEquals(List.of(3L, 4L), events.map(RecordedEvent::globalPosition).toList());
      }

      try (var events =
          store.readAll(EventFilter.ofTypes(Set.of(AccountsEventTypes.USER_REGISTERED)))) {
        assertEquals(
            List.of("user-U1", "user-U2"), events.map(RecordedEvent::streamId).toList());
      }

      try (var events = store.readAll(EventFilter.ofStreamPrefix("tenant-"))) {
        assertEquals(List.of(4L), events.map(RecordedEvent::globalPosition).toList());
      }

      try (var events = store.readAll(EventFilter.ofStreamPrefix("user-").limit(2))) {
        assertEquals(List.of(1L, 2L), events.map(RecordedEvent::globalPosition).toList());
      }
    }

    @Test
    void when_position_is_beyond_the_log_nothing_is_read() {
      try (var events = store.readAll(EventFilter.all().after(100L))) {
        assertTrue(events.findAny().isEmpty());
      }
    }
  }

  @Test
  void concurrent_writers_of_different_streams_keep_global_order_gap_free()
      throws InterruptedException, ExecutionException {
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        final String userId = "U" + i;
        futures.add(
            executor.submit(
                () -> {
                  store.append("user-" + userId, 0L, newEvents(registered(userId, "T1")));
                  for (int v = 1; v <= 24; v++) {
                    final UserEvent event =
                        v % 2 == 1
                            ? new UserEvent.UserDeactivated(userId, "T1")
                            : new UserEvent.UserReactivated(userId, "T1");
                    store.append("user-" + userId, v, newEvents(event));
                  }
                }));
      }

      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    try (var events = store.readAll(EventFilter.all())) {
      final var positions = events.map(RecordedEvent::globalPosition).toList();
      assertEquals(100, positions.size());
      for (int i = 0; i < positions.size(); i++) {
        assertEquals(i + 1L, positions.get(i));
      }
    }
  }
}
