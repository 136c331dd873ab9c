package io.github.suppierk.es.projection;

import static io.github.suppierk.test.AccountsFixtures.newEvents;
import static io.github.suppierk.test.AccountsFixtures.registered;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.store.InMemoryEventStore;
import io.github.suppierk.test.CountingProjection;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProjectionEngineTest {
  InMemoryEventStore store;
  CountingProjection immediate;
  CountingProjection eventual;
  InMemoryViewStore<Long> immediateViews;
  InMemoryViewStore<Long> eventualViews;
  ProjectionEngine engine;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
    immediate = new CountingProjection("immediate", ConsistencyMode.IMMEDIATE, false);
    eventual = new CountingProjection("eventual", ConsistencyMode.EVENTUAL, true);
    immediateViews = new InMemoryViewStore<>();
    eventualViews = new InMemoryViewStore<>();
    engine =
        ProjectionEngine.builder(store)
            .register(immediate, immediateViews)
            .register(eventual, eventualViews)
            .batchSize(2)
            .build();
  }

  List<RecordedEvent> append(final String userId, final long expectedVersion) {
    final UserEvent event =
        expectedVersion == 0L
            ? registered(userId, "T1")
            : new UserEvent.UserDeactivated(userId, "T1");
    return store.append("user-" + userId, expectedVersion, newEvents(event)).events();
  }

  @Nested
  class Registration {
    @Test
    void multi_stream_projection_cannot_be_immediate() {
      final var builder = ProjectionEngine.builder(store);
      final var projection = new CountingProjection("bad", ConsistencyMode.IMMEDIATE, true);
      final var views = new InMemoryViewStore<Long>();

      assertThrows(IllegalArgumentException.class, () -> builder.register(projection, views));
    }

    @Test
    void projection_names_are_unique() {
      final var builder = ProjectionEngine.builder(store).register(immediate, immediateViews);
      final var views = new InMemoryViewStore<Long>();

      assertThrows(IllegalStateException.class, () -> builder.register(immediate, views));
    }

    @Test
    void when_arguments_are_invalid_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> ProjectionEngine.builder(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> ProjectionEngine.builder(store).register(null, immediateViews));
      assertThrows(
          IllegalArgumentException.class, () -> ProjectionEngine.builder(store).batchSize(0));
      assertThrows(IllegalArgumentException.class, () -> engine.status("missing"));
      assertThrows(IllegalArgumentException.class, () -> engine.rebuild("missing"));
      assertThrows(IllegalArgumentException.class, () -> engine.onCommitted(null));
    }

    @Test
    void registered_projections_are_listed_in_order() {
      assertEquals(Set.of("immediate", "eventual"), engine.projectionNames());
      assertEquals(List.of("immediate", "eventual"), List.copyOf(engine.projectionNames()));
    }
  }

  @Nested
  class Consistency {
    @Test
    void committed_events_update_only_immediate_projections() {
      engine.onCommitted(append("U1", 0L));

      assertEquals(Map.of("user-U1", 1L), immediateViews.all());
      assertEquals(1L, engine.checkpoint("immediate"));
      assertTrue(eventualViews.all().isEmpty());
      assertEquals(0L, engine.checkpoint("eventual"));
    }

    @Test
    void catch_up_brings_every_projection_up_to_date_in_batches() {
      append("U1", 0L);
      append("U2", 0L);
      append("U1", 1L);
      append("U3", 0L);
      append("U2", 1L);

      assertEquals(10, engine.catchUp());

      final var expected = Map.of("user-U1", 2L, "user-U2", 2L, "user-U3", 1L);
      assertEquals(expected, immediateViews.all());
      assertEquals(expected, eventualViews.all());
      assertEquals(5L, engine.checkpoint("eventual"));
      assertEquals(0, engine.catchUp("eventual"));
    }

    @Test
    void redelivered_events_are_applied_once() {
      final var events = append("U1", 0L);

      engine.onCommitted(events);
      engine.onCommitted(events);
      engine.catchUp();

      assertEquals(Map.of("user-U1", 1L), immediateViews.all());
    }
  }

  @Nested
  class Failures {
    @Test
    void failed_projection_stops_before_failing_event_and_recovers_on_next_catch_up() {
      append("U1", 0L);
      append("U2", 0L);
      append("U1", 1L);

      eventual.failAt(2L);
      assertEquals(1, engine.catchUp("eventual"));
      assertEquals(ProjectionStatus.FAILED, engine.status("eventual"));
      assertEquals(1L, engine.checkpoint("eventual"));

      eventual.recover();
      assertEquals(2, engine.catchUp("eventual"));
      assertEquals(ProjectionStatus.HEALTHY, engine.status("eventual"));
      assertEquals(Map.of("user-U1", 2L, "user-U2", 1L), eventualViews.all());
    }

    @Test
    void failed_immediate_projection_does_not_propagate_to_committer() {
      immediate.failAt(1L);

      engine.onCommitted(append("U1", 0L));

      assertEquals(ProjectionStatus.FAILED, engine.status("immediate"));
      assertTrue(immediateViews.all().isEmpty());

      immediate.recover();
      engine.onCommitted(append("U1", 1L));

      assertEquals(ProjectionStatus.HEALTHY, engine.status("immediate"));
      assertEquals(Map.of("user-U1", 2L), immediateViews.all());
    }
  }

  @Nested
  class Rebuild {
    @Test
    void rebuilt_views_equal_incrementally_maintained_ones() {
      engine.onCommitted(append("U1", 0L));
      engine.onCommitted(append("U2", 0L));
      engine.onCommitted(append("U1", 1L));
      final var incremental = immediateViews.all();

      assertEquals(3, engine.rebuild("immediate"));

      assertEquals(incremental, immediateViews.all());
      assertEquals(3L, engine.checkpoint("immediate"));
      assertEquals(ProjectionStatus.HEALTHY, engine.status("immediate"));
    }

    @Test
    void rebuild_repairs_corrupted_views() {
      engine.onCommitted(append("U1", 0L));
      immediateViews.reset();
      immediateViews.save("user-U1", 42L, 1L);

      engine.rebuild("immediate");

      assertEquals(Map.of("user-U1", 1L), immediateViews.all());
    }
  }

  @Test
  void background_catch_up_follows_the_store() throws InterruptedException {
    append("U1", 0L);
    append("U2", 0L);

    engine.start(Duration.ofMillis(10));
    try {
      assertThrows(IllegalStateException.class, () -> engine.start(Duration.ofMillis(10)));

      final long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
      while (engine.checkpoint("eventual") < 2L && System.nanoTime() < deadline) {
        Thread.sleep(10L);
      }
    } finally {
      engine.close();
    }

    assertEquals(Map.of("user-U1", 1L, "user-U2", 1L), eventualViews.all());
    engine.close();
  }
}
