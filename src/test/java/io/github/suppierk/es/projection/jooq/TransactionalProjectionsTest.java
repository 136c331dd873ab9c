package io.github.suppierk.es.projection.jooq;

import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_CHECKPOINT;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_VIEW;
import static io.github.suppierk.test.AccountsFixtures.REGISTRY;
import static io.github.suppierk.test.AccountsFixtures.newEvents;
import static io.github.suppierk.test.AccountsFixtures.registered;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.projection.TenantUserStatistics;
import io.github.suppierk.es.accounts.projection.TenantUserStatisticsProjection;
import io.github.suppierk.es.accounts.projection.UserDirectoryEntry;
import io.github.suppierk.es.accounts.projection.UserDirectoryProjection;
import io.github.suppierk.es.accounts.user.UserCommand;
import io.github.suppierk.es.accounts.user.UserCommand.DeactivateUser;
import io.github.suppierk.es.accounts.user.UserCommand.RegisterUser;
import io.github.suppierk.es.accounts.user.UserDecider;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.accounts.user.UserState;
import io.github.suppierk.es.command.CommandProcessor;
import io.github.suppierk.es.command.CommandResult;
import io.github.suppierk.es.projection.ProjectionEngine;
import io.github.suppierk.es.serialization.EventSerializer;
import io.github.suppierk.es.store.jooq.EventStoreSchema;
import io.github.suppierk.es.store.jooq.JooqEventStore;
import io.github.suppierk.es.store.jooq.TransactionalAppendListener;
import java.sql.DriverManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TransactionalProjectionsTest {
  static final String JDBC_URL =
      "jdbc:h2:mem:projected_store;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
          + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1";

  static final DSLContext DSL_CONTEXT;
  static final EventSerializer SERIALIZER = new EventSerializer(REGISTRY);

  static {
    try {
      final var connection = DriverManager.getConnection(JDBC_URL);
      DSL_CONTEXT = DSL.using(connection, SQLDialect.POSTGRES);
      EventStoreSchema.create(DSL_CONTEXT);
      ViewStoreSchema.create(DSL_CONTEXT);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  JooqViewStore<UserDirectoryEntry> directory;
  JooqEventStore store;

  @BeforeEach
  void setUp() {
    EventStoreSchema.truncate(DSL_CONTEXT);
    DSL_CONTEXT.deleteFrom(PROJECTION_VIEW).execute();
    DSL_CONTEXT.deleteFrom(PROJECTION_CHECKPOINT).execute();

    directory = directoryViews();
    store = storeWith(directoryProjections());
  }

  static JooqViewStore<UserDirectoryEntry> directoryViews() {
    return new JooqViewStore<>(
        DSL_CONTEXT,
        UserDirectoryProjection.NAME,
        UserDirectoryEntry.class,
        EventSerializer.createObjectMapper());
  }

  TransactionalProjections directoryProjections() {
    return TransactionalProjections.builder()
        .register(new UserDirectoryProjection(), directory)
        .build();
  }

  static JooqEventStore storeWith(final TransactionalAppendListener... listeners) {
    return new JooqEventStore(DSL_CONTEXT, SERIALIZER, List.of(listeners));
  }

  @Nested
  class Registration {
    @Test
    void only_immediate_single_stream_projections_are_accepted() {
      final var builder = TransactionalProjections.builder();
      final var statistics =
          new JooqViewStore<>(
              DSL_CONTEXT,
              TenantUserStatisticsProjection.NAME,
              TenantUserStatistics.class,
              EventSerializer.createObjectMapper());

      assertThrows(
          IllegalArgumentException.class,
          () -> builder.register(new TenantUserStatisticsProjection(), statistics));
      assertThrows(IllegalArgumentException.class, () -> builder.register(null, directory));
      assertThrows(IllegalArgumentException.class, () -> builder.batchSize(0));
    }
  }

  @Nested
  class SameTransaction {
    @Test
    void committed_command_is_visible_in_persisted_views_right_away() {
      final CommandProcessor<UserCommand, UserState, UserEvent> processor =
          CommandProcessor.builder(new UserDecider(), store, REGISTRY).build();

      final var registered =
          processor.handle(new RegisterUser("U1", "T1", "jane@x.com", "Jane", "Doe"));
      final var deactivated = processor.handle(new DeactivateUser("U1"));

      assertInstanceOf(CommandResult.Committed.class, registered);
      assertInstanceOf(CommandResult.Committed.class, deactivated);

      // A fresh instance reads what was committed along with the events
      final var reopened = directoryViews();
      assertEquals(
          Optional.of(new UserDirectoryEntry("U1", "T1", "jane@x.com", "Jane", "Doe", null, false)),
          reopened.find("U1"));
      assertEquals(2L, reopened.checkpoint());
    }

    @Test
    void rolled_back_append_leaves_no_views_behind() {
      final var failingStore =
          storeWith(
              directoryProjections(),
              (trx, events, appended) -> {
                throw new IllegalStateException("Outbox is unavailable");
              });

      assertThrows(
          IllegalStateException.class,
          () -> failingStore.append("user-U1", 0L, newEvents(registered("U1", "T1"))));

      assertEquals(0L, store.currentVersion("user-U1"));
      assertTrue(directory.all().isEmpty());
      assertEquals(0L, directory.checkpoint());
    }

    @Test
    void failing_projection_does_not_prevent_the_append() {
      // A directory entry cannot be created from anything but a registration
      final var result =
          store.append("user-U1", 0L, newEvents(new UserEvent.UserDeactivated("U1", "T1")));

      assertEquals(1L, result.newVersion());
      assertEquals(1L, store.currentVersion("user-U1"));
      assertTrue(directory.all().isEmpty());
      assertEquals(0L, directory.checkpoint());
    }
  }

  @Test
  void persisted_views_are_rebuildable_from_the_event_table() {
    store.append("user-U1", 0L, newEvents(registered("U1", "T1")));
    store.append("user-U2", 0L, newEvents(registered("U2", "T1")));
    store.append("user-U1", 1L, newEvents(new UserEvent.UserDeactivated("U1", "T1")));
    final Map<String, UserDirectoryEntry> incremental = directory.all();

    final var engine =
        ProjectionEngine.builder(store).register(new UserDirectoryProjection(), directory).build();

    assertEquals(0, engine.catchUp());
    assertEquals(3, engine.rebuild(UserDirectoryProjection.NAME));
    assertEquals(incremental, directory.all());
    assertEquals(3L, directory.checkpoint());
    assertEquals(2, incremental.size());
  }
}
