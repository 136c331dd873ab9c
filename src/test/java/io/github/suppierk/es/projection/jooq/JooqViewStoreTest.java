package io.github.suppierk.es.projection.jooq;

import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_CHECKPOINT;
import static io.github.suppierk.es.projection.jooq.ViewStoreSchema.PROJECTION_VIEW;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.projection.UserDirectoryEntry;
import io.github.suppierk.es.serialization.EventSerializer;
import java.sql.DriverManager;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JooqViewStoreTest {
  static final String JDBC_URL =
      "jdbc:h2:mem:view_store;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;"
          + "DB_CLOSE_DELAY=-1";

  static final DSLContext DSL_CONTEXT;

  static {
    try {
      final var connection = DriverManager.getConnection(JDBC_URL);
      DSL_CONTEXT = DSL.using(connection, SQLDialect.POSTGRES);
      ViewStoreSchema.create(DSL_CONTEXT);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  static final UserDirectoryEntry JANE =
      new UserDirectoryEntry("U1", "T1", "jane@x.com", "Jane", "Doe", null, true);

  JooqViewStore<UserDirectoryEntry> store;

  @BeforeEach
  void setUp() {
    DSL_CONTEXT.deleteFrom(PROJECTION_VIEW).execute();
    DSL_CONTEXT.deleteFrom(PROJECTION_CHECKPOINT).execute();
    store = views("directory");
  }

  JooqViewStore<UserDirectoryEntry> views(final String projectionName) {
    final var mapper = EventSerializer.createObjectMapper();
    return new JooqViewStore<>(DSL_CONTEXT, projectionName, UserDirectoryEntry.class, mapper);
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_exception_is_thrown() {
    final var mapper = EventSerializer.createObjectMapper();

    assertThrows(
        IllegalArgumentException.class,
        () -> new JooqViewStore<>(null, "p", UserDirectoryEntry.class, mapper));
    assertThrows(
        IllegalArgumentException.class,
        () -> new JooqViewStore<>(DSL_CONTEXT, " ", UserDirectoryEntry.class, mapper));
    assertThrows(
        IllegalArgumentException.class,
        () -> new JooqViewStore<>(DSL_CONTEXT, "p", null, mapper));
    assertThrows(IllegalArgumentException.class, () -> store.find(null));
  }

  @Test
  void schema_creation_is_idempotent() {
    assertDoesNotThrow(() -> ViewStoreSchema.create(DSL_CONTEXT));
  }

  @Test
  void empty_store_has_no_views_and_zero_checkpoint() {
    assertEquals(Optional.empty(), store.find("U1"));
    assertTrue(store.all().isEmpty());
    assertEquals(0L, store.checkpoint());
  }

  @Test
  void saved_views_survive_a_new_store_instance() {
    store.save("U1", JANE, 3L);
    final var deactivated =
        new UserDirectoryEntry("U1", "T1", "jane@x.com", "Jane", "Doe", "CTO", false);
    store.save("U1", deactivated, 5L);

    final var reopened = views("directory");

    assertEquals(Optional.of(deactivated), reopened.find("U1"));
    assertEquals(Map.of("U1", deactivated), reopened.all());
    assertEquals(5L, reopened.checkpoint());
  }

  @Test
  void checkpoint_only_moves_forward() {
    store.save("U1", JANE, 3L);

    assertThrows(IllegalArgumentException.class, () -> store.save("U2", JANE, 3L));
    assertThrows(IllegalArgumentException.class, () -> store.save("U2", JANE, 2L));

    assertEquals(Optional.empty(), store.find("U2"));
    assertEquals(3L, store.checkpoint());
  }

  @Test
  void views_of_projections_are_isolated() {
    final var other = views("other");

    store.save("U1", JANE, 1L);
    other.save("U2", JANE, 7L);

    assertEquals(List.of("U1"), List.copyOf(store.all().keySet()));
    assertEquals(1L, store.checkpoint());
    assertEquals(7L, other.checkpoint());

    store.reset();

    assertTrue(store.all().isEmpty());
    assertEquals(0L, store.checkpoint());
    assertEquals(Map.of("U2", JANE), other.all());
  }

  @Test
  void view_and_checkpoint_are_rolled_back_together() {
    assertThrows(
        IllegalStateException.class,
        () ->
            DSL_CONTEXT.transaction(
                (final Configuration trx) -> {
                  store.using(trx.dsl()).save("U1", JANE, 1L);
                  throw new IllegalStateException("Rolled back");
                }));

    assertTrue(store.all().isEmpty());
    assertEquals(0L, store.checkpoint());
  }
}
