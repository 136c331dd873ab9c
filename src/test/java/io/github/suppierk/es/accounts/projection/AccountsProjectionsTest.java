package io.github.suppierk.es.accounts.projection;

import static io.github.suppierk.test.AccountsFixtures.REGISTRY;
import static io.github.suppierk.test.AccountsFixtures.newEvent;
import static io.github.suppierk.test.AccountsFixtures.newEvents;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.tenant.TenantCommand;
import io.github.suppierk.es.accounts.tenant.TenantDecider;
import io.github.suppierk.es.accounts.tenant.TenantEvent;
import io.github.suppierk.es.accounts.tenant.TenantState;
import io.github.suppierk.es.accounts.user.UserCommand;
import io.github.suppierk.es.accounts.user.UserCommand.ChangeUserEmail;
import io.github.suppierk.es.accounts.user.UserCommand.DeactivateUser;
import io.github.suppierk.es.accounts.user.UserCommand.ReactivateUser;
import io.github.suppierk.es.accounts.user.UserCommand.RegisterUser;
import io.github.suppierk.es.accounts.user.UserCommand.UpdateUserProfile;
import io.github.suppierk.es.accounts.user.UserDecider;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.accounts.user.UserState;
import io.github.suppierk.es.command.CommandProcessor;
import io.github.suppierk.es.event.DomainEvent;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.projection.InMemoryViewStore;
import io.github.suppierk.es.projection.ProjectionEngine;
import io.github.suppierk.es.projection.ProjectionStatus;
import io.github.suppierk.es.store.InMemoryEventStore;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountsProjectionsTest {
  InMemoryEventStore store;
  InMemoryViewStore<UserDirectoryEntry> directory;
  InMemoryViewStore<TenantUserStatistics> statistics;
  ProjectionEngine engine;
  CommandProcessor<UserCommand, UserState, UserEvent> users;
  CommandProcessor<TenantCommand, TenantState, TenantEvent> tenants;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
    directory = new InMemoryViewStore<>();
    statistics = new InMemoryViewStore<>();
    engine =
        ProjectionEngine.builder(store)
            .register(new UserDirectoryProjection(), directory)
            .register(new TenantUserStatisticsProjection(), statistics)
            .build();
    users =
        CommandProcessor.builder(new UserDecider(), store, REGISTRY)
            .projectionEngine(engine)
            .build();
    tenants =
        CommandProcessor.builder(new TenantDecider(), store, REGISTRY)
            .projectionEngine(engine)
            .build();
  }

  void populate() {
    tenants.handle(new TenantCommand.CreateTenant("T1", "Acme", "owner@acme.com", null));
    tenants.handle(new TenantCommand.CreateTenant("T2", "Globex", "owner@globex.com", null));

    users.handle(new RegisterUser("U1", "T1", "jane@acme.com", "Jane", "Doe"));
    users.handle(new RegisterUser("U2", "T1", "john@acme.com", "John", "Roe"));
    users.handle(new RegisterUser("U3", "T2", "ann@globex.com", "Ann", null));
    users.handle(new UpdateUserProfile("U1", "Jane", "Smith", "CTO"));
    users.handle(new ChangeUserEmail("U2", "jr@acme.com"));
    users.handle(new DeactivateUser("U2"));
    users.handle(new DeactivateUser("U3"));
    users.handle(new ReactivateUser("U3"));
  }

  @Test
  void user_directory_is_up_to_date_when_command_returns() {
    populate();

    assertEquals(
        new UserDirectoryEntry("U1", "T1", "jane@acme.com", "Jane", "Smith", "CTO", true),
        directory.find("U1").orElseThrow());
    assertEquals(
        new UserDirectoryEntry("U2", "T1", "jr@acme.com", "John", "Roe", null, false),
        directory.find("U2").orElseThrow());
    assertEquals("Jane Smith", directory.find("U1").orElseThrow().displayName());
    assertEquals("Ann", directory.find("U3").orElseThrow().displayName());
  }

  @Test
  void tenant_statistics_follow_after_catch_up() {
    populate();
    assertTrue(statistics.all().isEmpty());

    engine.catchUp();

    assertEquals(
        Map.of(
            "T1", new TenantUserStatistics("T1", 1L, 1L),
            "T2", new TenantUserStatistics("T2", 1L, 0L)),
        statistics.all());
    assertEquals(2L, statistics.find("T1").orElseThrow().totalUsers());
  }

  @Test
  void rebuilding_yields_identical_views() {
    populate();
    engine.catchUp();

    final var directoryBefore = directory.all();
    final var statisticsBefore = statistics.all();

    engine.rebuild(UserDirectoryProjection.NAME);
    engine.rebuild(TenantUserStatisticsProjection.NAME);

    assertEquals(directoryBefore, directory.all());
    assertEquals(statisticsBefore, statistics.all());
  }

  @Test
  void directory_reports_failure_for_a_user_stream_without_registration() {
    store.append("user-U9", 0L, newEvents(new UserEvent.UserDeactivated("U9", "T1")));

    assertEquals(0, engine.catchUp(UserDirectoryProjection.NAME));
    assertEquals(ProjectionStatus.FAILED, engine.status(UserDirectoryProjection.NAME));
    assertEquals(0L, engine.checkpoint(UserDirectoryProjection.NAME));

    // Other projections are not affected
    engine.catchUp(TenantUserStatisticsProjection.NAME);
    assertEquals(
        ProjectionStatus.HEALTHY, engine.status(TenantUserStatisticsProjection.NAME));
  }

  @Test
  void statistics_are_keyed_by_the_tenant_of_each_counted_event() {
    final var projection = new TenantUserStatisticsProjection();
    final var deactivated = recorded("user-U1", new UserEvent.UserDeactivated("U1", "T1"));

    assertEquals("T1", projection.viewId(deactivated));
    assertEquals(
        new TenantUserStatistics("T1", 0L, 1L),
        projection.apply(deactivated, new TenantUserStatistics("T1", 1L, 0L)));
  }

  @Test
  void statistics_refuse_events_they_do_not_count() {
    final var projection = new TenantUserStatisticsProjection();
    final var profileUpdated =
        recorded("user-U1", new UserEvent.UserProfileUpdated("U1", "Jane", "Doe", null));
    final var tenantCreated =
        recorded(
            "tenant-T1", new TenantEvent.TenantCreated("T1", "Acme", "owner@acme.com", null));

    assertThrows(IllegalStateException.class, () -> projection.viewId(profileUpdated));
    assertThrows(
        IllegalStateException.class,
        () -> projection.apply(profileUpdated, TenantUserStatistics.empty("T1")));
    assertThrows(IllegalStateException.class, () -> projection.viewId(tenantCreated));
  }

  static RecordedEvent recorded(final String streamId, final DomainEvent payload) {
    return RecordedEvent.of(1L, streamId, 1L, newEvent(payload));
  }
}
