package io.github.suppierk.es.serialization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.accounts.AccountsEventTypes;
import io.github.suppierk.es.accounts.tenant.TenantEvent;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.event.DomainEvent;
import org.junit.jupiter.api.Test;

class EventTypeRegistryTest {
  record UserRegisteredV2(String userId, String tenantId, String email, String displayName)
      implements DomainEvent {}

  record Unregistered(String value) implements DomainEvent {}

  @Test
  void registered_types_resolve_in_both_directions() {
    final var registry = AccountsEventTypes.users();
    final var type = registry.typeOf(new UserEvent.UserReactivated("U1", "T1"));

    assertEquals(AccountsEventTypes.USER_REACTIVATED, type.name());
    assertEquals(1, type.schemaVersion());
    assertEquals(UserEvent.UserReactivated.class, registry.classOf(type.name(), 1));
  }

  @Test
  void several_schema_versions_of_the_same_type_coexist() {
    final var registry =
        EventTypeRegistry.builder()
            .include(AccountsEventTypes.users())
            .register(UserRegisteredV2.class, AccountsEventTypes.USER_REGISTERED, 2)
            .build();

    assertEquals(
        UserEvent.UserRegistered.class,
        registry.classOf(AccountsEventTypes.USER_REGISTERED, 1));
    assertEquals(UserRegisteredV2.class, registry.classOf(AccountsEventTypes.USER_REGISTERED, 2));
  }

  @Test
  void when_type_is_unknown_it_is_rejected() {
    final var registry = AccountsEventTypes.users();

    assertThrows(UnknownEventTypeException.class, () -> registry.classOf("UserTeleported", 1));
    assertThrows(
        UnknownEventTypeException.class,
        () -> registry.classOf(AccountsEventTypes.USER_REGISTERED, 7));
    assertThrows(UnknownEventTypeException.class, () -> registry.typeOf(new Unregistered("x")));
  }

  @Test
  void when_registration_is_duplicated_it_is_rejected() {
    final var byClass =
        EventTypeRegistry.builder().register(UserEvent.UserRegistered.class, "First");
    assertThrows(
        IllegalStateException.class,
        () -> byClass.register(UserEvent.UserRegistered.class, "Second"));

    final var byName =
        EventTypeRegistry.builder().register(UserEvent.UserRegistered.class, "Registered");
    assertThrows(
        IllegalStateException.class,
        () -> byName.register(TenantEvent.TenantCreated.class, "Registered"));

    assertThrows(
        IllegalStateException.class,
        () ->
            EventTypeRegistry.builder()
                .include(AccountsEventTypes.users())
                .include(AccountsEventTypes.users()));
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_exception_is_thrown() {
    final var builder = EventTypeRegistry.builder();

    assertThrows(IllegalArgumentException.class, () -> builder.register(null, "Name"));
    assertThrows(
        IllegalArgumentException.class, () -> builder.register(Unregistered.class, " "));
    assertThrows(
        IllegalArgumentException.class, () -> builder.register(Unregistered.class, "Name", 0));
    assertThrows(IllegalArgumentException.class, () -> builder.include(null));
    assertThrows(IllegalArgumentException.class, () -> AccountsEventTypes.all().typeOf(null));
  }

  @Test
  void combined_registry_contains_every_account_event() {
    final var registry = AccountsEventTypes.all();

    assertEquals(9, registry.registeredTypes().size());
    assertTrue(
        registry
            .registeredTypes()
            .contains(new EventTypeRegistry.EventType(AccountsEventTypes.TENANT_SUSPENDED, 1)));
  }
}
