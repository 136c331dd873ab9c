/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.serialization;

import io.github.suppierk.es.event.DomainEvent;
import io.github.suppierk.es.internal.Suspicious;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping between event payload classes and their logical, schema-versioned names.
 *
 * <p>Logical names decouple stored events from Java class names, so that classes can be renamed
 * or moved without rewriting history. A new schema version of the same event type is registered
 * as a separate class, which allows aggregates to keep understanding older events.
 *
 * <p>Built once at start-up with {@link #builder()} and then shared.
 */
public final class EventTypeRegistry extends Suspicious {
  private final Map<Class<? extends DomainEvent>, EventType> typesByClass;
  private final Map<EventType, Class<? extends DomainEvent>> classesByType;

  private EventTypeRegistry(
      final Map<Class<? extends DomainEvent>, EventType> typesByClass,
      final Map<EventType, Class<? extends DomainEvent>> classesByType) {
    this.typesByClass = Map.copyOf(typesByClass);
    this.classesByType = Map.copyOf(classesByType);
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param payload to look up
   * @return the logical type of given payload
   * @throws UnknownEventTypeException if the payload class was not registered
   */
  public EventType typeOf(final DomainEvent payload) {
    final DomainEvent nonNullPayload = throwIllegalArgumentIfNull(payload, "Payload");
    final EventType type = typesByClass.get(nonNullPayload.getClass());

    if (type == null) {
      throw new UnknownEventTypeException(
          "Event class '%s' is not registered".formatted(nonNullPayload.getClass().getName()));
    }

    return type;
  }

  /**
   * @param name of the event type
   * @param schemaVersion of the event type
   * @return the payload class registered for given type
   * @throws UnknownEventTypeException if the type was not registered
   */
  public Class<? extends DomainEvent> classOf(final String name, final int schemaVersion) {
    final Class<? extends DomainEvent> payloadClass =
        classesByType.get(new EventType(name, schemaVersion));

    if (payloadClass == null) {
      throw new UnknownEventTypeException(
          "Event type '%s' version %d is not registered".formatted(name, schemaVersion));
    }

    return payloadClass;
  }

  /**
   * @return all registered types
   */
  public Set<EventType> registeredTypes() {
    return classesByType.keySet();
  }

  /**
   * Logical type of an event.
   *
   * @param name of the event type, e.g. {@code UserRegistered}
   * @param schemaVersion of the payload, starting from {@code 1}
   */
  public record EventType(String name, int schemaVersion) {
    public EventType {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Event type name cannot be blank");
      }

      if (schemaVersion < 1) {
        throw new IllegalArgumentException("Schema version must be positive");
      }
    }
  }

  /** Collects registrations, rejecting duplicates eagerly. */
  public static final class Builder extends Suspicious {
    private final Map<Class<? extends DomainEvent>, EventType> typesByClass;
    private final Map<EventType, Class<? extends DomainEvent>> classesByType;

    private Builder() {
      this.typesByClass = new HashMap<>();
      this.classesByType = new HashMap<>();
    }

    /**
     * Same as {@link #register(Class, String, int)} with schema version {@code 1}.
     *
     * @param payloadClass to register
     * @param name of the event type
     * @return this builder
     */
    public Builder register(final Class<? extends DomainEvent> payloadClass, final String name) {
      return register(payloadClass, name, 1);
    }

    /**
     * @param payloadClass to register
     * @param name of the event type
     * @param schemaVersion of the payload
     * @return this builder
     * @throws IllegalStateException if either the class or the type is already registered
     */
    public Builder register(
        final Class<? extends DomainEvent> payloadClass,
        final String name,
        final int schemaVersion) {
      final Class<? extends DomainEvent> nonNullClass =
          throwIllegalArgumentIfNull(payloadClass, "Payload class");
      final EventType type = new EventType(name, schemaVersion);

      if (typesByClass.containsKey(nonNullClass)) {
        throw new IllegalStateException(
            "Event class '%s' is already registered".formatted(nonNullClass.getName()));
      }

      if (classesByType.containsKey(type)) {
        throw new IllegalStateException(
            "Event type '%s' version %d is already registered".formatted(name, schemaVersion));
      }

      typesByClass.put(nonNullClass, type);
      classesByType.put(type, nonNullClass);
      return this;
    }

    /**
     * Copies all registrations of another registry, e.g. to combine several aggregates.
     *
     * @param registry to include
     * @return this builder
     */
    public Builder include(final EventTypeRegistry registry) {
      throwIllegalArgumentIfNull(registry, "Registry")
          .typesByClass
          .forEach(
              (payloadClass, type) -> register(payloadClass, type.name(), type.schemaVersion()));
      return this;
    }

    /**
     * @return a new immutable {@link EventTypeRegistry}
     */
    public EventTypeRegistry build() {
      return new EventTypeRegistry(typesByClass, classesByType);
    }
  }
}
