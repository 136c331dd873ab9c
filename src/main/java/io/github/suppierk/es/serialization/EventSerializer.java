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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.es.event.DomainEvent;
import io.github.suppierk.es.internal.Suspicious;

/**
 * JSON serialization of event payloads, used by durable event stores.
 *
 * <p>{@link JavaTimeModule} handles {@code java.time} values as ISO 8601 strings. Unknown
 * properties are ignored on read, which permits adding optional properties to a payload without
 * bumping its schema version.
 */
public final class EventSerializer extends Suspicious {
  private final ObjectMapper objectMapper;
  private final EventTypeRegistry eventTypeRegistry;

  /**
   * @param eventTypeRegistry to resolve payload classes with
   */
  public EventSerializer(final EventTypeRegistry eventTypeRegistry) {
    this(createObjectMapper(), eventTypeRegistry);
  }

  /**
   * @param objectMapper to use, e.g. when the application has its own configuration
   * @param eventTypeRegistry to resolve payload classes with
   */
  public EventSerializer(
      final ObjectMapper objectMapper, final EventTypeRegistry eventTypeRegistry) {
    this.objectMapper = throwIllegalArgumentIfNull(objectMapper, "Object mapper");
    this.eventTypeRegistry = throwIllegalArgumentIfNull(eventTypeRegistry, "Event type registry");
  }

  /**
   * @return an {@link ObjectMapper} configured the way this serializer expects by default
   */
  public static ObjectMapper createObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * @return the registry used to resolve payload classes
   */
  public EventTypeRegistry getEventTypeRegistry() {
    return eventTypeRegistry;
  }

  /**
   * @param payload to serialize
   * @return JSON representation of the payload
   * @throws EventSerializationException if serialization fails
   */
  public String serialize(final DomainEvent payload) {
    final DomainEvent nonNullPayload = throwIllegalArgumentIfNull(payload, "Payload");

    try {
      return objectMapper.writeValueAsString(nonNullPayload);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException(
          "Failed to serialize '%s'".formatted(nonNullPayload.getClass().getName()), e);
    }
  }

  /**
   * @param eventType logical name of the event type
   * @param schemaVersion of the payload
   * @param json representation of the payload
   * @return deserialized payload
   * @throws UnknownEventTypeException if the type is not registered
   * @throws EventSerializationException if deserialization fails
   */
  public DomainEvent deserialize(
      final String eventType, final int schemaVersion, final String json) {
    final Class<? extends DomainEvent> payloadClass =
        eventTypeRegistry.classOf(eventType, schemaVersion);

    try {
      return objectMapper.readValue(throwIllegalArgumentIfNull(json, "JSON"), payloadClass);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException(
          "Failed to deserialize '%s' version %d".formatted(eventType, schemaVersion), e);
    }
  }
}
