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

package io.github.suppierk.es.event;

import java.time.Instant;
import java.util.UUID;

/**
 * An event which has been decided but not yet appended to a stream.
 *
 * <p>Identifier and timestamp are assigned by the command processor rather than by the decider,
 * which keeps deciding deterministic.
 *
 * @param eventId unique identifier of the event
 * @param eventType logical name of the event type
 * @param schemaVersion version of the payload schema for the given event type
 * @param payload of the event
 * @param occurredAt when the event was produced
 */
public record NewEvent(
    UUID eventId, String eventType, int schemaVersion, DomainEvent payload, Instant occurredAt) {
  public NewEvent {
    if (eventId == null) {
      throw new IllegalArgumentException("Event ID cannot be null");
    }

    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    if (schemaVersion < 1) {
      throw new IllegalArgumentException("Schema version must be positive");
    }

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    if (occurredAt == null) {
      throw new IllegalArgumentException("Occurrence timestamp cannot be null");
    }
  }
}
