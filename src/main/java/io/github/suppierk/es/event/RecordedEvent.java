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
 * An event which has been durably appended to a stream.
 *
 * @param globalPosition position of the event in the global append order across all streams,
 *     starting from {@code 1}
 * @param streamId identifier of the stream the event belongs to
 * @param version sequence number of the event within its stream, starting from {@code 1}
 * @param eventId unique identifier of the event
 * @param eventType logical name of the event type
 * @param schemaVersion version of the payload schema for the given event type
 * @param payload of the event
 * @param occurredAt when the event was produced
 */
public record RecordedEvent(
    long globalPosition,
    String streamId,
    long version,
    UUID eventId,
    String eventType,
    int schemaVersion,
    DomainEvent payload,
    Instant occurredAt) {
  public RecordedEvent {
    if (globalPosition < 1) {
      throw new IllegalArgumentException("Global position must be positive");
    }

    if (streamId == null || streamId.isBlank()) {
      throw new IllegalArgumentException("Stream ID cannot be blank");
    }

    if (version < 1) {
      throw new IllegalArgumentException("Stream version must be positive");
    }

    if (eventId == null || eventType == null || payload == null || occurredAt == null) {
      throw new IllegalArgumentException("Recorded event properties cannot be null");
    }
  }

  /**
   * Creates a {@link RecordedEvent} out of a {@link NewEvent} once the store has assigned its
   * positions.
   *
   * @param globalPosition assigned by the store
   * @param streamId the event was appended to
   * @param version assigned by the store
   * @param newEvent which was appended
   * @return a new instance of {@link RecordedEvent}
   */
  public static RecordedEvent of(
      final long globalPosition,
      final String streamId,
      final long version,
      final NewEvent newEvent) {
    return new RecordedEvent(
        globalPosition,
        streamId,
        version,
        newEvent.eventId(),
        newEvent.eventType(),
        newEvent.schemaVersion(),
        newEvent.payload(),
        newEvent.occurredAt());
  }
}
