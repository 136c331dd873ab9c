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

package io.github.suppierk.es.store;

import io.github.suppierk.es.event.RecordedEvent;
import java.util.Set;

/**
 * Selects events for {@link EventStore#readAll(EventFilter)}.
 *
 * @param afterPosition only events with a greater global position are selected
 * @param eventTypes selected event type names, empty set selects every type
 * @param streamIdPrefix selected stream identifier prefix, {@code null} selects every stream
 * @param limit maximal amount of events to return, {@code 0} means no limit
 */
public record EventFilter(
    long afterPosition, Set<String> eventTypes, String streamIdPrefix, int limit) {
  public EventFilter {
    if (afterPosition < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }

    if (limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative");
    }

    eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
  }

  /**
   * @return a filter selecting every event
   */
  public static EventFilter all() {
    return new EventFilter(0L, Set.of(), null, 0);
  }

  /**
   * @param eventTypes to select
   * @return a filter selecting only given event types
   */
  public static EventFilter ofTypes(final Set<String> eventTypes) {
    return new EventFilter(0L, eventTypes, null, 0);
  }

  /**
   * @param streamIdPrefix to select, typically an aggregate category followed by a dash
   * @return a filter selecting only streams starting with given prefix
   */
  public static EventFilter ofStreamPrefix(final String streamIdPrefix) {
    return new EventFilter(0L, Set.of(), streamIdPrefix, 0);
  }

  /**
   * @param position to start after
   * @return a copy of this filter selecting events after given global position
   */
  public EventFilter after(final long position) {
    return new EventFilter(position, eventTypes, streamIdPrefix, limit);
  }

  /**
   * @param maxEvents to return
   * @return a copy of this filter with given limit
   */
  public EventFilter limit(final int maxEvents) {
    return new EventFilter(afterPosition, eventTypes, streamIdPrefix, maxEvents);
  }

  /**
   * Evaluates type and stream criteria, but not the position and the limit.
   *
   * @param event to verify
   * @return {@code true} if the event is selected by this filter
   */
  public boolean matches(final RecordedEvent event) {
    return (eventTypes.isEmpty() || eventTypes.contains(event.eventType()))
        && (streamIdPrefix == null || event.streamId().startsWith(streamIdPrefix));
  }
}
