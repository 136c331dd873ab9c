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

import io.github.suppierk.es.event.NewEvent;
import io.github.suppierk.es.event.RecordedEvent;
import java.util.List;
import java.util.stream.Stream;

/**
 * Durable, ordered, append-only storage of events grouped in streams, with optimistic
 * concurrency control.
 *
 * <p>Streams are created implicitly on the first append and are never deleted. The version of a
 * stream is the amount of events appended to it, and increases by exactly one per event.
 *
 * <p>The event store is the single shared mutable resource of the library - implementations must
 * be thread-safe and must not serialize writers of different streams behind one lock while
 * checking versions.
 */
public interface EventStore {
  /**
   * Appends events atomically: either all of them are appended, or none.
   *
   * @param streamId to append to
   * @param expectedVersion the stream must currently be at, {@link ExpectedVersion#NO_STREAM} for
   *     a new stream or {@link ExpectedVersion#ANY} to skip the check
   * @param events to append, must not be empty
   * @return the new version of the stream along with the recorded events
   * @throws IllegalArgumentException if the arguments are invalid
   * @throws ConcurrencyConflictException if the stream is not at the expected version
   * @throws EventStoreException if the underlying storage failed
   */
  AppendResult append(
      final String streamId, final long expectedVersion, final List<NewEvent> events);

  /**
   * Reads events of a single stream lazily, in append order.
   *
   * <p>The returned {@link Stream} may hold storage resources and must be closed. Calling this
   * method again restarts the read. A nonexistent stream produces an empty {@link Stream}.
   *
   * @param streamId to read
   * @param fromVersion only events with a greater version are returned, {@code 0} reads the whole
   *     stream
   * @return events of the stream
   * @throws EventStoreException if the underlying storage failed
   */
  Stream<RecordedEvent> readStream(final String streamId, final long fromVersion);

  /**
   * Same as {@link #readStream(String, long)} from the beginning of the stream.
   *
   * @param streamId to read
   * @return events of the stream
   */
  default Stream<RecordedEvent> readStream(final String streamId) {
    return readStream(streamId, 0L);
  }

  /**
   * Reads events across all streams lazily, in global append order: global positions are
   * strictly increasing, which also preserves the order within every stream.
   *
   * <p>The returned {@link Stream} may hold storage resources and must be closed.
   *
   * @param filter selecting the events
   * @return selected events
   * @throws EventStoreException if the underlying storage failed
   */
  Stream<RecordedEvent> readAll(final EventFilter filter);

  /**
   * @param streamId to inspect
   * @return current version of the stream, {@code 0} if it does not exist
   * @throws EventStoreException if the underlying storage failed
   */
  long currentVersion(final String streamId);
}
