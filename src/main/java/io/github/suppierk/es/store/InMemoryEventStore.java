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
import io.github.suppierk.es.internal.Suspicious;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * {@link EventStore} keeping all events in memory, suitable for tests and single-process setups.
 *
 * <p>Version checks are guarded by a lock per stream, so writers of different streams never
 * contend on them. Assigning global positions takes a short global lock, which keeps the global
 * log free of gaps: a reader of {@link #readAll(EventFilter)} never observes position {@code N+1}
 * before position {@code N}.
 */
public final class InMemoryEventStore extends Suspicious implements EventStore {
  private final ConcurrentMap<String, List<RecordedEvent>> streams;
  private final List<RecordedEvent> globalLog;
  private final ReadWriteLock globalLock;

  public InMemoryEventStore() {
    this.streams = new ConcurrentHashMap<>();
    this.globalLog = new ArrayList<>();
    this.globalLock = new ReentrantReadWriteLock();
  }

  /** {@inheritDoc} */
  @Override
  public AppendResult append(
      final String streamId, final long expectedVersion, final List<NewEvent> events) {
    final String nonBlankStreamId = throwIllegalArgumentIfBlank(streamId, "Stream ID");
    final List<NewEvent> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");

    if (nonNullEvents.isEmpty()) {
      throw new IllegalArgumentException("Events cannot be empty");
    }

    if (expectedVersion < ExpectedVersion.ANY) {
      throw new IllegalArgumentException(
          "Expected version %d is invalid".formatted(expectedVersion));
    }

    final List<RecordedEvent> stream =
        streams.computeIfAbsent(nonBlankStreamId, ignored -> new ArrayList<>());

    synchronized (stream) {
      final long currentVersion = stream.size();

      if (expectedVersion != ExpectedVersion.ANY && expectedVersion != currentVersion) {
        throw new ConcurrencyConflictException(nonBlankStreamId, expectedVersion, currentVersion);
      }

      final List<RecordedEvent> recorded = new ArrayList<>(nonNullEvents.size());

      globalLock.writeLock().lock();
      try {
        long version = currentVersion;
        for (NewEvent event : nonNullEvents) {
          throwIllegalArgumentIfNull(event, "Event");
          version++;
          final long position = globalLog.size() + recorded.size() + 1L;
          recorded.add(RecordedEvent.of(position, nonBlankStreamId, version, event));
        }

        globalLog.addAll(recorded);
        stream.addAll(recorded);
      } finally {
        globalLock.writeLock().unlock();
      }

      return new AppendResult(nonBlankStreamId, stream.size(), recorded);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Stream<RecordedEvent> readStream(final String streamId, final long fromVersion) {
    final String nonBlankStreamId = throwIllegalArgumentIfBlank(streamId, "Stream ID");

    if (fromVersion < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    final List<RecordedEvent> stream = streams.get(nonBlankStreamId);
    if (stream == null) {
      return Stream.empty();
    }

    final List<RecordedEvent> copy;
    synchronized (stream) {
      copy =
          fromVersion >= stream.size()
              ? List.of()
              : List.copyOf(stream.subList((int) fromVersion, stream.size()));
    }

    return copy.stream();
  }

  /** {@inheritDoc} */
  @Override
  public Stream<RecordedEvent> readAll(final EventFilter filter) {
    final EventFilter nonNullFilter = throwIllegalArgumentIfNull(filter, "Filter");

    final List<RecordedEvent> copy;
    globalLock.readLock().lock();
    try {
      // Positions are gap-free and start from 1, so the position doubles as an index
      final long from = Math.min(nonNullFilter.afterPosition(), globalLog.size());
      copy = List.copyOf(globalLog.subList((int) from, globalLog.size()));
    } finally {
      globalLock.readLock().unlock();
    }

    final Stream<RecordedEvent> selected = copy.stream().filter(nonNullFilter::matches);
    return nonNullFilter.limit() > 0 ? selected.limit(nonNullFilter.limit()) : selected;
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    final List<RecordedEvent> stream =
        streams.get(throwIllegalArgumentIfBlank(streamId, "Stream ID"));
    if (stream == null) {
      return 0L;
    }

    synchronized (stream) {
      return stream.size();
    }
  }
}
