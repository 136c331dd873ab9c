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

package io.github.suppierk.es.command;

import io.github.suppierk.es.decider.Decider;
import io.github.suppierk.es.decider.Decision;
import io.github.suppierk.es.decider.DomainCommand;
import io.github.suppierk.es.event.DomainEvent;
import io.github.suppierk.es.event.NewEvent;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.internal.Suspicious;
import io.github.suppierk.es.projection.ProjectionEngine;
import io.github.suppierk.es.serialization.EventTypeRegistry;
import io.github.suppierk.es.snapshot.Snapshot;
import io.github.suppierk.es.snapshot.SnapshotPolicy;
import io.github.suppierk.es.snapshot.SnapshotStore;
import io.github.suppierk.es.store.AppendResult;
import io.github.suppierk.es.store.ConcurrencyConflictException;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only component which performs I/O on behalf of a {@link Decider}.
 *
 * <p>Handling a command consists of:
 *
 * <ol>
 *   <li>loading the aggregate state from the latest snapshot, if any, and the events after it;
 *   <li>deciding;
 *   <li>appending the decided events with the version the state was loaded at as the expected one;
 *   <li>reporting committed events to the projection engine and to the handlers.
 * </ol>
 *
 * <p>A concurrency conflict restarts the whole cycle from loading, at most {@link
 * RetryPolicy#maxConflictRetries()} times, after which {@link CommandResult.Conflicted} is
 * returned. Storage failures are retried with exponential backoff and then thrown.
 *
 * <p>Instances are immutable and thread-safe as long as the collaborators are.
 *
 * @param <C> the type of commands
 * @param <S> the type of state
 * @param <E> the type of events
 */
// @formatter:off
public final class CommandProcessor<
  C extends DomainCommand,
  S,
  E extends DomainEvent
> extends Suspicious {
// @formatter:on

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandProcessor.class);

  private final Decider<C, S, E> decider;
  private final EventStore eventStore;
  private final EventTypeRegistry eventTypeRegistry;
  private final RetryPolicy retryPolicy;
  private final SnapshotStore<S> snapshotStore;
  private final SnapshotPolicy snapshotPolicy;
  private final ProjectionEngine projectionEngine;
  private final List<CommittedEventHandler> handlers;
  private final Clock clock;
  private final Supplier<UUID> idSupplier;
  private final Sleeper sleeper;

  private CommandProcessor(final Builder<C, S, E> builder) {
    this.decider = builder.decider;
    this.eventStore = builder.eventStore;
    this.eventTypeRegistry = builder.eventTypeRegistry;
    this.retryPolicy = builder.retryPolicy;
    this.snapshotStore = builder.snapshotStore;
    this.snapshotPolicy = builder.snapshotPolicy;
    this.projectionEngine = builder.projectionEngine;
    this.handlers = List.copyOf(builder.handlers);
    this.clock = builder.clock;
    this.idSupplier = builder.idSupplier;
    this.sleeper = builder.sleeper;
  }

  /**
   * @param decider containing the business logic
   * @param eventStore to load and append events with
   * @param eventTypeRegistry to resolve logical event types with
   * @param <C> the type of commands
   * @param <S> the type of state
   * @param <E> the type of events
   * @return a new builder
   */
  // @formatter:off
  public static <
    C extends DomainCommand,
    S,
    E extends DomainEvent
  > Builder<C, S, E> builder(
      final Decider<C, S, E> decider,
      final EventStore eventStore,
      final EventTypeRegistry eventTypeRegistry) {
  // @formatter:on
    return new Builder<>(decider, eventStore, eventTypeRegistry);
  }

  /**
   * Loads the current state of the aggregate without deciding anything.
   *
   * @param aggregateId identifier of the aggregate instance
   * @return current state, {@link Decider#initialState()} if the aggregate has no events
   */
  public S load(final String aggregateId) {
    final String streamId = decider.streamId(throwIllegalArgumentIfBlank(aggregateId, "ID"));
    return withStorageRetries(streamId, () -> loadState(streamId)).state();
  }

  /**
   * @param command to handle
   * @return outcome of the command
   * @throws CancellationException if the current thread was interrupted before appending
   * @throws EventStoreException if the storage kept failing after all retries
   * @throws IllegalStateException if the stream of the aggregate is corrupted
   */
  public CommandResult handle(final C command) {
    final C nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final String aggregateId =
        throwIllegalArgumentIfBlank(nonNullCommand.aggregateId(), "Aggregate ID");
    final String streamId = decider.streamId(aggregateId);

    int attempt = 0;
    while (true) {
      attempt++;

      final LoadedState<S> loaded = withStorageRetries(streamId, () -> loadState(streamId));
      final Decision<E> decision =
          throwIllegalStateIfNull(decider.decide(nonNullCommand, loaded.state()), "Decision");

      if (decision instanceof Decision.Rejected<E> rejected) {
        LOGGER.debug(
            "Command {} on stream '{}' rejected: {}",
            nonNullCommand.getClass().getSimpleName(),
            streamId,
            rejected.rejection().message());
        return new CommandResult.Rejected(streamId, rejected.rejection());
      }

      final List<E> decided = ((Decision.Accepted<E>) decision).events();
      if (decided.isEmpty()) {
        LOGGER.debug(
            "Command {} on stream '{}' changed nothing",
            nonNullCommand.getClass().getSimpleName(),
            streamId);
        return new CommandResult.NoOp(streamId, loaded.version());
      }

      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException(
            "Command on stream '%s' was cancelled before appending".formatted(streamId));
      }

      final List<NewEvent> newEvents = toNewEvents(decided);

      final AppendResult result;
      try {
        result = append(streamId, loaded.version(), newEvents);
      } catch (ConcurrencyConflictException e) {
        if (attempt > retryPolicy.maxConflictRetries()) {
          LOGGER.warn(
              "Command {} on stream '{}' gave up after {} conflicting attempts",
              nonNullCommand.getClass().getSimpleName(),
              streamId,
              attempt);
          return new CommandResult.Conflicted(
              streamId, attempt, e.getExpectedVersion(), e.getActualVersion());
        }

        LOGGER.debug(
            "Stream '{}' moved from version {} to {}, retrying",
            streamId,
            e.getExpectedVersion(),
            e.getActualVersion());
        continue;
      }

      LOGGER.debug(
          "Stream '{}' advanced from version {} to {}",
          streamId,
          loaded.version(),
          result.newVersion());

      afterCommit(loaded, decided, result);
      return new CommandResult.Committed(streamId, result.newVersion(), result.events());
    }
  }

  private LoadedState<S> loadState(final String streamId) {
    S state = decider.initialState();
    long version = 0L;

    final Optional<Snapshot<S>> snapshot = latestSnapshot(streamId);
    if (snapshot.isPresent()) {
      state = snapshot.get().state();
      version = snapshot.get().version();
    }

    try (Stream<RecordedEvent> events = eventStore.readStream(streamId, version)) {
      for (RecordedEvent event : (Iterable<RecordedEvent>) events::iterator) {
        if (event.version() != version + 1) {
          throw new IllegalStateException(
              "Stream '%s' has event version %d after %d"
                  .formatted(streamId, event.version(), version));
        }

        state = decider.evolve(state, payloadOf(event));
        version = event.version();
      }
    }

    return new LoadedState<>(throwIllegalStateIfNull(state, "State"), version);
  }

  private Optional<Snapshot<S>> latestSnapshot(final String streamId) {
    try {
      return snapshotStore.latest(streamId);
    } catch (RuntimeException e) {
      LOGGER.warn("Snapshot of stream '{}' could not be loaded, replaying all events", streamId, e);
      return Optional.empty();
    }
  }

  private E payloadOf(final RecordedEvent event) {
    final DomainEvent payload = event.payload();

    if (!decider.eventClass().isInstance(payload)) {
      throw new IllegalStateException(
          "Event %s of stream '%s' is a %s, not a %s"
              .formatted(
                  event.eventId(),
                  event.streamId(),
                  payload.getClass().getName(),
                  decider.eventClass().getName()));
    }

    return decider.eventClass().cast(payload);
  }

  private List<NewEvent> toNewEvents(final List<E> decided) {
    final Instant now = clock.instant();
    final List<NewEvent> newEvents = new ArrayList<>(decided.size());

    for (E payload : decided) {
      final EventTypeRegistry.EventType type = eventTypeRegistry.typeOf(payload);
      newEvents.add(
          new NewEvent(
              throwIllegalStateIfNull(idSupplier.get(), "Event ID"),
              type.name(),
              type.schemaVersion(),
              payload,
              now));
    }

    return newEvents;
  }

  private AppendResult append(
      final String streamId, final long expectedVersion, final List<NewEvent> newEvents) {
    Duration backoff = retryPolicy.initialBackoff();
    EventStoreException lastFailure = null;

    for (int retry = 0; ; retry++) {
      try {
        return eventStore.append(streamId, expectedVersion, newEvents);
      } catch (ConcurrencyConflictException e) {
        if (lastFailure != null) {
          // The failed attempt may have been committed before the connection broke
          final Optional<AppendResult> committed =
              findCommitted(streamId, expectedVersion, newEvents);
          if (committed.isPresent()) {
            LOGGER.info("Append to stream '{}' had succeeded despite the failure", streamId);
            return committed.get();
          }
        }

        throw e;
      } catch (EventStoreException e) {
        if (retry >= retryPolicy.maxStorageRetries()) {
          throw e;
        }

        lastFailure = e;
        LOGGER.warn(
            "Append to stream '{}' failed, retrying in {} ms", streamId, backoff.toMillis(), e);
        pause(backoff, e);
        backoff = retryPolicy.nextBackoff(backoff);
      }
    }
  }

  private Optional<AppendResult> findCommitted(
      final String streamId, final long expectedVersion, final List<NewEvent> newEvents) {
    final List<RecordedEvent> appended;
    try (Stream<RecordedEvent> events = eventStore.readStream(streamId, expectedVersion)) {
      appended = events.limit(newEvents.size()).toList();
    }

    if (appended.size() != newEvents.size()) {
      return Optional.empty();
    }

    for (int i = 0; i < appended.size(); i++) {
      if (!appended.get(i).eventId().equals(newEvents.get(i).eventId())) {
        return Optional.empty();
      }
    }

    return Optional.of(new AppendResult(streamId, expectedVersion + appended.size(), appended));
  }

  private <T> T withStorageRetries(final String streamId, final Supplier<T> operation) {
    Duration backoff = retryPolicy.initialBackoff();

    for (int retry = 0; ; retry++) {
      try {
        return operation.get();
      } catch (ConcurrencyConflictException e) {
        throw e;
      } catch (EventStoreException e) {
        if (retry >= retryPolicy.maxStorageRetries()) {
          throw e;
        }

        LOGGER.warn(
            "Reading stream '{}' failed, retrying in {} ms", streamId, backoff.toMillis(), e);
        pause(backoff, e);
        backoff = retryPolicy.nextBackoff(backoff);
      }
    }
  }

  private void pause(final Duration backoff, final EventStoreException failure) {
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failure.addSuppressed(e);
      throw failure;
    }
  }

  private void afterCommit(
      final LoadedState<S> loaded, final List<E> decided, final AppendResult result) {
    if (snapshotPolicy.shouldSnapshot(loaded.version(), result.newVersion())) {
      try {
        final S state = decider.fold(loaded.state(), decided);
        snapshotStore.save(new Snapshot<>(result.streamId(), result.newVersion(), state));
      } catch (RuntimeException e) {
        LOGGER.warn(
            "Snapshot of stream '{}' at version {} could not be saved",
            result.streamId(),
            result.newVersion(),
            e);
      }
    }

    if (projectionEngine != null) {
      projectionEngine.onCommitted(result.events());
    }

    for (CommittedEventHandler handler : handlers) {
      try {
        handler.handle(result.events());
      } catch (RuntimeException e) {
        LOGGER.error(
            "Handler {} failed on {} events committed to stream '{}'",
            handler.getClass().getName(),
            result.events().size(),
            result.streamId(),
            e);
      }
    }
  }

  /**
   * State together with the version it was folded up to.
   *
   * @param state of the aggregate
   * @param version of the stream
   * @param <S> the type of state
   */
  private record LoadedState<S>(S state, long version) {}

  /**
   * Collects the configuration of a {@link CommandProcessor}.
   *
   * @param <C> the type of commands
   * @param <S> the type of state
   * @param <E> the type of events
   */
  // @formatter:off
  public static final class Builder<
    C extends DomainCommand,
    S,
    E extends DomainEvent
  > extends Suspicious {
  // @formatter:on

    private final Decider<C, S, E> decider;
    private final EventStore eventStore;
    private final EventTypeRegistry eventTypeRegistry;
    private final List<CommittedEventHandler> handlers;
    private RetryPolicy retryPolicy;
    private SnapshotStore<S> snapshotStore;
    private SnapshotPolicy snapshotPolicy;
    private ProjectionEngine projectionEngine;
    private Clock clock;
    private Supplier<UUID> idSupplier;
    private Sleeper sleeper;

    private Builder(
        final Decider<C, S, E> decider,
        final EventStore eventStore,
        final EventTypeRegistry eventTypeRegistry) {
      this.decider = throwIllegalArgumentIfNull(decider, "Decider");
      this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
      this.eventTypeRegistry = throwIllegalArgumentIfNull(eventTypeRegistry, "Event type registry");
      this.handlers = new ArrayList<>();
      this.retryPolicy = RetryPolicy.defaults();
      this.snapshotStore = SnapshotStore.none();
      this.snapshotPolicy = SnapshotPolicy.never();
      this.clock = Clock.systemUTC();
      this.idSupplier = UUID::randomUUID;
      this.sleeper = Sleeper.THREAD;
    }

    public Builder<C, S, E> retryPolicy(final RetryPolicy retryPolicy) {
      this.retryPolicy = throwIllegalArgumentIfNull(retryPolicy, "Retry policy");
      return this;
    }

    /**
     * @param snapshotStore to load and save snapshots with
     * @param snapshotPolicy deciding when to save a snapshot
     * @return this builder
     */
    public Builder<C, S, E> snapshots(
        final SnapshotStore<S> snapshotStore, final SnapshotPolicy snapshotPolicy) {
      this.snapshotStore = throwIllegalArgumentIfNull(snapshotStore, "Snapshot store");
      this.snapshotPolicy = throwIllegalArgumentIfNull(snapshotPolicy, "Snapshot policy");
      return this;
    }

    /**
     * @param projectionEngine to notify about committed events
     * @return this builder
     */
    public Builder<C, S, E> projectionEngine(final ProjectionEngine projectionEngine) {
      this.projectionEngine = throwIllegalArgumentIfNull(projectionEngine, "Projection engine");
      return this;
    }

    /**
     * @param handler to invoke with committed events, in registration order
     * @return this builder
     */
    public Builder<C, S, E> handler(final CommittedEventHandler handler) {
      handlers.add(throwIllegalArgumentIfNull(handler, "Handler"));
      return this;
    }

    public Builder<C, S, E> clock(final Clock clock) {
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
      return this;
    }

    public Builder<C, S, E> idSupplier(final Supplier<UUID> idSupplier) {
      this.idSupplier = throwIllegalArgumentIfNull(idSupplier, "ID supplier");
      return this;
    }

    public Builder<C, S, E> sleeper(final Sleeper sleeper) {
      this.sleeper = throwIllegalArgumentIfNull(sleeper, "Sleeper");
      return this;
    }

    /**
     * @return a new {@link CommandProcessor}
     */
    public CommandProcessor<C, S, E> build() {
      return new CommandProcessor<>(this);
    }
  }
}
