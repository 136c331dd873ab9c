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

package io.github.suppierk.es.projection;

import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.internal.Suspicious;
import io.github.suppierk.es.store.EventStore;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps registered {@link Projection}s up to date with the {@link EventStore}.
 *
 * <p>Every projection is maintained by catching up: reading the events selected by its filter
 * after its checkpoint in global order and folding them into its views. This single mechanism
 * serves every case:
 *
 * <ul>
 *   <li>{@link ConsistencyMode#IMMEDIATE} projections catch up inline when the command processor
 *       reports committed events via {@link #onCommitted(List)}.
 *   <li>{@link ConsistencyMode#EVENTUAL} projections catch up when {@link #catchUp()} is called,
 *       either explicitly or periodically after {@link #start(Duration)}.
 *   <li>{@link #rebuild(String)} drops the views and catches up from the very first event.
 * </ul>
 *
 * <p>A failure to apply an event is logged and leaves the checkpoint right before the failing
 * event, so the next catch-up retries it. It never affects already committed events.
 *
 * <p>The set of projections is fixed once the engine is built.
 */
public final class ProjectionEngine extends Suspicious implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectionEngine.class);

  private static final int DEFAULT_BATCH_SIZE = 500;

  private final EventStore eventStore;
  private final Map<String, Registration<?>> registrations;
  private final int batchSize;

  private ScheduledExecutorService scheduler;

  private ProjectionEngine(
      final EventStore eventStore,
      final Map<String, Registration<?>> registrations,
      final int batchSize) {
    this.eventStore = eventStore;
    this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    this.batchSize = batchSize;
  }

  /**
   * @param eventStore to read events from
   * @return a new builder
   */
  public static Builder builder(final EventStore eventStore) {
    return new Builder(eventStore);
  }

  /**
   * @return names of the registered projections, in registration order
   */
  public Set<String> projectionNames() {
    return registrations.keySet();
  }

  /**
   * @param projectionName to inspect
   * @return current status of the projection
   * @throws IllegalArgumentException if there is no such projection
   */
  public ProjectionStatus status(final String projectionName) {
    return registration(projectionName).status;
  }

  /**
   * @param projectionName to inspect
   * @return global position of the last event the projection took into account
   * @throws IllegalArgumentException if there is no such projection
   */
  public long checkpoint(final String projectionName) {
    return registration(projectionName).projector.getViewStore().checkpoint();
  }

  /**
   * Brings {@link ConsistencyMode#IMMEDIATE} projections interested in given events up to date.
   *
   * <p>Failures are logged and never propagated: events are already committed at this point.
   *
   * @param events which were just committed
   */
  public void onCommitted(final List<RecordedEvent> events) {
    final List<RecordedEvent> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");

    for (Registration<?> registration : registrations.values()) {
      if (registration.consistency() != ConsistencyMode.IMMEDIATE
          || !registration.projector.isInterestedInAny(nonNullEvents)) {
        continue;
      }

      try {
        catchUp(registration);
      } catch (RuntimeException e) {
        registration.status = ProjectionStatus.FAILED;
        LOGGER.error("Projection '{}' could not be updated immediately", registration.name(), e);
      }
    }
  }

  /**
   * Brings every registered projection up to date.
   *
   * @return amount of events applied
   */
  public int catchUp() {
    int applied = 0;
    for (Registration<?> registration : registrations.values()) {
      applied += catchUp(registration);
    }
    return applied;
  }

  /**
   * Brings one projection up to date.
   *
   * @param projectionName to catch up
   * @return amount of events applied
   * @throws IllegalArgumentException if there is no such projection
   */
  public int catchUp(final String projectionName) {
    return catchUp(registration(projectionName));
  }

  /**
   * Drops all views of the projection and replays every relevant event from the beginning.
   *
   * <p>Used to recover from corrupted views or to roll out changed projection logic.
   *
   * @param projectionName to rebuild
   * @return amount of events applied
   * @throws IllegalArgumentException if there is no such projection
   */
  public int rebuild(final String projectionName) {
    final Registration<?> registration = registration(projectionName);

    registration.lock.lock();
    try {
      LOGGER.info("Rebuilding projection '{}'", projectionName);
      registration.status = ProjectionStatus.REBUILDING;
      registration.projector.getViewStore().reset();
      final int applied = catchUp(registration);
      LOGGER.info("Projection '{}' rebuilt from {} events", projectionName, applied);
      return applied;
    } finally {
      registration.lock.unlock();
    }
  }

  /**
   * Starts catching up periodically in the background.
   *
   * @param pollInterval delay between the end of one catch-up and the start of the next one
   * @throws IllegalStateException if already started
   */
  public synchronized void start(final Duration pollInterval) {
    final Duration nonNullPollInterval = throwIllegalArgumentIfNull(pollInterval, "Poll interval");

    if (nonNullPollInterval.isNegative() || nonNullPollInterval.isZero()) {
      throw new IllegalArgumentException("Poll interval must be positive");
    }

    if (scheduler != null) {
      throw new IllegalStateException("Projection engine is already started");
    }

    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              final Thread thread = new Thread(runnable, "projection-engine");
              thread.setDaemon(true);
              return thread;
            });

    scheduler.scheduleWithFixedDelay(
        this::catchUpInBackground, 0L, nonNullPollInterval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Stops background catch-up, if started. */
  @Override
  public synchronized void close() {
    if (scheduler == null) {
      return;
    }

    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      scheduler = null;
    }
  }

  private void catchUpInBackground() {
    try {
      catchUp();
    } catch (RuntimeException e) {
      // An exception escaping here would cancel all further executions
      LOGGER.error("Background projection catch-up failed", e);
    }
  }

  private int catchUp(final Registration<?> registration) {
    registration.lock.lock();
    try {
      final int applied = registration.projector.catchUp(eventStore, batchSize);

      registration.status = ProjectionStatus.HEALTHY;
      if (applied > 0) {
        LOGGER.debug("Projection '{}' applied {} events", registration.name(), applied);
      }
      return applied;
    } catch (ProjectionException e) {
      registration.status = ProjectionStatus.FAILED;
      LOGGER.error(e.getMessage(), e.getCause());
      return e.getApplied();
    } finally {
      registration.lock.unlock();
    }
  }

  private Registration<?> registration(final String projectionName) {
    final Registration<?> registration =
        registrations.get(throwIllegalArgumentIfNull(projectionName, "Projection name"));

    if (registration == null) {
      throw new IllegalArgumentException(
          "Projection '%s' is not registered".formatted(projectionName));
    }

    return registration;
  }

  /**
   * Everything the engine keeps per projection.
   *
   * @param <V> the type of views
   */
  private static final class Registration<V> {
    private final Projector<V> projector;
    private final ReentrantLock lock;
    private volatile ProjectionStatus status;

    private Registration(final Projection<V> projection, final ViewStore<V> viewStore) {
      this.projector = new Projector<>(projection, viewStore);
      this.lock = new ReentrantLock();
      this.status = ProjectionStatus.HEALTHY;
    }

    private String name() {
      return projector.getProjection().name();
    }

    private ConsistencyMode consistency() {
      return projector.getProjection().consistency();
    }
  }

  /** Collects projections, validating them eagerly. */
  public static final class Builder extends Suspicious {
    private final EventStore eventStore;
    private final Map<String, Registration<?>> registrations;
    private int batchSize;

    private Builder(final EventStore eventStore) {
      this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
      this.registrations = new LinkedHashMap<>();
      this.batchSize = DEFAULT_BATCH_SIZE;
    }

    /**
     * @param projection to register
     * @param viewStore to keep views of the projection in
     * @param <V> the type of views
     * @return this builder
     * @throws IllegalArgumentException if a multi-stream projection requests immediate consistency
     * @throws IllegalStateException if a projection with the same name is already registered
     */
    public <V> Builder register(final Projection<V> projection, final ViewStore<V> viewStore) {
      final Projection<V> nonNullProjection = throwIllegalArgumentIfNull(projection, "Projection");
      final ViewStore<V> nonNullViewStore = throwIllegalArgumentIfNull(viewStore, "View store");
      final String name = throwIllegalStateIfNull(nonNullProjection.name(), "Projection name");

      throwIllegalStateIfNull(nonNullProjection.consistency(), "Projection consistency");
      throwIllegalStateIfNull(nonNullProjection.filter(), "Projection filter");

      if (nonNullProjection.multiStream()
          && nonNullProjection.consistency() == ConsistencyMode.IMMEDIATE) {
        throw new IllegalArgumentException(
            "Multi-stream projection '%s' must be eventually consistent".formatted(name));
      }

      if (registrations.containsKey(name)) {
        throw new IllegalStateException("Projection '%s' is already registered".formatted(name));
      }

      registrations.put(name, new Registration<>(nonNullProjection, nonNullViewStore));
      return this;
    }

    /**
     * @param size maximal amount of events read from the store at once
     * @return this builder
     */
    public Builder batchSize(final int size) {
      if (size < 1) {
        throw new IllegalArgumentException("Batch size must be positive");
      }

      this.batchSize = size;
      return this;
    }

    /**
     * @return a new {@link ProjectionEngine}
     */
    public ProjectionEngine build() {
      return new ProjectionEngine(eventStore, registrations, batchSize);
    }
  }
}
