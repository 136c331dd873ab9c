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

package io.github.suppierk.es.projection.jooq;

import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.internal.Suspicious;
import io.github.suppierk.es.projection.ConsistencyMode;
import io.github.suppierk.es.projection.Projection;
import io.github.suppierk.es.projection.Projector;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.jooq.TransactionalAppendListener;
import java.util.ArrayList;
import java.util.List;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Updates {@link ConsistencyMode#IMMEDIATE} projections in the same transaction as the event
 * append, when registered as a listener of {@link io.github.suppierk.es.store.jooq.JooqEventStore}.
 *
 * <p>Each projection catches up in a nested transaction. A failure rolls back only that nested
 * transaction and is logged: the append still commits, the checkpoint stays before the failing
 * event and the next catch-up of a {@link io.github.suppierk.es.projection.ProjectionEngine}
 * working on the same view store retries it.
 */
public final class TransactionalProjections extends Suspicious
    implements TransactionalAppendListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(TransactionalProjections.class);

  private static final int DEFAULT_BATCH_SIZE = 500;

  private final List<Registration<?>> registrations;
  private final int batchSize;

  private TransactionalProjections(
      final List<Registration<?>> registrations, final int batchSize) {
    this.registrations = List.copyOf(registrations);
    this.batchSize = batchSize;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** {@inheritDoc} */
  @Override
  public void onAppend(
      final DSLContext trx, final EventStore eventStore, final List<RecordedEvent> events) {
    for (Registration<?> registration : registrations) {
      if (events.stream().anyMatch(registration.projection().filter()::matches)) {
        project(trx, eventStore, registration);
      }
    }
  }

  private <V> void project(
      final DSLContext trx, final EventStore eventStore, final Registration<V> registration) {
    try {
      trx.transaction(
          (final Configuration nested) ->
              new Projector<>(
                      registration.projection(), registration.viewStore().using(nested.dsl()))
                  .catchUp(eventStore, batchSize));
    } catch (RuntimeException e) {
      LOGGER.error(
          "Projection '{}' could not be updated within the append transaction",
          registration.projection().name(),
          e);
    }
  }

  private record Registration<V>(Projection<V> projection, JooqViewStore<V> viewStore) {}

  /** Collects immediately consistent projections. */
  public static final class Builder extends Suspicious {
    private final List<Registration<?>> registrations;
    private int batchSize;

    private Builder() {
      this.registrations = new ArrayList<>();
      this.batchSize = DEFAULT_BATCH_SIZE;
    }

    /**
     * @param projection to update within append transactions
     * @param viewStore to keep views of the projection in
     * @param <V> the type of views
     * @return this builder
     * @throws IllegalArgumentException if the projection is not immediately consistent or spans
     *     several streams
     */
    public <V> Builder register(
        final Projection<V> projection, final JooqViewStore<V> viewStore) {
      final Projection<V> nonNullProjection = throwIllegalArgumentIfNull(projection, "Projection");
      final JooqViewStore<V> nonNullViewStore =
          throwIllegalArgumentIfNull(viewStore, "View store");

      if (nonNullProjection.consistency() != ConsistencyMode.IMMEDIATE
          || nonNullProjection.multiStream()) {
        throw new IllegalArgumentException(
            "Projection '%s' must be immediately consistent and single-stream"
                .formatted(nonNullProjection.name()));
      }

      registrations.add(new Registration<>(nonNullProjection, nonNullViewStore));
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
     * @return a new {@link TransactionalProjections}
     */
    public TransactionalProjections build() {
      return new TransactionalProjections(registrations, batchSize);
    }
  }
}
