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
import io.github.suppierk.es.store.EventFilter;
import io.github.suppierk.es.store.EventStore;
import java.util.List;
import java.util.stream.Stream;

/**
 * Folds events of an {@link EventStore} into the views of one {@link Projection}.
 *
 * <p>Not thread-safe: callers make sure a single projector works on a view store at a time.
 *
 * @param <V> the type of views
 */
public final class Projector<V> extends Suspicious {
  private final Projection<V> projection;
  private final ViewStore<V> viewStore;

  /**
   * @param projection to apply
   * @param viewStore to keep the views in
   */
  public Projector(final Projection<V> projection, final ViewStore<V> viewStore) {
    this.projection = throwIllegalArgumentIfNull(projection, "Projection");
    this.viewStore = throwIllegalArgumentIfNull(viewStore, "View store");
  }

  public Projection<V> getProjection() {
    return projection;
  }

  public ViewStore<V> getViewStore() {
    return viewStore;
  }

  /**
   * @param events to check
   * @return {@code true} if any of the events is relevant to the projection
   */
  public boolean isInterestedInAny(final List<RecordedEvent> events) {
    final EventFilter filter = projection.filter();
    return throwIllegalArgumentIfNull(events, "Events").stream().anyMatch(filter::matches);
  }

  /**
   * Applies every relevant event after the checkpoint, in global order.
   *
   * @param eventStore to read events from
   * @param batchSize maximal amount of events read at once
   * @return amount of events applied
   * @throws ProjectionException if an event could not be applied
   */
  public int catchUp(final EventStore eventStore, final int batchSize) {
    final EventStore nonNullEventStore = throwIllegalArgumentIfNull(eventStore, "Event store");

    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive");
    }

    int applied = 0;

    while (true) {
      final EventFilter filter =
          projection.filter().after(viewStore.checkpoint()).limit(batchSize);

      final List<RecordedEvent> batch;
      try (Stream<RecordedEvent> events = nonNullEventStore.readAll(filter)) {
        batch = events.toList();
      }

      for (RecordedEvent event : batch) {
        try {
          apply(event);
        } catch (RuntimeException e) {
          throw new ProjectionException(projection.name(), event, applied, e);
        }
        applied++;
      }

      if (batch.size() < batchSize) {
        return applied;
      }
    }
  }

  private void apply(final RecordedEvent event) {
    if (event.globalPosition() <= viewStore.checkpoint()) {
      return;
    }

    final String viewId = throwIllegalStateIfNull(projection.viewId(event), "View ID");
    final V view =
        viewStore
            .find(viewId)
            .map(current -> projection.apply(event, current))
            .orElseGet(() -> projection.create(event));

    viewStore.save(viewId, throwIllegalStateIfNull(view, "Projected view"), event.globalPosition());
  }
}
