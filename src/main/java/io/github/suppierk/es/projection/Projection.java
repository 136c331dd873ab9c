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
import io.github.suppierk.es.store.EventFilter;

/**
 * Read-optimized view derived from events, independent of aggregate state.
 *
 * <p>A projection is a fold as well: views are created from the first relevant event and then
 * evolved by every following one. The same events in the same order must always produce the same
 * views, which is what makes projections rebuildable from zero - the correctness definition of a
 * projection.
 *
 * <p>All methods are expected to be pure.
 *
 * @param <V> the type of views, must be an immutable value
 */
public interface Projection<V> {
  /**
   * @return unique name of the projection
   */
  String name();

  /**
   * @return how soon the views reflect new events
   */
  ConsistencyMode consistency();

  /**
   * Projections aggregating events of more than one stream into the same view are inherently
   * eventually consistent.
   *
   * @return {@code true} if a view can be affected by events of several streams
   */
  default boolean multiStream() {
    return false;
  }

  /**
   * Position and limit of the returned filter are ignored.
   *
   * @return filter selecting relevant events
   */
  EventFilter filter();

  /**
   * @param event relevant to this projection
   * @return identifier of the view affected by the event
   */
  String viewId(final RecordedEvent event);

  /**
   * @param event first relevant event of the view
   * @return a new view
   */
  V create(final RecordedEvent event);

  /**
   * @param event relevant to this projection
   * @param view current view
   * @return a new view, the given one must not be modified
   */
  V apply(final RecordedEvent event, final V view);
}
