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

import java.util.Map;
import java.util.Optional;

/**
 * Storage of views of a single {@link Projection} along with its checkpoint - the global position
 * of the last event taken into account.
 *
 * <p>Implementations backed by a database should update a view and the checkpoint atomically.
 *
 * @param <V> the type of views
 */
public interface ViewStore<V> {
  /**
   * @param viewId to look up
   * @return the view, if present
   */
  Optional<V> find(final String viewId);

  /**
   * @return all views by their identifiers
   */
  Map<String, V> all();

  /**
   * Saves the view and moves the checkpoint to the given position.
   *
   * @param viewId of the view
   * @param view to save
   * @param position of the event which produced the view
   */
  void save(final String viewId, final V view, final long position);

  /**
   * @return global position of the last event taken into account, {@code 0} if none
   */
  long checkpoint();

  /** Drops all views and the checkpoint. */
  void reset();
}
