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

import io.github.suppierk.es.internal.Suspicious;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ViewStore} keeping views in memory.
 *
 * @param <V> the type of views
 */
public final class InMemoryViewStore<V> extends Suspicious implements ViewStore<V> {
  private final Map<String, V> views;
  private long checkpoint;

  public InMemoryViewStore() {
    this.views = new LinkedHashMap<>();
    this.checkpoint = 0L;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<V> find(final String viewId) {
    return Optional.ofNullable(views.get(throwIllegalArgumentIfNull(viewId, "View ID")));
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Map<String, V> all() {
    return Map.copyOf(views);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void save(final String viewId, final V view, final long position) {
    final String nonNullViewId = throwIllegalArgumentIfNull(viewId, "View ID");
    final V nonNullView = throwIllegalArgumentIfNull(view, "View");

    if (position <= checkpoint) {
      throw new IllegalArgumentException(
          "Position %d is not after checkpoint %d".formatted(position, checkpoint));
    }

    views.put(nonNullViewId, nonNullView);
    checkpoint = position;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized long checkpoint() {
    return checkpoint;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void reset() {
    views.clear();
    checkpoint = 0L;
  }
}
