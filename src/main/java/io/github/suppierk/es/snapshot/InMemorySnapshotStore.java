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

package io.github.suppierk.es.snapshot;

import io.github.suppierk.es.internal.Suspicious;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link SnapshotStore} keeping the latest snapshot of every stream in memory.
 *
 * @param <S> the type of state
 */
public final class InMemorySnapshotStore<S> extends Suspicious implements SnapshotStore<S> {
  private final ConcurrentMap<String, Snapshot<S>> snapshots;

  public InMemorySnapshotStore() {
    this.snapshots = new ConcurrentHashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Snapshot<S>> latest(final String streamId) {
    return Optional.ofNullable(snapshots.get(throwIllegalArgumentIfNull(streamId, "Stream ID")));
  }

  /** {@inheritDoc} */
  @Override
  public void save(final Snapshot<S> snapshot) {
    final Snapshot<S> nonNullSnapshot = throwIllegalArgumentIfNull(snapshot, "Snapshot");

    snapshots.merge(
        nonNullSnapshot.streamId(),
        nonNullSnapshot,
        (existing, candidate) -> candidate.version() > existing.version() ? candidate : existing);
  }

  /** {@inheritDoc} */
  @Override
  public void invalidate(final String streamId) {
    snapshots.remove(throwIllegalArgumentIfNull(streamId, "Stream ID"));
  }

  /** {@inheritDoc} */
  @Override
  public void clear() {
    snapshots.clear();
  }
}
