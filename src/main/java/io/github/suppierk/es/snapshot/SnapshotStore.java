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

import java.util.Optional;

/**
 * Storage of {@link Snapshot}s for a single aggregate kind.
 *
 * @param <S> the type of state
 */
public interface SnapshotStore<S> {
  /**
   * @return an instance of store which never keeps anything
   * @param <S> the type of state
   */
  @SuppressWarnings("unchecked")
  static <S> SnapshotStore<S> none() {
    return (SnapshotStore<S>) NoOp.INSTANCE;
  }

  /**
   * @param streamId to look up
   * @return the latest snapshot of the stream, if any
   */
  Optional<Snapshot<S>> latest(final String streamId);

  /**
   * Saves the snapshot unless a snapshot of a later version is already present.
   *
   * @param snapshot to save
   */
  void save(final Snapshot<S> snapshot);

  /**
   * Drops every snapshot of the stream, e.g. after the evolve logic of the aggregate changed.
   *
   * @param streamId to drop snapshots of
   */
  void invalidate(final String streamId);

  /** Drops every snapshot. */
  void clear();

  /** Default implementation of the store which does not keep anything */
  final class NoOp implements SnapshotStore<Object> {
    private static final SnapshotStore<Object> INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public Optional<Snapshot<Object>> latest(final String streamId) {
      return Optional.empty();
    }

    @Override
    public void save(final Snapshot<Object> snapshot) {
      // Do nothing
    }

    @Override
    public void invalidate(final String streamId) {
      // Do nothing
    }

    @Override
    public void clear() {
      // Do nothing
    }
  }
}
