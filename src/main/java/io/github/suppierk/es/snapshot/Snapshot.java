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

/**
 * State of an aggregate cached at a known stream version.
 *
 * <p>A snapshot at version {@code N} must be equal to the fold of the first {@code N} events of
 * the stream. Snapshots are an optimization only: they can be dropped at any time and rebuilt from
 * the events.
 *
 * @param streamId the state belongs to
 * @param version of the stream the state corresponds to
 * @param state of the aggregate
 * @param <S> the type of state
 */
public record Snapshot<S>(String streamId, long version, S state) {
  public Snapshot {
    if (streamId == null || streamId.isBlank()) {
      throw new IllegalArgumentException("Stream ID cannot be blank");
    }

    if (version < 1) {
      throw new IllegalArgumentException("Snapshot version must be positive");
    }

    if (state == null) {
      throw new IllegalArgumentException("State cannot be null");
    }
  }
}
