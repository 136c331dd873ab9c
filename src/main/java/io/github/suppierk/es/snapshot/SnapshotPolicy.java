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
 * Decides when the command processor should take a snapshot after a successful append.
 *
 * @param frequency amount of events between snapshots, {@code 0} disables snapshots
 */
public record SnapshotPolicy(int frequency) {
  public SnapshotPolicy {
    if (frequency < 0) {
      throw new IllegalArgumentException("Snapshot frequency cannot be negative");
    }
  }

  /**
   * @return a policy which never takes snapshots
   */
  public static SnapshotPolicy never() {
    return new SnapshotPolicy(0);
  }

  /**
   * @param frequency amount of events between snapshots
   * @return a policy taking a snapshot whenever the stream version crosses a multiple of the
   *     frequency
   */
  public static SnapshotPolicy everyEvents(final int frequency) {
    if (frequency < 1) {
      throw new IllegalArgumentException("Snapshot frequency must be positive");
    }

    return new SnapshotPolicy(frequency);
  }

  /**
   * @param previousVersion of the stream before the append
   * @param newVersion of the stream after the append
   * @return {@code true} if a snapshot should be taken at {@code newVersion}
   */
  public boolean shouldSnapshot(final long previousVersion, final long newVersion) {
    return frequency > 0 && newVersion / frequency > previousVersion / frequency;
  }
}
