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

package io.github.suppierk.es.store;

import java.io.Serial;

/**
 * Thrown by {@link EventStore#append(String, long, java.util.List)} when the stream version
 * differs from the expected one, meaning that another writer appended to the same stream
 * concurrently.
 *
 * <p>This is an expected outcome of optimistic concurrency: the caller must reload the stream,
 * decide again and append again.
 */
public class ConcurrencyConflictException extends EventStoreException {
  @Serial private static final long serialVersionUID = 2659025212394924712L;

  private final String streamId;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * @param streamId the append was attempted on
   * @param expectedVersion provided by the writer
   * @param actualVersion of the stream at the time of the append
   */
  public ConcurrencyConflictException(
      final String streamId, final long expectedVersion, final long actualVersion) {
    super(
        "Stream '%s' is at version %d, but version %d was expected"
            .formatted(streamId, actualVersion, expectedVersion));
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String getStreamId() {
    return streamId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  public long getActualVersion() {
    return actualVersion;
  }
}
