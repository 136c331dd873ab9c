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

import io.github.suppierk.es.event.RecordedEvent;
import java.util.List;

/**
 * Outcome of a successful {@link EventStore#append(String, long, List)}.
 *
 * @param streamId events were appended to
 * @param newVersion of the stream after the append
 * @param events as they were recorded, in append order
 */
public record AppendResult(String streamId, long newVersion, List<RecordedEvent> events) {
  public AppendResult {
    if (events == null) {
      throw new IllegalArgumentException("Recorded events cannot be null");
    }

    events = List.copyOf(events);
  }
}
