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
import java.io.Serial;

/**
 * Thrown when a {@link Projection} fails to apply an event.
 *
 * <p>Views and the checkpoint stay as they were right before the failing event.
 */
public class ProjectionException extends RuntimeException {
  @Serial private static final long serialVersionUID = 7302615846021955143L;

  private final String projectionName;
  private final transient RecordedEvent event;
  private final int applied;

  /**
   * @param projectionName of the failed projection
   * @param event which could not be applied
   * @param applied amount of events applied before the failure
   * @param cause of the failure
   */
  public ProjectionException(
      final String projectionName,
      final RecordedEvent event,
      final int applied,
      final Throwable cause) {
    super(
        "Projection '%s' failed to apply event %s at position %d"
            .formatted(projectionName, event.eventId(), event.globalPosition()),
        cause);
    this.projectionName = projectionName;
    this.event = event;
    this.applied = applied;
  }

  public String getProjectionName() {
    return projectionName;
  }

  public RecordedEvent getEvent() {
    return event;
  }

  public int getApplied() {
    return applied;
  }
}
