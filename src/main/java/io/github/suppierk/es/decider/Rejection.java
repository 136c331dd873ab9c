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

package io.github.suppierk.es.decider;

/**
 * A typed rejection produced by a {@link Decider}.
 *
 * @param reason of the rejection
 * @param detail optional additional context, can be {@code null}
 */
public record Rejection(RejectionReason reason, String detail) {
  public Rejection {
    if (reason == null) {
      throw new IllegalArgumentException("Rejection reason cannot be null");
    }
  }

  /**
   * @return the category of this rejection
   */
  public RejectionReason.Kind kind() {
    return reason.kind();
  }

  /**
   * @return the description of the reason, followed by the detail if present
   */
  public String message() {
    return detail == null || detail.isBlank()
        ? reason.description()
        : "%s: %s".formatted(reason.description(), detail);
  }
}
