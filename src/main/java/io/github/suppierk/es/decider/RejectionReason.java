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
 * Enumerable reason for a {@link Decider} to reject a command.
 *
 * <p>Intended to be implemented by {@code enum}s - one per aggregate - which makes every possible
 * rejection of an aggregate visible in one place.
 */
public interface RejectionReason {
  /**
   * Satisfied by {@link Enum#name()}.
   *
   * @return stable machine-readable code of the reason
   */
  String name();

  /**
   * @return the category of this rejection
   */
  Kind kind();

  /**
   * @return human-readable description of the reason
   */
  String description();

  /** Categories of rejections. Neither of them is ever retried automatically. */
  enum Kind {
    /** Command input is malformed or missing, caller must correct it. */
    VALIDATION,
    /** Current state forbids the requested transition. */
    BUSINESS_RULE
  }
}
