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

/** Health of a registered {@link Projection}. */
public enum ProjectionStatus {
  /** Last catch-up applied every available event. */
  HEALTHY,
  /** Views were dropped and events are being replayed. */
  REBUILDING,
  /** Last catch-up stopped at an event which could not be applied. */
  FAILED
}
