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

/** Declares how soon a {@link Projection} reflects newly appended events. */
public enum ConsistencyMode {
  /**
   * The projection is brought up to date by the command processor right after the append, before
   * the command result is returned. Limits throughput, only allowed for single-stream projections.
   */
  IMMEDIATE,

  /**
   * The projection is brought up to date asynchronously by the {@link ProjectionEngine}, readers
   * must tolerate staleness.
   */
  EVENTUAL
}
