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
 * Represents an immutable intent to change the state of a single aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s, grouped under one
 * {@code sealed} interface per aggregate.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Deactivate User' instead of 'Set
 * User status to INACTIVE'.
 *
 * <p>Commands are never persisted: they live only for the duration of a single {@link
 * Decider#decide(DomainCommand, Object)} invocation, everything worth remembering must be
 * captured by the events they produce.
 */
public interface DomainCommand {
  /**
   * @return identifier of the aggregate instance this command targets
   */
  String aggregateId();
}
