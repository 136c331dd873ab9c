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

import io.github.suppierk.es.event.DomainEvent;
import java.util.List;

/**
 * Pure business logic of a single aggregate kind.
 *
 * <p>The contract consists of three functions:
 *
 * <ul>
 *   <li>{@link #initialState()} - state of an aggregate which does not exist yet.
 *   <li>{@link #decide(DomainCommand, Object)} - evaluates a command against the current state.
 *   <li>{@link #evolve(Object, DomainEvent)} - applies a single event to a state.
 * </ul>
 *
 * <p>None of them may perform I/O, consult the wall clock for branching or throw for expected
 * business conditions. Only structurally corrupt events may escalate as exceptions from {@link
 * #evolve(Object, DomainEvent)}, since that indicates a data integrity bug.
 *
 * <p>Each aggregate instance is stored in its own stream, named {@code category-aggregateId}.
 *
 * @param <C> the type of commands
 * @param <S> the type of state, must be an immutable value
 * @param <E> the type of events
 */
// @formatter:off
public interface Decider<
  C extends DomainCommand,
  S,
  E extends DomainEvent
> {
// @formatter:on

  /**
   * @return stream category of the aggregate, e.g. {@code user}
   */
  String category();

  /**
   * Used to verify that the events read from a stream belong to this aggregate.
   *
   * @return the common supertype of the aggregate events
   */
  Class<E> eventClass();

  /**
   * @return the state of an aggregate before any event was applied
   */
  S initialState();

  /**
   * @param command to evaluate
   * @param state current state of the aggregate
   * @return either events to append (possibly none) or a typed rejection
   */
  Decision<E> decide(final C command, final S state);

  /**
   * @param state to evolve
   * @param event to apply
   * @return a new state, the given one must not be modified
   */
  S evolve(final S state, final E event);

  /**
   * Left-folds the events over the given state.
   *
   * @param state to start with
   * @param events to apply in order
   * @return the final state
   */
  default S fold(final S state, final List<? extends E> events) {
    S current = state;
    for (E event : events) {
      current = evolve(current, event);
    }
    return current;
  }

  /**
   * Same as {@link #fold(Object, List)} starting from the {@link #initialState()}.
   *
   * @param events to apply in order
   * @return the final state
   */
  default S fold(final List<? extends E> events) {
    return fold(initialState(), events);
  }

  /**
   * @param aggregateId identifier of the aggregate instance
   * @return identifier of the stream which stores given aggregate instance
   */
  default String streamId(final String aggregateId) {
    return category() + "-" + aggregateId;
  }
}
