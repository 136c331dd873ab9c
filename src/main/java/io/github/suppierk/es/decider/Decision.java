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
 * Outcome of a {@link Decider#decide(DomainCommand, Object)} invocation.
 *
 * <p>Validation failures and business rule violations share the same channel, no exceptions are
 * used for expected outcomes.
 *
 * @param <E> the type of events produced by the decider
 */
// @formatter:off
public sealed interface Decision<E extends DomainEvent>
permits
  Decision.Accepted, Decision.Rejected
{
// @formatter:on

  /**
   * @param events to accept the command with
   * @return a new {@link Accepted} decision
   * @param <E> the type of events
   */
  @SafeVarargs
  static <E extends DomainEvent> Decision<E> accept(final E... events) {
    return new Accepted<>(List.of(events));
  }

  /**
   * @param events to accept the command with
   * @return a new {@link Accepted} decision
   * @param <E> the type of events
   */
  static <E extends DomainEvent> Decision<E> accept(final List<? extends E> events) {
    return new Accepted<>(List.copyOf(events));
  }

  /**
   * Accepts the command without producing any events, e.g. when the requested state is already
   * reached. This is a success, not a failure.
   *
   * @return a new {@link Accepted} decision without events
   * @param <E> the type of events
   */
  static <E extends DomainEvent> Decision<E> noOp() {
    return new Accepted<>(List.of());
  }

  /**
   * @param reason to reject the command with
   * @return a new {@link Rejected} decision
   * @param <E> the type of events
   */
  static <E extends DomainEvent> Decision<E> reject(final RejectionReason reason) {
    return new Rejected<>(new Rejection(reason, null));
  }

  /**
   * @param reason to reject the command with
   * @param detail additional context
   * @return a new {@link Rejected} decision
   * @param <E> the type of events
   */
  static <E extends DomainEvent> Decision<E> reject(
      final RejectionReason reason, final String detail) {
    return new Rejected<>(new Rejection(reason, detail));
  }

  /**
   * @return {@code true} if the command was accepted
   */
  boolean isAccepted();

  /**
   * The command was accepted.
   *
   * @param events to append, possibly empty
   * @param <E> the type of events
   */
  record Accepted<E extends DomainEvent>(List<E> events) implements Decision<E> {
    public Accepted {
      if (events == null) {
        throw new IllegalArgumentException("Events cannot be null");
      }

      events = List.copyOf(events);
    }

    /**
     * @return {@code true} if nothing has to be appended
     */
    public boolean isNoOp() {
      return events.isEmpty();
    }

    @Override
    public boolean isAccepted() {
      return true;
    }
  }

  /**
   * The command was rejected.
   *
   * @param rejection describing why
   * @param <E> the type of events
   */
  record Rejected<E extends DomainEvent>(Rejection rejection) implements Decision<E> {
    public Rejected {
      if (rejection == null) {
        throw new IllegalArgumentException("Rejection cannot be null");
      }
    }

    @Override
    public boolean isAccepted() {
      return false;
    }
  }
}
