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

package io.github.suppierk.es.command;

import io.github.suppierk.es.event.RecordedEvent;
import java.util.List;

/**
 * Abstract contract for an isolated side effect - a notification, an audit export - triggered by
 * committed events.
 *
 * <p>Handlers are invoked by the {@link CommandProcessor} after the events were durably appended.
 * A failing handler is logged and never turns the command into a failure, nor does it prevent
 * other handlers from being invoked. Delivery is therefore at most once: handlers which cannot
 * afford to lose events should instead follow the event store with their own checkpoint, like
 * eventual projections do.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
@FunctionalInterface
public interface CommittedEventHandler {
  /**
   * @return an instance of handler which does not perform any operations
   */
  static CommittedEventHandler empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param events committed by a single command, in append order
   */
  void handle(final List<RecordedEvent> events);

  /** Default implementation of the fake handler */
  final class NoOp implements CommittedEventHandler {
    private static final CommittedEventHandler INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void handle(final List<RecordedEvent> events) {
      // Do nothing
    }
  }
}
