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

package io.github.suppierk.es.store.jooq;

import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.store.EventStore;
import java.util.List;
import org.jooq.DSLContext;

/**
 * Work done by {@link JooqEventStore} inside the append transaction, right after the events were
 * inserted, e.g. updating projection tables atomically with the events.
 *
 * <p>An exception thrown by a listener rolls the whole append back. Listeners which must not affect
 * the append have to contain their failures, e.g. in a nested transaction.
 */
@FunctionalInterface
public interface TransactionalAppendListener {
  /**
   * @param trx the append transaction
   * @param eventStore reading within the append transaction, so appended events are visible
   * @param events just appended, in order
   */
  void onAppend(
      final DSLContext trx, final EventStore eventStore, final List<RecordedEvent> events);
}
