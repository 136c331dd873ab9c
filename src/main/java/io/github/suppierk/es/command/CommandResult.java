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

import io.github.suppierk.es.decider.Rejection;
import io.github.suppierk.es.event.RecordedEvent;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link CommandProcessor#handle(io.github.suppierk.es.decider.DomainCommand)}.
 *
 * <p>Storage failures which persisted after retries are not represented here, they are thrown.
 */
// @formatter:off
public sealed interface CommandResult
permits
  CommandResult.Committed, CommandResult.NoOp,
  CommandResult.Rejected, CommandResult.Conflicted
{
// @formatter:on

  /**
   * @return identifier of the stream the command targeted
   */
  String streamId();

  /**
   * @return {@code true} if the command was accepted, with or without new events
   */
  boolean isSuccess();

  /**
   * New events were appended.
   *
   * @param streamId events were appended to
   * @param version of the stream after the append
   * @param events as they were recorded
   */
  record Committed(String streamId, long version, List<RecordedEvent> events)
      implements CommandResult {
    public Committed {
      events = List.copyOf(events);
    }

    /**
     * @return identifiers of the appended events
     */
    public List<UUID> eventIds() {
      return events.stream().map(RecordedEvent::eventId).toList();
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /**
   * The command was accepted without new events, since the requested state is already reached.
   *
   * @param streamId the command targeted
   * @param version of the stream the command was decided against
   */
  record NoOp(String streamId, long version) implements CommandResult {
    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /**
   * The command was rejected, nothing was written.
   *
   * @param streamId the command targeted
   * @param rejection describing why
   */
  record Rejected(String streamId, Rejection rejection) implements CommandResult {
    @Override
    public boolean isSuccess() {
      return false;
    }
  }

  /**
   * Other writers kept appending to the stream and the retries were exhausted, nothing was
   * written. The caller may try again later.
   *
   * @param streamId the command targeted
   * @param attempts made
   * @param lastExpectedVersion expected by the last attempt
   * @param lastActualVersion found by the last attempt
   */
  record Conflicted(String streamId, int attempts, long lastExpectedVersion, long lastActualVersion)
      implements CommandResult {
    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
