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

package io.github.suppierk.es.accounts.projection;

import io.github.suppierk.es.accounts.user.UserDecider;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.accounts.user.UserEvent.UserDeactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserEmailChanged;
import io.github.suppierk.es.accounts.user.UserEvent.UserProfileUpdated;
import io.github.suppierk.es.accounts.user.UserEvent.UserReactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserRegistered;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.projection.ConsistencyMode;
import io.github.suppierk.es.projection.Projection;
import io.github.suppierk.es.store.EventFilter;

/**
 * One {@link UserDirectoryEntry} per user stream, updated before the command returns so that a
 * user sees their own changes right away.
 */
public final class UserDirectoryProjection implements Projection<UserDirectoryEntry> {
  public static final String NAME = "user-directory";

  private static final EventFilter FILTER =
      EventFilter.ofStreamPrefix(UserDecider.CATEGORY + "-");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ConsistencyMode consistency() {
    return ConsistencyMode.IMMEDIATE;
  }

  @Override
  public EventFilter filter() {
    return FILTER;
  }

  @Override
  public String viewId(final RecordedEvent event) {
    return userEvent(event).userId();
  }

  @Override
  public UserDirectoryEntry create(final RecordedEvent event) {
    if (event.payload() instanceof UserRegistered registered) {
      return new UserDirectoryEntry(
          registered.userId(),
          registered.tenantId(),
          registered.email(),
          registered.firstName(),
          registered.lastName(),
          null,
          true);
    }

    throw new IllegalStateException(
        "User %s has no directory entry to apply %s to"
            .formatted(userEvent(event).userId(), event.eventType()));
  }

  @Override
  public UserDirectoryEntry apply(final RecordedEvent event, final UserDirectoryEntry view) {
    return userEvent(event).accept(new Applying(view));
  }

  private static UserEvent userEvent(final RecordedEvent event) {
    if (event.payload() instanceof UserEvent userEvent) {
      return userEvent;
    }

    throw new IllegalStateException(
        "Event %s of stream '%s' is not a user event".formatted(event.eventId(), event.streamId()));
  }

  private static final class Applying implements UserEvent.Visitor<UserDirectoryEntry> {
    private final UserDirectoryEntry view;

    private Applying(final UserDirectoryEntry view) {
      this.view = view;
    }

    @Override
    public UserDirectoryEntry visit(final UserRegistered event) {
      return view;
    }

    @Override
    public UserDirectoryEntry visit(final UserProfileUpdated event) {
      return new UserDirectoryEntry(
          view.userId(),
          view.tenantId(),
          view.email(),
          event.firstName(),
          event.lastName(),
          event.title(),
          view.active());
    }

    @Override
    public UserDirectoryEntry visit(final UserEmailChanged event) {
      return new UserDirectoryEntry(
          view.userId(),
          view.tenantId(),
          event.email(),
          view.firstName(),
          view.lastName(),
          view.title(),
          view.active());
    }

    @Override
    public UserDirectoryEntry visit(final UserDeactivated event) {
      return withActive(false);
    }

    @Override
    public UserDirectoryEntry visit(final UserReactivated event) {
      return withActive(true);
    }

    private UserDirectoryEntry withActive(final boolean active) {
      return new UserDirectoryEntry(
          view.userId(),
          view.tenantId(),
          view.email(),
          view.firstName(),
          view.lastName(),
          view.title(),
          active);
    }
  }
}
