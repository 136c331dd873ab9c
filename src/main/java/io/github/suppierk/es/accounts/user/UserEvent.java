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

package io.github.suppierk.es.accounts.user;

import io.github.suppierk.es.event.DomainEvent;

/** Events of the user aggregate. */
// @formatter:off
public sealed interface UserEvent extends DomainEvent
permits
  UserEvent.UserRegistered, UserEvent.UserProfileUpdated, UserEvent.UserEmailChanged,
  UserEvent.UserDeactivated, UserEvent.UserReactivated
{
// @formatter:on

  /**
   * @return identifier of the user
   */
  String userId();

  /**
   * @param visitor to dispatch to
   * @param <R> the type of the result
   * @return the result of the visitor
   */
  <R> R accept(final Visitor<R> visitor);

  /**
   * Exhaustive dispatch over events.
   *
   * @param <R> the type of the result
   */
  interface Visitor<R> {
    R visit(final UserRegistered event);

    R visit(final UserProfileUpdated event);

    R visit(final UserEmailChanged event);

    R visit(final UserDeactivated event);

    R visit(final UserReactivated event);
  }

  record UserRegistered(
      String userId, String tenantId, String email, String firstName, String lastName)
      implements UserEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record UserProfileUpdated(String userId, String firstName, String lastName, String title)
      implements UserEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record UserEmailChanged(String userId, String email) implements UserEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Carries the tenant so that tenant-level views do not need the registration event.
   *
   * @param userId identifier of the user
   * @param tenantId the user belongs to
   */
  record UserDeactivated(String userId, String tenantId) implements UserEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record UserReactivated(String userId, String tenantId) implements UserEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
