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

import io.github.suppierk.es.decider.DomainCommand;

/** Commands accepted by the {@link UserDecider}. */
// @formatter:off
public sealed interface UserCommand extends DomainCommand
permits
  UserCommand.RegisterUser, UserCommand.UpdateUserProfile, UserCommand.ChangeUserEmail,
  UserCommand.DeactivateUser, UserCommand.ReactivateUser
{
// @formatter:on

  /**
   * @return identifier of the user
   */
  String userId();

  @Override
  default String aggregateId() {
    return userId();
  }

  /**
   * @param visitor to dispatch to
   * @param <R> the type of the result
   * @return the result of the visitor
   */
  <R> R accept(final Visitor<R> visitor);

  /**
   * Exhaustive dispatch over commands.
   *
   * @param <R> the type of the result
   */
  interface Visitor<R> {
    R visit(final RegisterUser command);

    R visit(final UpdateUserProfile command);

    R visit(final ChangeUserEmail command);

    R visit(final DeactivateUser command);

    R visit(final ReactivateUser command);
  }

  record RegisterUser(
      String userId, String tenantId, String email, String firstName, String lastName)
      implements UserCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record UpdateUserProfile(String userId, String firstName, String lastName, String title)
      implements UserCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record ChangeUserEmail(String userId, String email) implements UserCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record DeactivateUser(String userId) implements UserCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record ReactivateUser(String userId) implements UserCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
