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

/**
 * Current state of a user, as folded from its events.
 *
 * @param userId identifier, {@code null} until registered
 * @param tenantId the user belongs to
 * @param email of the user
 * @param firstName of the user
 * @param lastName of the user
 * @param title of the user, optional
 * @param status lifecycle status
 */
public record UserState(
    String userId,
    String tenantId,
    String email,
    String firstName,
    String lastName,
    String title,
    UserStatus status) {
  private static final UserState INITIAL =
      new UserState(null, null, null, null, null, null, UserStatus.NOT_EXISTS);

  /**
   * @return state of a user which was never registered
   */
  public static UserState initial() {
    return INITIAL;
  }

  public boolean exists() {
    return status != UserStatus.NOT_EXISTS;
  }

  public boolean isActive() {
    return status == UserStatus.ACTIVE;
  }

  UserState withProfile(final String firstName, final String lastName, final String title) {
    return new UserState(userId, tenantId, email, firstName, lastName, title, status);
  }

  UserState withEmail(final String email) {
    return new UserState(userId, tenantId, email, firstName, lastName, title, status);
  }

  UserState withStatus(final UserStatus status) {
    return new UserState(userId, tenantId, email, firstName, lastName, title, status);
  }
}
