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

/**
 * Searchable view of a single user.
 *
 * @param userId identifier of the user
 * @param tenantId the user belongs to
 * @param email of the user
 * @param firstName of the user
 * @param lastName of the user
 * @param title of the user, optional
 * @param active whether the user may sign in
 */
public record UserDirectoryEntry(
    String userId,
    String tenantId,
    String email,
    String firstName,
    String lastName,
    String title,
    boolean active) {

  /**
   * @return first and last name separated by a space, skipping missing parts
   */
  public String displayName() {
    if (firstName == null || firstName.isBlank()) {
      return lastName == null ? "" : lastName;
    }

    return lastName == null || lastName.isBlank() ? firstName : firstName + " " + lastName;
  }
}
