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

package io.github.suppierk.es.accounts;

import java.util.regex.Pattern;

/** Input limits shared by the account aggregates. */
public final class AccountsValidation {
  public static final int MAX_NAME_LENGTH = 30;
  public static final int MAX_TITLE_LENGTH = 50;
  public static final int MAX_EMAIL_LENGTH = 100;
  public static final int MAX_PHONE_LENGTH = 20;

  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

  private AccountsValidation() {
    // Cannot be instantiated
  }

  /**
   * @param email to verify
   * @return {@code true} if the address is well-formed and short enough
   */
  public static boolean isValidEmail(final String email) {
    return email != null && email.length() <= MAX_EMAIL_LENGTH && EMAIL.matcher(email).matches();
  }

  /**
   * @param value to verify, {@code null} counts as empty
   * @param maxLength inclusive
   * @return {@code true} if the value does not exceed the limit
   */
  public static boolean fits(final String value, final int maxLength) {
    return value == null || value.length() <= maxLength;
  }

  /**
   * @param value to verify
   * @return {@code true} if the value is {@code null} or consists of whitespace only
   */
  public static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
