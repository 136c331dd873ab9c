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

package io.github.suppierk.es.accounts.tenant;

import io.github.suppierk.es.decider.RejectionReason;

/** Reasons to reject a {@link TenantCommand}. */
public enum TenantRejection implements RejectionReason {
  NAME_REQUIRED(Kind.VALIDATION, "name is required"),
  NAME_TOO_LONG(Kind.VALIDATION, "name is too long"),
  PHONE_TOO_LONG(Kind.VALIDATION, "phone is too long"),
  EMAIL_INVALID(Kind.VALIDATION, "email is invalid"),
  REASON_REQUIRED(Kind.VALIDATION, "suspension reason is required"),
  ALREADY_EXISTS(Kind.BUSINESS_RULE, "already exists"),
  NOT_FOUND(Kind.BUSINESS_RULE, "not found"),
  SUSPENDED(Kind.BUSINESS_RULE, "is suspended");

  private final Kind kind;
  private final String description;

  TenantRejection(final Kind kind, final String description) {
    this.kind = kind;
    this.description = description;
  }

  @Override
  public Kind kind() {
    return kind;
  }

  @Override
  public String description() {
    return description;
  }
}
