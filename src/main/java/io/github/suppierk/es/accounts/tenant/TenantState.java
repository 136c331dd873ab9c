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

/**
 * Current state of a tenant, as folded from its events.
 *
 * @param tenantId identifier, {@code null} until created
 * @param name display name
 * @param email of the owner
 * @param phone optional contact number
 * @param suspensionReason set while suspended
 * @param status lifecycle status
 */
public record TenantState(
    String tenantId,
    String name,
    String email,
    String phone,
    String suspensionReason,
    TenantStatus status) {
  private static final TenantState INITIAL =
      new TenantState(null, null, null, null, null, TenantStatus.NOT_EXISTS);

  public static TenantState initial() {
    return INITIAL;
  }

  public boolean exists() {
    return status != TenantStatus.NOT_EXISTS;
  }
}
