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

import io.github.suppierk.es.decider.DomainCommand;

/** Commands accepted by the {@link TenantDecider}. */
// @formatter:off
public sealed interface TenantCommand extends DomainCommand
permits
  TenantCommand.CreateTenant, TenantCommand.UpdateTenant,
  TenantCommand.SuspendTenant, TenantCommand.ActivateTenant
{
// @formatter:on

  /**
   * @return identifier of the tenant
   */
  String tenantId();

  @Override
  default String aggregateId() {
    return tenantId();
  }

  <R> R accept(final Visitor<R> visitor);

  /**
   * Exhaustive dispatch over commands.
   *
   * @param <R> the type of the result
   */
  interface Visitor<R> {
    R visit(final CreateTenant command);

    R visit(final UpdateTenant command);

    R visit(final SuspendTenant command);

    R visit(final ActivateTenant command);
  }

  /**
   * @param tenantId identifier of the new tenant
   * @param name display name
   * @param email of the owner
   * @param phone optional contact number
   */
  record CreateTenant(String tenantId, String name, String email, String phone)
      implements TenantCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record UpdateTenant(String tenantId, String name, String email, String phone)
      implements TenantCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record SuspendTenant(String tenantId, String reason) implements TenantCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record ActivateTenant(String tenantId) implements TenantCommand {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
