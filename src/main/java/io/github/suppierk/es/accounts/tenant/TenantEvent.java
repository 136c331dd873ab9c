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

import io.github.suppierk.es.event.DomainEvent;

/** Events of the tenant aggregate. */
// @formatter:off
public sealed interface TenantEvent extends DomainEvent
permits
  TenantEvent.TenantCreated, TenantEvent.TenantUpdated,
  TenantEvent.TenantSuspended, TenantEvent.TenantActivated
{
// @formatter:on

  String tenantId();

  <R> R accept(final Visitor<R> visitor);

  /**
   * Exhaustive dispatch over events.
   *
   * @param <R> the type of the result
   */
  interface Visitor<R> {
    R visit(final TenantCreated event);

    R visit(final TenantUpdated event);

    R visit(final TenantSuspended event);

    R visit(final TenantActivated event);
  }

  record TenantCreated(String tenantId, String name, String email, String phone)
      implements TenantEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record TenantUpdated(String tenantId, String name, String email, String phone)
      implements TenantEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record TenantSuspended(String tenantId, String reason) implements TenantEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record TenantActivated(String tenantId) implements TenantEvent {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
