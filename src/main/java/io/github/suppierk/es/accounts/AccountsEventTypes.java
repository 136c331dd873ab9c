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

import io.github.suppierk.es.accounts.tenant.TenantEvent;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.serialization.EventTypeRegistry;

/** Logical names of the account events, as they are stored. */
public final class AccountsEventTypes {
  public static final String USER_REGISTERED = "UserRegistered";
  public static final String USER_PROFILE_UPDATED = "UserProfileUpdated";
  public static final String USER_EMAIL_CHANGED = "UserEmailChanged";
  public static final String USER_DEACTIVATED = "UserDeactivated";
  public static final String USER_REACTIVATED = "UserReactivated";

  public static final String TENANT_CREATED = "TenantCreated";
  public static final String TENANT_UPDATED = "TenantUpdated";
  public static final String TENANT_SUSPENDED = "TenantSuspended";
  public static final String TENANT_ACTIVATED = "TenantActivated";

  private AccountsEventTypes() {
    // Cannot be instantiated
  }

  /**
   * @return a new registry of user events
   */
  public static EventTypeRegistry users() {
    return EventTypeRegistry.builder()
        .register(UserEvent.UserRegistered.class, USER_REGISTERED)
        .register(UserEvent.UserProfileUpdated.class, USER_PROFILE_UPDATED)
        .register(UserEvent.UserEmailChanged.class, USER_EMAIL_CHANGED)
        .register(UserEvent.UserDeactivated.class, USER_DEACTIVATED)
        .register(UserEvent.UserReactivated.class, USER_REACTIVATED)
        .build();
  }

  /**
   * @return a new registry of tenant events
   */
  public static EventTypeRegistry tenants() {
    return EventTypeRegistry.builder()
        .register(TenantEvent.TenantCreated.class, TENANT_CREATED)
        .register(TenantEvent.TenantUpdated.class, TENANT_UPDATED)
        .register(TenantEvent.TenantSuspended.class, TENANT_SUSPENDED)
        .register(TenantEvent.TenantActivated.class, TENANT_ACTIVATED)
        .build();
  }

  /**
   * @return a new registry of all account events, to be shared by a single event store
   */
  public static EventTypeRegistry all() {
    return EventTypeRegistry.builder().include(users()).include(tenants()).build();
  }
}
