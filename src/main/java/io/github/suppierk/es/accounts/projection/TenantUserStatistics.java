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
 * Amount of users per tenant.
 *
 * @param tenantId identifier of the tenant
 * @param activeUsers amount of active users
 * @param inactiveUsers amount of deactivated users
 */
public record TenantUserStatistics(String tenantId, long activeUsers, long inactiveUsers) {
  static TenantUserStatistics empty(final String tenantId) {
    return new TenantUserStatistics(tenantId, 0L, 0L);
  }

  public long totalUsers() {
    return activeUsers + inactiveUsers;
  }
}
