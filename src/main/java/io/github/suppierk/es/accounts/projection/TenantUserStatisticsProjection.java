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

import io.github.suppierk.es.accounts.AccountsEventTypes;
import io.github.suppierk.es.accounts.user.UserEvent;
import io.github.suppierk.es.accounts.user.UserEvent.UserDeactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserEmailChanged;
import io.github.suppierk.es.accounts.user.UserEvent.UserProfileUpdated;
import io.github.suppierk.es.accounts.user.UserEvent.UserReactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserRegistered;
import io.github.suppierk.es.event.RecordedEvent;
import io.github.suppierk.es.projection.ConsistencyMode;
import io.github.suppierk.es.projection.Projection;
import io.github.suppierk.es.store.EventFilter;
import java.util.Set;

/** Counts the users of every tenant across all user streams. */
public final class TenantUserStatisticsProjection implements Projection<TenantUserStatistics> {
  public static final String NAME = "tenant-user-statistics";

  private static final EventFilter FILTER =
      EventFilter.ofTypes(
          Set.of(
              AccountsEventTypes.USER_REGISTERED,
              AccountsEventTypes.USER_DEACTIVATED,
              AccountsEventTypes.USER_REACTIVATED));

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ConsistencyMode consistency() {
    return ConsistencyMode.EVENTUAL;
  }

  @Override
  public boolean multiStream() {
    return true;
  }

  @Override
  public EventFilter filter() {
    return FILTER;
  }

  @Override
  public String viewId(final RecordedEvent event) {
    return userEvent(event).accept(TenantOf.INSTANCE);
  }

  @Override
  public TenantUserStatistics create(final RecordedEvent event) {
    return apply(event, TenantUserStatistics.empty(viewId(event)));
  }

  @Override
  public TenantUserStatistics apply(final RecordedEvent event, final TenantUserStatistics view) {
    return userEvent(event).accept(new Counting(view));
  }

  private static UserEvent userEvent(final RecordedEvent event) {
    if (event.payload() instanceof UserEvent userEvent) {
      return userEvent;
    }

    throw new IllegalStateException(
        "Event %s of stream '%s' is not a user event".formatted(event.eventId(), event.streamId()));
  }

  private static IllegalStateException notCounted(final UserEvent event) {
    return new IllegalStateException(
        "%s of user %s cannot be counted"
            .formatted(event.getClass().getSimpleName(), event.userId()));
  }

  private static final class TenantOf implements UserEvent.Visitor<String> {
    private static final TenantOf INSTANCE = new TenantOf();

    @Override
    public String visit(final UserRegistered event) {
      return event.tenantId();
    }

    @Override
    public String visit(final UserProfileUpdated event) {
      throw notCounted(event);
    }

    @Override
    public String visit(final UserEmailChanged event) {
      throw notCounted(event);
    }

    @Override
    public String visit(final UserDeactivated event) {
      return event.tenantId();
    }

    @Override
    public String visit(final UserReactivated event) {
      return event.tenantId();
    }
  }

  private static final class Counting implements UserEvent.Visitor<TenantUserStatistics> {
    private final TenantUserStatistics view;

    private Counting(final TenantUserStatistics view) {
      this.view = view;
    }

    @Override
    public TenantUserStatistics visit(final UserRegistered event) {
      return new TenantUserStatistics(
          view.tenantId(), view.activeUsers() + 1, view.inactiveUsers());
    }

    @Override
    public TenantUserStatistics visit(final UserProfileUpdated event) {
      throw notCounted(event);
    }

    @Override
    public TenantUserStatistics visit(final UserEmailChanged event) {
      throw notCounted(event);
    }

    @Override
    public TenantUserStatistics visit(final UserDeactivated event) {
      return new TenantUserStatistics(
          view.tenantId(), view.activeUsers() - 1, view.inactiveUsers() + 1);
    }

    @Override
    public TenantUserStatistics visit(final UserReactivated event) {
      return new TenantUserStatistics(
          view.tenantId(), view.activeUsers() + 1, view.inactiveUsers() - 1);
    }
  }
}
