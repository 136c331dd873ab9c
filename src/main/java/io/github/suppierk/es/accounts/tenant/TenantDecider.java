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

import static io.github.suppierk.es.accounts.AccountsValidation.MAX_NAME_LENGTH;
import static io.github.suppierk.es.accounts.AccountsValidation.MAX_PHONE_LENGTH;
import static io.github.suppierk.es.accounts.AccountsValidation.fits;
import static io.github.suppierk.es.accounts.AccountsValidation.isBlank;
import static io.github.suppierk.es.accounts.AccountsValidation.isValidEmail;

import io.github.suppierk.es.accounts.tenant.TenantCommand.ActivateTenant;
import io.github.suppierk.es.accounts.tenant.TenantCommand.CreateTenant;
import io.github.suppierk.es.accounts.tenant.TenantCommand.SuspendTenant;
import io.github.suppierk.es.accounts.tenant.TenantCommand.UpdateTenant;
import io.github.suppierk.es.accounts.tenant.TenantEvent.TenantActivated;
import io.github.suppierk.es.accounts.tenant.TenantEvent.TenantCreated;
import io.github.suppierk.es.accounts.tenant.TenantEvent.TenantSuspended;
import io.github.suppierk.es.accounts.tenant.TenantEvent.TenantUpdated;
import io.github.suppierk.es.decider.Decider;
import io.github.suppierk.es.decider.Decision;
import io.github.suppierk.es.decider.RejectionReason;
import java.util.Objects;

/**
 * Business rules of tenants.
 *
 * <p>A tenant starts in {@link TenantStatus#TRIAL}, activation moves it to {@link
 * TenantStatus#ACTIVE}, suspension blocks updates until the next activation.
 */
public final class TenantDecider implements Decider<TenantCommand, TenantState, TenantEvent> {
  public static final String CATEGORY = "tenant";

  @Override
  public String category() {
    return CATEGORY;
  }

  @Override
  public Class<TenantEvent> eventClass() {
    return TenantEvent.class;
  }

  @Override
  public TenantState initialState() {
    return TenantState.initial();
  }

  @Override
  public Decision<TenantEvent> decide(final TenantCommand command, final TenantState state) {
    return command.accept(new Deciding(state));
  }

  @Override
  public TenantState evolve(final TenantState state, final TenantEvent event) {
    return event.accept(new Evolving(state));
  }

  private static RejectionReason validateDetails(
      final String name, final String email, final String phone) {
    if (isBlank(name)) {
      return TenantRejection.NAME_REQUIRED;
    }

    if (!fits(name, MAX_NAME_LENGTH)) {
      return TenantRejection.NAME_TOO_LONG;
    }

    if (!isValidEmail(email)) {
      return TenantRejection.EMAIL_INVALID;
    }

    if (!fits(phone, MAX_PHONE_LENGTH)) {
      return TenantRejection.PHONE_TOO_LONG;
    }

    return null;
  }

  private static final class Deciding implements TenantCommand.Visitor<Decision<TenantEvent>> {
    private final TenantState state;

    private Deciding(final TenantState state) {
      this.state = state;
    }

    @Override
    public Decision<TenantEvent> visit(final CreateTenant command) {
      final RejectionReason invalid =
          validateDetails(command.name(), command.email(), command.phone());
      if (invalid != null) {
        return Decision.reject(invalid);
      }

      if (state.exists()) {
        return Decision.reject(TenantRejection.ALREADY_EXISTS, command.tenantId());
      }

      return Decision.accept(
          new TenantCreated(command.tenantId(), command.name(), command.email(), command.phone()));
    }

    @Override
    public Decision<TenantEvent> visit(final UpdateTenant command) {
      final RejectionReason invalid =
          validateDetails(command.name(), command.email(), command.phone());
      if (invalid != null) {
        return Decision.reject(invalid);
      }

      if (!state.exists()) {
        return Decision.reject(TenantRejection.NOT_FOUND, command.tenantId());
      }

      if (state.status() == TenantStatus.SUSPENDED) {
        return Decision.reject(TenantRejection.SUSPENDED, command.tenantId());
      }

      if (Objects.equals(state.name(), command.name())
          && command.email().equalsIgnoreCase(state.email())
          && Objects.equals(state.phone(), command.phone())) {
        return Decision.noOp();
      }

      return Decision.accept(
          new TenantUpdated(command.tenantId(), command.name(), command.email(), command.phone()));
    }

    @Override
    public Decision<TenantEvent> visit(final SuspendTenant command) {
      if (isBlank(command.reason())) {
        return Decision.reject(TenantRejection.REASON_REQUIRED);
      }

      if (!state.exists()) {
        return Decision.reject(TenantRejection.NOT_FOUND, command.tenantId());
      }

      if (state.status() == TenantStatus.SUSPENDED) {
        return Decision.noOp();
      }

      return Decision.accept(new TenantSuspended(command.tenantId(), command.reason()));
    }

    @Override
    public Decision<TenantEvent> visit(final ActivateTenant command) {
      if (!state.exists()) {
        return Decision.reject(TenantRejection.NOT_FOUND, command.tenantId());
      }

      if (state.status() == TenantStatus.ACTIVE) {
        return Decision.noOp();
      }

      return Decision.accept(new TenantActivated(command.tenantId()));
    }
  }

  private static final class Evolving implements TenantEvent.Visitor<TenantState> {
    private final TenantState state;

    private Evolving(final TenantState state) {
      this.state = state;
    }

    @Override
    public TenantState visit(final TenantCreated event) {
      return new TenantState(
          event.tenantId(), event.name(), event.email(), event.phone(), null, TenantStatus.TRIAL);
    }

    @Override
    public TenantState visit(final TenantUpdated event) {
      return new TenantState(
          state.tenantId(),
          event.name(),
          event.email(),
          event.phone(),
          state.suspensionReason(),
          state.status());
    }

    @Override
    public TenantState visit(final TenantSuspended event) {
      return new TenantState(
          state.tenantId(),
          state.name(),
          state.email(),
          state.phone(),
          event.reason(),
          TenantStatus.SUSPENDED);
    }

    @Override
    public TenantState visit(final TenantActivated event) {
      return new TenantState(
          state.tenantId(), state.name(), state.email(), state.phone(), null, TenantStatus.ACTIVE);
    }
  }
}
