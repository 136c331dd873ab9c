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

package io.github.suppierk.es.accounts.user;

import static io.github.suppierk.es.accounts.AccountsValidation.MAX_NAME_LENGTH;
import static io.github.suppierk.es.accounts.AccountsValidation.MAX_TITLE_LENGTH;
import static io.github.suppierk.es.accounts.AccountsValidation.fits;
import static io.github.suppierk.es.accounts.AccountsValidation.isBlank;
import static io.github.suppierk.es.accounts.AccountsValidation.isValidEmail;

import io.github.suppierk.es.accounts.user.UserCommand.ChangeUserEmail;
import io.github.suppierk.es.accounts.user.UserCommand.DeactivateUser;
import io.github.suppierk.es.accounts.user.UserCommand.ReactivateUser;
import io.github.suppierk.es.accounts.user.UserCommand.RegisterUser;
import io.github.suppierk.es.accounts.user.UserCommand.UpdateUserProfile;
import io.github.suppierk.es.accounts.user.UserEvent.UserDeactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserEmailChanged;
import io.github.suppierk.es.accounts.user.UserEvent.UserProfileUpdated;
import io.github.suppierk.es.accounts.user.UserEvent.UserReactivated;
import io.github.suppierk.es.accounts.user.UserEvent.UserRegistered;
import io.github.suppierk.es.decider.Decider;
import io.github.suppierk.es.decider.Decision;
import java.util.Objects;

/**
 * Business rules of users.
 *
 * <p>Validation of the command input comes first, then the rules depending on the state. Repeating
 * a deactivation, a reactivation or an update with the same values is accepted without events.
 */
public final class UserDecider implements Decider<UserCommand, UserState, UserEvent> {
  public static final String CATEGORY = "user";

  @Override
  public String category() {
    return CATEGORY;
  }

  @Override
  public Class<UserEvent> eventClass() {
    return UserEvent.class;
  }

  @Override
  public UserState initialState() {
    return UserState.initial();
  }

  @Override
  public Decision<UserEvent> decide(final UserCommand command, final UserState state) {
    return command.accept(new Deciding(state));
  }

  @Override
  public UserState evolve(final UserState state, final UserEvent event) {
    return event.accept(new Evolving(state));
  }

  private static final class Deciding implements UserCommand.Visitor<Decision<UserEvent>> {
    private final UserState state;

    private Deciding(final UserState state) {
      this.state = state;
    }

    @Override
    public Decision<UserEvent> visit(final RegisterUser command) {
      if (isBlank(command.tenantId())) {
        return Decision.reject(UserRejection.TENANT_REQUIRED);
      }

      if (!isValidEmail(command.email())) {
        return Decision.reject(UserRejection.EMAIL_INVALID, command.email());
      }

      if (!fits(command.firstName(), MAX_NAME_LENGTH)
          || !fits(command.lastName(), MAX_NAME_LENGTH)) {
        return Decision.reject(UserRejection.NAME_TOO_LONG);
      }

      if (state.exists()) {
        return Decision.reject(UserRejection.ALREADY_EXISTS, command.userId());
      }

      return Decision.accept(
          new UserRegistered(
              command.userId(),
              command.tenantId(),
              command.email(),
              command.firstName(),
              command.lastName()));
    }

    @Override
    public Decision<UserEvent> visit(final UpdateUserProfile command) {
      if (!fits(command.firstName(), MAX_NAME_LENGTH)
          || !fits(command.lastName(), MAX_NAME_LENGTH)) {
        return Decision.reject(UserRejection.NAME_TOO_LONG);
      }

      if (!fits(command.title(), MAX_TITLE_LENGTH)) {
        return Decision.reject(UserRejection.TITLE_TOO_LONG);
      }

      final Decision<UserEvent> precondition = requireActive(command.userId());
      if (precondition != null) {
        return precondition;
      }

      if (Objects.equals(state.firstName(), command.firstName())
          && Objects.equals(state.lastName(), command.lastName())
          && Objects.equals(state.title(), command.title())) {
        return Decision.noOp();
      }

      return Decision.accept(
          new UserProfileUpdated(
              command.userId(), command.firstName(), command.lastName(), command.title()));
    }

    @Override
    public Decision<UserEvent> visit(final ChangeUserEmail command) {
      if (!isValidEmail(command.email())) {
        return Decision.reject(UserRejection.EMAIL_INVALID, command.email());
      }

      final Decision<UserEvent> precondition = requireActive(command.userId());
      if (precondition != null) {
        return precondition;
      }

      if (command.email().equalsIgnoreCase(state.email())) {
        return Decision.noOp();
      }

      return Decision.accept(new UserEmailChanged(command.userId(), command.email()));
    }

    @Override
    public Decision<UserEvent> visit(final DeactivateUser command) {
      if (!state.exists()) {
        return Decision.reject(UserRejection.NOT_FOUND, command.userId());
      }

      if (state.status() == UserStatus.INACTIVE) {
        return Decision.noOp();
      }

      return Decision.accept(new UserDeactivated(command.userId(), state.tenantId()));
    }

    @Override
    public Decision<UserEvent> visit(final ReactivateUser command) {
      if (!state.exists()) {
        return Decision.reject(UserRejection.NOT_FOUND, command.userId());
      }

      if (state.isActive()) {
        return Decision.noOp();
      }

      return Decision.accept(new UserReactivated(command.userId(), state.tenantId()));
    }

    private Decision<UserEvent> requireActive(final String userId) {
      if (!state.exists()) {
        return Decision.reject(UserRejection.NOT_FOUND, userId);
      }

      if (!state.isActive()) {
        return Decision.reject(UserRejection.MUST_BE_ACTIVE, userId);
      }

      return null;
    }
  }

  private static final class Evolving implements UserEvent.Visitor<UserState> {
    private final UserState state;

    private Evolving(final UserState state) {
      this.state = state;
    }

    @Override
    public UserState visit(final UserRegistered event) {
      return new UserState(
          event.userId(),
          event.tenantId(),
          event.email(),
          event.firstName(),
          event.lastName(),
          null,
          UserStatus.ACTIVE);
    }

    @Override
    public UserState visit(final UserProfileUpdated event) {
      return state.withProfile(event.firstName(), event.lastName(), event.title());
    }

    @Override
    public UserState visit(final UserEmailChanged event) {
      return state.withEmail(event.email());
    }

    @Override
    public UserState visit(final UserDeactivated event) {
      return state.withStatus(UserStatus.INACTIVE);
    }

    @Override
    public UserState visit(final UserReactivated event) {
      return state.withStatus(UserStatus.ACTIVE);
    }
  }
}
