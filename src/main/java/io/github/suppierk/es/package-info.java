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

/**
 * Event-sourced aggregates built from pure functions and a thin imperative shell.
 *
 * <p>Here is how the parts relate to each other, using a user account as an example:
 *
 * <ul>
 *   <li>The user account is an aggregate. Everything that ever happened to it is stored as an
 *       ordered stream of {@link io.github.suppierk.es.event.DomainEvent}s in an {@link
 *       io.github.suppierk.es.store.EventStore}, under the stream {@code user-<id>}.
 *   <li>The current state is never stored: it is folded from the stream by a {@link
 *       io.github.suppierk.es.decider.Decider}, which applies one event at a time via {@code
 *       evolve}.
 *   <li>A request to change the account, like {@code DeactivateUser}, is a {@link
 *       io.github.suppierk.es.decider.DomainCommand}. The decider evaluates it against the state
 *       and returns a {@link io.github.suppierk.es.decider.Decision}:
 *       <ul>
 *         <li>events to append, like {@code UserDeactivated};
 *         <li>no events at all, when the account is already deactivated;
 *         <li>a typed {@link io.github.suppierk.es.decider.Rejection}, when the account does not
 *             exist.
 *       </ul>
 *   <li>The {@link io.github.suppierk.es.command.CommandProcessor} performs the I/O around the
 *       decider: loads the stream, appends the decided events expecting the stream version it has
 *       loaded and retries when another writer was faster.
 *   <li>Read models, like a directory of users or user counts per tenant, are {@link
 *       io.github.suppierk.es.projection.Projection}s maintained by the {@link
 *       io.github.suppierk.es.projection.ProjectionEngine}. They can always be dropped and rebuilt
 *       from the events.
 * </ul>
 */
package io.github.suppierk.es;
