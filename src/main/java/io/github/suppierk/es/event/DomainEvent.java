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

package io.github.suppierk.es.event;

/**
 * Represents an immutable fact which already happened within a single aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s, grouped under one
 * {@code sealed} interface per aggregate, so that the aggregate's {@code evolve} function can be
 * exhaustive over its own events.
 *
 * <p>Events are named in the past tense - e.g. 'User Registered' instead of 'Register User'.
 * Payloads are serialized to JSON when stored by a durable event store, therefore they must
 * consist of plain values only.
 */
public interface DomainEvent {}
