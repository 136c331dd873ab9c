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

package io.github.suppierk.es.serialization;

import java.io.Serial;

/**
 * Thrown when an event type is not registered within an {@link EventTypeRegistry}.
 *
 * <p>Unknown event types are rejected at the schema layer, which is why aggregates never have to
 * deal with them: reading a stream containing an unknown event type indicates a deployment or data
 * integrity problem.
 */
public class UnknownEventTypeException extends RuntimeException {
  @Serial private static final long serialVersionUID = 5307946117294651372L;

  /**
   * Constructs a new runtime exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public UnknownEventTypeException(String message) {
    super(message);
  }

  /**
   * Constructs a new runtime exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public UnknownEventTypeException(String message, Throwable cause) {
    super(message, cause);
  }
}
