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

package io.github.suppierk.es.store;

/** Well-known values for the {@code expectedVersion} argument of {@link EventStore#append}. */
public final class ExpectedVersion {
  /** The stream must not exist yet. */
  public static final long NO_STREAM = 0L;

  /** Skips the version check entirely, must not be used to append decided events. */
  public static final long ANY = -1L;

  private ExpectedVersion() {
    // No instance
  }
}
