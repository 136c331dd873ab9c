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

package io.github.suppierk.es.command;

import java.time.Duration;

/** Waits between retries, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {
  /** Blocks the current thread. */
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  /**
   * @param duration to wait for
   * @throws InterruptedException if the waiting thread was interrupted
   */
  void sleep(final Duration duration) throws InterruptedException;
}
