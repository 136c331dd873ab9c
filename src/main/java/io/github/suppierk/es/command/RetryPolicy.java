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

/**
 * Bounds of the retries performed by the {@link CommandProcessor}.
 *
 * @param maxConflictRetries how many times a command is re-decided after a concurrency conflict
 *     before the conflict is reported to the caller
 * @param maxStorageRetries how many times a failed storage operation is repeated before the
 *     failure is reported to the caller
 * @param initialBackoff delay before the first storage retry
 * @param backoffMultiplier applied to the delay after every storage retry
 * @param maxBackoff upper bound of the delay
 */
public record RetryPolicy(
    int maxConflictRetries,
    int maxStorageRetries,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff) {
  public RetryPolicy {
    if (maxConflictRetries < 0 || maxStorageRetries < 0) {
      throw new IllegalArgumentException("Retry counts cannot be negative");
    }

    if (initialBackoff == null || initialBackoff.isNegative()) {
      throw new IllegalArgumentException("Initial backoff cannot be null or negative");
    }

    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("Maximal backoff cannot be less than the initial one");
    }

    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("Backoff multiplier cannot be less than 1");
    }
  }

  /**
   * Three conflict retries, three storage retries starting at 50 milliseconds, doubling up to one
   * second.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(3, 3, Duration.ofMillis(50), 2.0, Duration.ofSeconds(1));
  }

  /**
   * @return a policy which never retries
   */
  public static RetryPolicy none() {
    return new RetryPolicy(0, 0, Duration.ZERO, 1.0, Duration.ZERO);
  }

  /**
   * @param maxRetries how many times a command is re-decided after a concurrency conflict
   * @return a copy of this policy
   */
  public RetryPolicy withMaxConflictRetries(final int maxRetries) {
    return new RetryPolicy(
        maxRetries, maxStorageRetries, initialBackoff, backoffMultiplier, maxBackoff);
  }

  /**
   * @param maxRetries how many times a failed storage operation is repeated
   * @return a copy of this policy
   */
  public RetryPolicy withMaxStorageRetries(final int maxRetries) {
    return new RetryPolicy(
        maxConflictRetries, maxRetries, initialBackoff, backoffMultiplier, maxBackoff);
  }

  /**
   * @param currentBackoff delay used for the last retry
   * @return delay to use for the next retry
   */
  public Duration nextBackoff(final Duration currentBackoff) {
    final long nextMillis = (long) (currentBackoff.toMillis() * backoffMultiplier);
    final Duration next = Duration.ofMillis(nextMillis);
    return next.compareTo(maxBackoff) > 0 ? maxBackoff : next;
  }
}
