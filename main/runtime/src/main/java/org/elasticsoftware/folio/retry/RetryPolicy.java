/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.folio.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff, doubling from {@code initialBackoff} up to {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
    }

    public static RetryPolicy withoutBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO);
    }

    /**
     * The pause after the given failed attempt, counting from 1.
     */
    public Duration backoff(int attempt) {
        if (attempt < 1 || initialBackoff.isZero()) {
            return Duration.ZERO;
        }
        Duration delay = initialBackoff;
        for (int i = 1; i < attempt && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public boolean hasAttemptsLeft(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Sleeps for {@link #backoff(int)}. An interrupt restores the flag and ends the retry loop.
     */
    public void pause(int attempt, String domain, String aggregateId, Throwable lastFailure) {
        Duration delay = backoff(attempt);
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            RetriesExhaustedException exhausted = new RetriesExhaustedException(domain, aggregateId, attempt, lastFailure);
            exhausted.addSuppressed(e);
            throw exhausted;
        }
    }
}
