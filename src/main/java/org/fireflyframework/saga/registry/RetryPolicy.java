/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.saga.registry;

import java.time.Duration;

/**
 * Retry policy of a saga step.
 * <p>
 * The delay before retry {@code n} (1-based, i.e. after the n-th failure) is
 * {@code min(backoffMs * backoffMultiplier^(n-1), maxBackoffMs)}.
 *
 * @param maxAttempts total number of attempts, the first one included
 * @param backoffMs delay before the first retry
 * @param maxBackoffMs cap applied to every computed delay
 * @param backoffMultiplier growth factor between consecutive retries
 */
public record RetryPolicy(
        int maxAttempts,
        long backoffMs,
        long maxBackoffMs,
        double backoffMultiplier
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoffMs must be >= 0 but was " + backoffMs);
        }
        if (maxBackoffMs < backoffMs) {
            throw new IllegalArgumentException("maxBackoffMs (" + maxBackoffMs + ") must be >= backoffMs (" + backoffMs + ")");
        }
        if (backoffMultiplier < 1.0d) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1 but was " + backoffMultiplier);
        }
    }

    /** A single attempt, no retries. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, 1.0d);
    }

    /** Fixed delay between attempts. */
    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay.toMillis(), delay.toMillis(), 1.0d);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
        return new RetryPolicy(maxAttempts, initialBackoff.toMillis(), maxBackoff.toMillis(), multiplier);
    }

    /**
     * Computes the backoff in milliseconds for the given failure count.
     * Counts below 1 are treated as the first retry.
     */
    public long delayForRetry(int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        double raw = backoffMs * Math.pow(backoffMultiplier, exponent);
        if (raw >= maxBackoffMs) {
            return maxBackoffMs;
        }
        return (long) raw;
    }

    /**
     * Checks if another attempt is permitted after {@code retryCount} failures.
     */
    public boolean allowsRetry(int retryCount) {
        return retryCount < maxAttempts;
    }
}
