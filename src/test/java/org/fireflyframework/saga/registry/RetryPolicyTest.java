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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void backoffGrowsAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(5, 100, 1000, 2.0);

        assertEquals(100, policy.delayForRetry(1));
        assertEquals(200, policy.delayForRetry(2));
        assertEquals(400, policy.delayForRetry(3));
        assertEquals(800, policy.delayForRetry(4));
        assertEquals(1000, policy.delayForRetry(5));
        assertEquals(1000, policy.delayForRetry(30));
    }

    @Test
    void countsBelowOneUseTheInitialBackoff() {
        RetryPolicy policy = new RetryPolicy(3, 250, 1000, 3.0);

        assertEquals(250, policy.delayForRetry(0));
    }

    @Test
    void allowsRetryWhileAttemptsRemain() {
        RetryPolicy policy = new RetryPolicy(3, 100, 100, 1.0);

        assertTrue(policy.allowsRetry(1));
        assertTrue(policy.allowsRetry(2));
        assertFalse(policy.allowsRetry(3));
        assertFalse(RetryPolicy.noRetry().allowsRetry(1));
    }

    @Test
    void factoriesProduceEquivalentPolicies() {
        assertEquals(new RetryPolicy(4, 500, 500, 1.0), RetryPolicy.fixed(4, Duration.ofMillis(500)));
        assertEquals(new RetryPolicy(3, 100, 2000, 2.0),
                RetryPolicy.exponential(3, Duration.ofMillis(100), Duration.ofSeconds(2), 2.0));
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 100, 1000, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1, 1000, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 500, 100, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 100, 1000, 0.5));
    }
}
