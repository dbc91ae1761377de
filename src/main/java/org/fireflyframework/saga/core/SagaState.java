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

package org.fireflyframework.saga.core;

/**
 * Lifecycle states of a saga execution.
 * <p>
 * Transitions:
 * <pre>
 * PENDING -> RUNNING -> COMPLETED
 *                    -> COMPENSATING -> COMPENSATED | FAILED
 * PENDING | RUNNING | COMPENSATING -> CANCELLED
 * </pre>
 * COMPLETED, FAILED, COMPENSATED and CANCELLED are terminal.
 */
public enum SagaState {

    /**
     * Saga has been created but not started.
     */
    PENDING,

    /**
     * Saga is executing its forward steps.
     */
    RUNNING,

    /**
     * Every step completed successfully.
     */
    COMPLETED,

    /**
     * Compensation could not complete; the saga needs manual remediation.
     */
    FAILED,

    /**
     * Completed steps are being undone in reverse order.
     */
    COMPENSATING,

    /**
     * Every completed step has been compensated.
     */
    COMPENSATED,

    /**
     * Saga was cancelled before completion.
     */
    CANCELLED;

    /**
     * Checks if no further transition is expected from this state.
     */
    public boolean isTerminal() {
        return this == COMPLETED ||
               this == FAILED ||
               this == COMPENSATED ||
               this == CANCELLED;
    }

    /**
     * Checks if the saga is actively executing or compensating and can time out.
     */
    public boolean isInFlight() {
        return this == RUNNING || this == COMPENSATING;
    }
}
