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

package org.fireflyframework.saga.observability;

import org.fireflyframework.saga.core.SagaState;

import java.time.Duration;

/**
 * Observability hook for saga lifecycle events.
 * Provide your own Spring bean of this type to export metrics/traces/logs.
 * A default logger-based implementation is provided: {@link SagaLoggerEvents}.
 *
 * Notes:
 * - onStepCompensated is invoked for both success and error cases; a null error indicates a successful compensation.
 * - onFinished is invoked once per saga with its terminal state (COMPLETED, COMPENSATED or FAILED).
 */
public interface SagaEvents {
    /** Invoked when a saga has been started and persisted. */
    default void onStarted(String sagaType, String sagaId, String correlationId) {}

    /** Invoked when a step command is handed to the command bus. Attempt is 1-based. */
    default void onStepDispatched(String sagaType, String sagaId, String stepId, int attempt) {}

    default void onStepCompleted(String sagaType, String sagaId, String stepId) {}
    default void onStepFailed(String sagaType, String sagaId, String stepId, String error, int retryCount) {}
    default void onStepRetryScheduled(String sagaType, String sagaId, String stepId, int retryCount, Duration delay) {}
    default void onStepTimedOut(String sagaType, String sagaId, String stepId, Duration timeout) {}

    default void onCompensationStarted(String sagaType, String sagaId) {}
    default void onCompensationSkipped(String sagaType, String sagaId, String stepId) {}
    default void onStepCompensated(String sagaType, String sagaId, String stepId, Throwable error) {}

    default void onCancelled(String sagaType, String sagaId) {}

    default void onFinished(String sagaType, String sagaId, SagaState finalState, Duration duration) {}
}
