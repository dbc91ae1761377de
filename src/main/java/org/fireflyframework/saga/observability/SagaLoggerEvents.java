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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Default logger-based implementation of SagaEvents.
 * <p>
 * This implementation logs all saga lifecycle events in a structured JSON format
 * to facilitate monitoring and debugging. The log format is designed to be
 * easily parseable by log aggregation systems.
 * <p>
 * Log levels used:
 * <ul>
 *   <li>INFO - Normal lifecycle events (started, finished, step transitions)</li>
 *   <li>WARN - Retries, timeouts and cancellations</li>
 *   <li>ERROR - Step failures and failed compensations</li>
 * </ul>
 */
public class SagaLoggerEvents implements SagaEvents {

    private static final Logger log = LoggerFactory.getLogger(SagaLoggerEvents.class);

    @Override
    public void onStarted(String sagaType, String sagaId, String correlationId) {
        log.info("{\"saga_event\":\"started\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"correlation_id\":\"{}\"}",
                sagaType, sagaId, correlationId);
    }

    @Override
    public void onStepDispatched(String sagaType, String sagaId, String stepId, int attempt) {
        log.info("{\"saga_event\":\"step_dispatched\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"attempt\":\"{}\"}",
                sagaType, sagaId, stepId, attempt);
    }

    @Override
    public void onStepCompleted(String sagaType, String sagaId, String stepId) {
        log.info("{\"saga_event\":\"step_completed\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}",
                sagaType, sagaId, stepId);
    }

    @Override
    public void onStepFailed(String sagaType, String sagaId, String stepId, String error, int retryCount) {
        log.error("{\"saga_event\":\"step_failed\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_message\":\"{}\",\"retry_count\":\"{}\"}",
                sagaType, sagaId, stepId, error, retryCount);
    }

    @Override
    public void onStepRetryScheduled(String sagaType, String sagaId, String stepId, int retryCount, Duration delay) {
        log.warn("{\"saga_event\":\"step_retry_scheduled\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"retry_count\":\"{}\",\"delay_ms\":\"{}\"}",
                sagaType, sagaId, stepId, retryCount, delay.toMillis());
    }

    @Override
    public void onStepTimedOut(String sagaType, String sagaId, String stepId, Duration timeout) {
        log.warn("{\"saga_event\":\"step_timed_out\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"timeout_ms\":\"{}\"}",
                sagaType, sagaId, stepId, timeout.toMillis());
    }

    @Override
    public void onCompensationStarted(String sagaType, String sagaId) {
        log.info("{\"saga_event\":\"compensation_started\",\"saga_type\":\"{}\",\"saga_id\":\"{}\"}",
                sagaType, sagaId);
    }

    @Override
    public void onCompensationSkipped(String sagaType, String sagaId, String stepId) {
        log.info("{\"saga_event\":\"compensation_skipped\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"reason\":\"no compensation command\"}",
                sagaType, sagaId, stepId);
    }

    @Override
    public void onStepCompensated(String sagaType, String sagaId, String stepId, Throwable error) {
        if (error == null) {
            log.info("{\"saga_event\":\"step_compensated\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\"}",
                    sagaType, sagaId, stepId);
        } else {
            log.error("{\"saga_event\":\"step_compensation_failed\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"step_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}",
                    sagaType, sagaId, stepId, error.getClass().getSimpleName(), error.getMessage());
        }
    }

    @Override
    public void onCancelled(String sagaType, String sagaId) {
        log.warn("{\"saga_event\":\"cancelled\",\"saga_type\":\"{}\",\"saga_id\":\"{}\"}",
                sagaType, sagaId);
    }

    @Override
    public void onFinished(String sagaType, String sagaId, SagaState finalState, Duration duration) {
        if (finalState == SagaState.FAILED) {
            log.error("{\"saga_event\":\"finished\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"final_state\":\"{}\",\"duration_ms\":\"{}\"}",
                    sagaType, sagaId, finalState, duration.toMillis());
        } else {
            log.info("{\"saga_event\":\"finished\",\"saga_type\":\"{}\",\"saga_id\":\"{}\",\"final_state\":\"{}\",\"duration_ms\":\"{}\"}",
                    sagaType, sagaId, finalState, duration.toMillis());
        }
    }
}
