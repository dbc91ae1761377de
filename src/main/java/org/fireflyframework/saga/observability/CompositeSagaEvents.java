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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Fan-out implementation of SagaEvents that delegates to multiple sinks
 * (e.g., logs + metrics). Used by default configuration to avoid bean
 * conflicts while enabling multiple observability channels.
 */
public class CompositeSagaEvents implements SagaEvents {
    private final List<SagaEvents> delegates;

    public CompositeSagaEvents(Collection<? extends SagaEvents> delegates) {
        this.delegates = new ArrayList<>(Objects.requireNonNull(delegates, "delegates"));
    }

    @Override
    public void onStarted(String sagaType, String sagaId, String correlationId) {
        for (SagaEvents d : delegates) d.onStarted(sagaType, sagaId, correlationId);
    }

    @Override
    public void onStepDispatched(String sagaType, String sagaId, String stepId, int attempt) {
        for (SagaEvents d : delegates) d.onStepDispatched(sagaType, sagaId, stepId, attempt);
    }

    @Override
    public void onStepCompleted(String sagaType, String sagaId, String stepId) {
        for (SagaEvents d : delegates) d.onStepCompleted(sagaType, sagaId, stepId);
    }

    @Override
    public void onStepFailed(String sagaType, String sagaId, String stepId, String error, int retryCount) {
        for (SagaEvents d : delegates) d.onStepFailed(sagaType, sagaId, stepId, error, retryCount);
    }

    @Override
    public void onStepRetryScheduled(String sagaType, String sagaId, String stepId, int retryCount, Duration delay) {
        for (SagaEvents d : delegates) d.onStepRetryScheduled(sagaType, sagaId, stepId, retryCount, delay);
    }

    @Override
    public void onStepTimedOut(String sagaType, String sagaId, String stepId, Duration timeout) {
        for (SagaEvents d : delegates) d.onStepTimedOut(sagaType, sagaId, stepId, timeout);
    }

    @Override
    public void onCompensationStarted(String sagaType, String sagaId) {
        for (SagaEvents d : delegates) d.onCompensationStarted(sagaType, sagaId);
    }

    @Override
    public void onCompensationSkipped(String sagaType, String sagaId, String stepId) {
        for (SagaEvents d : delegates) d.onCompensationSkipped(sagaType, sagaId, stepId);
    }

    @Override
    public void onStepCompensated(String sagaType, String sagaId, String stepId, Throwable error) {
        for (SagaEvents d : delegates) d.onStepCompensated(sagaType, sagaId, stepId, error);
    }

    @Override
    public void onCancelled(String sagaType, String sagaId) {
        for (SagaEvents d : delegates) d.onCancelled(sagaType, sagaId);
    }

    @Override
    public void onFinished(String sagaType, String sagaId, SagaState finalState, Duration duration) {
        for (SagaEvents d : delegates) d.onFinished(sagaType, sagaId, finalState, duration);
    }
}
