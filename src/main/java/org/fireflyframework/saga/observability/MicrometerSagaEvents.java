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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.fireflyframework.saga.core.SagaState;

import java.time.Duration;

/**
 * Micrometer-based implementation of SagaEvents.
 * <p>
 * Publishes counters and a duration timer tagged with the saga type:
 * <ul>
 *   <li>{@code saga.started}</li>
 *   <li>{@code saga.finished} with {@code outcome} = completed | compensated | failed</li>
 *   <li>{@code saga.duration}, same tags as {@code saga.finished}</li>
 *   <li>{@code saga.step.failed}, {@code saga.step.retries}, {@code saga.step.timeouts}</li>
 *   <li>{@code saga.compensation.completed} with {@code outcome} = success | failure | skipped</li>
 *   <li>{@code saga.cancelled}</li>
 * </ul>
 */
public class MicrometerSagaEvents implements SagaEvents {

    private final MeterRegistry registry;

    public MicrometerSagaEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStarted(String sagaType, String sagaId, String correlationId) {
        registry.counter("saga.started", sagaTags(sagaType)).increment();
    }

    @Override
    public void onStepFailed(String sagaType, String sagaId, String stepId, String error, int retryCount) {
        registry.counter("saga.step.failed", stepTags(sagaType, stepId)).increment();
    }

    @Override
    public void onStepRetryScheduled(String sagaType, String sagaId, String stepId, int retryCount, Duration delay) {
        registry.counter("saga.step.retries", stepTags(sagaType, stepId)).increment();
    }

    @Override
    public void onStepTimedOut(String sagaType, String sagaId, String stepId, Duration timeout) {
        registry.counter("saga.step.timeouts", stepTags(sagaType, stepId)).increment();
    }

    @Override
    public void onCompensationSkipped(String sagaType, String sagaId, String stepId) {
        registry.counter("saga.compensation.completed",
                stepTags(sagaType, stepId).and(Tag.of("outcome", "skipped"))).increment();
    }

    @Override
    public void onStepCompensated(String sagaType, String sagaId, String stepId, Throwable error) {
        registry.counter("saga.compensation.completed",
                stepTags(sagaType, stepId).and(Tag.of("outcome", error == null ? "success" : "failure"))).increment();
    }

    @Override
    public void onCancelled(String sagaType, String sagaId) {
        registry.counter("saga.cancelled", sagaTags(sagaType)).increment();
    }

    @Override
    public void onFinished(String sagaType, String sagaId, SagaState finalState, Duration duration) {
        Tags tags = sagaTags(sagaType).and(Tag.of("outcome", finalState.name().toLowerCase()));
        registry.counter("saga.finished", tags).increment();
        if (duration != null && !duration.isNegative()) {
            registry.timer("saga.duration", tags).record(duration);
        }
    }

    private static Tags sagaTags(String sagaType) {
        return Tags.of(Tag.of("saga.type", sagaType));
    }

    private static Tags stepTags(String sagaType, String stepId) {
        return Tags.of(Tag.of("saga.type", sagaType), Tag.of("step.id", stepId));
    }
}
