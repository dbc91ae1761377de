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

import org.fireflyframework.saga.registry.RetryPolicy;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaStep;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State machine of one saga execution.
 * <p>
 * Wraps an immutable {@link SagaDefinition} and a mutable working copy of the execution state.
 * It performs no I/O: the orchestrator applies a transition, takes a snapshot with
 * {@link #getContext()} and persists it. Illegal transitions raise {@link SagaStateException}
 * and leave the instance untouched.
 * <p>
 * Not thread-safe. An instance lives for the duration of a single orchestrator operation.
 */
public class SagaInstance {

    private final SagaDefinition definition;
    private final Clock clock;

    private final String sagaId;
    private final String correlationId;
    private SagaState state;
    private int currentStepIndex;
    private final List<String> completedSteps;
    private final List<String> failedSteps;
    private final List<String> compensatedSteps;
    private final Map<String, Object> data;
    private final Instant startedAt;
    private Instant lastUpdatedAt;
    private final Instant timeoutAt;
    private String errorMessage;
    private int retryCount;
    private final long version;

    private SagaInstance(SagaDefinition definition, SagaExecutionContext context, Clock clock) {
        this.definition = definition;
        this.clock = clock;
        this.sagaId = context.getSagaId();
        this.correlationId = context.getCorrelationId();
        this.state = context.getState();
        this.currentStepIndex = context.getCurrentStepIndex();
        this.completedSteps = new ArrayList<>(context.getCompletedSteps());
        this.failedSteps = new ArrayList<>(context.getFailedSteps());
        this.compensatedSteps = new ArrayList<>(context.getCompensatedSteps());
        this.data = new LinkedHashMap<>(context.getData());
        this.startedAt = context.getStartedAt();
        this.lastUpdatedAt = context.getLastUpdatedAt();
        this.timeoutAt = context.getTimeoutAt();
        this.errorMessage = context.getErrorMessage();
        this.retryCount = context.getRetryCount();
        this.version = context.getVersion();
    }

    /**
     * Creates a new PENDING instance. The global timeout, if any, is measured from now.
     */
    public static SagaInstance create(SagaDefinition definition, String sagaId, String correlationId) {
        return create(definition, sagaId, correlationId, Clock.systemUTC());
    }

    public static SagaInstance create(SagaDefinition definition, String sagaId, String correlationId, Clock clock) {
        Instant now = clock.instant();
        SagaExecutionContext context = SagaExecutionContext.builder()
                .sagaId(sagaId)
                .sagaType(definition.getSagaType())
                .correlationId(correlationId != null ? correlationId : sagaId)
                .state(SagaState.PENDING)
                .currentStepIndex(0)
                .startedAt(now)
                .lastUpdatedAt(now)
                .timeoutAt(definition.getGlobalTimeout().map(now::plus).orElse(null))
                .build();
        return new SagaInstance(definition, context, clock);
    }

    /**
     * Rehydrates an instance from a persisted context. Has no side effects.
     *
     * @throws IllegalArgumentException if the context belongs to another saga type
     */
    public static SagaInstance fromContext(SagaDefinition definition, SagaExecutionContext context) {
        return fromContext(definition, context, Clock.systemUTC());
    }

    public static SagaInstance fromContext(SagaDefinition definition, SagaExecutionContext context, Clock clock) {
        if (!definition.getSagaType().equals(context.getSagaType())) {
            throw new IllegalArgumentException("Context of saga " + context.getSagaId() + " has type '"
                    + context.getSagaType() + "' but definition is '" + definition.getSagaType() + "'");
        }
        return new SagaInstance(definition, context, clock);
    }

    public void start(Map<String, Object> initialData) {
        require(state == SagaState.PENDING, "Saga can only be started from PENDING");
        if (initialData != null) {
            data.putAll(initialData);
        }
        state = SagaState.RUNNING;
        touch();
    }

    public void completeCurrentStep(Map<String, Object> stepResult) {
        require(state == SagaState.RUNNING, "Cannot complete a step of a saga that is not running");
        SagaStep step = getCurrentStep()
                .orElseThrow(() -> new SagaStateException(sagaId, state, "No current step to complete"));
        completedSteps.add(step.getStepId());
        currentStepIndex++;
        retryCount = 0;
        if (stepResult != null) {
            data.putAll(stepResult);
        }
        if (currentStepIndex >= definition.getStepCount()) {
            state = SagaState.COMPLETED;
        }
        touch();
    }

    /**
     * Records a failed attempt of the current step. The saga stays RUNNING while the step's retry
     * policy allows another attempt, and moves to COMPENSATING otherwise.
     */
    public void failCurrentStep(String error) {
        require(state == SagaState.RUNNING, "Cannot fail a step of a saga that is not running");
        SagaStep step = getCurrentStep()
                .orElseThrow(() -> new SagaStateException(sagaId, state, "No current step to fail"));
        failedSteps.add(step.getStepId());
        errorMessage = error;
        retryCount++;
        if (!shouldRetryCurrentStep()) {
            state = SagaState.COMPENSATING;
        }
        touch();
    }

    /**
     * Enters COMPENSATING and points at the most recent completed step that was not compensated
     * yet. When nothing is left to undo the saga becomes COMPENSATED right away.
     */
    public void startCompensation() {
        require(state != SagaState.COMPLETED && state != SagaState.COMPENSATED && state != SagaState.FAILED,
                "Cannot compensate a saga that already finished");
        state = SagaState.COMPENSATING;
        currentStepIndex = completedSteps.size() - 1 - compensatedSteps.size();
        if (currentStepIndex < 0) {
            state = SagaState.COMPENSATED;
        }
        touch();
    }

    public void completeCurrentCompensation() {
        require(state == SagaState.COMPENSATING, "Saga is not compensating");
        SagaStep step = getCurrentStep()
                .orElseThrow(() -> new SagaStateException(sagaId, state, "No step left to compensate"));
        compensatedSteps.add(step.getStepId());
        currentStepIndex--;
        if (currentStepIndex < 0) {
            state = SagaState.COMPENSATED;
        }
        touch();
    }

    public void markAsFailed(String error) {
        require(state != SagaState.COMPLETED && state != SagaState.COMPENSATED,
                "Cannot fail a saga that already finished");
        state = SagaState.FAILED;
        errorMessage = error;
        touch();
    }

    public void cancel() {
        require(!state.isTerminal(), "Cannot cancel a saga that already finished");
        state = SagaState.CANCELLED;
        touch();
    }

    /** Merges values into the saga data. */
    public void updateData(Map<String, Object> values) {
        require(!state.isTerminal(), "Cannot update data of a saga that already finished");
        data.putAll(values);
        touch();
    }

    /**
     * Step at {@code currentStepIndex}: the step to execute while RUNNING, the step to undo while
     * COMPENSATING.
     */
    public Optional<SagaStep> getCurrentStep() {
        return definition.stepAt(currentStepIndex);
    }

    public boolean shouldRetryCurrentStep() {
        if (state != SagaState.RUNNING || retryCount == 0) {
            return false;
        }
        return currentRetryPolicy()
                .map(policy -> policy.allowsRetry(retryCount))
                .orElse(false);
    }

    /**
     * Backoff before the next attempt of the current step, zero when it has no retry policy.
     */
    public Duration getRetryDelay() {
        return currentRetryPolicy()
                .map(policy -> Duration.ofMillis(policy.delayForRetry(retryCount)))
                .orElse(Duration.ZERO);
    }

    public boolean isTimedOut() {
        return timeoutAt != null && state.isInFlight() && timeoutAt.isBefore(clock.instant());
    }

    /**
     * Immutable snapshot of the current execution state, carrying the version it was loaded with.
     */
    public SagaExecutionContext getContext() {
        return new SagaExecutionContext(
                sagaId,
                definition.getSagaType(),
                correlationId,
                state,
                currentStepIndex,
                completedSteps,
                failedSteps,
                compensatedSteps,
                data,
                startedAt,
                lastUpdatedAt,
                timeoutAt,
                errorMessage,
                retryCount,
                version
        );
    }

    public SagaDefinition getDefinition() { return definition; }
    public String getSagaId() { return sagaId; }
    public String getSagaType() { return definition.getSagaType(); }
    public String getCorrelationId() { return correlationId; }
    public SagaState getState() { return state; }
    public int getCurrentStepIndex() { return currentStepIndex; }
    public List<String> getCompletedSteps() { return List.copyOf(completedSteps); }
    public List<String> getFailedSteps() { return List.copyOf(failedSteps); }
    public List<String> getCompensatedSteps() { return List.copyOf(compensatedSteps); }
    public Map<String, Object> getData() { return Collections.unmodifiableMap(data); }
    public String getErrorMessage() { return errorMessage; }
    public int getRetryCount() { return retryCount; }
    public long getVersion() { return version; }

    private Optional<RetryPolicy> currentRetryPolicy() {
        return getCurrentStep().flatMap(SagaStep::getRetryPolicy);
    }

    private void require(boolean condition, String message) {
        if (!condition) {
            throw new SagaStateException(sagaId, state, message);
        }
    }

    private void touch() {
        lastUpdatedAt = clock.instant();
    }
}
