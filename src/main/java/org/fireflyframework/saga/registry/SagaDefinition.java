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

import org.fireflyframework.saga.core.SagaExecutionContext;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Immutable description of a saga workflow: its type, its ordered steps, an optional global
 * timeout and optional lifecycle callbacks.
 * <p>
 * Use {@link SagaBuilder} to assemble one.
 */
public final class SagaDefinition {

    private final String sagaType;
    private final List<SagaStep> steps;
    private final Duration globalTimeout;
    private final Function<SagaExecutionContext, Mono<Void>> onCompleted;
    private final BiFunction<SagaExecutionContext, Throwable, Mono<Void>> onFailed;
    private final Function<SagaExecutionContext, Mono<Void>> onCompensated;

    public SagaDefinition(String sagaType,
                          List<SagaStep> steps,
                          Duration globalTimeout,
                          Function<SagaExecutionContext, Mono<Void>> onCompleted,
                          BiFunction<SagaExecutionContext, Throwable, Mono<Void>> onFailed,
                          Function<SagaExecutionContext, Mono<Void>> onCompensated) {
        if (sagaType == null || sagaType.isBlank()) {
            throw new IllegalArgumentException("sagaType must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Saga '" + sagaType + "' must declare at least one step");
        }
        Set<String> seen = new HashSet<>();
        for (SagaStep step : steps) {
            if (!seen.add(step.getStepId())) {
                throw new IllegalArgumentException("Duplicate step id '" + step.getStepId() + "' in saga '" + sagaType + "'");
            }
        }
        if (globalTimeout != null && (globalTimeout.isZero() || globalTimeout.isNegative())) {
            throw new IllegalArgumentException("globalTimeout of saga '" + sagaType + "' must be positive");
        }
        this.sagaType = sagaType;
        this.steps = List.copyOf(steps);
        this.globalTimeout = globalTimeout;
        this.onCompleted = onCompleted;
        this.onFailed = onFailed;
        this.onCompensated = onCompensated;
    }

    public String getSagaType() {
        return sagaType;
    }

    public List<SagaStep> getSteps() {
        return steps;
    }

    public int getStepCount() {
        return steps.size();
    }

    /**
     * Returns the step at the given index, or empty when the index is out of range.
     */
    public Optional<SagaStep> stepAt(int index) {
        if (index < 0 || index >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(index));
    }

    public Optional<Duration> getGlobalTimeout() {
        return Optional.ofNullable(globalTimeout);
    }

    /** Invokes the completion callback; empty when none is configured. */
    public Mono<Void> fireCompleted(SagaExecutionContext context) {
        return onCompleted != null ? Mono.defer(() -> onCompleted.apply(context)) : Mono.empty();
    }

    /** Invokes the failure callback; empty when none is configured. */
    public Mono<Void> fireFailed(SagaExecutionContext context, Throwable error) {
        return onFailed != null ? Mono.defer(() -> onFailed.apply(context, error)) : Mono.empty();
    }

    /** Invokes the compensation callback; empty when none is configured. */
    public Mono<Void> fireCompensated(SagaExecutionContext context) {
        return onCompensated != null ? Mono.defer(() -> onCompensated.apply(context)) : Mono.empty();
    }

    @Override
    public String toString() {
        return "SagaDefinition{sagaType='" + sagaType + "', steps=" + steps.size() + ", globalTimeout=" + globalTimeout + '}';
    }
}
