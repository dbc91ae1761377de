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

import org.fireflyframework.saga.command.SagaCommand;
import org.fireflyframework.saga.core.SagaExecutionContext;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fluent builder to construct a {@link SagaDefinition}.
 * <pre>
 * SagaDefinition def = SagaBuilder.saga("order_fulfillment")
 *     .step("reserve").command(SagaCommand.of("inventory.reserve"))
 *         .compensation(SagaCommand.of("inventory.release"))
 *         .retry(new RetryPolicy(3, 100, 1000, 2.0))
 *         .add()
 *     .step("charge").command(SagaCommand.of("payment.charge")).timeout(Duration.ofSeconds(30)).add()
 *     .globalTimeout(Duration.ofMinutes(5))
 *     .build();
 * </pre>
 */
public class SagaBuilder {

    private final String sagaType;
    private final List<SagaStep> steps = new ArrayList<>();
    private Duration globalTimeout;
    private Function<SagaExecutionContext, Mono<Void>> onCompleted;
    private BiFunction<SagaExecutionContext, Throwable, Mono<Void>> onFailed;
    private Function<SagaExecutionContext, Mono<Void>> onCompensated;

    private SagaBuilder(String sagaType) {
        this.sagaType = sagaType;
    }

    public static SagaBuilder saga(String sagaType) {
        return new SagaBuilder(sagaType);
    }

    public Step step(String stepId) {
        return new Step(stepId);
    }

    public SagaBuilder globalTimeout(Duration globalTimeout) {
        this.globalTimeout = globalTimeout;
        return this;
    }

    public SagaBuilder onCompleted(Function<SagaExecutionContext, Mono<Void>> callback) {
        this.onCompleted = callback;
        return this;
    }

    public SagaBuilder onFailed(BiFunction<SagaExecutionContext, Throwable, Mono<Void>> callback) {
        this.onFailed = callback;
        return this;
    }

    public SagaBuilder onCompensated(Function<SagaExecutionContext, Mono<Void>> callback) {
        this.onCompensated = callback;
        return this;
    }

    /**
     * Validates and builds the definition.
     *
     * @throws IllegalArgumentException if the definition is invalid
     */
    public SagaDefinition build() {
        return new SagaDefinition(sagaType, steps, globalTimeout, onCompleted, onFailed, onCompensated);
    }

    public class Step {
        private final String stepId;
        private String name;
        private SagaCommand command;
        private SagaCommand compensation;
        private Duration timeout;
        private RetryPolicy retryPolicy;

        private Step(String stepId) {
            this.stepId = stepId;
        }

        public Step name(String name) {
            this.name = name;
            return this;
        }

        public Step command(SagaCommand command) {
            this.command = command;
            return this;
        }

        public Step command(String commandType, Map<String, Object> payload) {
            return command(SagaCommand.of(commandType, payload));
        }

        public Step compensation(SagaCommand compensation) {
            this.compensation = compensation;
            return this;
        }

        public Step compensation(String commandType, Map<String, Object> payload) {
            return compensation(SagaCommand.of(commandType, payload));
        }

        public Step timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Step timeoutMs(long timeoutMs) {
            return timeout(Duration.ofMillis(timeoutMs));
        }

        public Step retry(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public SagaBuilder add() {
            steps.add(new SagaStep(stepId, name, command, compensation, timeout, retryPolicy));
            return SagaBuilder.this;
        }
    }
}
