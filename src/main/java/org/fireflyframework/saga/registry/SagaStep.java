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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one step of a saga: the command that performs it and, optionally,
 * the command that undoes it, a per-step timeout and a retry policy.
 */
public final class SagaStep {

    private final String stepId;
    private final String stepName;
    private final SagaCommand command;
    private final SagaCommand compensationCommand;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public SagaStep(String stepId,
                    String stepName,
                    SagaCommand command,
                    SagaCommand compensationCommand,
                    Duration timeout,
                    RetryPolicy retryPolicy) {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId must not be blank");
        }
        this.stepId = stepId;
        this.stepName = stepName != null && !stepName.isBlank() ? stepName : stepId;
        this.command = Objects.requireNonNull(command, () -> "command of step '" + stepId + "'");
        this.compensationCommand = compensationCommand;
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout of step '" + stepId + "' must be positive");
        }
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public SagaCommand getCommand() {
        return command;
    }

    public Optional<SagaCommand> getCompensationCommand() {
        return Optional.ofNullable(compensationCommand);
    }

    public boolean hasCompensation() {
        return compensationCommand != null;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<RetryPolicy> getRetryPolicy() {
        return Optional.ofNullable(retryPolicy);
    }

    @Override
    public String toString() {
        return "SagaStep{" +
                "stepId='" + stepId + '\'' +
                ", command=" + command.commandType() +
                ", compensation=" + (compensationCommand != null ? compensationCommand.commandType() : "none") +
                ", timeout=" + timeout +
                ", retryPolicy=" + retryPolicy +
                '}';
    }
}
