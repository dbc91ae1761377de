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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, serializable snapshot of a saga execution.
 * <p>
 * This is the only artifact the orchestrator writes to durable storage. It carries everything
 * needed to rehydrate a {@link SagaInstance} in another process via
 * {@link SagaInstance#fromContext}.
 * <p>
 * The {@code version} is managed by the repository: a context that was never saved has version 0
 * and each successful save stores the context with its version incremented by one.
 */
public final class SagaExecutionContext {

    private final String sagaId;
    private final String sagaType;
    private final String correlationId;
    private final SagaState state;
    private final int currentStepIndex;
    private final List<String> completedSteps;
    private final List<String> failedSteps;
    private final List<String> compensatedSteps;
    private final Map<String, Object> data;
    private final Instant startedAt;
    private final Instant lastUpdatedAt;
    private final Instant timeoutAt;
    private final String errorMessage;
    private final int retryCount;
    private final long version;

    @JsonCreator
    public SagaExecutionContext(
            @JsonProperty("sagaId") String sagaId,
            @JsonProperty("sagaType") String sagaType,
            @JsonProperty("correlationId") String correlationId,
            @JsonProperty("state") SagaState state,
            @JsonProperty("currentStepIndex") int currentStepIndex,
            @JsonProperty("completedSteps") List<String> completedSteps,
            @JsonProperty("failedSteps") List<String> failedSteps,
            @JsonProperty("compensatedSteps") List<String> compensatedSteps,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("startedAt") Instant startedAt,
            @JsonProperty("lastUpdatedAt") Instant lastUpdatedAt,
            @JsonProperty("timeoutAt") Instant timeoutAt,
            @JsonProperty("errorMessage") String errorMessage,
            @JsonProperty("retryCount") int retryCount,
            @JsonProperty("version") long version) {
        this.sagaId = Objects.requireNonNull(sagaId, "sagaId");
        this.sagaType = Objects.requireNonNull(sagaType, "sagaType");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.state = Objects.requireNonNull(state, "state");
        this.currentStepIndex = currentStepIndex;
        this.completedSteps = List.copyOf(completedSteps != null ? completedSteps : List.of());
        this.failedSteps = List.copyOf(failedSteps != null ? failedSteps : List.of());
        this.compensatedSteps = List.copyOf(compensatedSteps != null ? compensatedSteps : List.of());
        // step results may legitimately carry null values, which Map.copyOf rejects
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data != null ? data : Map.of()));
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.lastUpdatedAt = Objects.requireNonNull(lastUpdatedAt, "lastUpdatedAt");
        this.timeoutAt = timeoutAt;
        this.errorMessage = errorMessage;
        this.retryCount = retryCount;
        this.version = version;
    }

    public String getSagaId() { return sagaId; }
    public String getSagaType() { return sagaType; }
    public String getCorrelationId() { return correlationId; }
    public SagaState getState() { return state; }
    public int getCurrentStepIndex() { return currentStepIndex; }
    public List<String> getCompletedSteps() { return completedSteps; }
    public List<String> getFailedSteps() { return failedSteps; }
    public List<String> getCompensatedSteps() { return compensatedSteps; }
    public Map<String, Object> getData() { return data; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public Instant getTimeoutAt() { return timeoutAt; }
    public String getErrorMessage() { return errorMessage; }
    public int getRetryCount() { return retryCount; }
    public long getVersion() { return version; }

    /**
     * Checks if the global timeout has passed while the saga is still running or compensating.
     */
    @JsonIgnore
    public boolean isTimedOut(Instant now) {
        return timeoutAt != null && timeoutAt.isBefore(now) && state.isInFlight();
    }

    /**
     * Creates a copy stamped with the given version. Used by repositories on save.
     */
    public SagaExecutionContext withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .sagaId(sagaId)
                .sagaType(sagaType)
                .correlationId(correlationId)
                .state(state)
                .currentStepIndex(currentStepIndex)
                .completedSteps(completedSteps)
                .failedSteps(failedSteps)
                .compensatedSteps(compensatedSteps)
                .data(data)
                .startedAt(startedAt)
                .lastUpdatedAt(lastUpdatedAt)
                .timeoutAt(timeoutAt)
                .errorMessage(errorMessage)
                .retryCount(retryCount)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SagaExecutionContext that = (SagaExecutionContext) o;
        return currentStepIndex == that.currentStepIndex &&
                retryCount == that.retryCount &&
                version == that.version &&
                sagaId.equals(that.sagaId) &&
                sagaType.equals(that.sagaType) &&
                correlationId.equals(that.correlationId) &&
                state == that.state &&
                completedSteps.equals(that.completedSteps) &&
                failedSteps.equals(that.failedSteps) &&
                compensatedSteps.equals(that.compensatedSteps) &&
                data.equals(that.data) &&
                startedAt.equals(that.startedAt) &&
                lastUpdatedAt.equals(that.lastUpdatedAt) &&
                Objects.equals(timeoutAt, that.timeoutAt) &&
                Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sagaId, version);
    }

    @Override
    public String toString() {
        return "SagaExecutionContext{" +
                "sagaId='" + sagaId + '\'' +
                ", sagaType='" + sagaType + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", state=" + state +
                ", currentStepIndex=" + currentStepIndex +
                ", retryCount=" + retryCount +
                ", version=" + version +
                '}';
    }

    /**
     * Builder for creating SagaExecutionContext instances.
     */
    public static class Builder {
        private String sagaId;
        private String sagaType;
        private String correlationId;
        private SagaState state = SagaState.PENDING;
        private int currentStepIndex = 0;
        private List<String> completedSteps = List.of();
        private List<String> failedSteps = List.of();
        private List<String> compensatedSteps = List.of();
        private Map<String, Object> data = Map.of();
        private Instant startedAt = Instant.now();
        private Instant lastUpdatedAt = Instant.now();
        private Instant timeoutAt;
        private String errorMessage;
        private int retryCount = 0;
        private long version = 0;

        public Builder sagaId(String sagaId) {
            this.sagaId = sagaId;
            return this;
        }

        public Builder sagaType(String sagaType) {
            this.sagaType = sagaType;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder state(SagaState state) {
            this.state = state;
            return this;
        }

        public Builder currentStepIndex(int currentStepIndex) {
            this.currentStepIndex = currentStepIndex;
            return this;
        }

        public Builder completedSteps(List<String> completedSteps) {
            this.completedSteps = completedSteps;
            return this;
        }

        public Builder failedSteps(List<String> failedSteps) {
            this.failedSteps = failedSteps;
            return this;
        }

        public Builder compensatedSteps(List<String> compensatedSteps) {
            this.compensatedSteps = compensatedSteps;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder lastUpdatedAt(Instant lastUpdatedAt) {
            this.lastUpdatedAt = lastUpdatedAt;
            return this;
        }

        public Builder timeoutAt(Instant timeoutAt) {
            this.timeoutAt = timeoutAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public SagaExecutionContext build() {
            return new SagaExecutionContext(
                    sagaId, sagaType, correlationId, state, currentStepIndex,
                    completedSteps, failedSteps, compensatedSteps, data,
                    startedAt, lastUpdatedAt, timeoutAt, errorMessage, retryCount, version
            );
        }
    }
}
