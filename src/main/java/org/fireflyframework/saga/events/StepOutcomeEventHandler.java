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

package org.fireflyframework.saga.events;

import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes step outcome events to the orchestrator.
 * <p>
 * Events of a success type complete the current step of the saga named in the payload, with the
 * remaining payload merged into the saga data. Events of a failure type fail the current step,
 * using the payload's {@code reason} (or {@code error}) as the error message.
 * <pre>
 * orchestrator.registerEventHandler(StepOutcomeEventHandler.builder()
 *     .onSuccess("payment.captured")
 *     .onFailure("payment.declined")
 *     .build());
 * </pre>
 */
public class StepOutcomeEventHandler implements SagaEventHandler {

    private static final Logger log = LoggerFactory.getLogger(StepOutcomeEventHandler.class);

    public static final String DEFAULT_SAGA_ID_KEY = "sagaId";

    private final Set<String> successTypes;
    private final Set<String> failureTypes;
    private final String sagaIdKey;

    public StepOutcomeEventHandler(Set<String> successTypes, Set<String> failureTypes, String sagaIdKey) {
        this.successTypes = Set.copyOf(successTypes);
        this.failureTypes = Set.copyOf(failureTypes);
        this.sagaIdKey = sagaIdKey != null ? sagaIdKey : DEFAULT_SAGA_ID_KEY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean canHandle(DomainEvent event) {
        return (successTypes.contains(event.eventType()) || failureTypes.contains(event.eventType()))
                && event.get(sagaIdKey, String.class).isPresent();
    }

    @Override
    public Mono<Void> handle(DomainEvent event, SagaOrchestrator orchestrator) {
        String sagaId = event.get(sagaIdKey, String.class)
                .orElseThrow(() -> new IllegalArgumentException("Event " + event.eventId() + " carries no " + sagaIdKey));
        if (successTypes.contains(event.eventType())) {
            Map<String, Object> result = new LinkedHashMap<>(event.payload());
            result.remove(sagaIdKey);
            log.debug("Event {} completes current step of saga {}", event.eventType(), sagaId);
            return orchestrator.completeStep(sagaId, result);
        }
        String reason = event.get("reason", String.class)
                .or(() -> event.get("error", String.class))
                .orElse(event.eventType());
        log.debug("Event {} fails current step of saga {}: {}", event.eventType(), sagaId, reason);
        return orchestrator.failStep(sagaId, reason);
    }

    public static class Builder {
        private final Set<String> successTypes = new LinkedHashSet<>();
        private final Set<String> failureTypes = new LinkedHashSet<>();
        private String sagaIdKey = DEFAULT_SAGA_ID_KEY;

        public Builder onSuccess(String... eventTypes) {
            successTypes.addAll(List.of(eventTypes));
            return this;
        }

        public Builder onFailure(String... eventTypes) {
            failureTypes.addAll(List.of(eventTypes));
            return this;
        }

        public Builder sagaIdKey(String sagaIdKey) {
            this.sagaIdKey = sagaIdKey;
            return this;
        }

        public StepOutcomeEventHandler build() {
            return new StepOutcomeEventHandler(successTypes, failureTypes, sagaIdKey);
        }
    }
}
