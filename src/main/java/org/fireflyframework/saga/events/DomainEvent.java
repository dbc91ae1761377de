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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Domain event delivered to {@code SagaOrchestrator.handleEvent}.
 *
 * @param eventType routing key inspected by handlers
 * @param eventId unique id of this occurrence
 * @param payload event attributes
 */
public record DomainEvent(String eventType, String eventId, Map<String, Object> payload) {

    public DomainEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(eventId, "eventId");
        // attributes may carry null values, which Map.copyOf rejects
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static DomainEvent of(String eventType, Map<String, Object> payload) {
        return new DomainEvent(eventType, UUID.randomUUID().toString(), payload);
    }

    /**
     * Typed lookup of a payload attribute. Empty if absent or of another type.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = payload.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}
