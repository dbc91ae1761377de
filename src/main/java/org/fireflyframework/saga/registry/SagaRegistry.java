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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only index of saga definitions keyed by saga type.
 * <p>
 * Thread-safe; a type can be registered once per process.
 */
public class SagaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SagaRegistry.class);

    private final Map<String, SagaDefinition> sagas = new ConcurrentHashMap<>();

    /**
     * @throws SagaDefinitionException if the type is already registered
     */
    public void register(SagaDefinition definition) {
        SagaDefinition existing = sagas.putIfAbsent(definition.getSagaType(), definition);
        if (existing != null) {
            throw new SagaDefinitionException(definition.getSagaType(),
                    "Saga definition already registered: " + definition.getSagaType());
        }
        log.info("Registered saga definition '{}' with {} steps", definition.getSagaType(), definition.getStepCount());
    }

    /**
     * @throws SagaDefinitionException if the type is unknown
     */
    public SagaDefinition getSaga(String sagaType) {
        SagaDefinition def = sagas.get(sagaType);
        if (def == null) {
            throw new SagaDefinitionException(sagaType, "Saga definition not found: " + sagaType);
        }
        return def;
    }

    public Optional<SagaDefinition> findSaga(String sagaType) {
        return Optional.ofNullable(sagas.get(sagaType));
    }

    public boolean hasSaga(String sagaType) {
        return sagas.containsKey(sagaType);
    }

    public Collection<SagaDefinition> getAll() {
        return Collections.unmodifiableCollection(sagas.values());
    }
}
