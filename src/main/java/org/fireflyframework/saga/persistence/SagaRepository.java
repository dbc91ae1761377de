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

package org.fireflyframework.saga.persistence;

import org.fireflyframework.saga.core.SagaExecutionContext;
import org.fireflyframework.saga.core.SagaState;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage for saga execution contexts.
 * <p>
 * Implementations must apply an optimistic version check on {@link #save}: a context is accepted
 * only if its {@code version} matches the stored one (or nothing is stored yet and the version is
 * 0). The stored copy carries {@code version + 1} and is returned to the caller.
 */
public interface SagaRepository {

    /**
     * Upserts a context keyed by saga id.
     *
     * @return the stored copy with its new version
     * @throws SagaConcurrencyException (as an error signal) when the incoming version is stale
     */
    Mono<SagaExecutionContext> save(SagaExecutionContext context);

    /**
     * @return the stored context, or empty if none exists
     */
    Mono<SagaExecutionContext> load(String sagaId);

    Flux<SagaExecutionContext> findByCorrelationId(String correlationId);

    Flux<SagaExecutionContext> findByState(SagaState state);

    /**
     * Contexts whose {@code timeoutAt} is in the past and whose state is RUNNING or COMPENSATING.
     */
    Flux<SagaExecutionContext> findTimedOut();

    Mono<Void> delete(String sagaId);
}
