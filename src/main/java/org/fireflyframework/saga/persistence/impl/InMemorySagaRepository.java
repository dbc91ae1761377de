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

package org.fireflyframework.saga.persistence.impl;

import org.fireflyframework.saga.core.SagaExecutionContext;
import org.fireflyframework.saga.core.SagaState;
import org.fireflyframework.saga.persistence.SagaConcurrencyException;
import org.fireflyframework.saga.persistence.SagaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link SagaRepository}.
 * <p>
 * Provides no durability across restarts. Suitable for development, tests and sagas that do not
 * need to survive the process. The version check and write happen atomically per saga id.
 */
public class InMemorySagaRepository implements SagaRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySagaRepository.class);

    private final ConcurrentMap<String, SagaExecutionContext> contexts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySagaRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySagaRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<SagaExecutionContext> save(SagaExecutionContext context) {
        return Mono.fromCallable(() -> {
            String sagaId = context.getSagaId();
            log.debug("Saving saga {} in memory (version {}, state {})", sagaId, context.getVersion(), context.getState());
            return contexts.compute(sagaId, (id, stored) -> {
                long storedVersion = stored != null ? stored.getVersion() : -1L;
                boolean fresh = stored == null && context.getVersion() == 0;
                if (!fresh && storedVersion != context.getVersion()) {
                    throw new SagaConcurrencyException(id, context.getVersion(), storedVersion);
                }
                return context.withVersion(context.getVersion() + 1);
            });
        });
    }

    @Override
    public Mono<SagaExecutionContext> load(String sagaId) {
        return Mono.fromCallable(() -> contexts.get(sagaId));
    }

    @Override
    public Flux<SagaExecutionContext> findByCorrelationId(String correlationId) {
        return Flux.defer(() -> Flux.fromIterable(contexts.values()))
                .filter(ctx -> correlationId.equals(ctx.getCorrelationId()));
    }

    @Override
    public Flux<SagaExecutionContext> findByState(SagaState state) {
        return Flux.defer(() -> Flux.fromIterable(contexts.values()))
                .filter(ctx -> ctx.getState() == state);
    }

    @Override
    public Flux<SagaExecutionContext> findTimedOut() {
        return Flux.defer(() -> Flux.fromIterable(contexts.values()))
                .filter(ctx -> ctx.isTimedOut(clock.instant()));
    }

    @Override
    public Mono<Void> delete(String sagaId) {
        return Mono.fromRunnable(() -> {
            if (contexts.remove(sagaId) != null) {
                log.debug("Deleted saga {} from memory", sagaId);
            }
        });
    }

    /** Number of stored contexts. */
    public int size() {
        return contexts.size();
    }
}
