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
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.persistence.SagaRecoveryService;
import org.fireflyframework.saga.persistence.SagaRecoveryService.SingleRecoveryResult.RecoveryStatus;
import org.fireflyframework.saga.persistence.SagaRepository;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of SagaRecoveryService.
 * <p>
 * Recovery process:
 * <ol>
 *   <li>Scan the repository for RUNNING and COMPENSATING sagas</li>
 *   <li>Skip sagas whose definition is not registered in this process</li>
 *   <li>Hand the rest to {@link SagaOrchestrator#resumeSaga(String)}</li>
 * </ol>
 * Sagas are resumed one at a time; a failing saga is counted and does not stop the others.
 */
public class DefaultSagaRecoveryService implements SagaRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(DefaultSagaRecoveryService.class);

    private final SagaRepository repository;
    private final SagaOrchestrator orchestrator;
    private final SagaRegistry registry;

    public DefaultSagaRecoveryService(SagaRepository repository,
                                      SagaOrchestrator orchestrator,
                                      SagaRegistry registry) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.registry = registry;
    }

    @Override
    public Mono<RecoveryResult> recoverInFlightSagas() {
        Instant startTime = Instant.now();
        AtomicInteger totalFound = new AtomicInteger(0);
        AtomicInteger resumed = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);
        AtomicInteger skipped = new AtomicInteger(0);

        log.info("Starting recovery of in-flight sagas");

        return Flux.concat(repository.findByState(SagaState.RUNNING), repository.findByState(SagaState.COMPENSATING))
                .doOnNext(context -> {
                    totalFound.incrementAndGet();
                    log.debug("Found in-flight saga for recovery: {} ({}, {})",
                            context.getSagaId(), context.getSagaType(), context.getState());
                })
                .concatMap(this::recoverSingleSaga)
                .doOnNext(result -> {
                    switch (result.getStatus()) {
                        case RESUMED -> resumed.incrementAndGet();
                        case FAILED -> failed.incrementAndGet();
                        default -> skipped.incrementAndGet();
                    }
                })
                .then(Mono.fromCallable(() -> {
                    RecoveryResult result = new RecoveryResult(
                            totalFound.get(),
                            resumed.get(),
                            failed.get(),
                            skipped.get(),
                            Duration.between(startTime, Instant.now())
                    );
                    log.info("Saga recovery completed: {}", result);
                    return result;
                }));
    }

    @Override
    public Mono<SingleRecoveryResult> recoverSaga(String sagaId) {
        log.debug("Attempting to recover specific saga: {}", sagaId);
        return repository.load(sagaId)
                .flatMap(this::recoverSingleSaga)
                .defaultIfEmpty(new SingleRecoveryResult(sagaId, RecoveryStatus.NOT_FOUND,
                        "Saga context not found in repository"));
    }

    private Mono<SingleRecoveryResult> recoverSingleSaga(SagaExecutionContext context) {
        String sagaId = context.getSagaId();
        if (!context.getState().isInFlight()) {
            return Mono.just(new SingleRecoveryResult(sagaId, RecoveryStatus.SKIPPED,
                    "Saga is " + context.getState()));
        }
        if (!registry.hasSaga(context.getSagaType())) {
            log.warn("Cannot recover saga {}: no definition registered for type '{}'", sagaId, context.getSagaType());
            return Mono.just(new SingleRecoveryResult(sagaId, RecoveryStatus.SKIPPED,
                    "Saga definition not registered: " + context.getSagaType()));
        }
        return orchestrator.resumeSaga(sagaId)
                .then(Mono.fromCallable(() -> {
                    log.info("Resumed saga {} ({}) from state {}", sagaId, context.getSagaType(), context.getState());
                    return new SingleRecoveryResult(sagaId, RecoveryStatus.RESUMED, "Resumed from " + context.getState());
                }))
                .onErrorResume(error -> {
                    log.error("Failed to recover saga {}", sagaId, error);
                    return Mono.just(new SingleRecoveryResult(sagaId, RecoveryStatus.FAILED, error.getMessage()));
                });
    }
}
