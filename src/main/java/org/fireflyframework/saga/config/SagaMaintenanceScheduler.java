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

package org.fireflyframework.saga.config;

import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.persistence.SagaRecoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background maintenance of the orchestrator, started once the application is ready:
 * optional recovery of in-flight sagas, then a periodic sweep cancelling timed out sagas.
 */
public class SagaMaintenanceScheduler implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SagaMaintenanceScheduler.class);

    private final SagaOrchestrator orchestrator;
    private final SagaRecoveryService recoveryService;
    private final SagaOrchestratorProperties properties;
    private final Scheduler scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Disposable subscription;

    public SagaMaintenanceScheduler(SagaOrchestrator orchestrator,
                                    SagaRecoveryService recoveryService,
                                    SagaOrchestratorProperties properties,
                                    Scheduler scheduler) {
        this.orchestrator = orchestrator;
        this.recoveryService = recoveryService;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    /**
     * Starts recovery and the timeout sweep. Subsequent calls are ignored.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Mono<Void> recovery = Mono.empty();
        if (properties.getRecovery().isEnabled()) {
            recovery = recoveryService.recoverInFlightSagas()
                    .doOnNext(result -> log.info("Startup saga recovery finished: {}", result))
                    .onErrorResume(error -> {
                        log.error("Startup saga recovery failed", error);
                        return Mono.empty();
                    })
                    .then();
        }

        Flux<Long> sweeps = Flux.empty();
        if (properties.isTimeoutCheckEnabled()) {
            Duration interval = properties.getTimeoutCheckInterval();
            log.info("Scheduling saga timeout sweep every {}", interval);
            sweeps = Flux.interval(interval, interval, scheduler)
                    .onBackpressureDrop()
                    .concatMap(tick -> orchestrator.processTimedOutSagas()
                            .onErrorResume(error -> {
                                log.error("Saga timeout sweep failed", error);
                                return Mono.just(0L);
                            }));
        }

        subscription = recovery.thenMany(sweeps)
                .subscribe(null, error -> log.error("Saga maintenance stopped unexpectedly", error));
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    @Override
    public void destroy() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
            log.debug("Stopped saga maintenance");
        }
    }
}
