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
import org.fireflyframework.saga.persistence.SagaRecoveryService.RecoveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SagaMaintenanceSchedulerTest {

    private SagaOrchestrator orchestrator;
    private SagaRecoveryService recoveryService;
    private SagaOrchestratorProperties properties;
    private VirtualTimeScheduler scheduler;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SagaOrchestrator.class);
        recoveryService = mock(SagaRecoveryService.class);
        when(orchestrator.processTimedOutSagas()).thenReturn(Mono.just(0L));
        when(recoveryService.recoverInFlightSagas())
                .thenReturn(Mono.just(new RecoveryResult(0, 0, 0, 0, Duration.ZERO)));
        properties = new SagaOrchestratorProperties();
        properties.setTimeoutCheckInterval(Duration.ofSeconds(10));
        scheduler = VirtualTimeScheduler.create();
    }

    @Test
    void sweepsTimedOutSagasPeriodically() {
        SagaMaintenanceScheduler maintenance = new SagaMaintenanceScheduler(orchestrator, recoveryService, properties, scheduler);

        maintenance.start();
        scheduler.advanceTimeBy(Duration.ofSeconds(35));

        verify(orchestrator, times(3)).processTimedOutSagas();
        verify(recoveryService, never()).recoverInFlightSagas();
        assertThat(maintenance.isRunning()).isTrue();

        maintenance.destroy();
        scheduler.advanceTimeBy(Duration.ofSeconds(30));

        verify(orchestrator, times(3)).processTimedOutSagas();
        assertThat(maintenance.isRunning()).isFalse();
    }

    @Test
    void runsRecoveryOnceBeforeSweeping() {
        properties.getRecovery().setEnabled(true);
        SagaMaintenanceScheduler maintenance = new SagaMaintenanceScheduler(orchestrator, recoveryService, properties, scheduler);

        maintenance.onApplicationReady();
        maintenance.onApplicationReady();
        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        verify(recoveryService, times(1)).recoverInFlightSagas();
        verify(orchestrator, times(1)).processTimedOutSagas();
        maintenance.destroy();
    }

    @Test
    void sweepErrorsDoNotStopTheSchedule() {
        when(orchestrator.processTimedOutSagas())
                .thenReturn(Mono.error(new IllegalStateException("redis down")))
                .thenReturn(Mono.just(1L));
        SagaMaintenanceScheduler maintenance = new SagaMaintenanceScheduler(orchestrator, recoveryService, properties, scheduler);

        maintenance.start();
        scheduler.advanceTimeBy(Duration.ofSeconds(20));

        verify(orchestrator, times(2)).processTimedOutSagas();
        assertThat(maintenance.isRunning()).isTrue();
        maintenance.destroy();
    }

    @Test
    void disabledTimeoutCheckSchedulesNothing() {
        properties.setTimeoutCheckEnabled(false);
        SagaMaintenanceScheduler maintenance = new SagaMaintenanceScheduler(orchestrator, recoveryService, properties, scheduler);

        maintenance.start();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));

        verify(orchestrator, never()).processTimedOutSagas();
        assertThat(maintenance.isRunning()).isFalse();
    }
}
