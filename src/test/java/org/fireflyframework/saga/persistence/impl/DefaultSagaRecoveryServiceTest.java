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

import org.fireflyframework.saga.command.SagaCommand;
import org.fireflyframework.saga.core.SagaInstance;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.persistence.SagaRecoveryService.RecoveryResult;
import org.fireflyframework.saga.persistence.SagaRecoveryService.SingleRecoveryResult.RecoveryStatus;
import org.fireflyframework.saga.registry.SagaBuilder;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.fireflyframework.saga.testsupport.RecordingCommandBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class DefaultSagaRecoveryServiceTest {

    private SagaDefinition definition;
    private SagaRegistry registry;
    private InMemorySagaRepository repository;
    private RecordingCommandBus bus;
    private SagaOrchestrator orchestrator;
    private DefaultSagaRecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        definition = SagaBuilder.saga("order_fulfillment")
                .step("reserve").command(SagaCommand.of("inventory.reserve"))
                    .compensation(SagaCommand.of("inventory.release")).add()
                .step("charge").command(SagaCommand.of("payment.charge")).add()
                .build();
        registry = new SagaRegistry();
        registry.register(definition);
        repository = new InMemorySagaRepository();
        bus = new RecordingCommandBus();
        orchestrator = new SagaOrchestrator(registry, repository, bus);
        recoveryService = new DefaultSagaRecoveryService(repository, orchestrator, registry);
    }

    @Test
    void resumesRunningAndCompensatingSagas() {
        SagaInstance running = SagaInstance.create(definition, "running", null);
        running.start(Map.of());
        repository.save(running.getContext()).block();

        SagaInstance compensating = SagaInstance.create(definition, "compensating", null);
        compensating.start(Map.of());
        compensating.completeCurrentStep(Map.of());
        compensating.failCurrentStep("declined");
        compensating.startCompensation();
        repository.save(compensating.getContext()).block();

        SagaInstance cancelled = SagaInstance.create(definition, "cancelled", null);
        cancelled.start(Map.of());
        cancelled.cancel();
        repository.save(cancelled.getContext()).block();

        StepVerifier.create(recoveryService.recoverInFlightSagas())
                .assertNext(result -> {
                    assertThat(result.getTotalFound()).isEqualTo(2);
                    assertThat(result.getResumed()).isEqualTo(2);
                    assertThat(result.getFailed()).isZero();
                    assertThat(result.getSkipped()).isZero();
                })
                .verifyComplete();

        assertThat(bus.sentTypes()).containsExactlyInAnyOrder("inventory.reserve", "inventory.release");
    }

    @Test
    void skipsSagasWithoutRegisteredDefinition() {
        SagaDefinition foreign = SagaBuilder.saga("legacy").step("a").command(SagaCommand.of("a.do")).add().build();
        SagaInstance instance = SagaInstance.create(foreign, "legacy-1", null);
        instance.start(Map.of());
        repository.save(instance.getContext()).block();

        RecoveryResult result = recoveryService.recoverInFlightSagas().block();

        assertThat(result.getTotalFound()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(bus.getSent()).isEmpty();
    }

    @Test
    void countsFailedResumes() {
        SagaOrchestrator failing = spy(orchestrator);
        doReturn(Mono.error(new IllegalStateException("storage unavailable"))).when(failing).resumeSaga("running");
        DefaultSagaRecoveryService service = new DefaultSagaRecoveryService(repository, failing, registry);

        SagaInstance running = SagaInstance.create(definition, "running", null);
        running.start(Map.of());
        repository.save(running.getContext()).block();

        StepVerifier.create(service.recoverSaga("running"))
                .assertNext(single -> {
                    assertThat(single.getStatus()).isEqualTo(RecoveryStatus.FAILED);
                    assertThat(single.getMessage()).isEqualTo("storage unavailable");
                })
                .verifyComplete();
        assertThat(service.recoverInFlightSagas().block().getFailed()).isEqualTo(1);
    }

    @Test
    void recoverSingleSagaReportsMissingAndFinishedSagas() {
        StepVerifier.create(recoveryService.recoverSaga("missing"))
                .assertNext(single -> assertThat(single.getStatus()).isEqualTo(RecoveryStatus.NOT_FOUND))
                .verifyComplete();

        SagaInstance cancelled = SagaInstance.create(definition, "cancelled", null);
        cancelled.cancel();
        repository.save(cancelled.getContext()).block();

        StepVerifier.create(recoveryService.recoverSaga("cancelled"))
                .assertNext(single -> assertThat(single.getStatus()).isEqualTo(RecoveryStatus.SKIPPED))
                .verifyComplete();
    }
}
