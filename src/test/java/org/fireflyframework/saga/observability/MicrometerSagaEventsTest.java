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

package org.fireflyframework.saga.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.saga.command.SagaCommand;
import org.fireflyframework.saga.core.SagaState;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.persistence.impl.InMemorySagaRepository;
import org.fireflyframework.saga.registry.RetryPolicy;
import org.fireflyframework.saga.registry.SagaBuilder;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.fireflyframework.saga.testsupport.RecordingCommandBus;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerSagaEventsTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MicrometerSagaEvents events = new MicrometerSagaEvents(meterRegistry);

    @Test
    void countsLifecycleEventsPerSagaType() {
        events.onStarted("order", "s1", "s1");
        events.onStarted("order", "s2", "s2");
        events.onStepFailed("order", "s1", "charge", "declined", 1);
        events.onStepRetryScheduled("order", "s1", "charge", 1, Duration.ofMillis(100));
        events.onStepTimedOut("order", "s1", "charge", Duration.ofSeconds(5));
        events.onCancelled("order", "s2");

        assertThat(meterRegistry.get("saga.started").tag("saga.type", "order").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("saga.step.failed").tag("step.id", "charge").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.step.retries").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.step.timeouts").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.cancelled").counter().count()).isEqualTo(1.0);
    }

    @Test
    void tagsCompensationsAndFinishedSagasWithTheirOutcome() {
        events.onStepCompensated("order", "s1", "charge", null);
        events.onStepCompensated("order", "s1", "reserve", new IllegalStateException("offline"));
        events.onCompensationSkipped("order", "s1", "notify");
        events.onFinished("order", "s1", SagaState.FAILED, Duration.ofSeconds(3));
        events.onFinished("order", "s2", SagaState.COMPLETED, Duration.ofSeconds(1));

        assertThat(meterRegistry.get("saga.compensation.completed").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.compensation.completed").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.compensation.completed").tag("outcome", "skipped").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.finished").tag("outcome", "failed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.duration").tag("outcome", "completed").timer().count()).isEqualTo(1);
    }

    @Test
    void recordsMetricsFromARealExecution() {
        RecordingCommandBus bus = new RecordingCommandBus().fail("payment.charge", "declined");
        SagaOrchestrator orchestrator = new SagaOrchestrator(new SagaRegistry(), new InMemorySagaRepository(), bus,
                events, Schedulers.immediate(), Clock.systemUTC());
        orchestrator.registerSagaDefinition(SagaBuilder.saga("order")
                .step("reserve").command(SagaCommand.of("inventory.reserve"))
                    .compensation(SagaCommand.of("inventory.release")).add()
                .step("charge").command(SagaCommand.of("payment.charge")).retry(RetryPolicy.noRetry()).add()
                .build());

        String sagaId = orchestrator.startSaga("order", Map.of()).block();
        orchestrator.completeStep(sagaId, Map.of()).block();

        assertThat(meterRegistry.get("saga.started").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("saga.finished").tag("outcome", "compensated").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("saga.step.retries").counter()).isNull();
    }
}
