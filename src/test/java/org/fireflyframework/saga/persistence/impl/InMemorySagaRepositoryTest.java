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
import org.fireflyframework.saga.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySagaRepositoryTest {

    private MutableClock clock;
    private InMemorySagaRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T10:00:00Z");
        repository = new InMemorySagaRepository(clock);
    }

    @Test
    void saveIncrementsTheVersion() {
        SagaExecutionContext saved = repository.save(context("s1", SagaState.RUNNING)).block();
        assertThat(saved.getVersion()).isEqualTo(1);

        SagaExecutionContext updated = repository.save(saved.toBuilder().currentStepIndex(1).build()).block();
        assertThat(updated.getVersion()).isEqualTo(2);

        StepVerifier.create(repository.load("s1"))
                .assertNext(loaded -> {
                    assertThat(loaded.getVersion()).isEqualTo(2);
                    assertThat(loaded.getCurrentStepIndex()).isEqualTo(1);
                    assertThat(loaded.getData()).containsEntry("orderId", "123");
                })
                .verifyComplete();
    }

    @Test
    void staleWriteIsRejected() {
        SagaExecutionContext first = repository.save(context("s1", SagaState.RUNNING)).block();
        repository.save(first.toBuilder().currentStepIndex(1).build()).block();

        StepVerifier.create(repository.save(first.toBuilder().currentStepIndex(2).build()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(SagaConcurrencyException.class);
                    SagaConcurrencyException conflict = (SagaConcurrencyException) error;
                    assertThat(conflict.getExpectedVersion()).isEqualTo(1);
                    assertThat(conflict.getActualVersion()).isEqualTo(2);
                })
                .verify();
        assertThat(repository.load("s1").block().getCurrentStepIndex()).isEqualTo(1);
    }

    @Test
    void secondFreshInsertOfSameIdIsRejected() {
        repository.save(context("s1", SagaState.RUNNING)).block();

        StepVerifier.create(repository.save(context("s1", SagaState.RUNNING)))
                .expectError(SagaConcurrencyException.class)
                .verify();
    }

    @Test
    void versionedWriteOfMissingSagaIsRejected() {
        StepVerifier.create(repository.save(context("s1", SagaState.RUNNING).withVersion(3)))
                .expectErrorSatisfies(error -> assertThat(((SagaConcurrencyException) error).getActualVersion()).isEqualTo(-1))
                .verify();
    }

    @Test
    void loadOfMissingSagaIsEmpty() {
        StepVerifier.create(repository.load("missing")).verifyComplete();
    }

    @Test
    void queriesFilterByCorrelationStateAndTimeout() {
        repository.save(context("s1", SagaState.RUNNING).toBuilder().correlationId("order-1").build()).block();
        repository.save(context("s2", SagaState.COMPENSATING).toBuilder().correlationId("order-1").build()).block();
        repository.save(context("s3", SagaState.CANCELLED).toBuilder().correlationId("order-2").build()).block();

        StepVerifier.create(repository.findByCorrelationId("order-1").map(SagaExecutionContext::getSagaId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("s1", "s2"))
                .verifyComplete();
        StepVerifier.create(repository.findByState(SagaState.CANCELLED).map(SagaExecutionContext::getSagaId))
                .expectNext("s3")
                .verifyComplete();
        StepVerifier.create(repository.findTimedOut()).verifyComplete();

        clock.advance(Duration.ofMinutes(10));

        StepVerifier.create(repository.findTimedOut().map(SagaExecutionContext::getSagaId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("s1", "s2"))
                .verifyComplete();
    }

    @Test
    void deleteRemovesTheSaga() {
        repository.save(context("s1", SagaState.RUNNING)).block();

        StepVerifier.create(repository.delete("s1")).verifyComplete();
        StepVerifier.create(repository.delete("s1")).verifyComplete();

        assertThat(repository.size()).isZero();
        StepVerifier.create(repository.load("s1")).verifyComplete();
    }

    private SagaExecutionContext context(String sagaId, SagaState state) {
        Instant now = clock.instant();
        return SagaExecutionContext.builder()
                .sagaId(sagaId)
                .sagaType("order_fulfillment")
                .correlationId(sagaId)
                .state(state)
                .data(Map.of("orderId", "123"))
                .startedAt(now)
                .lastUpdatedAt(now)
                .timeoutAt(now.plus(Duration.ofMinutes(5)))
                .build();
    }
}
