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

package org.fireflyframework.saga.core;

import org.fireflyframework.saga.command.SagaCommand;
import org.fireflyframework.saga.registry.RetryPolicy;
import org.fireflyframework.saga.registry.SagaBuilder;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SagaInstanceTest {

    private MutableClock clock;
    private SagaDefinition definition;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T10:00:00Z");
        definition = SagaBuilder.saga("order_fulfillment")
                .step("reserve").command(SagaCommand.of("inventory.reserve"))
                    .compensation(SagaCommand.of("inventory.release")).add()
                .step("charge").command(SagaCommand.of("payment.charge"))
                    .compensation(SagaCommand.of("payment.refund"))
                    .retry(new RetryPolicy(3, 100, 1000, 2.0)).add()
                .step("ship").command(SagaCommand.of("shipping.ship")).add()
                .globalTimeout(Duration.ofMinutes(5))
                .build();
    }

    @Test
    void createStartsPendingAtFirstStep() {
        SagaInstance saga = SagaInstance.create(definition, "saga-1", null, clock);

        assertThat(saga.getState()).isEqualTo(SagaState.PENDING);
        assertThat(saga.getCurrentStepIndex()).isZero();
        assertThat(saga.getCorrelationId()).isEqualTo("saga-1");
        assertThat(saga.getVersion()).isZero();
        assertThat(saga.getContext().getTimeoutAt()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));
        assertThat(saga.getCurrentStep()).map(s -> s.getStepId()).contains("reserve");
    }

    @Test
    void startMergesInitialDataAndRejectsSecondStart() {
        SagaInstance saga = SagaInstance.create(definition, "saga-1", "order-123", clock);
        saga.start(Map.of("orderId", "123"));

        assertThat(saga.getState()).isEqualTo(SagaState.RUNNING);
        assertThat(saga.getData()).containsEntry("orderId", "123");
        assertThat(saga.getCorrelationId()).isEqualTo("order-123");

        assertThatThrownBy(() -> saga.start(Map.of()))
                .isInstanceOf(SagaStateException.class)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void completingEveryStepCompletesTheSaga() {
        SagaInstance saga = running();

        saga.completeCurrentStep(Map.of("reservationId", "r-1"));
        saga.completeCurrentStep(null);
        assertThat(saga.getState()).isEqualTo(SagaState.RUNNING);
        saga.completeCurrentStep(Map.of("trackingId", "t-9"));

        assertThat(saga.getState()).isEqualTo(SagaState.COMPLETED);
        assertThat(saga.getCompletedSteps()).containsExactly("reserve", "charge", "ship");
        assertThat(saga.getData()).containsEntry("reservationId", "r-1").containsEntry("trackingId", "t-9");
        assertThat(saga.getCurrentStep()).isEmpty();

        assertThatThrownBy(() -> saga.completeCurrentStep(Map.of()))
                .isInstanceOf(SagaStateException.class);
    }

    @Test
    void completingAStepResetsTheRetryCount() {
        SagaInstance saga = running();
        saga.completeCurrentStep(null);
        saga.failCurrentStep("declined");
        assertThat(saga.getRetryCount()).isEqualTo(1);

        saga.completeCurrentStep(null);

        assertThat(saga.getRetryCount()).isZero();
    }

    @Test
    void failureWithoutRetryPolicyMovesToCompensating() {
        SagaInstance saga = running();

        saga.failCurrentStep("out of stock");

        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATING);
        assertThat(saga.getFailedSteps()).containsExactly("reserve");
        assertThat(saga.getErrorMessage()).isEqualTo("out of stock");
        assertThat(saga.shouldRetryCurrentStep()).isFalse();
    }

    @Test
    void retryPolicyAllowsTwoRetriesForThreeAttempts() {
        SagaInstance saga = running();
        saga.completeCurrentStep(null);

        saga.failCurrentStep("timeout");
        assertThat(saga.getState()).isEqualTo(SagaState.RUNNING);
        assertThat(saga.shouldRetryCurrentStep()).isTrue();
        assertThat(saga.getRetryDelay()).isEqualTo(Duration.ofMillis(100));

        saga.failCurrentStep("timeout");
        assertThat(saga.shouldRetryCurrentStep()).isTrue();
        assertThat(saga.getRetryDelay()).isEqualTo(Duration.ofMillis(200));

        saga.failCurrentStep("timeout");
        assertThat(saga.getRetryCount()).isEqualTo(3);
        assertThat(saga.shouldRetryCurrentStep()).isFalse();
        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATING);
        assertThat(saga.getFailedSteps()).containsExactly("charge", "charge", "charge");
    }

    @Test
    void retryDelayIsCappedExponentialBackoff() {
        SagaDefinition def = SagaBuilder.saga("backoff")
                .step("s1").command(SagaCommand.of("cmd"))
                    .retry(new RetryPolicy(10, 100, 1000, 2.0)).add()
                .build();
        SagaInstance saga = SagaInstance.create(def, "saga-2", null, clock);
        saga.start(Map.of());

        for (int i = 0; i < 4; i++) {
            saga.failCurrentStep("boom");
        }
        assertThat(saga.getRetryCount()).isEqualTo(4);
        assertThat(saga.getRetryDelay()).isEqualTo(Duration.ofMillis(800));

        saga.failCurrentStep("boom");
        assertThat(saga.getRetryDelay()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void retryDelayIsZeroWithoutPolicy() {
        assertThat(running().getRetryDelay()).isEqualTo(Duration.ZERO);
    }

    @Test
    void compensationWalksCompletedStepsBackwards() {
        SagaInstance saga = running();
        saga.completeCurrentStep(null);
        saga.completeCurrentStep(null);

        saga.startCompensation();
        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATING);
        assertThat(saga.getCurrentStep()).map(s -> s.getStepId()).contains("charge");

        saga.completeCurrentCompensation();
        assertThat(saga.getCurrentStep()).map(s -> s.getStepId()).contains("reserve");

        saga.completeCurrentCompensation();
        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(saga.getCompensatedSteps()).containsExactly("charge", "reserve");
    }

    @Test
    void compensationWithNothingCompletedEndsCompensatedImmediately() {
        SagaInstance saga = running();
        saga.failCurrentStep("boom");

        saga.startCompensation();

        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(saga.getCurrentStepIndex()).isEqualTo(-1);
    }

    @Test
    void compensationResumesAfterAlreadyCompensatedSteps() {
        SagaInstance saga = running();
        saga.completeCurrentStep(null);
        saga.completeCurrentStep(null);
        saga.startCompensation();
        saga.completeCurrentCompensation();

        SagaInstance restored = SagaInstance.fromContext(definition, saga.getContext(), clock);
        restored.startCompensation();

        assertThat(restored.getCurrentStep()).map(s -> s.getStepId()).contains("reserve");
    }

    @Test
    void compensationIsRejectedOnceFinished() {
        SagaInstance completed = running();
        completed.completeCurrentStep(null);
        completed.completeCurrentStep(null);
        completed.completeCurrentStep(null);

        assertThatThrownBy(completed::startCompensation).isInstanceOf(SagaStateException.class);
        assertThatThrownBy(completed::completeCurrentCompensation).isInstanceOf(SagaStateException.class);
    }

    @Test
    void cancelIsRejectedInEveryTerminalState() {
        SagaInstance completed = running();
        completed.completeCurrentStep(null);
        completed.completeCurrentStep(null);
        completed.completeCurrentStep(null);

        SagaInstance failed = running();
        failed.markAsFailed("compensation failed");

        SagaInstance compensated = running();
        compensated.failCurrentStep("boom");
        compensated.startCompensation();

        SagaInstance cancelled = running();
        cancelled.cancel();

        for (SagaInstance saga : List.of(completed, failed, compensated, cancelled)) {
            SagaState before = saga.getState();
            assertThatThrownBy(saga::cancel)
                    .isInstanceOf(SagaStateException.class)
                    .satisfies(e -> assertThat(((SagaStateException) e).getState()).isEqualTo(before));
            assertThat(saga.getState()).isEqualTo(before);
        }
    }

    @Test
    void cancelledSagaWithCompletedStepsCanCompensate() {
        SagaInstance saga = running();
        saga.completeCurrentStep(null);
        saga.cancel();

        saga.startCompensation();

        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATING);
        assertThat(saga.getCurrentStep()).map(s -> s.getStepId()).contains("reserve");
    }

    @Test
    void markAsFailedIsRejectedAfterCompletion() {
        SagaInstance saga = running();
        saga.failCurrentStep("boom");
        saga.startCompensation();

        assertThatThrownBy(() -> saga.markAsFailed("late")).isInstanceOf(SagaStateException.class);
        assertThat(saga.getState()).isEqualTo(SagaState.COMPENSATED);
    }

    @Test
    void failIsRejectedWhenNotRunning() {
        SagaInstance saga = SagaInstance.create(definition, "saga-1", null, clock);

        assertThatThrownBy(() -> saga.failCurrentStep("boom")).isInstanceOf(SagaStateException.class);
        assertThat(saga.getFailedSteps()).isEmpty();
        assertThat(saga.getRetryCount()).isZero();
    }

    @Test
    void timesOutOnlyWhileInFlight() {
        SagaInstance saga = running();
        assertThat(saga.isTimedOut()).isFalse();

        clock.advance(Duration.ofMinutes(6));
        assertThat(saga.isTimedOut()).isTrue();
        assertThat(saga.getContext().isTimedOut(clock.instant())).isTrue();

        saga.cancel();
        assertThat(saga.isTimedOut()).isFalse();
    }

    @Test
    void contextRoundTripPreservesState() {
        SagaInstance saga = running();
        saga.completeCurrentStep(Map.of("reservationId", "r-1"));
        saga.failCurrentStep("declined");

        SagaExecutionContext context = saga.getContext();
        SagaInstance restored = SagaInstance.fromContext(definition, context, clock);

        assertThat(restored.getContext()).isEqualTo(context);
        assertThat(restored.getRetryCount()).isEqualTo(1);
        assertThat(restored.getCurrentStep()).map(s -> s.getStepId()).contains("charge");
    }

    @Test
    void fromContextRejectsForeignSagaType() {
        SagaExecutionContext context = running().getContext().toBuilder().sagaType("other").build();

        assertThatThrownBy(() -> SagaInstance.fromContext(definition, context, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("other");
    }

    @Test
    void snapshotIsIsolatedFromLaterTransitions() {
        SagaInstance saga = running();
        SagaExecutionContext before = saga.getContext();

        saga.completeCurrentStep(Map.of("k", "v"));

        assertThat(before.getCompletedSteps()).isEmpty();
        assertThat(before.getData()).doesNotContainKey("k");
        assertThatThrownBy(() -> before.getData().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    private SagaInstance running() {
        SagaInstance saga = SagaInstance.create(definition, "saga-1", null, clock);
        saga.start(Map.of("orderId", "123"));
        return saga;
    }
}
