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

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Service responsible for resuming in-flight sagas after application restarts.
 * <p>
 * A saga interrupted by a shutdown or crash stays RUNNING or COMPENSATING in the repository.
 * Recovery rehydrates it and continues where the persisted context says it stopped: RUNNING
 * sagas re-dispatch their current step command, COMPENSATING sagas continue compensation.
 * Step commands are therefore delivered at least once.
 */
public interface SagaRecoveryService {

    /**
     * Resumes every RUNNING and COMPENSATING saga found in the repository.
     *
     * @return Mono containing the recovery result with statistics
     */
    Mono<RecoveryResult> recoverInFlightSagas();

    /**
     * Resumes a single saga, for manual recovery or retry scenarios.
     */
    Mono<SingleRecoveryResult> recoverSaga(String sagaId);

    /**
     * Result of saga recovery operations.
     */
    class RecoveryResult {
        private final int totalFound;
        private final int resumed;
        private final int failed;
        private final int skipped;
        private final Duration recoveryTime;

        public RecoveryResult(int totalFound, int resumed, int failed, int skipped, Duration recoveryTime) {
            this.totalFound = totalFound;
            this.resumed = resumed;
            this.failed = failed;
            this.skipped = skipped;
            this.recoveryTime = recoveryTime;
        }

        public int getTotalFound() { return totalFound; }
        public int getResumed() { return resumed; }
        public int getFailed() { return failed; }
        public int getSkipped() { return skipped; }
        public Duration getRecoveryTime() { return recoveryTime; }

        @Override
        public String toString() {
            return String.format("RecoveryResult{total=%d, resumed=%d, failed=%d, skipped=%d, time=%s}",
                    totalFound, resumed, failed, skipped, recoveryTime);
        }
    }

    /**
     * Result of single saga recovery.
     */
    class SingleRecoveryResult {
        private final String sagaId;
        private final RecoveryStatus status;
        private final String message;

        public SingleRecoveryResult(String sagaId, RecoveryStatus status, String message) {
            this.sagaId = sagaId;
            this.status = status;
            this.message = message;
        }

        public String getSagaId() { return sagaId; }
        public RecoveryStatus getStatus() { return status; }
        public String getMessage() { return message; }

        public enum RecoveryStatus {
            RESUMED,
            SKIPPED,
            NOT_FOUND,
            FAILED
        }

        @Override
        public String toString() {
            return String.format("SingleRecoveryResult{sagaId=%s, status=%s, message=%s}", sagaId, status, message);
        }
    }
}
