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

package org.fireflyframework.saga.engine;

import java.time.Duration;

/**
 * Reported as the failure of a step whose command did not resolve within the step timeout.
 */
public class StepTimeoutException extends RuntimeException {

    private final String sagaId;
    private final String stepId;
    private final Duration timeout;

    public StepTimeoutException(String sagaId, String stepId, Duration timeout) {
        super("Step '" + stepId + "' of saga " + sagaId + " timed out after " + timeout.toMillis() + "ms");
        this.sagaId = sagaId;
        this.stepId = stepId;
        this.timeout = timeout;
    }

    public String getSagaId() {
        return sagaId;
    }

    public String getStepId() {
        return stepId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
