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

/**
 * Passed to the failure callback of a saga whose compensation could not complete.
 * The saga is left FAILED for manual remediation.
 */
public class CompensationException extends RuntimeException {

    private final String sagaId;
    private final String stepId;

    public CompensationException(String sagaId, String stepId, String error) {
        super("Compensation of step '" + stepId + "' in saga " + sagaId + " failed: " + error);
        this.sagaId = sagaId;
        this.stepId = stepId;
    }

    public String getSagaId() {
        return sagaId;
    }

    public String getStepId() {
        return stepId;
    }
}
