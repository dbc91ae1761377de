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

/**
 * Thrown when a {@link SagaInstance} transition is not allowed from its current state.
 * The instance is left unchanged.
 */
public class SagaStateException extends IllegalStateException {

    private final String sagaId;
    private final SagaState state;

    public SagaStateException(String sagaId, SagaState state, String message) {
        super(message + " (saga " + sagaId + " is " + state + ")");
        this.sagaId = sagaId;
        this.state = state;
    }

    public String getSagaId() {
        return sagaId;
    }

    public SagaState getState() {
        return state;
    }
}
