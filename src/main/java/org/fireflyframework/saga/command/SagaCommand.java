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

package org.fireflyframework.saga.command;

import java.util.Map;

/**
 * Command message sent to the {@link CommandBus} for a step or its compensation.
 * <p>
 * Applications usually model their commands as a closed family of records implementing this
 * interface so a handler can switch over every known kind. {@link #of(String, Map)} builds an
 * untyped command for the simple cases.
 */
public interface SagaCommand {

    /** Dispatch key used by the bus to select a handler. */
    String commandType();

    /** Opaque command payload. */
    Map<String, Object> payload();

    static SagaCommand of(String commandType, Map<String, Object> payload) {
        return new GenericSagaCommand(commandType, payload);
    }

    static SagaCommand of(String commandType) {
        return new GenericSagaCommand(commandType, Map.of());
    }
}
