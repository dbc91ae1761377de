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

import reactor.core.publisher.Mono;

/**
 * Transport that executes a single step command.
 * <p>
 * Implementations should report failures through {@link CommandResult#failure(String)}. The
 * orchestrator still treats an errored or empty {@code Mono} as a failed result.
 */
public interface CommandBus {

    Mono<CommandResult> send(SagaCommand command);
}
