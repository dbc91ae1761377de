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
 * Handles one command type on behalf of the {@link DefaultCommandBus}.
 * <p>
 * Handlers can signal failure by returning {@link CommandResult#failure(String)}, by emitting an
 * error or by throwing; the bus converts all three into a failed result.
 */
public interface CommandHandler {

    /** Command type this handler accepts. */
    String commandType();

    Mono<CommandResult> handle(SagaCommand command);
}
