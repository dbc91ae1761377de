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

import java.util.Optional;

/**
 * Outcome reported by the {@link CommandBus} for one command.
 *
 * @param successful whether the command was accepted
 * @param error failure description, null on success
 */
public record CommandResult(boolean successful, String error) {

    private static final CommandResult SUCCESS = new CommandResult(true, null);

    public static CommandResult success() {
        return SUCCESS;
    }

    public static CommandResult failure(String error) {
        return new CommandResult(false, error != null ? error : "Command failed");
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
