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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link CommandBus} dispatching each command to the handler registered for its type.
 * <p>
 * {@link #send(SagaCommand)} never errors: unknown command types, handler exceptions and empty
 * handler results all come back as {@link CommandResult#failure(String)}.
 */
public class DefaultCommandBus implements CommandBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandBus.class);

    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();

    public DefaultCommandBus() {
        this(List.of());
    }

    public DefaultCommandBus(Collection<? extends CommandHandler> handlers) {
        handlers.forEach(this::register);
    }

    /**
     * Registers a handler for its command type.
     *
     * @throws HandlerAlreadyRegisteredException if the type already has a handler
     */
    public void register(CommandHandler handler) {
        String type = handler.commandType();
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new HandlerAlreadyRegisteredException(type);
        }
        log.debug("Registered command handler {} for type {}", handler.getClass().getSimpleName(), type);
    }

    public boolean hasHandler(String commandType) {
        return handlers.containsKey(commandType);
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Mono<CommandResult> send(SagaCommand command) {
        CommandHandler handler = handlers.get(command.commandType());
        if (handler == null) {
            log.warn("No handler registered for command type {}", command.commandType());
            return Mono.just(CommandResult.failure("No handler registered for command type " + command.commandType()));
        }
        return Mono.defer(() -> handler.handle(command))
                .defaultIfEmpty(CommandResult.failure("Handler for " + command.commandType() + " returned no result"))
                .onErrorResume(error -> {
                    log.warn("Command handler for type {} failed: {}", command.commandType(), error.toString());
                    return Mono.just(CommandResult.failure(error.getMessage() != null
                            ? error.getMessage()
                            : error.getClass().getSimpleName()));
                });
    }
}
