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

import org.fireflyframework.saga.command.CommandBus;
import org.fireflyframework.saga.command.CommandResult;
import org.fireflyframework.saga.command.SagaCommand;
import org.fireflyframework.saga.core.SagaExecutionContext;
import org.fireflyframework.saga.core.SagaInstance;
import org.fireflyframework.saga.core.SagaState;
import org.fireflyframework.saga.core.SagaStateException;
import org.fireflyframework.saga.events.DomainEvent;
import org.fireflyframework.saga.events.SagaEventHandler;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.persistence.SagaConcurrencyException;
import org.fireflyframework.saga.persistence.SagaRepository;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.fireflyframework.saga.registry.SagaStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Drives saga executions: starts them, dispatches step commands, schedules retries and step
 * timeouts, runs compensation in reverse order and persists every transition.
 * <p>
 * Every operation loads the context from the {@link SagaRepository}, rehydrates a
 * {@link SagaInstance}, applies a transition and saves the result. The repository's version check
 * is the only synchronization between concurrent signals for the same saga: a rejected transition
 * ({@link SagaStateException}) or a stale write ({@link SagaConcurrencyException}) is logged and
 * the operation completes empty. Repository failures propagate to the caller.
 * <p>
 * A successful command acknowledgement does not complete a step. Completion is reported later
 * through {@link #completeStep}, directly or via a routed {@link DomainEvent}.
 */
public class SagaOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestrator.class);

    private final SagaRegistry registry;
    private final SagaRepository repository;
    private final CommandBus commandBus;
    private final SagaEvents events;
    private final StepTimerRegistry timers;
    private final Clock clock;
    private final List<SagaEventHandler> eventHandlers = new CopyOnWriteArrayList<>();

    public SagaOrchestrator(SagaRegistry registry, SagaRepository repository, CommandBus commandBus) {
        this(registry, repository, commandBus, new SagaEvents() { }, Schedulers.parallel(), Clock.systemUTC());
    }

    public SagaOrchestrator(SagaRegistry registry,
                            SagaRepository repository,
                            CommandBus commandBus,
                            SagaEvents events,
                            Scheduler timerScheduler,
                            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.commandBus = Objects.requireNonNull(commandBus, "commandBus");
        this.events = events != null ? events : new SagaEvents() { };
        this.timers = new StepTimerRegistry(Objects.requireNonNull(timerScheduler, "timerScheduler"));
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ------------------------------------------------------------------ registration

    /**
     * @throws org.fireflyframework.saga.registry.SagaDefinitionException if the type is already registered
     */
    public void registerSagaDefinition(SagaDefinition definition) {
        registry.register(definition);
    }

    public void registerEventHandler(SagaEventHandler handler) {
        eventHandlers.add(Objects.requireNonNull(handler, "handler"));
        log.debug("Registered saga event handler {}", handler.getClass().getSimpleName());
    }

    // ------------------------------------------------------------------ public operations

    public Mono<String> startSaga(String sagaType, Map<String, Object> initialData) {
        return startSaga(sagaType, initialData, null);
    }

    /**
     * Creates, starts and persists a saga, then dispatches its first step.
     *
     * @param correlationId business identifier; defaults to the generated saga id
     * @return the saga id. Errors with {@code SagaDefinitionException} if the type is unknown.
     */
    public Mono<String> startSaga(String sagaType, Map<String, Object> initialData, String correlationId) {
        return Mono.defer(() -> {
            SagaDefinition definition = registry.getSaga(sagaType);
            String sagaId = UUID.randomUUID().toString();
            SagaInstance instance = SagaInstance.create(definition, sagaId, correlationId, clock);
            instance.start(initialData);
            return persist(instance)
                    .flatMap(saved -> {
                        log.info("Started saga {} of type '{}' (correlation {})", sagaId, sagaType, saved.getCorrelationId());
                        events.onStarted(sagaType, sagaId, saved.getCorrelationId());
                        return executeCurrentStep(saved);
                    })
                    .thenReturn(sagaId);
        });
    }

    /**
     * Completes the current step, merging {@code stepResult} into the saga data, and either
     * dispatches the next step or finishes the saga.
     */
    public Mono<Void> completeStep(String sagaId, Map<String, Object> stepResult) {
        return withSaga(sagaId, "completeStep", instance -> {
            String stepId = currentStepId(instance);
            instance.completeCurrentStep(stepResult);
            return persist(instance).flatMap(saved -> {
                timers.cancelStep(sagaId, stepId);
                events.onStepCompleted(saved.getSagaType(), sagaId, stepId);
                log.debug("Step '{}' of saga {} completed", stepId, sagaId);
                if (saved.getState() == SagaState.COMPLETED) {
                    return finishCompleted(saved);
                }
                return executeCurrentStep(saved);
            });
        }).then();
    }

    /**
     * Records a failed attempt of the current step. Retries after the step's backoff while its
     * retry policy allows, and starts compensation otherwise.
     */
    public Mono<Void> failStep(String sagaId, String error) {
        return failStep(sagaId, null, null, error);
    }

    public Mono<Void> failStep(String sagaId, Throwable error) {
        Objects.requireNonNull(error, "error");
        return failStep(sagaId, null, null, error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    /**
     * Cancels a saga and compensates the steps it already completed.
     * Rejected (logged, no-op) once the saga is finished. A saga that is already compensating is
     * left to its compensation, which is not cancellable.
     */
    public Mono<Void> cancelSaga(String sagaId) {
        return cancel(sagaId).then();
    }

    /**
     * Cancels every saga whose global timeout has passed while RUNNING or COMPENSATING. Timed out
     * COMPENSATING sagas keep compensating and are not counted.
     *
     * @return the number of sagas cancelled
     */
    public Mono<Long> processTimedOutSagas() {
        return repository.findTimedOut()
                .concatMap(context -> {
                    log.warn("Saga {} of type '{}' exceeded its timeout at {}", context.getSagaId(), context.getSagaType(), context.getTimeoutAt());
                    return cancel(context.getSagaId())
                            .onErrorResume(error -> {
                                log.error("Failed to cancel timed out saga {}", context.getSagaId(), error);
                                return Mono.empty();
                            });
                })
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("Cancelled {} timed out sagas", count);
                    }
                });
    }

    /**
     * Offers the event to every registered handler that accepts it. A failing handler is logged
     * and does not prevent the remaining handlers from running.
     */
    public Mono<Void> handleEvent(DomainEvent event) {
        return Flux.fromIterable(eventHandlers)
                .filter(handler -> accepts(handler, event))
                .concatMap(handler -> Mono.defer(() -> handler.handle(event, this))
                        .onErrorResume(error -> {
                            log.error("Event handler {} failed for event {} ({})",
                                    handler.getClass().getSimpleName(), event.eventType(), event.eventId(), error);
                            return Mono.empty();
                        }))
                .then();
    }

    /**
     * Continues a persisted saga after a restart: RUNNING sagas re-dispatch their current step,
     * COMPENSATING sagas continue compensation. Other states are left untouched.
     */
    public Mono<Void> resumeSaga(String sagaId) {
        return withSaga(sagaId, "resumeSaga", instance -> {
            return switch (instance.getState()) {
                case RUNNING -> {
                    log.info("Resuming saga {} at step '{}'", sagaId, currentStepId(instance));
                    yield executeCurrentStep(instance);
                }
                case COMPENSATING -> {
                    log.info("Resuming compensation of saga {}", sagaId);
                    yield executeCompensationStep(instance);
                }
                default -> {
                    log.debug("Saga {} is {}, nothing to resume", sagaId, instance.getState());
                    yield Mono.<Void>empty();
                }
            };
        }).then();
    }

    public Mono<SagaExecutionContext> getSaga(String sagaId) {
        return repository.load(sagaId);
    }

    public Flux<SagaExecutionContext> findByCorrelationId(String correlationId) {
        return repository.findByCorrelationId(correlationId);
    }

    /** Number of armed step timeout and retry timers. */
    public int pendingTimerCount() {
        return timers.pendingCount();
    }

    /** Cancels every outstanding timer. */
    public void dispose() {
        timers.dispose();
    }

    // ------------------------------------------------------------------ step execution

    private Mono<Void> executeCurrentStep(SagaInstance instance) {
        Optional<SagaStep> current = instance.getCurrentStep();
        if (instance.getState() != SagaState.RUNNING || current.isEmpty()) {
            return Mono.empty();
        }
        SagaStep step = current.get();
        String sagaId = instance.getSagaId();
        String sagaType = instance.getSagaType();
        String stepId = step.getStepId();
        int retryCount = instance.getRetryCount();
        StepTimerRegistry.TimerKey timeoutKey = StepTimerRegistry.TimerKey.stepTimeout(sagaId, stepId);

        // the answer of this attempt may only disarm the timeout armed for this attempt
        Disposable timeoutHandle = step.getTimeout()
                .map(timeout -> timers.schedule(timeoutKey, timeout,
                        () -> onStepTimeout(sagaType, sagaId, stepId, retryCount, timeout)))
                .orElse(null);
        events.onStepDispatched(sagaType, sagaId, stepId, retryCount + 1);
        log.debug("Dispatching command '{}' for step '{}' of saga {}", step.getCommand().commandType(), stepId, sagaId);

        return dispatch(step.getCommand()).flatMap(result -> {
            if (timeoutHandle != null && !timers.cancel(timeoutKey, timeoutHandle)) {
                log.debug("Ignoring late answer of attempt {} for step '{}' of saga {}", retryCount + 1, stepId, sagaId);
                return Mono.empty();
            }
            if (result.successful()) {
                log.debug("Command for step '{}' of saga {} acknowledged", stepId, sagaId);
                return Mono.empty();
            }
            CommandExecutionException error = new CommandExecutionException(step.getCommand().commandType(), result.error());
            return failStep(sagaId, stepId, retryCount, error.getMessage());
        });
    }

    private Mono<Void> onStepTimeout(String sagaType, String sagaId, String stepId, int retryCount, Duration timeout) {
        StepTimeoutException error = new StepTimeoutException(sagaId, stepId, timeout);
        log.warn(error.getMessage());
        events.onStepTimedOut(sagaType, sagaId, stepId, timeout);
        return failStep(sagaId, stepId, retryCount, error.getMessage());
    }

    /**
     * @param expectedStepId when set, the failure is ignored unless that step is still the current one
     * @param expectedRetryCount when set, the failure is ignored unless the step is still at that attempt
     */
    private Mono<Void> failStep(String sagaId, String expectedStepId, Integer expectedRetryCount, String error) {
        return withSaga(sagaId, "failStep", instance -> {
            String stepId = currentStepId(instance);
            if (expectedStepId != null && (instance.getState() != SagaState.RUNNING || !expectedStepId.equals(stepId))) {
                log.debug("Ignoring failure of step '{}' for saga {}: saga is {} at step '{}'",
                        expectedStepId, sagaId, instance.getState(), stepId);
                return Mono.<Void>empty();
            }
            if (expectedRetryCount != null && expectedRetryCount != instance.getRetryCount()) {
                log.debug("Ignoring stale failure of attempt {} for step '{}' of saga {}: step is at attempt {}",
                        expectedRetryCount + 1, stepId, sagaId, instance.getRetryCount() + 1);
                return Mono.<Void>empty();
            }
            instance.failCurrentStep(error);
            boolean retry = instance.shouldRetryCurrentStep();
            Duration delay = instance.getRetryDelay();
            if (!retry) {
                instance.startCompensation();
            }
            return persist(instance).flatMap(saved -> {
                timers.cancelStep(sagaId, stepId);
                events.onStepFailed(saved.getSagaType(), sagaId, stepId, error, saved.getRetryCount());
                if (retry) {
                    log.warn("Step '{}' of saga {} failed (attempt {}), retrying in {}ms: {}",
                            stepId, sagaId, saved.getRetryCount(), delay.toMillis(), error);
                    events.onStepRetryScheduled(saved.getSagaType(), sagaId, stepId, saved.getRetryCount(), delay);
                    timers.schedule(StepTimerRegistry.TimerKey.retry(sagaId, stepId), delay, () -> retryStep(sagaId, stepId));
                    return Mono.<Void>empty();
                }
                log.warn("Step '{}' of saga {} failed, starting compensation: {}", stepId, sagaId, error);
                events.onCompensationStarted(saved.getSagaType(), sagaId);
                return executeCompensationStep(saved);
            });
        }).then();
    }

    private Mono<Void> retryStep(String sagaId, String stepId) {
        return withSaga(sagaId, "retryStep", instance -> {
            if (instance.getState() != SagaState.RUNNING || !stepId.equals(currentStepId(instance))) {
                log.debug("Dropping retry of step '{}' for saga {}: saga is {}", stepId, sagaId, instance.getState());
                return Mono.<Void>empty();
            }
            return executeCurrentStep(instance);
        }).then();
    }

    // ------------------------------------------------------------------ compensation engine

    private Mono<Void> executeCompensationStep(SagaInstance instance) {
        Optional<SagaStep> current = instance.getCurrentStep();
        if (instance.getState() == SagaState.COMPENSATED || current.isEmpty()) {
            return finishCompensated(instance);
        }
        SagaStep step = current.get();
        String sagaId = instance.getSagaId();
        String stepId = step.getStepId();

        Optional<SagaCommand> compensation = step.getCompensationCommand();
        if (compensation.isEmpty()) {
            log.debug("Step '{}' of saga {} has no compensation, skipping", stepId, sagaId);
            events.onCompensationSkipped(instance.getSagaType(), sagaId, stepId);
            instance.completeCurrentCompensation();
            return persist(instance).flatMap(this::executeCompensationStep);
        }

        log.debug("Dispatching compensation '{}' for step '{}' of saga {}", compensation.get().commandType(), stepId, sagaId);
        return dispatch(compensation.get()).flatMap(result -> {
            if (result.successful()) {
                events.onStepCompensated(instance.getSagaType(), sagaId, stepId, null);
                instance.completeCurrentCompensation();
                return persist(instance).flatMap(this::executeCompensationStep);
            }
            CompensationException error = new CompensationException(sagaId, stepId, result.error());
            events.onStepCompensated(instance.getSagaType(), sagaId, stepId, error);
            return finishFailed(instance, error);
        });
    }

    // ------------------------------------------------------------------ terminal transitions

    private Mono<Void> finishCompleted(SagaInstance instance) {
        SagaExecutionContext context = instance.getContext();
        timers.cancelAll(instance.getSagaId());
        log.info("Saga {} of type '{}' completed", instance.getSagaId(), instance.getSagaType());
        events.onFinished(instance.getSagaType(), instance.getSagaId(), SagaState.COMPLETED, elapsed(context));
        return invokeCallback(instance, "onCompleted", instance.getDefinition().fireCompleted(context))
                .then(repository.delete(instance.getSagaId()));
    }

    private Mono<Void> finishCompensated(SagaInstance instance) {
        SagaExecutionContext context = instance.getContext();
        timers.cancelAll(instance.getSagaId());
        log.info("Saga {} of type '{}' compensated ({} steps undone)",
                instance.getSagaId(), instance.getSagaType(), context.getCompensatedSteps().size());
        events.onFinished(instance.getSagaType(), instance.getSagaId(), SagaState.COMPENSATED, elapsed(context));
        return invokeCallback(instance, "onCompensated", instance.getDefinition().fireCompensated(context))
                .then(repository.delete(instance.getSagaId()));
    }

    private Mono<Void> finishFailed(SagaInstance instance, CompensationException error) {
        instance.markAsFailed(error.getMessage());
        return persist(instance).flatMap(saved -> {
            timers.cancelAll(saved.getSagaId());
            log.error("Saga {} of type '{}' failed and requires manual intervention: {}",
                    saved.getSagaId(), saved.getSagaType(), error.getMessage());
            SagaExecutionContext context = saved.getContext();
            events.onFinished(saved.getSagaType(), saved.getSagaId(), SagaState.FAILED, elapsed(context));
            return invokeCallback(saved, "onFailed", saved.getDefinition().fireFailed(context, error));
        });
    }

    private Mono<Boolean> cancel(String sagaId) {
        return withSaga(sagaId, "cancelSaga", instance -> {
            if (instance.getState() == SagaState.COMPENSATING) {
                log.info("Cancel of saga {} ignored: compensation already in progress", sagaId);
                return Mono.just(false);
            }
            instance.cancel();
            return persist(instance).flatMap(saved -> {
                timers.cancelAll(sagaId);
                log.info("Saga {} of type '{}' cancelled", sagaId, saved.getSagaType());
                events.onCancelled(saved.getSagaType(), sagaId);
                if (saved.getCompletedSteps().isEmpty()) {
                    return Mono.just(true);
                }
                saved.startCompensation();
                events.onCompensationStarted(saved.getSagaType(), sagaId);
                return persist(saved)
                        .flatMap(this::executeCompensationStep)
                        .thenReturn(true);
            });
        });
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Loads and rehydrates a saga, then applies {@code action}. Unknown sagas, unknown saga types,
     * rejected transitions and stale writes complete empty.
     */
    private <T> Mono<T> withSaga(String sagaId, String operation, Function<SagaInstance, Mono<T>> action) {
        return repository.load(sagaId)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("{} ignored: saga {} not found", operation, sagaId);
                    return Mono.<SagaExecutionContext>empty();
                }))
                .flatMap(context -> {
                    Optional<SagaDefinition> definition = registry.findSaga(context.getSagaType());
                    if (definition.isEmpty()) {
                        log.error("{} ignored: no definition registered for type '{}' of saga {}",
                                operation, context.getSagaType(), sagaId);
                        return Mono.<T>empty();
                    }
                    return Mono.defer(() -> action.apply(SagaInstance.fromContext(definition.get(), context, clock)));
                })
                .onErrorResume(SagaStateException.class, error -> {
                    log.warn("{} rejected for saga {}: {}", operation, sagaId, error.getMessage());
                    return Mono.empty();
                })
                .onErrorResume(SagaConcurrencyException.class, error -> {
                    log.warn("{} skipped for saga {}: {}", operation, sagaId, error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<SagaInstance> persist(SagaInstance instance) {
        return repository.save(instance.getContext())
                .map(saved -> SagaInstance.fromContext(instance.getDefinition(), saved, clock));
    }

    private Mono<CommandResult> dispatch(SagaCommand command) {
        return Mono.defer(() -> commandBus.send(command))
                .onErrorResume(error -> {
                    log.warn("Command bus failed to send '{}': {}", command.commandType(), error.toString());
                    return Mono.just(CommandResult.failure(error.getMessage() != null
                            ? error.getMessage()
                            : error.getClass().getSimpleName()));
                })
                .defaultIfEmpty(CommandResult.failure("Command bus returned no result for " + command.commandType()));
    }

    private Mono<Void> invokeCallback(SagaInstance instance, String callback, Mono<Void> invocation) {
        return invocation.onErrorResume(error -> {
            log.error("{} callback of saga {} ({}) failed", callback, instance.getSagaId(), instance.getSagaType(), error);
            return Mono.empty();
        });
    }

    private boolean accepts(SagaEventHandler handler, DomainEvent event) {
        try {
            return handler.canHandle(event);
        } catch (RuntimeException e) {
            log.error("Event handler {} failed to inspect event {} ({})",
                    handler.getClass().getSimpleName(), event.eventType(), event.eventId(), e);
            return false;
        }
    }

    private Duration elapsed(SagaExecutionContext context) {
        return Duration.between(context.getStartedAt(), clock.instant());
    }

    private static String currentStepId(SagaInstance instance) {
        return instance.getCurrentStep().map(SagaStep::getStepId).orElse(null);
    }
}
