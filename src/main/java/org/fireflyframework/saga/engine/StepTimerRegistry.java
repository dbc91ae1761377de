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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Bookkeeping of the deferred callbacks armed by the orchestrator: per-step timeouts and retry
 * backoffs.
 * <p>
 * Each timer is keyed by {@link TimerKey}. Scheduling a key that is already pending replaces the
 * previous timer. A timer leaves the registry before its action runs, so {@link #cancel} returning
 * {@code false} means the timer has either fired or was never armed.
 * <p>
 * Callers that must only disarm the timer they armed themselves keep the handle returned by
 * {@link #schedule} and use {@link #cancel(TimerKey, Disposable)}: a handle that was replaced or
 * has fired no longer matches and leaves the current timer alone.
 */
public class StepTimerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepTimerRegistry.class);

    public enum TimerKind {
        STEP_TIMEOUT,
        RETRY
    }

    /**
     * Composite identity of a timer.
     */
    public record TimerKey(String sagaId, String stepId, TimerKind kind) {

        public TimerKey {
            Objects.requireNonNull(sagaId, "sagaId");
            Objects.requireNonNull(stepId, "stepId");
            Objects.requireNonNull(kind, "kind");
        }

        public static TimerKey stepTimeout(String sagaId, String stepId) {
            return new TimerKey(sagaId, stepId, TimerKind.STEP_TIMEOUT);
        }

        public static TimerKey retry(String sagaId, String stepId) {
            return new TimerKey(sagaId, stepId, TimerKind.RETRY);
        }
    }

    private final Map<TimerKey, Disposable.Swap> timers = new ConcurrentHashMap<>();
    private final Scheduler scheduler;

    public StepTimerRegistry(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Arms a timer that runs {@code action} after {@code delay} unless cancelled first.
     *
     * @return the handle of this timer, for {@link #cancel(TimerKey, Disposable)}
     */
    public Disposable schedule(TimerKey key, Duration delay, Supplier<Mono<Void>> action) {
        Disposable.Swap handle = Disposables.swap();
        Disposable.Swap previous = timers.put(key, handle);
        if (previous != null) {
            previous.dispose();
        }
        log.debug("Armed {} timer for saga {} step {} ({}ms)", key.kind(), key.sagaId(), key.stepId(), delay.toMillis());
        handle.update(Mono.delay(delay, scheduler)
                .flatMap(tick -> timers.remove(key, handle) ? action.get() : Mono.<Void>empty())
                .subscribe(null, error -> log.error("{} timer of saga {} step {} failed", key.kind(), key.sagaId(), key.stepId(), error)));
        return handle;
    }

    /**
     * Cancels a pending timer.
     *
     * @return true if the timer was still pending
     */
    public boolean cancel(TimerKey key) {
        Disposable.Swap handle = timers.remove(key);
        if (handle == null) {
            return false;
        }
        handle.dispose();
        log.debug("Cancelled {} timer for saga {} step {}", key.kind(), key.sagaId(), key.stepId());
        return true;
    }

    /**
     * Cancels the timer armed under {@code handle}, only if it is still the pending timer of {@code key}.
     *
     * @return true if that timer was still pending
     */
    public boolean cancel(TimerKey key, Disposable handle) {
        if (handle == null || !timers.remove(key, handle)) {
            return false;
        }
        handle.dispose();
        log.debug("Cancelled {} timer for saga {} step {}", key.kind(), key.sagaId(), key.stepId());
        return true;
    }

    /** Cancels the timeout and retry timers of one step. */
    public void cancelStep(String sagaId, String stepId) {
        cancel(TimerKey.stepTimeout(sagaId, stepId));
        cancel(TimerKey.retry(sagaId, stepId));
    }

    /** Cancels every timer of a saga. */
    public int cancelAll(String sagaId) {
        List<TimerKey> keys = timers.keySet().stream()
                .filter(key -> key.sagaId().equals(sagaId))
                .collect(Collectors.toList());
        int cancelled = 0;
        for (TimerKey key : keys) {
            if (cancel(key)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public boolean isPending(TimerKey key) {
        return timers.containsKey(key);
    }

    public int pendingCount() {
        return timers.size();
    }

    /** Cancels every pending timer. */
    public void dispose() {
        List<TimerKey> keys = List.copyOf(timers.keySet());
        keys.forEach(this::cancel);
        if (!keys.isEmpty()) {
            log.info("Disposed {} pending saga timers", keys.size());
        }
    }
}
