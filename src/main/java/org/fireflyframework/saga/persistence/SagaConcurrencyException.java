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

package org.fireflyframework.saga.persistence;

/**
 * Signals that a save was rejected because the stored context has moved on since the incoming
 * context was loaded.
 */
public class SagaConcurrencyException extends RuntimeException {

    private final String sagaId;
    private final long expectedVersion;
    private final long actualVersion;

    public SagaConcurrencyException(String sagaId, long expectedVersion, long actualVersion) {
        super("Stale write for saga " + sagaId + ": expected version " + expectedVersion
                + " but stored version is " + (actualVersion < 0 ? "absent" : String.valueOf(actualVersion)));
        this.sagaId = sagaId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getSagaId() {
        return sagaId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    /** Stored version, or -1 when nothing is stored. */
    public long getActualVersion() {
        return actualVersion;
    }
}
