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

package org.fireflyframework.saga.persistence.serialization;

import org.fireflyframework.saga.core.SagaExecutionContext;

/**
 * Converts saga execution contexts to and from bytes for external stores.
 * <p>
 * Implementations tag their output with a content type and a format version so that stored
 * contexts written by an incompatible serializer are rejected instead of misread.
 */
public interface SagaContextSerializer {

    /**
     * @throws SerializationException if serialization fails
     */
    byte[] serialize(SagaExecutionContext context) throws SerializationException;

    /**
     * @throws SerializationException if the data is corrupted or in an incompatible format
     */
    SagaExecutionContext deserialize(byte[] data) throws SerializationException;

    /** Content type identifier, e.g. {@code application/json}. */
    String getContentType();

    /** Format version written by this serializer. */
    String getVersion();

    boolean canDeserialize(String contentType, String version);

    /**
     * Exception thrown when serialization or deserialization fails.
     */
    class SerializationException extends Exception {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
