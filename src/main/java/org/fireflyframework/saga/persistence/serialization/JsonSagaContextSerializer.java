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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.saga.core.SagaExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Jackson implementation of {@link SagaContextSerializer}.
 * <p>
 * Contexts are written as JSON wrapped with the content type and format version:
 * <pre>
 * {"contentType":"application/json","version":"1.0","context":{...}}
 * </pre>
 */
public class JsonSagaContextSerializer implements SagaContextSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonSagaContextSerializer.class);

    private static final String CONTENT_TYPE = "application/json";
    private static final String VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public JsonSagaContextSerializer() {
        this(createDefaultObjectMapper());
    }

    public JsonSagaContextSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(SagaExecutionContext context) throws SerializationException {
        try {
            log.debug("Serializing context of saga {}", context.getSagaId());
            return objectMapper.writeValueAsBytes(new ContextEnvelope(CONTENT_TYPE, VERSION, context));
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize context of saga %s", context.getSagaId());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public SagaExecutionContext deserialize(byte[] data) throws SerializationException {
        ContextEnvelope envelope;
        try {
            envelope = objectMapper.readValue(data, ContextEnvelope.class);
        } catch (IOException e) {
            String message = "Failed to deserialize saga context from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
        if (!canDeserialize(envelope.contentType(), envelope.version())) {
            throw new SerializationException(String.format(
                    "Incompatible serialization format: %s version %s", envelope.contentType(), envelope.version()));
        }
        if (envelope.context() == null) {
            throw new SerializationException("Serialized envelope carries no saga context");
        }
        return envelope.context();
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public boolean canDeserialize(String contentType, String version) {
        return CONTENT_TYPE.equals(contentType) && VERSION.equals(version);
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Wire envelope carrying format metadata next to the context.
     */
    record ContextEnvelope(String contentType, String version, SagaExecutionContext context) {
    }
}
