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

package org.fireflyframework.saga.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.fireflyframework.saga.persistence.serialization.JsonSagaContextSerializer;
import org.fireflyframework.saga.persistence.serialization.SagaContextSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for saga context serialization.
 * <p>
 * Contributes the Jackson {@link ObjectMapper} and the {@link SagaContextSerializer} used by
 * external repositories. Both back off when the application declares its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
public class SagaPersistenceAutoConfiguration {

    /**
     * Default ObjectMapper for saga serialization.
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper sagaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // registers the JSR310 module for java.time types
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaContextSerializer sagaContextSerializer(ObjectMapper objectMapper) {
        return new JsonSagaContextSerializer(objectMapper);
    }
}
