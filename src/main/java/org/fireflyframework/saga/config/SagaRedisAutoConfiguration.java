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

import org.fireflyframework.saga.persistence.SagaRepository;
import org.fireflyframework.saga.persistence.impl.RedisSagaRepository;
import org.fireflyframework.saga.persistence.serialization.SagaContextSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Auto-configuration for Redis-based saga persistence.
 * <p>
 * This configuration is only loaded when Redis classes are available on the classpath,
 * preventing ClassNotFoundException when Redis is not included as a dependency.
 * <p>
 * Redis persistence is enabled when {@code firefly.saga.persistence.enabled=true}.
 */
@AutoConfiguration
@AutoConfigureAfter(SagaPersistenceAutoConfiguration.class)
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
@ConditionalOnClass({ReactiveRedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(
    name = "firefly.saga.persistence.enabled",
    havingValue = "true",
    matchIfMissing = false
)
public class SagaRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaRedisAutoConfiguration.class);

    /**
     * Lettuce connection factory for saga persistence.
     * Only created when no connection factory is provided by the application.
     */
    @Bean
    @ConditionalOnMissingBean(ReactiveRedisConnectionFactory.class)
    public LettuceConnectionFactory sagaRedisConnectionFactory(SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.RedisProperties redis = properties.getPersistence().getRedis();

        log.info("Configuring Redis connection factory for saga persistence: {}:{}",
                redis.getHost(), redis.getPort());

        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(redis.getHost(), redis.getPort());
        configuration.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            configuration.setPassword(redis.getPassword());
        }
        return new LettuceConnectionFactory(configuration);
    }

    /**
     * Reactive Redis template with string keys and raw byte values.
     */
    @Bean
    @ConditionalOnMissingBean(name = "sagaReactiveRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        log.debug("Configuring reactive Redis template for saga persistence");

        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    /**
     * Redis-based saga repository, preferred over the in-memory default.
     */
    @Bean
    @Primary
    public SagaRepository redisSagaRepository(ReactiveRedisTemplate<String, byte[]> sagaReactiveRedisTemplate,
                                              SagaContextSerializer serializer,
                                              SagaOrchestratorProperties properties) {
        SagaOrchestratorProperties.RedisProperties redis = properties.getPersistence().getRedis();
        log.info("Configuring Redis saga repository with key prefix: {}", redis.getKeyPrefix());
        return new RedisSagaRepository(sagaReactiveRedisTemplate, serializer, redis);
    }
}
