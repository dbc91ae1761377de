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

package org.fireflyframework.saga.persistence.impl;

import org.fireflyframework.saga.config.SagaOrchestratorProperties;
import org.fireflyframework.saga.core.SagaExecutionContext;
import org.fireflyframework.saga.core.SagaState;
import org.fireflyframework.saga.persistence.SagaConcurrencyException;
import org.fireflyframework.saga.persistence.SagaRepository;
import org.fireflyframework.saga.persistence.serialization.SagaContextSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Redis-based implementation of {@link SagaRepository}.
 * <p>
 * Redis key structure:
 * <ul>
 *   <li>{prefix}state:{sagaId} - serialized execution context</li>
 *   <li>{prefix}version:{sagaId} - version of the stored context</li>
 * </ul>
 * The version check and both writes run in a single Lua script, so concurrent writers of the same
 * saga cannot interleave. Queries scan {@code {prefix}state:*} and filter client-side.
 */
public class RedisSagaRepository implements SagaRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisSagaRepository.class);

    /*
     * KEYS: state key, version key. ARGV: expected version, payload, new version, ttl millis (0 = none).
     * Returns the new version on success, or -(storedVersion + 1) on a version mismatch (0 when nothing is stored).
     */
    private static final String SAVE_SCRIPT =
            "local current = redis.call('GET', KEYS[2])\n" +
            "if current == false then\n" +
            "  if ARGV[1] ~= '0' then\n" +
            "    return 0\n" +
            "  end\n" +
            "elseif current ~= ARGV[1] then\n" +
            "  return -(tonumber(current) + 1)\n" +
            "end\n" +
            "redis.call('SET', KEYS[1], ARGV[2])\n" +
            "redis.call('SET', KEYS[2], ARGV[3])\n" +
            "local ttl = tonumber(ARGV[4])\n" +
            "if ttl > 0 then\n" +
            "  redis.call('PEXPIRE', KEYS[1], ttl)\n" +
            "  redis.call('PEXPIRE', KEYS[2], ttl)\n" +
            "end\n" +
            "return tonumber(ARGV[3])\n";

    private static final RedisScript<Long> SAVE = RedisScript.of(SAVE_SCRIPT, Long.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final SagaContextSerializer serializer;
    private final Duration keyTtl;
    private final Clock clock;

    private final String stateKeyPrefix;
    private final String versionKeyPrefix;

    public RedisSagaRepository(ReactiveRedisTemplate<String, byte[]> redisTemplate,
                               SagaContextSerializer serializer,
                               SagaOrchestratorProperties.RedisProperties redisProperties) {
        this(redisTemplate, serializer, redisProperties, Clock.systemUTC());
    }

    public RedisSagaRepository(ReactiveRedisTemplate<String, byte[]> redisTemplate,
                               SagaContextSerializer serializer,
                               SagaOrchestratorProperties.RedisProperties redisProperties,
                               Clock clock) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyTtl = redisProperties.getKeyTtl();
        this.clock = clock;

        String basePrefix = redisProperties.getKeyPrefix();
        this.stateKeyPrefix = basePrefix + "state:";
        this.versionKeyPrefix = basePrefix + "version:";

        log.info("Initialized Redis saga repository with key prefix: {}", basePrefix);
    }

    @Override
    public Mono<SagaExecutionContext> save(SagaExecutionContext context) {
        String sagaId = context.getSagaId();
        long expected = context.getVersion();
        SagaExecutionContext stored = context.withVersion(expected + 1);

        return Mono.fromCallable(() -> serialize(stored))
                .flatMap(payload -> {
                    List<String> keys = List.of(stateKeyPrefix + sagaId, versionKeyPrefix + sagaId);
                    List<byte[]> args = List.of(
                            bytes(String.valueOf(expected)),
                            payload,
                            bytes(String.valueOf(expected + 1)),
                            bytes(String.valueOf(keyTtl != null ? keyTtl.toMillis() : 0L)));
                    return redisTemplate.execute(SAVE, keys, args).next();
                })
                .flatMap(result -> {
                    if (result > 0) {
                        log.debug("Saved saga {} to Redis with version {}", sagaId, result);
                        return Mono.just(stored);
                    }
                    return Mono.error(new SagaConcurrencyException(sagaId, expected, -result - 1));
                });
    }

    @Override
    public Mono<SagaExecutionContext> load(String sagaId) {
        return redisTemplate.opsForValue().get(stateKeyPrefix + sagaId)
                .map(this::deserialize)
                .doOnNext(ctx -> log.debug("Loaded saga {} from Redis (version {})", sagaId, ctx.getVersion()));
    }

    @Override
    public Flux<SagaExecutionContext> findByCorrelationId(String correlationId) {
        return scanAll().filter(ctx -> correlationId.equals(ctx.getCorrelationId()));
    }

    @Override
    public Flux<SagaExecutionContext> findByState(SagaState state) {
        return scanAll().filter(ctx -> ctx.getState() == state);
    }

    @Override
    public Flux<SagaExecutionContext> findTimedOut() {
        return scanAll().filter(ctx -> ctx.isTimedOut(clock.instant()));
    }

    @Override
    public Mono<Void> delete(String sagaId) {
        return redisTemplate.delete(stateKeyPrefix + sagaId, versionKeyPrefix + sagaId)
                .doOnNext(count -> log.debug("Deleted {} Redis keys of saga {}", count, sagaId))
                .then();
    }

    private Flux<SagaExecutionContext> scanAll() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(stateKeyPrefix + "*").count(100).build())
                .concatMap(key -> redisTemplate.opsForValue().get(key)
                        .flatMap(data -> {
                            try {
                                return Mono.just(serializer.deserialize(data));
                            } catch (SagaContextSerializer.SerializationException e) {
                                log.warn("Skipping unreadable saga context at key {}", key, e);
                                return Mono.empty();
                            }
                        }));
    }

    private byte[] serialize(SagaExecutionContext context) {
        try {
            return serializer.serialize(context);
        } catch (SagaContextSerializer.SerializationException e) {
            throw new IllegalStateException("Failed to serialize saga " + context.getSagaId(), e);
        }
    }

    private SagaExecutionContext deserialize(byte[] data) {
        try {
            return serializer.deserialize(data);
        } catch (SagaContextSerializer.SerializationException e) {
            throw new IllegalStateException("Failed to deserialize saga context", e);
        }
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
