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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the saga orchestrator.
 *
 * <p>
 * Example configuration:
 * <pre>
 * firefly.saga.timeout-check-enabled=true
 * firefly.saga.timeout-check-interval=PT30S
 * firefly.saga.recovery.enabled=true
 * firefly.saga.persistence.enabled=true
 * firefly.saga.persistence.redis.host=localhost
 * firefly.saga.persistence.redis.port=6379
 * firefly.saga.persistence.redis.key-prefix=firefly:saga:
 * firefly.saga.observability.metrics-enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.saga")
public class SagaOrchestratorProperties {

    /**
     * Whether sagas past their global timeout are cancelled periodically.
     */
    private boolean timeoutCheckEnabled = true;

    /**
     * Interval between two timeout sweeps.
     */
    private Duration timeoutCheckInterval = Duration.ofSeconds(30);

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    @NestedConfigurationProperty
    private ObservabilityProperties observability = new ObservabilityProperties();

    public boolean isTimeoutCheckEnabled() {
        return timeoutCheckEnabled;
    }

    public void setTimeoutCheckEnabled(boolean timeoutCheckEnabled) {
        this.timeoutCheckEnabled = timeoutCheckEnabled;
    }

    public Duration getTimeoutCheckInterval() {
        return timeoutCheckInterval;
    }

    public void setTimeoutCheckInterval(Duration timeoutCheckInterval) {
        this.timeoutCheckInterval = timeoutCheckInterval;
    }

    public RecoveryProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryProperties recovery) {
        this.recovery = recovery;
    }

    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    public ObservabilityProperties getObservability() {
        return observability;
    }

    public void setObservability(ObservabilityProperties observability) {
        this.observability = observability;
    }

    /**
     * Startup recovery of in-flight sagas.
     */
    public static class RecoveryProperties {
        /**
         * Whether RUNNING and COMPENSATING sagas are resumed when the application is ready.
         */
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class PersistenceProperties {
        /**
         * Whether saga contexts are stored in Redis instead of in memory.
         */
        private boolean enabled = false;

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    /**
     * Redis connection and key layout.
     */
    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;

        /**
         * Prefix of every key written by the repository.
         */
        private String keyPrefix = "firefly:saga:";

        /**
         * Expiry applied to stored contexts. Null keeps them until deleted.
         */
        private Duration keyTtl;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getKeyTtl() {
            return keyTtl;
        }

        public void setKeyTtl(Duration keyTtl) {
            this.keyTtl = keyTtl;
        }
    }

    public static class ObservabilityProperties {
        /**
         * Whether lifecycle events are written to the log.
         */
        private boolean eventLoggingEnabled = true;

        /**
         * Whether Micrometer metrics are recorded when a MeterRegistry is available.
         */
        private boolean metricsEnabled = true;

        public boolean isEventLoggingEnabled() {
            return eventLoggingEnabled;
        }

        public void setEventLoggingEnabled(boolean eventLoggingEnabled) {
            this.eventLoggingEnabled = eventLoggingEnabled;
        }

        public boolean isMetricsEnabled() {
            return metricsEnabled;
        }

        public void setMetricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
        }
    }
}
