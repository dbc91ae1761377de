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

package org.fireflyframework.saga.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.fireflyframework.saga.core.SagaState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SagaLoggerEventsTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private final SagaLoggerEvents events = new SagaLoggerEvents();

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(SagaLoggerEvents.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void emitsOneStructuredLinePerEvent() {
        events.onStarted("order", "s1", "order-1");
        events.onStepFailed("order", "s1", "charge", "declined", 2);
        events.onFinished("order", "s1", SagaState.COMPENSATED, Duration.ofMillis(1500));

        assertThat(appender.list).hasSize(3);
        assertThat(appender.list.get(0).getFormattedMessage())
                .isEqualTo("{\"saga_event\":\"started\",\"saga_type\":\"order\",\"saga_id\":\"s1\",\"correlation_id\":\"order-1\"}");
        assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.ERROR);
        assertThat(appender.list.get(1).getFormattedMessage())
                .contains("\"saga_event\":\"step_failed\"")
                .contains("\"retry_count\":\"2\"");
        assertThat(appender.list.get(2).getLevel()).isEqualTo(Level.INFO);
        assertThat(appender.list.get(2).getFormattedMessage())
                .contains("\"final_state\":\"COMPENSATED\"")
                .contains("\"duration_ms\":\"1500\"");
    }

    @Test
    void failedSagaIsLoggedAtError() {
        events.onFinished("order", "s1", SagaState.FAILED, Duration.ZERO);

        assertThat(appender.list).singleElement()
                .satisfies(e -> assertThat(e.getLevel()).isEqualTo(Level.ERROR));
    }
}
