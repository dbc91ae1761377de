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

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.saga.command.CommandBus;
import org.fireflyframework.saga.command.CommandHandler;
import org.fireflyframework.saga.command.DefaultCommandBus;
import org.fireflyframework.saga.engine.SagaOrchestrator;
import org.fireflyframework.saga.events.SagaEventHandler;
import org.fireflyframework.saga.observability.CompositeSagaEvents;
import org.fireflyframework.saga.observability.MicrometerSagaEvents;
import org.fireflyframework.saga.observability.SagaEvents;
import org.fireflyframework.saga.observability.SagaLoggerEvents;
import org.fireflyframework.saga.persistence.SagaRecoveryService;
import org.fireflyframework.saga.persistence.SagaRepository;
import org.fireflyframework.saga.persistence.impl.DefaultSagaRecoveryService;
import org.fireflyframework.saga.persistence.impl.InMemorySagaRepository;
import org.fireflyframework.saga.registry.SagaDefinition;
import org.fireflyframework.saga.registry.SagaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Spring configuration that wires the saga orchestrator components.
 * Users typically activate it via {@link org.fireflyframework.saga.annotations.EnableSagaOrchestrator}.
 */
@Configuration
@EnableConfigurationProperties(SagaOrchestratorProperties.class)
public class SagaOrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaOrchestratorConfiguration.class);

    @Bean
    public SagaRegistry sagaRegistry(ObjectProvider<SagaDefinition> definitions) {
        SagaRegistry registry = new SagaRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(CommandBus.class)
    public CommandBus sagaCommandBus(ObjectProvider<CommandHandler> handlers) {
        List<CommandHandler> all = handlers.orderedStream().collect(Collectors.toList());
        log.info("Configuring default command bus with {} handlers", all.size());
        return new DefaultCommandBus(all);
    }

    /**
     * Default in-memory repository. Redis persistence, when enabled, contributes a primary bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public SagaRepository sagaRepository() {
        return new InMemorySagaRepository();
    }

    @Bean
    @Primary
    public SagaEvents sagaEventsComposite(ApplicationContext applicationContext,
                                          SagaOrchestratorProperties properties,
                                          ObjectProvider<MeterRegistry> meterRegistry) {
        List<SagaEvents> sinks = new ArrayList<>();

        // user-declared sinks; the composite itself is excluded
        Map<String, SagaEvents> allEvents = applicationContext.getBeansOfType(SagaEvents.class);
        for (Map.Entry<String, SagaEvents> entry : allEvents.entrySet()) {
            if (!"sagaEventsComposite".equals(entry.getKey())) {
                sinks.add(entry.getValue());
            }
        }

        if (properties.getObservability().isEventLoggingEnabled()) {
            sinks.add(new SagaLoggerEvents());
        }

        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getObservability().isMetricsEnabled()) {
            sinks.add(new MicrometerSagaEvents(registry));
        }

        return new CompositeSagaEvents(sinks);
    }

    @Bean(destroyMethod = "dispose")
    public SagaOrchestrator sagaOrchestrator(SagaRegistry registry,
                                             SagaRepository repository,
                                             CommandBus commandBus,
                                             SagaEvents events,
                                             ObjectProvider<SagaEventHandler> eventHandlers) {
        SagaOrchestrator orchestrator = new SagaOrchestrator(
                registry, repository, commandBus, events, Schedulers.parallel(), Clock.systemUTC());
        eventHandlers.orderedStream().forEach(orchestrator::registerEventHandler);
        log.info("Initialized saga orchestrator with {} saga definitions and repository {}",
                registry.getAll().size(), repository.getClass().getSimpleName());
        return orchestrator;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRecoveryService sagaRecoveryService(SagaRepository repository,
                                                   SagaOrchestrator orchestrator,
                                                   SagaRegistry registry) {
        return new DefaultSagaRecoveryService(repository, orchestrator, registry);
    }

    @Bean
    public SagaMaintenanceScheduler sagaMaintenanceScheduler(SagaOrchestrator orchestrator,
                                                             SagaRecoveryService recoveryService,
                                                             SagaOrchestratorProperties properties) {
        return new SagaMaintenanceScheduler(orchestrator, recoveryService, properties, Schedulers.parallel());
    }
}
