/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.folio;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.folio.aggregate.AggregateCoordinator;
import org.elasticsoftware.folio.aggregate.AggregateRuntime;
import org.elasticsoftware.folio.bus.EventPublisher;
import org.elasticsoftware.folio.bus.LocalEventBus;
import org.elasticsoftware.folio.processmanager.ProcessManager;
import org.elasticsoftware.folio.processmanager.ProcessManagerEngine;
import org.elasticsoftware.folio.query.DefaultEventQueryService;
import org.elasticsoftware.folio.retry.RetryPolicy;
import org.elasticsoftware.folio.saga.Saga;
import org.elasticsoftware.folio.saga.SagaOrchestrator;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.service.CommandService;
import org.elasticsoftware.folio.service.DefaultCommandService;
import org.elasticsoftware.folio.service.EventQueryService;
import org.elasticsoftware.folio.speculative.SpeculativeExecutor;
import org.elasticsoftware.folio.store.EventStore;
import org.elasticsoftware.folio.store.InMemoryEventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Wires a complete in-process runtime from the {@link AggregateRuntime}, {@link Saga} and
 * {@link ProcessManager} beans found in the context. Every infrastructure bean backs off when the
 * application defines its own.
 */
@AutoConfiguration
@PropertySource("classpath:folio-runtime.properties")
public class FolioRuntimeAutoConfiguration {

    @Bean(name = "folioPayloadSerde")
    @ConditionalOnMissingBean
    public PayloadSerde payloadSerde(ObjectProvider<ObjectMapper> objectMapper) {
        return new PayloadSerde(objectMapper.getIfAvailable(PayloadSerde::defaultObjectMapper));
    }

    @Bean(name = "folioClock")
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "folioEventStore", destroyMethod = "close")
    @ConditionalOnMissingBean(EventStore.class)
    public InMemoryEventStore eventStore() {
        return new InMemoryEventStore();
    }

    @Bean(name = "folioEventPublisher", destroyMethod = "close")
    @ConditionalOnMissingBean(EventPublisher.class)
    public LocalEventBus localEventBus(@Value("${folio.bus.threads}") int threads) {
        return threads > 0 ? new LocalEventBus(Executors.newFixedThreadPool(threads)) : LocalEventBus.direct();
    }

    @Bean(name = "folioSagaRetryPolicy")
    public RetryPolicy sagaRetryPolicy(@Value("${folio.saga.retry.max-attempts}") int maxAttempts,
                                       @Value("${folio.saga.retry.initial-backoff-ms}") long initialBackoffMs,
                                       @Value("${folio.saga.retry.max-backoff-ms}") long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    @Bean(name = "folioProcessManagerRetryPolicy")
    public RetryPolicy processManagerRetryPolicy(@Value("${folio.processmanager.retry.max-attempts}") int maxAttempts,
                                                 @Value("${folio.processmanager.retry.initial-backoff-ms}") long initialBackoffMs,
                                                 @Value("${folio.processmanager.retry.max-backoff-ms}") long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    @Bean(name = "folioAggregateCoordinator")
    @ConditionalOnMissingBean
    public AggregateCoordinator aggregateCoordinator(ObjectProvider<AggregateRuntime> runtimes,
                                                     EventStore eventStore,
                                                     EventPublisher eventPublisher,
                                                     Clock clock,
                                                     @Value("${folio.aggregate.snapshot-interval}") int snapshotInterval) {
        return new AggregateCoordinator(runtimes.orderedStream().collect(Collectors.toList()),
                eventStore, eventPublisher, clock, snapshotInterval);
    }

    /**
     * Subscribes an orchestrator per saga and an engine per process manager once all singletons exist,
     * since the bus and the coordinator depend on each other.
     */
    @Bean(name = "folioSubscriptions")
    public SmartInitializingSingleton subscriptions(ObjectProvider<LocalEventBus> eventBus,
                                                    ObjectProvider<Saga> sagas,
                                                    ObjectProvider<ProcessManager> processManagers,
                                                    AggregateCoordinator coordinator,
                                                    EventStore eventStore,
                                                    @Qualifier("folioSagaRetryPolicy") RetryPolicy sagaRetryPolicy,
                                                    @Qualifier("folioProcessManagerRetryPolicy") RetryPolicy processManagerRetryPolicy) {
        return () -> eventBus.ifAvailable(bus -> {
            sagas.orderedStream().forEach(saga ->
                    bus.subscribe(new SagaOrchestrator(saga, eventStore, coordinator, sagaRetryPolicy)));
            processManagers.orderedStream().forEach(processManager ->
                    bus.subscribe(new ProcessManagerEngine(processManager, eventStore, coordinator, processManagerRetryPolicy)));
        });
    }

    @Bean(name = "folioSpeculativeExecutor")
    @ConditionalOnMissingBean
    public SpeculativeExecutor speculativeExecutor(AggregateCoordinator coordinator,
                                                   EventStore eventStore,
                                                   ObjectProvider<Saga> sagas,
                                                   ObjectProvider<ProcessManager> processManagers) {
        return new SpeculativeExecutor(coordinator, eventStore,
                sagas.orderedStream().collect(Collectors.toList()),
                processManagers.orderedStream().collect(Collectors.toList()));
    }

    @Bean(name = "folioCommandService")
    @ConditionalOnMissingBean
    public CommandService commandService(AggregateCoordinator coordinator, SpeculativeExecutor speculativeExecutor) {
        return new DefaultCommandService(coordinator, speculativeExecutor);
    }

    @Bean(name = "folioEventQueryService")
    @ConditionalOnMissingBean
    public EventQueryService eventQueryService(EventStore eventStore) {
        return new DefaultEventQueryService(eventStore);
    }
}
