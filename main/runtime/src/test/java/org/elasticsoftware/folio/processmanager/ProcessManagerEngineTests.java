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

package org.elasticsoftware.folio.processmanager;

import org.elasticsoftware.folio.aggregate.AggregateCoordinator;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.bus.EventPublisher;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.elasticsoftware.folio.events.DomainEvent;
import org.elasticsoftware.folio.retry.RetriesExhaustedException;
import org.elasticsoftware.folio.retry.RetryPolicy;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.store.InMemoryEventStore;
import org.elasticsoftware.foliotest.FolioTestSupport;
import org.elasticsoftware.foliotest.fulfillment.FulfillmentAggregate;
import org.elasticsoftware.foliotest.fulfillment.FulfillmentProcessManager;
import org.elasticsoftware.foliotest.fulfillment.ItemsPackedEvent;
import org.elasticsoftware.foliotest.fulfillment.PaymentSubmittedEvent;
import org.elasticsoftware.foliotest.fulfillment.ShipOrderCommand;
import org.elasticsoftware.foliotest.fulfillment.StockReservedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProcessManagerEngineTests {
    private static final String CORRELATION_ID = "PM-1";
    private final PayloadSerde serde = FolioTestSupport.serde();
    private final UUID orderId = UUID.randomUUID();
    private final Cover shipment = new Cover(FulfillmentAggregate.DOMAIN, orderId);
    private InMemoryEventStore store;
    private AggregateCoordinator coordinator;
    private FulfillmentProcessManager processManager;
    private ProcessManagerEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        coordinator = new AggregateCoordinator(List.of(FulfillmentAggregate.runtime(serde)), store,
                EventPublisher.noop(), FolioTestSupport.fixedClock(), 0);
        processManager = new FulfillmentProcessManager(serde);
        engine = new ProcessManagerEngine(processManager, store, coordinator, RetryPolicy.withoutBackoff(50));
    }

    private EventBook trigger(char prerequisite) {
        Map<Character, String> domains = Map.of(
                'A', FulfillmentProcessManager.PAYMENT,
                'B', FulfillmentProcessManager.INVENTORY,
                'C', FulfillmentProcessManager.PACKING);
        String domain = domains.get(prerequisite);
        DomainEvent event = switch (prerequisite) {
            case 'A' -> new PaymentSubmittedEvent(orderId.toString());
            case 'B' -> new StockReservedEvent(orderId.toString());
            default -> new ItemsPackedEvent(orderId.toString());
        };
        return FolioTestSupport.events(serde, new Cover(domain, orderId, CORRELATION_ID), event);
    }

    private long shipments() {
        return store.read(shipment).pages().stream().filter(page -> "OrderShipped".equals(page.typeName())).count();
    }

    @ParameterizedTest
    @ValueSource(strings = {"ABC", "CBA", "ACB", "AABCC", "BBCAAC"})
    void testShipsExactlyOnceWhateverTheOrder(String deliveries) {
        for (char prerequisite : deliveries.toCharArray()) {
            engine.handle(trigger(prerequisite));
        }

        assertEquals(1, shipments());
        EventBook shipped = store.findByCorrelationId(CORRELATION_ID).stream()
                .filter(book -> book.cover().domain().equals(FulfillmentAggregate.DOMAIN))
                .findFirst()
                .orElseThrow();
        assertEquals(1, shipped.pages().size());
    }

    @Test
    void testShipCommandCarriesCorrelationId() {
        engine.handle(trigger('A'));
        engine.handle(trigger('B'));
        ProcessManagerResult result = engine.handle(trigger('C'));

        assertEquals(ProcessManagerResult.Status.HANDLED, result.status());
        assertThat(result.dispatched()).hasSize(1);
        assertEquals(CORRELATION_ID, result.dispatched().get(0).cover().correlationId());
        assertEquals("ShipOrder", result.dispatched().get(0).firstPage().typeName());
        assertThat(result.failed()).isEmpty();
        assertThat(result.compensations()).isEmpty();
    }

    @Test
    void testRejectedShipmentIsRecordedInProcessStream() {
        coordinator.handle(FolioTestSupport.command(serde, shipment, 0, new ShipOrderCommand(orderId.toString())));
        engine.handle(trigger('A'));
        engine.handle(trigger('B'));

        ProcessManagerResult result = engine.handle(trigger('C'));

        assertThat(result.dispatched()).isEmpty();
        assertThat(result.failed()).hasSize(1);
        assertThat(result.compensations()).hasSize(1);
        EventPage recorded = result.compensations().get(0).pages().get(0);
        assertEquals("DispatchRejected", recorded.typeName());
        assertEquals(FolioTestSupport.NOW, recorded.createdAt());
        EventBook pmState = store.read(engine.coverFor(CORRELATION_ID));
        assertThat(pmState.pages()).extracting(EventPage::typeName).containsExactly(
                "PrerequisiteCompleted", "PrerequisiteCompleted", "PrerequisiteCompleted", "DispatchIssued", "DispatchRejected");
        assertEquals("Order " + orderId + " already shipped", processManager.state(pmState).failure());
        assertEquals(1, shipments());
    }

    @Test
    void testRemainingPrerequisiteIsPending() {
        engine.handle(trigger('A'));
        engine.handle(trigger('C'));

        EventBook pmState = store.read(engine.coverFor(CORRELATION_ID));
        assertEquals(Set.of(FulfillmentProcessManager.INVENTORY), processManager.state(pmState).pending());
        assertFalse(processManager.state(pmState).dispatched());
        assertEquals(0, shipments());
    }

    @Test
    void testProcessStreamLivesAtDerivedRoot() {
        engine.handle(trigger('A'));

        Cover pmCover = engine.coverFor(CORRELATION_ID);
        assertEquals(FulfillmentProcessManager.DOMAIN, pmCover.domain());
        assertEquals(CorrelationRoots.rootOf(CORRELATION_ID), pmCover.root());
        EventBook pmState = store.read(pmCover);
        assertThat(pmState.pages()).extracting(EventPage::typeName).containsExactly("PrerequisiteCompleted");
        assertEquals(FolioTestSupport.NOW, pmState.pages().get(0).createdAt());
    }

    @Test
    void testTriggerWithoutCorrelationIdIsSkipped() {
        EventBook uncorrelated = FolioTestSupport.events(serde,
                new Cover(FulfillmentProcessManager.PAYMENT, orderId), new PaymentSubmittedEvent(orderId.toString()));

        ProcessManagerResult result = engine.handle(uncorrelated);

        assertEquals(ProcessManagerResult.Status.SKIPPED, result.status());
        assertTrue(store.read(engine.coverFor(CORRELATION_ID)).isEmpty());
    }

    @Test
    void testConcurrentDeliveryShipsExactlyOnce() throws Exception {
        List<EventBook> triggers = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            triggers.add(trigger('A'));
            triggers.add(trigger('B'));
            triggers.add(trigger('C'));
        }
        Collections.shuffle(triggers);
        ExecutorService executor = Executors.newFixedThreadPool(triggers.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ProcessManagerResult>> futures = new ArrayList<>();
        for (EventBook trigger : triggers) {
            futures.add(executor.submit(() -> {
                start.await();
                return engine.handle(trigger);
            }));
        }
        start.countDown();
        for (Future<ProcessManagerResult> future : futures) {
            assertEquals(ProcessManagerResult.Status.HANDLED, future.get(30, TimeUnit.SECONDS).status());
        }
        executor.shutdown();

        assertEquals(1, shipments());
        EventBook pmState = store.read(engine.coverFor(CORRELATION_ID));
        assertTrue(processManager.state(pmState).dispatched());
        assertThat(pmState.pages()).hasSize(4);
    }

    @Test
    void testPersistentConflictExhaustsRetries() {
        AggregateCoordinator conflicted = mock(AggregateCoordinator.class);
        when(conflicted.getClock()).thenReturn(FolioTestSupport.fixedClock());
        when(conflicted.persistEvents(any())).thenThrow(new SequenceConflictException("order-fulfillment", "x", 0, 1));
        ProcessManagerEngine failing = new ProcessManagerEngine(processManager, store, conflicted, RetryPolicy.withoutBackoff(3));

        RetriesExhaustedException exception = assertThrows(RetriesExhaustedException.class,
                () -> failing.handle(trigger('A')));

        assertEquals(3, exception.getAttempts());
        verify(conflicted, times(3)).persistEvents(any());
        verify(conflicted, never()).handle(any());
    }
}
