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

package org.elasticsoftware.folio.aggregate;

import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.CommandPage;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.book.SyncMode;
import org.elasticsoftware.folio.bus.EventPublisher;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.errors.ErrorKind;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.store.InMemoryEventStore;
import org.elasticsoftware.foliotest.FolioTestSupport;
import org.elasticsoftware.foliotest.player.PlayerAggregate;
import org.elasticsoftware.foliotest.player.PlayerState;
import org.elasticsoftware.foliotest.player.RegisterPlayerCommand;
import org.elasticsoftware.foliotest.player.ReleaseFundsCommand;
import org.elasticsoftware.foliotest.player.ReserveFundsCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AggregateCoordinatorTests {
    private final PayloadSerde serde = FolioTestSupport.serde();
    private final Cover player = new Cover(PlayerAggregate.DOMAIN, UUID.randomUUID());
    private InMemoryEventStore store;
    private EventPublisher publisher;
    private AggregateCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        publisher = mock(EventPublisher.class);
        when(publisher.publish(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(publisher.publishOnCallerThread(any())).thenReturn(CompletableFuture.completedFuture(null));
        coordinator = new AggregateCoordinator(List.of(PlayerAggregate.runtime(serde)), store, publisher,
                FolioTestSupport.fixedClock(), 0);
    }

    private CommandBook register(long expectedSequence) {
        return FolioTestSupport.command(serde, player, expectedSequence, new RegisterPlayerCommand("alice", 1000));
    }

    private CommandBook reserve(long expectedSequence, String handId, long amount) {
        return FolioTestSupport.command(serde, player, expectedSequence, new ReserveFundsCommand(handId, amount));
    }

    @Test
    void testSequencesAreContiguousFromZero() {
        coordinator.handle(register(0));
        coordinator.handle(reserve(1, "hand-1", 10));
        EventBook result = coordinator.handle(reserve(2, "hand-2", 20));

        assertThat(result.pages()).extracting(EventPage::sequence).containsExactly(0L, 1L, 2L);
        assertEquals(3, store.read(player).nextSequence());
    }

    @Test
    void testEventsAreStampedWithCoordinatorClock() {
        EventBook result = coordinator.handle(register(0));
        assertEquals(FolioTestSupport.NOW, result.pages().get(0).createdAt());
    }

    @Test
    void testStaleSequenceIsRejectedWithoutSideEffects() {
        coordinator.handle(register(0));
        reset(publisher);

        SequenceConflictException exception = assertThrows(SequenceConflictException.class,
                () -> coordinator.handle(reserve(0, "hand-1", 10)));

        assertEquals(ErrorKind.FAILED_PRECONDITION, exception.getKind());
        assertTrue(exception.isRetryable());
        assertEquals(1, store.read(player).pages().size());
        verifyNoInteractions(publisher);
    }

    @Test
    void testSequenceAheadOfStreamIsRejected() {
        assertThrows(SequenceConflictException.class, () -> coordinator.handle(register(5)));
    }

    @Test
    void testEmptyCommandBookIsInvalid() {
        CommandRejectedException exception = assertThrows(CommandRejectedException.class,
                () -> coordinator.handle(new CommandBook(player, List.of())));
        assertEquals(ErrorKind.INVALID_ARGUMENT, exception.getKind());
    }

    @Test
    void testUnknownDomainIsInvalid() {
        CommandBook command = FolioTestSupport.command(serde, new Cover("casino", UUID.randomUUID()), 0,
                new RegisterPlayerCommand("x", 1));
        CommandRejectedException exception = assertThrows(CommandRejectedException.class, () -> coordinator.handle(command));
        assertEquals(ErrorKind.INVALID_ARGUMENT, exception.getKind());
        assertEquals("casino", exception.getDomain());
    }

    @Test
    void testBusinessRejectionCarriesStreamAndPersistsNothing() {
        coordinator.handle(register(0));

        CommandRejectedException exception = assertThrows(CommandRejectedException.class,
                () -> coordinator.handle(reserve(1, "hand-1", 5000)));

        assertEquals(ErrorKind.FAILED_PRECONDITION, exception.getKind());
        assertEquals("Insufficient funds", exception.getReason());
        assertEquals(PlayerAggregate.DOMAIN, exception.getDomain());
        assertEquals(player.root().toString(), exception.getAggregateId());
        assertEquals(1, store.read(player).pages().size());
    }

    @Test
    void testCommandWithoutEventsReturnsCurrentBook() {
        coordinator.handle(register(0));
        reset(publisher);
        CommandBook release = FolioTestSupport.command(serde, player, 1,
                new ReleaseFundsCommand("unknown-hand"));

        EventBook result = coordinator.handle(release);

        assertEquals(1, result.nextSequence());
        verifyNoInteractions(publisher);
    }

    @Test
    void testMultiPageCommandSeesEvolvingState() {
        CommandBook batch = new CommandBook(player, List.of(
                new CommandPage(0, serde.serialize(new RegisterPlayerCommand("bob", 100))),
                new CommandPage(1, serde.serialize(new ReserveFundsCommand("hand-1", 60))),
                new CommandPage(2, serde.serialize(new ReserveFundsCommand("hand-2", 40)))));

        EventBook result = coordinator.handle(batch);

        assertThat(result.pages()).extracting(EventPage::typeName)
                .containsExactly("PlayerRegistered", "FundsReserved", "FundsReserved");
        PlayerState state = PlayerAggregate.stateRebuilder(serde).rebuild(result);
        assertEquals(0, state.available());
    }

    @Test
    void testOnlyNewEventsArePublished() {
        coordinator.handle(register(0));
        coordinator.handle(reserve(1, "hand-1", 10));

        ArgumentCaptor<EventBook> captor = ArgumentCaptor.forClass(EventBook.class);
        verify(publisher, times(2)).publish(captor.capture());
        EventBook second = captor.getAllValues().get(1);
        assertThat(second.pages()).extracting(EventPage::sequence).containsExactly(1L);
    }

    @Test
    void testSynchronousPublicationFailureIsPropagated() {
        when(publisher.publishOnCallerThread(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("subscriber down")));
        CommandBook command = CommandBook.of(player,
                new CommandPage(0, serde.serialize(new RegisterPlayerCommand("carol", 10)), SyncMode.SYNCHRONOUS));

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> coordinator.handle(command));
        assertEquals("subscriber down", exception.getMessage());
        assertEquals(1, store.read(player).pages().size());
    }

    @Test
    void testSnapshotWrittenWhenIntervalCrossed() {
        coordinator = new AggregateCoordinator(List.of(PlayerAggregate.runtime(serde)), store, publisher,
                FolioTestSupport.fixedClock(), 2);

        coordinator.handle(register(0));
        assertNull(store.read(player).snapshot());

        coordinator.handle(reserve(1, "hand-1", 10));
        EventBook book = store.read(player);
        assertNotNull(book.snapshot());
        assertEquals(1, book.snapshot().asOfSequence());
        assertTrue(book.pages().isEmpty());

        EventBook afterSnapshot = coordinator.handle(reserve(2, "hand-2", 15));
        assertEquals(3, afterSnapshot.nextSequence());
        assertEquals(975, PlayerAggregate.stateRebuilder(serde).rebuild(afterSnapshot).available());
    }

    @Test
    void testFailedSnapshotDoesNotFailCommittedCommand() {
        AggregateRuntime players = PlayerAggregate.runtime(serde);
        AggregateRuntime failingSnapshots = new AggregateRuntime() {
            @Override
            public String getDomain() {
                return players.getDomain();
            }

            @Override
            public Set<String> getCommandTypeNames() {
                return players.getCommandTypeNames();
            }

            @Override
            public List<Payload> handle(EventBook priorEvents, CommandPage command) {
                return players.handle(priorEvents, command);
            }

            @Override
            public Optional<Payload> snapshot(EventBook events) {
                throw new IllegalStateException("snapshot failed");
            }
        };
        coordinator = new AggregateCoordinator(List.of(failingSnapshots), store, publisher,
                FolioTestSupport.fixedClock(), 1);

        EventBook result = coordinator.handle(register(0));

        assertEquals(1, result.nextSequence());
        assertEquals(1, store.read(player).pages().size());
        assertNull(store.read(player).snapshot());
        verify(publisher).publish(any());
    }

    @Test
    void testPersistEventsUsesFirstSequenceAsToken() {
        coordinator.handle(register(0));
        EventBook tail = store.readAll(player);

        assertThrows(SequenceConflictException.class, () -> coordinator.persistEvents(tail));
    }
}
