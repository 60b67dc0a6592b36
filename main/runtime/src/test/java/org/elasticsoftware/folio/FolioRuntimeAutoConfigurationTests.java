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

import jakarta.inject.Inject;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.bus.LocalEventBus;
import org.elasticsoftware.folio.query.TemporalQuery;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.service.CommandService;
import org.elasticsoftware.folio.service.DryRunRequest;
import org.elasticsoftware.folio.service.EventQueryService;
import org.elasticsoftware.folio.service.Query;
import org.elasticsoftware.foliotest.FolioTestConfiguration;
import org.elasticsoftware.foliotest.FolioTestSupport;
import org.elasticsoftware.foliotest.hand.EndHandCommand;
import org.elasticsoftware.foliotest.hand.HandAggregate;
import org.elasticsoftware.foliotest.player.PlayerAggregate;
import org.elasticsoftware.foliotest.player.RegisterPlayerCommand;
import org.elasticsoftware.foliotest.player.ReserveFundsCommand;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = FolioTestConfiguration.class, properties = "folio.bus.threads=0")
@DirtiesContext
class FolioRuntimeAutoConfigurationTests {
    @Inject
    CommandService commandService;
    @Inject
    EventQueryService eventQueryService;
    @Inject
    LocalEventBus eventBus;
    @Inject
    PayloadSerde serde;

    @Test
    void testSubscribersAreRegistered() {
        assertThat(eventBus.getSubscribers())
                .extracting(subscriber -> subscriber.getName())
                .containsExactlyInAnyOrder("ReleaseFundsSaga", "FulfillmentProcessManager");
    }

    @Test
    void testEndingHandReleasesReservationsThroughTheBus() {
        Cover player = new Cover(PlayerAggregate.DOMAIN, UUID.randomUUID());
        Cover hand = new Cover(HandAggregate.DOMAIN, UUID.randomUUID(), "table-1");
        commandService.handle(FolioTestSupport.command(serde, player, 0, new RegisterPlayerCommand("alice", 100)));
        commandService.handle(FolioTestSupport.command(serde, player, 1, new ReserveFundsCommand(hand.root().toString(), 40)));

        commandService.handle(FolioTestSupport.command(serde, hand, 0, new EndHandCommand(List.of(player.root()))));

        EventBook playerEvents = eventQueryService.getEventBook(new Query(player));
        assertThat(playerEvents.pages()).extracting(EventPage::typeName)
                .containsExactly("PlayerRegistered", "FundsReserved", "FundsReleased");
        assertEquals(FolioTestSupport.NOW, playerEvents.pages().get(2).createdAt());
        assertThat(eventQueryService.getEventBooksByCorrelationId("table-1")).hasSize(2);
    }

    @Test
    void testDryRunLeavesStreamUntouched() {
        Cover player = new Cover(PlayerAggregate.DOMAIN, UUID.randomUUID());
        commandService.handle(FolioTestSupport.command(serde, player, 0, new RegisterPlayerCommand("bob", 50)));
        CommandBook reserve = FolioTestSupport.command(serde, player, 1, new ReserveFundsCommand("hand-9", 10));

        EventBook hypothetical = commandService.dryRun(new DryRunRequest(reserve, TemporalQuery.current())).events();

        assertThat(hypothetical.pages()).extracting(EventPage::typeName).containsExactly("FundsReserved");
        assertEquals(1, eventQueryService.getEventBook(new Query(player)).nextSequence());
    }
}
