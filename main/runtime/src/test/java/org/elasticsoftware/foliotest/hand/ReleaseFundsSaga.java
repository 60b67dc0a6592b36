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

package org.elasticsoftware.foliotest.hand;

import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.CommandPage;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.saga.Saga;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.state.StateRebuilder;
import org.elasticsoftware.foliotest.player.PlayerAggregate;
import org.elasticsoftware.foliotest.player.PlayerState;
import org.elasticsoftware.foliotest.player.ReleaseFundsCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * Releases every player's reservation for a hand once the hand has ended. Players that no longer hold a
 * reservation for the hand get no command, so running the saga twice is harmless.
 */
public class ReleaseFundsSaga implements Saga {
    private final PayloadSerde serde;
    private final StateRebuilder<PlayerState> playerState;

    public ReleaseFundsSaga(PayloadSerde serde) {
        this.serde = serde;
        this.playerState = PlayerAggregate.stateRebuilder(serde);
    }

    @Override
    public String getSourceDomain() {
        return HandAggregate.DOMAIN;
    }

    @Override
    public List<Cover> prepare(EventBook source) {
        List<Cover> covers = new ArrayList<>();
        for (EventPage page : source.pages()) {
            if ("HandEnded".equals(page.typeName())) {
                serde.deserialize(page.payload(), HandEndedEvent.class).playerIds()
                        .forEach(playerId -> covers.add(new Cover(PlayerAggregate.DOMAIN, playerId)));
            }
        }
        return covers;
    }

    @Override
    public List<CommandBook> execute(EventBook source, List<EventBook> destinations) {
        String handId = source.cover().root().toString();
        List<CommandBook> commands = new ArrayList<>();
        for (EventBook destination : destinations) {
            if (playerState.rebuild(destination).reservations().containsKey(handId)) {
                commands.add(CommandBook.of(destination.cover(),
                        new CommandPage(destination.nextSequence(), serde.serialize(new ReleaseFundsCommand(handId)))));
            }
        }
        return commands;
    }
}
