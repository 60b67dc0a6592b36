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

package org.elasticsoftware.foliotest;

import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.CommandPage;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.commands.Command;
import org.elasticsoftware.folio.events.DomainEvent;
import org.elasticsoftware.folio.serialization.PayloadSerde;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class FolioTestSupport {
    public static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private FolioTestSupport() {
    }

    public static PayloadSerde serde() {
        return new PayloadSerde(PayloadSerde.defaultObjectMapper());
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static CommandBook command(PayloadSerde serde, Cover cover, long expectedSequence, Command command) {
        return CommandBook.of(cover, new CommandPage(expectedSequence, serde.serialize(command)));
    }

    /**
     * A book holding the given events from sequence 0, one second apart starting at {@link #NOW}.
     */
    public static EventBook events(PayloadSerde serde, Cover cover, DomainEvent... events) {
        List<EventPage> pages = new ArrayList<>();
        for (int i = 0; i < events.length; i++) {
            pages.add(new EventPage(i, serde.serialize(events[i]), NOW.plusSeconds(i)));
        }
        return new EventBook(cover, pages);
    }
}
