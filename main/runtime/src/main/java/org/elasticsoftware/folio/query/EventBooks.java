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

package org.elasticsoftware.folio.query;

import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

public final class EventBooks {
    private EventBooks() {
    }

    /**
     * Cuts a book back to the point in time the query names. The result is always a prefix of the
     * input, so it stays gap-free. Historical cuts need the full history: a book carrying a snapshot
     * can only be cut at or after the snapshot's sequence, and never by timestamp.
     */
    public static EventBook truncate(EventBook eventBook, TemporalQuery query) {
        if (query instanceof TemporalQuery.AsOfSequence asOfSequence) {
            long bound = asOfSequence.sequence();
            if (eventBook.snapshot() != null && eventBook.snapshot().asOfSequence() > bound) {
                throw new IllegalArgumentException("Cannot truncate " + eventBook.cover().streamKey()
                        + " to sequence " + bound + ": snapshot covers up to " + eventBook.snapshot().asOfSequence());
            }
            return eventBook.withPages(prefix(eventBook, page -> page.sequence() <= bound));
        } else if (query instanceof TemporalQuery.AsOfTimestamp asOfTimestamp) {
            if (eventBook.snapshot() != null) {
                throw new IllegalArgumentException("Cannot truncate " + eventBook.cover().streamKey()
                        + " by timestamp: book starts from a snapshot");
            }
            return eventBook.withPages(prefix(eventBook, page -> !page.createdAt().isAfter(asOfTimestamp.timestamp())));
        } else {
            return eventBook;
        }
    }

    private static List<EventPage> prefix(EventBook eventBook, Predicate<EventPage> keep) {
        List<EventPage> pages = new ArrayList<>();
        for (EventPage page : eventBook.pages()) {
            if (!keep.test(page)) {
                break;
            }
            pages.add(page);
        }
        return pages;
    }
}
