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

package org.elasticsoftware.folio.book;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * An immutable, gap-free run of events for one stream, optionally preceded by a snapshot.
 * <p>
 * Pages are contiguous and strictly increasing. With a snapshot the first page must be
 * {@code snapshot.asOfSequence + 1}. Books read from storage without a snapshot start at 0, books
 * carrying events that are about to be appended start at the stream's next free sequence.
 * </p>
 */
public record EventBook(@NotNull Cover cover, @NotNull List<EventPage> pages, @Nullable Snapshot snapshot) {
    public EventBook {
        Objects.requireNonNull(cover, "cover");
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
        for (int i = 1; i < pages.size(); i++) {
            long previous = pages.get(i - 1).sequence();
            long current = pages.get(i).sequence();
            if (current != previous + 1) {
                throw new IllegalArgumentException("EventBook for " + cover.streamKey()
                        + " has a gap or is out of order: " + previous + " followed by " + current);
            }
        }
        if (snapshot != null && !pages.isEmpty() && pages.get(0).sequence() != snapshot.asOfSequence() + 1) {
            throw new IllegalArgumentException("EventBook for " + cover.streamKey() + " must continue at "
                    + (snapshot.asOfSequence() + 1) + " after its snapshot, got " + pages.get(0).sequence());
        }
    }

    public EventBook(Cover cover, List<EventPage> pages) {
        this(cover, pages, null);
    }

    public static EventBook empty(Cover cover) {
        return new EventBook(cover, List.of(), null);
    }

    /**
     * The sequence the next appended event will receive.
     */
    public long nextSequence() {
        if (!pages.isEmpty()) {
            return pages.get(pages.size() - 1).sequence() + 1;
        } else if (snapshot != null) {
            return snapshot.asOfSequence() + 1;
        } else {
            return 0L;
        }
    }

    /**
     * The first sequence held by this book, which is {@link #nextSequence()} when it holds no pages.
     */
    public long firstSequence() {
        return pages.isEmpty() ? nextSequence() : pages.get(0).sequence();
    }

    public boolean isEmpty() {
        return pages.isEmpty() && snapshot == null;
    }

    public EventBook withPages(List<EventPage> pages) {
        return new EventBook(cover, pages, snapshot);
    }
}
