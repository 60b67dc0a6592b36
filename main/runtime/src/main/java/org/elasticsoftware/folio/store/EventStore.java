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

package org.elasticsoftware.folio.store;

import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.errors.SequenceConflictException;

import java.util.List;

/**
 * Durable, per-stream ordered storage of events and snapshots.
 */
public interface EventStore {
    /**
     * Reads the stream starting from its latest snapshot, if any. Unknown streams yield an empty book.
     */
    EventBook read(Cover cover);

    /**
     * Reads every page of the stream from sequence 0, ignoring snapshots.
     */
    EventBook readAll(Cover cover);

    /**
     * Appends pages if and only if the stream's next sequence equals {@code expectedSequence}. The check
     * and the write are atomic per stream.
     *
     * @throws SequenceConflictException when another writer got there first
     */
    void append(Cover cover, long expectedSequence, List<EventPage> pages) throws SequenceConflictException;

    void writeSnapshot(Cover cover, Payload state, long asOfSequence);

    /**
     * Full streams that received at least one append under the given correlation id.
     */
    List<EventBook> findByCorrelationId(String correlationId);
}
