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
import org.elasticsoftware.folio.errors.AggregateNotFoundException;
import org.elasticsoftware.folio.service.EventQueryService;
import org.elasticsoftware.folio.service.Query;
import org.elasticsoftware.folio.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads streams for clients. Current reads may start from a snapshot; historical reads replay the full
 * stream and fail with {@link AggregateNotFoundException} for a stream that has no history at all.
 */
public class DefaultEventQueryService implements EventQueryService {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEventQueryService.class);
    private final EventStore eventStore;

    public DefaultEventQueryService(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public EventBook getEventBook(Query query) {
        logger.trace("Reading {} at {}", query.cover().streamKey(), query.temporal());
        if (query.temporal().isCurrent()) {
            return eventStore.read(query.cover());
        }
        EventBook history = eventStore.readAll(query.cover());
        if (history.pages().isEmpty()) {
            throw new AggregateNotFoundException(query.cover().domain(), query.cover().root().toString());
        }
        return EventBooks.truncate(history, query.temporal());
    }

    @Override
    public List<EventBook> getEventBooksByCorrelationId(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be blank");
        }
        return eventStore.findByCorrelationId(correlationId);
    }
}
