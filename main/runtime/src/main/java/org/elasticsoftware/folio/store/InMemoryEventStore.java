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
import org.elasticsoftware.folio.book.Snapshot;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryEventStore implements EventStore, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);
    private final ConcurrentMap<String, Stream> streams = new ConcurrentHashMap<>();

    @Override
    public EventBook read(Cover cover) {
        Stream stream = streams.get(cover.streamKey());
        if (stream == null) {
            return EventBook.empty(cover);
        }
        synchronized (stream) {
            if (stream.snapshot == null) {
                return new EventBook(cover, stream.pages);
            }
            int from = (int) stream.snapshot.asOfSequence() + 1;
            return new EventBook(cover, stream.pages.subList(from, stream.pages.size()), stream.snapshot);
        }
    }

    @Override
    public EventBook readAll(Cover cover) {
        Stream stream = streams.get(cover.streamKey());
        if (stream == null) {
            return EventBook.empty(cover);
        }
        synchronized (stream) {
            return new EventBook(cover, stream.pages);
        }
    }

    @Override
    public void append(Cover cover, long expectedSequence, List<EventPage> pages) throws SequenceConflictException {
        Stream stream = streams.computeIfAbsent(cover.streamKey(), key -> new Stream(cover.domain(), cover.root()));
        synchronized (stream) {
            long nextSequence = stream.pages.size();
            if (expectedSequence != nextSequence) {
                throw new SequenceConflictException(cover.domain(), cover.root().toString(), expectedSequence, nextSequence);
            }
            for (int i = 0; i < pages.size(); i++) {
                if (pages.get(i).sequence() != expectedSequence + i) {
                    throw new EventStoreException(cover.domain(), cover.root().toString(),
                            "Page " + i + " has sequence " + pages.get(i).sequence()
                                    + ", expected " + (expectedSequence + i));
                }
            }
            stream.pages.addAll(pages);
            if (cover.hasCorrelationId()) {
                stream.correlationIds.add(cover.correlationId());
            }
            logger.trace("Appended {} pages to {}, next sequence {}", pages.size(), cover.streamKey(), stream.pages.size());
        }
    }

    @Override
    public void writeSnapshot(Cover cover, Payload state, long asOfSequence) {
        Stream stream = streams.get(cover.streamKey());
        if (stream == null) {
            throw new EventStoreException(cover.domain(), cover.root().toString(), "Cannot snapshot an empty stream");
        }
        synchronized (stream) {
            if (asOfSequence < 0 || asOfSequence >= stream.pages.size()) {
                throw new EventStoreException(cover.domain(), cover.root().toString(),
                        "Snapshot sequence " + asOfSequence + " is outside the stream (next sequence "
                                + stream.pages.size() + ")");
            }
            if (stream.snapshot == null || stream.snapshot.asOfSequence() < asOfSequence) {
                stream.snapshot = new Snapshot(state, asOfSequence);
                logger.debug("Stored snapshot of {} as of sequence {}", cover.streamKey(), asOfSequence);
            }
        }
    }

    @Override
    public List<EventBook> findByCorrelationId(String correlationId) {
        List<EventBook> result = new ArrayList<>();
        for (Stream stream : streams.values()) {
            synchronized (stream) {
                if (stream.correlationIds.contains(correlationId)) {
                    result.add(new EventBook(new Cover(stream.domain, stream.root, correlationId), stream.pages));
                }
            }
        }
        return result;
    }

    @Override
    public void close() {
        streams.clear();
    }

    private static final class Stream {
        private final String domain;
        private final UUID root;
        private final List<EventPage> pages = new ArrayList<>();
        private final Set<String> correlationIds = new HashSet<>();
        private Snapshot snapshot;

        private Stream(String domain, UUID root) {
            this.domain = domain;
            this.root = root;
        }
    }
}
