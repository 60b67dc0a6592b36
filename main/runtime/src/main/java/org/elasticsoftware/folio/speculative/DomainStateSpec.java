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

package org.elasticsoftware.folio.speculative;

import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.query.TemporalQuery;

import java.time.Instant;
import java.util.Objects;

/**
 * How a speculative run obtains the state of one stream.
 */
public sealed interface DomainStateSpec
        permits DomainStateSpec.Current, DomainStateSpec.AtSequence, DomainStateSpec.AtTimestamp, DomainStateSpec.Explicit {

    static DomainStateSpec current() {
        return new Current();
    }

    static DomainStateSpec atSequence(long sequence) {
        return new AtSequence(sequence);
    }

    static DomainStateSpec atTimestamp(Instant timestamp) {
        return new AtTimestamp(timestamp);
    }

    static DomainStateSpec explicit(EventBook eventBook) {
        return new Explicit(eventBook);
    }

    record Current() implements DomainStateSpec {
    }

    record AtSequence(long sequence) implements DomainStateSpec {
        public TemporalQuery toQuery() {
            return TemporalQuery.asOfSequence(sequence);
        }
    }

    record AtTimestamp(Instant timestamp) implements DomainStateSpec {
        public AtTimestamp {
            Objects.requireNonNull(timestamp, "timestamp");
        }

        public TemporalQuery toQuery() {
            return TemporalQuery.asOfTimestamp(timestamp);
        }
    }

    /**
     * Use this book as-is, without reading storage.
     */
    record Explicit(EventBook eventBook) implements DomainStateSpec {
        public Explicit {
            Objects.requireNonNull(eventBook, "eventBook");
        }
    }
}
