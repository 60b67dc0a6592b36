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

import java.time.Instant;
import java.util.Objects;

/**
 * The point in a stream's history a read should reflect.
 */
public sealed interface TemporalQuery permits TemporalQuery.Current, TemporalQuery.AsOfSequence, TemporalQuery.AsOfTimestamp {

    static TemporalQuery current() {
        return Current.INSTANCE;
    }

    static TemporalQuery asOfSequence(long sequence) {
        return new AsOfSequence(sequence);
    }

    static TemporalQuery asOfTimestamp(Instant timestamp) {
        return new AsOfTimestamp(timestamp);
    }

    default boolean isCurrent() {
        return this instanceof Current;
    }

    record Current() implements TemporalQuery {
        static final Current INSTANCE = new Current();
    }

    /**
     * Pages up to and including {@code sequence}.
     */
    record AsOfSequence(long sequence) implements TemporalQuery {
        public AsOfSequence {
            if (sequence < 0) {
                throw new IllegalArgumentException("sequence must not be negative, got " + sequence);
            }
        }
    }

    /**
     * Pages created at or before {@code timestamp}.
     */
    record AsOfTimestamp(Instant timestamp) implements TemporalQuery {
        public AsOfTimestamp {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
