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

package org.elasticsoftware.folio.bus;

import org.elasticsoftware.folio.book.EventBook;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Hands committed events to downstream consumers. The returned stage completes once every consumer
 * has processed the book.
 */
@FunctionalInterface
public interface EventPublisher {
    CompletionStage<Void> publish(EventBook events);

    /**
     * Publishes with every delivery running on the calling thread, for callers that wait on the result.
     * Waiting on a pooled delivery from inside another delivery could otherwise starve the pool.
     */
    default CompletionStage<Void> publishOnCallerThread(EventBook events) {
        return publish(events);
    }

    static EventPublisher noop() {
        return events -> CompletableFuture.completedFuture(null);
    }
}
