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

package org.elasticsoftware.folio.aggregate;

import org.elasticsoftware.folio.book.CommandPage;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.errors.CommandRejectedException;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The business logic of one domain as seen by the coordinator: prior events plus a command in, new
 * event payloads out. Implementations never touch storage and never read the clock.
 */
public interface AggregateRuntime {
    String getDomain();

    Set<String> getCommandTypeNames();

    List<Payload> handle(EventBook priorEvents, CommandPage command) throws CommandRejectedException;

    /**
     * The state after {@code events}, serialized for snapshot storage, or empty when this domain does not
     * snapshot.
     */
    default Optional<Payload> snapshot(EventBook events) {
        return Optional.empty();
    }
}
