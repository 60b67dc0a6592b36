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

package org.elasticsoftware.folio.saga;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.errors.CommandRejectedException;

import java.util.List;

/**
 * A stateless reaction to one domain's committed events.
 * <p>
 * The saga cannot know the current sequence of a destination aggregate before it has read it, hence
 * the two phases. Both phases must be pure functions of their input: a saga is re-run from scratch
 * whenever one of its commands hits a sequence conflict.
 * </p>
 */
public interface Saga {
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * The domain whose committed events trigger this saga.
     */
    String getSourceDomain();

    /**
     * Declares the streams whose current state is needed to decide on the commands.
     */
    @NotNull List<Cover> prepare(@NotNull EventBook source);

    /**
     * Produces the commands, one book per destination, each with its expected sequence set to the
     * destination's {@link EventBook#nextSequence()}.
     */
    @NotNull List<CommandBook> execute(@NotNull EventBook source, @NotNull List<EventBook> destinations);

    /**
     * Called for each command the destination rejected, after the saga has run without a conflict.
     * Returns compensating commands, typically against the source aggregate. They are dispatched once,
     * and their own failures are only logged.
     */
    default @NotNull List<CommandBook> onCommandRejected(@NotNull CommandBook command,
                                                         @NotNull CommandRejectedException rejection,
                                                         @NotNull EventBook source) {
        return List.of();
    }
}
