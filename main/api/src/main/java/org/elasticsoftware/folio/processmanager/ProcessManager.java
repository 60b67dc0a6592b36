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

package org.elasticsoftware.folio.processmanager;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.errors.CommandRejectedException;

import java.util.List;

/**
 * A stateful, event-sourced reactor keyed by correlation id. Unlike a {@link org.elasticsoftware.folio.saga.Saga}
 * it remembers which triggers it has already seen, which makes it the tool for fan-in: wait for several
 * independent completions, then act exactly once.
 * <p>
 * The state book passed in is the process manager's own stream in {@link #getDomain()}, addressed by
 * the root derived from the trigger's correlation id. It is empty for the first trigger of a workflow.
 * Events returned in {@link ProcessManagerResponse#processEvents()} must continue that stream at
 * {@code pmState.nextSequence()}.
 * </p>
 */
public interface ProcessManager {
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * The domain the process manager's own stream lives in.
     */
    String getDomain();

    /**
     * Whether a committed book from the given domain should be delivered to this process manager.
     */
    boolean isTriggeredBy(String domain);

    @NotNull List<Cover> prepare(@NotNull EventBook trigger, @NotNull EventBook pmState);

    @NotNull ProcessManagerResponse handle(@NotNull EventBook trigger,
                                           @NotNull EventBook pmState,
                                           @NotNull List<EventBook> destinations);

    /**
     * Called when a command this process manager emitted is rejected by its target. The returned process
     * events, continuing {@code pmState} like those of {@link #handle}, are persisted to the process
     * manager's stream so the workflow can record the failure or compensate. {@code null} or an empty
     * book records nothing.
     */
    default @Nullable EventBook onCommandRejected(@NotNull CommandBook command,
                                                  @NotNull CommandRejectedException rejection,
                                                  @NotNull EventBook pmState) {
        return null;
    }
}
