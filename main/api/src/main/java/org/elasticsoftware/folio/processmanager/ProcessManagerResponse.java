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
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.EventBook;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ProcessManager#handle}: commands for other domains plus the events to append to
 * the process manager's own stream.
 */
public record ProcessManagerResponse(List<CommandBook> commands, @Nullable EventBook processEvents) {
    public ProcessManagerResponse {
        commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
    }

    public static ProcessManagerResponse empty() {
        return new ProcessManagerResponse(List.of(), null);
    }

    public boolean hasProcessEvents() {
        return processEvents != null && !processEvents.pages().isEmpty();
    }
}
