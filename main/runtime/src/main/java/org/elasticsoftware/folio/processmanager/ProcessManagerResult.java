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

public record ProcessManagerResult(Status status,
                                   int attempts,
                                   @Nullable EventBook processEvents,
                                   List<CommandBook> dispatched,
                                   List<CommandBook> failed,
                                   List<EventBook> compensations) {
    public enum Status {
        /**
         * The trigger carried no correlation id.
         */
        SKIPPED,
        HANDLED
    }

    public ProcessManagerResult {
        dispatched = List.copyOf(dispatched);
        failed = List.copyOf(failed);
        compensations = List.copyOf(compensations);
    }

    public static ProcessManagerResult skipped() {
        return new ProcessManagerResult(Status.SKIPPED, 0, null, List.of(), List.of(), List.of());
    }
}
