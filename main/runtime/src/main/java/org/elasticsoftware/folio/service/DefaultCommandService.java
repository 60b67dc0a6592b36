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

package org.elasticsoftware.folio.service;

import org.elasticsoftware.folio.aggregate.AggregateCoordinator;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.speculative.SpeculativeExecutor;

public class DefaultCommandService implements CommandService {
    private final AggregateCoordinator coordinator;
    private final SpeculativeExecutor speculativeExecutor;

    public DefaultCommandService(AggregateCoordinator coordinator, SpeculativeExecutor speculativeExecutor) {
        this.coordinator = coordinator;
        this.speculativeExecutor = speculativeExecutor;
    }

    @Override
    public CommandResponse handle(CommandBook command) {
        return new CommandResponse(coordinator.handle(command));
    }

    @Override
    public CommandResponse dryRun(DryRunRequest request) {
        return new CommandResponse(speculativeExecutor.speculate(request.command(), request.pointInTime()));
    }
}
