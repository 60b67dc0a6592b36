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

package org.elasticsoftware.folio.commands;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.events.DomainEvent;

import java.util.stream.Stream;

/**
 * Business logic for one command type. Must be deterministic given (command, state) and must not
 * persist anything itself.
 */
@FunctionalInterface
public interface CommandHandlerFunction<S, C extends Command, E extends DomainEvent> {
    @NotNull Stream<E> apply(@NotNull C command, @NotNull S state) throws CommandRejectedException;
}
