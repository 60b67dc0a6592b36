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
import org.elasticsoftware.folio.commands.Command;
import org.elasticsoftware.folio.commands.CommandHandlerFunction;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.errors.ErrorKind;
import org.elasticsoftware.folio.events.DomainEvent;
import org.elasticsoftware.folio.serialization.PayloadSerde;
import org.elasticsoftware.folio.state.StateRebuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link AggregateRuntime} built from a {@link StateRebuilder} and a table of typed command handlers.
 * The table is fixed when {@link Builder#build()} returns.
 */
public final class DefaultAggregateRuntime<S> implements AggregateRuntime {
    private static final Logger logger = LoggerFactory.getLogger(DefaultAggregateRuntime.class);
    private final String domain;
    private final StateRebuilder<S> stateRebuilder;
    private final Map<String, CommandRoute<S>> commandHandlers;
    private final PayloadSerde serde;
    private final boolean snapshotting;

    private DefaultAggregateRuntime(String domain,
                                    StateRebuilder<S> stateRebuilder,
                                    Map<String, CommandRoute<S>> commandHandlers,
                                    PayloadSerde serde,
                                    boolean snapshotting) {
        this.domain = domain;
        this.stateRebuilder = stateRebuilder;
        this.commandHandlers = Map.copyOf(commandHandlers);
        this.serde = serde;
        this.snapshotting = snapshotting;
    }

    public static <S> Builder<S> builder(String domain, StateRebuilder<S> stateRebuilder, PayloadSerde serde) {
        return new Builder<>(domain, stateRebuilder, serde);
    }

    @Override
    public String getDomain() {
        return domain;
    }

    @Override
    public Set<String> getCommandTypeNames() {
        return commandHandlers.keySet();
    }

    @Override
    public List<Payload> handle(EventBook priorEvents, CommandPage command) throws CommandRejectedException {
        CommandRoute<S> route = commandHandlers.get(command.typeName());
        if (route == null) {
            throw new CommandRejectedException(ErrorKind.INVALID_ARGUMENT, domain,
                    priorEvents.cover().root().toString(),
                    "No CommandHandler for type " + command.typeName() + " in domain " + domain);
        }
        S state = stateRebuilder.rebuild(priorEvents);
        Command typedCommand = serde.deserialize(command.payload(), route.commandType().typeClass());
        logger.trace("Handling {} on {}", command.typeName(), priorEvents.cover().streamKey());
        return route.handler().apply(typedCommand, state)
                .map(serde::serialize)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Payload> snapshot(EventBook events) {
        if (!snapshotting) {
            return Optional.empty();
        }
        return Optional.of(stateRebuilder.toSnapshot(stateRebuilder.rebuild(events)));
    }

    public StateRebuilder<S> getStateRebuilder() {
        return stateRebuilder;
    }

    private record CommandRoute<S>(CommandType<?> commandType,
                                   CommandHandlerFunction<S, Command, DomainEvent> handler) {
    }

    public static final class Builder<S> {
        private final String domain;
        private final StateRebuilder<S> stateRebuilder;
        private final PayloadSerde serde;
        private final Map<String, CommandRoute<S>> commandHandlers = new HashMap<>();
        private boolean snapshotting = false;

        private Builder(String domain, StateRebuilder<S> stateRebuilder, PayloadSerde serde) {
            this.domain = domain;
            this.stateRebuilder = stateRebuilder;
            this.serde = serde;
        }

        @SuppressWarnings("unchecked")
        public <C extends Command, E extends DomainEvent> Builder<S> withCommandHandler(
                Class<C> commandClass, CommandHandlerFunction<S, C, E> handler) {
            CommandType<C> commandType = CommandType.of(commandClass);
            if (commandHandlers.containsKey(commandType.typeName())) {
                throw new IllegalStateException("Duplicate CommandHandler for " + commandType.typeName());
            }
            commandHandlers.put(commandType.typeName(),
                    new CommandRoute<>(commandType, (CommandHandlerFunction<S, Command, DomainEvent>) handler));
            return this;
        }

        public Builder<S> withSnapshots() {
            this.snapshotting = true;
            return this;
        }

        public DefaultAggregateRuntime<S> build() {
            return new DefaultAggregateRuntime<>(domain, stateRebuilder, commandHandlers, serde, snapshotting);
        }
    }
}
