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

import com.google.common.annotations.VisibleForTesting;
import org.elasticsoftware.folio.aggregate.CommandExecutor;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.bus.EventBookSubscriber;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.elasticsoftware.folio.retry.RetriesExhaustedException;
import org.elasticsoftware.folio.retry.RetryPolicy;
import org.elasticsoftware.folio.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a {@link Saga} for each committed book of its source domain: prepare, read the destinations,
 * execute, dispatch. When a command hits a sequence conflict the whole saga runs again from prepare,
 * with fresh destination state, until the {@link RetryPolicy} gives up.
 */
public class SagaOrchestrator implements EventBookSubscriber {
    private static final Logger logger = LoggerFactory.getLogger(SagaOrchestrator.class);
    private final Saga saga;
    private final EventStore eventStore;
    private final CommandExecutor commandExecutor;
    private final RetryPolicy retryPolicy;

    public SagaOrchestrator(Saga saga, EventStore eventStore, CommandExecutor commandExecutor, RetryPolicy retryPolicy) {
        this.saga = saga;
        this.eventStore = eventStore;
        this.commandExecutor = commandExecutor;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String getName() {
        return saga.getName();
    }

    @Override
    public boolean accepts(String domain) {
        return saga.getSourceDomain().equals(domain);
    }

    @Override
    public void onEvents(EventBook events) {
        handle(events);
    }

    public SagaResult handle(EventBook source) {
        SequenceConflictException lastConflict = null;
        // commands that went through stay dispatched when a later command forces a re-run
        List<CommandBook> dispatched = new ArrayList<>();
        Map<CommandBook, CommandRejectedException> rejected = new LinkedHashMap<>();
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            lastConflict = null;
            for (CommandBook command : commandsFor(source)) {
                try {
                    commandExecutor.execute(command);
                    dispatched.add(command);
                    rejected.remove(command);
                } catch (SequenceConflictException e) {
                    logger.warn("Saga {} attempt {} hit a conflict: {}", saga.getName(), attempt, e.getMessage());
                    lastConflict = e;
                    break;
                } catch (CommandRejectedException e) {
                    logger.error("Saga {} command on {} was rejected: {}",
                            saga.getName(), command.cover().streamKey(), e.getReason());
                    rejected.put(command, e);
                }
            }
            if (lastConflict == null) {
                return new SagaResult(attempt, dispatched, List.copyOf(rejected.keySet()), compensate(rejected, source));
            }
            if (retryPolicy.hasAttemptsLeft(attempt)) {
                retryPolicy.pause(attempt, source.cover().domain(), source.cover().root().toString(), lastConflict);
            }
        }
        throw new RetriesExhaustedException(source.cover().domain(), source.cover().root().toString(),
                retryPolicy.maxAttempts(), lastConflict);
    }

    /**
     * Both saga phases against current destination state, with the source's correlation id filled in
     * on commands that carry none.
     */
    public List<CommandBook> commandsFor(EventBook source) {
        List<Cover> covers = saga.prepare(source);
        List<EventBook> destinations = covers.stream().map(eventStore::read).collect(Collectors.toList());
        logger.debug("Saga {} read {} destinations for {}", saga.getName(), destinations.size(), source.cover().streamKey());
        return withCorrelationId(saga.execute(source, destinations), source);
    }

    private List<CommandBook> compensate(Map<CommandBook, CommandRejectedException> rejected, EventBook source) {
        List<CommandBook> compensations = new ArrayList<>();
        rejected.forEach((command, rejection) -> {
            for (CommandBook compensation : withCorrelationId(saga.onCommandRejected(command, rejection, source), source)) {
                try {
                    commandExecutor.execute(compensation);
                    compensations.add(compensation);
                } catch (SequenceConflictException | CommandRejectedException e) {
                    logger.error("Saga {} compensation on {} failed: {}",
                            saga.getName(), compensation.cover().streamKey(), e.getMessage());
                }
            }
        });
        return compensations;
    }

    @VisibleForTesting
    static List<CommandBook> withCorrelationId(List<CommandBook> commands, EventBook source) {
        String correlationId = source.cover().correlationId();
        return commands.stream()
                .map(command -> command.withDefaultCorrelationId(correlationId))
                .collect(Collectors.toList());
    }

    public Saga getSaga() {
        return saga;
    }
}
