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

import org.elasticsoftware.folio.aggregate.AggregateCoordinator;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.bus.EventBookSubscriber;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.elasticsoftware.folio.retry.RetriesExhaustedException;
import org.elasticsoftware.folio.retry.RetryPolicy;
import org.elasticsoftware.folio.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Delivers triggers to a {@link ProcessManager} and keeps its stream consistent.
 * <p>
 * For every trigger the engine reads the process manager's stream, runs both phases and appends the
 * resulting process events. A conflict on that append means another trigger of the same workflow won
 * the race; the engine re-reads and runs again. Commands go out only after the process events are
 * stored, so a process manager that records "dispatched" in its own events dispatches at most once.
 * </p>
 * <p>
 * A command rejected by its target is handed back through {@link ProcessManager#onCommandRejected}, and
 * whatever process events that returns are appended to the same stream.
 * </p>
 */
public class ProcessManagerEngine implements EventBookSubscriber {
    private static final Logger logger = LoggerFactory.getLogger(ProcessManagerEngine.class);
    private final ProcessManager processManager;
    private final EventStore eventStore;
    private final AggregateCoordinator coordinator;
    private final RetryPolicy retryPolicy;

    public ProcessManagerEngine(ProcessManager processManager,
                                EventStore eventStore,
                                AggregateCoordinator coordinator,
                                RetryPolicy retryPolicy) {
        this.processManager = processManager;
        this.eventStore = eventStore;
        this.coordinator = coordinator;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String getName() {
        return processManager.getName();
    }

    @Override
    public boolean accepts(String domain) {
        return processManager.isTriggeredBy(domain);
    }

    @Override
    public void onEvents(EventBook events) {
        handle(events);
    }

    public ProcessManagerResult handle(EventBook trigger) {
        String correlationId = trigger.cover().correlationId();
        if (correlationId == null) {
            logger.debug("{} skipping {}: no correlation id", processManager.getName(), trigger.cover().streamKey());
            return ProcessManagerResult.skipped();
        }
        Cover pmCover = coverFor(correlationId);
        SequenceConflictException lastConflict = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            EventBook pmState = eventStore.read(pmCover);
            List<Cover> covers = processManager.prepare(trigger, pmState);
            List<EventBook> destinations = covers.stream().map(eventStore::read).collect(Collectors.toList());
            ProcessManagerResponse response = processManager.handle(trigger, pmState, destinations);
            EventBook processEvents = null;
            if (response.hasProcessEvents()) {
                processEvents = stamp(pmCover, response.processEvents());
                try {
                    coordinator.persistEvents(processEvents);
                } catch (SequenceConflictException e) {
                    logger.warn("{} attempt {} for correlation {} conflicted: {}",
                            processManager.getName(), attempt, correlationId, e.getMessage());
                    lastConflict = e;
                    if (retryPolicy.hasAttemptsLeft(attempt)) {
                        retryPolicy.pause(attempt, pmCover.domain(), pmCover.root().toString(), e);
                    }
                    continue;
                }
                logger.info("{} persisted {} process events for correlation {}",
                        processManager.getName(), processEvents.pages().size(), correlationId);
            }
            return dispatch(attempt, processEvents, response.commands(), pmCover);
        }
        logger.error("{} gave up on correlation {} after {} attempts",
                processManager.getName(), correlationId, retryPolicy.maxAttempts());
        throw new RetriesExhaustedException(pmCover.domain(), pmCover.root().toString(),
                retryPolicy.maxAttempts(), lastConflict);
    }

    public Cover coverFor(String correlationId) {
        return new Cover(processManager.getDomain(), CorrelationRoots.rootOf(correlationId), correlationId);
    }

    public ProcessManager getProcessManager() {
        return processManager;
    }

    private EventBook stamp(Cover pmCover, EventBook processEvents) {
        Instant now = coordinator.getClock().instant();
        return new EventBook(pmCover, processEvents.pages().stream()
                .map(page -> new EventPage(page.sequence(), page.payload(), now))
                .collect(Collectors.toList()));
    }

    private ProcessManagerResult dispatch(int attempt, EventBook processEvents, List<CommandBook> commands, Cover pmCover) {
        String correlationId = pmCover.correlationId();
        List<CommandBook> dispatched = new ArrayList<>();
        List<CommandBook> failed = new ArrayList<>();
        List<EventBook> compensations = new ArrayList<>();
        for (CommandBook command : commands) {
            CommandBook correlated = command.withDefaultCorrelationId(correlationId);
            try {
                coordinator.handle(correlated);
                dispatched.add(correlated);
            } catch (SequenceConflictException e) {
                logger.warn("{} command on {} conflicted: {}",
                        processManager.getName(), correlated.cover().streamKey(), e.getMessage());
                failed.add(correlated);
            } catch (CommandRejectedException e) {
                logger.error("{} command on {} was rejected: {}",
                        processManager.getName(), correlated.cover().streamKey(), e.getReason());
                failed.add(correlated);
                compensate(correlated, e, pmCover).ifPresent(compensations::add);
            }
        }
        return new ProcessManagerResult(ProcessManagerResult.Status.HANDLED, attempt, processEvents, dispatched,
                failed, compensations);
    }

    private Optional<EventBook> compensate(CommandBook command, CommandRejectedException rejection, Cover pmCover) {
        SequenceConflictException lastConflict = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            EventBook pmState = eventStore.read(pmCover);
            EventBook compensation = processManager.onCommandRejected(command, rejection, pmState);
            if (compensation == null || compensation.pages().isEmpty()) {
                return Optional.empty();
            }
            EventBook stamped = stamp(pmCover, compensation);
            try {
                coordinator.persistEvents(stamped);
                logger.info("{} recorded {} compensation events for correlation {}",
                        processManager.getName(), stamped.pages().size(), pmCover.correlationId());
                return Optional.of(stamped);
            } catch (SequenceConflictException e) {
                logger.warn("{} compensation attempt {} for correlation {} conflicted: {}",
                        processManager.getName(), attempt, pmCover.correlationId(), e.getMessage());
                lastConflict = e;
                if (retryPolicy.hasAttemptsLeft(attempt)) {
                    retryPolicy.pause(attempt, pmCover.domain(), pmCover.root().toString(), e);
                }
            }
        }
        throw new RetriesExhaustedException(pmCover.domain(), pmCover.root().toString(),
                retryPolicy.maxAttempts(), lastConflict);
    }
}
