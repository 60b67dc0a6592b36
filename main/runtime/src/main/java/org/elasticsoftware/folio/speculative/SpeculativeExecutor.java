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

package org.elasticsoftware.folio.speculative;

import org.elasticsoftware.folio.aggregate.AggregateCoordinator;
import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.processmanager.CorrelationRoots;
import org.elasticsoftware.folio.processmanager.ProcessManager;
import org.elasticsoftware.folio.processmanager.ProcessManagerResponse;
import org.elasticsoftware.folio.query.EventBooks;
import org.elasticsoftware.folio.query.TemporalQuery;
import org.elasticsoftware.folio.saga.Saga;
import org.elasticsoftware.folio.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers "what would happen if" without changing anything: runs aggregates, sagas and process
 * managers through their production code paths against current, historical or caller-supplied state,
 * and returns the outcome instead of persisting or publishing it.
 * <p>
 * A speculative command skips the expected-sequence check, since it is evaluated against whatever
 * history the caller picked.
 * </p>
 */
public class SpeculativeExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SpeculativeExecutor.class);
    private final AggregateCoordinator coordinator;
    private final EventStore eventStore;
    private final Map<String, Saga> sagas;
    private final Map<String, ProcessManager> processManagers;

    public SpeculativeExecutor(AggregateCoordinator coordinator,
                               EventStore eventStore,
                               Collection<Saga> sagas,
                               Collection<ProcessManager> processManagers) {
        this.coordinator = coordinator;
        this.eventStore = eventStore;
        this.sagas = sagas.stream().collect(Collectors.toUnmodifiableMap(Saga::getName, Function.identity()));
        this.processManagers = processManagers.stream()
                .collect(Collectors.toUnmodifiableMap(ProcessManager::getName, Function.identity()));
    }

    /**
     * The events the command would produce against the stream as of {@code pointInTime}, numbered from
     * that point's next sequence.
     */
    public EventBook speculate(CommandBook command, TemporalQuery pointInTime) {
        EventBook history = pointInTime.isCurrent()
                ? eventStore.read(command.cover())
                : EventBooks.truncate(eventStore.readAll(command.cover()), pointInTime);
        List<EventPage> pages = coordinator.evaluate(command, history);
        logger.debug("Speculative {} on {} at {} yields {} events",
                command.pages().get(0).typeName(), command.cover().streamKey(), pointInTime, pages.size());
        return new EventBook(command.cover(), pages);
    }

    /**
     * The commands the named saga would emit for {@code source}. Destination state is resolved per
     * domain through {@code domainSpecs}; domains not listed are read at their current state.
     */
    public List<CommandBook> speculateSaga(String sagaName, EventBook source, Map<String, DomainStateSpec> domainSpecs) {
        Saga saga = sagas.get(sagaName);
        if (saga == null) {
            throw new IllegalArgumentException("Unknown saga " + sagaName);
        }
        List<EventBook> destinations = saga.prepare(source).stream()
                .map(cover -> resolve(cover, domainSpecs))
                .collect(Collectors.toList());
        String correlationId = source.cover().correlationId();
        return saga.execute(source, destinations).stream()
                .map(commandBook -> commandBook.withDefaultCorrelationId(correlationId))
                .collect(Collectors.toList());
    }

    /**
     * What the named process manager would do for {@code trigger}. Its own state is resolved through
     * the {@link DomainStateSpec} registered for its domain, destinations through the one for theirs.
     */
    public ProcessManagerResponse speculateProcessManager(String processManagerName,
                                                          EventBook trigger,
                                                          Map<String, DomainStateSpec> domainSpecs) {
        ProcessManager processManager = processManagers.get(processManagerName);
        if (processManager == null) {
            throw new IllegalArgumentException("Unknown process manager " + processManagerName);
        }
        String correlationId = trigger.cover().correlationId();
        if (correlationId == null) {
            return ProcessManagerResponse.empty();
        }
        Cover pmCover = new Cover(processManager.getDomain(), CorrelationRoots.rootOf(correlationId), correlationId);
        EventBook pmState = resolve(pmCover, domainSpecs);
        List<EventBook> destinations = processManager.prepare(trigger, pmState).stream()
                .map(cover -> resolve(cover, domainSpecs))
                .collect(Collectors.toList());
        return processManager.handle(trigger, pmState, destinations);
    }

    private EventBook resolve(Cover cover, Map<String, DomainStateSpec> domainSpecs) {
        return resolve(cover, domainSpecs.getOrDefault(cover.domain(), DomainStateSpec.current()));
    }

    public EventBook resolve(Cover cover, DomainStateSpec spec) {
        if (spec instanceof DomainStateSpec.Explicit explicit) {
            return explicit.eventBook();
        } else if (spec instanceof DomainStateSpec.AtSequence atSequence) {
            return EventBooks.truncate(eventStore.readAll(cover), atSequence.toQuery());
        } else if (spec instanceof DomainStateSpec.AtTimestamp atTimestamp) {
            return EventBooks.truncate(eventStore.readAll(cover), atTimestamp.toQuery());
        } else {
            return eventStore.read(cover);
        }
    }
}
