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

import org.elasticsoftware.folio.book.CommandBook;
import org.elasticsoftware.folio.book.CommandPage;
import org.elasticsoftware.folio.book.Cover;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.book.SyncMode;
import org.elasticsoftware.folio.bus.EventPublisher;
import org.elasticsoftware.folio.errors.CommandRejectedException;
import org.elasticsoftware.folio.errors.ErrorKind;
import org.elasticsoftware.folio.errors.SequenceConflictException;
import org.elasticsoftware.folio.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives a command through read, sequence check, business logic, append and publish.
 * <p>
 * A command is accepted only when its expected sequence equals the stream's next sequence at read time,
 * and the store repeats that check atomically on append, so two concurrent writers with the same token
 * cannot both succeed. Events are stamped with the coordinator's clock, never the handler's.
 * </p>
 */
public class AggregateCoordinator implements CommandExecutor {
    private static final Logger logger = LoggerFactory.getLogger(AggregateCoordinator.class);
    private final Map<String, AggregateRuntime> runtimes;
    private final EventStore eventStore;
    private final EventPublisher eventPublisher;
    private final Clock clock;
    private final int snapshotInterval;

    public AggregateCoordinator(Collection<AggregateRuntime> runtimes,
                                EventStore eventStore,
                                EventPublisher eventPublisher,
                                Clock clock,
                                int snapshotInterval) {
        this.runtimes = runtimes.stream().collect(Collectors.toUnmodifiableMap(AggregateRuntime::getDomain, Function.identity()));
        this.eventStore = eventStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.snapshotInterval = snapshotInterval;
    }

    @Override
    public EventBook execute(CommandBook command) {
        return handle(command);
    }

    public EventBook handle(CommandBook commandBook) {
        long expectedSequence = validate(commandBook).expectedSequence();
        Cover cover = commandBook.cover();
        EventBook priorEvents = eventStore.read(cover);
        long actualSequence = priorEvents.nextSequence();
        if (expectedSequence != actualSequence) {
            logger.warn("Rejecting {} on {}: expected sequence {} but stream is at {}",
                    commandBook.firstPage().typeName(), cover.streamKey(), expectedSequence, actualSequence);
            throw new SequenceConflictException(cover.domain(), cover.root().toString(), expectedSequence, actualSequence);
        }
        List<EventPage> newPages = evaluate(commandBook, priorEvents);
        if (newPages.isEmpty()) {
            logger.debug("{} on {} produced no events", commandBook.firstPage().typeName(), cover.streamKey());
            return priorEvents;
        }
        eventStore.append(cover, expectedSequence, newPages);
        List<EventPage> allPages = new ArrayList<>(priorEvents.pages());
        allPages.addAll(newPages);
        EventBook updated = new EventBook(cover, allPages, priorEvents.snapshot());
        snapshotIfDue(cover, updated, expectedSequence);
        publish(new EventBook(cover, newPages), syncModeOf(commandBook));
        return updated;
    }

    /**
     * Appends a book of already-built events, for instance a process manager's own state changes. The
     * book's first sequence is the expected sequence.
     */
    public EventBook persistEvents(EventBook events) {
        if (events.pages().isEmpty()) {
            return events;
        }
        eventStore.append(events.cover(), events.firstSequence(), events.pages());
        publish(events, SyncMode.NONE);
        return events;
    }

    /**
     * Runs every page of the command against the given history and returns the resulting pages, stamped
     * and numbered from {@code priorEvents.nextSequence()}. Performs no I/O, so it serves dry runs too.
     */
    public List<EventPage> evaluate(CommandBook commandBook, EventBook priorEvents) {
        validate(commandBook);
        AggregateRuntime runtime = runtimes.get(commandBook.domain());
        Instant now = clock.instant();
        EventBook working = priorEvents;
        List<EventPage> newPages = new ArrayList<>();
        for (CommandPage page : commandBook.pages()) {
            List<Payload> payloads;
            try {
                payloads = runtime.handle(working, page);
            } catch (CommandRejectedException e) {
                logger.info("{} on {} rejected: {}", page.typeName(), commandBook.cover().streamKey(), e.getReason());
                throw e.getDomain() != null ? e
                        : new CommandRejectedException(e.getKind(), commandBook.domain(),
                                commandBook.cover().root().toString(), e.getReason());
            }
            List<EventPage> produced = new ArrayList<>(payloads.size());
            long sequence = working.nextSequence();
            for (Payload payload : payloads) {
                produced.add(new EventPage(sequence++, payload, now));
            }
            newPages.addAll(produced);
            List<EventPage> workingPages = new ArrayList<>(working.pages());
            workingPages.addAll(produced);
            working = working.withPages(workingPages);
        }
        return newPages;
    }

    public Optional<AggregateRuntime> getRuntime(String domain) {
        return Optional.ofNullable(runtimes.get(domain));
    }

    public Clock getClock() {
        return clock;
    }

    private CommandPage validate(CommandBook commandBook) {
        if (!runtimes.containsKey(commandBook.domain())) {
            throw new CommandRejectedException(ErrorKind.INVALID_ARGUMENT, commandBook.domain(),
                    commandBook.cover().root().toString(), "Unknown domain " + commandBook.domain());
        }
        CommandPage first = commandBook.firstPage();
        if (first == null) {
            throw new CommandRejectedException(ErrorKind.INVALID_ARGUMENT, commandBook.domain(),
                    commandBook.cover().root().toString(), "CommandBook has no pages");
        }
        return first;
    }

    private SyncMode syncModeOf(CommandBook commandBook) {
        return commandBook.pages().stream().anyMatch(page -> page.syncMode() == SyncMode.SYNCHRONOUS)
                ? SyncMode.SYNCHRONOUS : SyncMode.NONE;
    }

    private void snapshotIfDue(Cover cover, EventBook updated, long previousNextSequence) {
        if (snapshotInterval <= 0) {
            return;
        }
        long nextSequence = updated.nextSequence();
        if (nextSequence / snapshotInterval == previousNextSequence / snapshotInterval) {
            return;
        }
        // the events are already committed at this point
        try {
            AggregateRuntime runtime = runtimes.get(cover.domain());
            runtime.snapshot(updated).ifPresent(state -> eventStore.writeSnapshot(cover, state, nextSequence - 1));
        } catch (RuntimeException e) {
            logger.warn("Snapshot of {} at sequence {} failed", cover.streamKey(), nextSequence - 1, e);
        }
    }

    private void publish(EventBook events, SyncMode syncMode) {
        if (syncMode == SyncMode.SYNCHRONOUS) {
            CompletionStage<Void> delivery = eventPublisher.publishOnCallerThread(events);
            try {
                delivery.toCompletableFuture().join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        } else {
            eventPublisher.publish(events).whenComplete((ignored, failure) -> {
                if (failure != null) {
                    logger.error("Asynchronous delivery of {} failed", events.cover().streamKey(), failure);
                }
            });
        }
    }
}
