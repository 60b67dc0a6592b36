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

package org.elasticsoftware.folio.state;

import jakarta.annotation.Nullable;
import org.elasticsoftware.folio.aggregate.DomainEventType;
import org.elasticsoftware.folio.aggregate.UpcastingHandlerFunction;
import org.elasticsoftware.folio.book.EventBook;
import org.elasticsoftware.folio.book.EventPage;
import org.elasticsoftware.folio.book.Payload;
import org.elasticsoftware.folio.book.Snapshot;
import org.elasticsoftware.folio.events.DomainEvent;
import org.elasticsoftware.folio.events.EventSourcingHandlerFunction;
import org.elasticsoftware.folio.serialization.PayloadSerde;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Folds an {@link EventBook} into a typed state value.
 * <p>
 * Rebuilding is a pure function of the book: no I/O and no clock reads, so the same book always
 * yields the same state. Speculative execution and safe retries both depend on that. Events of a type
 * that has no handler registered leave the state untouched, which keeps readers built against an
 * older schema working.
 * </p>
 * <p>
 * Events stored under a retired type are upcast to their replacement first, possibly over several
 * steps, and then applied by the handler of the final type.
 * </p>
 */
public final class StateRebuilder<S> {
    private final Class<S> stateClass;
    private final String stateTypeName;
    private final Supplier<S> emptyState;
    private final Map<String, EventSourcingHandler<S>> eventSourcingHandlers;
    private final Map<String, Upcaster> upcasters;
    private final PayloadSerde serde;

    private StateRebuilder(Class<S> stateClass,
                           String stateTypeName,
                           Supplier<S> emptyState,
                           Map<String, EventSourcingHandler<S>> eventSourcingHandlers,
                           Map<String, Upcaster> upcasters,
                           PayloadSerde serde) {
        this.stateClass = stateClass;
        this.stateTypeName = stateTypeName;
        this.emptyState = emptyState;
        this.eventSourcingHandlers = Map.copyOf(eventSourcingHandlers);
        this.upcasters = Map.copyOf(upcasters);
        this.serde = serde;
    }

    public static <S> Builder<S> builder(Class<S> stateClass, Supplier<S> emptyState, PayloadSerde serde) {
        return new Builder<>(stateClass, emptyState, serde);
    }

    /**
     * The raw rebuild contract: start from the snapshot when there is one, else from the empty state,
     * then apply every page in ascending sequence order.
     */
    public static <S> S rebuild(EventBook eventBook,
                                BiFunction<S, EventPage, S> applyFn,
                                Supplier<S> emptyFn,
                                Function<Payload, S> snapshotLoaderFn) {
        Snapshot snapshot = eventBook.snapshot();
        S state = snapshot != null ? snapshotLoaderFn.apply(snapshot.state()) : emptyFn.get();
        for (EventPage page : eventBook.pages()) {
            state = applyFn.apply(state, page);
        }
        return state;
    }

    public S rebuild(EventBook eventBook) {
        return rebuild(eventBook, this::apply, emptyState, this::loadSnapshot);
    }

    public S apply(S state, EventPage page) {
        String typeName = page.typeName();
        Upcaster upcaster = upcasters.get(typeName);
        EventSourcingHandler<S> handler;
        DomainEvent event;
        if (upcaster == null) {
            handler = eventSourcingHandlers.get(typeName);
            if (handler == null) {
                return state;
            }
            event = serde.deserialize(page.payload(), handler.eventClass());
        } else {
            event = serde.deserialize(page.payload(), upcaster.inputClass());
            while (upcaster != null) {
                event = Objects.requireNonNull(upcaster.function().apply(event),
                        "UpcastingHandler for " + typeName + " returned null");
                typeName = upcaster.outputTypeName();
                upcaster = upcasters.get(typeName);
            }
            handler = eventSourcingHandlers.get(typeName);
        }
        return Objects.requireNonNull(handler.function().apply(state, event),
                "EventSourcingHandler for " + typeName + " returned null");
    }

    public Payload toSnapshot(S state) {
        return serde.serialize(stateTypeName, state);
    }

    public S loadSnapshot(Payload payload) {
        return serde.deserialize(payload, stateClass);
    }

    public S emptyState() {
        return emptyState.get();
    }

    public Class<S> getStateClass() {
        return stateClass;
    }

    /**
     * Every type name this rebuilder understands, upcast types included.
     */
    public Set<String> getEventTypeNames() {
        Set<String> typeNames = new HashSet<>(eventSourcingHandlers.keySet());
        typeNames.addAll(upcasters.keySet());
        return Set.copyOf(typeNames);
    }

    private record EventSourcingHandler<S>(Class<? extends DomainEvent> eventClass,
                                           BiFunction<S, DomainEvent, S> function) {
    }

    private record Upcaster(Class<? extends DomainEvent> inputClass,
                            String outputTypeName,
                            Function<DomainEvent, DomainEvent> function) {
    }

    public static final class Builder<S> {
        private final Class<S> stateClass;
        private final Supplier<S> emptyState;
        private final PayloadSerde serde;
        private final Map<String, EventSourcingHandler<S>> eventSourcingHandlers = new HashMap<>();
        private final Map<String, Upcaster> upcasters = new HashMap<>();
        @Nullable
        private String stateTypeName;

        private Builder(Class<S> stateClass, Supplier<S> emptyState, PayloadSerde serde) {
            this.stateClass = Objects.requireNonNull(stateClass, "stateClass");
            this.emptyState = Objects.requireNonNull(emptyState, "emptyState");
            this.serde = Objects.requireNonNull(serde, "serde");
        }

        public Builder<S> stateTypeName(String stateTypeName) {
            this.stateTypeName = stateTypeName;
            return this;
        }

        public <E extends DomainEvent> Builder<S> on(Class<E> eventClass, EventSourcingHandlerFunction<S, E> handler) {
            DomainEventType<E> eventType = DomainEventType.of(eventClass);
            if (eventSourcingHandlers.containsKey(eventType.typeName())) {
                throw new IllegalStateException("Duplicate EventSourcingHandler for " + eventType.typeName());
            }
            eventSourcingHandlers.put(eventType.typeName(), new EventSourcingHandler<S>(eventType.typeClass(),
                    (state, event) -> handler.apply(eventType.typeClass().cast(event), state)));
            return this;
        }

        /**
         * Registers a conversion from a retired event type to its replacement. The replacement must end,
         * possibly through further upcasters, in a type that has an event sourcing handler.
         */
        public <F extends DomainEvent, T extends DomainEvent> Builder<S> upcast(Class<F> fromClass,
                                                                              Class<T> toClass,
                                                                              UpcastingHandlerFunction<F, T> upcaster) {
            DomainEventType<F> fromType = DomainEventType.of(fromClass);
            DomainEventType<T> toType = DomainEventType.of(toClass);
            if (fromType.typeName().equals(toType.typeName())) {
                throw new IllegalArgumentException("Cannot upcast " + fromType.typeName() + " to itself");
            }
            if (upcasters.containsKey(fromType.typeName())) {
                throw new IllegalStateException("Duplicate UpcastingHandler for " + fromType.typeName());
            }
            upcasters.put(fromType.typeName(), new Upcaster(fromClass, toType.typeName(),
                    event -> upcaster.apply(fromClass.cast(event))));
            return this;
        }

        public StateRebuilder<S> build() {
            for (String typeName : upcasters.keySet()) {
                if (eventSourcingHandlers.containsKey(typeName)) {
                    throw new IllegalStateException(typeName + " has both an UpcastingHandler and an EventSourcingHandler");
                }
                Set<String> visited = new HashSet<>();
                String current = typeName;
                while (upcasters.containsKey(current)) {
                    if (!visited.add(current)) {
                        throw new IllegalStateException("Upcasting cycle through " + current);
                    }
                    current = upcasters.get(current).outputTypeName();
                }
                if (!eventSourcingHandlers.containsKey(current)) {
                    throw new IllegalStateException("Upcasting " + typeName + " ends in " + current
                            + ", which has no EventSourcingHandler");
                }
            }
            return new StateRebuilder<>(stateClass,
                    stateTypeName != null ? stateTypeName : stateClass.getSimpleName(),
                    emptyState,
                    eventSourcingHandlers,
                    upcasters,
                    serde);
        }
    }
}
