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

package org.elasticsoftware.folio.bus;

import org.elasticsoftware.folio.book.EventBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * In-process {@link EventPublisher} that fans each book out to every subscriber accepting its domain.
 * <p>
 * Each accepting subscriber gets one delivery per published book. A failing subscriber does not stop
 * delivery to the others; its exception is logged and completes the returned stage exceptionally, but
 * the book is not redelivered. Subscribers must still tolerate duplicates, since a command can be
 * retried after its events were published.
 * </p>
 * <p>
 * Asynchronous publication runs on the configured executor. Synchronous publication through
 * {@link #publishOnCallerThread(EventBook)} never uses it, so a subscriber running on a pool thread can
 * dispatch a synchronous command without waiting for a free pool thread.
 * </p>
 */
public class LocalEventBus implements EventPublisher, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(LocalEventBus.class);
    private final List<EventBookSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Executor executor;

    public LocalEventBus(Executor executor) {
        this.executor = executor;
    }

    /**
     * A bus that delivers on the publishing thread.
     */
    public static LocalEventBus direct() {
        return new LocalEventBus(Runnable::run);
    }

    public void subscribe(EventBookSubscriber subscriber) {
        logger.info("Subscribing {}", subscriber.getName());
        subscribers.add(subscriber);
    }

    public List<EventBookSubscriber> getSubscribers() {
        return List.copyOf(subscribers);
    }

    @Override
    public CompletionStage<Void> publish(EventBook events) {
        String domain = events.cover().domain();
        CompletableFuture<?>[] deliveries = subscribers.stream()
                .filter(subscriber -> subscriber.accepts(domain))
                .map(subscriber -> CompletableFuture.runAsync(() -> deliver(subscriber, events), executor))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(deliveries);
    }

    @Override
    public CompletionStage<Void> publishOnCallerThread(EventBook events) {
        String domain = events.cover().domain();
        RuntimeException failure = null;
        for (EventBookSubscriber subscriber : subscribers) {
            if (!subscriber.accepts(domain)) {
                continue;
            }
            try {
                deliver(subscriber, events);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        return failure == null ? CompletableFuture.completedFuture(null) : CompletableFuture.failedFuture(failure);
    }

    private void deliver(EventBookSubscriber subscriber, EventBook events) {
        try {
            subscriber.onEvents(events);
        } catch (RuntimeException e) {
            logger.error("Subscriber {} failed on {}", subscriber.getName(), events.cover().streamKey(), e);
            throw e;
        }
    }

    @Override
    public void close() {
        if (executor instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
    }
}
