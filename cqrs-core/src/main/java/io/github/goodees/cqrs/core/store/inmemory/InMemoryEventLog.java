package io.github.goodees.cqrs.core.store.inmemory;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Replay;
import io.github.goodees.cqrs.core.store.EventLog;
import io.github.goodees.cqrs.core.store.StoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.stream.Collectors.toList;

/**
 * Event log kept in memory. Events are kept per aggregate in the order they were appended and returned in replay
 * order.
 */
public class InMemoryEventLog implements EventLog {
    private final ConcurrentMap<UUID, List<Event>> storage = new ConcurrentHashMap<>();
    private final Set<UUID> eventIds = ConcurrentHashMap.newKeySet();

    /**
     * Append event to the log.
     * @param event event to append
     * @throws StoreException when event with the same id is already stored
     */
    public void append(Event event) throws StoreException {
        if (!eventIds.add(event.getId())) {
            throw StoreException.duplicateEvent(event.getId());
        }
        aggregateLog(event.getAggregateRootId()).add(event);
    }

    public void append(Iterable<? extends Event> events) throws StoreException {
        for (Event event : events) {
            append(event);
        }
    }

    public void append(Event... events) throws StoreException {
        for (Event event : events) {
            append(event);
        }
    }

    private List<Event> aggregateLog(UUID aggregateRootId) {
        return storage.computeIfAbsent(aggregateRootId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public CompletionStage<List<Event>> loadEventHistory(UUID aggregateRootId, Optional<Instant> until) {
        List<Event> events = storage.get(aggregateRootId);
        if (events == null) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        List<Event> filtered;
        // synchronizedList must be manually synchronized when iterating
        synchronized (events) {
            filtered = events.stream()
                    .filter(e -> !until.isPresent() || !e.getTimestamp().isAfter(until.get()))
                    .collect(toList());
        }
        return CompletableFuture.completedFuture(Replay.ordered(filtered));
    }

    @Override
    public CompletionStage<Set<UUID>> aggregateRootIds() {
        return CompletableFuture.completedFuture(Collections.unmodifiableSet(new LinkedHashSet<>(storage.keySet())));
    }
}
