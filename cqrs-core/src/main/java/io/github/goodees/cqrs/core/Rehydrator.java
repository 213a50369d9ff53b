package io.github.goodees.cqrs.core;

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

import io.github.goodees.cqrs.core.store.EventLog;
import io.github.goodees.cqrs.core.store.StateStore;
import io.github.goodees.cqrs.core.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Rebuilds state from the event log.
 */
public class Rehydrator {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final EventLog eventLog;
    private final StateStore stateStore;

    public Rehydrator(EventLog eventLog, StateStore stateStore) {
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be provided");
        this.stateStore = Objects.requireNonNull(stateStore, "State store must be provided");
    }

    /**
     * Fold the full history of an aggregate.
     * @param factory creates empty instance
     * @param id aggregate root id
     * @param <T> type of state
     * @return the current state
     */
    public <T extends EventSourcedObject> CompletableFuture<T> rehydrateAsync(Supplier<T> factory, UUID id) {
        return rehydrateAsync(factory, id, Optional.empty());
    }

    /**
     * Fold history of an aggregate up to and including a point in time.
     * @param factory creates empty instance
     * @param id aggregate root id
     * @param until last point in time to include, empty for current state
     * @param <T> type of state
     * @return the state as of the point in time
     */
    public <T extends EventSourcedObject> CompletableFuture<T> rehydrateAsync(Supplier<T> factory, UUID id,
            Optional<Instant> until) {
        return eventLog.loadEventHistory(id, until).thenApply(events -> {
            T target = factory.get();
            target.setId(id);
            return Replay.replay(target, events);
        }).toCompletableFuture();
    }

    /**
     * Replace the container of an aggregate type with state rebuilt from every aggregate in the event log.
     * @param type aggregate type
     * @param factory creates empty instance
     * @param <A> aggregate type
     * @return results of storing the aggregates
     */
    public <A extends Aggregate> CompletableFuture<List<UpsertResult>> rebuildCurrentStateAsync(Class<A> type,
            Supplier<A> factory) {
        return rebuildCurrentStateAsync(type, factory, Collections.emptySet());
    }

    /**
     * Replace the container of an aggregate type with state rebuilt from the event log, limited to aggregates whose
     * history contains one of the commands.
     * @param type aggregate type
     * @param factory creates empty instance
     * @param commands commands of the aggregate type, empty to rebuild every aggregate in the log
     * @param <A> aggregate type
     * @return results of storing the aggregates
     */
    public <A extends Aggregate> CompletableFuture<List<UpsertResult>> rebuildCurrentStateAsync(Class<A> type,
            Supplier<A> factory, Set<Command> commands) {
        logger.info("Rebuilding current state of {}", type.getSimpleName());
        return stateStore.deleteAll(type)
                .thenCompose(deleted -> eventLog.aggregateRootIds())
                .thenCompose(ids -> {
                    List<CompletionStage<List<Event>>> histories = new ArrayList<>();
                    for (UUID id : ids) {
                        histories.add(eventLog.loadEventHistory(id));
                    }
                    return Futures.allAsList(histories);
                })
                .thenCompose(histories -> {
                    List<A> rebuilt = new ArrayList<>();
                    for (List<Event> history : histories) {
                        if (history.isEmpty() || !belongs(history, commands)) {
                            continue;
                        }
                        A aggregate = factory.get();
                        aggregate.setId(history.get(0).getAggregateRootId());
                        rebuilt.add(Replay.replay(aggregate, history));
                    }
                    logger.info("Storing {} rebuilt {}", rebuilt.size(), type.getSimpleName());
                    return stateStore.bulkUpsert(type, rebuilt);
                })
                .toCompletableFuture();
    }

    private static boolean belongs(List<Event> history, Set<Command> commands) {
        if (commands.isEmpty()) {
            return true;
        }
        for (Event event : history) {
            if (commands.contains(event.getCommand())) {
                return true;
            }
        }
        return false;
    }
}
