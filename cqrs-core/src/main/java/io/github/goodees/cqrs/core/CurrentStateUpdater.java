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

import io.github.goodees.cqrs.core.store.StateStore;
import io.github.goodees.cqrs.core.store.StoreException;
import io.github.goodees.cqrs.core.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Keeps a current state container up to date with incoming events: loads the stored state, applies the event and
 * stores the result.
 */
public class CurrentStateUpdater {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final StateStore stateStore;

    public CurrentStateUpdater(StateStore stateStore) {
        this.stateStore = Objects.requireNonNull(stateStore, "State store must be provided");
    }

    /**
     * Apply event to the stored state of its aggregate. Creating commands, and events of aggregates without stored
     * state, start from new instance.
     * @param type container type
     * @param factory creates empty instance
     * @param event event to apply
     * @param <T> container type
     * @return the updated state; fails with {@link StoreException} when it cannot be stored
     */
    public <T extends EventSourcedObject> CompletableFuture<T> applyAndPersistAsync(Class<T> type,
            Supplier<T> factory, Event event) {
        Objects.requireNonNull(event, "event");
        return stateStore.load(type, event.getAggregateRootId())
                .thenCompose(stored -> {
                    T state = event.getCommand().isNew() ? factory.get() : stored.orElseGet(factory);
                    if (!event.getCommand().isNew() && !stored.isPresent()) {
                        logger.debug("{} {} not stored yet, applying {} to new instance", type.getSimpleName(),
                            event.getAggregateRootId(), event.getCommand());
                    }
                    state.apply(event);
                    return stateStore.upsert(type, state).thenCompose(result -> completed(type, state, result));
                })
                .toCompletableFuture();
    }

    private static <T extends EventSourcedObject> CompletableFuture<T> completed(Class<T> type, T state,
            UpsertResult result) {
        if (result.isSuccessful()) {
            return CompletableFuture.completedFuture(state);
        }
        return Futures.failed(StoreException.storeFailed(type, state.getId(),
            new IllegalStateException(result.getError().orElse("unknown error"))));
    }
}
