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

import io.github.goodees.cqrs.core.Aggregate;
import io.github.goodees.cqrs.core.EventSourcedObject;
import io.github.goodees.cqrs.core.Futures;
import io.github.goodees.cqrs.core.projection.Projection;
import io.github.goodees.cqrs.core.store.Serialization;
import io.github.goodees.cqrs.core.store.StateStore;
import io.github.goodees.cqrs.core.store.StoreException;
import io.github.goodees.cqrs.core.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * State store kept in memory, that also exercises serialization: documents are stored as JSON strings.
 */
public class InMemoryStateStore implements StateStore {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<Class<?>, ConcurrentMap<UUID, String>> containers = new ConcurrentHashMap<>();

    protected <T> Serialization<T> serialization(Class<T> type) {
        return Serialization.json(type);
    }

    private ConcurrentMap<UUID, String> container(Class<?> type) {
        return containers.computeIfAbsent(type, t -> new ConcurrentHashMap<>());
    }

    @Override
    public <T extends EventSourcedObject> CompletionStage<Optional<T>> load(Class<T> type, UUID id) {
        String document = container(type).get(id);
        if (document == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.completedFuture(Optional.of(serialization(type).deserialize(document)));
        } catch (RuntimeException e) {
            return Futures.failed(StoreException.readFailed(type, id, e));
        }
    }

    @Override
    public <A extends Aggregate> CompletionStage<List<UUID>> loadAggregateIds(Class<A> type, boolean includeDeleted) {
        return Futures.invoke(() -> {
            List<UUID> result = new ArrayList<>();
            for (A aggregate : readAll(type)) {
                if (includeDeleted || !aggregate.isDeleted()) {
                    result.add(aggregate.getId());
                }
            }
            return result;
        });
    }

    @Override
    public <T extends EventSourcedObject> CompletionStage<List<UpsertResult>> bulkUpsert(Class<T> type,
            List<? extends T> items) {
        ConcurrentMap<UUID, String> container = container(type);
        List<UpsertResult> results = new ArrayList<>(items.size());
        for (T item : items) {
            results.add(store(type, container, item));
        }
        return CompletableFuture.completedFuture(results);
    }

    /**
     * Store single document of a bulk upsert.
     * @param type container type
     * @param container documents of the container
     * @param item document to store
     * @param <T> container type
     * @return result of the store
     */
    protected <T extends EventSourcedObject> UpsertResult store(Class<T> type, Map<UUID, String> container, T item) {
        if (item == null || item.getId() == null) {
            return UpsertResult.failure(null, StoreException.missingId(type).getMessage());
        }
        try {
            container.put(item.getId(), serialization(type).serialize(item));
            return UpsertResult.success(item.getId());
        } catch (RuntimeException e) {
            logger.warn("Failed to store {} {}", type.getSimpleName(), item.getId(), e);
            return UpsertResult.failure(item.getId(), StoreException.storeFailed(type, item.getId(), e).getMessage());
        }
    }

    @Override
    public CompletionStage<Integer> deleteAll(Class<? extends EventSourcedObject> type) {
        ConcurrentMap<UUID, String> removed = containers.remove(type);
        return CompletableFuture.completedFuture(removed == null ? 0 : removed.size());
    }

    @Override
    public <P extends Projection> CompletionStage<List<P>> findUninitialized(Class<P> type) {
        return Futures.invoke(() -> {
            List<P> result = new ArrayList<>();
            for (P projection : readAll(type)) {
                if (!projection.isInitialized()) {
                    result.add(projection);
                }
            }
            return result;
        });
    }

    public int count(Class<?> type) {
        return container(type).size();
    }

    public Optional<String> getDocument(Class<?> type, UUID id) {
        return Optional.ofNullable(container(type).get(id));
    }

    private <T> List<T> readAll(Class<T> type) {
        Serialization<T> serialization = serialization(type);
        List<T> result = new ArrayList<>();
        for (String document : container(type).values()) {
            result.add(serialization.deserialize(document));
        }
        return result;
    }
}
