package io.github.goodees.cqrs.core.store;

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
import io.github.goodees.cqrs.core.projection.Projection;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * Current state documents of aggregates and projections, one container per type.
 *
 * <p>Operations report failures through the returned stage, usually as {@link StoreException}.</p>
 */
public interface StateStore {

    <T extends EventSourcedObject> CompletionStage<Optional<T>> load(Class<T> type, UUID id);

    default <A extends Aggregate> CompletionStage<Optional<A>> loadAggregate(Class<A> type, UUID id) {
        return load(type, id);
    }

    /**
     * Ids of stored aggregates.
     * @param type aggregate type
     * @param includeDeleted whether aggregates flagged as deleted are included
     * @return aggregate ids
     */
    <A extends Aggregate> CompletionStage<List<UUID>> loadAggregateIds(Class<A> type, boolean includeDeleted);

    /**
     * Insert or replace documents. Failure of a single document does not prevent storing the others.
     * @param type container type
     * @param items documents to store
     * @return one result per item, in order of items
     */
    <T extends EventSourcedObject> CompletionStage<List<UpsertResult>> bulkUpsert(Class<T> type,
            List<? extends T> items);

    default <T extends EventSourcedObject> CompletionStage<UpsertResult> upsert(Class<T> type, T item) {
        return bulkUpsert(type, Collections.singletonList(item)).thenApply(results -> results.get(0));
    }

    /**
     * Remove all documents of a container.
     * @param type container type
     * @return number of removed documents
     */
    CompletionStage<Integer> deleteAll(Class<? extends EventSourcedObject> type);

    <P extends Projection> CompletionStage<List<P>> findUninitialized(Class<P> type);
}
