package io.github.goodees.cqrs.core.projection;

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
import io.github.goodees.cqrs.core.Futures;
import io.github.goodees.cqrs.core.Replay;
import io.github.goodees.cqrs.core.store.EventLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Source of events of other aggregates that a projection depends on. Called once for a whole batch of projections.
 * @param <P> projection type
 */
@FunctionalInterface
public interface ExternalDataProvider<P extends Projection> {

    /**
     * Fetch external data of projections.
     * @param projections projections being initialized
     * @param pointInTime when present, only events at or before it are relevant
     * @return external data, at most one entry per projection is expected, events of the same projection are merged
     */
    CompletionStage<List<ExternalDataEvent>> fetchExternalData(List<P> projections, Optional<Instant> pointInTime);

    /**
     * Provider reading histories of referenced aggregates from an event log.
     * @param eventLog the log
     * @param foreignIds ids of aggregates referenced by a projection
     * @param <P> projection type
     * @return provider that reports failure per projection
     */
    static <P extends Projection> ExternalDataProvider<P> fromEventLog(EventLog eventLog,
            Function<? super P, ? extends Collection<UUID>> foreignIds) {
        return (projections, pointInTime) -> {
            List<CompletableFuture<ExternalDataEvent>> perProjection = new ArrayList<>();
            for (P projection : projections) {
                List<CompletionStage<List<Event>>> histories = new ArrayList<>();
                for (UUID foreignId : foreignIds.apply(projection)) {
                    if (foreignId != null) {
                        histories.add(eventLog.loadEventHistory(foreignId, pointInTime));
                    }
                }
                perProjection.add(Futures.allAsList(histories).handle((loaded, t) -> {
                    if (t != null) {
                        return ExternalDataEvent.failure(projection.getId(), Futures.unwrapCompletionException(t));
                    }
                    List<Event> events = new ArrayList<>();
                    loaded.forEach(events::addAll);
                    return ExternalDataEvent.of(projection.getId(), Replay.ordered(events));
                }));
            }
            return Futures.allAsList(perProjection);
        };
    }
}
