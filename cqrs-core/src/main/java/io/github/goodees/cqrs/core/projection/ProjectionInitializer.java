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

import io.github.goodees.cqrs.core.Aggregate;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Futures;
import io.github.goodees.cqrs.core.Replay;
import io.github.goodees.cqrs.core.store.EventLog;
import io.github.goodees.cqrs.core.store.StateStore;
import io.github.goodees.cqrs.core.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * Brings projections to the initialized state by applying their external data.
 *
 * <p>External data of a batch are requested from every provider of the projection type once, providers are called
 * concurrently. Events from all providers are merged per projection and applied in replay order, so the result does
 * not depend on the order in which providers respond. Failure to get or apply external data of one projection
 * leaves that projection uninitialized and is reported in {@link InitResult#getFailures()}; the other projections
 * of the batch are initialized.</p>
 *
 * <p>Cancelling a returned future stops the process before further events are applied or stored. Projections that
 * were not completed at that point stay {@link Projection.State#REHYDRATING}. All operations may be invoked again
 * to pick up where they failed; projections that are already initialized are left as they are.</p>
 */
public class ProjectionInitializer {
    public static final int DEFAULT_LOOP_SIZE = 1000;

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final StateStore stateStore;
    private final EventLog eventLog;

    public ProjectionInitializer(StateStore stateStore, EventLog eventLog) {
        this.stateStore = Objects.requireNonNull(stateStore, "State store must be provided");
        this.eventLog = Objects.requireNonNull(eventLog, "Event log must be provided");
    }

    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAsync(
            ProjectionType<P, A> type, UUID id) {
        return initAsync(type, Collections.singletonList(id));
    }

    /**
     * Initialize projections of aggregates. Projections are seeded from current state of the aggregates and
     * returned without being stored.
     * @param type projection type
     * @param ids aggregate ids
     * @param <P> projection type
     * @param <A> aggregate type
     * @return result with initialized projections; missing aggregates are reported as failures
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAsync(
            ProjectionType<P, A> type, Collection<UUID> ids) {
        CompletableFuture<InitResult<P>> result = new CompletableFuture<>();
        List<CompletableFuture<Seeded<P>>> loads = new ArrayList<>();
        for (UUID id : new LinkedHashSet<>(ids)) {
            loads.add(stateStore.loadAggregate(type.getAggregateClass(), id)
                    .handle((aggregate, t) -> {
                        if (t != null) {
                            return Seeded.<P>failed(id, Futures.unwrapCompletionException(t));
                        }
                        if (!aggregate.isPresent()) {
                            return Seeded.<P>failed(id, StoreException.notFound(type.getAggregateClass(), id));
                        }
                        return seed(type, aggregate.get());
                    }).toCompletableFuture());
        }
        CompletableFuture<InitResult<P>> pipeline = Futures.allAsList(loads)
                .thenCompose(seeded -> convergeSeeded(type, seeded, Optional.empty(), result));
        return track(pipeline, result);
    }

    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAsync(
            ProjectionType<P, A> type, List<P> projections) {
        return initAsync(type, projections, Optional.empty());
    }

    /**
     * Initialize given projections without storing them.
     * @param type projection type
     * @param projections projections to initialize
     * @param pointInTime when present, only external data at or before it are applied
     * @param <P> projection type
     * @param <A> aggregate type
     * @return result with the projections
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAsync(
            ProjectionType<P, A> type, List<P> projections, Optional<Instant> pointInTime) {
        CompletableFuture<InitResult<P>> result = new CompletableFuture<>();
        return track(converge(type, projections, pointInTime, result), result);
    }

    /**
     * Initialize projections and store all of them with single bulk upsert. Projections that failed to initialize
     * are stored as uninitialized, so that {@link #initAllUninitialized(ProjectionType)} finds them later.
     * @param type projection type
     * @param projections projections to initialize
     * @param <P> projection type
     * @param <A> aggregate type
     * @return result with the projections and upsert results
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAndPersistAsync(
            ProjectionType<P, A> type, List<P> projections) {
        CompletableFuture<InitResult<P>> result = new CompletableFuture<>();
        return track(converge(type, projections, Optional.empty(), result)
                .thenCompose(converged -> persist(type, converged, result)), result);
    }

    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initContainerAsync(
            ProjectionType<P, A> type) {
        return initContainerAsync(type, DEFAULT_LOOP_SIZE);
    }

    /**
     * Rebuild whole projection container. All projection documents are deleted, then projections of all
     * aggregates that are not deleted are replayed from the aggregates' event histories, initialized and stored,
     * batch by batch. Failure of a batch is reported and does not stop processing of the following batches.
     * The operation is not resumable, invoking it again starts from scratch.
     * @param type projection type
     * @param loopSize number of projections per batch
     * @param <P> projection type
     * @param <A> aggregate type
     * @return combined result of all batches
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initContainerAsync(
            ProjectionType<P, A> type, int loopSize) {
        if (loopSize < 1) {
            throw new IllegalArgumentException("Loop size must be positive, got " + loopSize);
        }
        CompletableFuture<InitResult<P>> result = new CompletableFuture<>();
        logger.info("Initializing container of {}", type);
        CompletableFuture<InitResult<P>> pipeline = stateStore.deleteAll(type.getProjectionClass())
                .thenCompose(deleted -> {
                    logger.debug("Deleted {} documents of {}", deleted, type.getProjectionClass().getSimpleName());
                    return stateStore.loadAggregateIds(type.getAggregateClass(), false);
                })
                .thenCompose(ids -> {
                    CompletableFuture<InitResult<P>> chain = CompletableFuture.completedFuture(InitResult.empty());
                    for (int from = 0; from < ids.size(); from += loopSize) {
                        List<UUID> batch = new ArrayList<>(ids.subList(from, Math.min(from + loopSize, ids.size())));
                        chain = chain.thenCompose(acc -> {
                            if (result.isCancelled()) {
                                return CompletableFuture.completedFuture(acc);
                            }
                            return initBatch(type, batch, result).handle((batchResult, t) -> {
                                if (t != null) {
                                    Throwable cause = Futures.unwrapCompletionException(t);
                                    logger.warn("Batch of {} {} failed", batch.size(),
                                        type.getProjectionClass().getSimpleName(), cause);
                                    return acc.merge(InitResult.failed(batch, cause));
                                }
                                return acc.merge(batchResult);
                            });
                        });
                    }
                    return chain;
                })
                .thenApply(total -> {
                    logger.info("Initialized container of {}: {}", type, total);
                    return total;
                })
                .toCompletableFuture();
        return track(pipeline, result);
    }

    private <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initBatch(
            ProjectionType<P, A> type, List<UUID> ids, Future<?> cancellation) {
        List<CompletableFuture<Seeded<P>>> replays = new ArrayList<>();
        for (UUID id : ids) {
            replays.add(eventLog.loadEventHistory(id).handle((events, t) -> {
                if (t != null) {
                    return Seeded.<P>failed(id, Futures.unwrapCompletionException(t));
                }
                return replay(type, id, events);
            }).toCompletableFuture());
        }
        return Futures.allAsList(replays)
                .thenCompose(seeded -> convergeSeeded(type, seeded, Optional.empty(), cancellation))
                .thenCompose(converged -> persist(type, converged, cancellation));
    }

    /**
     * Initialize all stored projections that are not initialized yet, storing them with single bulk upsert.
     * @param type projection type
     * @param <P> projection type
     * @param <A> aggregate type
     * @return result with the projections and upsert results
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> initAllUninitialized(
            ProjectionType<P, A> type) {
        CompletableFuture<InitResult<P>> result = new CompletableFuture<>();
        CompletableFuture<InitResult<P>> pipeline = stateStore.findUninitialized(type.getProjectionClass())
                .thenCompose(found -> {
                    logger.debug("Found {} uninitialized {}", found.size(),
                        type.getProjectionClass().getSimpleName());
                    return converge(type, found, Optional.empty(), result);
                })
                .thenCompose(converged -> persist(type, converged, result))
                .toCompletableFuture();
        return track(pipeline, result);
    }

    public <P extends Projection, A extends Aggregate> CompletableFuture<P> rehydrateAsync(ProjectionType<P, A> type,
            UUID id) {
        return rehydrateAsync(type, id, Optional.empty());
    }

    /**
     * Build projection of an aggregate from its event history and initialize it, without storing.
     * @param type projection type
     * @param id aggregate id
     * @param pointInTime when present, both history and external data are limited to events at or before it
     * @param <P> projection type
     * @param <A> aggregate type
     * @return initialized projection; fails with the cause when it could not be initialized
     */
    public <P extends Projection, A extends Aggregate> CompletableFuture<P> rehydrateAsync(ProjectionType<P, A> type,
            UUID id, Optional<Instant> pointInTime) {
        CompletableFuture<P> result = new CompletableFuture<>();
        CompletableFuture<P> pipeline = eventLog.loadEventHistory(id, pointInTime)
                .thenCompose(events -> {
                    Seeded<P> seeded = replay(type, id, events);
                    return convergeSeeded(type, Collections.singletonList(seeded), pointInTime, result);
                })
                .thenCompose(converged -> {
                    Throwable failure = converged.getFailures().get(id);
                    if (failure != null) {
                        return Futures.<P>failed(failure);
                    }
                    return CompletableFuture.completedFuture(converged.getProjections().get(0));
                })
                .toCompletableFuture();
        return track(pipeline, result);
    }

    private <P extends Projection, A extends Aggregate> Seeded<P> seed(ProjectionType<P, A> type, A aggregate) {
        try {
            return Seeded.of(type.fromAggregate(aggregate));
        } catch (RuntimeException e) {
            logger.warn("Cannot create {} from {}", type, aggregate.getId(), e);
            return Seeded.failed(aggregate.getId(), e);
        }
    }

    private <P extends Projection, A extends Aggregate> Seeded<P> replay(ProjectionType<P, A> type, UUID id,
            List<Event> events) {
        try {
            P projection = type.newInstance();
            projection.setId(id);
            return Seeded.of(Replay.replay(projection, events));
        } catch (RuntimeException e) {
            logger.warn("Cannot replay {} {}", type, id, e);
            return Seeded.failed(id, e);
        }
    }

    private <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> convergeSeeded(
            ProjectionType<P, A> type, List<Seeded<P>> seeded, Optional<Instant> pointInTime, Future<?> cancellation) {
        List<P> projections = new ArrayList<>();
        Map<UUID, Throwable> failures = new LinkedHashMap<>();
        for (Seeded<P> s : seeded) {
            if (s.projection != null) {
                projections.add(s.projection);
            } else {
                failures.put(s.id, s.failure);
            }
        }
        return converge(type, projections, pointInTime, cancellation)
                .thenApply(converged -> converged.withFailures(failures));
    }

    private <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> converge(
            ProjectionType<P, A> type, List<P> projections, Optional<Instant> pointInTime, Future<?> cancellation) {
        List<P> pending = new ArrayList<>();
        for (P projection : projections) {
            if (projection.beginRehydration()) {
                pending.add(projection);
            }
        }
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(
                new InitResult<>(projections, Collections.emptyMap(), Collections.emptyList()));
        }
        List<P> requested = Collections.unmodifiableList(pending);
        List<CompletableFuture<Fetched>> fetches = new ArrayList<>();
        for (ExternalDataProvider<P> provider : type.getProviders()) {
            fetches.add(fetch(provider, requested, pointInTime));
        }
        return Futures.allAsList(fetches).thenApply(fetched -> {
            Map<UUID, Throwable> failures = new LinkedHashMap<>();
            Map<UUID, Set<Event>> eventsById = new LinkedHashMap<>();
            for (Fetched f : fetched) {
                if (f.failure != null) {
                    logger.warn("External data of {} {} failed", pending.size(), type, f.failure);
                    pending.forEach(p -> failures.putIfAbsent(p.getId(), f.failure));
                    continue;
                }
                for (ExternalDataEvent data : f.data) {
                    if (data.getFailure().isPresent()) {
                        failures.putIfAbsent(data.getAggregateRootId(), data.getFailure().get());
                    } else {
                        eventsById.computeIfAbsent(data.getAggregateRootId(), k -> new LinkedHashSet<>())
                                .addAll(data.getEvents());
                    }
                }
            }
            for (P projection : pending) {
                if (cancellation.isCancelled()) {
                    logger.debug("Initialization of {} cancelled", type);
                    break;
                }
                Throwable failure = failures.get(projection.getId());
                if (failure != null) {
                    logger.warn("{} {} stays uninitialized", type.getProjectionClass().getSimpleName(),
                        projection.getId(), failure);
                    continue;
                }
                Set<Event> events = eventsById.getOrDefault(projection.getId(), Collections.emptySet());
                try {
                    for (Event event : Replay.ordered(events)) {
                        projection.apply(event);
                    }
                    projection.completeRehydration();
                } catch (RuntimeException e) {
                    logger.warn("Applying external data to {} {} failed",
                        type.getProjectionClass().getSimpleName(), projection.getId(), e);
                    failures.put(projection.getId(), e);
                }
            }
            return new InitResult<>(projections, failures, Collections.emptyList());
        });
    }

    private <P extends Projection> CompletableFuture<Fetched> fetch(ExternalDataProvider<P> provider,
            List<P> projections, Optional<Instant> pointInTime) {
        CompletionStage<List<ExternalDataEvent>> call;
        try {
            call = provider.fetchExternalData(projections, pointInTime);
        } catch (RuntimeException e) {
            call = Futures.failed(e);
        }
        return call.handle((data, t) -> t == null ? new Fetched(data, null)
                : new Fetched(null, Futures.unwrapCompletionException(t))).toCompletableFuture();
    }

    private <P extends Projection, A extends Aggregate> CompletableFuture<InitResult<P>> persist(
            ProjectionType<P, A> type, InitResult<P> converged, Future<?> cancellation) {
        if (cancellation.isCancelled() || converged.getProjections().isEmpty()) {
            return CompletableFuture.completedFuture(converged);
        }
        return stateStore.bulkUpsert(type.getProjectionClass(), converged.getProjections())
                .thenApply(converged::withUpserts)
                .toCompletableFuture();
    }

    /**
     * Complete result with the pipeline's outcome, and stop waiting for the pipeline when result is cancelled.
     */
    private static <T> CompletableFuture<T> track(CompletableFuture<T> pipeline, CompletableFuture<T> result) {
        pipeline.whenComplete((r, t) -> {
            if (t == null) {
                result.complete(r);
            } else {
                result.completeExceptionally(Futures.unwrapCompletionException(t));
            }
        });
        result.whenComplete((r, t) -> {
            if (result.isCancelled()) {
                pipeline.cancel(false);
            }
        });
        return result;
    }

    private static final class Seeded<P> {
        private final UUID id;
        private final P projection;
        private final Throwable failure;

        private Seeded(UUID id, P projection, Throwable failure) {
            this.id = id;
            this.projection = projection;
            this.failure = failure;
        }

        static <P extends Projection> Seeded<P> of(P projection) {
            return new Seeded<>(projection.getId(), projection, null);
        }

        static <P> Seeded<P> failed(UUID id, Throwable failure) {
            return new Seeded<>(id, null, failure);
        }
    }

    private static final class Fetched {
        private final List<ExternalDataEvent> data;
        private final Throwable failure;

        Fetched(List<ExternalDataEvent> data, Throwable failure) {
            this.data = data;
            this.failure = failure;
        }
    }
}
