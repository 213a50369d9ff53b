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
import io.github.goodees.cqrs.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Events of other aggregates relevant to one projection, or failure to fetch them.
 * {@link #getAggregateRootId()} is the id of the projection the events are for.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class ExternalDataEvent {

    public abstract UUID getAggregateRootId();

    public abstract List<Event> getEvents();

    public abstract Optional<Throwable> getFailure();

    public static ExternalDataEvent of(UUID projectionId, Collection<Event> events) {
        return ImmutableExternalDataEvent.builder().aggregateRootId(projectionId).events(events).build();
    }

    /**
     * Report that external data of a projection could not be fetched. The projection will not be initialized.
     * @param projectionId id of the projection
     * @param cause the failure
     * @return failed external data
     */
    public static ExternalDataEvent failure(UUID projectionId, Throwable cause) {
        return ImmutableExternalDataEvent.builder().aggregateRootId(projectionId).failure(cause).build();
    }
}
