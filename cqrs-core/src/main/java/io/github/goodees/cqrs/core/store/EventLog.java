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

import io.github.goodees.cqrs.core.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * Reads the persisted event history.
 */
public interface EventLog {
    /**
     * Read events of an aggregate.
     * @param aggregateRootId the aggregate
     * @param until when present, only events with timestamp at or before it
     * @return events in replay order
     */
    CompletionStage<List<Event>> loadEventHistory(UUID aggregateRootId, Optional<Instant> until);

    default CompletionStage<List<Event>> loadEventHistory(UUID aggregateRootId) {
        return loadEventHistory(aggregateRootId, Optional.empty());
    }

    /**
     * Ids of all aggregates that have events in the log.
     * @return aggregate root ids
     */
    CompletionStage<Set<UUID>> aggregateRootIds();
}
