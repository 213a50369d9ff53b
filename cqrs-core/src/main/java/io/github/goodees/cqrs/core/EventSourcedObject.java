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

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * State derived from events. The state <strong>only</strong> changes as result of applying an event in
 * {@link #updateState(Event)}; both aggregates and projections are folded from their events this way.
 *
 * <p>The object remembers position (timestamp, event id) of the last event of its own stream, i. e. event whose
 * aggregate root id equals the object's id. The position is part of the stored document, so that replay can be
 * resumed with events past it, see {@link Replay#resume(EventSourcedObject, java.util.Collection)}.</p>
 *
 * <p>Instances are stored as JSON documents, subclasses need a no-arg constructor and bean accessors for their
 * state.</p>
 */
public abstract class EventSourcedObject {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private UUID id;
    private UUID tenantId = Identifiers.NIL;
    private Instant lastEventTimestamp;
    private UUID lastEventId;

    protected EventSourcedObject() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public void setTenantId(UUID tenantId) {
        this.tenantId = tenantId == null ? Identifiers.NIL : tenantId;
    }

    public Instant getLastEventTimestamp() {
        return lastEventTimestamp;
    }

    public UUID getLastEventId() {
        return lastEventId;
    }

    @JsonProperty("lastEventTimestamp")
    void restoreLastEventTimestamp(Instant lastEventTimestamp) {
        this.lastEventTimestamp = lastEventTimestamp;
    }

    @JsonProperty("lastEventId")
    void restoreLastEventId(UUID lastEventId) {
        this.lastEventId = lastEventId;
    }

    /**
     * Apply an event. Object without id takes aggregate root id of the first event applied.
     * @param event event to apply
     */
    public final void apply(Event event) {
        Objects.requireNonNull(event, "event");
        if (id == null) {
            id = event.getAggregateRootId();
        }
        boolean ownStream = id.equals(event.getAggregateRootId());
        if (ownStream && hasApplied(event)) {
            logger.warn("{} {} applies event {} that precedes already applied event {}", getClass().getSimpleName(),
                id, event.getId(), lastEventId);
        }
        updateState(event);
        if (ownStream && !hasApplied(event)) {
            lastEventTimestamp = event.getTimestamp();
            lastEventId = event.getId();
        }
    }

    /**
     * Whether an event of own stream is at or before the last applied position.
     * @param event event to check
     * @return true when replay order places the event at or before last applied event
     */
    public final boolean hasApplied(Event event) {
        if (lastEventTimestamp == null) {
            return false;
        }
        int byTime = event.getTimestamp().compareTo(lastEventTimestamp);
        return byTime < 0 || (byTime == 0 && event.getId().compareTo(lastEventId) <= 0);
    }

    /**
     * Update the state as result of application of an event. This method must be robust - it may not throw an
     * exception or break state invariants under any input, otherwise the object cannot be rebuilt from its history.
     *
     * @param event event to apply
     */
    protected abstract void updateState(Event event);

    protected final Logger getLogger() {
        return logger;
    }
}
