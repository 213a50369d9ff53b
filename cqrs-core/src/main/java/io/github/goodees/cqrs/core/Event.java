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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record that a command was applied to an aggregate. Payload is a JSON document holding the changed
 * properties of the aggregate, or {@code null} for commands that allow it.
 *
 * <p>Events are created by {@link EventFactory} or {@link EventBuilder}, or decoded from transport. Two events are
 * equal when they have the same id.</p>
 */
public final class Event {
    private final UUID id;
    private final UUID aggregateRootId;
    private final Command command;
    private final ObjectNode payload;
    private final Instant timestamp;
    private final UUID userId;
    private final UUID partitionKey;

    /**
     * Create event with all its fields. Payload is copied.
     * @param id unique event id
     * @param aggregateRootId aggregate the event applies to
     * @param command command that produced the event
     * @param payload the payload, may be null
     * @param timestamp time of creation
     * @param userId user that issued the command, {@link Identifiers#NIL} when unknown
     * @param partitionKey partition key, {@link Identifiers#NIL} when unknown
     */
    public Event(UUID id, UUID aggregateRootId, Command command, ObjectNode payload, Instant timestamp, UUID userId,
            UUID partitionKey) {
        this.id = Objects.requireNonNull(id, "id");
        this.aggregateRootId = Objects.requireNonNull(aggregateRootId, "aggregateRootId");
        this.command = Objects.requireNonNull(command, "command");
        this.payload = payload == null ? null : payload.deepCopy();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.userId = userId == null ? Identifiers.NIL : userId;
        this.partitionKey = partitionKey == null ? Identifiers.NIL : partitionKey;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAggregateRootId() {
        return aggregateRootId;
    }

    public Command getCommand() {
        return command;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getPartitionKey() {
        return partitionKey;
    }

    public boolean hasPayload() {
        return payload != null;
    }

    /**
     * Copy of the payload.
     * @return the payload, or empty if event has none
     */
    public Optional<ObjectNode> getPayload() {
        return payload == null ? Optional.empty() : Optional.of(payload.deepCopy());
    }

    /**
     * Payload converted to a type.
     * @param type target type
     * @param <T> target type
     * @return converted payload, empty if event has none
     * @throws IllegalArgumentException when payload cannot be converted
     */
    public <T> Optional<T> getPayload(Class<T> type) {
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonMapping.mapper().treeToValue(payload, type));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload of event " + id + " is not convertible to " + type.getName(), e);
        }
    }

    public boolean payloadHasProperty(String property) {
        return payload != null && payload.has(property);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        return id.equals(((Event) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Event{" + "id=" + id + ", aggregateRootId=" + aggregateRootId + ", command=" + command
                + ", timestamp=" + timestamp + ", payload=" + payload + '}';
    }
}
