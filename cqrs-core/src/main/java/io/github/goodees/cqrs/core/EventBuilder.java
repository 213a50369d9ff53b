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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.cqrs.core.validation.PayloadValidator;
import io.github.goodees.cqrs.core.validation.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Fluent construction of a single {@link Event}. Unlike {@link EventFactory} it allows to supply pre-existing
 * event id and timestamp, and exposes payload validation as a named toggle.
 *
 * <p>When no aggregate root id is given, it is taken from property {@code id} of the payload.</p>
 */
public final class EventBuilder {
    private final PayloadValidator validator;
    private final Clock clock;
    private final Command command;
    private UUID eventId;
    private UUID aggregateRootId;
    private ObjectNode payload;
    private UUID userId = Identifiers.NIL;
    private UUID partitionKey = Identifiers.NIL;
    private Instant timestamp;
    private boolean validate = true;

    EventBuilder(PayloadValidator validator, Clock clock, Command command) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.command = Objects.requireNonNull(command, "command");
    }

    public EventBuilder eventId(UUID eventId) {
        this.eventId = eventId;
        return this;
    }

    public EventBuilder aggregateRootId(UUID aggregateRootId) {
        this.aggregateRootId = aggregateRootId;
        return this;
    }

    /**
     * Aggregate root id as text.
     * @param aggregateRootId the id
     * @return this builder
     * @throws IllegalArgumentException when value is not a UUID
     */
    public EventBuilder aggregateRootId(String aggregateRootId) {
        this.aggregateRootId = Identifiers.parse(aggregateRootId, "Aggregate Root ID");
        return this;
    }

    /**
     * Payload, either a JSON object node or any object Jackson converts to JSON object.
     * @param payload the payload, may be null
     * @return this builder
     * @throws IllegalArgumentException when payload does not convert to JSON object
     */
    public EventBuilder payload(Object payload) {
        this.payload = toPayload(payload);
        return this;
    }

    public EventBuilder userId(UUID userId) {
        this.userId = userId == null ? Identifiers.NIL : userId;
        return this;
    }

    public EventBuilder userId(String userId) {
        this.userId = Identifiers.parse(userId, "User ID");
        return this;
    }

    public EventBuilder partitionKey(UUID partitionKey) {
        this.partitionKey = partitionKey == null ? Identifiers.NIL : partitionKey;
        return this;
    }

    public EventBuilder partitionKey(String partitionKey) {
        this.partitionKey = Identifiers.parse(partitionKey, "Partition Key");
        return this;
    }

    public EventBuilder timestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public EventBuilder validate(boolean validate) {
        this.validate = validate;
        return this;
    }

    /**
     * Build event without aggregate specific rules. Only command level checks apply when validating.
     * @return new event
     */
    public Event build() {
        return build(Object.class);
    }

    /**
     * Build event for an aggregate type.
     * @param aggregateType type whose payload rules apply when validating
     * @return new event
     * @throws IllegalArgumentException when aggregate root id is neither given nor present in payload
     * @throws ValidationException when validating and payload violates the rules
     */
    public Event build(Class<?> aggregateType) {
        UUID rootId = aggregateRootId != null ? aggregateRootId : idFromPayload(payload);
        if (validate) {
            validator.validate(aggregateType, command, payload);
        }
        return new Event(eventId != null ? eventId : UUID.randomUUID(), rootId, command, payload,
                timestamp != null ? timestamp : clock.instant(), userId, partitionKey);
    }

    static UUID idFromPayload(ObjectNode payload) {
        Objects.requireNonNull(payload, "Payload cannot be null if you do not specify an aggregate root ID");
        return Identifiers.fromNode(payload.get("id")).orElseThrow(() -> new IllegalArgumentException(
            "Aggregate Root ID does not exist or is not parsable to a UUID"));
    }

    static ObjectNode toPayload(Object payload) {
        if (payload == null) {
            return null;
        }
        JsonNode node = payload instanceof JsonNode ? (JsonNode) payload : JsonMapping.mapper().valueToTree(payload);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Payload must be a JSON object, got " + node.getNodeType());
        }
        return (ObjectNode) node;
    }
}
