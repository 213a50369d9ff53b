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

import io.github.goodees.cqrs.core.validation.PayloadValidator;
import io.github.goodees.cqrs.core.validation.ValidationException;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates events, validating the payload against the rules of the target aggregate type unless validation is
 * switched off.
 *
 * <p>Events get fresh random id and current UTC timestamp. User id and partition key default to
 * {@link Identifiers#NIL}.</p>
 */
public class EventFactory {
    private final PayloadValidator validator;
    private final Clock clock;
    private volatile boolean validatePayload = true;

    public EventFactory(PayloadValidator validator) {
        this(validator, Clock.systemUTC());
    }

    public EventFactory(PayloadValidator validator, Clock clock) {
        this.validator = Objects.requireNonNull(validator, "Payload validator must be provided");
        this.clock = Objects.requireNonNull(clock, "Clock must be provided");
    }

    public boolean isValidatePayload() {
        return validatePayload;
    }

    public void setValidatePayload(boolean validatePayload) {
        this.validatePayload = validatePayload;
    }

    /**
     * Factory sharing this one's collaborators, that does not validate payloads.
     * @return non-validating factory
     */
    public EventFactory noValidate() {
        EventFactory result = new EventFactory(validator, clock);
        result.validatePayload = false;
        return result;
    }

    /**
     * Create event for an aggregate.
     * @param aggregateType type whose payload rules apply
     * @param command the command
     * @param aggregateRootId id of the aggregate
     * @param payload the payload
     * @return new event
     * @throws ValidationException when validating and payload violates the rules
     */
    public Event create(Class<?> aggregateType, Command command, UUID aggregateRootId, Object payload) {
        return create(aggregateType, command, aggregateRootId, payload, Identifiers.NIL, Identifiers.NIL);
    }

    public Event create(Class<?> aggregateType, Command command, UUID aggregateRootId, Object payload, UUID userId) {
        return create(aggregateType, command, aggregateRootId, payload, userId, Identifiers.NIL);
    }

    public Event create(Class<?> aggregateType, Command command, UUID aggregateRootId, Object payload, UUID userId,
            UUID partitionKey) {
        Objects.requireNonNull(aggregateRootId, "aggregateRootId");
        return builder(command).aggregateRootId(aggregateRootId).payload(payload).userId(userId)
                .partitionKey(partitionKey).build(aggregateType);
    }

    /**
     * Create event whose aggregate root id is property {@code id} of the payload.
     * @param aggregateType type whose payload rules apply
     * @param command the command
     * @param payload payload containing the id
     * @return new event
     * @throws NullPointerException when payload is null
     * @throws IllegalArgumentException when payload has no id parsable to UUID
     */
    public Event createFromPayload(Class<?> aggregateType, Command command, Object payload) {
        return createFromPayload(aggregateType, command, payload, Identifiers.NIL, Identifiers.NIL);
    }

    public Event createFromPayload(Class<?> aggregateType, Command command, Object payload, UUID userId) {
        return createFromPayload(aggregateType, command, payload, userId, Identifiers.NIL);
    }

    public Event createFromPayload(Class<?> aggregateType, Command command, Object payload, UUID userId,
            UUID partitionKey) {
        return builder(command).payload(payload).userId(userId).partitionKey(partitionKey).build(aggregateType);
    }

    /**
     * Create event from identifiers in text form.
     * @param aggregateType type whose payload rules apply
     * @param command the command
     * @param aggregateRootId id of the aggregate
     * @param payload the payload
     * @param userId user id
     * @param partitionKey partition key
     * @return new event
     * @throws IllegalArgumentException naming the identifier that is not parsable to UUID
     */
    public Event create(Class<?> aggregateType, Command command, String aggregateRootId, Object payload,
            String userId, String partitionKey) {
        return builder(command).aggregateRootId(aggregateRootId).payload(payload).userId(userId)
                .partitionKey(partitionKey).build(aggregateType);
    }

    /**
     * Create event without payload. Never validates.
     * @param command the command
     * @param aggregateRootId id of the aggregate
     * @return new event
     */
    public Event createNullPayloadEvent(Command command, UUID aggregateRootId) {
        return createNullPayloadEvent(command, aggregateRootId, Identifiers.NIL, Identifiers.NIL);
    }

    public Event createNullPayloadEvent(Command command, UUID aggregateRootId, UUID userId) {
        return createNullPayloadEvent(command, aggregateRootId, userId, Identifiers.NIL);
    }

    public Event createNullPayloadEvent(Command command, UUID aggregateRootId, UUID userId, UUID partitionKey) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(aggregateRootId, "aggregateRootId");
        return new EventBuilder(validator, clock, command).validate(false).aggregateRootId(aggregateRootId)
                .userId(userId).partitionKey(partitionKey).build();
    }

    /**
     * Builder of a single event, validating according to this factory's setting.
     * @param command the command
     * @return new builder
     */
    public EventBuilder builder(Command command) {
        Objects.requireNonNull(command, "command");
        return new EventBuilder(validator, clock, command).validate(validatePayload);
    }
}
