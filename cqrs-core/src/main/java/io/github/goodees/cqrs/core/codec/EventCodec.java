package io.github.goodees.cqrs.core.codec;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.CommandRegistry;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Identifiers;
import io.github.goodees.cqrs.core.JsonMapping;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON envelope of events exchanged over transport:
 * <pre>{@code
 * {"id": "...", "aggregateRootId": "...", "command": {"name": "...", "isNew": false, "allowNullPayload": false},
 *  "payload": {...}, "timestamp": "2024-01-01T00:00:00Z", "userId": "...", "partitionKey": "..."}
 * }</pre>
 * Commands are resolved by name in a {@link CommandRegistry}, command given as plain string is accepted as well.
 */
public class EventCodec {
    private final CommandRegistry commands;
    private final ObjectMapper mapper;

    public EventCodec(CommandRegistry commands) {
        this(commands, JsonMapping.mapper());
    }

    public EventCodec(CommandRegistry commands, ObjectMapper mapper) {
        this.commands = Objects.requireNonNull(commands, "Command registry must be provided");
        this.mapper = Objects.requireNonNull(mapper, "Object mapper must be provided");
    }

    public String encode(Event event) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("id", event.getId().toString());
        envelope.put("aggregateRootId", event.getAggregateRootId().toString());
        ObjectNode command = envelope.putObject("command");
        command.put("name", event.getCommand().getName());
        command.put("isNew", event.getCommand().isNew());
        command.put("allowNullPayload", event.getCommand().allowsNullPayload());
        envelope.set("payload", event.getPayload().map(JsonNode.class::cast).orElse(mapper.nullNode()));
        envelope.put("timestamp", event.getTimestamp().toString());
        envelope.put("userId", event.getUserId().toString());
        envelope.put("partitionKey", event.getPartitionKey().toString());
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode event " + event.getId(), e);
        }
    }

    /**
     * Decode envelope.
     * @param value JSON text
     * @return decoded event
     * @throws EmptyEventValueException when value is null or blank
     * @throws EventDecodeException when value is not a valid envelope
     */
    public Event decode(String value) throws EventDecodeException, EmptyEventValueException {
        if (value == null || value.isBlank()) {
            throw new EmptyEventValueException("Event value is empty");
        }
        JsonNode node;
        try {
            node = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw EventDecodeException.malformed("not JSON", e);
        }
        return decode(node);
    }

    public Event decode(JsonNode envelope) throws EventDecodeException {
        if (envelope == null || !envelope.isObject()) {
            throw EventDecodeException.malformed("not a JSON object", null);
        }
        UUID id = requiredId(envelope, "id");
        UUID aggregateRootId = requiredId(envelope, "aggregateRootId");
        Command command = command(envelope.get("command"));
        JsonNode payload = envelope.get("payload");
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw EventDecodeException.invalidValue("payload", payload.toString(), null);
        }
        Instant timestamp = timestamp(envelope.get("timestamp"));
        UUID userId = optionalId(envelope, "userId");
        UUID partitionKey = optionalId(envelope, "partitionKey");
        return new Event(id, aggregateRootId, command, payload == null || payload.isNull() ? null : (ObjectNode) payload,
                timestamp, userId, partitionKey);
    }

    private Command command(JsonNode node) throws EventDecodeException {
        JsonNode name = node != null && node.isObject() ? node.get("name") : node;
        if (name == null || name.isNull()) {
            throw EventDecodeException.missingField("command");
        }
        if (!name.isTextual()) {
            throw EventDecodeException.invalidValue("command", name.toString(), null);
        }
        Optional<Command> registered = commands.find(name.textValue());
        if (!registered.isPresent()) {
            throw EventDecodeException.unknownCommand(name.textValue());
        }
        return registered.get();
    }

    private static Instant timestamp(JsonNode node) throws EventDecodeException {
        if (node == null || node.isNull()) {
            throw EventDecodeException.missingField("timestamp");
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw EventDecodeException.invalidValue("timestamp", node.asText(), e);
        }
    }

    private static UUID requiredId(JsonNode envelope, String field) throws EventDecodeException {
        JsonNode node = envelope.get(field);
        if (node == null || node.isNull()) {
            throw EventDecodeException.missingField(field);
        }
        return parseId(node, field);
    }

    private static UUID optionalId(JsonNode envelope, String field) throws EventDecodeException {
        JsonNode node = envelope.get(field);
        if (node == null || node.isNull()) {
            return Identifiers.NIL;
        }
        return parseId(node, field);
    }

    private static UUID parseId(JsonNode node, String field) throws EventDecodeException {
        Optional<UUID> id = node.isTextual() ? Identifiers.tryParse(node.textValue()) : Optional.empty();
        if (!id.isPresent()) {
            throw EventDecodeException.invalidValue(field, node.toString(), null);
        }
        return id.get();
    }
}
