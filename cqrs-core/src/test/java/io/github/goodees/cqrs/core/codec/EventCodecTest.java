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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.cqrs.core.CommandRegistry;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.Identifiers;
import io.github.goodees.cqrs.core.JsonMapping;
import io.github.goodees.cqrs.example.AccountCommands;
import org.junit.Test;

import java.time.Instant;
import java.util.UUID;

import static io.github.goodees.cqrs.example.AccountCommands.CREATE;
import static io.github.goodees.cqrs.example.AccountCommands.DELETE;
import static io.github.goodees.cqrs.example.ExampleEvents.payload;
import static org.junit.Assert.*;

public class EventCodecTest {
    private final EventCodec codec = new EventCodec(AccountCommands.register(new CommandRegistry()));
    private final UUID id = UUID.randomUUID();
    private final UUID accountId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final Instant timestamp = Instant.parse("2024-03-01T10:15:30Z");

    private ObjectNode envelope() {
        ObjectNode envelope = JsonMapping.mapper().createObjectNode();
        envelope.put("id", id.toString());
        envelope.put("aggregateRootId", accountId.toString());
        envelope.putObject("command").put("name", "Create_Account").put("isNew", true);
        envelope.set("payload", payload("name", "Pat"));
        envelope.put("timestamp", timestamp.toString());
        return envelope;
    }

    private EventDecodeException.Fault faultOf(String value) throws EmptyEventValueException {
        try {
            codec.decode(value);
        } catch (EventDecodeException e) {
            return e.getFault();
        }
        throw new AssertionError("Expected decoding of " + value + " to fail");
    }

    @Test
    public void encoded_event_is_decoded_to_equal_values() throws Exception {
        Event event = new Event(id, accountId, CREATE, payload("name", "Pat"), timestamp, userId, null);

        Event decoded = codec.decode(codec.encode(event));

        assertEquals(id, decoded.getId());
        assertEquals(accountId, decoded.getAggregateRootId());
        assertSame(CREATE, decoded.getCommand());
        assertEquals("Pat", decoded.getPayload().get().get("name").asText());
        assertEquals(timestamp, decoded.getTimestamp());
        assertEquals(userId, decoded.getUserId());
        assertEquals(Identifiers.NIL, decoded.getPartitionKey());
    }

    @Test
    public void envelope_carries_command_definition_and_null_payload() throws Exception {
        Event event = new Event(id, accountId, DELETE, null, timestamp, null, null);

        JsonNode encoded = JsonMapping.mapper().readTree(codec.encode(event));

        assertEquals("Delete_Account", encoded.path("command").path("name").asText());
        assertTrue(encoded.path("command").path("allowNullPayload").asBoolean());
        assertFalse(encoded.path("command").path("isNew").asBoolean());
        assertTrue(encoded.get("payload").isNull());
        assertEquals("2024-03-01T10:15:30Z", encoded.get("timestamp").asText());
        assertFalse(codec.decode(encoded).hasPayload());
    }

    @Test
    public void command_may_be_given_by_name_only() throws Exception {
        ObjectNode envelope = envelope();
        envelope.put("command", "Create_Account");
        assertSame(CREATE, codec.decode(envelope).getCommand());
    }

    @Test
    public void optional_identifiers_default_to_nil() throws Exception {
        Event decoded = codec.decode(envelope().toString());
        assertEquals(Identifiers.NIL, decoded.getUserId());
        assertEquals(Identifiers.NIL, decoded.getPartitionKey());
    }

    @Test(expected = EmptyEventValueException.class)
    public void null_value_is_empty() throws Exception {
        codec.decode((String) null);
    }

    @Test(expected = EmptyEventValueException.class)
    public void blank_value_is_empty() throws Exception {
        codec.decode("  ");
    }

    @Test
    public void text_that_is_not_an_envelope_is_malformed() throws Exception {
        assertEquals(EventDecodeException.Fault.MALFORMED, faultOf("{not json"));
        assertEquals(EventDecodeException.Fault.MALFORMED, faultOf("[1, 2]"));
    }

    @Test
    public void missing_fields_are_reported() throws Exception {
        ObjectNode noId = envelope();
        noId.remove("id");
        assertEquals(EventDecodeException.Fault.MISSING_FIELD, faultOf(noId.toString()));

        ObjectNode noTimestamp = envelope();
        noTimestamp.remove("timestamp");
        assertEquals(EventDecodeException.Fault.MISSING_FIELD, faultOf(noTimestamp.toString()));

        ObjectNode noCommand = envelope();
        noCommand.remove("command");
        assertEquals(EventDecodeException.Fault.MISSING_FIELD, faultOf(noCommand.toString()));
    }

    @Test
    public void unregistered_command_is_reported() throws Exception {
        ObjectNode envelope = envelope();
        envelope.putObject("command").put("name", "Close_Account");
        assertEquals(EventDecodeException.Fault.UNKNOWN_COMMAND, faultOf(envelope.toString()));
    }

    @Test
    public void invalid_values_are_reported() throws Exception {
        ObjectNode badId = envelope();
        badId.put("aggregateRootId", "42");
        assertEquals(EventDecodeException.Fault.INVALID_VALUE, faultOf(badId.toString()));

        ObjectNode badTimestamp = envelope();
        badTimestamp.put("timestamp", "yesterday");
        assertEquals(EventDecodeException.Fault.INVALID_VALUE, faultOf(badTimestamp.toString()));

        ObjectNode arrayPayload = envelope();
        arrayPayload.putArray("payload").add(1);
        assertEquals(EventDecodeException.Fault.INVALID_VALUE, faultOf(arrayPayload.toString()));
    }
}
