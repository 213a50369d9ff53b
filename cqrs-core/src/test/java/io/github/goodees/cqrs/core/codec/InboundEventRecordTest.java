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

import io.github.goodees.cqrs.core.CommandRegistry;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.example.AccountCommands;
import org.junit.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

import static io.github.goodees.cqrs.example.AccountCommands.*;
import static io.github.goodees.cqrs.example.ExampleEvents.payload;
import static org.junit.Assert.*;

public class InboundEventRecordTest {
    private final EventCodec codec = new EventCodec(AccountCommands.register(new CommandRegistry()));
    private final Event event = new Event(UUID.randomUUID(), UUID.randomUUID(), UPDATE, payload("name", "Pat"),
            Instant.parse("2024-03-01T10:00:00Z"), null, null);

    private InboundEventRecord record(String value) {
        return InboundEventRecord.builder()
                .topic("accounts")
                .partition(3)
                .offset(42L)
                .key(event.getAggregateRootId().toString())
                .value(Optional.ofNullable(value))
                .headers(Collections.singletonMap("source", "test"))
                .build();
    }

    @Test
    public void record_without_filters_yields_its_event() throws Exception {
        Optional<Event> decoded = record(codec.encode(event)).toEvent(codec);
        assertTrue(decoded.isPresent());
        assertEquals(event, decoded.get());
        assertEquals(UPDATE, decoded.get().getCommand());
    }

    @Test
    public void event_matching_a_filter_is_returned() throws Exception {
        assertTrue(record(codec.encode(event)).toEvent(codec, CREATE, UPDATE).isPresent());
    }

    @Test
    public void event_of_other_command_is_skipped() throws Exception {
        assertFalse(record(codec.encode(event)).toEvent(codec, CREATE, DELETE).isPresent());
    }

    @Test(expected = EmptyEventValueException.class)
    public void record_without_value_cannot_be_decoded() throws Exception {
        record(null).toEvent(codec);
    }

    @Test
    public void record_keeps_transport_metadata() {
        InboundEventRecord record = record("{}");
        assertEquals("accounts", record.getTopic());
        assertEquals(3, record.getPartition());
        assertEquals(42L, record.getOffset());
        assertEquals("test", record.getHeaders().get("source"));
    }
}
