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

import io.github.goodees.cqrs.core.store.Serialization;
import io.github.goodees.cqrs.example.Account;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static io.github.goodees.cqrs.example.AccountCommands.*;
import static io.github.goodees.cqrs.example.ExampleEvents.T0;
import static io.github.goodees.cqrs.example.ExampleEvents.event;
import static io.github.goodees.cqrs.example.ExampleEvents.payload;
import static org.junit.Assert.*;

public class ReplayTest {
    private final UUID id = UUID.randomUUID();

    private List<Event> history() {
        return Arrays.asList(
            event(CREATE, id, 0, "id", id, "name", "Ann"),
            event(UPDATE, id, 5, "email", "ann@example.com"),
            event(UPDATE, id, 10, "name", "Anna"),
            event(UPDATE, id, 15, "note", "vip"),
            event(UPDATE, id, 20, "email", "anna@example.com"));
    }

    @Test
    public void events_are_applied_in_timestamp_order() {
        List<Event> shuffled = new ArrayList<>(history());
        Collections.shuffle(shuffled, new Random(7));
        Account account = Replay.replay(new Account(), shuffled);
        assertEquals(id, account.getId());
        assertEquals("Anna", account.getName());
        assertEquals("anna@example.com", account.getEmail());
        assertEquals("vip", account.getNote());
        assertEquals(T0.plusSeconds(20), account.getLastEventTimestamp());
    }

    @Test
    public void equal_timestamps_are_ordered_by_event_id() {
        Event first = new Event(new UUID(0, 1), id, UPDATE, payload("name", "first"), T0, null, null);
        Event second = new Event(new UUID(0, 2), id, UPDATE, payload("name", "second"), T0, null, null);
        assertEquals("second", Replay.replay(new Account(), Arrays.asList(second, first)).getName());
        assertEquals("second", Replay.replay(new Account(), Arrays.asList(first, second)).getName());
    }

    @Test
    public void prefix_then_remainder_equals_full_replay() {
        List<Event> history = history();
        Account full = Replay.replay(new Account(), history);

        Account incremental = Replay.replay(new Account(), history.subList(0, 3));
        assertEquals("Anna", incremental.getName());
        assertNull(incremental.getNote());
        Replay.resume(incremental, history);

        assertEquals(full.getName(), incremental.getName());
        assertEquals(full.getEmail(), incremental.getEmail());
        assertEquals(full.getNote(), incremental.getNote());
        assertEquals(full.getLastEventId(), incremental.getLastEventId());
    }

    @Test
    public void replay_resumes_from_stored_document() {
        List<Event> history = history();
        Serialization<Account> serialization = Serialization.json(Account.class);
        String stored = serialization.serialize(Replay.replay(new Account(), history.subList(0, 2)));

        Account restored = serialization.deserialize(stored);
        Replay.resume(restored, history);

        assertEquals("Anna", restored.getName());
        assertEquals(history.get(4).getId(), restored.getLastEventId());
    }

    @Test
    public void late_event_is_applied_without_moving_position() {
        List<Event> history = history();
        Account account = Replay.replay(new Account(), history);
        Event late = event(UPDATE, id, 1, "note", "late");
        account.apply(late);
        assertEquals("late", account.getNote());
        assertTrue(account.hasApplied(late));
        assertEquals(history.get(4).getId(), account.getLastEventId());
    }

    @Test
    public void deleted_aggregate_stays_deleted() {
        List<Event> history = new ArrayList<>(history());
        history.add(event(DELETE, id, 30));
        history.add(event(UPDATE, id, 40, "note", "after delete"));
        Account account = Replay.replay(new Account(), history);
        assertTrue(account.isDeleted());
        Account restored = Serialization.json(Account.class).deserialize(
            Serialization.json(Account.class).serialize(account));
        assertTrue(restored.isDeleted());
    }

    @Test
    public void events_of_other_aggregates_do_not_move_position() {
        Account account = Replay.replay(new Account(), history());
        UUID lastEventId = account.getLastEventId();
        account.apply(event(UPDATE, UUID.randomUUID(), 100, "note", "other"));
        assertEquals(lastEventId, account.getLastEventId());
    }
}
