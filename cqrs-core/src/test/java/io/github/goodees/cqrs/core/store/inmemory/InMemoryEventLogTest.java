package io.github.goodees.cqrs.core.store.inmemory;

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
import io.github.goodees.cqrs.core.store.StoreException;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

import static io.github.goodees.cqrs.example.AccountCommands.UPDATE;
import static io.github.goodees.cqrs.example.ExampleEvents.event;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.*;

public class InMemoryEventLogTest {
    private final InMemoryEventLog log = new InMemoryEventLog();

    @Test
    public void history_is_returned_in_replay_order() throws Exception {
        UUID id = UUID.randomUUID();
        Event late = event(UPDATE, id, 20, "name", "late");
        Event early = event(UPDATE, id, 10, "name", "early");
        log.append(late, early);
        List<Event> history = log.loadEventHistory(id).toCompletableFuture().get();
        assertThat(history, contains(early, late));
        assertThat(log.aggregateRootIds().toCompletableFuture().get(), contains(id));
    }

    @Test
    public void unknown_aggregate_has_no_history() throws Exception {
        assertThat(log.loadEventHistory(UUID.randomUUID()).toCompletableFuture().get(), empty());
    }

    @Test
    public void duplicate_event_is_rejected() throws Exception {
        Event event = event(UPDATE, UUID.randomUUID(), 0, "name", "x");
        log.append(event);
        try {
            log.append(event);
            fail("Duplicate should be rejected");
        } catch (StoreException e) {
            assertEquals(StoreException.Fault.DUPLICATE, e.getFault());
        }
    }
}
