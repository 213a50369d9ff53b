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

import io.github.goodees.cqrs.core.store.StoreException;
import io.github.goodees.cqrs.core.store.UpsertResult;
import io.github.goodees.cqrs.core.store.inmemory.InMemoryStateStore;
import io.github.goodees.cqrs.example.Account;
import org.junit.Test;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

import static io.github.goodees.cqrs.example.AccountCommands.*;
import static io.github.goodees.cqrs.example.ExampleEvents.event;
import static org.junit.Assert.*;

public class CurrentStateUpdaterTest {
    private final InMemoryStateStore stateStore = new InMemoryStateStore();
    private final CurrentStateUpdater updater = new CurrentStateUpdater(stateStore);
    private final UUID id = UUID.randomUUID();

    @Test(timeout = 5000)
    public void events_update_stored_state() throws Exception {
        updater.applyAndPersistAsync(Account.class, Account::new, event(CREATE, id, 0, "id", id, "name", "Kim")).get();
        Account updated = updater.applyAndPersistAsync(Account.class, Account::new,
            event(UPDATE, id, 1, "email", "kim@example.com")).get();

        assertEquals("Kim", updated.getName());
        Account stored = stateStore.loadAggregate(Account.class, id).toCompletableFuture().get().get();
        assertEquals("Kim", stored.getName());
        assertEquals("kim@example.com", stored.getEmail());
    }

    @Test(timeout = 5000)
    public void creating_command_starts_from_new_instance() throws Exception {
        updater.applyAndPersistAsync(Account.class, Account::new, event(CREATE, id, 0, "id", id, "name", "Kim",
            "note", "old")).get();
        Account recreated = updater.applyAndPersistAsync(Account.class, Account::new,
            event(CREATE, id, 5, "id", id, "name", "Lee")).get();
        assertNull(recreated.getNote());
    }

    @Test(timeout = 5000)
    public void delete_is_persisted_as_flag() throws Exception {
        updater.applyAndPersistAsync(Account.class, Account::new, event(CREATE, id, 0, "id", id, "name", "Kim")).get();
        updater.applyAndPersistAsync(Account.class, Account::new, event(DELETE, id, 1)).get();
        assertTrue(stateStore.loadAggregateIds(Account.class, false).toCompletableFuture().get().isEmpty());
        assertEquals(1, stateStore.loadAggregateIds(Account.class, true).toCompletableFuture().get().size());
    }

    @Test(timeout = 5000)
    public void failed_upsert_fails_the_update() throws Exception {
        InMemoryStateStore failing = new InMemoryStateStore() {
            @Override
            protected <T extends EventSourcedObject> UpsertResult store(Class<T> type, Map<UUID, String> container,
                    T item) {
                return UpsertResult.failure(item.getId(), "disk full");
            }
        };
        try {
            new CurrentStateUpdater(failing).applyAndPersistAsync(Account.class, Account::new,
                event(CREATE, id, 0, "id", id, "name", "Kim")).get();
            fail("Update should fail");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof StoreException);
            assertEquals(StoreException.Fault.TX_ERROR, ((StoreException) e.getCause()).getFault());
        }
    }
}
