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

import io.github.goodees.cqrs.core.store.UpsertResult;
import io.github.goodees.cqrs.example.Account;
import io.github.goodees.cqrs.example.AccountSummary;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.Assert.*;

public class InMemoryStateStoreTest {
    private final InMemoryStateStore store = new InMemoryStateStore();

    private static Account account(String name) {
        Account account = new Account();
        account.setId(UUID.randomUUID());
        account.setName(name);
        return account;
    }

    @Test
    public void stored_document_is_loaded() throws Exception {
        Account account = account("Mia");
        store.upsert(Account.class, account).toCompletableFuture().get();
        Optional<Account> loaded = store.loadAggregate(Account.class, account.getId()).toCompletableFuture().get();
        assertTrue(loaded.isPresent());
        assertNotSame(account, loaded.get());
        assertEquals("Mia", loaded.get().getName());
        assertTrue(store.getDocument(Account.class, account.getId()).get().contains("\"name\":\"Mia\""));
    }

    @Test
    public void missing_document_is_empty() throws Exception {
        assertFalse(store.loadAggregate(Account.class, UUID.randomUUID()).toCompletableFuture().get().isPresent());
    }

    @Test
    public void bulk_upsert_reports_each_item() throws Exception {
        Account withoutId = new Account();
        List<UpsertResult> results = store.bulkUpsert(Account.class,
            Arrays.asList(account("a"), withoutId, account("b"))).toCompletableFuture().get();
        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccessful());
        assertFalse(results.get(1).isSuccessful());
        assertTrue(results.get(2).isSuccessful());
        assertEquals(2, store.count(Account.class));
    }

    @Test
    public void containers_are_separate_and_deletable() throws Exception {
        store.upsert(Account.class, account("a")).toCompletableFuture().get();
        AccountSummary summary = new AccountSummary();
        summary.setId(UUID.randomUUID());
        store.upsert(AccountSummary.class, summary).toCompletableFuture().get();

        assertEquals(Integer.valueOf(1), store.deleteAll(Account.class).toCompletableFuture().get());
        assertEquals(0, store.count(Account.class));
        assertEquals(1, store.count(AccountSummary.class));
    }

    @Test
    public void uninitialized_projections_are_found() throws Exception {
        AccountSummary summary = new AccountSummary();
        summary.setId(UUID.randomUUID());
        store.upsert(AccountSummary.class, summary).toCompletableFuture().get();
        List<AccountSummary> found = store.findUninitialized(AccountSummary.class).toCompletableFuture().get();
        assertEquals(1, found.size());
        assertEquals(summary.getId(), found.get(0).getId());
        assertFalse(found.get(0).isInitialized());
    }
}
