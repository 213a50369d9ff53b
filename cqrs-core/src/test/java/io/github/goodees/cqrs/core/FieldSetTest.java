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

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.goodees.cqrs.example.Account;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static io.github.goodees.cqrs.example.ExampleEvents.payload;
import static org.junit.Assert.*;

public class FieldSetTest {

    static class Tagged {
        List<String> tags;
        Integer count;
    }

    @Test
    public void only_present_properties_are_written() {
        Account account = new Account();
        account.setName("Eve");
        account.setEmail("eve@example.com");
        Account.FIELDS.merge(account, payload("email", "new@example.com"));
        assertEquals("Eve", account.getName());
        assertEquals("new@example.com", account.getEmail());
    }

    @Test
    public void explicit_null_clears_property() {
        Account account = new Account();
        account.setNote("note");
        Account.FIELDS.merge(account, payload("note", null));
        assertNull(account.getNote());
    }

    @Test
    public void unknown_properties_are_ignored() {
        Account account = new Account();
        Account.FIELDS.merge(account, payload("color", "red", "name", "Fay"));
        assertEquals("Fay", account.getName());
    }

    @Test
    public void values_are_converted_to_field_type() {
        UUID owner = UUID.randomUUID();
        Account account = Account.FIELDS.merge(new Account(), payload("ownerId", owner.toString()));
        assertEquals(owner, account.getOwnerId());
    }

    @Test
    public void generic_fields_use_type_reference() {
        FieldSet<Tagged> fields = FieldSet.forType(Tagged.class)
                .field("tags", new TypeReference<List<String>>() {}, (t, v) -> t.tags = v)
                .field("count", Integer.class, (t, v) -> t.count = v)
                .build();
        Tagged tagged = fields.merge(new Tagged(), payload("tags", Arrays.asList("a", "b"), "count", "3"));
        assertEquals(Arrays.asList("a", "b"), tagged.tags);
        assertEquals(Integer.valueOf(3), tagged.count);
    }

    @Test
    public void renamed_properties_are_mapped() {
        Account account = Account.FIELDS.merge(new Account(), payload("fullName", "Gus", "email", "g@x.y"),
            Collections.singletonMap("fullName", "name"), false);
        assertEquals("Gus", account.getName());
        assertEquals("g@x.y", account.getEmail());
    }

    @Test
    public void strict_merge_writes_only_renamed_properties() {
        Account account = Account.FIELDS.merge(new Account(), payload("fullName", "Gus", "email", "g@x.y"),
            Collections.singletonMap("fullName", "name"), true);
        assertEquals("Gus", account.getName());
        assertNull(account.getEmail());
    }

    @Test(expected = IllegalArgumentException.class)
    public void inconvertible_value_is_rejected() {
        Account.FIELDS.merge(new Account(), payload("ownerId", "not a uuid"));
    }

    @Test
    public void null_payload_changes_nothing() {
        Account account = new Account();
        account.setName("Hal");
        Account.FIELDS.merge(account, null);
        assertEquals("Hal", account.getName());
    }
}
