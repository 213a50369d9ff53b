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

import org.junit.Test;

import static org.junit.Assert.*;

public class CommandRegistryTest {
    private final CommandRegistry registry = new CommandRegistry();

    @Test
    public void registered_command_is_found_by_name() {
        Command create = new Command("Create_Thing", true);
        registry.register(create);
        Command found = registry.require("Create_Thing");
        assertSame(create, found);
        assertTrue(found.isNew());
    }

    @Test
    public void unknown_name_is_not_found() {
        assertFalse(registry.find("Nope").isPresent());
        assertFalse(registry.find(null).isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void require_fails_for_unknown_name() {
        registry.require("Nope");
    }

    @Test
    public void registering_same_definition_twice_is_allowed() {
        registry.register(new Command("Delete", false, true));
        registry.register(new Command("Delete", false, true));
        assertEquals(1, registry.commands().size());
    }

    @Test(expected = IllegalStateException.class)
    public void conflicting_definition_is_rejected() {
        registry.register(new Command("Delete", false, true));
        registry.register(new Command("Delete", true, false));
    }

    @Test
    public void global_registry_is_shared() {
        assertSame(CommandRegistry.global(), CommandRegistry.global());
    }
}
