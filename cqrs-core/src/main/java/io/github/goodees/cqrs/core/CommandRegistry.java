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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of commands known to the process, keyed by name. Populated at startup, then used to resolve
 * commands of events decoded from transport.
 */
public class CommandRegistry {
    private static final CommandRegistry GLOBAL = new CommandRegistry();

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ConcurrentMap<String, Command> commands = new ConcurrentHashMap<>();

    /**
     * Process-wide registry.
     * @return the shared registry instance
     */
    public static CommandRegistry global() {
        return GLOBAL;
    }

    /**
     * Register commands. Registering an equal definition again has no effect.
     * @param toRegister commands to register
     * @return this registry
     * @throws IllegalStateException when a command of the same name but different flags is already registered
     */
    public CommandRegistry register(Command... toRegister) {
        for (Command command : toRegister) {
            Command existing = commands.putIfAbsent(command.getName(), command);
            if (existing == null) {
                logger.debug("Registered command {}", command);
            } else if (!existing.sameDefinition(command)) {
                throw new IllegalStateException("Command " + command + " is already registered with different definition");
            }
        }
        return this;
    }

    public Optional<Command> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(commands.get(name));
    }

    /**
     * Look up command by name.
     * @param name name of the command
     * @return registered command
     * @throws IllegalArgumentException when no such command is registered
     */
    public Command require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown command '" + name + "'"));
    }

    public Collection<Command> commands() {
        return Collections.unmodifiableCollection(commands.values());
    }
}
