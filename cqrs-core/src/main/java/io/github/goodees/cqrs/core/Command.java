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

import java.util.Objects;

/**
 * A named intent that produces events. Commands are identified by their name only, so that instances
 * declared once at startup compare equal to instances resolved later, for example when decoding an event
 * received from transport.
 *
 * <p>{@code isNew} marks commands that create an aggregate; payload validation then enforces the fields
 * required for creation. {@code allowNullPayload} marks commands that legitimately carry no payload, e. g.
 * deletion.</p>
 */
public final class Command implements Comparable<Command> {
    private final String name;
    private final boolean isNew;
    private final boolean allowNullPayload;

    /**
     * Create command that neither creates an aggregate nor allows null payload.
     * @param name name of the command
     * @throws IllegalArgumentException when name is null, empty or whitespace
     */
    public Command(String name) {
        this(name, false, false);
    }

    public Command(String name, boolean isNew) {
        this(name, isNew, false);
    }

    /**
     * Create command.
     * @param name name of the command, unique within the process
     * @param isNew whether the command creates an aggregate
     * @param allowNullPayload whether events of this command may carry no payload
     * @throws IllegalArgumentException when name is null, empty or whitespace
     */
    public Command(String name, boolean isNew, boolean allowNullPayload) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Command name cannot be null or empty (parameter 'name')");
        }
        this.name = name;
        this.isNew = isNew;
        this.allowNullPayload = allowNullPayload;
    }

    public String getName() {
        return name;
    }

    public boolean isNew() {
        return isNew;
    }

    public boolean allowsNullPayload() {
        return allowNullPayload;
    }

    /**
     * Whether the other command carries the same flags. Plain equality only compares names.
     * @param other command to compare with
     * @return true if name and both flags match
     */
    public boolean sameDefinition(Command other) {
        return other != null && name.equals(other.name) && isNew == other.isNew
                && allowNullPayload == other.allowNullPayload;
    }

    @Override
    public int compareTo(Command o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Command)) {
            return false;
        }
        return name.equals(((Command) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
