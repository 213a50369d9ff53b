package io.github.goodees.cqrs.core.validation;

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

import io.github.goodees.cqrs.core.Command;

import java.util.Objects;
import java.util.Optional;

/**
 * A payload property that must be present for creating commands, or for one specific command.
 */
public final class RequiredField {
    private final String property;
    private final Command command;
    private final boolean notDefault;

    private RequiredField(String property, Command command, boolean notDefault) {
        this.property = Objects.requireNonNull(property, "property");
        this.command = command;
        this.notDefault = notDefault;
    }

    static RequiredField forCreate(String property, boolean notDefault) {
        return new RequiredField(property, null, notDefault);
    }

    static RequiredField forCommand(Command command, String property, boolean notDefault) {
        return new RequiredField(property, Objects.requireNonNull(command, "command"), notDefault);
    }

    public String getProperty() {
        return property;
    }

    /**
     * The command this requirement applies to, empty for requirements of creating commands.
     * @return command the field is required for
     */
    public Optional<Command> getCommand() {
        return Optional.ofNullable(command);
    }

    public boolean isNotDefault() {
        return notDefault;
    }

    boolean appliesTo(Command issued) {
        return command == null ? issued.isNew() : command.equals(issued);
    }
}
