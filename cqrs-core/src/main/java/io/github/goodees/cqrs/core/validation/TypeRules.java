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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Validation rules of a single type: required payload properties and maximum lengths of its text properties.
 * Rules are declared once at startup and registered in {@link ValidationRegistry}. Text properties that are not
 * declared with {@code text} or {@code maxLength} have no length limit, not even the default maximum.
 *
 * <pre>{@code
 * TypeRules.forType(Account.class)
 *     .requiredForCreate("id", true)
 *     .requiredFor(RENAME, "name")
 *     .maxLength("name", Account::getName, 20)
 *     .maxLength("note", Account::getNote, "account.note.maxLength")
 *     .text("email", Account::getEmail)
 *     .build();
 * }</pre>
 * @param <T> the validated type
 */
public final class TypeRules<T> {
    private final Class<T> type;
    private final List<RequiredField> requiredFields;
    private final List<LengthRule<T>> lengthRules;
    private final Set<String> properties;

    private TypeRules(Builder<T> builder) {
        this.type = builder.type;
        this.requiredFields = Collections.unmodifiableList(new ArrayList<>(builder.requiredFields));
        this.lengthRules = Collections.unmodifiableList(new ArrayList<>(builder.lengthRules));
        this.properties = builder.properties == null ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.properties));
    }

    public static <T> Builder<T> forType(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<T> getType() {
        return type;
    }

    public List<RequiredField> getRequiredFields() {
        return requiredFields;
    }

    List<LengthRule<T>> getLengthRules() {
        return lengthRules;
    }

    /**
     * Complete set of payload properties, when declared. Payload properties outside of it are reported as invalid.
     * @return declared properties, or empty when any property is accepted
     */
    public Optional<Set<String>> getProperties() {
        return Optional.ofNullable(properties);
    }

    static final class LengthRule<T> {
        private final Class<T> type;
        private final String property;
        private final Function<? super T, String> getter;
        private final MaxLength maxLength;

        LengthRule(Class<T> type, String property, Function<? super T, String> getter, MaxLength maxLength) {
            this.type = type;
            this.property = Objects.requireNonNull(property, "property");
            this.getter = Objects.requireNonNull(getter, "getter");
            this.maxLength = Objects.requireNonNull(maxLength, "maxLength");
        }

        String getProperty() {
            return property;
        }

        String valueOf(Object instance) {
            return getter.apply(type.cast(instance));
        }

        MaxLength getMaxLength() {
            return maxLength;
        }
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final List<RequiredField> requiredFields = new ArrayList<>();
        private final List<LengthRule<T>> lengthRules = new ArrayList<>();
        private Set<String> properties;

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder<T> requiredForCreate(String... names) {
            for (String name : names) {
                requiredForCreate(name, false);
            }
            return this;
        }

        /**
         * Require property in payloads of commands that create the aggregate.
         * @param name property name
         * @param notDefault whether default values (nil UUID, empty text, zero) are rejected as well
         * @return this builder
         */
        public Builder<T> requiredForCreate(String name, boolean notDefault) {
            requiredFields.add(RequiredField.forCreate(name, notDefault));
            return this;
        }

        public Builder<T> requiredFor(Command command, String name) {
            return requiredFor(command, name, false);
        }

        public Builder<T> requiredFor(Command command, String name, boolean notDefault) {
            requiredFields.add(RequiredField.forCommand(command, name, notDefault));
            return this;
        }

        public Builder<T> maxLength(String name, Function<? super T, String> getter, int maxLength) {
            return text(name, getter, MaxLength.of(maxLength));
        }

        public Builder<T> maxLength(String name, Function<? super T, String> getter, String configKey) {
            return text(name, getter, MaxLength.fromConfig(configKey));
        }

        /**
         * Declare text property limited by the validator's default maximum length.
         * @param name property name
         * @param getter accessor of the property
         * @return this builder
         */
        public Builder<T> text(String name, Function<? super T, String> getter) {
            return text(name, getter, MaxLength.byDefault());
        }

        public Builder<T> text(String name, Function<? super T, String> getter, MaxLength maxLength) {
            lengthRules.add(new LengthRule<>(type, name, getter, maxLength));
            return this;
        }

        /**
         * Declare complete set of payload properties of the type.
         * @param names property names
         * @return this builder
         */
        public Builder<T> properties(String... names) {
            if (properties == null) {
                properties = new LinkedHashSet<>();
            }
            Collections.addAll(properties, names);
            return this;
        }

        public TypeRules<T> build() {
            return new TypeRules<>(this);
        }
    }
}
