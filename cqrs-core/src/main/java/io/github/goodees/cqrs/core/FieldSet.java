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
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Settable properties of a type, used to merge event payloads into state. Only properties present in the payload
 * are written, others keep their value, which gives the partial update semantics of events.
 *
 * <pre>{@code
 * static final FieldSet<Account> FIELDS = FieldSet.forType(Account.class)
 *     .field("name", String.class, Account::setName)
 *     .field("balance", BigDecimal.class, Account::setBalance)
 *     .build();
 * }</pre>
 * @param <T> type of the target
 */
public final class FieldSet<T> {
    private final Class<T> type;
    private final Map<String, Field<T, ?>> fields;

    private FieldSet(Class<T> type, Map<String, Field<T, ?>> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static <T> Builder<T> forType(Class<T> type) {
        return new Builder<>(type);
    }

    public Set<String> names() {
        return fields.keySet();
    }

    /**
     * Write payload properties that match field names.
     * @param target object to update
     * @param payload the payload, null payload changes nothing
     * @return the target
     * @throws IllegalArgumentException when a property value is not convertible to type of the field
     */
    public T merge(T target, JsonNode payload) {
        return merge(target, payload, Collections.emptyMap(), false);
    }

    /**
     * Write payload properties, with some of them mapped to differently named fields.
     * @param target object to update
     * @param payload the payload
     * @param renames mapping from payload property name to field name
     * @param strict when true, only properties listed in renames are written
     * @return the target
     * @throws IllegalArgumentException when a property value is not convertible to type of the field
     */
    public T merge(T target, JsonNode payload, Map<String, String> renames, boolean strict) {
        Objects.requireNonNull(target, "target");
        if (payload == null || !payload.isObject()) {
            return target;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = payload.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> property = it.next();
            String fieldName = renames.get(property.getKey());
            if (fieldName == null) {
                if (strict) {
                    continue;
                }
                fieldName = property.getKey();
            }
            Field<T, ?> field = fields.get(fieldName);
            if (field != null) {
                field.write(target, property.getValue());
            }
        }
        return target;
    }

    @Override
    public String toString() {
        return "FieldSet{" + type.getSimpleName() + fields.keySet() + '}';
    }

    private static final class Field<T, V> {
        private final String name;
        private final JavaType valueType;
        private final BiConsumer<? super T, ? super V> setter;

        Field(String name, JavaType valueType, BiConsumer<? super T, ? super V> setter) {
            this.name = name;
            this.valueType = valueType;
            this.setter = setter;
        }

        void write(T target, JsonNode value) {
            V converted;
            try {
                converted = JsonMapping.mapper().convertValue(value, valueType);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Property " + name + " is not convertible to " + valueType, e);
            }
            setter.accept(target, converted);
        }
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final Map<String, Field<T, ?>> fields = new LinkedHashMap<>();

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public <V> Builder<T> field(String name, Class<V> valueType, BiConsumer<? super T, ? super V> setter) {
            return add(name, JsonMapping.mapper().constructType(valueType), setter);
        }

        public <V> Builder<T> field(String name, TypeReference<V> valueType, BiConsumer<? super T, ? super V> setter) {
            return add(name, JsonMapping.mapper().getTypeFactory().constructType(valueType), setter);
        }

        private <V> Builder<T> add(String name, JavaType valueType, BiConsumer<? super T, ? super V> setter) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(setter, "setter");
            fields.put(name, new Field<T, V>(name, valueType, setter));
            return this;
        }

        public FieldSet<T> build() {
            return new FieldSet<>(type, fields);
        }
    }
}
