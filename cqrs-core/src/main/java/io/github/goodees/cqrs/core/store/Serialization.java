package io.github.goodees.cqrs.core.store;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.cqrs.core.JsonMapping;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Conversion of stored documents to and from String payload. Stores use it so that state is persisted in the
 * same form regardless of the storage.
 * <p>Serialization failures are reported as {@link UncheckedIOException}.</p>
 */
public interface Serialization<T> {
    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     */
    String serialize(T object);

    /**
     * Deserialize a payload.
     * @param payload payload to deserialize
     * @return deserialized object
     */
    T deserialize(String payload);

    /**
     * JSON serialization with shared mapper configuration.
     * @param type type of documents
     * @param <T> type of documents
     * @return serialization
     */
    static <T> Serialization<T> json(Class<T> type) {
        return json(type, JsonMapping.mapper());
    }

    static <T> Serialization<T> json(Class<T> type, ObjectMapper mapper) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(mapper, "mapper");
        return new Serialization<T>() {
            @Override
            public String serialize(T object) {
                try {
                    return mapper.writeValueAsString(object);
                } catch (JsonProcessingException e) {
                    throw new UncheckedIOException("Cannot serialize " + type.getSimpleName(), e);
                }
            }

            @Override
            public T deserialize(String payload) {
                try {
                    return mapper.readValue(payload, type);
                } catch (JsonProcessingException e) {
                    throw new UncheckedIOException("Cannot deserialize " + type.getSimpleName(), e);
                }
            }
        };
    }
}
