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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.UUID;

/**
 * Parsing of UUID identifiers supplied as text.
 */
public final class Identifiers {
    /**
     * The nil UUID, used where an identifier is not known.
     */
    public static final UUID NIL = new UUID(0L, 0L);

    private Identifiers() {
    }

    /**
     * Parse identifier.
     * @param value text to parse
     * @param field name of the field for the error message
     * @return parsed identifier
     * @throws IllegalArgumentException when value is null or not a UUID
     */
    public static UUID parse(String value, String field) {
        return tryParse(value)
                .orElseThrow(() -> new IllegalArgumentException(field + " is not parsable to a UUID: " + value));
    }

    public static Optional<UUID> tryParse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            UUID parsed = UUID.fromString(value.trim());
            // UUID.fromString accepts shortened groups, require canonical form
            return parsed.toString().equalsIgnoreCase(value.trim()) ? Optional.of(parsed) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static Optional<UUID> fromNode(JsonNode node) {
        return node != null && node.isTextual() ? tryParse(node.textValue()) : Optional.empty();
    }

    public static boolean isNil(UUID id) {
        return id == null || NIL.equals(id);
    }
}
