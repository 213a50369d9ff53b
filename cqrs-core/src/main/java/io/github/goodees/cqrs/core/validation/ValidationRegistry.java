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

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rules per type. Lookup falls back to rules of superclasses.
 */
public class ValidationRegistry {
    private final ConcurrentMap<Class<?>, TypeRules<?>> rules = new ConcurrentHashMap<>();

    public ValidationRegistry register(TypeRules<?>... typeRules) {
        for (TypeRules<?> r : typeRules) {
            rules.put(r.getType(), r);
        }
        return this;
    }

    /**
     * Rules of a type, or of its nearest superclass that has rules.
     * @param type type of validated instances
     * @return rules applicable to instances of the type
     */
    public Optional<TypeRules<?>> rulesFor(Class<?> type) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            TypeRules<?> found = rules.get(c);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }
}
