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

import io.github.goodees.cqrs.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of storing a single document of a bulk upsert.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class UpsertResult {

    public abstract Optional<UUID> getId();

    public abstract Optional<String> getError();

    public boolean isSuccessful() {
        return !getError().isPresent();
    }

    public static UpsertResult success(UUID id) {
        return ImmutableUpsertResult.builder().id(id).build();
    }

    public static UpsertResult failure(UUID id, String error) {
        return ImmutableUpsertResult.builder().id(id).error(error).build();
    }
}
