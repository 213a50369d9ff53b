package io.github.goodees.cqrs.core.projection;

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

import io.github.goodees.cqrs.core.store.UpsertResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.util.stream.Collectors.toList;

/**
 * Outcome of initializing a batch of projections. Failure of single projection is reported here rather than
 * failing the whole batch.
 * @param <P> projection type
 */
public final class InitResult<P extends Projection> {
    private final List<P> projections;
    private final Map<UUID, Throwable> failures;
    private final List<UpsertResult> upserts;

    InitResult(List<P> projections, Map<UUID, Throwable> failures, List<UpsertResult> upserts) {
        this.projections = Collections.unmodifiableList(new ArrayList<>(projections));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.upserts = Collections.unmodifiableList(new ArrayList<>(upserts));
    }

    public static <P extends Projection> InitResult<P> empty() {
        return new InitResult<>(Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());
    }

    static <P extends Projection> InitResult<P> failed(Iterable<UUID> ids, Throwable cause) {
        Map<UUID, Throwable> failures = new LinkedHashMap<>();
        for (UUID id : ids) {
            failures.put(id, cause);
        }
        return new InitResult<>(Collections.emptyList(), failures, Collections.emptyList());
    }

    /**
     * All processed projections, including those that failed to initialize.
     * @return processed projections
     */
    public List<P> getProjections() {
        return projections;
    }

    public List<P> getInitialized() {
        return projections.stream().filter(Projection::isInitialized).collect(toList());
    }

    public Map<UUID, Throwable> getFailures() {
        return failures;
    }

    public List<UpsertResult> getUpserts() {
        return upserts;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public InitResult<P> merge(InitResult<P> other) {
        List<P> mergedProjections = new ArrayList<>(projections);
        mergedProjections.addAll(other.projections);
        Map<UUID, Throwable> mergedFailures = new LinkedHashMap<>(failures);
        mergedFailures.putAll(other.failures);
        List<UpsertResult> mergedUpserts = new ArrayList<>(upserts);
        mergedUpserts.addAll(other.upserts);
        return new InitResult<>(mergedProjections, mergedFailures, mergedUpserts);
    }

    InitResult<P> withFailures(Map<UUID, Throwable> additional) {
        Map<UUID, Throwable> mergedFailures = new LinkedHashMap<>(failures);
        mergedFailures.putAll(additional);
        return new InitResult<>(projections, mergedFailures, upserts);
    }

    InitResult<P> withUpserts(List<UpsertResult> results) {
        Map<UUID, Throwable> mergedFailures = new LinkedHashMap<>(failures);
        for (UpsertResult result : results) {
            if (!result.isSuccessful() && result.getId().isPresent()) {
                mergedFailures.putIfAbsent(result.getId().get(),
                    new IllegalStateException(result.getError().orElse("upsert failed")));
            }
        }
        List<UpsertResult> mergedUpserts = new ArrayList<>(upserts);
        mergedUpserts.addAll(results);
        return new InitResult<>(projections, mergedFailures, mergedUpserts);
    }

    @Override
    public String toString() {
        return "InitResult{" + "projections=" + projections.size() + ", failures=" + failures.keySet()
                + ", upserts=" + upserts.size() + '}';
    }
}
