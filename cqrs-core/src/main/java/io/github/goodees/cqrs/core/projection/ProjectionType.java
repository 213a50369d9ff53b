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

import io.github.goodees.cqrs.core.Aggregate;
import io.github.goodees.cqrs.core.JsonMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Describes a projection: its base aggregate, how to create it, and where its external data come from.
 * @param <P> projection type
 * @param <A> base aggregate type
 */
public final class ProjectionType<P extends Projection, A extends Aggregate> {
    private final Class<P> projectionClass;
    private final Class<A> aggregateClass;
    private final Supplier<P> factory;
    private final Function<? super A, ? extends P> seed;
    private final List<ExternalDataProvider<P>> providers;

    private ProjectionType(Builder<P, A> builder) {
        this.projectionClass = builder.projectionClass;
        this.aggregateClass = builder.aggregateClass;
        this.factory = builder.factory;
        this.seed = builder.seed != null ? builder.seed : this::convert;
        this.providers = Collections.unmodifiableList(new ArrayList<>(builder.providers));
    }

    public static <P extends Projection, A extends Aggregate> Builder<P, A> builder(Class<P> projectionClass,
            Class<A> aggregateClass, Supplier<P> factory) {
        return new Builder<>(projectionClass, aggregateClass, factory);
    }

    public Class<P> getProjectionClass() {
        return projectionClass;
    }

    public Class<A> getAggregateClass() {
        return aggregateClass;
    }

    public List<ExternalDataProvider<P>> getProviders() {
        return providers;
    }

    public P newInstance() {
        return factory.get();
    }

    /**
     * Projection seeded with the state of its base aggregate.
     * @param aggregate the aggregate
     * @return new, uninitialized projection with the aggregate's id
     */
    public P fromAggregate(A aggregate) {
        P projection = seed.apply(aggregate);
        if (projection.getId() == null) {
            projection.setId(aggregate.getId());
        }
        return projection;
    }

    private P convert(A aggregate) {
        return JsonMapping.mapper().convertValue(aggregate, projectionClass);
    }

    @Override
    public String toString() {
        return "ProjectionType{" + projectionClass.getSimpleName() + " of " + aggregateClass.getSimpleName() + '}';
    }

    public static final class Builder<P extends Projection, A extends Aggregate> {
        private final Class<P> projectionClass;
        private final Class<A> aggregateClass;
        private final Supplier<P> factory;
        private Function<? super A, ? extends P> seed;
        private final List<ExternalDataProvider<P>> providers = new ArrayList<>();

        private Builder(Class<P> projectionClass, Class<A> aggregateClass, Supplier<P> factory) {
            this.projectionClass = Objects.requireNonNull(projectionClass, "projectionClass");
            this.aggregateClass = Objects.requireNonNull(aggregateClass, "aggregateClass");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        /**
         * How to seed projection from aggregate. By default aggregate properties are copied to same named
         * properties of the projection.
         * @param seed conversion function
         * @return this builder
         */
        public Builder<P, A> seed(Function<? super A, ? extends P> seed) {
            this.seed = seed;
            return this;
        }

        public Builder<P, A> provider(ExternalDataProvider<P> provider) {
            providers.add(Objects.requireNonNull(provider, "provider"));
            return this;
        }

        public ProjectionType<P, A> build() {
            return new ProjectionType<>(this);
        }
    }
}
