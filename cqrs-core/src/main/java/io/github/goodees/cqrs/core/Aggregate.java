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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consistency boundary of the write side. Deleted aggregates are kept, flagged as deleted. Once deleted, an
 * aggregate stays deleted unless the subclass explicitly undeletes it.
 */
public abstract class Aggregate extends EventSourcedObject {
    private boolean deleted;

    public boolean isDeleted() {
        return deleted;
    }

    @JsonProperty("deleted")
    void restoreDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    protected final void markDeleted() {
        this.deleted = true;
    }

    protected final void undelete() {
        this.deleted = false;
    }
}
