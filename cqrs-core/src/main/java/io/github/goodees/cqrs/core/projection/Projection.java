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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.cqrs.core.EventSourcedObject;

/**
 * Read model derived from an aggregate's events, enriched with events of other aggregates (external data).
 *
 * <p>A projection is usable only after it was initialized, i. e. external data relevant to it were applied. The
 * state moves from {@link State#UNINITIALIZED} through {@link State#REHYDRATING} to {@link State#INITIALIZED}, and
 * never moves back. Only the initialized flag is part of the stored document.</p>
 */
public abstract class Projection extends EventSourcedObject {

    public enum State {
        UNINITIALIZED, REHYDRATING, INITIALIZED
    }

    private volatile State state = State.UNINITIALIZED;

    @JsonIgnore
    public State getState() {
        return state;
    }

    public boolean isInitialized() {
        return state == State.INITIALIZED;
    }

    @JsonProperty("initialized")
    void restoreInitialized(boolean initialized) {
        if (initialized) {
            state = State.INITIALIZED;
        }
    }

    /**
     * Start applying external data.
     * @return false when the projection is already initialized
     */
    boolean beginRehydration() {
        if (state == State.INITIALIZED) {
            return false;
        }
        state = State.REHYDRATING;
        return true;
    }

    void completeRehydration() {
        state = State.INITIALIZED;
    }
}
