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

import java.util.UUID;

/**
 * Failure of an event log or state store operation.
 */
public class StoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        NOT_FOUND, DUPLICATE, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected StoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static StoreException notFound(Class<?> type, UUID id) {
        return new StoreException(Fault.NOT_FOUND, type.getSimpleName() + " " + id + " does not exist", null);
    }

    public static StoreException duplicateEvent(UUID eventId) {
        return new StoreException(Fault.DUPLICATE, "Event " + eventId + " is already stored", null);
    }

    public static StoreException storeFailed(Class<?> type, UUID id, Throwable cause) {
        return new StoreException(Fault.TX_ERROR,
            "Store of " + type.getSimpleName() + " " + id + " failed. " + cause.getMessage(), cause);
    }

    public static StoreException readFailed(Class<?> type, UUID id, Throwable cause) {
        return new StoreException(Fault.TX_ERROR,
            "Read of " + type.getSimpleName() + " " + id + " failed. " + cause.getMessage(), cause);
    }

    public static StoreException missingId(Class<?> type) {
        return new StoreException(Fault.PROGRAMMATIC_ERROR, "Cannot store " + type.getSimpleName() + " without id",
            null);
    }
}
