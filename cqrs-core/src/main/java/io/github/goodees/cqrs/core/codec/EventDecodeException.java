package io.github.goodees.cqrs.core.codec;

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

/**
 * Received value is not a valid event envelope.
 */
public class EventDecodeException extends Exception {
    private final Fault fault;

    public enum Fault {
        MALFORMED, MISSING_FIELD, UNKNOWN_COMMAND, INVALID_VALUE
    }

    protected EventDecodeException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventDecodeException malformed(String reason, Throwable cause) {
        return new EventDecodeException(Fault.MALFORMED, "Event envelope is malformed: " + reason, cause);
    }

    public static EventDecodeException missingField(String field) {
        return new EventDecodeException(Fault.MISSING_FIELD, "Event envelope has no " + field, null);
    }

    public static EventDecodeException unknownCommand(String name) {
        return new EventDecodeException(Fault.UNKNOWN_COMMAND, "Event command '" + name + "' is not registered",
            null);
    }

    public static EventDecodeException invalidValue(String field, String value, Throwable cause) {
        return new EventDecodeException(Fault.INVALID_VALUE,
            "Event envelope field " + field + " has invalid value: " + value, cause);
    }
}
