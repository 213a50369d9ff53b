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

import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Record received from a message topic, carrying an encoded event as its value.
 */
@Value.Immutable
@ImmutablesSupport
public abstract class InboundEventRecord {

    public abstract String getTopic();

    public abstract int getPartition();

    public abstract long getOffset();

    public abstract Optional<String> getKey();

    public abstract Optional<String> getValue();

    public abstract Map<String, String> getHeaders();

    /**
     * Decode the event carried by this record.
     * @param codec codec of the envelope
     * @param filters commands of interest, none to accept any command
     * @return the event, or empty when its command is not among the filters
     * @throws EmptyEventValueException when the record has no value
     * @throws EventDecodeException when the value is not a valid envelope
     */
    public Optional<Event> toEvent(EventCodec codec, Command... filters)
            throws EventDecodeException, EmptyEventValueException {
        if (!getValue().isPresent()) {
            throw new EmptyEventValueException("Record " + getTopic() + "/" + getPartition() + "@" + getOffset()
                    + " has no value");
        }
        Event event = codec.decode(getValue().get());
        if (filters.length > 0 && !Arrays.asList(filters).contains(event.getCommand())) {
            return Optional.empty();
        }
        return Optional.of(event);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableInboundEventRecord.Builder {
    }
}
