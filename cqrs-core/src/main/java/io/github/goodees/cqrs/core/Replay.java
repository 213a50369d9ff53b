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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Folding events into state in replay order: ascending timestamp, ties broken by event id.
 */
public final class Replay {
    public static final Comparator<Event> REPLAY_ORDER = Comparator.comparing(Event::getTimestamp)
            .thenComparing(Event::getId);

    private Replay() {
    }

    public static List<Event> ordered(Collection<Event> events) {
        List<Event> result = new ArrayList<>(events);
        result.sort(REPLAY_ORDER);
        return result;
    }

    /**
     * Apply all events in replay order.
     * @param target object to apply events to
     * @param events events in any order
     * @param <T> type of target
     * @return the target
     */
    public static <T extends EventSourcedObject> T replay(T target, Collection<Event> events) {
        for (Event event : ordered(events)) {
            target.apply(event);
        }
        return target;
    }

    /**
     * Apply only events of target's own stream past its last applied position, and all other events. Replaying a
     * prefix of history and resuming with the full history results in the same state as replaying it at once.
     * @param target object to apply events to
     * @param events events in any order
     * @param <T> type of target
     * @return the target
     */
    public static <T extends EventSourcedObject> T resume(T target, Collection<Event> events) {
        for (Event event : ordered(events)) {
            boolean ownStream = target.getId() == null || target.getId().equals(event.getAggregateRootId());
            if (!ownStream || !target.hasApplied(event)) {
                target.apply(event);
            }
        }
        return target;
    }
}
