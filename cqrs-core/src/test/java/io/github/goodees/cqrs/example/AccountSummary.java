package io.github.goodees.cqrs.example;

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
import io.github.goodees.cqrs.core.Event;
import io.github.goodees.cqrs.core.FieldSet;
import io.github.goodees.cqrs.core.projection.Projection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Account with name of its owner, which comes from events of {@link Owner}.
 *
 * <p>Owner events may arrive before the account's own events set {@code ownerId}, so owner data are kept per owner
 * id and looked up through {@code ownerId} when read.</p>
 */
public class AccountSummary extends Projection {
    static final FieldSet<AccountSummary> FIELDS = FieldSet.forType(AccountSummary.class)
            .field("name", String.class, AccountSummary::setName)
            .field("ownerId", UUID.class, AccountSummary::setOwnerId)
            .build();

    private String name;
    private UUID ownerId;
    private Map<UUID, OwnerView> owners = new LinkedHashMap<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public Map<UUID, OwnerView> getOwners() {
        return owners;
    }

    public void setOwners(Map<UUID, OwnerView> owners) {
        this.owners = owners == null ? new LinkedHashMap<>() : new LinkedHashMap<>(owners);
    }

    @JsonIgnore
    public String getOwnerName() {
        OwnerView owner = currentOwner();
        return owner == null ? null : owner.getName();
    }

    @JsonIgnore
    public int getOwnerEvents() {
        OwnerView owner = currentOwner();
        return owner == null ? 0 : owner.getEvents();
    }

    private OwnerView currentOwner() {
        return ownerId == null ? null : owners.get(ownerId);
    }

    @Override
    protected void updateState(Event event) {
        if (AccountCommands.CREATE_OWNER.equals(event.getCommand())
                || AccountCommands.RENAME_OWNER.equals(event.getCommand())) {
            OwnerView owner = owners.computeIfAbsent(event.getAggregateRootId(), id -> new OwnerView());
            event.getPayload().map(p -> p.path("name").asText(null)).ifPresent(owner::setName);
            owner.setEvents(owner.getEvents() + 1);
        } else {
            FIELDS.merge(this, event.getPayload().orElse(null));
        }
    }

    public static class OwnerView {
        private String name;
        private int events;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getEvents() {
            return events;
        }

        public void setEvents(int events) {
            this.events = events;
        }
    }
}
