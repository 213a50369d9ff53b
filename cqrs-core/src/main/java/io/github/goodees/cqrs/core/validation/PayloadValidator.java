package io.github.goodees.cqrs.core.validation;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.cqrs.core.Command;
import io.github.goodees.cqrs.core.Identifiers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks event payload against the rules of the aggregate type the event applies to.
 *
 * <p>Reported violations: null payload for command that does not allow it; properties outside of declared
 * property set; required properties that are missing, null, or default when they must not be; text properties
 * exceeding maximum length, when an {@link AggregateValidator} is supplied.</p>
 */
public class PayloadValidator {
    private final ValidationRegistry registry;
    private final AggregateValidator lengthValidator;

    public PayloadValidator(ValidationRegistry registry) {
        this(registry, null);
    }

    /**
     * Create validator.
     * @param registry rules
     * @param lengthValidator validator of text lengths, may be null
     */
    public PayloadValidator(ValidationRegistry registry, AggregateValidator lengthValidator) {
        this.registry = Objects.requireNonNull(registry, "Validation registry must be provided");
        this.lengthValidator = lengthValidator;
    }

    /**
     * Collect violations of a payload.
     * @param type aggregate type
     * @param command command of the event
     * @param payload the payload, may be null
     * @return all violations
     */
    public List<ValidationError> check(Class<?> type, Command command, ObjectNode payload) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(command, "command");
        List<ValidationError> errors = new ArrayList<>();
        if (payload == null) {
            if (!command.allowsNullPayload()) {
                errors.add(ValidationError.of("payload", "Payload cannot be null for command '" + command + "'."));
            }
            return errors;
        }
        Optional<? extends TypeRules<?>> rules = registry.rulesFor(type);
        if (rules.isPresent()) {
            checkProperties(rules.get(), payload, errors);
            checkRequired(rules.get(), command, payload, errors);
        }
        if (lengthValidator != null) {
            errors.addAll(lengthValidator.validateDocument(type, payload));
        }
        return errors;
    }

    /**
     * Validate payload.
     * @param type aggregate type
     * @param command command of the event
     * @param payload the payload, may be null
     * @throws ValidationException with all violations found
     */
    public void validate(Class<?> type, Command command, ObjectNode payload) {
        List<ValidationError> errors = check(type, command, payload);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void checkProperties(TypeRules<?> rules, ObjectNode payload, List<ValidationError> errors) {
        Optional<Set<String>> declared = rules.getProperties();
        if (!declared.isPresent()) {
            return;
        }
        for (Iterator<String> it = payload.fieldNames(); it.hasNext();) {
            String name = it.next();
            if (!declared.get().contains(name)) {
                errors.add(ValidationError.of(name, "Invalid property '" + name + "' found in payload."));
            }
        }
    }

    private void checkRequired(TypeRules<?> rules, Command command, ObjectNode payload, List<ValidationError> errors) {
        for (RequiredField field : rules.getRequiredFields()) {
            if (!field.appliesTo(command)) {
                continue;
            }
            String name = field.getProperty();
            JsonNode value = payload.get(name);
            if (value == null || value.isMissingNode()) {
                errors.add(ValidationError.of(name,
                    "Missing required property '" + name + "' for command '" + command + "'."));
            } else if (value.isNull()) {
                errors.add(ValidationError.of(name,
                    "Property '" + name + "' cannot be null for command '" + command + "'."));
            } else if (field.isNotDefault() && isDefault(value)) {
                errors.add(ValidationError.of(name,
                    "Property '" + name + "' cannot have default value for command '" + command + "'."));
            }
        }
    }

    private static boolean isDefault(JsonNode value) {
        if (value.isTextual()) {
            String text = value.textValue();
            return text.isEmpty() || Identifiers.tryParse(text).map(Identifiers::isNil).orElse(false);
        }
        if (value.isNumber()) {
            return value.decimalValue().signum() == 0;
        }
        if (value.isBoolean()) {
            return !value.booleanValue();
        }
        return false;
    }
}
