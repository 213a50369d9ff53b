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
import io.github.goodees.cqrs.core.config.ConfigurationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks text properties of aggregates against their maximum lengths.
 *
 * <p>Maximum of a property is resolved in order: explicit length declared in rules, value of a named configuration
 * key, default maximum of the validator. Configuration key that is absent or not a number falls through to the
 * default; if there is no default either, the property is not checked. Null and empty values never fail.</p>
 *
 * <p>Only text properties declared in {@link TypeRules} are checked. Instances of types without registered rules
 * pass, which is logged at warn once per type.</p>
 *
 * <p>Default maximum is read from configuration key {@link ValidatorConfiguration#getDefaultMaxStringLengthKey()}
 * when the validator is created.</p>
 */
public class AggregateValidator {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ValidationRegistry registry;
    private final ConfigurationProvider configuration;
    private final ValidatorConfiguration validatorConfiguration;
    private final Set<String> reportedKeys = ConcurrentHashMap.newKeySet();
    private final Set<Class<?>> reportedTypes = ConcurrentHashMap.newKeySet();

    public AggregateValidator(ValidationRegistry registry, ConfigurationProvider configuration) {
        this(registry, configuration, new ValidatorConfiguration());
    }

    public AggregateValidator(ValidationRegistry registry, ConfigurationProvider configuration,
            ValidatorConfiguration validatorConfiguration) {
        this.registry = Objects.requireNonNull(registry, "Validation registry must be provided");
        this.configuration = Objects.requireNonNull(configuration, "Configuration provider must be provided");
        this.validatorConfiguration = Objects.requireNonNull(validatorConfiguration,
            "Validator configuration must be provided");
        readInt(validatorConfiguration.getDefaultMaxStringLengthKey())
                .ifPresent(validatorConfiguration::setDefaultMaxStringLengthValue);
    }

    public ValidatorConfiguration getConfiguration() {
        return validatorConfiguration;
    }

    /**
     * Validate text properties of an aggregate.
     * @param aggregate instance to validate
     * @return all violations, empty list for valid instance
     * @throws NullPointerException when aggregate is null
     */
    public List<ValidationError> validate(Object aggregate) {
        Objects.requireNonNull(aggregate, "aggregate");
        Class<?> type = aggregate.getClass();
        Optional<TypeRules<?>> rules = registry.rulesFor(type);
        if (!rules.isPresent()) {
            if (reportedTypes.add(type)) {
                logger.warn("No validation rules registered for {}, text lengths are not checked", type.getName());
            }
            return Collections.emptyList();
        }
        List<ValidationError> errors = new ArrayList<>();
        for (TypeRules.LengthRule<?> rule : rules.get().getLengthRules()) {
            check(rule.getProperty(), rule.getMaxLength(), rule.valueOf(aggregate), errors);
        }
        return errors;
    }

    /**
     * Validate and raise exception when invalid.
     * @param aggregate instance to validate
     * @throws ValidationException when any property violates its maximum length
     */
    public void validateOrThrow(Object aggregate) {
        List<ValidationError> errors = validate(aggregate);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Apply text rules of a type to a JSON document, such as event payload. Only textual properties present in
     * the document are checked.
     * @param type type whose rules apply
     * @param document document to check
     * @return all violations
     */
    public List<ValidationError> validateDocument(Class<?> type, JsonNode document) {
        Objects.requireNonNull(type, "type");
        if (document == null || !document.isObject()) {
            return Collections.emptyList();
        }
        List<ValidationError> errors = new ArrayList<>();
        registry.rulesFor(type).ifPresent(rules -> {
            for (TypeRules.LengthRule<?> rule : rules.getLengthRules()) {
                JsonNode value = document.get(rule.getProperty());
                if (value != null && value.isTextual()) {
                    check(rule.getProperty(), rule.getMaxLength(), value.textValue(), errors);
                }
            }
        });
        return errors;
    }

    private void check(String property, MaxLength maxLength, String value, List<ValidationError> errors) {
        if (value == null || value.isEmpty()) {
            return;
        }
        OptionalInt max = resolve(property, maxLength);
        if (max.isPresent() && value.length() > max.getAsInt()) {
            errors.add(ValidationError.of(property,
                "Length " + value.length() + " exceeds max " + max.getAsInt() + "."));
        }
    }

    OptionalInt resolve(String property, MaxLength maxLength) {
        switch (maxLength.getSource()) {
            case LITERAL:
                return OptionalInt.of(maxLength.getLength());
            case CONFIG_KEY:
                OptionalInt configured = readInt(maxLength.getConfigKey());
                if (configured.isPresent()) {
                    return configured;
                }
                if (reportedKeys.add(maxLength.getConfigKey())) {
                    logger.warn("Max length of {} configured by key {} which has no usable value, using default",
                        property, maxLength.getConfigKey());
                }
                return validatorConfiguration.getDefaultMaxStringLengthValue();
            default:
                return validatorConfiguration.getDefaultMaxStringLengthValue();
        }
    }

    private OptionalInt readInt(String key) {
        Optional<String> value = configuration.get(key);
        if (!value.isPresent()) {
            return OptionalInt.empty();
        }
        try {
            int parsed = Integer.parseInt(value.get().trim());
            return parsed < 0 ? OptionalInt.empty() : OptionalInt.of(parsed);
        } catch (NumberFormatException e) {
            logger.warn("Configuration value of {} is not a number: {}", key, value.get());
            return OptionalInt.empty();
        }
    }
}
