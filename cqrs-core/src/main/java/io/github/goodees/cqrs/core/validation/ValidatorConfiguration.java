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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Settings of {@link AggregateValidator}. The default maximum string length can be replaced at runtime.
 */
public class ValidatorConfiguration {
    public static final String DEFAULT_MAX_STRING_LENGTH_KEY = "cqrs.validation.defaultMaxStringLength";
    public static final int DEFAULT_MAX_STRING_LENGTH = 1024;

    private final String defaultMaxStringLengthKey;
    private volatile Integer defaultMaxStringLengthValue;

    public ValidatorConfiguration() {
        this(DEFAULT_MAX_STRING_LENGTH_KEY, DEFAULT_MAX_STRING_LENGTH);
    }

    /**
     * Create configuration.
     * @param defaultMaxStringLengthKey configuration key overriding the default at validator construction
     * @param defaultMaxStringLengthValue default maximum, null for no default limit
     */
    public ValidatorConfiguration(String defaultMaxStringLengthKey, Integer defaultMaxStringLengthValue) {
        this.defaultMaxStringLengthKey = Objects.requireNonNull(defaultMaxStringLengthKey,
            "Default max string length key must be provided");
        this.defaultMaxStringLengthValue = defaultMaxStringLengthValue;
    }

    public String getDefaultMaxStringLengthKey() {
        return defaultMaxStringLengthKey;
    }

    public OptionalInt getDefaultMaxStringLengthValue() {
        Integer value = defaultMaxStringLengthValue;
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public void setDefaultMaxStringLengthValue(Integer defaultMaxStringLengthValue) {
        this.defaultMaxStringLengthValue = defaultMaxStringLengthValue;
    }
}
