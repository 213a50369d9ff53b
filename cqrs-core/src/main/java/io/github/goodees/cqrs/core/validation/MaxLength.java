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

/**
 * Where the maximum length of a text property comes from. Resolved by {@link AggregateValidator} in order:
 * literal value, named configuration key, validator default.
 */
public final class MaxLength {
    enum Source {
        LITERAL, CONFIG_KEY, DEFAULT
    }

    private static final MaxLength DEFAULT = new MaxLength(Source.DEFAULT, 0, null);

    private final Source source;
    private final int length;
    private final String configKey;

    private MaxLength(Source source, int length, String configKey) {
        this.source = source;
        this.length = length;
        this.configKey = configKey;
    }

    public static MaxLength of(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Max length cannot be negative: " + length);
        }
        return new MaxLength(Source.LITERAL, length, null);
    }

    public static MaxLength fromConfig(String configKey) {
        Objects.requireNonNull(configKey, "configKey");
        return new MaxLength(Source.CONFIG_KEY, 0, configKey);
    }

    public static MaxLength byDefault() {
        return DEFAULT;
    }

    Source getSource() {
        return source;
    }

    int getLength() {
        return length;
    }

    String getConfigKey() {
        return configKey;
    }

    @Override
    public String toString() {
        switch (source) {
            case LITERAL:
                return "MaxLength{" + length + "}";
            case CONFIG_KEY:
                return "MaxLength{config=" + configKey + "}";
            default:
                return "MaxLength{default}";
        }
    }
}
