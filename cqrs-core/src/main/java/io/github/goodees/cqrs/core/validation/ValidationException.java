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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a payload or aggregate violates its declared rules. Carries all violations found, in the order
 * they were detected.
 */
public class ValidationException extends RuntimeException {
    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<String> getAllErrorMessages() {
        return errors.stream().map(ValidationError::getMessage).collect(Collectors.toList());
    }

    /**
     * Messages grouped by property, properties in order of their first violation.
     * @return map from property name to its messages
     */
    public Map<String, List<String>> getErrorsByProperty() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            result.computeIfAbsent(error.getProperty(), k -> new ArrayList<>()).add(error.getMessage());
        }
        return result;
    }

    private static String buildMessage(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Validation failed with no specific errors.";
        }
        return "Validation failed: "
                + errors.stream().map(ValidationError::getMessage).collect(Collectors.joining(" "));
    }
}
