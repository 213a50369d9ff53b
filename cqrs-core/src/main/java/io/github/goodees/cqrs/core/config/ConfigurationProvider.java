package io.github.goodees.cqrs.core.config;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Source of configuration values. Absent keys yield empty result, lookups never fail.
 */
@FunctionalInterface
public interface ConfigurationProvider {

    Optional<String> get(String key);

    static ConfigurationProvider empty() {
        return key -> Optional.empty();
    }

    static ConfigurationProvider of(Map<String, String> values) {
        Map<String, String> copy = Collections.unmodifiableMap(new HashMap<>(values));
        return key -> Optional.ofNullable(copy.get(key));
    }

    static ConfigurationProvider fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return key -> Optional.ofNullable(properties.getProperty(key));
    }

    static ConfigurationProvider systemProperties() {
        return key -> Optional.ofNullable(System.getProperty(key));
    }

    /**
     * Properties file loaded from classpath. Missing resource results in empty provider.
     * @param resource resource name
     * @return provider of the file's values
     * @throws UncheckedIOException when resource exists, but cannot be read
     */
    static ConfigurationProvider classpath(String resource) {
        Logger logger = LoggerFactory.getLogger(ConfigurationProvider.class);
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigurationProvider.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("Configuration resource {} not found", resource);
                return empty();
            }
            Properties properties = new Properties();
            properties.load(in);
            logger.debug("Loaded {} configuration values from {}", properties.size(), resource);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration resource " + resource, e);
        }
    }

    /**
     * Layered configuration, first provider having a value wins.
     * @param providers providers in order of precedence
     * @return combined provider
     */
    static ConfigurationProvider firstOf(ConfigurationProvider... providers) {
        List<ConfigurationProvider> layers = Arrays.asList(providers.clone());
        return key -> {
            for (ConfigurationProvider p : layers) {
                Optional<String> value = p.get(key);
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        };
    }
}
