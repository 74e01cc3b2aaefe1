/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cimrepo.commons.properties;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads a tunable from a system property.
 * <p>
 * An unset property yields the default and is logged at TRACE. A value that
 * does not parse or fails validation is logged at ERROR and replaced by the
 * default. A value that differs from the default is logged at INFO.
 * <p>
 * Supported types are {@link Boolean}, {@link Integer}, {@link Long} and
 * {@link String}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private Predicate<T> validator = v -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@NotNull String propName, @NotNull T defaultValue) {
        this.propName = checkNotNull(propName, "propName must be non-null");
        this.defaultValue = checkNotNull(defaultValue, "defaultValue must be non-null");
        this.parser = parserFor(defaultValue);
    }

    public static <U> SystemPropertySupplier<U> create(@NotNull String propName, @NotNull U defaultValue) {
        return new SystemPropertySupplier<>(propName, defaultValue);
    }

    /**
     * Log to {@code log} instead of this class's logger.
     */
    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    public SystemPropertySupplier<T> validateWith(@NotNull Predicate<T> validator) {
        this.validator = checkNotNull(validator);
        return this;
    }

    /**
     * Replaces {@code System.getProperty(String)}, for tests.
     */
    protected SystemPropertySupplier<T> usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
        this.sysPropReader = checkNotNull(sysPropReader);
        return this;
    }

    @Override
    public T get() {
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return defaultValue;
        }
        log.trace("System property {} set to '{}'", propName, value);

        T result = defaultValue;
        try {
            T parsed = parser.apply(value.trim());
            if (validator.test(parsed)) {
                result = parsed;
            } else {
                log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            }
        } catch (NumberFormatException e) {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
        }
        if (!result.equals(defaultValue)) {
            log.info("System property {} found to be '{}'", propName, result);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> parserFor(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) Boolean.valueOf(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v);
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v);
        }
        checkArgument(defaultValue instanceof String,
                "expects a default value of Boolean, Integer, Long or String, but got: %s", defaultValue.getClass());
        return v -> (T) v;
    }
}
