/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.quill.commons.properties;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a typed configuration value from a system property.
 * <ul>
 * <li>TRACE level logging of the lookup
 * <li>ERROR level logging when the value does not parse or is rejected by
 * the validator, in which case the default is used
 * <li>INFO (or the configured level) when the effective value differs from
 * the default
 * </ul>
 * Supported types are {@link Boolean}, {@link Integer}, {@link Long} and
 * {@link String}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private String successLogLevel = "INFO";
    private Predicate<T> validator = v -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@NotNull String propName, @NotNull T defaultValue) {
        this.propName = checkNotNull(propName, "propName must be non-null");
        this.defaultValue = checkNotNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    public static <U> SystemPropertySupplier<U> create(@NotNull String propName, @NotNull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    public SystemPropertySupplier<T> validateWith(@NotNull Predicate<T> validator) {
        this.validator = checkNotNull(validator);
        return this;
    }

    /**
     * Level of the message logged when a non-default value is in force
     * ("TRACE", "DEBUG", "INFO", "WARN" or "ERROR").
     */
    public SystemPropertySupplier<T> logSuccessAs(@NotNull String level) {
        switch (checkNotNull(level)) {
            case "TRACE":
            case "DEBUG":
            case "INFO":
            case "WARN":
            case "ERROR":
                this.successLogLevel = level;
                return this;
            default:
                throw new IllegalArgumentException("unsupported log level: " + level);
        }
    }

    /**
     * <em>For unit testing</em>: replaces {@code System.getProperty(String)}.
     */
    public SystemPropertySupplier<T> usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
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
            T parsed = parser.apply(value);
            if (validator.test(parsed)) {
                result = parsed;
            } else {
                log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            }
        } catch (NumberFormatException e) {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
        }

        if (!result.equals(defaultValue)) {
            logSuccess(String.format("System property %s found to be '%s'", propName, result));
        }
        return result;
    }

    private void logSuccess(String msg) {
        switch (successLogLevel) {
            case "TRACE":
                log.trace(msg);
                break;
            case "DEBUG":
                log.debug(msg);
                break;
            case "WARN":
                log.warn(msg);
                break;
            case "ERROR":
                log.error(msg);
                break;
            default:
                log.info(msg);
                break;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) Boolean.valueOf(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v.trim());
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v.trim());
        } else if (defaultValue instanceof String) {
            return v -> (T) v;
        }
        throw new IllegalArgumentException(String.format(
                "expects a defaultValue of Boolean, Integer, Long, or String, but got: %s",
                defaultValue.getClass()));
    }
}
