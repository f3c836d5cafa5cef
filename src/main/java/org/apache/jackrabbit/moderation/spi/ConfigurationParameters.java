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
package org.apache.jackrabbit.moderation.spi;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * Immutable configuration options with typed access. Values are converted
 * to the type of the requested default, so {@code "true"} can be read as a
 * boolean and {@code "RETRACT_ON_EDIT"} as an enum constant.
 */
public final class ConfigurationParameters {

    public static final ConfigurationParameters EMPTY = new ConfigurationParameters(ImmutableMap.<String, Object>of());

    private final ImmutableMap<String, Object> options;

    private ConfigurationParameters(Map<String, Object> options) {
        this.options = ImmutableMap.copyOf(options);
    }

    /**
     * Creates parameters from a map. Entries with a {@code null} value are
     * ignored.
     */
    @Nonnull
    public static ConfigurationParameters of(@Nonnull Map<?, ?> options) {
        if (options.isEmpty()) {
            return EMPTY;
        }
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        for (Map.Entry<?, ?> entry : options.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                builder.put(entry.getKey().toString(), entry.getValue());
            }
        }
        return new ConfigurationParameters(builder.build());
    }

    @Nonnull
    public static ConfigurationParameters of(@Nonnull String key, @Nonnull Object value) {
        return new ConfigurationParameters(ImmutableMap.of(key, value));
    }

    public boolean contains(@Nonnull String key) {
        return options.containsKey(key);
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    @Nonnull
    public Set<String> keySet() {
        return options.keySet();
    }

    /**
     * Returns the value of {@code key} converted to {@code targetClass}, or
     * {@code defaultValue} if the key is not set.
     *
     * @param targetClass type to convert to, {@code null} to derive it from
     *                    the default value or to return the raw value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    @CheckForNull
    public <T> T getConfigValue(@Nonnull String key, @Nullable T defaultValue,
                                @Nullable Class<T> targetClass) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        Class<?> target = targetClass;
        if (target == null && defaultValue != null) {
            target = typeOf(defaultValue);
        }
        @SuppressWarnings("unchecked")
        T converted = (T) convert(key, value, target);
        return converted;
    }

    /**
     * Returns the value of {@code key} converted to the type of
     * {@code defaultValue}, or {@code defaultValue} if the key is not set.
     */
    @Nonnull
    public <T> T getConfigValue(@Nonnull String key, @Nonnull T defaultValue) {
        T value = getConfigValue(key, defaultValue, null);
        return value == null ? defaultValue : value;
    }

    //------------------------------------------------------------< private >---

    private static Class<?> typeOf(Object value) {
        if (value instanceof Enum) {
            return ((Enum<?>) value).getDeclaringClass();
        }
        return value.getClass();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(String key, Object value, @Nullable Class<?> target) {
        if (target == null || target.isInstance(value)) {
            return value;
        }
        String str = value.toString().trim();
        try {
            if (target == String.class) {
                return value.toString();
            } else if (target == Integer.class || target == int.class) {
                return (value instanceof Number) ? ((Number) value).intValue() : Integer.parseInt(str);
            } else if (target == Long.class || target == long.class) {
                return (value instanceof Number) ? ((Number) value).longValue() : Long.parseLong(str);
            } else if (target == Double.class || target == double.class) {
                return (value instanceof Number) ? ((Number) value).doubleValue() : Double.parseDouble(str);
            } else if (target == Boolean.class || target == boolean.class) {
                return Boolean.parseBoolean(str);
            } else if (target.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) target, str.toUpperCase(Locale.ENGLISH));
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Cannot convert " + key + '=' + value + " to " + target.getName(), e);
        }
        throw new IllegalArgumentException("Unsupported conversion of " + key + " to " + target.getName());
    }

    @Override
    public String toString() {
        return "ConfigurationParameters" + options;
    }
}
