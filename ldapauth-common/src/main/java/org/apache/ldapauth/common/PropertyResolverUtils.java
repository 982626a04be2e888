/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.ldapauth.common;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.ldapauth.common.util.GenericUtils;

/**
 * Conversions of raw configuration values and {@link PropertyResolver} factories.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class PropertyResolverUtils {
    /**
     * Case <U>insensitive</U> values considered {@code true} by {@link #parseBoolean(String)}
     */
    public static final NavigableSet<String> TRUE_VALUES = caseInsensitiveSet("true", "t", "yes", "y", "on");

    /**
     * Case <U>insensitive</U> values considered {@code false} by {@link #parseBoolean(String)}
     */
    public static final NavigableSet<String> FALSE_VALUES = caseInsensitiveSet("false", "f", "no", "n", "off");

    /** Separator used when flattening nested configuration maps */
    public static final char NESTED_KEY_SEPARATOR = '.';

    private PropertyResolverUtils() {
        throw new UnsupportedOperationException("No instance allowed");
    }

    private static NavigableSet<String> caseInsensitiveSet(String... values) {
        NavigableSet<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        set.addAll(Arrays.asList(values));
        return Collections.unmodifiableNavigableSet(set);
    }

    /**
     * @param  value                 A {@link Number} or a string holding a decimal value - may be {@code null}
     * @return                       The converted value - {@code null} if {@code null} value
     * @throws NumberFormatException if malformed value
     */
    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Number) {
            return ((Number) value).longValue();
        } else {
            return Long.valueOf(value.toString().trim());
        }
    }

    /**
     * @param  value                 A {@link Number} or a string holding a decimal value - may be {@code null}
     * @return                       The converted value - {@code null} if {@code null} value
     * @throws NumberFormatException if malformed value or out of the {@code int} range
     */
    public static Integer toInteger(Object value) {
        if (value == null) {
            return null;
        } else if ((value instanceof Integer) || (value instanceof Short) || (value instanceof Byte)) {
            return ((Number) value).intValue();
        } else {
            return Integer.valueOf(value.toString().trim());
        }
    }

    /**
     * @param  value                         A {@link Boolean} or one of the {@link #TRUE_VALUES} / {@link #FALSE_VALUES}
     * @return                               The converted value - {@code null} if {@code null} or empty string
     * @throws UnsupportedOperationException if the value is neither a {@link Boolean} nor a string (e.g., a number)
     * @throws IllegalArgumentException      if an unknown string value
     */
    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof CharSequence) {
            return parseBoolean(value.toString().trim());
        } else {
            throw new UnsupportedOperationException(
                    "Cannot convert " + value.getClass().getSimpleName() + "[" + value + "] to boolean");
        }
    }

    /**
     * @param  value                    The value to parse
     * @return                          The result - {@code null} if value is {@code null}/empty
     * @throws IllegalArgumentException if not one of the (case <U>insensitive</U>) known values
     */
    public static Boolean parseBoolean(String value) {
        if (GenericUtils.isEmpty(value)) {
            return null;
        } else if (TRUE_VALUES.contains(value)) {
            return Boolean.TRUE;
        } else if (FALSE_VALUES.contains(value)) {
            return Boolean.FALSE;
        } else {
            throw new IllegalArgumentException("Unknown boolean value: '" + value + "'");
        }
    }

    /**
     * @param  <E>                      Type of enumerated value
     * @param  enumType                 The enumerated class type
     * @param  value                    An instance of the type or its (case <U>insensitive</U>) name
     * @return                          The matching value - {@code null} if {@code null} value
     * @throws IllegalArgumentException if no matching value
     */
    public static <E extends Enum<E>> E toEnum(Class<E> enumType, Object value) {
        if (value == null) {
            return null;
        } else if (enumType.isInstance(value)) {
            return enumType.cast(value);
        }

        String name = value.toString().trim();
        E[] available = enumType.getEnumConstants();
        for (E v : available) {
            if (name.equalsIgnoreCase(v.name())) {
                return v;
            }
        }

        throw new IllegalArgumentException(
                "No " + enumType.getSimpleName() + " named '" + name + "' - expected one of " + Arrays.toString(available));
    }

    public static PropertyResolver toPropertyResolver(Properties props) {
        Map<String, Object> values = new TreeMap<>();
        if (props != null) {
            for (String key : props.stringPropertyNames()) {
                values.put(key, props.getProperty(key));
            }
        }
        return toPropertyResolver(values);
    }

    public static PropertyResolver toPropertyResolver(Map<String, ?> props) {
        return toPropertyResolver(props, null);
    }

    /**
     * @param  props  The properties map - may be {@code null}
     * @param  parent The parent resolver - may be {@code null}
     * @return        A resolver wrapping the map - changes to the map are visible through it
     */
    public static PropertyResolver toPropertyResolver(Map<String, ?> props, PropertyResolver parent) {
        Map<String, ?> effective = (props == null) ? Collections.emptyMap() : props;
        return new PropertyResolver() {
            @Override
            public PropertyResolver getParentPropertyResolver() {
                return parent;
            }

            @Override
            public Map<String, ?> getProperties() {
                return effective;
            }

            @Override
            public String toString() {
                return Objects.toString(effective);
            }
        };
    }

    /**
     * Flattens a hierarchical configuration (e.g., as loaded from a YAML document) so that nested keys are joined using
     * the {@link #NESTED_KEY_SEPARATOR} - e.g., <code>{attributes={uid=cn}}</code> becomes
     * <code>{attributes.uid=cn}</code>. {@code null} values are skipped, but an empty section is kept under its own key
     * since its presence alone may be meaningful.
     *
     * @param  config The hierarchical configuration - may be {@code null}/empty
     * @return        The flattened {@link Map} - never {@code null}
     */
    public static Map<String, Object> flatten(Map<String, ?> config) {
        Map<String, Object> result = new TreeMap<>();
        flatten(null, config, result);
        return result;
    }

    private static void flatten(String prefix, Map<?, ?> config, Map<String, Object> result) {
        if (GenericUtils.isEmpty(config)) {
            return;
        }

        for (Map.Entry<?, ?> ce : config.entrySet()) {
            String key = Objects.toString(ce.getKey(), null);
            Object value = ce.getValue();
            if (GenericUtils.isEmpty(key) || (value == null)) {
                continue;
            }

            String name = (prefix == null) ? key : prefix + NESTED_KEY_SEPARATOR + key;
            if (!(value instanceof Map<?, ?>)) {
                result.put(name, value);
            } else if (((Map<?, ?>) value).isEmpty()) {
                result.put(name, Collections.emptyMap());
            } else {
                flatten(name, (Map<?, ?>) value, result);
            }
        }
    }
}
