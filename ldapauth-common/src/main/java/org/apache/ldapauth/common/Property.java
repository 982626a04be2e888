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

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * A typed, read-only configuration key. Raw values are looked up in a {@link PropertyResolver} and converted on
 * every access, so a single definition can be shared by any number of configurations.
 *
 * @param  <T> The generic property type
 * @author     Apache LDAP Password Provider Project
 */
public final class Property<T> {
    private final String name;
    private final T defaultValue;
    private final Function<Object, ? extends T> converter;

    private Property(String name, T defaultValue, Function<Object, ? extends T> converter) {
        this.name = ValidateUtils.checkNotNullAndNotEmpty(name, "No name provided");
        this.defaultValue = defaultValue;
        this.converter = Objects.requireNonNull(converter, "No converter");
    }

    public static Property<String> string(String name) {
        return string(name, null);
    }

    public static Property<String> string(String name, String def) {
        return new Property<>(name, def, Object::toString);
    }

    public static Property<Boolean> bool(String name, boolean def) {
        return new Property<>(name, def, PropertyResolverUtils::toBoolean);
    }

    public static Property<Integer> integer(String name) {
        return new Property<>(name, null, PropertyResolverUtils::toInteger);
    }

    public static Property<Integer> integer(String name, int def) {
        return new Property<>(name, def, PropertyResolverUtils::toInteger);
    }

    // CHECKSTYLE:OFF
    public static <E extends Enum<E>> Property<E> enum_(String name, Class<E> type) {
        Objects.requireNonNull(type, "No enum type");
        return new Property<>(name, null, value -> PropertyResolverUtils.toEnum(type, value));
    }
    // CHECKSTYLE:ON

    /**
     * @param  name The property name
     * @param  def  Default value - may be {@code null}
     * @return      A property whose raw value is a number of <U>milliseconds</U>
     */
    public static Property<Duration> duration(String name, Duration def) {
        return new Property<>(name, def, value -> Duration.ofMillis(PropertyResolverUtils.toLong(value)));
    }

    /**
     * @param  name The property name
     * @return      A property whose raw value is a number of <U>seconds</U>
     */
    public static Property<Duration> durationSec(String name) {
        return new Property<>(name, null, value -> Duration.ofSeconds(PropertyResolverUtils.toLong(value)));
    }

    /**
     * @return The key of the raw value in the {@link PropertyResolver#getProperties() properties} map
     */
    public String getName() {
        return name;
    }

    /**
     * @return The pre-defined default - {@code null} if none
     */
    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * @param  resolver The resolver to query
     * @return          {@code true} if the resolver (or one of its parents) holds a value for this property
     */
    public boolean isSet(PropertyResolver resolver) {
        return resolver.getPropertyValue(getName()) != null;
    }

    /**
     * @param  resolver                 The resolver to query
     * @return                          The configured value - {@code null} if none, regardless of the default
     * @throws IllegalArgumentException if the configured value cannot be converted
     */
    public T getOrNull(PropertyResolver resolver) {
        return getOrCustomDefault(resolver, null);
    }

    /**
     * @param  resolver                 The resolver to query
     * @param  def                      Value to use if none configured - the pre-defined default is ignored
     * @return                          The configured or the specified default value
     * @throws IllegalArgumentException if the configured value cannot be converted
     */
    public T getOrCustomDefault(PropertyResolver resolver, T def) {
        Object value = resolver.getPropertyValue(getName());
        if (value == null) {
            return def;
        }

        try {
            return converter.apply(value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    "Invalid " + getName() + " value (" + value + "): " + e.getMessage(), e);
        }
    }

    /**
     * @param  resolver                 The resolver to query
     * @return                          The configured value or the pre-defined default one
     * @throws NoSuchElementException   if neither is available
     * @throws IllegalArgumentException if the configured value cannot be converted
     */
    public T getRequired(PropertyResolver resolver) {
        T value = getOrCustomDefault(resolver, getDefaultValue());
        if (value == null) {
            throw new NoSuchElementException("No value for " + getName());
        }
        return value;
    }

    @Override
    public String toString() {
        return "Property[" + getName() + "]";
    }
}
