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

import java.util.Map;

import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * A source of raw configuration values. Values missing from the {@link #getProperties() properties} map are looked up
 * in the parent resolver - if any.
 *
 * @author Apache LDAP Password Provider Project
 * @see    Property
 */
public interface PropertyResolver {
    /**
     * @return The parent resolver to query for missing properties - {@code null} if no parent
     */
    PropertyResolver getParentPropertyResolver();

    /**
     * @return The raw values keyed by property name - never {@code null}. Values are usually strings (from a
     *         {@code .properties} file) or the native YAML types - {@link Property} converts them as needed.
     */
    Map<String, ?> getProperties();

    /**
     * @param  name The property name
     * @return      The first non-{@code null} value found while unwinding the resolvers chain - {@code null} if none
     */
    default Object getPropertyValue(String name) {
        String key = ValidateUtils.checkNotNullAndNotEmpty(name, "No property name");
        for (PropertyResolver r = this; r != null; r = r.getParentPropertyResolver()) {
            Object value = r.getProperties().get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
