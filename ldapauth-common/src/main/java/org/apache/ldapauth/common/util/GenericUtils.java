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

package org.apache.ldapauth.common.util;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Null-safe helpers for the strings and collections that come back from configuration files and directory entries.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class GenericUtils {
    public static final String[] EMPTY_STRING_ARRAY = {};

    private GenericUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  s The value - may be {@code null}
     * @return   The trimmed value - empty if {@code null}
     */
    public static String trimToEmpty(String s) {
        return (s == null) ? "" : s.trim();
    }

    public static int length(CharSequence cs) {
        return (cs == null) ? 0 : cs.length();
    }

    public static boolean isEmpty(CharSequence cs) {
        return length(cs) == 0;
    }

    public static boolean isNotEmpty(CharSequence cs) {
        return length(cs) > 0;
    }

    public static boolean isEmpty(Collection<?> c) {
        return (c == null) || c.isEmpty();
    }

    public static boolean isEmpty(Map<?, ?> m) {
        return (m == null) || m.isEmpty();
    }

    public static boolean isNotEmpty(Map<?, ?> m) {
        return !isEmpty(m);
    }

    /**
     * @param  values    The values to join - {@code null} values are rendered as {@code "null"}
     * @param  separator The separator placed between consecutive values
     * @return           The joined string - empty if no values
     */
    public static String join(Iterable<?> values, CharSequence separator) {
        if (values == null) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (Object v : values) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(Objects.toString(v));
        }
        return sb.toString();
    }
}
