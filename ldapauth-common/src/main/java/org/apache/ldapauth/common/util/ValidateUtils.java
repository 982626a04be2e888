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

/**
 * Argument and state checks. Messages are {@link String#format(String, Object...)} patterns and are only formatted
 * when the check fails.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class ValidateUtils {
    private ValidateUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  <T>                      Type of checked value
     * @param  t                        The value
     * @param  message                  Message pattern
     * @param  args                     Message arguments
     * @return                          The value
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNull(T t, String message, Object... args) {
        checkTrue(t != null, message, args);
        return t;
    }

    /**
     * @param  s                        The value
     * @param  message                  Message pattern
     * @param  args                     Message arguments
     * @return                          The <U>trimmed</U> value
     * @throws IllegalArgumentException if the value is {@code null} or blank
     */
    public static String checkNotNullAndNotEmpty(String s, String message, Object... args) {
        String trimmed = checkNotNull(s, message, args).trim();
        checkTrue(!trimmed.isEmpty(), message, args);
        return trimmed;
    }

    public static void checkTrue(boolean flag, String message, Object... args) {
        if (!flag) {
            throw new IllegalArgumentException(format(message, args));
        }
    }

    public static void checkState(boolean flag, String message, Object... args) {
        if (!flag) {
            throw new IllegalStateException(format(message, args));
        }
    }

    private static String format(String message, Object... args) {
        return ((args == null) || (args.length == 0)) ? message : String.format(message, args);
    }
}
