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


package org.apache.ldapauth.auth;

import java.util.Locale;
import java.util.Objects;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * A normalized user identifier - e.g., {@code @alice:example.com} - and its local part ({@code alice})
 *
 * @author Apache LDAP Password Provider Project
 */
public final class UserIdentifier {
    public static final char SIGIL = '@';
    public static final char DOMAIN_SEPARATOR = ':';

    private final String userId;
    private final String localPart;

    private UserIdentifier(String userId, String localPart) {
        this.userId = userId;
        this.localPart = localPart;
    }

    /**
     * @return The lower-cased full identifier
     */
    public String getUserId() {
        return userId;
    }

    public String getLocalPart() {
        return localPart;
    }

    /**
     * @param  rawId The identifier as received from the login client
     * @return       The parsed identifier - {@code null} if no usable local part
     */
    public static UserIdentifier parse(String rawId) {
        String id = GenericUtils.trimToEmpty(rawId).toLowerCase(Locale.ROOT);
        if (id.isEmpty()) {
            return null;
        }

        int pos = id.indexOf(DOMAIN_SEPARATOR);
        String localPart = (pos < 0) ? id : id.substring(0, pos);
        if ((!localPart.isEmpty()) && (localPart.charAt(0) == SIGIL)) {
            localPart = localPart.substring(1);
        }

        return localPart.isEmpty() ? null : new UserIdentifier(id, localPart);
    }

    public static UserIdentifier of(String userId, String localPart) {
        return new UserIdentifier(
                ValidateUtils.checkNotNullAndNotEmpty(userId, "No user id"),
                ValidateUtils.checkNotNullAndNotEmpty(localPart, "No local part"));
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, localPart);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        UserIdentifier other = (UserIdentifier) obj;
        return Objects.equals(userId, other.userId) && Objects.equals(localPart, other.localPart);
    }

    @Override
    public String toString() {
        return userId;
    }
}
