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

import java.util.Objects;

import org.apache.ldapauth.ldap.DirectoryEntry;

/**
 * Outcome of a single authentication attempt. Only {@link #isAccepted()} is exposed to the login client - the reason
 * is for logging and testing.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class AuthResult {
    public enum Kind {
        ACCEPTED,
        REJECTED,
        ERROR;
    }

    private final Kind kind;
    private final String userId;
    private final String localPart;
    private final DirectoryEntry entry;
    private final String reason;
    private final Throwable cause;

    private AuthResult(
            Kind kind, String userId, String localPart, DirectoryEntry entry, String reason, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "No kind");
        this.userId = userId;
        this.localPart = localPart;
        this.entry = entry;
        this.reason = reason;
        this.cause = cause;
    }

    public static AuthResult accepted(String userId, String localPart, DirectoryEntry entry) {
        return new AuthResult(Kind.ACCEPTED, userId, localPart, entry, null, null);
    }

    public static AuthResult rejected(String reason) {
        return new AuthResult(Kind.REJECTED, null, null, null, reason, null);
    }

    public static AuthResult error(String reason, Throwable cause) {
        return new AuthResult(Kind.ERROR, null, null, null, reason, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }

    /**
     * @return The effective user id - {@code null} unless accepted
     */
    public String getUserId() {
        return userId;
    }

    public String getLocalPart() {
        return localPart;
    }

    public DirectoryEntry getEntry() {
        return entry;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isAccepted() ? kind + "[" + userId + "]" : kind + "[" + reason + "]";
    }
}
