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

package org.apache.ldapauth.ldap;

import java.util.Objects;

/**
 * @author Apache LDAP Password Provider Project
 */
public class DirectoryResponse {
    private final DirectoryResponseType type;
    private final DirectoryEntry entry;
    private final String reference;

    protected DirectoryResponse(DirectoryResponseType type, DirectoryEntry entry, String reference) {
        this.type = Objects.requireNonNull(type, "No response type");
        this.entry = entry;
        this.reference = reference;
    }

    public static DirectoryResponse entry(DirectoryEntry entry) {
        return new DirectoryResponse(
                DirectoryResponseType.SEARCH_RESULT_ENTRY, Objects.requireNonNull(entry, "No entry"), null);
    }

    public static DirectoryResponse reference(String url) {
        return new DirectoryResponse(DirectoryResponseType.SEARCH_RESULT_REFERENCE, null, url);
    }

    public static DirectoryResponse done() {
        return new DirectoryResponse(DirectoryResponseType.SEARCH_RESULT_DONE, null, null);
    }

    public DirectoryResponseType getType() {
        return type;
    }

    /**
     * @return The returned entry - {@code null} unless this is a {@link DirectoryResponseType#SEARCH_RESULT_ENTRY}
     */
    public DirectoryEntry getEntry() {
        return entry;
    }

    /**
     * @return The referral URL - {@code null} unless this is a {@link DirectoryResponseType#SEARCH_RESULT_REFERENCE}
     */
    public String getReference() {
        return reference;
    }

    @Override
    public String toString() {
        return getType() + "[" + ((entry != null) ? entry.getDistinguishedName() : reference) + "]";
    }
}
