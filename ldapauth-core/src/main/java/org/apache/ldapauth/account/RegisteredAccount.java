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


package org.apache.ldapauth.account;

import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * Result of provisioning a new account
 *
 * @author Apache LDAP Password Provider Project
 */
public class RegisteredAccount {
    private final String userId;
    private final String accessToken;

    public RegisteredAccount(String userId, String accessToken) {
        this.userId = ValidateUtils.checkNotNullAndNotEmpty(userId, "No user id");
        this.accessToken = accessToken;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * @return The access token issued on registration - may be {@code null}
     */
    public String getAccessToken() {
        return accessToken;
    }

    @Override
    public String toString() {
        // never log the token itself
        return getClass().getSimpleName() + "[" + getUserId() + "]";
    }
}
