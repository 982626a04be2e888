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

import java.util.concurrent.CompletableFuture;

/**
 * Used to authenticate users by user id and password
 *
 * @author Apache LDAP Password Provider Project
 */
public interface PasswordProvider {
    /**
     * Check the validity of a password. <B>Note:</B> the call may block on network I/O.
     *
     * @param  userId   The user id as given by the login client
     * @param  password The password
     * @return          {@code true} indicating if authentication succeeded
     */
    boolean checkPassword(String userId, String password);

    /**
     * @param  userId   The user id as given by the login client
     * @param  password The password
     * @return          A future completed with the authentication outcome - never completed exceptionally
     */
    CompletableFuture<Boolean> checkPasswordAsync(String userId, String password);
}
