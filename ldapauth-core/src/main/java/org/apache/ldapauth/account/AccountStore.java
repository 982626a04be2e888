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

/**
 * The home server's account store as seen by the password provider. Implementations may block - all calls are made
 * from the provider's worker threads.
 *
 * @author Apache LDAP Password Provider Project
 */
public interface AccountStore {
    /**
     * @param  userId The fully qualified user id
     * @return        {@code true} if an account exists
     */
    boolean userExists(String userId);

    /**
     * @param  localPart The local part to register
     * @return           The registered account - its user id is the one to be used from now on
     */
    RegisteredAccount register(String localPart);

    /**
     * @param localPart   The local part of the account
     * @param displayName The display name - replaces any existing one
     */
    void setDisplayName(String localPart, String displayName);

    /**
     * @param  medium  The contact medium
     * @param  address The (normalized) address
     * @return         The owning user id - {@code null} if the address is not bound to any account
     */
    String getUserIdByContact(ContactMedium medium, String address);

    /**
     * @param userId      The owning user id
     * @param medium      The contact medium
     * @param address     The (normalized) address
     * @param validatedAt Validation timestamp (msec.)
     * @param addedAt     Addition timestamp (msec.)
     */
    void addContact(String userId, ContactMedium medium, String address, long validatedAt, long addedAt);

    /**
     * @return The store's notion of &quot;now&quot; (msec.)
     */
    long currentTimeMillis();
}
