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

import java.util.Locale;

import org.apache.ldapauth.common.util.GenericUtils;

/**
 * Kinds of third party contact identifiers that can be bound to an account
 *
 * @author Apache LDAP Password Provider Project
 */
public enum ContactMedium {
    EMAIL("email") {
        @Override
        public String normalize(String address) {
            return GenericUtils.trimToEmpty(address).toLowerCase(Locale.ROOT);
        }
    },
    MSISDN("msisdn");

    private final String medium;

    ContactMedium(String medium) {
        this.medium = medium;
    }

    /**
     * @return The medium name as known to the account store
     */
    public String getMedium() {
        return medium;
    }

    /**
     * @param  address The raw address value
     * @return         The address in the form it is stored and looked up
     */
    public String normalize(String address) {
        return GenericUtils.trimToEmpty(address);
    }
}
