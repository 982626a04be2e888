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

import java.util.List;
import java.util.Objects;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;
import org.apache.ldapauth.ldap.AttributeMapping;
import org.apache.ldapauth.ldap.DirectoryEntry;

/**
 * Synchronizes the local account with the attributes of its directory entry: provisions the account on first login,
 * overwrites its display name and binds any email address or phone number that no other account owns.
 *
 * @author Apache LDAP Password Provider Project
 */
public class ProfileReconciler extends AbstractLoggingBean {
    private final AccountStore store;
    private final AttributeMapping mapping;

    public ProfileReconciler(AccountStore store, AttributeMapping mapping) {
        this.store = Objects.requireNonNull(store, "No account store");
        this.mapping = Objects.requireNonNull(mapping, "No attribute mapping");
    }

    public AccountStore getAccountStore() {
        return store;
    }

    public AttributeMapping getAttributeMapping() {
        return mapping;
    }

    /**
     * @param  userId    The (normalized) user id
     * @param  localPart The user id local part
     * @param  entry     The user's directory entry
     * @return           The effective user id - may differ from the given one if the account was just registered
     */
    public String reconcile(String userId, String localPart, DirectoryEntry entry) {
        Objects.requireNonNull(entry, "No directory entry");

        String effectiveId = userId;
        if (!store.userExists(userId)) {
            RegisteredAccount account = store.register(localPart);
            effectiveId = account.getUserId();
            log.info("reconcile({}) registered new account {}", userId, effectiveId);
        }

        String displayName = resolveDisplayName(entry);
        if (GenericUtils.isNotEmpty(displayName)) {
            store.setDisplayName(localPart, displayName);
            if (log.isDebugEnabled()) {
                log.debug("reconcile({}) display name set to {}", effectiveId, displayName);
            }
        }

        String mailAttr = mapping.getMail();
        if (mailAttr != null) {
            reconcileContacts(effectiveId, ContactMedium.EMAIL, entry.getValues(mailAttr));
        }

        String msisdnAttr = mapping.getMsisdn();
        if (msisdnAttr != null) {
            reconcileContacts(effectiveId, ContactMedium.MSISDN, entry.getValues(msisdnAttr));
        }

        return effectiveId;
    }

    protected String resolveDisplayName(DirectoryEntry entry) {
        for (String value : entry.getValues(mapping.getName())) {
            if (GenericUtils.isNotEmpty(value)) {
                return value;
            }
        }
        return null;
    }

    protected void reconcileContacts(String userId, ContactMedium medium, List<String> values) {
        for (String value : values) {
            String address = medium.normalize(value);
            if (GenericUtils.isEmpty(address)) {
                continue;
            }

            String owner = store.getUserIdByContact(medium, address);
            if (GenericUtils.isEmpty(owner)) {
                long now = store.currentTimeMillis();
                store.addContact(userId, medium, address, now, now);
                if (log.isDebugEnabled()) {
                    log.debug("reconcileContacts({}) added {}: {}", userId, medium.getMedium(), address);
                }
            } else if (!owner.equalsIgnoreCase(userId)) {
                log.error("reconcileContacts({}) {} {} already bound to {}", userId, medium.getMedium(), address, owner);
            } else if (log.isTraceEnabled()) {
                log.trace("reconcileContacts({}) {} {} already bound", userId, medium.getMedium(), address);
            }
        }
    }
}
