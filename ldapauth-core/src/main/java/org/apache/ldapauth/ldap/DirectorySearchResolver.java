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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import javax.naming.NamingException;

import org.apache.ldapauth.common.util.ValidateUtils;
import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;

/**
 * Resolves a search to a single directory entry. Only actual entries count - references and the final &quot;done&quot;
 * response are ignored.
 *
 * @author Apache LDAP Password Provider Project
 */
public class DirectorySearchResolver extends AbstractLoggingBean {
    public DirectorySearchResolver() {
        super();
    }

    /**
     * @param  conn            A bound connection
     * @param  baseDN          The search base
     * @param  filter          The search filter
     * @param  attributes      The attributes to retrieve
     * @return                 The matching entry - {@code null} if none or more than one found
     * @throws NamingException If the search failed
     */
    public DirectoryEntry resolveSingleEntry(
            DirectoryConnection conn, String baseDN, String filter, Collection<String> attributes)
            throws NamingException {
        ValidateUtils.checkNotNull(conn, "No connection");
        List<DirectoryResponse> responses = conn.search(baseDN, filter, attributes);
        List<DirectoryEntry> entries = new ArrayList<>();
        if (responses != null) {
            for (DirectoryResponse rsp : responses) {
                if (rsp.getType() == DirectoryResponseType.SEARCH_RESULT_ENTRY) {
                    entries.add(rsp.getEntry());
                } else if (log.isTraceEnabled()) {
                    log.trace("resolveSingleEntry({})[{}] skip {}", baseDN, filter, rsp);
                }
            }
        }

        int numEntries = entries.size();
        if (numEntries == 1) {
            DirectoryEntry entry = entries.get(0);
            if (log.isDebugEnabled()) {
                log.debug("resolveSingleEntry({})[{}] matched {}", baseDN, filter, entry.getDistinguishedName());
            }
            return entry;
        }

        if (numEntries == 0) {
            log.warn("resolveSingleEntry({})[{}] no matching entry", baseDN, filter);
        } else {
            log.warn("resolveSingleEntry({})[{}] ambiguous result - {} entries matched", baseDN, filter, numEntries);
        }
        return null;
    }
}
