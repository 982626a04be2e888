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


package org.apache.ldapauth.util.test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import javax.naming.CommunicationException;
import javax.naming.NamingException;

import org.apache.ldapauth.ldap.DirectoryConnection;
import org.apache.ldapauth.ldap.DirectoryConnector;
import org.apache.ldapauth.ldap.DirectoryEntry;
import org.apache.ldapauth.ldap.DirectoryResponse;

/**
 * A scripted directory: binds succeed for the registered DN/password pairs and searches return the entries registered
 * for the exact filter string. Every interaction is recorded.
 *
 * @author Apache LDAP Password Provider Project
 */
public class InMemoryDirectory implements DirectoryConnector {
    public static final String INVALID_CREDENTIALS = "invalidCredentials";

    private final Map<String, String> passwords = new ConcurrentHashMap<>();
    private final Map<String, List<DirectoryEntry>> results = new ConcurrentHashMap<>();
    private final Set<String> unreachableDNs = ConcurrentHashMap.newKeySet();
    private final Set<Connection> live = ConcurrentHashMap.newKeySet();
    private final List<String> bindAttempts = new CopyOnWriteArrayList<>();
    private final List<String> searchFilters = new CopyOnWriteArrayList<>();
    private final AtomicInteger connectionsCount = new AtomicInteger();
    private final AtomicInteger startTlsCount = new AtomicInteger();

    public InMemoryDirectory() {
        super();
    }

    public InMemoryDirectory addAccount(String dn, String password) {
        passwords.put(dn, password);
        return this;
    }

    public InMemoryDirectory addResult(String filter, DirectoryEntry... entries) {
        List<DirectoryEntry> list = new ArrayList<>(entries.length);
        Collections.addAll(list, entries);
        results.put(filter, list);
        return this;
    }

    /**
     * @param  dn A DN whose bind fails with a communication error
     * @return    this
     */
    public InMemoryDirectory failBind(String dn) {
        unreachableDNs.add(dn);
        return this;
    }

    public int getConnectionsCount() {
        return connectionsCount.get();
    }

    public int getStartTlsCount() {
        return startTlsCount.get();
    }

    public List<String> getBindAttempts() {
        return bindAttempts;
    }

    public List<String> getSearchFilters() {
        return searchFilters;
    }

    /**
     * @return Connections created but not yet unbound
     */
    public int getLiveConnectionsCount() {
        return live.size();
    }

    @Override
    public DirectoryConnection createConnection(String bindDN, String password) throws NamingException {
        connectionsCount.incrementAndGet();
        Connection conn = new Connection(bindDN, password);
        live.add(conn);
        return conn;
    }

    public class Connection implements DirectoryConnection {
        private final String bindDN;
        private final String password;
        private boolean open;
        private boolean bound;
        private String description;

        Connection(String bindDN, String password) {
            this.bindDN = bindDN;
            this.password = password;
        }

        @Override
        public void open() throws NamingException {
            open = true;
        }

        @Override
        public void startTls() throws NamingException {
            if (!open) {
                throw new IllegalStateException("StartTLS on closed connection");
            }
            if (bound) {
                throw new IllegalStateException("StartTLS after bind");
            }
            startTlsCount.incrementAndGet();
        }

        @Override
        public boolean bind() throws NamingException {
            open = true;
            bindAttempts.add(bindDN);
            if (unreachableDNs.contains(bindDN)) {
                throw new CommunicationException("Simulated failure for " + bindDN);
            }

            bound = (password != null) && password.equals(passwords.get(bindDN));
            description = bound ? "success" : INVALID_CREDENTIALS;
            return bound;
        }

        @Override
        public String getResultDescription() {
            return description;
        }

        @Override
        public List<DirectoryResponse> search(String baseDN, String filter, Collection<String> attributes)
                throws NamingException {
            if (!bound) {
                throw new IllegalStateException("Search on unbound connection");
            }

            searchFilters.add(filter);
            List<DirectoryResponse> responses = new ArrayList<>();
            for (DirectoryEntry e : results.getOrDefault(filter, Collections.emptyList())) {
                responses.add(DirectoryResponse.entry(e));
            }
            responses.add(DirectoryResponse.done());
            return responses;
        }

        @Override
        public void unbind() throws NamingException {
            open = false;
            bound = false;
            live.remove(this);
        }

        @Override
        public String toString() {
            return "InMemoryConnection[" + bindDN + "]";
        }
    }
}
