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

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.naming.NamingException;

import org.apache.ldapauth.account.AccountStore;
import org.apache.ldapauth.account.ProfileReconciler;
import org.apache.ldapauth.auth.lockout.LockoutTracker;
import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;
import org.apache.ldapauth.common.util.threads.ThreadUtils;
import org.apache.ldapauth.ldap.AttributeMapping;
import org.apache.ldapauth.ldap.DirectoryConnection;
import org.apache.ldapauth.ldap.DirectoryConnector;
import org.apache.ldapauth.ldap.DirectoryEntry;
import org.apache.ldapauth.ldap.DirectorySearchResolver;
import org.apache.ldapauth.ldap.DirectorySessionFactory;
import org.apache.ldapauth.ldap.JndiDirectoryConnector;
import org.apache.ldapauth.ldap.LdapFilters;

/**
 * Authenticates users against an LDAP directory and synchronizes their local profile on success.
 * <P>
 * In {@link LdapAuthMode#SIMPLE simple} mode the user binds directly as {@code <uid>=<localpart>,<base>}. In
 * {@link LdapAuthMode#SEARCH search} mode a service account looks up the user's entry, which must be unique, and the
 * user then binds using its DN. Either way the user's attributes are then read through the user's own connection and
 * handed to the {@link ProfileReconciler}.
 * </P>
 *
 * <P>
 * The blocking directory calls run on a worker pool. Cancelling the future returned by
 * {@link #checkPasswordAsync(String, String)} does not interrupt an attempt in progress - it still completes and
 * releases its connection.
 * </P>
 *
 * @author Apache LDAP Password Provider Project
 */
public class LdapPasswordProvider extends AbstractLoggingBean implements PasswordProvider, Closeable {
    public static final String WORKER_POOL_NAME = "worker";

    private final LdapProviderConfig config;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean shutdownExecutor;
    private final LockoutTracker lockoutTracker;
    private final DirectorySessionFactory sessionFactory;
    private final DirectorySearchResolver searchResolver;
    private final ProfileReconciler reconciler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LdapPasswordProvider(LdapProviderConfig config, AccountStore store) {
        this(config, config.isEnabled() ? createConnector(config) : null, store, null, Clock.systemUTC());
    }

    /**
     * @param config    The provider configuration
     * @param connector The directory connector - may be {@code null} only if the provider is disabled
     * @param store     The account store
     * @param executor  The worker pool - if {@code null} then one is created (and shut down on {@link #close()})
     * @param clock     The clock used for lockout tracking
     */
    public LdapPasswordProvider(
            LdapProviderConfig config, DirectoryConnector connector, AccountStore store,
            ExecutorService executor, Clock clock) {
        this.config = Objects.requireNonNull(config, "No configuration");
        this.clock = Objects.requireNonNull(clock, "No clock");
        this.shutdownExecutor = executor == null;
        this.executor = ThreadUtils.newFixedThreadPoolIf(executor, WORKER_POOL_NAME, config.getWorkerThreads());

        if (config.isEnabled()) {
            this.lockoutTracker = new LockoutTracker(config.getLockoutPolicy());
            this.sessionFactory = new DirectorySessionFactory(
                    Objects.requireNonNull(connector, "No directory connector"), config.isStartTls());
            this.searchResolver = new DirectorySearchResolver();
            this.reconciler = new ProfileReconciler(store, config.getAttributes());
            log.info("LDAP password provider enabled: {}", config);
        } else {
            this.lockoutTracker = new LockoutTracker(null);
            this.sessionFactory = null;
            this.searchResolver = null;
            this.reconciler = null;
            log.info("LDAP password provider disabled");
        }
    }

    public static JndiDirectoryConnector createConnector(LdapProviderConfig config) {
        JndiDirectoryConnector connector = JndiDirectoryConnector.forUrl(config.getUri());
        connector.setConnectTimeout(config.getConnectTimeout().toMillis());
        connector.setReadTimeout(config.getReadTimeout().toMillis());
        connector.setTimeLimit(config.getReadTimeout().toMillis());
        return connector;
    }

    public LdapProviderConfig getConfig() {
        return config;
    }

    public LockoutTracker getLockoutTracker() {
        return lockoutTracker;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public boolean checkPassword(String userId, String password) {
        return checkPasswordAsync(userId, password).join();
    }

    @Override
    public CompletableFuture<Boolean> checkPasswordAsync(String userId, String password) {
        if ((!isOpen()) || executor.isShutdown()) {
            log.warn("checkPasswordAsync({}) provider closed", userId);
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }

        try {
            return CompletableFuture.supplyAsync(() -> authenticate(userId, password).isAccepted(), executor);
        } catch (RejectedExecutionException e) {
            warn("checkPasswordAsync({}) failed to schedule", userId, e);
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
    }

    /**
     * Runs a single authentication attempt on the calling thread
     *
     * @param  rawUserId The user id as given by the login client
     * @param  password  The password
     * @return           The attempt outcome - never {@code null}
     */
    public AuthResult authenticate(String rawUserId, String password) {
        if (!config.isEnabled()) {
            return AuthResult.rejected("provider disabled");
        }

        if (GenericUtils.isEmpty(password)) {
            if (log.isDebugEnabled()) {
                log.debug("authenticate({}) empty password", rawUserId);
            }
            return AuthResult.rejected("empty password");
        }

        UserIdentifier id = UserIdentifier.parse(rawUserId);
        if (id == null) {
            log.warn("authenticate({}) malformed user id", rawUserId);
            return AuthResult.rejected("malformed user id");
        }

        String localPart = id.getLocalPart();
        Instant now = clock.instant();
        if (lockoutTracker.isLocked(localPart, now)) {
            Duration remaining = lockoutTracker.getRemainingLockTime(localPart, now);
            log.error("authenticate({}) locked by account lockout policy - seconds to unlock: {}",
                    id, remaining.getSeconds());
            return AuthResult.rejected("locked out");
        }

        DirectoryConnection conn = null;
        try {
            LdapAuthMode mode = config.getMode();
            switch (mode) {
                case SIMPLE:
                    conn = bindSimple(id, password, now);
                    break;
                case SEARCH:
                    conn = bindSearch(id, password, now);
                    break;
                default:
                    throw new IllegalStateException("Unsupported mode: " + mode);
            }

            if (conn == null) {
                return AuthResult.rejected("directory authentication failed");
            }

            AttributeMapping attributes = config.getAttributes();
            DirectoryEntry entry = searchResolver.resolveSingleEntry(
                    conn, config.getBase(), createSearchFilter(localPart), attributes.getAttributeNames());
            if (entry == null) {
                log.warn("authenticate({}) no unique entry to read attributes from", id);
                return AuthResult.rejected("attributes not resolved");
            }

            lockoutTracker.clear(localPart);
            String effectiveId = reconciler.reconcile(id.getUserId(), localPart, entry);
            log.info("authenticate({}) successful for local part {}", effectiveId, localPart);
            return AuthResult.accepted(effectiveId, localPart, entry);
        } catch (NamingException | RuntimeException e) {
            warn("authenticate({}) failed to query", id, e);
            return AuthResult.error(e.getClass().getSimpleName(), e);
        } finally {
            if (conn != null) {
                sessionFactory.release(conn);
            }
        }
    }

    protected DirectoryConnection bindSimple(UserIdentifier id, String password, Instant now) {
        String localPart = id.getLocalPart();
        String bindDN = LdapFilters.simpleBindDN(config.getAttributes().getUid(), localPart, config.getBase());
        DirectoryConnection conn = sessionFactory.bind(bindDN, password);
        if (conn == null) {
            lockoutTracker.recordFailure(localPart, now);
        }
        return conn;
    }

    protected DirectoryConnection bindSearch(UserIdentifier id, String password, Instant now) throws NamingException {
        DirectoryConnection service = sessionFactory.bind(config.getBindDN(), config.getBindPassword());
        if (service == null) {
            // the service account's failure, not the user's
            log.warn("bindSearch({}) service bind failed for {}", id, config.getBindDN());
            return null;
        }

        String localPart = id.getLocalPart();
        DirectoryEntry entry;
        try {
            entry = searchResolver.resolveSingleEntry(
                    service, config.getBase(), createSearchFilter(localPart), Collections.emptyList());
        } finally {
            sessionFactory.release(service);
        }

        if (entry == null) {
            lockoutTracker.recordFailure(localPart, now);
            return null;
        }

        String userDN = entry.getDistinguishedName();
        if (log.isDebugEnabled()) {
            log.debug("bindSearch({}) found DN={}", id, userDN);
        }

        DirectoryConnection conn = sessionFactory.bind(userDN, password);
        if (conn == null) {
            lockoutTracker.recordFailure(localPart, now);
        }
        return conn;
    }

    protected String createSearchFilter(String localPart) {
        String filter = LdapFilters.uidFilter(config.getAttributes().getUid(), localPart);
        if (config.getMode() == LdapAuthMode.SEARCH) {
            filter = LdapFilters.combine(filter, config.getFilter());
        }
        return filter;
    }

    @Override
    public void close() {
        if (!closed.getAndSet(true)) {
            if (shutdownExecutor) {
                // attempts in progress still complete and release their connections
                executor.shutdown();
            }
            log.info("close() LDAP password provider closed");
        }
    }
}
