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

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;

import org.apache.ldapauth.auth.lockout.LockoutPolicy;
import org.apache.ldapauth.common.Property;
import org.apache.ldapauth.common.PropertyResolver;
import org.apache.ldapauth.common.PropertyResolverUtils;
import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.ldap.AttributeMapping;
import org.apache.ldapauth.ldap.JndiDirectoryConnector;

/**
 * Immutable, validated provider configuration. Instances are created via one of the {@code resolve}, {@code fromMap}
 * or {@code load} factories which fail with an {@link LdapConfigException} naming every missing required value.
 *
 * @author Apache LDAP Password Provider Project
 * @see    LdapModuleProperties
 */
public final class LdapProviderConfig {
    public static final String MISSING_VALUES_MESSAGE = "LDAP enabled but missing required config values: ";

    private final boolean enabled;
    private final LdapAuthMode mode;
    private final String uri;
    private final boolean startTls;
    private final String base;
    private final AttributeMapping attributes;
    private final String bindDN;
    private final String bindPassword;
    private final String filter;
    private final LockoutPolicy lockoutPolicy;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final int workerThreads;

    // CHECKSTYLE:OFF
    private LdapProviderConfig(
            boolean enabled, LdapAuthMode mode, String uri, boolean startTls, String base, AttributeMapping attributes,
            String bindDN, String bindPassword, String filter, LockoutPolicy lockoutPolicy,
            Duration connectTimeout, Duration readTimeout, int workerThreads) {
        this.enabled = enabled;
        this.mode = mode;
        this.uri = uri;
        this.startTls = startTls;
        this.base = base;
        this.attributes = attributes;
        this.bindDN = bindDN;
        this.bindPassword = bindPassword;
        this.filter = filter;
        this.lockoutPolicy = lockoutPolicy;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
        this.workerThreads = workerThreads;
    }
    // CHECKSTYLE:ON

    /**
     * @return {@code false} if the provider is disabled - in which case no other value is meaningful
     */
    public boolean isEnabled() {
        return enabled;
    }

    public LdapAuthMode getMode() {
        return mode;
    }

    public String getUri() {
        return uri;
    }

    public boolean isStartTls() {
        return startTls;
    }

    public String getBase() {
        return base;
    }

    public AttributeMapping getAttributes() {
        return attributes;
    }

    /**
     * @return The service account DN - {@code null} unless {@link LdapAuthMode#SEARCH} mode
     */
    public String getBindDN() {
        return bindDN;
    }

    public String getBindPassword() {
        return bindPassword;
    }

    /**
     * @return Extra search filter - {@code null} if none or not in {@link LdapAuthMode#SEARCH} mode
     */
    public String getFilter() {
        return filter;
    }

    /**
     * @return The lockout policy - {@code null} if lockout is not enabled
     */
    public LockoutPolicy getLockoutPolicy() {
        return lockoutPolicy;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public static LdapProviderConfig fromMap(Map<String, ?> props) {
        return resolve(PropertyResolverUtils.toPropertyResolver(props));
    }

    /**
     * @param  config A hierarchical configuration - e.g., as parsed from a YAML document
     * @return        The resolved configuration
     * @see           PropertyResolverUtils#flatten(Map)
     */
    public static LdapProviderConfig fromNestedMap(Map<String, ?> config) {
        return fromMap(PropertyResolverUtils.flatten(config));
    }

    /**
     * @param  file        A {@code .properties} file (UTF-8)
     * @return             The resolved configuration
     * @throws IOException If failed to read the file
     */
    public static LdapProviderConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(r);
        }
        return resolve(PropertyResolverUtils.toPropertyResolver(props));
    }

    public static LdapProviderConfig resolve(PropertyResolver resolver) {
        try {
            return doResolve(resolver);
        } catch (LdapConfigException e) {
            throw e;
        } catch (NoSuchElementException | IllegalArgumentException | UnsupportedOperationException e) {
            throw new LdapConfigException("Invalid LDAP configuration: " + e.getMessage(), e);
        }
    }

    private static LdapProviderConfig doResolve(PropertyResolver resolver) {
        boolean enabled = LdapModuleProperties.ENABLED.getRequired(resolver);
        if (!enabled) {
            return new LdapProviderConfig(
                    false, null, null, false, null, null, null, null, null, null,
                    LdapModuleProperties.CONNECT_TIMEOUT.getDefaultValue(),
                    LdapModuleProperties.READ_TIMEOUT.getDefaultValue(),
                    LdapModuleProperties.WORKER_THREADS.getDefaultValue());
        }

        List<String> missing = new ArrayList<>();
        String uri = requiredString(resolver, LdapModuleProperties.URI, missing);
        String base = requiredString(resolver, LdapModuleProperties.BASE, missing);
        String uidAttr = requiredString(resolver, LdapModuleProperties.UID_ATTRIBUTE, missing);
        String nameAttr = requiredString(resolver, LdapModuleProperties.NAME_ATTRIBUTE, missing);

        String bindDN = optionalString(resolver, LdapModuleProperties.BIND_DN);
        LdapAuthMode mode = LdapModuleProperties.MODE.getOrNull(resolver);
        if (mode == null) {
            mode = (bindDN == null) ? LdapAuthMode.SIMPLE : LdapAuthMode.SEARCH;
        }

        String bindPassword = null;
        String filter = null;
        if (mode == LdapAuthMode.SEARCH) {
            bindDN = requiredString(resolver, LdapModuleProperties.BIND_DN, missing);
            // a password may legitimately be blank, only its presence is required
            bindPassword = LdapModuleProperties.BIND_PASSWORD.getOrNull(resolver);
            if (bindPassword == null) {
                missing.add(LdapModuleProperties.BIND_PASSWORD.getName());
            }
            filter = optionalString(resolver, LdapModuleProperties.FILTER);
        } else {
            bindDN = null;
        }

        Integer attempts = null;
        Duration lockTime = null;
        boolean lockoutEnabled = isLockoutConfigured(resolver);
        if (lockoutEnabled) {
            attempts = LdapModuleProperties.LOCKOUT_ATTEMPTS.getOrCustomDefault(resolver,
                    LdapModuleProperties.LOCKOUT_ATTEMPTS_LEGACY.getOrNull(resolver));
            if (attempts == null) {
                missing.add(LdapModuleProperties.LOCKOUT_ATTEMPTS.getName());
            }
            lockTime = LdapModuleProperties.LOCKOUT_TIME.getOrNull(resolver);
            if (lockTime == null) {
                missing.add(LdapModuleProperties.LOCKOUT_TIME.getName());
            }
        }

        if (!missing.isEmpty()) {
            throw new LdapConfigException(MISSING_VALUES_MESSAGE + GenericUtils.join(missing, ", "));
        }

        validateUri(uri);

        AttributeMapping attributes = new AttributeMapping(
                uidAttr, nameAttr,
                optionalString(resolver, LdapModuleProperties.MAIL_ATTRIBUTE),
                optionalString(resolver, LdapModuleProperties.MSISDN_ATTRIBUTE));
        LockoutPolicy policy = lockoutEnabled ? new LockoutPolicy(attempts, lockTime) : null;
        Duration connectTimeout = LdapModuleProperties.CONNECT_TIMEOUT.getRequired(resolver);
        Duration readTimeout = LdapModuleProperties.READ_TIMEOUT.getRequired(resolver);
        int workerThreads = LdapModuleProperties.WORKER_THREADS.getRequired(resolver);
        if (workerThreads <= 0) {
            throw new LdapConfigException("Non-positive " + LdapModuleProperties.WORKER_THREADS.getName()
                                          + ": " + workerThreads);
        }

        return new LdapProviderConfig(
                true, mode, uri, LdapModuleProperties.START_TLS.getRequired(resolver), base, attributes,
                bindDN, bindPassword, filter, policy, connectTimeout, readTimeout, workerThreads);
    }

    private static boolean isLockoutConfigured(PropertyResolver resolver) {
        return (resolver.getPropertyValue(LdapModuleProperties.LOCKOUT_POLICY_SECTION) != null)
                || LdapModuleProperties.LOCKOUT_ATTEMPTS.isSet(resolver)
                || LdapModuleProperties.LOCKOUT_ATTEMPTS_LEGACY.isSet(resolver)
                || LdapModuleProperties.LOCKOUT_TIME.isSet(resolver);
    }

    private static void validateUri(String uri) {
        URI parsed;
        try {
            parsed = new URI(uri);
        } catch (URISyntaxException e) {
            throw new LdapConfigException("Malformed " + LdapModuleProperties.URI.getName() + ": " + uri, e);
        }

        String scheme = parsed.getScheme();
        if (GenericUtils.isEmpty(scheme) || GenericUtils.isEmpty(parsed.getHost())) {
            throw new LdapConfigException("Incomplete " + LdapModuleProperties.URI.getName() + ": " + uri);
        }
        if (!(JndiDirectoryConnector.DEFAULT_LDAP_PROTOCOL.equalsIgnoreCase(scheme)
                || JndiDirectoryConnector.LDAPS_PROTOCOL.equalsIgnoreCase(scheme))) {
            throw new LdapConfigException("Unsupported " + LdapModuleProperties.URI.getName() + " scheme: " + uri);
        }
    }

    private static String requiredString(PropertyResolver resolver, Property<String> prop, List<String> missing) {
        String value = optionalString(resolver, prop);
        if (value == null) {
            missing.add(prop.getName());
        }
        return value;
    }

    private static String optionalString(PropertyResolver resolver, Property<String> prop) {
        String value = GenericUtils.trimToEmpty(prop.getOrNull(resolver));
        return value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        if (!isEnabled()) {
            return "LdapProviderConfig[disabled]";
        }

        // the bind password is never included
        return "LdapProviderConfig[mode=" + getMode()
               + ", uri=" + getUri()
               + ", startTls=" + isStartTls()
               + ", base=" + getBase()
               + ", attributes={" + getAttributes() + "}"
               + ", bindDN=" + getBindDN()
               + ", filter=" + getFilter()
               + ", lockout=" + getLockoutPolicy()
               + "]";
    }
}
