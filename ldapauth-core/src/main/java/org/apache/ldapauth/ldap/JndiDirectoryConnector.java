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

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import javax.naming.Context;
import javax.naming.NamingException;
import javax.naming.directory.SearchControls;

import org.apache.ldapauth.common.util.ValidateUtils;
import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;

/**
 * Creates directory connections using the <A HREF="http://docs.oracle.com/javase/7/docs/technotes/guides/jndi/jndi-ldap.html">
 * LDAP Naming Service Provider for the Java Naming and Directory Interface (JNDI)</A>. The connector itself holds no
 * network resources - it only carries the provider URL, the transport timeouts and the search settings shared by all
 * the connections it creates.
 *
 * @author Apache LDAP Password Provider Project
 */
public class JndiDirectoryConnector extends AbstractLoggingBean implements DirectoryConnector {
    public static final String DEFAULT_LDAP_PROTOCOL = "ldap";
    public static final int DEFAULT_LDAP_PORT = 389;
    public static final String LDAPS_PROTOCOL = "ldaps";
    public static final int DEFAULT_LDAPS_PORT = 636;

    public static final long DEFAULT_CONNECT_TIMEOUT = TimeUnit.SECONDS.toMillis(5L);
    public static final long DEFAULT_READ_TIMEOUT = TimeUnit.SECONDS.toMillis(15L);

    /**
     * System property used to override the default LDAP context factory class
     */
    public static final String LDAP_FACTORY_PROPNAME = "javax.naming.ldap.factory";
    public static final String DEFAULT_LDAP_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";
    public static final String CONNECT_TIMEOUT_PROPNAME = "com.sun.jndi.ldap.connect.timeout";
    public static final String READ_TIMEOUT_PROPNAME = "com.sun.jndi.ldap.read.timeout";
    public static final String DEFAULT_LDAP_REFERRAL_MODE = "ignore";
    public static final String SIMPLE_AUTHENTICATION = "simple";
    public static final String NO_AUTHENTICATION = "none";

    protected final Map<String, Object> ldapEnv = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private String protocol = DEFAULT_LDAP_PROTOCOL;
    private String host = "127.0.0.1";
    private int port = DEFAULT_LDAP_PORT;
    private long connectTimeout;
    private long readTimeout;
    private long timeLimit = DEFAULT_READ_TIMEOUT;
    // zero means no limit - ambiguous matches are detected only if more than one entry comes back
    private long countLimit;

    public JndiDirectoryConnector() {
        ldapEnv.put(Context.INITIAL_CONTEXT_FACTORY, System.getProperty(LDAP_FACTORY_PROPNAME, DEFAULT_LDAP_FACTORY));
        setReferralMode(DEFAULT_LDAP_REFERRAL_MODE);
        setConnectTimeout(DEFAULT_CONNECT_TIMEOUT);
        setReadTimeout(DEFAULT_READ_TIMEOUT);
    }

    /**
     * @param  url The directory URL - e.g., {@code ldap://ldap.example.com:389}
     * @return     A connector for the URL - if the URL carries no port then the protocol default one is used
     */
    public static JndiDirectoryConnector forUrl(String url) {
        JndiDirectoryConnector connector = new JndiDirectoryConnector();
        connector.setUrl(url);
        return connector;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * @return The {@code protocol://host:port} provider URL
     */
    public String getUrl() {
        return getProtocol() + "://" + getHost() + ":" + getPort();
    }

    /**
     * @param url The {@code ldap[s]://host[:port]} URL - any path or query part is ignored
     */
    public void setUrl(String url) {
        URI uri = URI.create(ValidateUtils.checkNotNullAndNotEmpty(url, "No URL"));
        String scheme = ValidateUtils.checkNotNullAndNotEmpty(uri.getScheme(), "No protocol in %s", url);
        boolean secure = LDAPS_PROTOCOL.equalsIgnoreCase(scheme);
        ValidateUtils.checkTrue(secure || DEFAULT_LDAP_PROTOCOL.equalsIgnoreCase(scheme),
                "Unsupported protocol in %s", url);

        protocol = secure ? LDAPS_PROTOCOL : DEFAULT_LDAP_PROTOCOL;
        host = ValidateUtils.checkNotNullAndNotEmpty(uri.getHost(), "No host in %s", url);
        port = (uri.getPort() > 0) ? uri.getPort() : secure ? DEFAULT_LDAPS_PORT : DEFAULT_LDAP_PORT;
    }

    public long getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * @param millis Connect timeout - zero means the network default
     */
    public void setConnectTimeout(long millis) {
        ldapEnv.put(CONNECT_TIMEOUT_PROPNAME, Long.toString(checkIntegerMillis(millis, "connect timeout")));
        connectTimeout = millis;
    }

    public long getReadTimeout() {
        return readTimeout;
    }

    /**
     * @param millis Time to wait for a response to a single request - zero means forever
     */
    public void setReadTimeout(long millis) {
        ldapEnv.put(READ_TIMEOUT_PROPNAME, Long.toString(checkIntegerMillis(millis, "read timeout")));
        readTimeout = millis;
    }

    public String getLdapFactory() {
        return Objects.toString(ldapEnv.get(Context.INITIAL_CONTEXT_FACTORY), null);
    }

    /**
     * @return How referrals encountered by the service provider are to be processed
     * @see    Context#REFERRAL
     */
    public String getReferralMode() {
        return Objects.toString(ldapEnv.get(Context.REFERRAL), null);
    }

    public void setReferralMode(String mode) {
        ldapEnv.put(Context.REFERRAL, ValidateUtils.checkNotNullAndNotEmpty(mode, "No referral mode"));
    }

    /**
     * @return Time limit (millis) the server may spend on a search - zero means no limit
     */
    public long getTimeLimit() {
        return timeLimit;
    }

    public void setTimeLimit(long limit) {
        timeLimit = checkIntegerMillis(limit, "time limit");
    }

    public long getCountLimit() {
        return countLimit;
    }

    public void setCountLimit(long count) {
        ValidateUtils.checkTrue(count >= 0L, "Bad count limit: %d", count);
        countLimit = count;
    }

    /**
     * @param  attributes The attributes to return - {@code null} means all
     * @return            Subtree search controls reflecting the current limits
     */
    public SearchControls createSearchControls(String[] attributes) {
        SearchControls controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setTimeLimit((int) getTimeLimit());
        controls.setCountLimit(getCountLimit());
        controls.setDerefLinkFlag(false);
        controls.setReturningObjFlag(false);
        controls.setReturningAttributes(attributes);
        return controls;
    }

    /**
     * @return A copy of the base JNDI environment - including the provider URL but no credentials
     */
    public Map<String, Object> createEnvironment() {
        Map<String, Object> env = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        env.putAll(ldapEnv);
        env.put(Context.PROVIDER_URL, getUrl());
        env.put(Context.SECURITY_AUTHENTICATION, NO_AUTHENTICATION);
        return env;
    }

    @Override
    public DirectoryConnection createConnection(String bindDN, String password) throws NamingException {
        if (log.isDebugEnabled()) {
            log.debug("createConnection({})[{}]", this, bindDN);
        }
        return new JndiDirectoryConnection(this, bindDN, password);
    }

    // JNDI parses these values as int
    private static long checkIntegerMillis(long value, String name) {
        ValidateUtils.checkTrue((value >= 0L) && (value <= Integer.MAX_VALUE), "Invalid %s: %d", name, value);
        return value;
    }

    @Override
    public String toString() {
        return getUrl() + ";connect=" + getConnectTimeout() + ";read=" + getReadTimeout();
    }
}
