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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Hashtable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import javax.naming.AuthenticationException;
import javax.naming.Context;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.ReferralException;
import javax.naming.SizeLimitExceededException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.LdapContext;
import javax.naming.ldap.StartTlsRequest;
import javax.naming.ldap.StartTlsResponse;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.ValidateUtils;
import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;

/**
 * A {@link DirectoryConnection} backed by a JNDI {@link LdapContext}. The context is created anonymously on
 * {@link #open()} so that StartTLS can be negotiated before the credentials are sent.
 *
 * @author Apache LDAP Password Provider Project
 */
public class JndiDirectoryConnection extends AbstractLoggingBean implements DirectoryConnection {
    protected final JndiDirectoryConnector connector;
    protected final String bindDN;

    private final String password;
    private LdapContext context;
    private StartTlsResponse tlsResponse;
    private String resultDescription;

    public JndiDirectoryConnection(JndiDirectoryConnector connector, String bindDN, String password) {
        this.connector = Objects.requireNonNull(connector, "No connector");
        this.bindDN = bindDN;
        this.password = password;
    }

    public String getBindDN() {
        return bindDN;
    }

    public synchronized boolean isOpen() {
        return context != null;
    }

    @Override
    public synchronized void open() throws NamingException {
        if (context != null) {
            return;
        }

        Map<String, Object> env = connector.createEnvironment();
        context = new InitialLdapContext(new Hashtable<>(env), null);
        if (log.isDebugEnabled()) {
            log.debug("open({}) connected to {}", bindDN, env.get(Context.PROVIDER_URL));
        }
    }

    @Override
    public synchronized void startTls() throws NamingException {
        ValidateUtils.checkState(context != null, "Connection not open: %s", bindDN);
        ValidateUtils.checkState(tlsResponse == null, "StartTLS already negotiated: %s", bindDN);

        StartTlsResponse response = (StartTlsResponse) context.extendedOperation(new StartTlsRequest());
        try {
            response.negotiate();
        } catch (IOException e) {
            NamingException ne = new NamingException("Failed to negotiate StartTLS: " + e.getMessage());
            ne.setRootCause(e);
            throw ne;
        }

        tlsResponse = response;
        if (log.isDebugEnabled()) {
            log.debug("startTls({}) connection upgraded", bindDN);
        }
    }

    @Override
    public synchronized boolean bind() throws NamingException {
        open();

        context.addToEnvironment(Context.SECURITY_AUTHENTICATION, JndiDirectoryConnector.SIMPLE_AUTHENTICATION);
        context.addToEnvironment(Context.SECURITY_PRINCIPAL, GenericUtils.trimToEmpty(bindDN));
        context.addToEnvironment(Context.SECURITY_CREDENTIALS, (password == null) ? "" : password);
        try {
            // re-authenticates using the updated environment
            context.reconnect(null);
            resultDescription = "success";
            return true;
        } catch (AuthenticationException e) {
            resultDescription = e.getExplanation();
            return false;
        }
    }

    @Override
    public synchronized String getResultDescription() {
        return resultDescription;
    }

    @Override
    public synchronized List<DirectoryResponse> search(String baseDN, String filter, Collection<String> attributes)
            throws NamingException {
        ValidateUtils.checkState(context != null, "Connection not open: %s", bindDN);

        String[] attrs = GenericUtils.isEmpty(attributes)
                ? GenericUtils.EMPTY_STRING_ARRAY
                : attributes.toArray(new String[attributes.size()]);
        List<DirectoryResponse> responses = new ArrayList<>();
        NamingEnumeration<SearchResult> result = context.search(
                ValidateUtils.checkNotNullAndNotEmpty(baseDN, "No base DN"),
                ValidateUtils.checkNotNullAndNotEmpty(filter, "No filter"),
                connector.createSearchControls(attrs));
        try {
            while (result.hasMore()) {
                responses.add(DirectoryResponse.entry(toEntry(result.next())));
            }
        } catch (SizeLimitExceededException e) {
            // the entries received so far are enough to detect ambiguous matches
            if (log.isDebugEnabled()) {
                log.debug("search({})[{}] size limit exceeded after {} entries", baseDN, filter, responses.size());
            }
        } catch (ReferralException e) {
            responses.add(DirectoryResponse.reference(Objects.toString(e.getReferralInfo(), null)));
        } finally {
            result.close();
        }

        responses.add(DirectoryResponse.done());
        resultDescription = "success";
        return responses;
    }

    @Override
    public synchronized void unbind() throws NamingException {
        LdapContext ctx = context;
        StartTlsResponse tls = tlsResponse;
        context = null;
        tlsResponse = null;
        if (ctx == null) {
            return;
        }

        try {
            if (tls != null) {
                tls.close();
            }
        } catch (IOException e) {
            NamingException ne = new NamingException("Failed to close TLS layer: " + e.getMessage());
            ne.setRootCause(e);
            throw ne;
        } finally {
            ctx.close();
        }
    }

    protected DirectoryEntry toEntry(SearchResult result) throws NamingException {
        Map<String, List<String>> attrsMap = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Attributes attrs = result.getAttributes();
        if (attrs != null) {
            NamingEnumeration<? extends Attribute> attrVals = attrs.getAll();
            try {
                while (attrVals.hasMore()) {
                    Attribute a = attrVals.next();
                    List<String> values = attrsMap.computeIfAbsent(a.getID(), k -> new ArrayList<>());
                    for (int index = 0; index < a.size(); index++) {
                        String value = toString(a.get(index));
                        if (value != null) {
                            values.add(value);
                        }
                    }
                }
            } finally {
                attrVals.close();
            }
        }

        return new DirectoryEntry(result.getNameInNamespace(), attrsMap);
    }

    public static String toString(Object attrVal) {
        if (attrVal == null) {
            return null;
        } else if (attrVal instanceof byte[]) {
            return new String((byte[]) attrVal, StandardCharsets.UTF_8);
        } else {
            return attrVal.toString();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + connector.getUrl() + "][" + bindDN + "]";
    }
}
