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

import java.util.Objects;

import javax.naming.NamingException;

import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;

/**
 * Opens authenticated directory connections. When StartTLS is enabled the connection is upgraded <U>before</U> any
 * credentials are sent. Failures are logged and reported as a {@code null} connection - never propagated.
 *
 * @author Apache LDAP Password Provider Project
 */
public class DirectorySessionFactory extends AbstractLoggingBean {
    private final DirectoryConnector connector;
    private final boolean startTls;

    public DirectorySessionFactory(DirectoryConnector connector, boolean startTls) {
        this.connector = Objects.requireNonNull(connector, "No directory connector");
        this.startTls = startTls;
    }

    public DirectoryConnector getConnector() {
        return connector;
    }

    public boolean isStartTls() {
        return startTls;
    }

    /**
     * @param  bindDN   The DN to bind as
     * @param  password The bind password
     * @return          A bound connection - {@code null} if the server rejected the credentials or the connection
     *                  could not be established. <B>Note:</B> the caller must {@link #release(DirectoryConnection)
     *                  release} a non-{@code null} result
     */
    public DirectoryConnection bind(String bindDN, String password) {
        DirectoryConnection conn;
        try {
            conn = connector.createConnection(bindDN, password);
        } catch (NamingException | RuntimeException e) {
            warn("bind({}) failed to create connection", bindDN, e);
            return null;
        }

        boolean bound = false;
        try {
            if (startTls) {
                conn.open();
                conn.startTls();
            }

            bound = conn.bind();
            if (!bound) {
                log.info("bind({}) rejected: {}", bindDN, conn.getResultDescription());
            } else if (log.isDebugEnabled()) {
                log.debug("bind({}) succeeded - startTls={}", bindDN, startTls);
            }
        } catch (NamingException | RuntimeException e) {
            warn("bind({}) failed to bind", bindDN, e);
        } finally {
            if (!bound) {
                release(conn);
            }
        }

        return bound ? conn : null;
    }

    /**
     * Unbinds the connection - logging but otherwise ignoring any failure
     *
     * @param conn The connection - ignored if {@code null}
     */
    public void release(DirectoryConnection conn) {
        if (conn == null) {
            return;
        }

        try {
            conn.unbind();
        } catch (NamingException | RuntimeException e) {
            warn("release({}) failed to unbind", conn, e);
        }
    }
}
