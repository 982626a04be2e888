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

import java.util.Collection;
import java.util.List;

import javax.naming.NamingException;

/**
 * A single connection to a directory server. All calls are blocking and must be invoked in the documented order:
 * {@link #open()}, optionally {@link #startTls()}, {@link #bind()}, any number of {@link #search(String, String,
 * Collection) searches} and finally {@link #unbind()}.
 *
 * @author Apache LDAP Password Provider Project
 */
public interface DirectoryConnection {
    /**
     * Opens the underlying network connection without authenticating
     *
     * @throws NamingException If failed to connect
     */
    void open() throws NamingException;

    /**
     * Upgrades an {@link #open() opened} connection to TLS via the StartTLS extended operation
     *
     * @throws NamingException If the upgrade failed
     */
    void startTls() throws NamingException;

    /**
     * Authenticates the connection using the distinguished name and password it was created with - opening it first if
     * required.
     *
     * @return                 {@code true} if the server accepted the credentials
     * @throws NamingException If a protocol or network error occurred
     */
    boolean bind() throws NamingException;

    /**
     * @return A human readable description of the last operation result - e.g., why a {@link #bind()} was refused.
     *         May be {@code null}
     */
    String getResultDescription();

    /**
     * @param  baseDN          The search base
     * @param  filter          The search filter
     * @param  attributes      The attributes to retrieve - if empty then no attributes are retrieved
     * @return                 The search responses in the order the server returned them
     * @throws NamingException If the search failed
     */
    List<DirectoryResponse> search(String baseDN, String filter, Collection<String> attributes) throws NamingException;

    /**
     * Unbinds and closes the connection. Invoking it on a connection that was never opened has no effect.
     *
     * @throws NamingException If failed to close cleanly
     */
    void unbind() throws NamingException;
}
