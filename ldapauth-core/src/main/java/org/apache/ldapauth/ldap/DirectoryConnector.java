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

import javax.naming.NamingException;

/**
 * Creates (not yet opened) connections to a single directory server.
 *
 * @author Apache LDAP Password Provider Project
 */
@FunctionalInterface
public interface DirectoryConnector {
    /**
     * @param  bindDN          The distinguished name used when the connection is {@link DirectoryConnection#bind()
     *                         bound}
     * @param  password        The bind password
     * @return                 A new connection - <B>Note:</B> no network activity takes place until it is opened or
     *                         bound
     * @throws NamingException If the connection cannot be set up
     */
    DirectoryConnection createConnection(String bindDN, String password) throws NamingException;
}
