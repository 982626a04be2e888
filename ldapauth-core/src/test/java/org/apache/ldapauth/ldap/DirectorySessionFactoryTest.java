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

import javax.naming.CommunicationException;
import javax.naming.NamingException;

import org.apache.ldapauth.util.test.BaseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.InOrder;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * @author Apache LDAP Password Provider Project
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class DirectorySessionFactoryTest extends BaseTestSupport {
    private static final String DN = userDN("alice");
    private static final String PASSWORD = "secret";

    private DirectoryConnector connector;
    private DirectoryConnection conn;

    public DirectorySessionFactoryTest() {
        super();
    }

    @BeforeEach
    void setUp() throws NamingException {
        connector = Mockito.mock(DirectoryConnector.class);
        conn = Mockito.mock(DirectoryConnection.class);
        Mockito.when(connector.createConnection(DN, PASSWORD)).thenReturn(conn);
    }

    @Test
    void bindWithoutStartTls() throws Exception {
        Mockito.when(conn.bind()).thenReturn(true);

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, false);
        assertSame(conn, factory.bind(DN, PASSWORD));
        Mockito.verify(conn, Mockito.never()).startTls();
        Mockito.verify(conn, Mockito.never()).unbind();
    }

    @Test
    void startTlsBeforeBind() throws Exception {
        Mockito.when(conn.bind()).thenReturn(true);

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, true);
        assertSame(conn, factory.bind(DN, PASSWORD));

        InOrder order = Mockito.inOrder(conn);
        order.verify(conn).open();
        order.verify(conn).startTls();
        order.verify(conn).bind();
    }

    @Test
    void rejectedBindReleasesConnection() throws Exception {
        Mockito.when(conn.bind()).thenReturn(false);
        Mockito.when(conn.getResultDescription()).thenReturn("invalidCredentials");

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, false);
        assertNull(factory.bind(DN, PASSWORD));
        Mockito.verify(conn).unbind();
    }

    @Test
    void failedStartTlsSkipsBind() throws Exception {
        Mockito.doThrow(new NamingException("handshake failed")).when(conn).startTls();

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, true);
        assertNull(factory.bind(DN, PASSWORD));
        Mockito.verify(conn, Mockito.never()).bind();
        Mockito.verify(conn).unbind();
    }

    @Test
    void communicationFailureNotPropagated() throws Exception {
        Mockito.when(conn.bind()).thenThrow(new CommunicationException("connection refused"));

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, false);
        assertNull(factory.bind(DN, PASSWORD));
        Mockito.verify(conn).unbind();
    }

    @Test
    void connectorFailureNotPropagated() throws Exception {
        Mockito.when(connector.createConnection(DN, PASSWORD)).thenThrow(new NamingException("bad URL"));

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, false);
        assertNull(factory.bind(DN, PASSWORD));
        Mockito.verifyNoInteractions(conn);
    }

    @Test
    void releaseIgnoresUnbindFailure() throws Exception {
        Mockito.doThrow(new CommunicationException("already closed")).when(conn).unbind();

        DirectorySessionFactory factory = new DirectorySessionFactory(connector, false);
        factory.release(conn);
        factory.release(null);
        Mockito.verify(conn).unbind();
    }
}
