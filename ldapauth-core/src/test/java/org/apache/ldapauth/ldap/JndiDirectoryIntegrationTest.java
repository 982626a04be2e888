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

import java.io.InputStream;
import java.net.InetAddress;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.listener.InMemoryListenerConfig;
import com.unboundid.ldif.LDIFReader;
import org.apache.ldapauth.account.ContactMedium;
import org.apache.ldapauth.auth.AuthResult;
import org.apache.ldapauth.auth.LdapPasswordProvider;
import org.apache.ldapauth.auth.LdapProviderConfig;
import org.apache.ldapauth.auth.LdapProviderConfigTest;
import org.apache.ldapauth.util.test.BaseTestSupport;
import org.apache.ldapauth.util.test.InMemoryAccountStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the JNDI connection and the provider against an embedded directory server loaded from
 * {@code auth-users.ldif}
 *
 * @author Apache LDAP Password Provider Project
 */
@TestMethodOrder(MethodName.class)
public class JndiDirectoryIntegrationTest extends BaseTestSupport {
    private static final String BASE_DN = "dc=example,dc=org";
    private static final String ALICE = InMemoryAccountStore.userId("alice");
    private static final String ALICE_PASSWORD = "wonderland";
    private static final String CAROL = InMemoryAccountStore.userId("carol");
    private static final String CAROL_PASSWORD = "rabbit-hole";

    private static InMemoryDirectoryServer server;
    private static String serverUri;

    private InMemoryAccountStore store;
    private LdapPasswordProvider provider;

    public JndiDirectoryIntegrationTest() {
        super();
    }

    @BeforeAll
    static void startServer() throws Exception {
        InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(BASE_DN);
        InetAddress address = InetAddress.getLoopbackAddress();
        config.setListenerConfigs(InMemoryListenerConfig.createLDAPConfig("default", address, 0, null));
        server = new InMemoryDirectoryServer(config);
        try (InputStream input = JndiDirectoryIntegrationTest.class.getResourceAsStream("/auth-users.ldif")) {
            assertNotNull(input, "Missing users LDIF");
            server.importFromLDIF(true, new LDIFReader(input));
        }
        server.startListening();
        serverUri = "ldap://" + address.getHostAddress() + ":" + server.getListenPort();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.shutDown(true);
            server = null;
        }
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryAccountStore();
    }

    @AfterEach
    void tearDown() {
        if (provider != null) {
            provider.close();
            provider = null;
        }
    }

    private static JndiDirectoryConnector createConnector() {
        JndiDirectoryConnector connector = JndiDirectoryConnector.forUrl(serverUri);
        connector.setConnectTimeout(5000L);
        connector.setReadTimeout(5000L);
        return connector;
    }

    private LdapPasswordProvider createProvider(Map<String, Object> props) {
        props.put("uri", serverUri);
        props.put("attributes.msisdn", "mobile");
        props.put("account_lockout_policy.attempts", 3);
        props.put("account_lockout_policy.locktime_s", 60);
        provider = new LdapPasswordProvider(LdapProviderConfig.fromMap(props), store);
        return provider;
    }

    @Test
    void bindWithValidCredentials() throws Exception {
        DirectorySessionFactory factory = new DirectorySessionFactory(createConnector(), false);
        DirectoryConnection conn = factory.bind(userDN("alice"), ALICE_PASSWORD);
        assertNotNull(conn, "Valid credentials not accepted");
        try {
            assertEquals("success", conn.getResultDescription());
        } finally {
            factory.release(conn);
        }
    }

    @Test
    void bindWithWrongPasswordFails() {
        DirectorySessionFactory factory = new DirectorySessionFactory(createConnector(), false);
        assertNull(factory.bind(userDN("alice"), "looking-glass"));
        assertNull(factory.bind(userDN("mallory"), ALICE_PASSWORD));
    }

    @Test
    void searchReadsEntryAttributes() throws Exception {
        DirectorySessionFactory factory = new DirectorySessionFactory(createConnector(), false);
        DirectoryConnection conn = factory.bind(TEST_SERVICE_DN, TEST_SERVICE_PASSWORD);
        assertNotNull(conn, "Service account not bound");
        try {
            List<DirectoryResponse> responses = conn.search(TEST_BASE, "(uid=alice)", Arrays.asList("cn", "mail"));
            assertEquals(2, responses.size(), "Unexpected responses: " + responses);
            assertEquals(DirectoryResponseType.SEARCH_RESULT_DONE, responses.get(1).getType());

            DirectoryEntry entry = responses.get(0).getEntry();
            assertEquals(userDN("alice"), entry.getDistinguishedName());
            assertEquals("Alice Liddell", entry.getFirstValue("CN"));
            assertEquals(Collections.singletonList("alice@example.org"), entry.getValues("mail"));
            // only the requested attributes are returned
            assertNull(entry.getFirstValue("mobile"));
        } finally {
            factory.release(conn);
        }
    }

    @Test
    void searchWithoutMatchReturnsOnlyDone() throws Exception {
        DirectorySessionFactory factory = new DirectorySessionFactory(createConnector(), false);
        DirectoryConnection conn = factory.bind(TEST_SERVICE_DN, TEST_SERVICE_PASSWORD);
        assertNotNull(conn, "Service account not bound");
        try {
            List<DirectoryResponse> responses = conn.search(TEST_BASE, "(uid=mallory)", Collections.emptyList());
            assertEquals(1, responses.size(), "Unexpected responses: " + responses);
            assertEquals(DirectoryResponseType.SEARCH_RESULT_DONE, responses.get(0).getType());
        } finally {
            factory.release(conn);
        }
    }

    @Test
    void startTlsUnsupportedByServerFailsBind() {
        DirectorySessionFactory factory = new DirectorySessionFactory(createConnector(), true);
        assertNull(factory.bind(userDN("alice"), ALICE_PASSWORD));
    }

    @Test
    void simpleModeEndToEnd() {
        createProvider(LdapProviderConfigTest.simpleConfig());

        AuthResult result = provider.authenticate(ALICE, ALICE_PASSWORD);
        assertTrue(result.isAccepted(), result.toString());
        assertEquals(ALICE, result.getUserId());
        assertEquals(userDN("alice"), result.getEntry().getDistinguishedName());

        assertEquals(Collections.singletonList("alice"), store.getRegistrations());
        assertEquals(Collections.singletonList("alice=Alice Liddell"), store.getDisplayNameUpdates());
        assertEquals(ALICE, store.getContactOwner(ContactMedium.EMAIL, "alice@example.org"));
        assertTrue(store.getAddedContacts().contains("msisdn/+44 7700 900123"), store.getAddedContacts().toString());
    }

    @Test
    void simpleModeWrongPasswordRejected() {
        createProvider(LdapProviderConfigTest.simpleConfig());
        assertFalse(provider.checkPassword(ALICE, "looking-glass"));
        assertTrue(store.getRegistrations().isEmpty());
        assertEquals(1, provider.getLockoutTracker().size());
    }

    @Test
    void searchModeEndToEnd() {
        createProvider(LdapProviderConfigTest.searchConfig());

        AuthResult result = provider.authenticate(ALICE, ALICE_PASSWORD);
        assertTrue(result.isAccepted(), result.toString());
        assertEquals(userDN("alice"), result.getEntry().getDistinguishedName());
        assertEquals(Collections.singletonList("alice=Alice Liddell"), store.getDisplayNameUpdates());

        assertFalse(provider.checkPassword(ALICE, "looking-glass"));
        assertFalse(provider.checkPassword(InMemoryAccountStore.userId("mallory"), ALICE_PASSWORD));
    }

    @Test
    void searchModeFilterExcludesEntries() {
        Map<String, Object> props = LdapProviderConfigTest.searchConfig();
        props.put("filter", "(objectClass=inetOrgPerson)");
        createProvider(props);

        assertTrue(provider.checkPassword(ALICE, ALICE_PASSWORD));
        assertFalse(provider.checkPassword(CAROL, CAROL_PASSWORD));
    }

    @Test
    void searchModeStaleServicePasswordRejects() {
        Map<String, Object> props = LdapProviderConfigTest.searchConfig();
        props.put("bind_password", "stale-secret");
        createProvider(props);

        assertFalse(provider.checkPassword(ALICE, ALICE_PASSWORD));
        assertEquals(0, provider.getLockoutTracker().size());
    }

    @Test
    void simpleModeAcceptsAnyObjectClass() {
        createProvider(LdapProviderConfigTest.simpleConfig());
        assertTrue(provider.checkPassword(CAROL, CAROL_PASSWORD));
    }
}
