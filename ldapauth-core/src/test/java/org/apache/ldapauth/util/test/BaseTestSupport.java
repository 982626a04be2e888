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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.ldapauth.ldap.DirectoryEntry;

/**
 * Base class for the provider tests
 *
 * @author Apache LDAP Password Provider Project
 */
public abstract class BaseTestSupport extends JUnitTestSupport {
    public static final String TEST_URI = "ldap://ldap.example.org:389";
    public static final String TEST_BASE = "ou=people,dc=example,dc=org";
    public static final String TEST_SERVICE_DN = "cn=synapse,ou=services,dc=example,dc=org";
    public static final String TEST_SERVICE_PASSWORD = "service-secret";

    protected BaseTestSupport() {
        super();
    }

    public static String userDN(String localPart) {
        return "uid=" + localPart + "," + TEST_BASE;
    }

    /**
     * @param  localPart The uid value
     * @param  attrs     Pairs of attribute name and value - repeating a name adds another value
     * @return           An entry under {@link #TEST_BASE}
     */
    public static DirectoryEntry entry(String localPart, String... attrs) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        values.put("uid", Collections.singletonList(localPart));
        for (int index = 0; index < attrs.length; index += 2) {
            String name = attrs[index];
            List<String> prev = values.get(name);
            List<String> list = (prev == null) ? new ArrayList<>() : new ArrayList<>(prev);
            list.add(attrs[index + 1]);
            values.put(name, list);
        }
        return new DirectoryEntry(userDN(localPart), values);
    }

    /**
     * A {@link Clock} whose time only changes when told to
     */
    public static class SettableClock extends Clock {
        private volatile Instant now;

        public SettableClock(Instant now) {
            this.now = now;
        }

        public void set(Instant instant) {
            now = instant;
        }

        public void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
