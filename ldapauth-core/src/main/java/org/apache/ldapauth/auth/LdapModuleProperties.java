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

import java.time.Duration;

import org.apache.ldapauth.common.Property;
import org.apache.ldapauth.ldap.JndiDirectoryConnector;

/**
 * Configurable properties of the LDAP password provider. Nested configuration sections are addressed using
 * dot-separated names - e.g., {@code attributes.uid}.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class LdapModuleProperties {
    /** Whether the provider is active - a disabled provider rejects every attempt */
    public static final Property<Boolean> ENABLED
            = Property.bool("enabled", true);

    /** Explicit authentication mode - if not set then {@code search} iff a {@link #BIND_DN} is configured */
    public static final Property<LdapAuthMode> MODE
            = Property.enum_("mode", LdapAuthMode.class);

    /** Directory URI - e.g., {@code ldap://ldap.example.com:389} */
    public static final Property<String> URI
            = Property.string("uri");

    public static final Property<Boolean> START_TLS
            = Property.bool("start_tls", false);

    /** Search base and suffix of the simple-mode bind DN */
    public static final Property<String> BASE
            = Property.string("base");

    public static final Property<String> UID_ATTRIBUTE
            = Property.string("attributes.uid");

    public static final Property<String> NAME_ATTRIBUTE
            = Property.string("attributes.name");

    public static final Property<String> MAIL_ATTRIBUTE
            = Property.string("attributes.mail");

    public static final Property<String> MSISDN_ATTRIBUTE
            = Property.string("attributes.msisdn");

    public static final Property<String> BIND_DN
            = Property.string("bind_dn");

    public static final Property<String> BIND_PASSWORD
            = Property.string("bind_password");

    /** Extra filter combined with the uid filter - {@code search} mode only */
    public static final Property<String> FILTER
            = Property.string("filter");

    /** Name of the lockout policy section - its presence alone enables the policy */
    public static final String LOCKOUT_POLICY_SECTION = "account_lockout_policy";

    public static final Property<Integer> LOCKOUT_ATTEMPTS
            = Property.integer(LOCKOUT_POLICY_SECTION + ".attempts");

    /** Misspelled key accepted for compatibility with existing deployments */
    public static final Property<Integer> LOCKOUT_ATTEMPTS_LEGACY
            = Property.integer(LOCKOUT_POLICY_SECTION + ".attemps");

    public static final Property<Duration> LOCKOUT_TIME
            = Property.durationSec(LOCKOUT_POLICY_SECTION + ".locktime_s");

    /** Connect timeout (msec.) for the directory server */
    public static final Property<Duration> CONNECT_TIMEOUT
            = Property.duration("connect_timeout", Duration.ofMillis(JndiDirectoryConnector.DEFAULT_CONNECT_TIMEOUT));

    /** Read timeout (msec.) for directory responses */
    public static final Property<Duration> READ_TIMEOUT
            = Property.duration("read_timeout", Duration.ofMillis(JndiDirectoryConnector.DEFAULT_READ_TIMEOUT));

    /** Size of the worker pool running the blocking directory calls */
    public static final Property<Integer> WORKER_THREADS
            = Property.integer("worker_threads", 10);

    private LdapModuleProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
