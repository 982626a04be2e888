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


package org.apache.ldapauth.auth.lockout;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the consecutive failures recorded for a local part
 *
 * @author Apache LDAP Password Provider Project
 */
public final class FailureRecord {
    private final int count;
    private final Instant lastFailure;

    public FailureRecord(int count, Instant lastFailure) {
        this.count = count;
        this.lastFailure = Objects.requireNonNull(lastFailure, "No failure time");
    }

    public int getCount() {
        return count;
    }

    public Instant getLastFailure() {
        return lastFailure;
    }

    public FailureRecord increment(Instant when) {
        return new FailureRecord(count + 1, when);
    }

    @Override
    public String toString() {
        return "count=" + getCount() + ",last=" + getLastFailure();
    }
}
