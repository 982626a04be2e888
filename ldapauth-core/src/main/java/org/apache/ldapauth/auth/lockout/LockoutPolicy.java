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

import java.time.Duration;
import java.util.Objects;

import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * How many consecutive failures lock an account out, and for how long
 *
 * @author Apache LDAP Password Provider Project
 */
public class LockoutPolicy {
    private final int attempts;
    private final Duration lockTime;

    public LockoutPolicy(int attempts, Duration lockTime) {
        ValidateUtils.checkTrue(attempts > 0, "Non-positive attempts count: %d", attempts);
        this.attempts = attempts;
        this.lockTime = Objects.requireNonNull(lockTime, "No lock time");
        ValidateUtils.checkTrue(!lockTime.isNegative(), "Negative lock time: %s", lockTime);
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getLockTime() {
        return lockTime;
    }

    @Override
    public String toString() {
        return "attempts=" + getAttempts() + ",locktime=" + getLockTime().getSeconds() + "s";
    }
}
