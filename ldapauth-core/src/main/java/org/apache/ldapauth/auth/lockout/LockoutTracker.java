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
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.ldapauth.common.util.logging.AbstractLoggingBean;

/**
 * Tracks consecutive authentication failures per local part. A local part is locked once its failure count reaches
 * the policy's attempts and until the lock time elapses since the last failure. A tracker without a policy never
 * locks and records nothing.
 *
 * @author Apache LDAP Password Provider Project
 */
public class LockoutTracker extends AbstractLoggingBean {
    private final LockoutPolicy policy;
    private final Map<String, FailureRecord> failures = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastPrune = new AtomicReference<>(Instant.EPOCH);

    /**
     * @param policy The lockout policy - {@code null} disables lockout tracking
     */
    public LockoutTracker(LockoutPolicy policy) {
        this.policy = policy;
    }

    public LockoutPolicy getPolicy() {
        return policy;
    }

    public boolean isEnabled() {
        return policy != null;
    }

    public boolean isLocked(String localPart, Instant now) {
        if (policy == null) {
            return false;
        }

        FailureRecord rec = failures.get(localPart);
        return isLocked(rec, now);
    }

    protected boolean isLocked(FailureRecord rec, Instant now) {
        if (rec == null) {
            return false;
        }

        if (rec.getCount() < policy.getAttempts()) {
            return false;
        }

        return !isExpired(rec, now);
    }

    /**
     * @param  localPart The local part
     * @param  now       Current time
     * @return           The remaining lock time - {@link Duration#ZERO} if not locked
     */
    public Duration getRemainingLockTime(String localPart, Instant now) {
        if (policy == null) {
            return Duration.ZERO;
        }

        FailureRecord rec = failures.get(localPart);
        if (!isLocked(rec, now)) {
            return Duration.ZERO;
        }

        return Duration.between(now, rec.getLastFailure().plus(policy.getLockTime()));
    }

    /**
     * @param  localPart The local part
     * @param  now       Time of failure
     * @return           The updated failure count - zero if tracking is disabled
     */
    public int recordFailure(String localPart, Instant now) {
        if (policy == null) {
            return 0;
        }

        pruneIfDue(now);

        // a record whose lock window elapsed starts over, whether or not it was pruned yet
        FailureRecord rec = failures.compute(localPart, (k, prev) -> ((prev == null) || isExpired(prev, now))
                ? new FailureRecord(1, now)
                : prev.increment(now));
        int count = rec.getCount();
        if (log.isDebugEnabled()) {
            log.debug("recordFailure({}) count={}/{}", localPart, count, policy.getAttempts());
        }
        return count;
    }

    public void clear(String localPart) {
        FailureRecord rec = failures.remove(localPart);
        if ((rec != null) && log.isDebugEnabled()) {
            log.debug("clear({}) removed {}", localPart, rec);
        }
    }

    /**
     * @return Number of local parts currently holding a failure record
     */
    public int size() {
        return failures.size();
    }

    /**
     * Removes the records whose lock window has elapsed
     *
     * @param  now Current time
     * @return     Number of removed records
     */
    public int pruneExpired(Instant now) {
        if (policy == null) {
            return 0;
        }

        int removed = 0;
        for (Map.Entry<String, FailureRecord> e : failures.entrySet()) {
            FailureRecord rec = e.getValue();
            if (isExpired(rec, now) && failures.remove(e.getKey(), rec)) {
                removed++;
            }
        }

        if ((removed > 0) && log.isDebugEnabled()) {
            log.debug("pruneExpired({}) removed {} records", now, removed);
        }
        return removed;
    }

    protected boolean isExpired(FailureRecord rec, Instant now) {
        return now.isAfter(rec.getLastFailure().plus(policy.getLockTime()));
    }

    /**
     * Frees the memory held by expired records. Lock decisions never depend on it since expired records are
     * treated as absent anyway.
     *
     * @param now Current time
     */
    protected void pruneIfDue(Instant now) {
        Instant prev = lastPrune.get();
        if (now.isBefore(prev.plus(policy.getLockTime()))) {
            return;
        }

        // only one thread gets to prune per window
        if (lastPrune.compareAndSet(prev, now)) {
            pruneExpired(now);
        }
    }
}
