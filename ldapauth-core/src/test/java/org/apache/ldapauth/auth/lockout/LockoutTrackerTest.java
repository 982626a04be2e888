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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.ldapauth.common.util.threads.ThreadUtils;
import org.apache.ldapauth.util.test.JUnitTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Apache LDAP Password Provider Project
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class LockoutTrackerTest extends JUnitTestSupport {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final LockoutPolicy POLICY = new LockoutPolicy(3, Duration.ofSeconds(60L));

    public LockoutTrackerTest() {
        super();
    }

    @Test
    void lockedAfterMaxAttempts() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        for (int index = 1; index < POLICY.getAttempts(); index++) {
            assertEquals(index, tracker.recordFailure("alice", T0.plusSeconds(index)));
            assertFalse(tracker.isLocked("alice", T0.plusSeconds(index)), "Locked after " + index + " failures");
        }

        Instant last = T0.plusSeconds(POLICY.getAttempts());
        assertEquals(POLICY.getAttempts(), tracker.recordFailure("alice", last));
        assertTrue(tracker.isLocked("alice", last));
        assertTrue(tracker.isLocked("alice", last.plusSeconds(60L)), "Unlocked before window end");
        assertFalse(tracker.isLocked("alice", last.plusSeconds(61L)), "Still locked after window end");
        assertFalse(tracker.isLocked("bob", last), "Other user locked");
    }

    @Test
    void remainingLockTime() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        for (int index = 0; index < POLICY.getAttempts(); index++) {
            tracker.recordFailure("alice", T0);
        }
        assertEquals(Duration.ofSeconds(45L), tracker.getRemainingLockTime("alice", T0.plusSeconds(15L)));
        assertEquals(Duration.ZERO, tracker.getRemainingLockTime("alice", T0.plusSeconds(61L)));
        assertEquals(Duration.ZERO, tracker.getRemainingLockTime("bob", T0));
    }

    @Test
    void clearUnlocksWithinWindow() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        for (int index = 0; index < POLICY.getAttempts(); index++) {
            tracker.recordFailure("alice", T0);
        }
        assertTrue(tracker.isLocked("alice", T0.plusSeconds(1L)));

        tracker.clear("alice");
        assertFalse(tracker.isLocked("alice", T0.plusSeconds(1L)));
        assertEquals(0, tracker.size());
    }

    @Test
    void disabledTrackerNeverLocks() {
        LockoutTracker tracker = new LockoutTracker(null);
        assertFalse(tracker.isEnabled());
        for (int index = 0; index < 10; index++) {
            assertEquals(0, tracker.recordFailure("alice", T0));
        }
        assertFalse(tracker.isLocked("alice", T0));
        assertEquals(0, tracker.size());
    }

    @Test
    void pruneExpiredRecords() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        tracker.recordFailure("alice", T0);
        tracker.recordFailure("bob", T0.plusSeconds(30L));
        assertEquals(1, tracker.pruneExpired(T0.plusSeconds(61L)));
        assertEquals(1, tracker.size());
        assertEquals(0, tracker.pruneExpired(T0.plusSeconds(61L)));
    }

    @Test
    void recordFailurePrunesOncePerWindow() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        for (int index = 0; index < 5; index++) {
            tracker.recordFailure("user" + index, T0);
        }
        assertEquals(5, tracker.size());

        // more than one lock window later only the new failure remains
        tracker.recordFailure("carol", T0.plusSeconds(120L));
        assertEquals(1, tracker.size());
    }

    @Test
    void expiredFailuresStartOver() {
        LockoutTracker tracker = new LockoutTracker(POLICY);
        tracker.recordFailure("alice", T0);
        tracker.recordFailure("alice", T0.plusSeconds(1L));
        assertEquals(1, tracker.recordFailure("alice", T0.plusSeconds(70L)), "Expired failures still counted");
        assertFalse(tracker.isLocked("alice", T0.plusSeconds(71L)));
    }

    @Test
    void lockStateIndependentOfOtherUsers() {
        LockoutPolicy policy = new LockoutPolicy(2, Duration.ofSeconds(60L));
        LockoutTracker quiet = new LockoutTracker(policy);
        LockoutTracker busy = new LockoutTracker(policy);
        for (LockoutTracker tracker : new LockoutTracker[] { quiet, busy }) {
            tracker.recordFailure("alice", T0);
            tracker.recordFailure("alice", T0.plusSeconds(1L));
        }

        // an unrelated failure that happens to trigger pruning
        busy.recordFailure("bob", T0.plusSeconds(60L));

        for (LockoutTracker tracker : new LockoutTracker[] { quiet, busy }) {
            assertEquals(1, tracker.recordFailure("alice", T0.plusSeconds(70L)));
            assertFalse(tracker.isLocked("alice", T0.plusSeconds(71L)), "Locked after expired failures");
            assertEquals(2, tracker.recordFailure("alice", T0.plusSeconds(72L)));
            assertTrue(tracker.isLocked("alice", T0.plusSeconds(73L)), "Not locked after new failures");
        }
    }

    @Test
    void concurrentFailuresNotLost() throws Exception {
        int numThreads = 8;
        int perThread = 250;
        LockoutTracker tracker = new LockoutTracker(new LockoutPolicy(Integer.MAX_VALUE, Duration.ofHours(1L)));
        ExecutorService service = ThreadUtils.newFixedThreadPool(getCurrentTestName(), numThreads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>(numThreads);
            for (int index = 0; index < numThreads; index++) {
                Callable<Void> task = () -> {
                    start.await();
                    for (int count = 0; count < perThread; count++) {
                        tracker.recordFailure("alice", T0);
                    }
                    return null;
                };
                futures.add(service.submit(task));
            }

            start.countDown();
            for (Future<?> f : futures) {
                f.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } finally {
            service.shutdownNow();
        }

        assertEquals(numThreads * perThread + 1, tracker.recordFailure("alice", T0));
    }

    @Test
    void invalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new LockoutPolicy(0, Duration.ofSeconds(1L)));
        assertThrows(IllegalArgumentException.class, () -> new LockoutPolicy(1, Duration.ofSeconds(-1L)));
    }
}
