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

package org.apache.ldapauth.common.util.threads;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * Creates the worker pools that run blocking directory calls off the caller's thread.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class ThreadUtils {
    public static final String THREAD_NAME_PREFIX = "ldapauth-";

    private ThreadUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  executorService An executor supplied by the caller - may be {@code null}
     * @param  poolName        Name of the pool to create if no executor supplied
     * @param  nThreads        Size of the pool to create if no executor supplied
     * @return                 The supplied executor or a newly created pool
     */
    public static ExecutorService newFixedThreadPoolIf(ExecutorService executorService, String poolName, int nThreads) {
        return (executorService == null) ? newFixedThreadPool(poolName, nThreads) : executorService;
    }

    /**
     * @param  poolName Used to name the daemon threads - {@code ldapauth-<pool>-thread-N}
     * @param  nThreads Number of threads
     * @return          A pool that rejects tasks submitted after it was shut down
     */
    public static ExecutorService newFixedThreadPool(String poolName, int nThreads) {
        ValidateUtils.checkTrue(nThreads > 0, "Non-positive pool size: %d", nThreads);
        return new ThreadPoolExecutor(
                nThreads, nThreads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new DaemonThreadFactory(poolName),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @param  poolName The pool name
     * @return          The prefix of the names of the threads created for the pool
     */
    public static String toThreadNamePrefix(String poolName) {
        String name = ValidateUtils.checkNotNullAndNotEmpty(poolName, "No pool name");
        return THREAD_NAME_PREFIX + name.replace(' ', '-') + "-thread-";
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger threadNumber = new AtomicInteger(1);

        DaemonThreadFactory(String poolName) {
            namePrefix = toThreadNamePrefix(poolName);
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
}
