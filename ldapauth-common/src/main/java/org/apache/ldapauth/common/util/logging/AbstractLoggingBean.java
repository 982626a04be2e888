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

package org.apache.ldapauth.common.util.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves as a common base class for the classes that require some kind of logging.
 *
 * @author Apache LDAP Password Provider Project
 */
public abstract class AbstractLoggingBean {
    protected final Logger log;

    protected AbstractLoggingBean() {
        log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Logs a failure at WARN level as {@code message (ExceptionType): exception-message}. Most failures are expected
     * ones - rejected credentials, an unreachable directory - so the stack trace is attached only if DEBUG is enabled.
     *
     * @param message The message - may contain a single {@code {}} placeholder for the subject
     * @param subject The subject of the failed operation - e.g., a DN or a user id
     * @param t       The failure cause
     */
    protected void warn(String message, Object subject, Throwable t) {
        String format = message + " ({}): {}";
        if (log.isDebugEnabled()) {
            log.warn(format, subject, t.getClass().getSimpleName(), t.getMessage(), t);
        } else {
            log.warn(format, subject, t.getClass().getSimpleName(), t.getMessage());
        }
    }
}
