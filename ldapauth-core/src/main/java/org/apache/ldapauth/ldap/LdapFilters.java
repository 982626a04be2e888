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

import javax.naming.ldap.Rdn;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * Builds search filters and distinguished names from user supplied values. Values are always escaped so that a user
 * name cannot alter the structure of the filter or DN it is embedded in.
 *
 * @author Apache LDAP Password Provider Project
 */
public final class LdapFilters {
    private LdapFilters() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  attrName The attribute name
     * @param  value    The (raw) attribute value
     * @return          An equality filter - e.g., {@code (uid=alice)}
     */
    public static String uidFilter(String attrName, String value) {
        return "(" + ValidateUtils.checkNotNullAndNotEmpty(attrName, "No attribute name")
               + "=" + escapeFilterValue(value) + ")";
    }

    /**
     * @param  filter The base filter
     * @param  extra  An extra filter - may be {@code null}/empty and need not be parenthesized
     * @return        The conjunction of both filters - or the base one if no extra filter
     */
    public static String combine(String filter, String extra) {
        ValidateUtils.checkNotNullAndNotEmpty(filter, "No base filter");
        String other = GenericUtils.trimToEmpty(extra);
        if (other.isEmpty()) {
            return filter;
        }

        if ((other.charAt(0) != '(') || (other.charAt(other.length() - 1) != ')')) {
            other = "(" + other + ")";
        }
        return "(&" + filter + other + ")";
    }

    /**
     * @param  attrName The RDN attribute name
     * @param  value    The (raw) attribute value
     * @param  baseDN   The base DN
     * @return          {@code attrName=value,baseDN} with the value escaped as per RFC 4514
     */
    public static String simpleBindDN(String attrName, String value, String baseDN) {
        return ValidateUtils.checkNotNullAndNotEmpty(attrName, "No attribute name")
               + "=" + Rdn.escapeValue(ValidateUtils.checkNotNull(value, "No value"))
               + "," + ValidateUtils.checkNotNullAndNotEmpty(baseDN, "No base DN");
    }

    /**
     * @param  value The raw value
     * @return       The value with the RFC 4515 special characters escaped
     */
    public static String escapeFilterValue(String value) {
        int len = GenericUtils.length(value);
        if (len <= 0) {
            return "";
        }

        StringBuilder sb = null;
        for (int index = 0; index < len; index++) {
            char ch = value.charAt(index);
            String replacement;
            switch (ch) {
                case '\\':
                    replacement = "\\5c";
                    break;
                case '*':
                    replacement = "\\2a";
                    break;
                case '(':
                    replacement = "\\28";
                    break;
                case ')':
                    replacement = "\\29";
                    break;
                case '\0':
                    replacement = "\\00";
                    break;
                default:
                    replacement = null;
            }

            if (replacement != null) {
                if (sb == null) {
                    sb = new StringBuilder(len + 8).append(value, 0, index);
                }
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(ch);
            }
        }

        return (sb == null) ? value : sb.toString();
    }
}
