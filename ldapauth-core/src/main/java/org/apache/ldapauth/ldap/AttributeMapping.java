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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * Maps the logical user attributes onto directory attribute names
 *
 * @author Apache LDAP Password Provider Project
 */
public class AttributeMapping {
    private final String uid;
    private final String name;
    private final String mail;
    private final String msisdn;

    public AttributeMapping(String uid, String name, String mail, String msisdn) {
        this.uid = ValidateUtils.checkNotNullAndNotEmpty(uid, "No uid attribute");
        this.name = ValidateUtils.checkNotNullAndNotEmpty(name, "No name attribute");
        this.mail = GenericUtils.isEmpty(mail) ? null : mail.trim();
        this.msisdn = GenericUtils.isEmpty(msisdn) ? null : msisdn.trim();
    }

    public String getUid() {
        return uid;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The mail attribute - {@code null} if email addresses are not synchronized
     */
    public String getMail() {
        return mail;
    }

    /**
     * @return The msisdn attribute - {@code null} if phone numbers are not synchronized
     */
    public String getMsisdn() {
        return msisdn;
    }

    /**
     * @return All the mapped directory attribute names - used as the attributes to retrieve
     */
    public List<String> getAttributeNames() {
        List<String> names = new ArrayList<>(4);
        names.add(uid);
        names.add(name);
        if (mail != null) {
            names.add(mail);
        }
        if (msisdn != null) {
            names.add(msisdn);
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return "uid=" + getUid() + ",name=" + getName() + ",mail=" + getMail() + ",msisdn=" + getMsisdn();
    }
}
