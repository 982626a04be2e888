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
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.apache.ldapauth.common.util.GenericUtils;
import org.apache.ldapauth.common.util.ValidateUtils;

/**
 * A directory entry returned by a search - its distinguished name and its (multi-valued) attributes. Attribute names
 * are matched case <U>insensitive</U>.
 *
 * @author Apache LDAP Password Provider Project
 */
public class DirectoryEntry {
    private final String distinguishedName;
    private final NavigableMap<String, List<String>> attributes;

    public DirectoryEntry(String distinguishedName, Map<String, ? extends List<String>> attributes) {
        this.distinguishedName = ValidateUtils.checkNotNullAndNotEmpty(distinguishedName, "No distinguished name");

        NavigableMap<String, List<String>> attrs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (GenericUtils.isNotEmpty(attributes)) {
            attributes.forEach((name, values) -> attrs.put(name,
                    GenericUtils.isEmpty(values)
                            ? Collections.emptyList()
                            : Collections.unmodifiableList(new ArrayList<>(values))));
        }
        this.attributes = Collections.unmodifiableNavigableMap(attrs);
    }

    public String getDistinguishedName() {
        return distinguishedName;
    }

    public NavigableMap<String, List<String>> getAttributes() {
        return attributes;
    }

    /**
     * @param  name The attribute name - may be {@code null}
     * @return      The attribute values - empty if attribute not present or no name provided
     */
    public List<String> getValues(String name) {
        if (GenericUtils.isEmpty(name)) {
            return Collections.emptyList();
        }

        List<String> values = attributes.get(name);
        return (values == null) ? Collections.emptyList() : values;
    }

    /**
     * @param  name The attribute name
     * @return      The first value of the attribute - {@code null} if no values
     */
    public String getFirstValue(String name) {
        List<String> values = getValues(name);
        return values.isEmpty() ? null : values.get(0);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getDistinguishedName() + "]" + getAttributes().keySet();
    }
}
