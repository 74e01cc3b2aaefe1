/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cimrepo.api;

import java.util.Collections;
import java.util.Map;

import org.cimrepo.commons.NocaseMap;
import org.jetbrains.annotations.NotNull;

/**
 * Names of the qualifiers the repository interprets, and helpers to read
 * them from a qualifier map.
 */
public final class Qualifiers {

    public static final String KEY = "Key";
    public static final String ASSOCIATION = "Association";
    public static final String ABSTRACT = "Abstract";
    public static final String INDICATION = "Indication";
    public static final String OVERRIDE = "Override";
    public static final String STATIC = "Static";
    public static final String IN = "In";
    public static final String OUT = "Out";
    public static final String DESCRIPTION = "Description";

    private Qualifiers() {
    }

    /**
     * @return {@code true} if {@code qualifiers} holds {@code name} with the
     *         boolean value {@code true}
     */
    public static boolean isTrue(@NotNull Map<String, CIMQualifier> qualifiers, @NotNull String name) {
        CIMQualifier q = qualifiers.get(name);
        return q != null && q.isTrue();
    }

    /**
     * Builds an unmodifiable, case-insensitive map of qualifiers keyed by
     * name.
     */
    @NotNull
    public static Map<String, CIMQualifier> toMap(@NotNull Iterable<CIMQualifier> qualifiers) {
        NocaseMap<CIMQualifier> map = new NocaseMap<>();
        for (CIMQualifier q : qualifiers) {
            map.put(q.getName(), q);
        }
        return Collections.unmodifiableMap(map);
    }
}
