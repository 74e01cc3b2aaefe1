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
package org.cimrepo.commons;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Name folding rules shared by all CIM element names. Class, property,
 * method, parameter, qualifier and namespace names compare
 * case-insensitively, while their original spelling is preserved for
 * display.
 */
public final class Names {

    private Names() {
    }

    /**
     * Returns the case-folded form of {@code name} that is used for lookups
     * and comparisons.
     */
    @NotNull
    public static String fold(@NotNull String name) {
        return checkNotNull(name).toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive comparison of two names, where either may be
     * {@code null}.
     */
    public static boolean same(@Nullable String a, @Nullable String b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equalsIgnoreCase(b);
    }

    /**
     * Folds every name of the given collection.
     *
     * @return immutable set of folded names, or {@code null} if
     *         {@code names} is {@code null}
     */
    @Nullable
    public static Set<String> foldAll(@Nullable Collection<String> names) {
        if (names == null) {
            return null;
        }
        ImmutableSet.Builder<String> folded = ImmutableSet.builder();
        for (String name : names) {
            folded.add(fold(name));
        }
        return folded.build();
    }

    /**
     * Strips leading and trailing slashes from a namespace name, so that
     * {@code "/root/cimv2/"} and {@code "root/cimv2"} name the same
     * namespace.
     */
    @NotNull
    public static String normalizeNamespace(@NotNull String namespace) {
        String ns = checkNotNull(namespace).trim();
        int start = 0;
        int end = ns.length();
        while (start < end && ns.charAt(start) == '/') {
            start++;
        }
        while (end > start && ns.charAt(end - 1) == '/') {
            end--;
        }
        return ns.substring(start, end);
    }
}
