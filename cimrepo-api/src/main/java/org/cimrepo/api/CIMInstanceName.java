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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Path of an instance: its class name and key bindings, optionally
 * qualified by namespace and host.
 * <p>
 * Two instance names are equal if class name, namespace and host match
 * case-insensitively and they bind the same set of keys to equal values.
 * Integral key values are held as {@code Long} (or {@code BigInteger} beyond
 * the range of a long) and real values as {@code Double}, so a key compares
 * by its numeric value whatever boxed type the caller used.
 * Repositories identify instances by {@link #modelPath()}, which drops
 * namespace and host.
 */
public final class CIMInstanceName implements CIMObjectPath {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final Map<String, Object> keyBindings;
    private final String namespace;
    private final String host;

    private CIMInstanceName(String className, Map<String, Object> keyBindings, String namespace, String host) {
        this.className = checkNotNull(className);
        this.keyBindings = keyBindings;
        this.namespace = namespace == null ? null : Names.normalizeNamespace(namespace);
        this.host = host;
    }

    /**
     * @throws IllegalArgumentException if a key value is {@code null}, an
     *         array, or not a CIM value
     */
    @NotNull
    public static CIMInstanceName of(@NotNull String className, @NotNull Map<String, ?> keyBindings,
                                     @Nullable String namespace) {
        NocaseMap<Object> keys = new NocaseMap<>();
        for (Map.Entry<String, ?> e : keyBindings.entrySet()) {
            keys.put(e.getKey(), checkKeyValue(e.getKey(), e.getValue()));
        }
        return new CIMInstanceName(className, Collections.unmodifiableMap(keys), namespace, null);
    }

    @NotNull
    public static CIMInstanceName of(@NotNull String className, @NotNull Map<String, ?> keyBindings) {
        return of(className, keyBindings, null);
    }

    @NotNull
    public static Builder builder(@NotNull String className) {
        return new Builder(className);
    }

    @NotNull
    @Override
    public String getClassName() {
        return className;
    }

    /**
     * @return unmodifiable, case-insensitive key bindings
     */
    @NotNull
    public Map<String, Object> getKeyBindings() {
        return keyBindings;
    }

    @Nullable
    public Object getKey(@NotNull String name) {
        return keyBindings.get(name);
    }

    @Nullable
    @Override
    public String getNamespace() {
        return namespace;
    }

    @Nullable
    @Override
    public String getHost() {
        return host;
    }

    @NotNull
    @Override
    public CIMInstanceName withNamespace(@Nullable String namespace) {
        return new CIMInstanceName(className, keyBindings, namespace, host);
    }

    @NotNull
    @Override
    public CIMInstanceName withHost(@Nullable String host) {
        return new CIMInstanceName(className, keyBindings, namespace, host);
    }

    /**
     * @return this path without namespace and host
     */
    @NotNull
    public CIMInstanceName modelPath() {
        if (namespace == null && host == null) {
            return this;
        }
        return new CIMInstanceName(className, keyBindings, null, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMInstanceName)) {
            return false;
        }
        CIMInstanceName that = (CIMInstanceName) o;
        return Names.same(className, that.className) && Names.same(namespace, that.namespace)
                && Names.same(host, that.host) && keyBindings.equals(that.keyBindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(className), keyBindings);
    }

    /**
     * Renders the path as a WBEM URI, with keys sorted by name.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (host != null) {
            sb.append("//").append(host);
        }
        if (namespace != null) {
            sb.append('/').append(namespace).append(':');
        }
        sb.append(className);
        List<String> names = new ArrayList<>(keyBindings.keySet());
        names.sort(String.CASE_INSENSITIVE_ORDER);
        String separator = ".";
        for (String name : names) {
            sb.append(separator).append(name).append('=');
            appendKeyValue(sb, keyBindings.get(name));
            separator = ",";
        }
        return sb.toString();
    }

    //-----------------------------------------------------------< private >--

    private static Object checkKeyValue(String name, Object value) {
        checkArgument(value != null, "Key binding %s has no value", name);
        checkArgument(value instanceof String || value instanceof Boolean || value instanceof Character
                        || value instanceof Number || value instanceof CIMDateTime
                        || value instanceof CIMInstanceName,
                "Key binding %s has an invalid value: %s", name, value);
        return value instanceof Number ? normalizeNumber((Number) value) : value;
    }

    private static Number normalizeNumber(Number n) {
        if (n instanceof Byte || n instanceof Short || n instanceof Integer) {
            return n.longValue();
        }
        if (n instanceof BigInteger) {
            BigInteger b = (BigInteger) n;
            return b.bitLength() < 64 ? (Number) b.longValue() : b;
        }
        if (n instanceof Float) {
            return Double.valueOf(n.toString());
        }
        return n;
    }

    private static void appendKeyValue(StringBuilder sb, Object value) {
        if (value instanceof Boolean) {
            sb.append((Boolean) value ? "TRUE" : "FALSE");
        } else if (value instanceof Number) {
            sb.append(value);
        } else {
            sb.append('"');
            String s = value.toString();
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"' || c == '\\') {
                    sb.append('\\');
                }
                sb.append(c);
            }
            sb.append('"');
        }
    }

    public static final class Builder {

        private final String className;
        private final NocaseMap<Object> keys = new NocaseMap<>();
        private String namespace;
        private String host;

        private Builder(String className) {
            this.className = className;
        }

        public Builder key(@NotNull String name, @NotNull Object value) {
            keys.put(name, checkKeyValue(name, value));
            return this;
        }

        public Builder namespace(@Nullable String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder host(@Nullable String host) {
            this.host = host;
            return this;
        }

        public CIMInstanceName build() {
            return new CIMInstanceName(className, Collections.unmodifiableMap(NocaseMap.copyOf(keys)),
                    namespace, host);
        }
    }
}
