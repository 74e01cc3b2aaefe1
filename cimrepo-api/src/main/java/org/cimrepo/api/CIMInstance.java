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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A CIM instance. Its identity is its {@link #getPath() path}, which the
 * repository derives from the key properties on creation.
 */
public final class CIMInstance implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final Map<String, CIMProperty> properties;
    private final Map<String, CIMQualifier> qualifiers;
    private final CIMInstanceName path;

    private CIMInstance(String className, Map<String, CIMProperty> properties,
                        Map<String, CIMQualifier> qualifiers, CIMInstanceName path) {
        this.className = checkNotNull(className);
        this.properties = properties;
        this.qualifiers = qualifiers;
        this.path = path;
    }

    @NotNull
    public static Builder builder(@NotNull String className) {
        return new Builder(className);
    }

    @NotNull
    public Builder toBuilder() {
        Builder b = new Builder(className);
        b.properties.putAll(properties);
        b.qualifiers.addAll(qualifiers.values());
        b.path = path;
        return b;
    }

    @NotNull
    public String getClassName() {
        return className;
    }

    @NotNull
    public Map<String, CIMProperty> getProperties() {
        return properties;
    }

    @Nullable
    public CIMProperty getProperty(@NotNull String name) {
        return properties.get(name);
    }

    /**
     * @return the value of the named property, or {@code null} if the
     *         property is absent or has no value
     */
    @Nullable
    public Object getPropertyValue(@NotNull String name) {
        CIMProperty p = properties.get(name);
        return p == null ? null : p.getValue();
    }

    @NotNull
    public Map<String, CIMQualifier> getQualifiers() {
        return qualifiers;
    }

    @Nullable
    public CIMInstanceName getPath() {
        return path;
    }

    @NotNull
    public CIMInstance withPath(@Nullable CIMInstanceName path) {
        return new CIMInstance(className, properties, qualifiers, path);
    }

    @NotNull
    public CIMInstance withProperties(@NotNull Collection<CIMProperty> properties) {
        return toBuilder().properties(properties).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMInstance)) {
            return false;
        }
        CIMInstance that = (CIMInstance) o;
        return Names.same(className, that.className) && properties.equals(that.properties)
                && qualifiers.equals(that.qualifiers) && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(className), path);
    }

    @Override
    public String toString() {
        return "instance of " + className + " " + properties.values();
    }

    public static final class Builder {

        private final String className;
        private final NocaseMap<CIMProperty> properties = new NocaseMap<>();
        private final List<CIMQualifier> qualifiers = new ArrayList<>();
        private CIMInstanceName path;

        private Builder(String className) {
            this.className = className;
        }

        public Builder property(@NotNull CIMProperty property) {
            properties.put(property.getName(), property);
            return this;
        }

        public Builder property(@NotNull String name, @NotNull CIMType type, @Nullable Object value) {
            return property(CIMProperty.of(name, type, value));
        }

        public Builder properties(@NotNull Collection<CIMProperty> properties) {
            this.properties.clear();
            for (CIMProperty p : properties) {
                property(p);
            }
            return this;
        }

        public Builder qualifier(@NotNull CIMQualifier qualifier) {
            qualifiers.add(qualifier);
            return this;
        }

        public Builder path(@Nullable CIMInstanceName path) {
            this.path = path;
            return this;
        }

        public CIMInstance build() {
            return new CIMInstance(className, Collections.unmodifiableMap(NocaseMap.copyOf(properties)),
                    Qualifiers.toMap(qualifiers), path);
        }
    }
}
