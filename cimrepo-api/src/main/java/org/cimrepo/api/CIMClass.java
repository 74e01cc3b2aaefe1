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
 * A CIM class.
 * <p>
 * A class as defined holds only its local members. A resolved class, as
 * returned by the repository, also holds the members inherited from its
 * superclass chain, each stamped with its class origin.
 */
public final class CIMClass implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final String superClass;
    private final Map<String, CIMProperty> properties;
    private final Map<String, CIMMethod> methods;
    private final Map<String, CIMQualifier> qualifiers;
    private final CIMClassName path;

    private CIMClass(String className, String superClass, Map<String, CIMProperty> properties,
                     Map<String, CIMMethod> methods, Map<String, CIMQualifier> qualifiers, CIMClassName path) {
        this.className = checkNotNull(className);
        this.superClass = superClass;
        this.properties = properties;
        this.methods = methods;
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
        b.superClass = superClass;
        b.properties.putAll(properties);
        b.methods.putAll(methods);
        b.qualifiers.addAll(qualifiers.values());
        b.path = path;
        return b;
    }

    @NotNull
    public String getClassName() {
        return className;
    }

    @Nullable
    public String getSuperClass() {
        return superClass;
    }

    @NotNull
    public Map<String, CIMProperty> getProperties() {
        return properties;
    }

    @Nullable
    public CIMProperty getProperty(@NotNull String name) {
        return properties.get(name);
    }

    @NotNull
    public Map<String, CIMMethod> getMethods() {
        return methods;
    }

    @Nullable
    public CIMMethod getMethod(@NotNull String name) {
        return methods.get(name);
    }

    @NotNull
    public Map<String, CIMQualifier> getQualifiers() {
        return qualifiers;
    }

    /**
     * @return the path of this class if it was returned by a class-level
     *         association operation, {@code null} otherwise
     */
    @Nullable
    public CIMClassName getPath() {
        return path;
    }

    public boolean isAssociation() {
        return Qualifiers.isTrue(qualifiers, Qualifiers.ASSOCIATION);
    }

    public boolean isAbstract() {
        return Qualifiers.isTrue(qualifiers, Qualifiers.ABSTRACT);
    }

    public boolean isIndication() {
        return Qualifiers.isTrue(qualifiers, Qualifiers.INDICATION);
    }

    /**
     * @return names of the properties qualified {@code Key}, in declaration
     *         order
     */
    @NotNull
    public List<String> getKeyPropertyNames() {
        List<String> keys = new ArrayList<>();
        for (CIMProperty p : properties.values()) {
            if (p.isKey()) {
                keys.add(p.getName());
            }
        }
        return keys;
    }

    @NotNull
    public CIMClass withPath(@Nullable CIMClassName path) {
        return new CIMClass(className, superClass, properties, methods, qualifiers, path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMClass)) {
            return false;
        }
        CIMClass that = (CIMClass) o;
        return Names.same(className, that.className) && Names.same(superClass, that.superClass)
                && properties.equals(that.properties) && methods.equals(that.methods)
                && qualifiers.equals(that.qualifiers) && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(className), properties.keySet().size());
    }

    @Override
    public String toString() {
        return "class " + className + (superClass != null ? " : " + superClass : "")
                + " " + properties.keySet() + " " + methods.keySet();
    }

    public static final class Builder {

        private final String className;
        private String superClass;
        private final NocaseMap<CIMProperty> properties = new NocaseMap<>();
        private final NocaseMap<CIMMethod> methods = new NocaseMap<>();
        private final List<CIMQualifier> qualifiers = new ArrayList<>();
        private CIMClassName path;

        private Builder(String className) {
            this.className = className;
        }

        public Builder superClass(@Nullable String superClass) {
            this.superClass = superClass;
            return this;
        }

        public Builder property(@NotNull CIMProperty property) {
            properties.put(property.getName(), property);
            return this;
        }

        public Builder properties(@NotNull Collection<CIMProperty> properties) {
            this.properties.clear();
            for (CIMProperty p : properties) {
                property(p);
            }
            return this;
        }

        public Builder method(@NotNull CIMMethod method) {
            methods.put(method.getName(), method);
            return this;
        }

        public Builder methods(@NotNull Collection<CIMMethod> methods) {
            this.methods.clear();
            for (CIMMethod m : methods) {
                method(m);
            }
            return this;
        }

        public Builder qualifier(@NotNull CIMQualifier qualifier) {
            qualifiers.removeIf(q -> Names.same(q.getName(), qualifier.getName()));
            qualifiers.add(qualifier);
            return this;
        }

        public Builder qualifier(@NotNull String name, boolean value) {
            return qualifier(CIMQualifier.of(name, value));
        }

        public Builder qualifiers(@NotNull Collection<CIMQualifier> qualifiers) {
            this.qualifiers.clear();
            this.qualifiers.addAll(qualifiers);
            return this;
        }

        public Builder path(@Nullable CIMClassName path) {
            this.path = path;
            return this;
        }

        public CIMClass build() {
            return new CIMClass(className, superClass,
                    Collections.unmodifiableMap(NocaseMap.copyOf(properties)),
                    Collections.unmodifiableMap(NocaseMap.copyOf(methods)),
                    Qualifiers.toMap(qualifiers), path);
        }
    }
}
