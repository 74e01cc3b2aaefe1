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
 * A method declared by a class.
 */
public final class CIMMethod implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final CIMType returnType;
    private final Map<String, CIMParameter> parameters;
    private final Map<String, CIMQualifier> qualifiers;
    private final String classOrigin;
    private final boolean propagated;

    private CIMMethod(String name, CIMType returnType, Map<String, CIMParameter> parameters,
                      Map<String, CIMQualifier> qualifiers, String classOrigin, boolean propagated) {
        this.name = checkNotNull(name);
        this.returnType = checkNotNull(returnType);
        this.parameters = parameters;
        this.qualifiers = qualifiers;
        this.classOrigin = classOrigin;
        this.propagated = propagated;
    }

    @NotNull
    public static Builder builder(@NotNull String name, @NotNull CIMType returnType) {
        return new Builder(name, returnType);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public CIMType getReturnType() {
        return returnType;
    }

    /**
     * @return parameters in declaration order, keyed case-insensitively
     */
    @NotNull
    public Map<String, CIMParameter> getParameters() {
        return parameters;
    }

    @NotNull
    public Map<String, CIMQualifier> getQualifiers() {
        return qualifiers;
    }

    @Nullable
    public String getClassOrigin() {
        return classOrigin;
    }

    public boolean isPropagated() {
        return propagated;
    }

    public boolean isStatic() {
        return Qualifiers.isTrue(qualifiers, Qualifiers.STATIC);
    }

    @NotNull
    public CIMMethod withQualifiers(@NotNull Collection<CIMQualifier> qualifiers) {
        return new CIMMethod(name, returnType, parameters, Qualifiers.toMap(qualifiers), classOrigin, propagated);
    }

    @NotNull
    public CIMMethod withOrigin(@Nullable String classOrigin, boolean propagated) {
        return new CIMMethod(name, returnType, parameters, qualifiers, classOrigin, propagated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMMethod)) {
            return false;
        }
        CIMMethod that = (CIMMethod) o;
        return Names.same(name, that.name) && returnType == that.returnType
                && propagated == that.propagated && Names.same(classOrigin, that.classOrigin)
                && parameters.equals(that.parameters) && qualifiers.equals(that.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(name), returnType);
    }

    @Override
    public String toString() {
        return returnType + " " + name + parameters.values();
    }

    public static final class Builder {

        private final String name;
        private final CIMType returnType;
        private final NocaseMap<CIMParameter> parameters = new NocaseMap<>();
        private final List<CIMQualifier> qualifiers = new ArrayList<>();
        private String classOrigin;
        private boolean propagated;

        private Builder(String name, CIMType returnType) {
            this.name = name;
            this.returnType = returnType;
        }

        public Builder parameter(@NotNull CIMParameter parameter) {
            parameters.put(parameter.getName(), parameter);
            return this;
        }

        public Builder qualifier(@NotNull CIMQualifier qualifier) {
            qualifiers.add(qualifier);
            return this;
        }

        public Builder qualifier(@NotNull String name, boolean value) {
            return qualifier(CIMQualifier.of(name, value));
        }

        public Builder classOrigin(@Nullable String classOrigin) {
            this.classOrigin = classOrigin;
            return this;
        }

        public Builder propagated(boolean propagated) {
            this.propagated = propagated;
            return this;
        }

        public CIMMethod build() {
            return new CIMMethod(name, returnType, Collections.unmodifiableMap(NocaseMap.copyOf(parameters)),
                    Qualifiers.toMap(qualifiers), classOrigin, propagated);
        }
    }
}
