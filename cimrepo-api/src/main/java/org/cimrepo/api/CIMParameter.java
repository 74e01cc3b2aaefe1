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
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A method parameter. In a method declaration the value is unused; in an
 * invocation it carries the argument.
 */
public final class CIMParameter implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final CIMType type;
    private final boolean array;
    private final Integer arraySize;
    private final String referenceClass;
    private final Map<String, CIMQualifier> qualifiers;
    private final Object value;

    private CIMParameter(String name, CIMType type, boolean array, Integer arraySize, String referenceClass,
                         Map<String, CIMQualifier> qualifiers, Object value) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        this.array = array;
        this.arraySize = arraySize;
        this.referenceClass = referenceClass;
        this.qualifiers = qualifiers;
        this.value = type.checkValue(value, array);
    }

    /**
     * Creates an argument for a method invocation.
     */
    @NotNull
    public static CIMParameter of(@NotNull String name, @NotNull CIMType type, @Nullable Object value) {
        return builder(name, type).value(value).build();
    }

    @NotNull
    public static Builder builder(@NotNull String name, @NotNull CIMType type) {
        return new Builder(name, type);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public CIMType getType() {
        return type;
    }

    public boolean isArray() {
        return array;
    }

    /**
     * @return the size of a fixed-size array parameter, or {@code null}
     */
    @Nullable
    public Integer getArraySize() {
        return arraySize;
    }

    @Nullable
    public String getReferenceClass() {
        return referenceClass;
    }

    @NotNull
    public Map<String, CIMQualifier> getQualifiers() {
        return qualifiers;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @NotNull
    public CIMParameter withName(@NotNull String name) {
        return new CIMParameter(name, type, array, arraySize, referenceClass, qualifiers, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMParameter)) {
            return false;
        }
        CIMParameter that = (CIMParameter) o;
        return Names.same(name, that.name) && type == that.type && array == that.array
                && Objects.equals(arraySize, that.arraySize) && Names.same(referenceClass, that.referenceClass) && qualifiers.equals(that.qualifiers)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(name), type, array);
    }

    @Override
    public String toString() {
        return name + " : " + type + (array ? "[]" : "") + (value != null ? " = " + value : "");
    }

    public static final class Builder {

        private final String name;
        private final CIMType type;
        private boolean array;
        private Integer arraySize;
        private String referenceClass;
        private final List<CIMQualifier> qualifiers = new ArrayList<>();
        private Object value;

        private Builder(String name, CIMType type) {
            this.name = name;
            this.type = type;
        }

        public Builder array(boolean array) {
            this.array = array;
            return this;
        }

        public Builder arraySize(@Nullable Integer arraySize) {
            this.arraySize = arraySize;
            return this;
        }

        public Builder referenceClass(@Nullable String referenceClass) {
            this.referenceClass = referenceClass;
            return this;
        }

        public Builder qualifier(@NotNull CIMQualifier qualifier) {
            qualifiers.add(qualifier);
            return this;
        }

        public Builder value(@Nullable Object value) {
            this.value = value;
            if (value instanceof List) {
                this.array = true;
            }
            return this;
        }

        public CIMParameter build() {
            return new CIMParameter(name, type, array, arraySize, referenceClass, Qualifiers.toMap(qualifiers),
                    value);
        }
    }
}
