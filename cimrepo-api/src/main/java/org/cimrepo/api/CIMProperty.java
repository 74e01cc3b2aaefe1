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
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A property of a class or an instance.
 * <p>
 * Class properties carry qualifiers and, once resolved, the name of the
 * class that declared them ({@link #getClassOrigin()}) and whether they
 * were inherited ({@link #isPropagated()}).
 */
public final class CIMProperty implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final CIMType type;
    private final boolean array;
    private final Integer arraySize;
    private final Object value;
    private final String referenceClass;
    private final Map<String, CIMQualifier> qualifiers;
    private final String classOrigin;
    private final boolean propagated;

    private CIMProperty(String name, CIMType type, boolean array, Integer arraySize, Object value,
                        String referenceClass, Map<String, CIMQualifier> qualifiers,
                        String classOrigin, boolean propagated) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        checkArgument(referenceClass == null || type == CIMType.REFERENCE,
                "Reference class given for non-reference property %s", name);
        this.array = array;
        this.arraySize = arraySize;
        this.value = type.checkValue(value, array);
        this.referenceClass = referenceClass;
        this.qualifiers = qualifiers;
        this.classOrigin = classOrigin;
        this.propagated = propagated;
    }

    /**
     * Creates a property without qualifiers. A {@link List} value makes it
     * an array property.
     */
    @NotNull
    public static CIMProperty of(@NotNull String name, @NotNull CIMType type, @Nullable Object value) {
        return builder(name, type).value(value).build();
    }

    @NotNull
    public static CIMProperty reference(@NotNull String name, @Nullable String referenceClass,
                                        @Nullable CIMInstanceName value) {
        return builder(name, CIMType.REFERENCE).referenceClass(referenceClass).value(value).build();
    }

    @NotNull
    public static Builder builder(@NotNull String name, @NotNull CIMType type) {
        return new Builder(name, type);
    }

    @NotNull
    public Builder toBuilder() {
        Builder b = new Builder(name, type);
        b.array = array;
        b.arraySize = arraySize;
        b.value = value;
        b.referenceClass = referenceClass;
        b.qualifiers.addAll(qualifiers.values());
        b.classOrigin = classOrigin;
        b.propagated = propagated;
        return b;
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

    @Nullable
    public Integer getArraySize() {
        return arraySize;
    }

    @Nullable
    public Object getValue() {
        return value;
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
    public String getClassOrigin() {
        return classOrigin;
    }

    public boolean isPropagated() {
        return propagated;
    }

    public boolean isKey() {
        return Qualifiers.isTrue(qualifiers, Qualifiers.KEY);
    }

    @NotNull
    public CIMProperty withValue(@Nullable Object value) {
        return new CIMProperty(name, type, array, arraySize, value, referenceClass, qualifiers, classOrigin, propagated);
    }

    /**
     * Renames the property, e.g. to the spelling used by its class.
     */
    @NotNull
    public CIMProperty withName(@NotNull String name) {
        return new CIMProperty(name, type, array, arraySize, value, referenceClass, qualifiers, classOrigin, propagated);
    }

    @NotNull
    public CIMProperty withQualifiers(@NotNull Collection<CIMQualifier> qualifiers) {
        return new CIMProperty(name, type, array, arraySize, value, referenceClass,
                Qualifiers.toMap(qualifiers), classOrigin, propagated);
    }

    @NotNull
    public CIMProperty withOrigin(@Nullable String classOrigin, boolean propagated) {
        return new CIMProperty(name, type, array, arraySize, value, referenceClass, qualifiers, classOrigin, propagated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMProperty)) {
            return false;
        }
        CIMProperty that = (CIMProperty) o;
        return Names.same(name, that.name) && type == that.type && array == that.array
                && propagated == that.propagated && Objects.equals(arraySize, that.arraySize)
                && Objects.equals(value, that.value) && Names.same(referenceClass, that.referenceClass)
                && Names.same(classOrigin, that.classOrigin) && qualifiers.equals(that.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(name), type, array, value);
    }

    @Override
    public String toString() {
        return name + " : " + (referenceClass != null ? referenceClass + " REF" : type) + (array ? "[]" : "")
                + " = " + value;
    }

    public static final class Builder {

        private final String name;
        private final CIMType type;
        private boolean array;
        private Integer arraySize;
        private Object value;
        private String referenceClass;
        private final List<CIMQualifier> qualifiers = new ArrayList<>();
        private String classOrigin;
        private boolean propagated;

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

        public Builder value(@Nullable Object value) {
            this.value = value;
            if (value instanceof List) {
                this.array = true;
            }
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

        public Builder qualifier(@NotNull String name, boolean value) {
            return qualifier(CIMQualifier.of(name, value));
        }

        /**
         * Shortcut for the {@code Key} qualifier.
         */
        public Builder key() {
            return qualifier(Qualifiers.KEY, true);
        }

        public Builder classOrigin(@Nullable String classOrigin) {
            this.classOrigin = classOrigin;
            return this;
        }

        public Builder propagated(boolean propagated) {
            this.propagated = propagated;
            return this;
        }

        public CIMProperty build() {
            return new CIMProperty(name, type, array, arraySize, value, referenceClass,
                    Qualifiers.toMap(qualifiers), classOrigin, propagated);
        }
    }
}
