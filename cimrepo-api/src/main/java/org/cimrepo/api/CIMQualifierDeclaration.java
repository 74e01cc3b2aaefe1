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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A qualifier type declaration. It fixes the type, the default value, the
 * scopes a qualifier may be used in and its default flavors.
 */
public final class CIMQualifierDeclaration implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final CIMType type;
    private final boolean array;
    private final Integer arraySize;
    private final Object value;
    private final Set<Scope> scopes;
    private final boolean overridable;
    private final boolean toSubclass;
    private final boolean toInstance;
    private final boolean translatable;

    private CIMQualifierDeclaration(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.array = builder.array;
        this.arraySize = builder.arraySize;
        this.value = type.checkValue(builder.value, array);
        this.scopes = Collections.unmodifiableSet(builder.scopes.isEmpty()
                ? EnumSet.noneOf(Scope.class) : EnumSet.copyOf(builder.scopes));
        this.overridable = builder.overridable;
        this.toSubclass = builder.toSubclass;
        this.toInstance = builder.toInstance;
        this.translatable = builder.translatable;
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

    @Nullable
    public Integer getArraySize() {
        return arraySize;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @NotNull
    public Set<Scope> getScopes() {
        return scopes;
    }

    public boolean isOverridable() {
        return overridable;
    }

    public boolean isToSubclass() {
        return toSubclass;
    }

    public boolean isToInstance() {
        return toInstance;
    }

    public boolean isTranslatable() {
        return translatable;
    }

    /**
     * @return {@code true} if a qualifier of this type may be used on an
     *         element of the given scope
     */
    public boolean isApplicableTo(@NotNull Scope scope) {
        return scopes.contains(Scope.ANY) || scopes.contains(scope);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMQualifierDeclaration)) {
            return false;
        }
        CIMQualifierDeclaration that = (CIMQualifierDeclaration) o;
        return Names.same(name, that.name) && type == that.type && array == that.array
                && Objects.equals(arraySize, that.arraySize) && Objects.equals(value, that.value)
                && scopes.equals(that.scopes) && overridable == that.overridable
                && toSubclass == that.toSubclass && toInstance == that.toInstance
                && translatable == that.translatable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(name), type, array, scopes);
    }

    @Override
    public String toString() {
        return "Qualifier " + name + " : " + type + (array ? "[]" : "") + " = " + value + " Scope" + scopes;
    }

    public static final class Builder {

        private final String name;
        private final CIMType type;
        private boolean array;
        private Integer arraySize;
        private Object value;
        private final Set<Scope> scopes = EnumSet.noneOf(Scope.class);
        private boolean overridable = true;
        private boolean toSubclass = true;
        private boolean toInstance;
        private boolean translatable;

        private Builder(String name, CIMType type) {
            this.name = checkNotNull(name);
            this.type = checkNotNull(type);
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

        public Builder scopes(Scope... scopes) {
            return scopes(Arrays.asList(scopes));
        }

        public Builder scopes(Collection<Scope> scopes) {
            this.scopes.addAll(scopes);
            return this;
        }

        public Builder overridable(boolean overridable) {
            this.overridable = overridable;
            return this;
        }

        public Builder toSubclass(boolean toSubclass) {
            this.toSubclass = toSubclass;
            return this;
        }

        public Builder toInstance(boolean toInstance) {
            this.toInstance = toInstance;
            return this;
        }

        public Builder translatable(boolean translatable) {
            this.translatable = translatable;
            return this;
        }

        public CIMQualifierDeclaration build() {
            return new CIMQualifierDeclaration(this);
        }
    }
}
