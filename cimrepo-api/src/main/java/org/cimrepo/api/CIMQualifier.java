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
import java.util.List;
import java.util.Objects;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A qualifier value attached to a class, property, method or parameter.
 * <p>
 * Flavors are tri-state: a {@code null} flavor is unspecified and takes
 * its value from the matching {@link CIMQualifierDeclaration} when the
 * owning class is resolved.
 */
public final class CIMQualifier implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final CIMType type;
    private final boolean array;
    private final Object value;
    private final Boolean overridable;
    private final Boolean toSubclass;
    private final Boolean toInstance;
    private final Boolean translatable;
    private final boolean propagated;

    public CIMQualifier(@NotNull String name, @NotNull CIMType type, @Nullable Object value) {
        this(name, type, value instanceof List, value, null, null, null, null, false);
    }

    public CIMQualifier(@NotNull String name, @NotNull CIMType type, boolean array, @Nullable Object value,
                        @Nullable Boolean overridable, @Nullable Boolean toSubclass,
                        @Nullable Boolean toInstance, @Nullable Boolean translatable, boolean propagated) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        this.array = array;
        this.value = type.checkValue(value, array);
        this.overridable = overridable;
        this.toSubclass = toSubclass;
        this.toInstance = toInstance;
        this.translatable = translatable;
        this.propagated = propagated;
    }

    /**
     * Boolean qualifier such as {@code Key} or {@code Association}.
     */
    @NotNull
    public static CIMQualifier of(@NotNull String name, boolean value) {
        return new CIMQualifier(name, CIMType.BOOLEAN, value);
    }

    @NotNull
    public static CIMQualifier of(@NotNull String name, @NotNull String value) {
        return new CIMQualifier(name, CIMType.STRING, value);
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
    public Object getValue() {
        return value;
    }

    @Nullable
    public Boolean getOverridable() {
        return overridable;
    }

    @Nullable
    public Boolean getToSubclass() {
        return toSubclass;
    }

    @Nullable
    public Boolean getToInstance() {
        return toInstance;
    }

    @Nullable
    public Boolean getTranslatable() {
        return translatable;
    }

    public boolean isPropagated() {
        return propagated;
    }

    /**
     * @return {@code true} if the value is the boolean {@code true}
     */
    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    @NotNull
    public CIMQualifier withValue(@Nullable Object value) {
        return new CIMQualifier(name, type, array, value, overridable, toSubclass, toInstance, translatable, propagated);
    }

    @NotNull
    public CIMQualifier withFlavors(@Nullable Boolean overridable, @Nullable Boolean toSubclass,
                                    @Nullable Boolean toInstance, @Nullable Boolean translatable) {
        return new CIMQualifier(name, type, array, value, overridable, toSubclass, toInstance, translatable, propagated);
    }

    @NotNull
    public CIMQualifier withPropagated(boolean propagated) {
        return new CIMQualifier(name, type, array, value, overridable, toSubclass, toInstance, translatable, propagated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMQualifier)) {
            return false;
        }
        CIMQualifier that = (CIMQualifier) o;
        return Names.same(name, that.name) && type == that.type && array == that.array
                && propagated == that.propagated && Objects.equals(value, that.value)
                && Objects.equals(overridable, that.overridable) && Objects.equals(toSubclass, that.toSubclass)
                && Objects.equals(toInstance, that.toInstance) && Objects.equals(translatable, that.translatable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(name), type, value);
    }

    @Override
    public String toString() {
        return name + "(" + value + ")";
    }
}
