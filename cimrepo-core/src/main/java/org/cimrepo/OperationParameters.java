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
package org.cimrepo;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.NocaseMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Named parameters of an intrinsic operation, as decoded from a request.
 * Names are case-insensitive. Typed getters fail with
 * {@link CIMStatus#INVALID_PARAMETER} if a value has the wrong type or a
 * required value is missing.
 */
public final class OperationParameters {

    private final NocaseMap<Object> values = new NocaseMap<>();

    @NotNull
    public static OperationParameters create() {
        return new OperationParameters();
    }

    /**
     * Sets a parameter. A {@code null} value removes it.
     */
    @NotNull
    public OperationParameters set(@NotNull String name, @Nullable Object value) {
        if (value == null) {
            values.remove(checkNotNull(name));
        } else {
            values.put(checkNotNull(name), value);
        }
        return this;
    }

    public boolean contains(@NotNull String name) {
        return values.containsKey(name);
    }

    @Nullable
    public <T> T get(@NotNull String name, @NotNull Class<T> type) throws CIMException {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Parameter " + name + " must be a "
                    + type.getSimpleName() + ", not a " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    @NotNull
    public <T> T getRequired(@NotNull String name, @NotNull Class<T> type) throws CIMException {
        T value = get(name, type);
        if (value == null) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Missing required parameter " + name);
        }
        return value;
    }

    @Nullable
    public String getString(@NotNull String name) throws CIMException {
        return get(name, String.class);
    }

    public boolean getBoolean(@NotNull String name, boolean defaultValue) throws CIMException {
        Boolean value = get(name, Boolean.class);
        return value == null ? defaultValue : value;
    }

    /**
     * @return the value of an integral parameter, or {@code null}
     */
    @Nullable
    public Integer getInteger(@NotNull String name) throws CIMException {
        Number value = get(name, Number.class);
        if (value == null) {
            return null;
        }
        long l = value.longValue();
        if (l != value.doubleValue() || l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "Parameter " + name + " must be an integer: " + value);
        }
        return (int) l;
    }

    /**
     * @return a list of names such as a PropertyList, or {@code null}
     */
    @Nullable
    public List<String> getStringList(@NotNull String name) throws CIMException {
        Collection<?> value = get(name, Collection.class);
        if (value == null) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object element : value) {
            if (!(element instanceof String)) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER,
                        "Parameter " + name + " must only contain strings: " + element);
            }
            result.add((String) element);
        }
        return result;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
