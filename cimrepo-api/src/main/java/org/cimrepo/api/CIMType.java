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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The CIM data types and the Java classes that represent their values.
 * Arrays are not separate types: elements carry an {@code array} flag and
 * an array value is a {@link List} of scalar values of the same type.
 */
public enum CIMType {

    BOOLEAN("boolean", Boolean.class),
    CHAR16("char16", Character.class),
    STRING("string", String.class),
    DATETIME("datetime", CIMDateTime.class),
    UINT8("uint8", Short.class, 0L, 0xFFL),
    UINT16("uint16", Integer.class, 0L, 0xFFFFL),
    UINT32("uint32", Long.class, 0L, 0xFFFFFFFFL),
    UINT64("uint64", BigInteger.class),
    SINT8("sint8", Byte.class, Byte.MIN_VALUE, Byte.MAX_VALUE),
    SINT16("sint16", Short.class, Short.MIN_VALUE, Short.MAX_VALUE),
    SINT32("sint32", Integer.class, Integer.MIN_VALUE, Integer.MAX_VALUE),
    SINT64("sint64", Long.class, Long.MIN_VALUE, Long.MAX_VALUE),
    REAL32("real32", Float.class),
    REAL64("real64", Double.class),
    REFERENCE("reference", CIMInstanceName.class);

    private static final Map<String, CIMType> TYPES = new HashMap<>();

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    static {
        for (CIMType type : values()) {
            TYPES.put(type.cimName, type);
        }
        TYPES.put("ref", REFERENCE);
    }

    private final String cimName;

    private final Class<?> valueClass;

    private final long min;

    private final long max;

    private final boolean bounded;

    CIMType(String cimName, Class<?> valueClass) {
        this.cimName = cimName;
        this.valueClass = valueClass;
        this.min = 0;
        this.max = 0;
        this.bounded = false;
    }

    CIMType(String cimName, Class<?> valueClass, long min, long max) {
        this.cimName = cimName;
        this.valueClass = valueClass;
        this.min = min;
        this.max = max;
        this.bounded = true;
    }

    /**
     * @return the MOF name of this type, e.g. {@code uint32}
     */
    @NotNull
    public String getCimName() {
        return cimName;
    }

    @NotNull
    public Class<?> getValueClass() {
        return valueClass;
    }

    /**
     * Looks up a type by its MOF name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    @NotNull
    public static CIMType fromCimName(@NotNull String name) {
        CIMType type = TYPES.get(name.toLowerCase(Locale.ROOT));
        checkArgument(type != null, "Unknown CIM type: %s", name);
        return type;
    }

    /**
     * Checks {@code value} against this type and converts integral and
     * floating point numbers to this type's value class.
     *
     * @param value a scalar, a {@link List} of scalars if {@code array}, or
     *              {@code null}
     * @return the checked value; array values are returned as unmodifiable
     *         lists
     * @throws IllegalArgumentException if the value does not fit this type
     */
    @Nullable
    public Object checkValue(@Nullable Object value, boolean array) {
        if (value == null) {
            return null;
        }
        if (array) {
            checkArgument(value instanceof List, "Array value of type %s expected, got %s", cimName, value);
            List<Object> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(element == null ? null : checkScalar(element));
            }
            return Collections.unmodifiableList(elements);
        }
        checkArgument(!(value instanceof List), "Scalar value of type %s expected, got %s", cimName, value);
        return checkScalar(value);
    }

    private Object checkScalar(Object value) {
        Object v = coerce(value);
        checkArgument(valueClass.isInstance(v), "Value %s (%s) is not valid for CIM type %s",
                value, value.getClass().getSimpleName(), cimName);
        if (bounded) {
            long l = ((Number) v).longValue();
            checkArgument(l >= min && l <= max, "Value %s out of range for CIM type %s", value, cimName);
        } else if (this == UINT64) {
            BigInteger b = (BigInteger) v;
            checkArgument(b.signum() >= 0 && b.compareTo(UINT64_MAX) <= 0,
                    "Value %s out of range for CIM type %s", value, cimName);
        }
        return v;
    }

    private Object coerce(Object value) {
        if (valueClass.isInstance(value) || !(value instanceof Number)) {
            return value;
        }
        Number n = (Number) value;
        boolean integral = value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger;
        switch (this) {
            case UINT8:
            case SINT16:
                return integral && n.longValue() >= Short.MIN_VALUE && n.longValue() <= Short.MAX_VALUE
                        ? (Object) n.shortValue() : value;
            case UINT16:
            case SINT32:
                return integral && n.longValue() >= Integer.MIN_VALUE && n.longValue() <= Integer.MAX_VALUE
                        ? (Object) n.intValue() : value;
            case UINT32:
            case SINT64:
                return integral && !(value instanceof BigInteger) ? (Object) n.longValue() : value;
            case SINT8:
                return integral && n.longValue() >= Byte.MIN_VALUE && n.longValue() <= Byte.MAX_VALUE
                        ? (Object) n.byteValue() : value;
            case UINT64:
                return integral ? (Object) BigInteger.valueOf(n.longValue()) : value;
            case REAL32:
                return (Object) n.floatValue();
            case REAL64:
                return (Object) n.doubleValue();
            default:
                return value;
        }
    }

    @Override
    public String toString() {
        return cimName;
    }
}
