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

import java.util.HashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * Status codes reported by failed CIM operations, as defined by DSP0200.
 */
public enum CIMStatus {

    FAILED(1),
    ACCESS_DENIED(2),
    INVALID_NAMESPACE(3),
    INVALID_PARAMETER(4),
    INVALID_CLASS(5),
    NOT_FOUND(6),
    NOT_SUPPORTED(7),
    CLASS_HAS_CHILDREN(8),
    CLASS_HAS_INSTANCES(9),
    INVALID_SUPERCLASS(10),
    ALREADY_EXISTS(11),
    QUERY_LANGUAGE_NOT_SUPPORTED(14),
    METHOD_NOT_AVAILABLE(16),
    METHOD_NOT_FOUND(17),
    NAMESPACE_NOT_EMPTY(20),
    INVALID_ENUMERATION_CONTEXT(21),
    FILTERED_ENUMERATION_NOT_SUPPORTED(25);

    private static final Map<Integer, CIMStatus> BY_CODE = new HashMap<>();

    static {
        for (CIMStatus status : values()) {
            BY_CODE.put(status.code, status);
        }
    }

    private final int code;

    CIMStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the symbolic name, e.g. {@code CIM_ERR_NOT_FOUND}
     */
    @NotNull
    public String getName() {
        return "CIM_ERR_" + name();
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not a known status
     */
    @NotNull
    public static CIMStatus fromCode(int code) {
        CIMStatus status = BY_CODE.get(code);
        if (status == null) {
            throw new IllegalArgumentException("Unknown CIM status code: " + code);
        }
        return status;
    }
}
