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

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.Names;
import org.cimrepo.spi.provider.ProviderType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The WBEM intrinsic operations, by their wire name. Operations that may be
 * handled by a registered provider name the provider capability they route
 * through.
 *
 * @see MockWBEMServer#invoke(IntrinsicMethod, String, OperationParameters)
 */
public enum IntrinsicMethod {

    GET_CLASS("GetClass"),
    ENUMERATE_CLASSES("EnumerateClasses"),
    ENUMERATE_CLASS_NAMES("EnumerateClassNames"),
    CREATE_CLASS("CreateClass"),
    MODIFY_CLASS("ModifyClass"),
    DELETE_CLASS("DeleteClass"),

    GET_QUALIFIER("GetQualifier"),
    ENUMERATE_QUALIFIERS("EnumerateQualifiers"),
    SET_QUALIFIER("SetQualifier"),
    DELETE_QUALIFIER("DeleteQualifier"),

    GET_INSTANCE("GetInstance"),
    ENUMERATE_INSTANCES("EnumerateInstances"),
    ENUMERATE_INSTANCE_NAMES("EnumerateInstanceNames"),
    CREATE_INSTANCE("CreateInstance", ProviderType.INSTANCE_WRITE),
    MODIFY_INSTANCE("ModifyInstance", ProviderType.INSTANCE_WRITE),
    DELETE_INSTANCE("DeleteInstance", ProviderType.INSTANCE_WRITE),
    EXEC_QUERY("ExecQuery"),

    ASSOCIATORS("Associators", ProviderType.ASSOCIATION),
    ASSOCIATOR_NAMES("AssociatorNames", ProviderType.ASSOCIATION),
    REFERENCES("References", ProviderType.ASSOCIATION),
    REFERENCE_NAMES("ReferenceNames", ProviderType.ASSOCIATION),

    OPEN_ENUMERATE_INSTANCES("OpenEnumerateInstances"),
    OPEN_ENUMERATE_INSTANCE_PATHS("OpenEnumerateInstancePaths"),
    OPEN_REFERENCE_INSTANCES("OpenReferenceInstances", ProviderType.ASSOCIATION),
    OPEN_REFERENCE_INSTANCE_PATHS("OpenReferenceInstancePaths", ProviderType.ASSOCIATION),
    OPEN_ASSOCIATOR_INSTANCES("OpenAssociatorInstances", ProviderType.ASSOCIATION),
    OPEN_ASSOCIATOR_INSTANCE_PATHS("OpenAssociatorInstancePaths", ProviderType.ASSOCIATION),
    OPEN_QUERY_INSTANCES("OpenQueryInstances"),
    PULL_INSTANCES_WITH_PATH("PullInstancesWithPath"),
    PULL_INSTANCE_PATHS("PullInstancePaths"),
    PULL_INSTANCES("PullInstances"),
    CLOSE_ENUMERATION("CloseEnumeration");

    private static final Map<String, IntrinsicMethod> BY_NAME;

    static {
        ImmutableMap.Builder<String, IntrinsicMethod> b = ImmutableMap.builder();
        for (IntrinsicMethod m : values()) {
            b.put(Names.fold(m.wireName), m);
        }
        BY_NAME = b.build();
    }

    private final String wireName;

    private final ProviderType providerType;

    IntrinsicMethod(String wireName) {
        this(wireName, null);
    }

    IntrinsicMethod(String wireName, ProviderType providerType) {
        this.wireName = wireName;
        this.providerType = providerType;
    }

    @NotNull
    public String getWireName() {
        return wireName;
    }

    /**
     * @return the provider capability that can take over this operation,
     *         or {@code null} if it is always served by the repository
     */
    @Nullable
    public ProviderType getProviderType() {
        return providerType;
    }

    /**
     * Looks up an operation by its wire name, ignoring case.
     *
     * @throws CIMException {@code NOT_SUPPORTED} for an unknown name
     */
    @NotNull
    public static IntrinsicMethod fromWireName(@NotNull String name) throws CIMException {
        IntrinsicMethod m = BY_NAME.get(Names.fold(name));
        if (m == null) {
            throw new CIMException(CIMStatus.NOT_SUPPORTED, "Unknown intrinsic method " + name);
        }
        return m;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
