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
package org.cimrepo.spi.provider;

import java.util.EnumSet;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

/**
 * Provider capabilities. A registration is made per capability, so one
 * provider object may be registered under several types.
 */
public enum ProviderType {

    INSTANCE_WRITE("instance-write", InstanceWriteProvider.class),
    METHOD("method", MethodProvider.class),
    ASSOCIATION("association", AssociationProvider.class);

    private final String name;

    private final Class<? extends Provider> capability;

    ProviderType(String name, Class<? extends Provider> capability) {
        this.name = name;
        this.capability = capability;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public Class<? extends Provider> getCapability() {
        return capability;
    }

    public boolean isImplementedBy(@NotNull Provider provider) {
        return capability.isInstance(provider);
    }

    /**
     * @return the capabilities {@code provider} implements
     */
    @NotNull
    public static Set<ProviderType> of(@NotNull Provider provider) {
        Set<ProviderType> types = EnumSet.noneOf(ProviderType.class);
        for (ProviderType type : values()) {
            if (type.isImplementedBy(provider)) {
                types.add(type);
            }
        }
        return types;
    }

    @Override
    public String toString() {
        return name;
    }
}
