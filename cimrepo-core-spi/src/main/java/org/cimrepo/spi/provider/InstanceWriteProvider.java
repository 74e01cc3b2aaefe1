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

import java.util.List;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Handles CreateInstance, ModifyInstance and DeleteInstance for its
 * classes. Instances passed in have already been checked against the
 * resolved class: every property exists in the class with a matching type,
 * and property names use the class's spelling.
 */
public interface InstanceWriteProvider extends Provider {

    /**
     * @param namespace   existing namespace
     * @param newInstance instance to create; its path is not set
     * @return the path of the new instance
     */
    @NotNull
    CIMInstanceName createInstance(@NotNull String namespace, @NotNull CIMInstance newInstance)
            throws CIMException;

    /**
     * @param modifiedInstance instance whose path names an existing instance
     * @param propertyList     properties to modify, or {@code null} for all
     *                         properties of {@code modifiedInstance}
     */
    void modifyInstance(@NotNull String namespace, @NotNull CIMInstance modifiedInstance,
                        @Nullable List<String> propertyList) throws CIMException;

    void deleteInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName) throws CIMException;
}
