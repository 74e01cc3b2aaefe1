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

import java.util.Map;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMObjectPath;
import org.cimrepo.api.CIMParameter;
import org.jetbrains.annotations.NotNull;

/**
 * Implements the extrinsic methods of its classes.
 */
public interface MethodProvider extends Provider {

    /**
     * @param objectName target instance path, or class path for a static
     *                   method
     * @param inParams   validated input parameters keyed case-insensitively
     */
    @NotNull
    MethodResult invokeMethod(@NotNull String namespace, @NotNull String methodName,
                              @NotNull CIMObjectPath objectName, @NotNull Map<String, CIMParameter> inParams)
            throws CIMException;
}
