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
import org.cimrepo.api.CIMInstanceName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the association instances referring to instances of its
 * classes, in place of the repository's scan of stored associations.
 * Instance-returning operations are served by fetching the returned paths
 * from the repository.
 */
public interface AssociationProvider extends Provider {

    /**
     * @return paths of the association instances referring to
     *         {@code objectName}, filtered by {@code resultClass} and
     *         {@code role}
     */
    @NotNull
    List<CIMInstanceName> referenceNames(@NotNull String namespace, @NotNull CIMInstanceName objectName,
                                         @Nullable String resultClass, @Nullable String role) throws CIMException;

    /**
     * @return paths of the instances associated with {@code objectName}
     */
    @NotNull
    List<CIMInstanceName> associatorNames(@NotNull String namespace, @NotNull CIMInstanceName objectName,
                                          @Nullable String assocClass, @Nullable String resultClass,
                                          @Nullable String role, @Nullable String resultRole) throws CIMException;
}
