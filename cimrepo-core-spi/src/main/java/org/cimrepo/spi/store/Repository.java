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
package org.cimrepo.spi.store;

import java.util.Set;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.jetbrains.annotations.NotNull;

/**
 * A set of namespaces, each with a class store, an instance store and a
 * qualifier declaration store. Namespace names compare case-insensitively
 * and leading or trailing slashes are ignored.
 */
public interface Repository {

    /**
     * @return the namespace names, as spelled when added
     */
    @NotNull
    Set<String> getNamespaces();

    boolean hasNamespace(@NotNull String namespace);

    /**
     * Checks that {@code namespace} exists.
     *
     * @return the namespace name as spelled when added
     * @throws CIMException {@code INVALID_NAMESPACE} if it does not exist
     */
    @NotNull
    String validateNamespace(@NotNull String namespace) throws CIMException;

    /**
     * @throws CIMException {@code ALREADY_EXISTS} if the namespace exists,
     *         {@code INVALID_PARAMETER} if the name is empty
     */
    void addNamespace(@NotNull String namespace) throws CIMException;

    /**
     * @throws CIMException {@code NOT_FOUND} if the namespace does not exist,
     *         {@code NAMESPACE_NOT_EMPTY} if it holds instances or classes
     *         other than system classes
     */
    void removeNamespace(@NotNull String namespace) throws CIMException;

    @NotNull
    ObjectStore<String, CIMClass> getClassStore(@NotNull String namespace) throws CIMException;

    /**
     * The instance store is keyed by {@link CIMInstanceName#modelPath() model
     * path}.
     */
    @NotNull
    ObjectStore<CIMInstanceName, CIMInstance> getInstanceStore(@NotNull String namespace) throws CIMException;

    @NotNull
    ObjectStore<String, CIMQualifierDeclaration> getQualifierStore(@NotNull String namespace) throws CIMException;
}
