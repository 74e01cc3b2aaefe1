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

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * What a provider may use of the server it is registered with.
 */
public interface ProviderContext {

    /**
     * @return read/write access to the namespaces and their stores
     */
    @NotNull
    Repository getRepository();

    /**
     * @return the class with all inherited members, qualifiers and class
     *         origins
     * @throws CIMException {@code INVALID_NAMESPACE} or {@code INVALID_CLASS}
     */
    @NotNull
    CIMClass getResolvedClass(@NotNull String namespace, @NotNull String className) throws CIMException;

    /**
     * @return the repository's own instance-write behavior, for providers
     *         that refine rather than replace it
     */
    @NotNull
    InstanceWriteProvider getDefaultInstanceWriteProvider();

    /**
     * Creates a namespace without any of the bookkeeping the server does
     * for namespaces added by clients.
     *
     * @throws CIMException {@code ALREADY_EXISTS} if it exists
     */
    void addNamespace(@NotNull String namespace) throws CIMException;

    /**
     * Removes a namespace and the provider registrations in it.
     *
     * @throws CIMException {@code NOT_FOUND} if it does not exist,
     *         {@code NAMESPACE_NOT_EMPTY} if it holds instances or classes
     */
    void removeNamespace(@NotNull String namespace) throws CIMException;

    /**
     * @return the interop namespace, or {@code null} if none exists
     */
    @Nullable
    String getInteropNamespace();
}
