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

import java.util.Set;

import org.jetbrains.annotations.NotNull;

/**
 * Base interface of user supplied providers. A provider implements one or
 * more of the capability interfaces {@link InstanceWriteProvider},
 * {@link MethodProvider} and {@link AssociationProvider}, and is registered
 * for the classes it names.
 * <p>
 * Providers that should survive a repository snapshot must be
 * {@link java.io.Serializable}; they should keep the {@link ProviderContext}
 * in a transient field, since {@link #init(ProviderContext)} is called again
 * after a restore.
 */
public interface Provider {

    /**
     * @return names of the classes this provider serves
     */
    @NotNull
    Set<String> getProvidedClassNames();

    /**
     * Called once the provider has been registered.
     */
    default void init(@NotNull ProviderContext context) {
    }
}
