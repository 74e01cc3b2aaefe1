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

import java.util.Collection;

import org.cimrepo.api.CIMException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Storage of one kind of CIM object (classes, instances or qualifier
 * declarations) within a namespace.
 * <p>
 * Stores hold objects as given. Callers receive the stored objects
 * themselves, which is safe because CIM model objects are immutable.
 *
 * @param <K> the key type: a name for classes and qualifier declarations,
 *            a model path for instances
 * @param <V> the object type
 */
public interface ObjectStore<K, V> {

    boolean exists(@NotNull K name);

    /**
     * @return the object stored under {@code name}, or {@code null} if none
     */
    @Nullable
    V get(@NotNull K name);

    /**
     * @throws CIMException {@code ALREADY_EXISTS} if {@code name} is present
     */
    void create(@NotNull K name, @NotNull V object) throws CIMException;

    /**
     * @throws CIMException {@code NOT_FOUND} if {@code name} is absent
     */
    void update(@NotNull K name, @NotNull V object) throws CIMException;

    /**
     * @throws CIMException {@code NOT_FOUND} if {@code name} is absent
     */
    void delete(@NotNull K name) throws CIMException;

    /**
     * @return snapshot of the keys, in insertion order
     */
    @NotNull
    Collection<K> names();

    /**
     * @return snapshot of the objects, in insertion order
     */
    @NotNull
    Collection<V> values();

    int size();
}
