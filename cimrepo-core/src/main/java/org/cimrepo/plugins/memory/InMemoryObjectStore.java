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
package org.cimrepo.plugins.memory;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.spi.store.ObjectStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Basic in-memory object store. Objects are held in insertion order under a
 * normalized key, so that class names compare case-insensitively and
 * instance paths compare without namespace and host.
 */
public class InMemoryObjectStore<K, V> implements ObjectStore<K, V>, Serializable {

    private static final long serialVersionUID = 1L;

    private final String kind;

    private final Map<Object, Entry<K, V>> objects = new LinkedHashMap<>();

    private final SerializableFunction<K, Object> normalizer;

    /**
     * @param kind       name of the stored object kind, used in messages
     * @param normalizer maps a key to the form used for lookups
     */
    public InMemoryObjectStore(@NotNull String kind, @NotNull SerializableFunction<K, Object> normalizer) {
        this.kind = checkNotNull(kind);
        this.normalizer = checkNotNull(normalizer);
    }

    @Override
    public synchronized boolean exists(@NotNull K name) {
        return objects.containsKey(normalizer.apply(checkNotNull(name)));
    }

    @Nullable
    @Override
    public synchronized V get(@NotNull K name) {
        Entry<K, V> e = objects.get(normalizer.apply(checkNotNull(name)));
        return e == null ? null : e.value;
    }

    @Override
    public synchronized void create(@NotNull K name, @NotNull V object) throws CIMException {
        checkNotNull(object);
        Object key = normalizer.apply(checkNotNull(name));
        if (objects.containsKey(key)) {
            throw new CIMException(CIMStatus.ALREADY_EXISTS, kind + " " + name + " already exists");
        }
        objects.put(key, new Entry<>(name, object));
    }

    @Override
    public synchronized void update(@NotNull K name, @NotNull V object) throws CIMException {
        checkNotNull(object);
        Object key = normalizer.apply(checkNotNull(name));
        Entry<K, V> e = objects.get(key);
        if (e == null) {
            throw new CIMException(CIMStatus.NOT_FOUND, kind + " " + name + " not found");
        }
        e.value = object;
    }

    @Override
    public synchronized void delete(@NotNull K name) throws CIMException {
        if (objects.remove(normalizer.apply(checkNotNull(name))) == null) {
            throw new CIMException(CIMStatus.NOT_FOUND, kind + " " + name + " not found");
        }
    }

    @NotNull
    @Override
    public synchronized Collection<K> names() {
        Collection<K> names = new ArrayList<>(objects.size());
        for (Entry<K, V> e : objects.values()) {
            names.add(e.name);
        }
        return names;
    }

    @NotNull
    @Override
    public synchronized Collection<V> values() {
        Collection<V> values = new ArrayList<>(objects.size());
        for (Entry<K, V> e : objects.values()) {
            values.add(e.value);
        }
        return values;
    }

    @Override
    public synchronized int size() {
        return objects.size();
    }

    @Override
    public synchronized String toString() {
        return kind + " store " + names();
    }

    /**
     * A key normalizer that survives serialization of the store.
     */
    public interface SerializableFunction<T, R> extends Function<T, R>, Serializable {
    }

    private static final class Entry<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        private final K name;

        private V value;

        Entry(K name, V value) {
            this.name = name;
            this.value = value;
        }
    }
}
