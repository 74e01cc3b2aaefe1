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
package org.cimrepo.commons;

import java.io.Serializable;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An insertion-ordered map with case-insensitive {@code String} keys.
 * <p>
 * Keys keep the spelling they were last put with. Lookups, removal and
 * {@link #equals(Object)} fold keys with {@link Names#fold(String)}, so two
 * maps are equal when they hold the same values under keys that differ only
 * in case. {@code null} keys are not supported, {@code null} values are.
 *
 * @param <V> value type
 */
public class NocaseMap<V> extends AbstractMap<String, V> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Item<V>> items = new LinkedHashMap<>();

    public NocaseMap() {
    }

    public NocaseMap(@NotNull Map<String, ? extends V> map) {
        putAll(map);
    }

    /**
     * Creates a copy of {@code map}, or an empty map for {@code null}.
     */
    @NotNull
    public static <V> NocaseMap<V> copyOf(Map<String, ? extends V> map) {
        NocaseMap<V> copy = new NocaseMap<>();
        if (map != null) {
            copy.putAll(map);
        }
        return copy;
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public boolean containsKey(Object key) {
        return key instanceof String && items.containsKey(Names.fold((String) key));
    }

    @Override
    public V get(Object key) {
        if (!(key instanceof String)) {
            return null;
        }
        Item<V> item = items.get(Names.fold((String) key));
        return item == null ? null : item.value;
    }

    @Override
    public V put(String key, V value) {
        Item<V> old = items.put(Names.fold(checkNotNull(key)), new Item<>(key, value));
        return old == null ? null : old.value;
    }

    @Override
    public V remove(Object key) {
        if (!(key instanceof String)) {
            return null;
        }
        Item<V> old = items.remove(Names.fold((String) key));
        return old == null ? null : old.value;
    }

    @Override
    public void clear() {
        items.clear();
    }

    /**
     * Returns the key as it was spelled when put, or {@code null} if there
     * is no such key.
     */
    public String getOriginalKey(@NotNull String key) {
        Item<V> item = items.get(Names.fold(key));
        return item == null ? null : item.key;
    }

    @NotNull
    @Override
    public Set<Entry<String, V>> entrySet() {
        return new AbstractSet<Entry<String, V>>() {
            @Override
            public Iterator<Entry<String, V>> iterator() {
                Iterator<Item<V>> it = items.values().iterator();
                return new Iterator<Entry<String, V>>() {
                    @Override
                    public boolean hasNext() {
                        return it.hasNext();
                    }

                    @Override
                    public Entry<String, V> next() {
                        return it.next();
                    }

                    @Override
                    public void remove() {
                        it.remove();
                    }
                };
            }

            @Override
            public int size() {
                return items.size();
            }
        };
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof Map)) {
            return false;
        }
        Map<?, ?> other = (Map<?, ?>) o;
        if (other.size() != size()) {
            return false;
        }
        for (Entry<?, ?> e : other.entrySet()) {
            if (!(e.getKey() instanceof String) || !containsKey(e.getKey())
                    || !Objects.equals(get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, Item<V>> e : items.entrySet()) {
            h += e.getKey().hashCode() ^ Objects.hashCode(e.getValue().value);
        }
        return h;
    }

    //-----------------------------------------------------------< private >--

    private static final class Item<V> implements Entry<String, V>, Serializable {

        private static final long serialVersionUID = 1L;

        private final String key;
        private V value;

        Item(String key, V value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        @Override
        public V setValue(V value) {
            V old = this.value;
            this.value = value;
            return old;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Entry)) {
                return false;
            }
            Entry<?, ?> e = (Entry<?, ?>) o;
            return e.getKey() instanceof String && Names.same(key, (String) e.getKey())
                    && Objects.equals(value, e.getValue());
        }

        @Override
        public int hashCode() {
            return Names.fold(key).hashCode() ^ Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }
}
