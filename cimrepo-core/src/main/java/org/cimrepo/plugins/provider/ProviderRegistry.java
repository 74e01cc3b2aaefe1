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
package org.cimrepo.plugins.provider;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.Sets;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.cimrepo.spi.provider.AssociationProvider;
import org.cimrepo.spi.provider.InstanceWriteProvider;
import org.cimrepo.spi.provider.MethodProvider;
import org.cimrepo.spi.provider.Provider;
import org.cimrepo.spi.provider.ProviderType;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registered providers, keyed by namespace, class name and provider type.
 * Namespace and class names are case-insensitive.
 * <p>
 * Two registries are equal if they hold registrations for the same
 * namespaces, classes and types by providers of the same classes, so a
 * registry compares equal to its restored snapshot.
 */
public class ProviderRegistry implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final NocaseMap<NocaseMap<EnumMap<ProviderType, Provider>>> registry = new NocaseMap<>();

    /**
     * Registers {@code provider} for each of its classes in each namespace,
     * under every capability it implements. Either all registrations are
     * made or none.
     *
     * @throws CIMException {@code INVALID_PARAMETER} if the provider has no
     *         capability or names no class, or no namespace is given;
     *         {@code INVALID_NAMESPACE} or {@code INVALID_CLASS} if a
     *         namespace or class does not exist; {@code ALREADY_EXISTS} if a
     *         provider of the same type is registered for one of the classes
     */
    public synchronized void register(@NotNull Repository repository, @NotNull Provider provider,
                                      @NotNull Collection<String> namespaces) throws CIMException {
        checkNotNull(provider);
        Set<ProviderType> types = ProviderType.of(provider);
        if (types.isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Provider " + provider.getClass().getName()
                    + " implements none of the provider capabilities");
        }
        Set<String> classNames = provider.getProvidedClassNames();
        if (classNames.isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "Provider " + provider.getClass().getName() + " names no class");
        }
        if (namespaces.isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "No namespace given for provider " + provider.getClass().getName());
        }

        List<String> validated = new ArrayList<>();
        for (String namespace : namespaces) {
            String ns = repository.validateNamespace(namespace);
            for (String className : classNames) {
                if (!repository.getClassStore(ns).exists(className)) {
                    throw new CIMException(CIMStatus.INVALID_CLASS, "Class " + className
                            + " of provider " + provider.getClass().getName() + " not found in namespace " + ns);
                }
                for (ProviderType type : types) {
                    Provider existing = lookup(ns, className, type);
                    if (existing != null) {
                        throw new CIMException(CIMStatus.ALREADY_EXISTS, "A " + type + " provider ("
                                + existing.getClass().getName() + ") is already registered for class "
                                + className + " in namespace " + ns);
                    }
                }
            }
            validated.add(ns);
        }

        for (String ns : validated) {
            NocaseMap<EnumMap<ProviderType, Provider>> classes = registry.get(ns);
            if (classes == null) {
                classes = new NocaseMap<>();
                registry.put(ns, classes);
            }
            for (String className : classNames) {
                EnumMap<ProviderType, Provider> byType = classes.get(className);
                if (byType == null) {
                    byType = new EnumMap<>(ProviderType.class);
                    classes.put(className, byType);
                }
                for (ProviderType type : types) {
                    byType.put(type, provider);
                }
            }
        }
        LOG.info("Registered {} provider {} for classes {} in namespaces {}",
                types, provider.getClass().getName(), classNames, validated);
    }

    /**
     * @return the provider of {@code type} for the class, or {@code null}
     */
    @Nullable
    public synchronized Provider getProvider(@NotNull String namespace, @NotNull String className,
                                             @NotNull ProviderType type) {
        return lookup(Names.normalizeNamespace(namespace), className, type);
    }

    @Nullable
    public InstanceWriteProvider getInstanceWriteProvider(@NotNull String namespace, @NotNull String className) {
        return (InstanceWriteProvider) getProvider(namespace, className, ProviderType.INSTANCE_WRITE);
    }

    @Nullable
    public MethodProvider getMethodProvider(@NotNull String namespace, @NotNull String className) {
        return (MethodProvider) getProvider(namespace, className, ProviderType.METHOD);
    }

    @Nullable
    public AssociationProvider getAssociationProvider(@NotNull String namespace, @NotNull String className) {
        return (AssociationProvider) getProvider(namespace, className, ProviderType.ASSOCIATION);
    }

    /**
     * @return every registration, ordered by namespace and class as
     *         registered
     */
    @NotNull
    public synchronized List<Registration> getRegistrations() {
        List<Registration> result = new ArrayList<>();
        for (Map.Entry<String, NocaseMap<EnumMap<ProviderType, Provider>>> ns : registry.entrySet()) {
            for (Map.Entry<String, EnumMap<ProviderType, Provider>> cls : ns.getValue().entrySet()) {
                for (Map.Entry<ProviderType, Provider> e : cls.getValue().entrySet()) {
                    result.add(new Registration(ns.getKey(), cls.getKey(), e.getKey(), e.getValue()));
                }
            }
        }
        return result;
    }

    /**
     * @return the distinct registered provider objects
     */
    @NotNull
    public synchronized Set<Provider> getProviders() {
        Set<Provider> providers = Sets.newIdentityHashSet();
        for (Registration r : getRegistrations()) {
            providers.add(r.getProvider());
        }
        return providers;
    }

    /**
     * Removes the registrations of a namespace, e.g. when it is removed.
     */
    public synchronized void removeNamespace(@NotNull String namespace) {
        registry.remove(Names.normalizeNamespace(namespace));
    }

    public synchronized boolean isEmpty() {
        return registry.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProviderRegistry)) {
            return false;
        }
        return keys().equals(((ProviderRegistry) o).keys());
    }

    @Override
    public int hashCode() {
        return keys().hashCode();
    }

    @Override
    public String toString() {
        return "ProviderRegistry" + getRegistrations();
    }

    //-----------------------------------------------------------< private >--

    private Provider lookup(String namespace, String className, ProviderType type) {
        NocaseMap<EnumMap<ProviderType, Provider>> classes = registry.get(namespace);
        if (classes == null) {
            return null;
        }
        EnumMap<ProviderType, Provider> byType = classes.get(className);
        return byType == null ? null : byType.get(type);
    }

    private Set<List<String>> keys() {
        Set<List<String>> keys = new HashSet<>();
        for (Registration r : getRegistrations()) {
            keys.add(Collections.unmodifiableList(Arrays.asList(Names.fold(r.getNamespace()),
                    Names.fold(r.getClassName()), r.getType().getName(), r.getProvider().getClass().getName())));
        }
        return keys;
    }

    /**
     * One (namespace, class, type) entry of the registry.
     */
    public static final class Registration {

        private final String namespace;
        private final String className;
        private final ProviderType type;
        private final Provider provider;

        Registration(String namespace, String className, ProviderType type, Provider provider) {
            this.namespace = namespace;
            this.className = className;
            this.type = type;
            this.provider = provider;
        }

        public String getNamespace() {
            return namespace;
        }

        public String getClassName() {
            return className;
        }

        public ProviderType getType() {
            return type;
        }

        public Provider getProvider() {
            return provider;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Registration)) {
                return false;
            }
            Registration that = (Registration) o;
            return Names.same(namespace, that.namespace) && Names.same(className, that.className)
                    && type == that.type && provider == that.provider;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Names.fold(namespace), Names.fold(className), type);
        }

        @Override
        public String toString() {
            return namespace + ":" + className + "[" + type + "]=" + provider.getClass().getSimpleName();
        }
    }
}
