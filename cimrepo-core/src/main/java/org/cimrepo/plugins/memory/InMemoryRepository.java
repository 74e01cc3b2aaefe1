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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory repository: a case-insensitive map of namespaces, each holding
 * its own class, instance and qualifier declaration stores.
 */
public class InMemoryRepository implements Repository, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRepository.class);

    /**
     * Prefix of system class names. System classes do not keep a namespace
     * from being removed.
     */
    public static final String SYSTEM_CLASS_PREFIX = "__";

    private final NocaseMap<NamespaceStores> namespaces = new NocaseMap<>();

    @NotNull
    @Override
    public synchronized Set<String> getNamespaces() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(namespaces.keySet()));
    }

    @Override
    public synchronized boolean hasNamespace(@NotNull String namespace) {
        return namespaces.containsKey(Names.normalizeNamespace(namespace));
    }

    @NotNull
    @Override
    public synchronized String validateNamespace(@NotNull String namespace) throws CIMException {
        String ns = Names.normalizeNamespace(checkNotNull(namespace));
        String existing = namespaces.getOriginalKey(ns);
        if (existing == null) {
            throw new CIMException(CIMStatus.INVALID_NAMESPACE, "Namespace " + ns + " does not exist");
        }
        return existing;
    }

    @Override
    public synchronized void addNamespace(@NotNull String namespace) throws CIMException {
        String ns = Names.normalizeNamespace(checkNotNull(namespace));
        if (ns.isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Namespace name must not be empty");
        }
        if (namespaces.containsKey(ns)) {
            throw new CIMException(CIMStatus.ALREADY_EXISTS,
                    "Namespace " + ns + " already exists as " + namespaces.getOriginalKey(ns));
        }
        namespaces.put(ns, new NamespaceStores());
        LOG.info("Added namespace {}", ns);
    }

    @Override
    public synchronized void removeNamespace(@NotNull String namespace) throws CIMException {
        String ns = Names.normalizeNamespace(checkNotNull(namespace));
        NamespaceStores stores = namespaces.get(ns);
        if (stores == null) {
            throw new CIMException(CIMStatus.NOT_FOUND, "Namespace " + ns + " does not exist");
        }
        if (stores.instances.size() > 0 || hasNonSystemClasses(stores)) {
            throw new CIMException(CIMStatus.NAMESPACE_NOT_EMPTY, "Namespace " + ns + " is not empty");
        }
        namespaces.remove(ns);
        LOG.info("Removed namespace {}", ns);
    }

    @NotNull
    @Override
    public ObjectStore<String, CIMClass> getClassStore(@NotNull String namespace) throws CIMException {
        return stores(namespace).classes;
    }

    @NotNull
    @Override
    public ObjectStore<CIMInstanceName, CIMInstance> getInstanceStore(@NotNull String namespace)
            throws CIMException {
        return stores(namespace).instances;
    }

    @NotNull
    @Override
    public ObjectStore<String, CIMQualifierDeclaration> getQualifierStore(@NotNull String namespace)
            throws CIMException {
        return stores(namespace).qualifiers;
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder("InMemoryRepository{");
        String sep = "";
        for (String ns : namespaces.keySet()) {
            NamespaceStores s = namespaces.get(ns);
            sb.append(sep).append(ns).append(": ").append(s.classes.size()).append(" classes, ")
                    .append(s.instances.size()).append(" instances, ")
                    .append(s.qualifiers.size()).append(" qualifiers");
            sep = "; ";
        }
        return sb.append('}').toString();
    }

    //-----------------------------------------------------------< private >--

    private synchronized NamespaceStores stores(String namespace) throws CIMException {
        return namespaces.get(validateNamespace(namespace));
    }

    private static boolean hasNonSystemClasses(NamespaceStores stores) {
        for (String name : stores.classes.names()) {
            if (!name.startsWith(SYSTEM_CLASS_PREFIX)) {
                return true;
            }
        }
        return false;
    }

    private static final class NamespaceStores implements Serializable {

        private static final long serialVersionUID = 1L;

        private final InMemoryObjectStore<String, CIMClass> classes =
                new InMemoryObjectStore<>("Class", Names::fold);

        private final InMemoryObjectStore<CIMInstanceName, CIMInstance> instances =
                new InMemoryObjectStore<>("Instance", CIMInstanceName::modelPath);

        private final InMemoryObjectStore<String, CIMQualifierDeclaration> qualifiers =
                new InMemoryObjectStore<>("Qualifier declaration", Names::fold);
    }
}
