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
package org.cimrepo.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.Names;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instance retrieval: GetInstance, EnumerateInstances and
 * EnumerateInstanceNames, and the property filters they share.
 * <p>
 * In lite mode the instance store is not backed by a class schema: classes
 * are not looked up and enumeration matches the exact class only.
 */
public class InstanceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(InstanceEngine.class);

    private final Repository repository;

    private final ClassResolver resolver;

    private final ServerSettings settings;

    private final boolean lite;

    public InstanceEngine(@NotNull Repository repository, @NotNull ClassResolver resolver,
                          @NotNull ServerSettings settings, boolean lite) {
        this.repository = checkNotNull(repository);
        this.resolver = checkNotNull(resolver);
        this.settings = checkNotNull(settings);
        this.lite = lite;
    }

    public boolean isLite() {
        return lite;
    }

    /**
     * @throws CIMException {@code INVALID_NAMESPACE}, {@code INVALID_CLASS} if
     *         the class of the instance is unknown, {@code NOT_FOUND} if no
     *         instance has this path
     */
    @NotNull
    public CIMInstance getInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName,
                                   boolean localOnly, boolean includeQualifiers, boolean includeClassOrigin,
                                   @Nullable Collection<String> propertyList) throws CIMException {
        CIMInstance instance = getStoredInstance(namespace, instanceName);
        return filter(namespace, instance, localOnly, includeQualifiers, includeClassOrigin,
                Names.foldAll(propertyList));
    }

    /**
     * Returns the instance as stored, after the same checks as
     * {@link #getInstance}.
     */
    @NotNull
    public CIMInstance getStoredInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        ObjectStore<CIMInstanceName, CIMInstance> instances = repository.getInstanceStore(namespace);
        checkClass(namespace, instanceName.getClassName());
        CIMInstance instance = instances.get(instanceName);
        if (instance == null) {
            throw new CIMException(CIMStatus.NOT_FOUND,
                    "Instance " + instanceName.modelPath() + " not found in namespace " + namespace);
        }
        return instance;
    }

    /**
     * Returns the instances of {@code className} and, if
     * {@code deepInheritance} and not lite, of its subclasses.
     */
    @NotNull
    public List<CIMInstance> enumerateInstances(@NotNull String namespace, @NotNull String className,
                                                boolean localOnly, boolean deepInheritance,
                                                boolean includeQualifiers, boolean includeClassOrigin,
                                                @Nullable Collection<String> propertyList) throws CIMException {
        ObjectStore<CIMInstanceName, CIMInstance> instances = repository.getInstanceStore(namespace);
        Set<String> classNames;
        if (deepInheritance) {
            classNames = targetClassNames(namespace, className);
        } else {
            checkClass(namespace, className);
            classNames = Collections.singleton(Names.fold(className));
        }
        Set<String> properties = Names.foldAll(propertyList);

        List<CIMInstance> result = new ArrayList<>();
        for (CIMInstance instance : instances.values()) {
            if (classNames.contains(Names.fold(instance.getClassName()))) {
                result.add(filter(namespace, instance, localOnly, includeQualifiers, includeClassOrigin, properties));
            }
        }
        LOG.debug("EnumerateInstances {} in {}: {} instances", className, namespace, result.size());
        return result;
    }

    @NotNull
    public List<CIMInstanceName> enumerateInstanceNames(@NotNull String namespace, @NotNull String className)
            throws CIMException {
        ObjectStore<CIMInstanceName, CIMInstance> instances = repository.getInstanceStore(namespace);
        Set<String> classNames = targetClassNames(namespace, className);
        List<CIMInstanceName> result = new ArrayList<>();
        for (CIMInstance instance : instances.values()) {
            if (classNames.contains(Names.fold(instance.getClassName()))) {
                result.add(instance.getPath().withNamespace(namespace));
            }
        }
        return result;
    }

    /**
     * Folded names of the classes whose instances belong to an enumeration
     * of {@code className}.
     *
     * @throws CIMException {@code INVALID_CLASS} if the class is unknown
     */
    @NotNull
    public Set<String> targetClassNames(@NotNull String namespace, @NotNull String className)
            throws CIMException {
        if (lite) {
            return Collections.singleton(Names.fold(className));
        }
        return resolver.getClassAndSubclassNames(namespace, className);
    }

    /**
     * Prepares a stored instance for return: sets the namespace of its
     * path, and applies LocalOnly, IncludeQualifiers, IncludeClassOrigin and
     * the property list.
     *
     * @param propertyList folded property names, or {@code null} for all
     */
    @NotNull
    public CIMInstance filter(@NotNull String namespace, @NotNull CIMInstance instance, boolean localOnly,
                              boolean includeQualifiers, boolean includeClassOrigin,
                              @Nullable Set<String> propertyList) {
        boolean honorLocalOnly = localOnly && settings.isInstanceLocalOnly();
        List<CIMProperty> properties = new ArrayList<>();
        for (CIMProperty p : instance.getProperties().values()) {
            if (propertyList != null && !propertyList.contains(Names.fold(p.getName()))) {
                continue;
            }
            if (honorLocalOnly && p.getClassOrigin() != null
                    && !Names.same(p.getClassOrigin(), instance.getClassName())) {
                continue;
            }
            if (!includeQualifiers && !p.getQualifiers().isEmpty()) {
                p = p.withQualifiers(Collections.emptyList());
            }
            if (!includeClassOrigin) {
                p = p.withOrigin(null, false);
            }
            properties.add(p);
        }
        CIMInstance.Builder b = CIMInstance.builder(instance.getClassName()).properties(properties);
        if (includeQualifiers) {
            instance.getQualifiers().values().forEach(b::qualifier);
        }
        CIMInstanceName path = instance.getPath();
        return b.path(path == null ? null : path.withNamespace(namespace).withHost(null)).build();
    }

    //-----------------------------------------------------------< private >--

    private void checkClass(String namespace, String className) throws CIMException {
        if (!lite && !resolver.classExists(namespace, className)) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Class " + className + " not found in namespace " + namespace);
        }
    }

}
