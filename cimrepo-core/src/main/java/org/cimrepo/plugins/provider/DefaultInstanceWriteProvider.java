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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.cimrepo.core.ClassResolver;
import org.cimrepo.core.InstanceEngine;
import org.cimrepo.spi.provider.InstanceWriteProvider;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store-backed CreateInstance, ModifyInstance and DeleteInstance, used for
 * every class without a registered instance-write provider.
 * <p>
 * Stored instances carry a path without namespace and host, and each of
 * their properties carries the class origin of the class property it
 * instantiates.
 */
public class DefaultInstanceWriteProvider implements InstanceWriteProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultInstanceWriteProvider.class);

    private final Repository repository;

    private final ClassResolver resolver;

    private final InstanceEngine instances;

    public DefaultInstanceWriteProvider(@NotNull Repository repository, @NotNull ClassResolver resolver,
                                        @NotNull InstanceEngine instances) {
        this.repository = checkNotNull(repository);
        this.resolver = checkNotNull(resolver);
        this.instances = checkNotNull(instances);
    }

    @NotNull
    @Override
    public Set<String> getProvidedClassNames() {
        return Collections.emptySet();
    }

    @NotNull
    @Override
    public CIMInstanceName createInstance(@NotNull String namespace, @NotNull CIMInstance newInstance)
            throws CIMException {
        String ns = repository.validateNamespace(namespace);
        ObjectStore<CIMInstanceName, CIMInstance> store = repository.getInstanceStore(ns);
        if (instances.isLite()) {
            CIMInstanceName path = newInstance.getPath();
            if (path == null) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER,
                        "Instance of " + newInstance.getClassName() + " has no path");
            }
            store.create(path.modelPath(), newInstance.withPath(path.modelPath()));
            LOG.debug("Created instance {} in {}", path, ns);
            return path.withNamespace(ns).withHost(null);
        }

        CIMClass cls = resolver.resolve(ns, newInstance.getClassName());
        if (cls.isAbstract()) {
            throw new CIMException(CIMStatus.FAILED,
                    "Cannot create an instance of abstract class " + cls.getClassName());
        }
        CIMInstance instance = checkProperties(cls, newInstance);

        List<String> keyNames = cls.getKeyPropertyNames();
        if (keyNames.isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "Class " + cls.getClassName() + " has no key properties");
        }
        Map<String, Object> keys = new LinkedHashMap<>();
        for (String keyName : keyNames) {
            Object value = instance.getPropertyValue(keyName);
            if (value == null) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Key property " + keyName
                        + " of a new " + cls.getClassName() + " instance has no value");
            }
            keys.put(keyName, value);
        }
        if (cls.isAssociation()) {
            checkEndpoints(ns, instance);
        }

        CIMInstanceName path = CIMInstanceName.of(cls.getClassName(), keys);
        List<CIMProperty> properties = new ArrayList<>();
        for (CIMProperty p : instance.getProperties().values()) {
            properties.add(stampOrigin(cls, p));
        }
        store.create(path, CIMInstance.builder(cls.getClassName())
                .properties(properties)
                .path(path)
                .build());
        LOG.debug("Created instance {} in {}", path, ns);
        return path.withNamespace(ns);
    }

    @Override
    public void modifyInstance(@NotNull String namespace, @NotNull CIMInstance modifiedInstance,
                               @Nullable List<String> propertyList) throws CIMException {
        String ns = repository.validateNamespace(namespace);
        CIMInstanceName path = modifiedInstance.getPath();
        if (path == null) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "Modified instance of " + modifiedInstance.getClassName() + " has no path");
        }
        if (!Names.same(path.getClassName(), modifiedInstance.getClassName())) {
            throw new CIMException(CIMStatus.INVALID_CLASS, "Instance class " + modifiedInstance.getClassName()
                    + " does not match the class of its path " + path.getClassName());
        }
        if (propertyList != null && propertyList.isEmpty()) {
            return;
        }
        CIMInstance stored = instances.getStoredInstance(ns, path);
        CIMClass cls = instances.isLite() ? null : resolver.resolve(ns, path.getClassName());
        CIMInstance modified = cls == null ? modifiedInstance : checkProperties(cls, modifiedInstance);

        NocaseMap<CIMProperty> result = new NocaseMap<>();
        result.putAll(stored.getProperties());
        List<String> names = propertyList == null
                ? new ArrayList<>(modified.getProperties().keySet()) : propertyList;
        for (String name : names) {
            CIMProperty classProperty = cls == null ? null : cls.getProperty(name);
            if (cls != null && classProperty == null) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Property " + name
                        + " in the property list is not a property of class " + cls.getClassName());
            }
            CIMProperty p = modified.getProperty(name);
            if (p == null) {
                if (classProperty != null && !classProperty.isKey()) {
                    result.put(name, stampOrigin(cls, classProperty.withQualifiers(Collections.emptyList())));
                }
                continue;
            }
            CIMProperty current = stored.getProperty(name);
            boolean key = classProperty != null ? classProperty.isKey() : path.getKeyBindings().containsKey(name);
            if (key && !Objects.equals(p.getValue(), current == null ? null : current.getValue())) {
                throw new CIMException(CIMStatus.NOT_FOUND, "No instance with the modified key " + name + "="
                        + p.getValue() + " exists; key properties cannot be changed");
            }
            result.put(name, cls == null ? p : stampOrigin(cls, p));
        }
        repository.getInstanceStore(ns).update(stored.getPath(), stored.withProperties(result.values()));
        LOG.debug("Modified instance {} in {}", stored.getPath(), ns);
    }

    @Override
    public void deleteInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        String ns = repository.validateNamespace(namespace);
        CIMInstance stored = instances.getStoredInstance(ns, instanceName);
        repository.getInstanceStore(ns).delete(stored.getPath());
        LOG.debug("Deleted instance {} in {}", stored.getPath(), ns);
    }

    /**
     * Checks the properties of {@code instance} against the resolved class
     * and returns the instance with property names spelled as in the class.
     *
     * @throws CIMException {@code INVALID_PARAMETER} for a property the
     *         class does not define, or whose type or array flag differ
     */
    @NotNull
    public static CIMInstance checkProperties(@NotNull CIMClass cls, @NotNull CIMInstance instance)
            throws CIMException {
        List<CIMProperty> properties = new ArrayList<>();
        for (CIMProperty p : instance.getProperties().values()) {
            CIMProperty defined = cls.getProperty(p.getName());
            if (defined == null) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER,
                        "Property " + p.getName() + " is not a property of class " + cls.getClassName());
            }
            if (defined.getType() != p.getType() || defined.isArray() != p.isArray()) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Property " + p.getName() + " has type "
                        + typeName(p.getType(), p.isArray()) + " but is declared as "
                        + typeName(defined.getType(), defined.isArray()) + " in class " + cls.getClassName());
            }
            properties.add(p.getName().equals(defined.getName()) ? p : p.withName(defined.getName()));
        }
        return instance.withProperties(properties);
    }

    //-----------------------------------------------------------< private >--

    private void checkEndpoints(String namespace, CIMInstance association) throws CIMException {
        for (CIMProperty p : association.getProperties().values()) {
            if (p.getType() != CIMType.REFERENCE || p.getValue() == null || p.isArray()) {
                continue;
            }
            CIMInstanceName target = (CIMInstanceName) p.getValue();
            String targetNs = target.getNamespace() == null ? namespace : target.getNamespace();
            if (!repository.hasNamespace(targetNs) || !repository.getInstanceStore(targetNs).exists(target)) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Reference " + p.getName() + " of "
                        + association.getClassName() + " refers to a missing instance " + target);
            }
        }
    }

    private static CIMProperty stampOrigin(CIMClass cls, CIMProperty p) {
        String origin = cls.getProperty(p.getName()).getClassOrigin();
        if (origin == null) {
            origin = cls.getClassName();
        }
        return p.withOrigin(origin, !Names.same(origin, cls.getClassName()));
    }

    private static String typeName(CIMType type, boolean array) {
        return array ? type + "[]" : type.toString();
    }
}
