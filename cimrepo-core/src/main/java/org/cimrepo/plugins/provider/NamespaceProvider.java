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
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import org.cimrepo.MockWBEMServer;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.commons.Names;
import org.cimrepo.core.ServerSettings;
import org.cimrepo.spi.provider.InstanceWriteProvider;
import org.cimrepo.spi.provider.ProviderContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instance-write provider for {@code CIM_Namespace} in the interop
 * namespace. Each namespace of the server is represented by one
 * {@code CIM_Namespace} instance: creating an instance creates the
 * namespace, deleting one removes it. The interop namespace itself cannot
 * be removed this way, and instances cannot be modified.
 */
public class NamespaceProvider implements InstanceWriteProvider, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(NamespaceProvider.class);

    public static final String CLASS_NAME = "CIM_Namespace";

    static final String NAME = "Name";
    static final String CREATION_CLASS_NAME = "CreationClassName";
    static final String OBJECT_MANAGER_NAME = "ObjectManagerName";
    static final String OBJECT_MANAGER_CREATION_CLASS_NAME = "ObjectManagerCreationClassName";
    static final String SYSTEM_NAME = "SystemName";
    static final String SYSTEM_CREATION_CLASS_NAME = "SystemCreationClassName";

    private final String objectManagerName;
    private final String objectManagerCreationClassName;
    private final String systemName;
    private final String systemCreationClassName;

    private transient ProviderContext context;

    public NamespaceProvider(@NotNull ServerSettings settings) {
        this.objectManagerName = settings.getObjectManagerName();
        this.objectManagerCreationClassName = settings.getObjectManagerCreationClassName();
        this.systemName = settings.getSystemName();
        this.systemCreationClassName = settings.getSystemCreationClassName();
    }

    /**
     * Creates the interop namespace if it does not exist, registers a
     * namespace provider in it and creates the {@code CIM_Namespace}
     * instances of all namespaces of {@code server}.
     *
     * @throws CIMException {@code INVALID_PARAMETER} if
     *         {@code interopNamespace} is not an interop namespace name,
     *         {@code INVALID_CLASS} if {@code CIM_Namespace} is not defined
     *         in it
     */
    @NotNull
    public static NamespaceProvider install(@NotNull MockWBEMServer server, @NotNull String interopNamespace)
            throws CIMException {
        String ns = Names.normalizeNamespace(checkNotNull(interopNamespace));
        if (!MockWBEMServer.isInteropNamespaceName(ns)) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, ns + " is not a valid interop namespace name");
        }
        if (!server.hasNamespace(ns)) {
            server.addNamespace(ns);
        }
        NamespaceProvider provider = new NamespaceProvider(server.getSettings());
        server.registerProvider(provider, Collections.singletonList(ns));
        for (String namespace : server.getNamespaces()) {
            provider.namespaceAdded(namespace);
        }
        return provider;
    }

    @Override
    public void init(@NotNull ProviderContext context) {
        this.context = checkNotNull(context);
    }

    @NotNull
    @Override
    public Set<String> getProvidedClassNames() {
        return ImmutableSet.of(CLASS_NAME);
    }

    @NotNull
    @Override
    public CIMInstanceName createInstance(@NotNull String namespace, @NotNull CIMInstance newInstance)
            throws CIMException {
        checkInterop(namespace);
        Object name = newInstance.getPropertyValue(NAME);
        if (!(name instanceof String) || Names.normalizeNamespace((String) name).isEmpty()) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "A new " + CLASS_NAME + " instance requires a Name property");
        }
        Object creationClassName = newInstance.getPropertyValue(CREATION_CLASS_NAME);
        if (creationClassName != null && !Names.same(creationClassName.toString(), newInstance.getClassName())) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "CreationClassName " + creationClassName
                    + " does not match the class " + newInstance.getClassName());
        }
        String ns = Names.normalizeNamespace((String) name);
        CIMInstance completed = complete(namespace, newInstance.getClassName(), newInstance, ns);
        boolean added = !context.getRepository().hasNamespace(ns);
        if (added) {
            context.addNamespace(ns);
        }
        try {
            return context.getDefaultInstanceWriteProvider().createInstance(namespace, completed);
        } catch (CIMException e) {
            if (added) {
                rollback(e, () -> context.removeNamespace(ns));
            }
            throw e;
        }
    }

    @Override
    public void modifyInstance(@NotNull String namespace, @NotNull CIMInstance modifiedInstance,
                               @Nullable List<String> propertyList) throws CIMException {
        throw new CIMException(CIMStatus.NOT_SUPPORTED, "Instances of " + CLASS_NAME + " cannot be modified");
    }

    @Override
    public void deleteInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        checkInterop(namespace);
        CIMInstance stored = context.getRepository().getInstanceStore(namespace).get(instanceName);
        if (stored == null) {
            throw new CIMException(CIMStatus.NOT_FOUND,
                    "Instance " + instanceName.modelPath() + " not found in namespace " + namespace);
        }
        String removed = null;
        Object name = stored.getPropertyValue(NAME);
        if (name instanceof String) {
            String ns = Names.normalizeNamespace((String) name);
            if (Names.same(ns, context.getInteropNamespace())) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER,
                        "The interop namespace " + ns + " cannot be deleted");
            }
            if (context.getRepository().hasNamespace(ns)) {
                context.removeNamespace(ns);
                removed = ns;
            }
        }
        try {
            context.getDefaultInstanceWriteProvider().deleteInstance(namespace, instanceName);
        } catch (CIMException e) {
            if (removed != null) {
                String ns = removed;
                rollback(e, () -> context.addNamespace(ns));
            }
            throw e;
        }
    }

    /**
     * Creates the {@code CIM_Namespace} instance of a namespace added to
     * the server, unless it exists.
     */
    public void namespaceAdded(@NotNull String namespace) throws CIMException {
        String interop = context.getInteropNamespace();
        if (interop == null || findInstance(interop, namespace) != null) {
            return;
        }
        CIMInstance instance = complete(interop, CLASS_NAME, CIMInstance.builder(CLASS_NAME).build(), namespace);
        context.getDefaultInstanceWriteProvider().createInstance(interop, instance);
        LOG.debug("Created {} instance for namespace {}", CLASS_NAME, namespace);
    }

    /**
     * Deletes the {@code CIM_Namespace} instance of a namespace removed
     * from the server, if it exists.
     */
    public void namespaceRemoved(@NotNull String namespace) throws CIMException {
        String interop = context.getInteropNamespace();
        if (interop == null) {
            return;
        }
        CIMInstanceName path = findInstance(interop, namespace);
        if (path != null) {
            context.getRepository().getInstanceStore(interop).delete(path);
            LOG.debug("Deleted {} instance of namespace {}", CLASS_NAME, namespace);
        }
    }

    //-----------------------------------------------------------< private >--

    private void checkInterop(String namespace) throws CIMException {
        if (!Names.same(Names.normalizeNamespace(namespace), context.getInteropNamespace())) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    CLASS_NAME + " instances only exist in the interop namespace, not in " + namespace);
        }
    }

    private interface Undo {
        void run() throws CIMException;
    }

    private static void rollback(CIMException failure, Undo undo) {
        try {
            undo.run();
        } catch (CIMException e) {
            LOG.warn("Could not undo namespace change after {}", failure.getMessage(), e);
            failure.addSuppressed(e);
        }
    }

    private CIMInstanceName findInstance(String interop, String namespace) throws CIMException {
        for (CIMInstance instance : context.getRepository().getInstanceStore(interop).values()) {
            if (Names.same(instance.getClassName(), CLASS_NAME)) {
                Object name = instance.getPropertyValue(NAME);
                if (name instanceof String && Names.same(Names.normalizeNamespace((String) name), namespace)) {
                    return instance.getPath();
                }
            }
        }
        return null;
    }

    /**
     * Adds the naming properties the class defines and the instance lacks.
     */
    private CIMInstance complete(String interop, String className, CIMInstance instance, String namespace)
            throws CIMException {
        CIMClass cls = context.getResolvedClass(interop, className);
        CIMInstance.Builder b = instance.toBuilder();
        b.property(NAME, CIMType.STRING, namespace);
        setDefault(b, cls, instance, CREATION_CLASS_NAME, cls.getClassName());
        setDefault(b, cls, instance, OBJECT_MANAGER_NAME, objectManagerName);
        setDefault(b, cls, instance, OBJECT_MANAGER_CREATION_CLASS_NAME, objectManagerCreationClassName);
        setDefault(b, cls, instance, SYSTEM_NAME, systemName);
        setDefault(b, cls, instance, SYSTEM_CREATION_CLASS_NAME, systemCreationClassName);
        return b.build();
    }

    private static void setDefault(CIMInstance.Builder b, CIMClass cls, CIMInstance instance, String name,
                                   String value) {
        CIMProperty defined = cls.getProperty(name);
        if (defined != null && defined.getType() == CIMType.STRING && !defined.isArray()
                && instance.getPropertyValue(name) == null) {
            b.property(name, CIMType.STRING, value);
        }
    }
}
