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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMClassName;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMObjectPath;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.Qualifiers;
import org.cimrepo.commons.NocaseMap;
import org.cimrepo.core.ClassResolver;
import org.cimrepo.core.InstanceEngine;
import org.cimrepo.spi.provider.InstanceWriteProvider;
import org.cimrepo.spi.provider.MethodProvider;
import org.cimrepo.spi.provider.MethodResult;
import org.cimrepo.spi.provider.Provider;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes the instance-write operations and InvokeMethod of a (namespace,
 * class) to its registered provider, or to the
 * {@link DefaultInstanceWriteProvider} if there is none.
 * <p>
 * Requests are validated against the resolved class before any provider
 * sees them, and modify and delete requests fail with
 * {@link CIMStatus#NOT_FOUND} if the target instance does not exist. {@link CIMException}s raised by a provider are passed on
 * unchanged; any other failure of a registered provider is reported as
 * {@link CIMStatus#FAILED}.
 */
public class ProviderDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderDispatcher.class);

    private final Repository repository;

    private final ClassResolver resolver;

    private final InstanceEngine instances;

    private final ProviderRegistry registry;

    private final InstanceWriteProvider defaultProvider;

    public ProviderDispatcher(@NotNull Repository repository, @NotNull ClassResolver resolver,
                              @NotNull InstanceEngine instances, @NotNull ProviderRegistry registry,
                              @NotNull InstanceWriteProvider defaultProvider) {
        this.repository = checkNotNull(repository);
        this.resolver = checkNotNull(resolver);
        this.instances = checkNotNull(instances);
        this.registry = checkNotNull(registry);
        this.defaultProvider = checkNotNull(defaultProvider);
    }

    @NotNull
    public CIMInstanceName createInstance(@NotNull String namespace, @NotNull CIMInstance newInstance)
            throws CIMException {
        String ns = repository.validateNamespace(namespace);
        CIMInstance instance = validate(ns, newInstance);
        InstanceWriteProvider provider = registry.getInstanceWriteProvider(ns, instance.getClassName());
        if (provider == null) {
            return defaultProvider.createInstance(ns, instance);
        }
        LOG.debug("CreateInstance of {} in {} handled by {}", instance.getClassName(), ns, name(provider));
        CIMInstanceName path;
        try {
            path = provider.createInstance(ns, instance);
        } catch (RuntimeException e) {
            throw providerFailure(provider, "CreateInstance", e);
        }
        if (path == null) {
            LOG.warn("Provider {} returned no path from CreateInstance of {}", name(provider),
                    instance.getClassName());
            throw new CIMException(CIMStatus.FAILED,
                    "Provider " + name(provider) + " returned no path for the new instance");
        }
        return path;
    }

    public void modifyInstance(@NotNull String namespace, @NotNull CIMInstance modifiedInstance,
                               @Nullable List<String> propertyList) throws CIMException {
        String ns = repository.validateNamespace(namespace);
        CIMInstance instance = validate(ns, modifiedInstance);
        InstanceWriteProvider provider = registry.getInstanceWriteProvider(ns, instance.getClassName());
        if (provider == null) {
            defaultProvider.modifyInstance(ns, instance, propertyList);
            return;
        }
        checkExists(ns, instance.getPath(), instance.getClassName());
        LOG.debug("ModifyInstance of {} in {} handled by {}", instance.getClassName(), ns, name(provider));
        try {
            provider.modifyInstance(ns, instance, propertyList);
        } catch (RuntimeException e) {
            throw providerFailure(provider, "ModifyInstance", e);
        }
    }

    public void deleteInstance(@NotNull String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        String ns = repository.validateNamespace(namespace);
        if (!instances.isLite() && !resolver.classExists(ns, instanceName.getClassName())) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Class " + instanceName.getClassName() + " not found in namespace " + ns);
        }
        InstanceWriteProvider provider = registry.getInstanceWriteProvider(ns, instanceName.getClassName());
        if (provider == null) {
            defaultProvider.deleteInstance(ns, instanceName);
            return;
        }
        checkExists(ns, instanceName, instanceName.getClassName());
        LOG.debug("DeleteInstance {} in {} handled by {}", instanceName, ns, name(provider));
        try {
            provider.deleteInstance(ns, instanceName);
        } catch (RuntimeException e) {
            throw providerFailure(provider, "DeleteInstance", e);
        }
    }

    /**
     * Invokes an extrinsic method on an instance or, for a static method,
     * on a class.
     *
     * @throws CIMException {@code INVALID_CLASS} or {@code NOT_FOUND} for a
     *         missing target, {@code METHOD_NOT_FOUND} if the class does not
     *         define the method, {@code INVALID_PARAMETER} for a non-static
     *         method invoked on a class or an input parameter the method does
     *         not accept, {@code METHOD_NOT_AVAILABLE} if no method provider
     *         is registered for the class
     */
    @NotNull
    public MethodResult invokeMethod(@NotNull String namespace, @NotNull String methodName,
                                     @NotNull CIMObjectPath target, @NotNull Collection<CIMParameter> inParams)
            throws CIMException {
        String ns = repository.validateNamespace(namespace);
        String className = target.getClassName();
        Map<String, CIMParameter> params = new NocaseMap<>();
        for (CIMParameter p : inParams) {
            params.put(p.getName(), p);
        }

        if (!instances.isLite()) {
            if (target instanceof CIMInstanceName) {
                instances.getStoredInstance(ns, (CIMInstanceName) target);
            } else if (!resolver.classExists(ns, className)) {
                throw new CIMException(CIMStatus.NOT_FOUND,
                        "Target class " + className + " not found in namespace " + ns);
            }
            CIMClass cls = resolver.resolve(ns, className);
            CIMMethod method = cls.getMethod(methodName);
            if (method == null) {
                throw new CIMException(CIMStatus.METHOD_NOT_FOUND,
                        "Method " + methodName + " is not defined by class " + cls.getClassName());
            }
            if (target instanceof CIMClassName && !method.isStatic()) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Non-static method " + methodName
                        + " of class " + cls.getClassName() + " cannot be invoked on a class");
            }
            params = checkParameters(cls, method, params);
        }

        MethodProvider provider = registry.getMethodProvider(ns, className);
        if (provider == null) {
            throw new CIMException(CIMStatus.METHOD_NOT_AVAILABLE,
                    "No method provider is registered for class " + className + " in namespace " + ns);
        }
        LOG.debug("InvokeMethod {}.{} in {} handled by {}", className, methodName, ns, name(provider));
        MethodResult result;
        try {
            result = provider.invokeMethod(ns, methodName, target, params);
        } catch (RuntimeException e) {
            throw providerFailure(provider, "InvokeMethod", e);
        }
        if (result == null) {
            LOG.warn("Provider {} returned no result from {}.{}", name(provider), className, methodName);
            throw new CIMException(CIMStatus.FAILED,
                    "Provider " + name(provider) + " returned no result for method " + methodName);
        }
        return result;
    }

    //-----------------------------------------------------------< private >--

    private CIMInstance validate(String namespace, CIMInstance instance) throws CIMException {
        if (instances.isLite()) {
            return instance;
        }
        CIMClass cls = resolver.resolve(namespace, instance.getClassName());
        return DefaultInstanceWriteProvider.checkProperties(cls, instance);
    }

    /**
     * A registered provider only sees modify and delete requests for
     * instances that exist.
     */
    private void checkExists(String namespace, CIMInstanceName path, String className) throws CIMException {
        if (path == null) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Instance of " + className + " has no path");
        }
        instances.getStoredInstance(namespace, path);
    }

    private static NocaseMap<CIMParameter> checkParameters(CIMClass cls, CIMMethod method,
                                                           Map<String, CIMParameter> params) throws CIMException {
        NocaseMap<CIMParameter> checked = new NocaseMap<>();
        for (CIMParameter p : params.values()) {
            CIMParameter defined = method.getParameters().get(p.getName());
            if (defined == null) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Input parameter " + p.getName()
                        + " is not defined by method " + method.getName() + " of class " + cls.getClassName());
            }
            CIMQualifier in = defined.getQualifiers().get(Qualifiers.IN);
            if (in != null && !in.isTrue()) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Parameter " + defined.getName()
                        + " of method " + method.getName() + " is an output parameter");
            }
            if (defined.getType() != p.getType() || defined.isArray() != p.isArray()) {
                throw new CIMException(CIMStatus.INVALID_PARAMETER, "Input parameter " + p.getName()
                        + " of method " + method.getName() + " must be of type " + defined.getType()
                        + (defined.isArray() ? "[]" : ""));
            }
            checked.put(defined.getName(), p.getName().equals(defined.getName()) ? p : p.withName(defined.getName()));
        }
        return checked;
    }

    private static CIMException providerFailure(Provider provider, String operation, RuntimeException e) {
        LOG.warn("Provider {} failed in {}", name(provider), operation, e);
        return new CIMException(CIMStatus.FAILED,
                operation + " failed in provider " + name(provider) + ": " + e.getMessage(), e);
    }

    private static String name(Provider provider) {
        return provider.getClass().getName();
    }
}
