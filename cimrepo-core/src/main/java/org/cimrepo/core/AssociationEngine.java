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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMClassName;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMObjectPath;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.commons.Names;
import org.cimrepo.plugins.provider.ProviderRegistry;
import org.cimrepo.spi.provider.AssociationProvider;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * References, ReferenceNames, Associators and AssociatorNames.
 * <p>
 * For an instance source the stored association instances are traversed
 * through their reference property values; an association provider
 * registered for the class of the source replaces that traversal. For a
 * class source the association classes are traversed through the reference
 * classes of their reference properties. Results are unordered and free of
 * duplicates.
 */
public class AssociationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AssociationEngine.class);

    private final Repository repository;

    private final ClassResolver resolver;

    private final InstanceEngine instances;

    private final ProviderRegistry providers;

    public AssociationEngine(@NotNull Repository repository, @NotNull ClassResolver resolver,
                             @NotNull InstanceEngine instances, @NotNull ProviderRegistry providers) {
        this.repository = checkNotNull(repository);
        this.resolver = checkNotNull(resolver);
        this.instances = checkNotNull(instances);
        this.providers = checkNotNull(providers);
    }

    //-------------------------------------------------< instance level >--

    /**
     * @return the paths of the association instances with a reference to
     *         {@code source}, of {@code resultClass} or a subclass, through
     *         a reference property named {@code role}
     * @throws CIMException {@code INVALID_NAMESPACE}, {@code INVALID_CLASS}
     *         for an unknown source or result class, {@code INVALID_PARAMETER}
     *         if the source path names another namespace
     */
    @NotNull
    public List<CIMInstanceName> referenceNames(@NotNull String namespace, @NotNull CIMInstanceName source,
                                                @Nullable String resultClass, @Nullable String role)
            throws CIMException {
        String ns = checkSource(namespace, source);
        checkFilterClass(ns, resultClass);
        AssociationProvider provider = providers.getAssociationProvider(ns, source.getClassName());
        if (provider != null) {
            LOG.debug("ReferenceNames of {} in {} handled by {}", source, ns, provider.getClass().getName());
            return withNamespace(ns, provider.referenceNames(ns, source.modelPath(), resultClass, role));
        }

        Set<String> resultClasses = classFilter(ns, resultClass);
        Set<CIMInstanceName> result = new LinkedHashSet<>();
        for (CIMInstance instance : repository.getInstanceStore(ns).values()) {
            if (resultClasses != null && !resultClasses.contains(Names.fold(instance.getClassName()))) {
                continue;
            }
            if (!sourceProperties(ns, instance, source, role).isEmpty()) {
                result.add(instance.getPath().withNamespace(ns));
            }
        }
        LOG.debug("ReferenceNames of {} in {}: {}", source, ns, result.size());
        return new ArrayList<>(result);
    }

    @NotNull
    public List<CIMInstance> references(@NotNull String namespace, @NotNull CIMInstanceName source,
                                        @Nullable String resultClass, @Nullable String role,
                                        boolean includeQualifiers, boolean includeClassOrigin,
                                        @Nullable Collection<String> propertyList) throws CIMException {
        String ns = repository.validateNamespace(namespace);
        return fetch(ns, referenceNames(ns, source, resultClass, role),
                includeQualifiers, includeClassOrigin, propertyList);
    }

    /**
     * @return the paths of the instances associated with {@code source}
     *         through an association instance of {@code assocClass} in which
     *         the source plays {@code role} and the result plays
     *         {@code resultRole}
     */
    @NotNull
    public List<CIMInstanceName> associatorNames(@NotNull String namespace, @NotNull CIMInstanceName source,
                                                 @Nullable String assocClass, @Nullable String resultClass,
                                                 @Nullable String role, @Nullable String resultRole)
            throws CIMException {
        String ns = checkSource(namespace, source);
        checkFilterClass(ns, assocClass);
        checkFilterClass(ns, resultClass);
        AssociationProvider provider = providers.getAssociationProvider(ns, source.getClassName());
        if (provider != null) {
            LOG.debug("AssociatorNames of {} in {} handled by {}", source, ns, provider.getClass().getName());
            return withNamespace(ns, provider.associatorNames(ns, source.modelPath(), assocClass, resultClass,
                    role, resultRole));
        }

        Set<String> assocClasses = classFilter(ns, assocClass);
        Set<String> resultClasses = classFilter(ns, resultClass);
        Set<CIMInstanceName> result = new LinkedHashSet<>();
        for (CIMInstance instance : repository.getInstanceStore(ns).values()) {
            if (assocClasses != null && !assocClasses.contains(Names.fold(instance.getClassName()))) {
                continue;
            }
            Set<String> sourceRoles = sourceProperties(ns, instance, source, role);
            if (sourceRoles.isEmpty()) {
                continue;
            }
            for (CIMProperty p : instance.getProperties().values()) {
                CIMInstanceName target = referenceValue(p);
                if (target == null || sourceRoles.contains(Names.fold(p.getName()))) {
                    continue;
                }
                if (resultRole != null && !Names.same(resultRole, p.getName())) {
                    continue;
                }
                if (resultClasses != null && !resultClasses.contains(Names.fold(target.getClassName()))) {
                    continue;
                }
                result.add(target.getNamespace() == null ? target.withNamespace(ns) : target.withHost(null));
            }
        }
        LOG.debug("AssociatorNames of {} in {}: {}", source, ns, result.size());
        return new ArrayList<>(result);
    }

    @NotNull
    public List<CIMInstance> associators(@NotNull String namespace, @NotNull CIMInstanceName source,
                                         @Nullable String assocClass, @Nullable String resultClass,
                                         @Nullable String role, @Nullable String resultRole,
                                         boolean includeQualifiers, boolean includeClassOrigin,
                                         @Nullable Collection<String> propertyList) throws CIMException {
        String ns = repository.validateNamespace(namespace);
        return fetch(ns, associatorNames(ns, source, assocClass, resultClass, role, resultRole),
                includeQualifiers, includeClassOrigin, propertyList);
    }

    //----------------------------------------------------< class level >--

    /**
     * @return the paths of the association classes, of {@code resultClass}
     *         or a subclass, that declare a reference property named
     *         {@code role} to the source class or one of its superclasses
     */
    @NotNull
    public List<CIMClassName> referenceClassNames(@NotNull String namespace, @NotNull CIMClassName source,
                                                  @Nullable String resultClass, @Nullable String role)
            throws CIMException {
        String ns = checkSource(namespace, source);
        checkFilterClass(ns, resultClass);
        Set<String> targets = sourceAndSuperclasses(ns, source.getClassName());
        Set<String> resultClasses = classFilter(ns, resultClass);

        List<CIMClassName> result = new ArrayList<>();
        for (CIMClass assoc : associationClasses(ns)) {
            if (resultClasses != null && !resultClasses.contains(Names.fold(assoc.getClassName()))) {
                continue;
            }
            if (!sourceProperties(assoc, targets, role).isEmpty()) {
                result.add(new CIMClassName(assoc.getClassName(), ns));
            }
        }
        return result;
    }

    @NotNull
    public List<CIMClass> referenceClasses(@NotNull String namespace, @NotNull CIMClassName source,
                                           @Nullable String resultClass, @Nullable String role,
                                           boolean includeQualifiers, boolean includeClassOrigin,
                                           @Nullable Collection<String> propertyList) throws CIMException {
        return fetchClasses(referenceClassNames(namespace, source, resultClass, role),
                includeQualifiers, includeClassOrigin, propertyList);
    }

    /**
     * @return the paths of the classes at the other ends of the association
     *         classes found as in {@link #referenceClassNames} with
     *         {@code assocClass} as result class
     */
    @NotNull
    public List<CIMClassName> associatorClassNames(@NotNull String namespace, @NotNull CIMClassName source,
                                                   @Nullable String assocClass, @Nullable String resultClass,
                                                   @Nullable String role, @Nullable String resultRole)
            throws CIMException {
        String ns = checkSource(namespace, source);
        checkFilterClass(ns, assocClass);
        checkFilterClass(ns, resultClass);
        Set<String> targets = sourceAndSuperclasses(ns, source.getClassName());
        Set<String> assocClasses = classFilter(ns, assocClass);
        Set<String> resultClasses = classFilter(ns, resultClass);

        Map<String, CIMClassName> result = new LinkedHashMap<>();
        for (CIMClass assoc : associationClasses(ns)) {
            if (assocClasses != null && !assocClasses.contains(Names.fold(assoc.getClassName()))) {
                continue;
            }
            Set<String> sourceRoles = sourceProperties(assoc, targets, role);
            if (sourceRoles.isEmpty()) {
                continue;
            }
            for (CIMProperty p : assoc.getProperties().values()) {
                if (p.getType() != CIMType.REFERENCE || p.getReferenceClass() == null) {
                    continue;
                }
                // a source role that is the only one is not an associated end
                if (sourceRoles.contains(Names.fold(p.getName())) && sourceRoles.size() == 1) {
                    continue;
                }
                if (resultRole != null && !Names.same(resultRole, p.getName())) {
                    continue;
                }
                if (resultClasses != null && !resultClasses.contains(Names.fold(p.getReferenceClass()))) {
                    continue;
                }
                result.putIfAbsent(Names.fold(p.getReferenceClass()), new CIMClassName(p.getReferenceClass(), ns));
            }
        }
        return new ArrayList<>(result.values());
    }

    @NotNull
    public List<CIMClass> associatorClasses(@NotNull String namespace, @NotNull CIMClassName source,
                                            @Nullable String assocClass, @Nullable String resultClass,
                                            @Nullable String role, @Nullable String resultRole,
                                            boolean includeQualifiers, boolean includeClassOrigin,
                                            @Nullable Collection<String> propertyList) throws CIMException {
        return fetchClasses(associatorClassNames(namespace, source, assocClass, resultClass, role, resultRole),
                includeQualifiers, includeClassOrigin, propertyList);
    }

    //-----------------------------------------------------------< private >--

    private String checkSource(String namespace, CIMObjectPath source) throws CIMException {
        String ns = repository.validateNamespace(namespace);
        if (source.getNamespace() != null && !Names.same(source.getNamespace(), ns)) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "Namespace of source object " + source
                    + " does not match the request namespace " + ns);
        }
        if ((source instanceof CIMClassName || !instances.isLite())
                && !resolver.classExists(ns, source.getClassName())) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Source class " + source.getClassName() + " not found in namespace " + ns);
        }
        return ns;
    }

    private void checkFilterClass(String namespace, String className) throws CIMException {
        if (className != null && !instances.isLite() && !resolver.classExists(namespace, className)) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Filter class " + className + " not found in namespace " + namespace);
        }
    }

    private Set<String> classFilter(String namespace, String className) throws CIMException {
        return className == null ? null : instances.targetClassNames(namespace, className);
    }

    /**
     * @return folded names of the reference properties of {@code instance}
     *         that refer to {@code source} and match {@code role}
     */
    private static Set<String> sourceProperties(String namespace, CIMInstance instance,
                                                CIMInstanceName source, String role) {
        Set<String> names = new HashSet<>();
        for (CIMProperty p : instance.getProperties().values()) {
            CIMInstanceName target = referenceValue(p);
            if (target != null && refersTo(namespace, target, source)
                    && (role == null || Names.same(role, p.getName()))) {
                names.add(Names.fold(p.getName()));
            }
        }
        return names;
    }

    private static Set<String> sourceProperties(CIMClass assoc, Set<String> targets, String role) {
        Set<String> names = new HashSet<>();
        for (CIMProperty p : assoc.getProperties().values()) {
            if (p.getType() == CIMType.REFERENCE && p.getReferenceClass() != null
                    && targets.contains(Names.fold(p.getReferenceClass()))
                    && (role == null || Names.same(role, p.getName()))) {
                names.add(Names.fold(p.getName()));
            }
        }
        return names;
    }

    private static CIMInstanceName referenceValue(CIMProperty p) {
        if (p.getType() != CIMType.REFERENCE || p.isArray() || p.getValue() == null) {
            return null;
        }
        return (CIMInstanceName) p.getValue();
    }

    private static boolean refersTo(String namespace, CIMInstanceName target, CIMInstanceName source) {
        if (target.getNamespace() != null && !Names.same(target.getNamespace(), namespace)) {
            return false;
        }
        return target.modelPath().equals(source.modelPath());
    }

    private Set<String> sourceAndSuperclasses(String namespace, String className) throws CIMException {
        Set<String> names = new HashSet<>();
        names.add(Names.fold(className));
        for (String superClass : resolver.getSuperclassNames(namespace, className)) {
            names.add(Names.fold(superClass));
        }
        return names;
    }

    private List<CIMClass> associationClasses(String namespace) throws CIMException {
        List<CIMClass> result = new ArrayList<>();
        for (String className : repository.getClassStore(namespace).names()) {
            CIMClass cls = resolver.resolve(namespace, className);
            if (cls.isAssociation()) {
                result.add(cls);
            }
        }
        return result;
    }

    private List<CIMInstance> fetch(String namespace, List<CIMInstanceName> names, boolean includeQualifiers,
                                    boolean includeClassOrigin, Collection<String> propertyList)
            throws CIMException {
        Set<String> properties = Names.foldAll(propertyList);
        List<CIMInstance> result = new ArrayList<>();
        for (CIMInstanceName name : names) {
            String ns = name.getNamespace() == null ? namespace : name.getNamespace();
            CIMInstance instance = repository.hasNamespace(ns) ? repository.getInstanceStore(ns).get(name) : null;
            if (instance == null) {
                LOG.warn("Skipping associated instance {}: not found in namespace {}", name, ns);
                continue;
            }
            result.add(instances.filter(repository.validateNamespace(ns), instance, false,
                    includeQualifiers, includeClassOrigin, properties));
        }
        return result;
    }

    private List<CIMClass> fetchClasses(List<CIMClassName> names, boolean includeQualifiers,
                                        boolean includeClassOrigin, Collection<String> propertyList)
            throws CIMException {
        List<CIMClass> result = new ArrayList<>();
        for (CIMClassName name : names) {
            CIMClass resolved = resolver.resolve(name.getNamespace(), name.getClassName());
            result.add(ClassResolver.filter(resolved, false, includeQualifiers, includeClassOrigin, propertyList)
                    .withPath(name));
        }
        return result;
    }

    private static List<CIMInstanceName> withNamespace(String namespace, List<CIMInstanceName> names) {
        List<CIMInstanceName> result = new ArrayList<>();
        for (CIMInstanceName name : new LinkedHashSet<>(names)) {
            result.add(name.getNamespace() == null ? name.withNamespace(namespace) : name);
        }
        return result;
    }
}
