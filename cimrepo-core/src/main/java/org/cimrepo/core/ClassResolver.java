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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.commons.Names;
import org.cimrepo.commons.NocaseMap;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves classes against their superclass chain and answers class
 * hierarchy queries.
 * <p>
 * Class stores hold classes as defined, with local members only.
 * {@link #resolve(String, String)} merges the chain from the root class
 * down: subclass members replace inherited members of the same name,
 * inherited members are marked propagated and keep the class origin of the
 * class that declared them, and qualifiers flow to subclasses according to
 * their {@code ToSubclass} flavor. Unspecified qualifier flavors are taken
 * from the namespace's qualifier declarations.
 */
public class ClassResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ClassResolver.class);

    private final Repository repository;

    public ClassResolver(@NotNull Repository repository) {
        this.repository = checkNotNull(repository);
    }

    public boolean classExists(@NotNull String namespace, @NotNull String className) throws CIMException {
        return repository.getClassStore(namespace).exists(className);
    }

    /**
     * @return the class as defined
     * @throws CIMException {@code INVALID_CLASS} if it does not exist
     */
    @NotNull
    public CIMClass getLocalClass(@NotNull String namespace, @NotNull String className) throws CIMException {
        CIMClass c = repository.getClassStore(namespace).get(className);
        if (c == null) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Class " + className + " not found in namespace " + namespace);
        }
        return c;
    }

    /**
     * Returns the class with all inherited members and resolved qualifier
     * flavors.
     *
     * @throws CIMException {@code INVALID_CLASS} if the class does not exist
     */
    @NotNull
    public CIMClass resolve(@NotNull String namespace, @NotNull String className) throws CIMException {
        ObjectStore<String, CIMClass> classes = repository.getClassStore(namespace);
        ObjectStore<String, CIMQualifierDeclaration> declarations = repository.getQualifierStore(namespace);

        List<CIMClass> chain = new ArrayList<>();
        CIMClass current = getLocalClass(namespace, className);
        while (current != null) {
            chain.add(current);
            String superClass = current.getSuperClass();
            if (superClass == null) {
                break;
            }
            current = classes.get(superClass);
            if (current == null) {
                throw new CIMException(CIMStatus.FAILED,
                        "Superclass " + superClass + " of " + chain.get(chain.size() - 1).getClassName()
                                + " is missing from namespace " + namespace);
            }
        }
        return merge(Lists.reverse(chain), declarations);
    }

    /**
     * Names of the direct or, if {@code deep}, all subclasses of
     * {@code className}. A {@code null} class name stands for the root of
     * the hierarchy, so that the top level classes are returned, or every
     * class if {@code deep}.
     *
     * @throws CIMException {@code INVALID_CLASS} if {@code className} does
     *         not exist
     */
    @NotNull
    public List<String> getSubclassNames(@NotNull String namespace, @Nullable String className, boolean deep)
            throws CIMException {
        ObjectStore<String, CIMClass> classes = repository.getClassStore(namespace);
        if (className != null && !classes.exists(className)) {
            throw new CIMException(CIMStatus.INVALID_CLASS,
                    "Class " + className + " not found in namespace " + namespace);
        }
        Collection<CIMClass> all = classes.values();
        List<String> result = new ArrayList<>();
        collectSubclasses(all, className, deep, result);
        return result;
    }

    /**
     * @return the superclass names of {@code className}, nearest first
     */
    @NotNull
    public List<String> getSuperclassNames(@NotNull String namespace, @NotNull String className)
            throws CIMException {
        ObjectStore<String, CIMClass> classes = repository.getClassStore(namespace);
        List<String> result = new ArrayList<>();
        CIMClass c = getLocalClass(namespace, className);
        while (c.getSuperClass() != null) {
            c = classes.get(c.getSuperClass());
            if (c == null) {
                break;
            }
            result.add(c.getClassName());
        }
        return result;
    }

    /**
     * @return folded names of {@code className} and all its subclasses
     */
    @NotNull
    public Set<String> getClassAndSubclassNames(@NotNull String namespace, @NotNull String className)
            throws CIMException {
        Set<String> names = new LinkedHashSet<>();
        names.add(Names.fold(getLocalClass(namespace, className).getClassName()));
        for (String sub : getSubclassNames(namespace, className, true)) {
            names.add(Names.fold(sub));
        }
        return names;
    }

    //------------------------------------------------------< filtering >--

    /**
     * Applies the GetClass filters to a resolved class.
     *
     * @param localOnly          keep only members that are not propagated
     * @param includeQualifiers  keep qualifiers on the class and its members
     * @param includeClassOrigin keep class origins of the members
     * @param propertyList       names of the properties to keep, or
     *                           {@code null} for all
     */
    @NotNull
    public static CIMClass filter(@NotNull CIMClass resolved, boolean localOnly, boolean includeQualifiers,
                                  boolean includeClassOrigin, @Nullable Collection<String> propertyList) {
        Set<String> wanted = Names.foldAll(propertyList);
        List<CIMProperty> properties = new ArrayList<>();
        for (CIMProperty p : resolved.getProperties().values()) {
            if (localOnly && p.isPropagated()) {
                continue;
            }
            if (wanted != null && !wanted.contains(Names.fold(p.getName()))) {
                continue;
            }
            if (!includeQualifiers) {
                p = p.withQualifiers(Collections.emptyList());
            }
            if (!includeClassOrigin) {
                p = p.withOrigin(null, p.isPropagated());
            }
            properties.add(p);
        }
        List<CIMMethod> methods = new ArrayList<>();
        for (CIMMethod m : resolved.getMethods().values()) {
            if (localOnly && m.isPropagated()) {
                continue;
            }
            if (!includeQualifiers) {
                m = stripQualifiers(m);
            }
            if (!includeClassOrigin) {
                m = m.withOrigin(null, m.isPropagated());
            }
            methods.add(m);
        }
        List<CIMQualifier> qualifiers = new ArrayList<>();
        if (includeQualifiers) {
            for (CIMQualifier q : resolved.getQualifiers().values()) {
                if (!localOnly || !q.isPropagated()) {
                    qualifiers.add(q);
                }
            }
        }
        return resolved.toBuilder().properties(properties).methods(methods).qualifiers(qualifiers).build();
    }

    //-----------------------------------------------------------< private >--

    private static void collectSubclasses(Collection<CIMClass> all, String className, boolean deep,
                                          List<String> result) {
        for (CIMClass c : all) {
            boolean child = className == null ? c.getSuperClass() == null : Names.same(c.getSuperClass(), className);
            if (child) {
                result.add(c.getClassName());
                if (deep) {
                    collectSubclasses(all, c.getClassName(), true, result);
                }
            }
        }
    }

    private static CIMClass merge(List<CIMClass> rootFirst,
                                  ObjectStore<String, CIMQualifierDeclaration> declarations) {
        NocaseMap<CIMProperty> properties = new NocaseMap<>();
        NocaseMap<CIMMethod> methods = new NocaseMap<>();
        NocaseMap<CIMQualifier> qualifiers = new NocaseMap<>();

        for (int i = 0; i < rootFirst.size(); i++) {
            CIMClass level = rootFirst.get(i);
            String origin = level.getClassName();
            if (i > 0) {
                inheritAll(properties, methods, qualifiers);
            }
            for (CIMQualifier q : level.getQualifiers().values()) {
                qualifiers.put(q.getName(), withFlavors(q, declarations).withPropagated(false));
            }
            for (CIMProperty p : level.getProperties().values()) {
                CIMProperty inherited = properties.get(p.getName());
                Collection<CIMQualifier> merged = mergeQualifiers(
                        inherited == null ? null : inherited.getQualifiers(), p.getQualifiers(), declarations);
                properties.put(p.getName(), p.withQualifiers(merged).withOrigin(origin, false));
            }
            for (CIMMethod m : level.getMethods().values()) {
                CIMMethod inherited = methods.get(m.getName());
                Collection<CIMQualifier> merged = mergeQualifiers(
                        inherited == null ? null : inherited.getQualifiers(), m.getQualifiers(), declarations);
                methods.put(m.getName(), withParameterFlavors(m, declarations).withQualifiers(merged)
                        .withOrigin(origin, false));
            }
        }

        CIMClass leaf = rootFirst.get(rootFirst.size() - 1);
        LOG.trace("Resolved class {} over {} levels", leaf.getClassName(), rootFirst.size());
        return leaf.toBuilder()
                .properties(properties.values())
                .methods(methods.values())
                .qualifiers(qualifiers.values())
                .build();
    }

    /**
     * Turns the members accumulated so far into inherited members of the
     * next level down.
     */
    private static void inheritAll(NocaseMap<CIMProperty> properties, NocaseMap<CIMMethod> methods,
                                   NocaseMap<CIMQualifier> qualifiers) {
        for (Map.Entry<String, CIMProperty> e : properties.entrySet()) {
            CIMProperty p = e.getValue();
            e.setValue(p.withQualifiers(inherit(p.getQualifiers())).withOrigin(p.getClassOrigin(), true));
        }
        for (Map.Entry<String, CIMMethod> e : methods.entrySet()) {
            CIMMethod m = e.getValue();
            e.setValue(m.withQualifiers(inherit(m.getQualifiers())).withOrigin(m.getClassOrigin(), true));
        }
        List<CIMQualifier> inherited = inherit(qualifiers);
        qualifiers.clear();
        for (CIMQualifier q : inherited) {
            qualifiers.put(q.getName(), q);
        }
    }

    private static List<CIMQualifier> inherit(Map<String, CIMQualifier> qualifiers) {
        List<CIMQualifier> result = new ArrayList<>();
        for (CIMQualifier q : qualifiers.values()) {
            if (!Boolean.FALSE.equals(q.getToSubclass())) {
                result.add(q.withPropagated(true));
            }
        }
        return result;
    }

    private static Collection<CIMQualifier> mergeQualifiers(@Nullable Map<String, CIMQualifier> inherited,
                                                            Map<String, CIMQualifier> local,
                                                            ObjectStore<String, CIMQualifierDeclaration> declarations) {
        NocaseMap<CIMQualifier> merged = new NocaseMap<>();
        if (inherited != null) {
            merged.putAll(inherited);
        }
        for (CIMQualifier q : local.values()) {
            merged.put(q.getName(), withFlavors(q, declarations).withPropagated(false));
        }
        return merged.values();
    }

    private static CIMMethod withParameterFlavors(CIMMethod m,
                                                  ObjectStore<String, CIMQualifierDeclaration> declarations) {
        CIMMethod.Builder b = CIMMethod.builder(m.getName(), m.getReturnType());
        for (CIMParameter p : m.getParameters().values()) {
            CIMParameter.Builder pb = CIMParameter.builder(p.getName(), p.getType())
                    .array(p.isArray()).arraySize(p.getArraySize()).referenceClass(p.getReferenceClass());
            for (CIMQualifier q : p.getQualifiers().values()) {
                pb.qualifier(withFlavors(q, declarations));
            }
            b.parameter(pb.build());
        }
        return b.build().withQualifiers(m.getQualifiers().values());
    }

    /**
     * Fills unspecified flavors from the qualifier declaration, or from the
     * DSP0004 defaults if there is none.
     */
    static CIMQualifier withFlavors(CIMQualifier q, ObjectStore<String, CIMQualifierDeclaration> declarations) {
        CIMQualifierDeclaration d = declarations.get(q.getName());
        boolean overridable = d == null || d.isOverridable();
        boolean toSubclass = d == null || d.isToSubclass();
        boolean toInstance = d != null && d.isToInstance();
        boolean translatable = d != null && d.isTranslatable();
        return q.withFlavors(
                q.getOverridable() != null ? q.getOverridable() : overridable,
                q.getToSubclass() != null ? q.getToSubclass() : toSubclass,
                q.getToInstance() != null ? q.getToInstance() : toInstance,
                q.getTranslatable() != null ? q.getTranslatable() : translatable);
    }

    private static CIMMethod stripQualifiers(CIMMethod m) {
        CIMMethod.Builder b = CIMMethod.builder(m.getName(), m.getReturnType())
                .classOrigin(m.getClassOrigin()).propagated(m.isPropagated());
        for (CIMParameter p : m.getParameters().values()) {
            b.parameter(CIMParameter.builder(p.getName(), p.getType()).array(p.isArray())
                    .arraySize(p.getArraySize()).referenceClass(p.getReferenceClass()).build());
        }
        return b.build();
    }
}
