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

import java.util.Map;
import java.util.Objects;

import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.Qualifiers;
import org.cimrepo.api.Scope;
import org.cimrepo.commons.Names;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Checks a class definition against its namespace before it is stored:
 * the superclass must exist, qualifiers must match their declarations in
 * type and scope, reference properties are only allowed in associations,
 * and members that redefine inherited members must say so with
 * {@code Override} without changing their type.
 */
public class ClassValidator {

    private final Repository repository;

    private final ClassResolver resolver;

    public ClassValidator(@NotNull Repository repository, @NotNull ClassResolver resolver) {
        this.repository = checkNotNull(repository);
        this.resolver = checkNotNull(resolver);
    }

    /**
     * @throws CIMException {@code INVALID_SUPERCLASS} if the superclass does
     *         not exist, {@code INVALID_PARAMETER} for any other violation
     */
    public void validate(@NotNull String namespace, @NotNull CIMClass newClass) throws CIMException {
        CIMClass superClass = null;
        if (newClass.getSuperClass() != null) {
            if (!resolver.classExists(namespace, newClass.getSuperClass())) {
                throw new CIMException(CIMStatus.INVALID_SUPERCLASS, "Superclass " + newClass.getSuperClass()
                        + " of class " + newClass.getClassName() + " not found in namespace " + namespace);
            }
            superClass = resolver.resolve(namespace, newClass.getSuperClass());
        }

        boolean association = newClass.isAssociation() || superClass != null && superClass.isAssociation();
        if (newClass.isAssociation() && superClass != null && !superClass.isAssociation()) {
            throw invalid("Association class %s cannot derive from non-association class %s",
                    newClass.getClassName(), superClass.getClassName());
        }

        ObjectStore<String, CIMQualifierDeclaration> declarations = repository.getQualifierStore(namespace);
        Scope classScope = association ? Scope.ASSOCIATION
                : newClass.isIndication() || superClass != null && superClass.isIndication()
                ? Scope.INDICATION : Scope.CLASS;
        checkQualifiers(declarations, newClass.getQualifiers(), classScope, "class " + newClass.getClassName());
        if (superClass != null) {
            checkOverridable(superClass.getQualifiers(), newClass.getQualifiers(),
                    "class " + newClass.getClassName());
        }

        for (CIMProperty p : newClass.getProperties().values()) {
            String where = "property " + newClass.getClassName() + "." + p.getName();
            if (p.getType() == CIMType.REFERENCE) {
                if (!association) {
                    throw invalid("Reference %s is only allowed in an association class", where);
                }
                String refClass = p.getReferenceClass();
                if (refClass != null && !Names.same(refClass, newClass.getClassName())
                        && !resolver.classExists(namespace, refClass)) {
                    throw invalid("Reference class %s of %s not found", refClass, where);
                }
            }
            checkQualifiers(declarations, p.getQualifiers(),
                    p.getType() == CIMType.REFERENCE ? Scope.REFERENCE : Scope.PROPERTY, where);
            CIMProperty inherited = superClass == null ? null : superClass.getProperty(p.getName());
            checkOverride(p.getQualifiers(), inherited == null ? null : inherited.getName(),
                    superClass == null || hasOverrideTarget(p.getQualifiers(), superClass.getProperties()), where);
            if (inherited != null) {
                if (inherited.getType() != p.getType() || inherited.isArray() != p.isArray()) {
                    throw invalid("%s overrides %s with a different type", where, inherited.getName());
                }
                checkOverridable(inherited.getQualifiers(), p.getQualifiers(), where);
            }
        }

        for (CIMMethod m : newClass.getMethods().values()) {
            String where = "method " + newClass.getClassName() + "." + m.getName();
            checkQualifiers(declarations, m.getQualifiers(), Scope.METHOD, where);
            for (CIMParameter param : m.getParameters().values()) {
                checkQualifiers(declarations, param.getQualifiers(), Scope.PARAMETER,
                        "parameter " + param.getName() + " of " + where);
            }
            CIMMethod inherited = superClass == null ? null : superClass.getMethod(m.getName());
            checkOverride(m.getQualifiers(), inherited == null ? null : inherited.getName(),
                    superClass == null || hasOverrideTarget(m.getQualifiers(), superClass.getMethods()), where);
            if (inherited != null) {
                if (inherited.getReturnType() != m.getReturnType()) {
                    throw invalid("%s overrides %s with a different return type", where, inherited.getName());
                }
                checkOverridable(inherited.getQualifiers(), m.getQualifiers(), where);
            }
        }
    }

    //-----------------------------------------------------------< private >--

    private static void checkQualifiers(ObjectStore<String, CIMQualifierDeclaration> declarations,
                                        Map<String, CIMQualifier> qualifiers, Scope scope, String where)
            throws CIMException {
        for (CIMQualifier q : qualifiers.values()) {
            CIMQualifierDeclaration d = declarations.get(q.getName());
            if (d == null) {
                throw invalid("Qualifier %s used on %s has no declaration", q.getName(), where);
            }
            if (d.getType() != q.getType() || d.isArray() != q.isArray()) {
                throw invalid("Qualifier %s on %s has type %s%s, declared as %s%s", q.getName(), where,
                        q.getType(), q.isArray() ? "[]" : "", d.getType(), d.isArray() ? "[]" : "");
            }
            if (!d.isApplicableTo(scope)) {
                throw invalid("Qualifier %s is not allowed on %s; its scopes are %s", q.getName(), where,
                        d.getScopes());
            }
        }
    }

    /**
     * A member that exists in the superclass must carry {@code Override},
     * and {@code Override} must name an inherited member.
     */
    private static void checkOverride(Map<String, CIMQualifier> qualifiers, @Nullable String inheritedName,
                                      boolean targetExists, String where) throws CIMException {
        CIMQualifier override = qualifiers.get(Qualifiers.OVERRIDE);
        if (inheritedName != null && override == null) {
            throw invalid("%s duplicates inherited %s without the Override qualifier", where, inheritedName);
        }
        if (override != null && !targetExists) {
            throw invalid("%s overrides %s, which is not inherited", where, override.getValue());
        }
    }

    private static boolean hasOverrideTarget(Map<String, CIMQualifier> qualifiers, Map<String, ?> inherited) {
        CIMQualifier override = qualifiers.get(Qualifiers.OVERRIDE);
        return override == null || override.getValue() instanceof String
                && inherited.containsKey((String) override.getValue());
    }

    /**
     * Inherited qualifiers with {@code DisableOverride} keep their value.
     */
    private static void checkOverridable(Map<String, CIMQualifier> inherited, Map<String, CIMQualifier> local,
                                         String where) throws CIMException {
        for (CIMQualifier q : local.values()) {
            CIMQualifier i = inherited.get(q.getName());
            if (i == null || Boolean.FALSE.equals(i.getToSubclass())) {
                continue;
            }
            if (Boolean.FALSE.equals(i.getOverridable()) && !Objects.equals(i.getValue(), q.getValue())) {
                throw invalid("Qualifier %s of %s is not overridable and must keep value %s",
                        q.getName(), where, i.getValue());
            }
        }
    }

    private static CIMException invalid(String format, Object... args) {
        return new CIMException(CIMStatus.INVALID_PARAMETER, String.format(format, args));
    }
}
