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

import org.cimrepo.AbstractServerTest;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.Qualifiers;
import org.junit.Before;
import org.junit.Test;

public class ClassValidatorTest extends AbstractServerTest {

    private ClassValidator validator;

    @Before
    @Override
    public void setUp() throws Exception {
        super.setUp();
        validator = new ClassValidator(server.getRepository(), new ClassResolver(server.getRepository()));
    }

    @Test
    public void validSubclass() throws Exception {
        validator.validate(ns, CIMClass.builder("CIM_Foo_sub3").superClass(FOO)
                .property(CIMProperty.builder("IntegerProp", CIMType.UINT32)
                        .qualifier(CIMQualifier.of(Qualifiers.OVERRIDE, "IntegerProp")).build())
                .build());
    }

    @Test
    public void missingSuperclass() {
        assertStatus(CIMStatus.INVALID_SUPERCLASS, () -> validator.validate(ns,
                CIMClass.builder("CIM_Orphan").superClass("CIM_Blah").build()));
    }

    @Test
    public void undeclaredQualifier() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns,
                CIMClass.builder("CIM_Bad").qualifier(CIMQualifier.of("Blah", true)).build()));
    }

    @Test
    public void qualifierOfWrongType() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns,
                CIMClass.builder("CIM_Bad").qualifier(CIMQualifier.of(Qualifiers.ABSTRACT, "yes")).build()));
    }

    @Test
    public void qualifierOutOfScope() {
        // Key applies to properties only
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns,
                CIMClass.builder("CIM_Bad").qualifier(CIMQualifier.of(Qualifiers.KEY, true)).build()));
    }

    @Test
    public void referenceOutsideAssociation() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("CIM_Bad")
                .property(CIMProperty.builder("ref", CIMType.REFERENCE).referenceClass(FOO).build())
                .build()));
    }

    @Test
    public void referenceToUnknownClass() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("TST_Bad")
                .qualifier(CIMQualifier.of(Qualifiers.ASSOCIATION, true))
                .property(CIMProperty.builder("ref", CIMType.REFERENCE).referenceClass("CIM_Blah").build())
                .build()));
    }

    @Test
    public void associationDerivedFromOrdinaryClass() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("TST_Bad")
                .superClass(FOO)
                .qualifier(CIMQualifier.of(Qualifiers.ASSOCIATION, true))
                .build()));
    }

    @Test
    public void redefinitionWithoutOverride() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("CIM_Bad")
                .superClass(FOO)
                .property(CIMProperty.of("IntegerProp", CIMType.UINT32, null))
                .build()));
    }

    @Test
    public void overrideWithDifferentType() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("CIM_Bad")
                .superClass(FOO)
                .property(CIMProperty.builder("IntegerProp", CIMType.STRING)
                        .qualifier(CIMQualifier.of(Qualifiers.OVERRIDE, "IntegerProp")).build())
                .build()));
    }

    @Test
    public void overrideOfNothing() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("CIM_Bad")
                .superClass(FOO)
                .method(CIMMethod.builder("Blah", CIMType.UINT32)
                        .qualifier(CIMQualifier.of(Qualifiers.OVERRIDE, "Blah")).build())
                .build()));
    }

    @Test
    public void disableOverrideQualifierKeepsValue() {
        // Key is declared DisableOverride
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> validator.validate(ns, CIMClass.builder("CIM_Bad")
                .superClass(FOO)
                .property(CIMProperty.builder("InstanceID", CIMType.STRING)
                        .qualifier(CIMQualifier.of(Qualifiers.OVERRIDE, "InstanceID"))
                        .qualifier(CIMQualifier.of(Qualifiers.KEY, false)).build())
                .build()));
    }
}
