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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.cimrepo.AbstractServerTest;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.Qualifiers;
import org.junit.Before;
import org.junit.Test;

public class ClassResolverTest extends AbstractServerTest {

    private ClassResolver resolver;

    @Before
    @Override
    public void setUp() throws Exception {
        super.setUp();
        resolver = new ClassResolver(server.getRepository());
    }

    @Test
    public void resolveMergesInheritedMembers() throws Exception {
        CIMClass sub = resolver.resolve(ns, "cim_foo_sub_sub");
        assertEquals(FOO_SUB_SUB, sub.getClassName());
        assertEquals(FOO_SUB, sub.getSuperClass());

        CIMProperty id = sub.getProperty("InstanceID");
        assertEquals(FOO, id.getClassOrigin());
        assertTrue(id.isPropagated());
        assertTrue(id.isKey());

        CIMProperty local = sub.getProperty("cimfoo_sub_sub");
        assertEquals(FOO_SUB_SUB, local.getClassOrigin());
        assertFalse(local.isPropagated());

        assertEquals(FOO, sub.getMethod("Fuzzy").getClassOrigin());
        assertTrue(sub.getMethod("Fuzzy").isPropagated());
        assertEquals(Arrays.asList("InstanceID"), sub.getKeyPropertyNames());
    }

    @Test
    public void fixedSizeArrayParameterKeepsItsSize() throws Exception {
        server.createClass(ns, CIMClass.builder("TST_Arrays")
                .method(CIMMethod.builder("Set", CIMType.UINT32)
                        .parameter(CIMParameter.builder("Values", CIMType.UINT8).array(true).arraySize(4)
                                .qualifier(CIMQualifier.of(Qualifiers.IN, true)).build())
                        .build())
                .build());
        CIMClass resolved = resolver.resolve(ns, "TST_Arrays");
        assertEquals(Integer.valueOf(4), resolved.getMethod("Set").getParameters().get("values").getArraySize());

        CIMClass stripped = ClassResolver.filter(resolved, false, false, false, null);
        CIMParameter values = stripped.getMethod("Set").getParameters().get("Values");
        assertTrue(values.isArray());
        assertEquals(Integer.valueOf(4), values.getArraySize());
        assertTrue(values.getQualifiers().isEmpty());
    }

    @Test
    public void restrictedQualifiersAreNotInherited() throws Exception {
        server.createClass(ns, CIMClass.builder("CIM_AbstractSub").superClass(ABSTRACT).build());
        assertTrue(resolver.resolve(ns, ABSTRACT).isAbstract());
        assertFalse(resolver.resolve(ns, "CIM_AbstractSub").isAbstract());
        // Description is ToSubclass by default
        assertNotNull(resolver.resolve(ns, FOO_SUB).getQualifiers().get(Qualifiers.DESCRIPTION));
        assertTrue(resolver.resolve(ns, FOO_SUB).getQualifiers().get(Qualifiers.DESCRIPTION).isPropagated());
    }

    @Test
    public void subclassNames() throws Exception {
        assertEquals(classNames(Arrays.asList(FOO_SUB, FOO_SUB2)),
                classNames(resolver.getSubclassNames(ns, FOO, false)));
        assertEquals(classNames(Arrays.asList(FOO_SUB, FOO_SUB_SUB, FOO_SUB2)),
                classNames(resolver.getSubclassNames(ns, FOO, true)));
        assertEquals(classNames(Arrays.asList(FOO, ABSTRACT, PERSON, LINEAGE)),
                classNames(resolver.getSubclassNames(ns, null, false)));
        assertEquals(7, resolver.getSubclassNames(ns, null, true).size());
        assertEquals(Collections.emptyList(), resolver.getSubclassNames(ns, FOO_SUB_SUB, true));
    }

    @Test
    public void subclassNamesOfUnknownClass() {
        assertStatus(CIMStatus.INVALID_CLASS, () -> resolver.getSubclassNames(ns, "CIM_Blah", true));
    }

    @Test
    public void superclassNames() throws Exception {
        assertEquals(Arrays.asList(FOO_SUB, FOO), resolver.getSuperclassNames(ns, FOO_SUB_SUB));
        assertEquals(Collections.emptyList(), resolver.getSuperclassNames(ns, FOO));
    }

    @Test
    public void resolveUnknownClass() {
        assertStatus(CIMStatus.INVALID_CLASS, () -> resolver.resolve(ns, "CIM_Blah"));
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> resolver.resolve("root/blah", FOO));
    }

    @Test
    public void filterLocalOnly() throws Exception {
        CIMClass resolved = resolver.resolve(ns, FOO_SUB);
        CIMClass local = ClassResolver.filter(resolved, true, true, false, null);
        assertEquals(1, local.getProperties().size());
        assertNotNull(local.getProperty("cimfoo_sub"));
        assertTrue(local.getMethods().isEmpty());
        // propagated Description is dropped with LocalOnly
        assertTrue(local.getQualifiers().isEmpty());
        assertNull(local.getProperty("cimfoo_sub").getClassOrigin());
    }

    @Test
    public void filterQualifiersAndOrigins() throws Exception {
        CIMClass resolved = resolver.resolve(ns, FOO);
        CIMClass bare = ClassResolver.filter(resolved, false, false, false, null);
        assertTrue(bare.getQualifiers().isEmpty());
        assertTrue(bare.getProperty("IntegerProp").getQualifiers().isEmpty());
        assertNull(bare.getProperty("IntegerProp").getClassOrigin());

        CIMClass full = ClassResolver.filter(resolved, false, true, true, null);
        assertEquals(FOO, full.getProperty("IntegerProp").getClassOrigin());
        assertNotNull(full.getProperty("IntegerProp").getQualifiers().get(Qualifiers.DESCRIPTION));
    }

    @Test
    public void filterPropertyList() throws Exception {
        CIMClass resolved = resolver.resolve(ns, FOO);
        CIMClass filtered = ClassResolver.filter(resolved, false, true, false, Arrays.asList("integerprop", "Blah"));
        assertEquals(1, filtered.getProperties().size());
        assertNotNull(filtered.getProperty("IntegerProp"));
        assertEquals(2, filtered.getMethods().size());

        assertTrue(ClassResolver.filter(resolved, false, true, false, Collections.<String>emptyList())
                .getProperties().isEmpty());
    }
}
