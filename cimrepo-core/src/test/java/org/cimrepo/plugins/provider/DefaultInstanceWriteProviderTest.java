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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.cimrepo.AbstractServerTest;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.junit.Test;

public class DefaultInstanceWriteProviderTest extends AbstractServerTest {

    @Test
    public void createReturnsPathBuiltFromKeys() throws Exception {
        CIMInstanceName path = server.createInstance(ns, foo("cim_foo", "CIM_Foo1", 7L));
        assertEquals(FOO, path.getClassName());
        assertEquals(ns, path.getNamespace());
        assertEquals(1, path.getKeyBindings().size());
        assertEquals("CIM_Foo1", path.getKey("instanceid"));

        CIMInstance stored = server.getRepository().getInstanceStore(ns).get(path);
        assertEquals(FOO, stored.getClassName());
        assertNull(stored.getPath().getNamespace());
        assertEquals(FOO, stored.getProperty("IntegerProp").getClassOrigin());
    }

    @Test
    public void createDoesNotAddClassDefaults() throws Exception {
        server.createInstance(ns, person("Mike"));
        CIMInstance mike = server.getInstance(ns, personName("Mike"));
        assertNull(mike.getProperty("extraProperty"));
    }

    @Test
    public void createNormalizesPropertyNames() throws Exception {
        server.createInstance(ns, CIMInstance.builder(FOO)
                .property("instanceid", CIMType.STRING, "x")
                .property("INTEGERPROP", CIMType.UINT32, 3L).build());
        CIMInstance x = server.getRepository().getInstanceStore(ns).get(fooName(FOO, "x"));
        assertTrue(x.getProperties().containsKey("IntegerProp"));
        assertEquals("IntegerProp", x.getProperty("integerprop").getName());
    }

    @Test
    public void createDuplicate() throws Exception {
        server.createInstance(ns, foo(FOO, "CIM_Foo1", null));
        assertStatus(CIMStatus.ALREADY_EXISTS, () -> server.createInstance(ns, foo("CIM_FOO", "CIM_Foo1", 1L)));
    }

    @Test
    public void createOfUnknownClass() {
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.createInstance(ns, foo("CIM_Blah", "1", null)));
    }

    @Test
    public void createOfAbstractClass() {
        assertStatus(CIMStatus.FAILED, () -> server.createInstance(ns, CIMInstance.builder(ABSTRACT)
                .property("InstanceID", CIMType.STRING, "1").build()));
    }

    @Test
    public void createWithUndefinedProperty() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, foo(FOO, "1", null)
                .toBuilder().property("Blah", CIMType.STRING, "x").build()));
    }

    @Test
    public void createWithWrongPropertyType() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, CIMInstance.builder(FOO)
                .property("InstanceID", CIMType.STRING, "1")
                .property("IntegerProp", CIMType.STRING, "one").build()));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, CIMInstance.builder(FOO)
                .property("InstanceID", CIMType.STRING, "1")
                .property(CIMProperty.builder("IntegerProp", CIMType.UINT32).array(true)
                        .value(Arrays.asList(1L, 2L)).build()).build()));
    }

    @Test
    public void createWithoutKeyValue() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, CIMInstance.builder(FOO)
                .property("IntegerProp", CIMType.UINT32, 1L).build()));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, CIMInstance.builder(FOO)
                .property("InstanceID", CIMType.STRING, null).build()));
    }

    @Test
    public void createOfClassWithoutKeys() throws Exception {
        server.createClass(ns, CIMClass.builder("CIM_Keyless")
                .property(CIMProperty.of("Name", CIMType.STRING, null)).build());
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.createInstance(ns, CIMInstance.builder("CIM_Keyless")
                .property("Name", CIMType.STRING, "x").build()));
    }

    @Test
    public void createAssociationWithMissingEndpoint() throws Exception {
        server.createInstance(ns, person("Mike"));
        assertStatus(CIMStatus.INVALID_PARAMETER,
                () -> server.createInstance(ns, lineage("MikeSofi", "Mike", "Sofi")));
        server.createInstance(ns, person("Sofi"));
        server.createInstance(ns, lineage("MikeSofi", "Mike", "Sofi"));
    }

    @Test
    public void createInUnknownNamespace() {
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> server.createInstance("root/blah", foo(FOO, "1", null)));
    }

    @Test
    public void modifyReplacesGivenProperties() throws Exception {
        loadInstances();
        CIMInstance modified = foo(FOO, "CIM_Foo1", 42L).withPath(fooName(FOO, "CIM_Foo1"));
        server.modifyInstance(ns, modified, null);
        CIMInstance foo1 = server.getInstance(ns, fooName(FOO, "CIM_Foo1"));
        assertEquals(Long.valueOf(42), foo1.getPropertyValue("IntegerProp"));
    }

    @Test
    public void modifyWithPropertyList() throws Exception {
        loadInstances();
        CIMInstance modified = CIMInstance.builder(FOO)
                .property("InstanceID", CIMType.STRING, "CIM_Foo1")
                .property("IntegerProp", CIMType.UINT32, 42L)
                .property("Flag", CIMType.BOOLEAN, false)
                .path(fooName(FOO, "CIM_Foo1"))
                .build();
        server.modifyInstance(ns, modified, Collections.singletonList("flag"));
        CIMInstance foo1 = server.getInstance(ns, fooName(FOO, "CIM_Foo1"));
        assertEquals(Long.valueOf(1), foo1.getPropertyValue("IntegerProp"));
        assertEquals(Boolean.FALSE, foo1.getPropertyValue("Flag"));
    }

    @Test
    public void modifyResetsListedPropertyToClassDefault() throws Exception {
        loadInstances();
        server.modifyInstance(ns, CIMInstance.builder(FOO).path(fooName(FOO, "CIM_Foo2")).build(),
                Arrays.asList("IntegerProp", "Flag"));
        CIMInstance foo2 = server.getInstance(ns, fooName(FOO, "CIM_Foo2"));
        assertNull(foo2.getPropertyValue("IntegerProp"));
        assertEquals(Boolean.TRUE, foo2.getPropertyValue("Flag"));
    }

    @Test
    public void modifyWithEmptyPropertyListChangesNothing() throws Exception {
        loadInstances();
        server.modifyInstance(ns, foo(FOO, "CIM_Foo1", 42L).withPath(fooName(FOO, "CIM_Foo1")),
                Collections.emptyList());
        assertEquals(Long.valueOf(1), server.getInstance(ns, fooName(FOO, "CIM_Foo1"))
                .getPropertyValue("IntegerProp"));
    }

    @Test
    public void modifyErrors() throws Exception {
        loadInstances();
        assertStatus(CIMStatus.INVALID_PARAMETER,
                () -> server.modifyInstance(ns, foo(FOO, "CIM_Foo1", 42L), null));
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.modifyInstance(ns,
                foo(FOO, "CIM_Foo1", 42L).withPath(fooName(FOO_SUB, "CIM_Foo1")), null));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.modifyInstance(ns,
                foo(FOO, "CIM_Foo99", 42L).withPath(fooName(FOO, "CIM_Foo99")), null));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.modifyInstance(ns,
                foo(FOO, "CIM_Foo1", 42L).withPath(fooName(FOO, "CIM_Foo1")), Arrays.asList("Blah")));
    }

    @Test
    public void modifyKeyValue() throws Exception {
        loadInstances();
        assertStatus(CIMStatus.NOT_FOUND, () -> server.modifyInstance(ns,
                foo(FOO, "CIM_Foo4", 42L).withPath(fooName(FOO, "CIM_Foo1")), null));
        assertEquals(Long.valueOf(1), server.getInstance(ns, fooName(FOO, "CIM_Foo1"))
                .getPropertyValue("IntegerProp"));
    }

    @Test
    public void delete() throws Exception {
        loadInstances();
        server.deleteInstance(ns, fooName("cim_foo", "CIM_Foo1"));
        assertFalse(server.getRepository().getInstanceStore(ns).exists(fooName(FOO, "CIM_Foo1")));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.deleteInstance(ns, fooName(FOO, "CIM_Foo1")));
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.deleteInstance(ns, fooName("CIM_Blah", "CIM_Foo1")));
    }

    @Test
    public void checkProperties() throws Exception {
        CIMClass cls = server.getClass(ns, FOO, false, true, false, null);
        CIMInstance checked = DefaultInstanceWriteProvider.checkProperties(cls,
                CIMInstance.builder(FOO).property("integerPROP", CIMType.UINT32, 1L).build());
        assertEquals("IntegerProp", checked.getProperties().values().iterator().next().getName());
    }
}
