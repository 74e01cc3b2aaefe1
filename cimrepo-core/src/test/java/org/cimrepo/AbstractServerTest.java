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
package org.cimrepo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableMap;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMMethod;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifier;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.Qualifiers;
import org.cimrepo.commons.Names;
import org.junit.Before;
import org.junit.function.ThrowingRunnable;

/**
 * Base class for tests that need a server populated with a small model:
 * <pre>
 * CIM_Foo (InstanceID key)
 *   CIM_Foo_sub
 *     CIM_Foo_sub_sub
 *   CIM_Foo_sub2
 * CIM_Abstract (abstract)
 * TST_Person (name key)
 * TST_Lineage (association: parent, child -&gt; TST_Person)
 * </pre>
 * {@link #loadInstances()} adds three {@code CIM_Foo}, one instance of each
 * subclass, four persons and three lineages.
 */
public abstract class AbstractServerTest {

    protected static final String FOO = "CIM_Foo";
    protected static final String FOO_SUB = "CIM_Foo_sub";
    protected static final String FOO_SUB_SUB = "CIM_Foo_sub_sub";
    protected static final String FOO_SUB2 = "CIM_Foo_sub2";
    protected static final String ABSTRACT = "CIM_Abstract";
    protected static final String PERSON = "TST_Person";
    protected static final String LINEAGE = "TST_Lineage";

    protected MockWBEMServer server;

    protected String ns;

    @Before
    public void setUp() throws Exception {
        server = createServer();
        ns = server.getSettings().getDefaultNamespace();
        loadClasses(server, ns);
    }

    protected MockWBEMServer createServer() {
        return new MockWBEMServer();
    }

    protected static void loadClasses(MockWBEMServer server, String namespace) throws CIMException {
        server.addStandardQualifiers(namespace);
        for (CIMClass c : classes()) {
            server.createClass(namespace, c);
        }
    }

    protected void loadInstances() throws CIMException {
        server.createInstance(ns, foo(FOO, "CIM_Foo1", 1L));
        server.createInstance(ns, foo(FOO, "CIM_Foo2", 2L));
        server.createInstance(ns, foo(FOO, "CIM_Foo3", null));
        server.createInstance(ns, fooSub("CIM_Foo_sub1", "sub"));
        server.createInstance(ns, foo(FOO_SUB_SUB, "CIM_Foo_sub_sub1", 3L));
        server.createInstance(ns, foo(FOO_SUB2, "CIM_Foo_sub2_1", null));
        for (String name : new String[] {"Mike", "Saara", "Sofi", "Gabi"}) {
            server.createInstance(ns, person(name));
        }
        server.createInstance(ns, lineage("MikeSofi", "Mike", "Sofi"));
        server.createInstance(ns, lineage("MikeGabi", "Mike", "Gabi"));
        server.createInstance(ns, lineage("SaaraSofi", "Saara", "Sofi"));
    }

    //------------------------------------------------------------< model >--

    protected static List<CIMClass> classes() {
        List<CIMClass> classes = new ArrayList<>();
        classes.add(CIMClass.builder(FOO)
                .qualifier(CIMQualifier.of(Qualifiers.DESCRIPTION, "Simple CIM class"))
                .property(CIMProperty.builder("InstanceID", CIMType.STRING).key().build())
                .property(CIMProperty.builder("IntegerProp", CIMType.UINT32)
                        .qualifier(CIMQualifier.of(Qualifiers.DESCRIPTION, "An integer")).build())
                .property(CIMProperty.of("Flag", CIMType.BOOLEAN, true))
                .method(CIMMethod.builder("Fuzzy", CIMType.UINT32)
                        .parameter(CIMParameter.builder("TestInOutParameter", CIMType.STRING)
                                .qualifier(CIMQualifier.of(Qualifiers.IN, true))
                                .qualifier(CIMQualifier.of(Qualifiers.OUT, true)).build())
                        .parameter(CIMParameter.builder("OutOnly", CIMType.UINT32)
                                .qualifier(CIMQualifier.of(Qualifiers.IN, false))
                                .qualifier(CIMQualifier.of(Qualifiers.OUT, true)).build())
                        .build())
                .method(CIMMethod.builder("DeleteNothing", CIMType.UINT32)
                        .qualifier(CIMQualifier.of(Qualifiers.STATIC, true)).build())
                .build());
        classes.add(CIMClass.builder(FOO_SUB).superClass(FOO)
                .property(CIMProperty.of("cimfoo_sub", CIMType.STRING, null))
                .build());
        classes.add(CIMClass.builder(FOO_SUB_SUB).superClass(FOO_SUB)
                .property(CIMProperty.of("cimfoo_sub_sub", CIMType.STRING, null))
                .build());
        classes.add(CIMClass.builder(FOO_SUB2).superClass(FOO)
                .property(CIMProperty.of("cimfoo_sub2", CIMType.STRING, null))
                .build());
        classes.add(CIMClass.builder(ABSTRACT)
                .qualifier(CIMQualifier.of(Qualifiers.ABSTRACT, true))
                .property(CIMProperty.builder("InstanceID", CIMType.STRING).key().build())
                .build());
        classes.add(CIMClass.builder(PERSON)
                .property(CIMProperty.builder("name", CIMType.STRING).key().build())
                .property(CIMProperty.of("extraProperty", CIMType.STRING, "defaultvalue"))
                .build());
        classes.add(CIMClass.builder(LINEAGE)
                .qualifier(CIMQualifier.of(Qualifiers.ASSOCIATION, true))
                .property(CIMProperty.builder("InstanceID", CIMType.STRING).key().build())
                .property(CIMProperty.builder("parent", CIMType.REFERENCE).referenceClass(PERSON).build())
                .property(CIMProperty.builder("child", CIMType.REFERENCE).referenceClass(PERSON).build())
                .build());
        return classes;
    }

    protected static CIMInstance foo(String className, String id, Long integerProp) {
        return CIMInstance.builder(className)
                .property("InstanceID", CIMType.STRING, id)
                .property("IntegerProp", CIMType.UINT32, integerProp)
                .build();
    }

    protected static CIMInstance fooSub(String id, String cimfooSub) {
        return CIMInstance.builder(FOO_SUB)
                .property("InstanceID", CIMType.STRING, id)
                .property("cimfoo_sub", CIMType.STRING, cimfooSub)
                .build();
    }

    protected static CIMInstanceName fooName(String className, String id) {
        return CIMInstanceName.of(className, ImmutableMap.of("InstanceID", id));
    }

    protected static CIMInstance person(String name) {
        return CIMInstance.builder(PERSON).property("name", CIMType.STRING, name).build();
    }

    protected static CIMInstanceName personName(String name) {
        return CIMInstanceName.of(PERSON, ImmutableMap.of("name", name));
    }

    protected static CIMInstance lineage(String id, String parent, String child) {
        return CIMInstance.builder(LINEAGE)
                .property("InstanceID", CIMType.STRING, id)
                .property(CIMProperty.reference("parent", PERSON, personName(parent)))
                .property(CIMProperty.reference("child", PERSON, personName(child)))
                .build();
    }

    protected static CIMInstanceName lineageName(String id) {
        return CIMInstanceName.of(LINEAGE, ImmutableMap.of("InstanceID", id));
    }

    //----------------------------------------------------------< asserts >--

    protected static CIMException assertStatus(CIMStatus status, ThrowingRunnable operation) {
        CIMException e = assertThrows(CIMException.class, operation);
        assertEquals(e.getMessage(), status, e.getStatus());
        return e;
    }

    /**
     * @return the {@code InstanceID} or {@code name} keys of the paths,
     *         sorted
     */
    protected static List<String> keys(Collection<CIMInstanceName> names) {
        List<String> result = new ArrayList<>();
        for (CIMInstanceName name : names) {
            Object key = name.getKey("InstanceID");
            result.add(String.valueOf(key != null ? key : name.getKey("name")));
        }
        result.sort(null);
        return result;
    }

    protected static List<String> instanceKeys(Collection<CIMInstance> instances) {
        List<CIMInstanceName> names = new ArrayList<>();
        for (CIMInstance instance : instances) {
            names.add(instance.getPath());
        }
        return keys(names);
    }

    protected static List<String> classNames(Collection<String> names) {
        List<String> result = new ArrayList<>();
        for (String name : names) {
            result.add(Names.fold(name));
        }
        result.sort(null);
        return result;
    }
}
