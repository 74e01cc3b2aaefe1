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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMClassName;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMObjectPath;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMProperty;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.EnumerationContext;
import org.cimrepo.api.EnumerationResult;
import org.cimrepo.api.Scope;
import org.cimrepo.core.ServerSettings;
import org.cimrepo.core.StandardQualifiers;
import org.cimrepo.spi.provider.MethodProvider;
import org.cimrepo.spi.provider.MethodResult;
import org.cimrepo.spi.provider.ProviderContext;
import org.jetbrains.annotations.NotNull;
import org.junit.Test;

public class MockWBEMServerTest extends AbstractServerTest {

    //-------------------------------------------------------< namespaces >--

    @Test
    public void defaultNamespace() throws Exception {
        assertEquals(Collections.singleton(ServerSettings.DEFAULT_NAMESPACE), server.getNamespaces());
        assertEquals(7, server.enumerateClassNames(null, null, true).size());
        assertTrue(server.hasNamespace("/root/CIMV2/"));
    }

    @Test
    public void addAndRemoveNamespace() throws Exception {
        server.addNamespace("root/other");
        assertEquals(ImmutableSet.of(ns, "root/other"), server.getNamespaces());
        assertStatus(CIMStatus.ALREADY_EXISTS, () -> server.addNamespace("ROOT/Other"));
        server.removeNamespace("root/other");
        assertFalse(server.hasNamespace("root/other"));
        assertStatus(CIMStatus.NAMESPACE_NOT_EMPTY, () -> server.removeNamespace(ns));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.removeNamespace("root/other"));
    }

    @Test
    public void interopNamespace() throws Exception {
        assertTrue(MockWBEMServer.isInteropNamespaceName("interop"));
        assertTrue(MockWBEMServer.isInteropNamespaceName("/root/pg_interop"));
        assertTrue(MockWBEMServer.isInteropNamespaceName("Root/Interop"));
        assertFalse(MockWBEMServer.isInteropNamespaceName(ns));
        assertFalse(MockWBEMServer.isInteropNamespaceName(null));

        assertNull(server.getInteropNamespace());
        server.addNamespace("root/PG_Interop");
        assertEquals("root/PG_Interop", server.getInteropNamespace());
    }

    //----------------------------------------------------------< classes >--

    @Test
    public void getClassDefaults() throws Exception {
        CIMClass sub = server.getClass(ns, "cim_foo_sub", true, true, false, null);
        assertEquals(FOO_SUB, sub.getClassName());
        assertEquals(FOO, sub.getSuperClass());
        assertEquals(Collections.singleton("cimfoo_sub"), sub.getProperties().keySet());

        CIMClass full = server.getClass(ns, FOO_SUB, false, true, true, null);
        assertEquals(4, full.getProperties().size());
        assertEquals(FOO, full.getProperty("InstanceID").getClassOrigin());
    }

    @Test
    public void getClassOfMissingClass() {
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.getClass(ns, "CIM_Blah", false, true, true, null));
        assertStatus(CIMStatus.INVALID_NAMESPACE,
                () -> server.getClass("root/blah", FOO, false, true, true, null));
    }

    @Test
    public void getClassIsRepeatable() throws Exception {
        CIMClass first = server.getClass(ns, FOO_SUB_SUB, false, true, true, null);
        CIMClass second = server.getClass(ns, FOO_SUB_SUB, false, true, true, null);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void enumerateClasses() throws Exception {
        assertEquals(asList("cim_abstract", "cim_foo", "tst_lineage", "tst_person"),
                classNames(server.enumerateClassNames(ns, null, false)));
        assertEquals(asList("cim_foo_sub", "cim_foo_sub2"),
                classNames(server.enumerateClassNames(ns, FOO, false)));
        List<String> deep = new ArrayList<>();
        for (CIMClass c : server.enumerateClasses(ns, FOO, true, true, false, false)) {
            deep.add(c.getClassName());
            assertTrue(c.getQualifiers().isEmpty());
        }
        assertEquals(asList("cim_foo_sub", "cim_foo_sub2", "cim_foo_sub_sub"), classNames(deep));
    }

    @Test
    public void createClassErrors() throws Exception {
        assertStatus(CIMStatus.ALREADY_EXISTS, () -> server.createClass(ns, CIMClass.builder("cim_foo").build()));
        assertStatus(CIMStatus.INVALID_SUPERCLASS, () -> server.createClass(ns,
                CIMClass.builder("CIM_Orphan").superClass("CIM_Missing").build()));
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> server.createClass("root/blah",
                CIMClass.builder("CIM_New").build()));
    }

    @Test
    public void modifyClass() throws Exception {
        server.modifyClass(ns, CIMClass.builder(FOO_SUB2).superClass(FOO)
                .property(CIMProperty.of("Added", CIMType.STRING, "x")).build());
        assertNotNull(server.getClass(ns, FOO_SUB2, true, false, false, null).getProperty("added"));

        assertStatus(CIMStatus.CLASS_HAS_CHILDREN, () -> server.modifyClass(ns, CIMClass.builder(FOO_SUB)
                .superClass(FOO).build()));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.modifyClass(ns, CIMClass.builder("CIM_Blah").build()));
    }

    @Test
    public void deleteClass() throws Exception {
        server.createInstance(ns, foo(FOO_SUB2, "X", null));
        assertStatus(CIMStatus.CLASS_HAS_INSTANCES, () -> server.deleteClass(ns, FOO_SUB2));
        server.deleteInstance(ns, fooName(FOO_SUB2, "X"));
        server.deleteClass(ns, FOO_SUB2);
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.getClass(ns, FOO_SUB2, true, true, false, null));
        assertStatus(CIMStatus.CLASS_HAS_CHILDREN, () -> server.deleteClass(ns, FOO));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.deleteClass(ns, FOO_SUB2));
    }

    //-------------------------------------------------------< qualifiers >--

    @Test
    public void qualifierDeclarations() throws Exception {
        assertEquals(StandardQualifiers.DECLARATIONS.size(), server.enumerateQualifiers(ns).size());
        assertEquals("Key", server.getQualifier(ns, "KEY").getName());
        assertStatus(CIMStatus.NOT_FOUND, () -> server.getQualifier(ns, "Blah"));

        CIMQualifierDeclaration blah = CIMQualifierDeclaration.builder("Blah", CIMType.STRING)
                .scopes(Scope.CLASS).build();
        server.setQualifier(ns, blah);
        assertEquals(blah, server.getQualifier(ns, "blah"));
        CIMQualifierDeclaration replaced = CIMQualifierDeclaration.builder("Blah", CIMType.STRING)
                .scopes(Scope.ANY).overridable(false).build();
        server.setQualifier(ns, replaced);
        assertFalse(server.getQualifier(ns, "Blah").isOverridable());

        server.deleteQualifier(ns, "blah");
        assertStatus(CIMStatus.NOT_FOUND, () -> server.deleteQualifier(ns, "blah"));
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> server.enumerateQualifiers("root/blah"));
    }

    //--------------------------------------------------------< instances >--

    @Test
    public void instanceLifecycle() throws Exception {
        CIMInstanceName path = server.createInstance(ns, foo(FOO, "New", 7L));
        assertEquals(ns, path.getNamespace());
        assertEquals("New", path.getKey("InstanceID"));

        CIMInstance stored = server.getInstance(ns, path);
        assertEquals(7L, stored.getPropertyValue("IntegerProp"));
        assertNull(stored.getPropertyValue("Flag"));

        server.modifyInstance(ns, foo(FOO, "New", 8L).withPath(path), Collections.singletonList("IntegerProp"));
        assertEquals(8L, server.getInstance(ns, fooName(FOO, "New")).getPropertyValue("IntegerProp"));

        server.deleteInstance(ns, path);
        assertStatus(CIMStatus.NOT_FOUND, () -> server.getInstance(ns, path));
        assertStatus(CIMStatus.NOT_FOUND, () -> server.deleteInstance(ns, path));
    }

    @Test
    public void integerKeyMatchesStoredInstance() throws Exception {
        server.createClass(ns, CIMClass.builder("TST_Num")
                .property(CIMProperty.builder("ID", CIMType.UINT32).key().build())
                .property(CIMProperty.of("Label", CIMType.STRING, null))
                .build());
        CIMInstanceName stored = server.createInstance(ns, CIMInstance.builder("TST_Num")
                .property("ID", CIMType.UINT32, 7L)
                .property("Label", CIMType.STRING, "seven")
                .build());
        CIMInstanceName asInteger = CIMInstanceName.of("TST_Num", ImmutableMap.of("ID", 7));
        assertEquals(stored.modelPath(), asInteger);

        assertEquals("seven", server.getInstance(ns, asInteger).getPropertyValue("Label"));
        server.modifyInstance(ns, CIMInstance.builder("TST_Num")
                .property("ID", CIMType.UINT32, 7L)
                .property("Label", CIMType.STRING, "sieben")
                .path(asInteger).build(), Collections.singletonList("Label"));
        assertEquals("sieben", server.getInstance(ns, stored).getPropertyValue("Label"));
        server.deleteInstance(ns, asInteger);
        assertStatus(CIMStatus.NOT_FOUND, () -> server.getInstance(ns, stored));
    }

    @Test
    public void getInstanceIsRepeatable() throws Exception {
        loadInstances();
        CIMInstanceName path = fooName(FOO_SUB, "CIM_Foo_sub1");
        CIMInstance first = server.getInstance(ns, path);
        CIMInstance second = server.getInstance(ns, path);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void enumerateInstances() throws Exception {
        loadInstances();
        assertEquals(asList("CIM_Foo1", "CIM_Foo2", "CIM_Foo3", "CIM_Foo_sub1", "CIM_Foo_sub2_1",
                "CIM_Foo_sub_sub1"), instanceKeys(server.enumerateInstances(ns, FOO)));
        assertEquals(asList("CIM_Foo_sub1", "CIM_Foo_sub_sub1"), keys(server.enumerateInstanceNames(ns, FOO_SUB)));
        assertStatus(CIMStatus.INVALID_CLASS, () -> server.enumerateInstances(ns, "CIM_Blah"));
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> server.enumerateInstances("root/blah", FOO));
    }

    @Test
    public void execQueryNotSupported() {
        assertStatus(CIMStatus.NOT_SUPPORTED, () -> server.execQuery(ns, "WQL", "SELECT * FROM CIM_Foo"));
        assertStatus(CIMStatus.INVALID_NAMESPACE, () -> server.execQuery("root/blah", "WQL", "SELECT"));
    }

    //-----------------------------------------------------< associations >--

    @Test
    public void associations() throws Exception {
        loadInstances();
        assertEquals(asList("MikeGabi", "MikeSofi"), keys(server.referenceNames(ns, personName("Mike"), null, null)));
        assertEquals(asList("Mike", "Saara"),
                keys(server.associatorNames(ns, personName("Sofi"), LINEAGE, PERSON, "child", "parent")));
        List<CIMClassName> classes = server.referenceNames(ns, new CIMClassName(PERSON), null, null);
        assertEquals(1, classes.size());
        assertEquals(LINEAGE, classes.get(0).getClassName());
    }

    //-------------------------------------------------------------< pull >--

    @Test
    public void openAndPullInstances() throws Exception {
        loadInstances();
        EnumerationResult<CIMInstance> first = server.openEnumerateInstances(ns, FOO, 2);
        assertEquals(2, first.getItems().size());
        assertFalse(first.isEndOfSequence());
        EnumerationContext context = first.getContext();
        assertNotNull(context);

        List<CIMInstance> all = new ArrayList<>(first.getItems());
        EnumerationResult<CIMInstance> next = server.pullInstancesWithPath(context, 3);
        assertEquals(3, next.getItems().size());
        assertFalse(next.isEndOfSequence());
        all.addAll(next.getItems());

        EnumerationResult<CIMInstance> last = server.pullInstancesWithPath(context, 3);
        assertTrue(last.isEndOfSequence());
        assertNull(last.getContext());
        all.addAll(last.getItems());

        assertEquals(instanceKeys(server.enumerateInstances(ns, FOO)), instanceKeys(all));
        assertStatus(CIMStatus.INVALID_ENUMERATION_CONTEXT, () -> server.pullInstancesWithPath(context, 1));
    }

    @Test
    public void openAndPullMatchEnumerateForAnyBatchSize() throws Exception {
        loadInstances();
        List<CIMInstance> expected = server.enumerateInstances(ns, FOO);
        int n = expected.size();
        for (int max : new int[] {0, 1, n - 1, n, n + 1}) {
            EnumerationResult<CIMInstance> result = server.openEnumerateInstances(ns, FOO, max);
            assertTrue(result.getItems().size() <= max);
            List<CIMInstance> all = new ArrayList<>(result.getItems());
            int pulls = 0;
            while (!result.isEndOfSequence()) {
                assertTrue("too many pulls with MaxObjectCount " + max, pulls++ <= n);
                result = server.pullInstancesWithPath(result.getContext(), Math.max(max, 1));
                all.addAll(result.getItems());
            }
            assertEquals("MaxObjectCount " + max, expected, all);
        }
    }

    @Test
    public void continueOnErrorDoesNotChangeResults() throws Exception {
        loadInstances();
        EnumerationResult<CIMInstanceName> plain = server.openEnumerateInstancePaths(ns, FOO,
                OpenOptions.defaults());
        EnumerationResult<CIMInstanceName> continuing = server.openEnumerateInstancePaths(ns, FOO,
                OpenOptions.builder().continueOnError(true).build());
        assertTrue(continuing.isEndOfSequence());
        assertEquals(plain.getItems(), continuing.getItems());
    }

    @Test
    public void openCompleteWithoutContext() throws Exception {
        loadInstances();
        EnumerationResult<CIMInstanceName> result = server.openEnumerateInstancePaths(ns, PERSON,
                OpenOptions.defaults());
        assertTrue(result.isEndOfSequence());
        assertNull(result.getContext());
        assertEquals(asList("Gabi", "Mike", "Saara", "Sofi"), keys(result.getItems()));
    }

    @Test
    public void openAssociationPaths() throws Exception {
        loadInstances();
        EnumerationResult<CIMInstanceName> refs = server.openReferenceInstancePaths(ns, personName("Mike"),
                null, null, OpenOptions.maxObjectCount(1));
        assertEquals(1, refs.getItems().size());
        EnumerationResult<CIMInstanceName> rest = server.pullInstancePaths(refs.getContext(), 5);
        assertTrue(rest.isEndOfSequence());
        List<CIMInstanceName> all = new ArrayList<>(refs.getItems());
        all.addAll(rest.getItems());
        assertEquals(asList("MikeGabi", "MikeSofi"), keys(all));

        EnumerationResult<CIMInstance> assocs = server.openAssociatorInstances(ns, personName("Sofi"),
                null, null, null, null, false, null, OpenOptions.defaults());
        assertEquals(asList("Mike", "Saara"), instanceKeys(assocs.getItems()));
    }

    @Test
    public void pullWithOtherOperation() throws Exception {
        loadInstances();
        EnumerationContext context = server.openEnumerateInstancePaths(ns, FOO, OpenOptions.maxObjectCount(1))
                .getContext();
        assertStatus(CIMStatus.INVALID_ENUMERATION_CONTEXT, () -> server.pullInstancesWithPath(context, 1));
        server.closeEnumeration(context);
        assertStatus(CIMStatus.INVALID_ENUMERATION_CONTEXT, () -> server.closeEnumeration(context));
    }

    @Test
    public void openOptionErrors() throws Exception {
        assertStatus(CIMStatus.FILTERED_ENUMERATION_NOT_SUPPORTED, () -> server.openEnumerateInstances(ns, FOO,
                true, false, null, OpenOptions.builder().filterQuery("DMTF:FQL", "a=1").build()));
        assertStatus(CIMStatus.QUERY_LANGUAGE_NOT_SUPPORTED, () -> server.openEnumerateInstancePaths(ns, FOO,
                OpenOptions.builder().filterQuery("WQL", "a=1").build()));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.openEnumerateInstancePaths(ns, FOO,
                OpenOptions.builder().operationTimeout(ServerSettings.OPEN_MAX_TIMEOUT + 1).build()));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.openEnumerateInstances(ns, FOO, -1));
        assertStatus(CIMStatus.NOT_SUPPORTED, () -> server.openQueryInstances(ns, "DMTF:CQL", "SELECT",
                OpenOptions.defaults()));
    }

    @Test
    public void pullOperationsDisabled() throws Exception {
        server = new MockWBEMServer(ServerSettings.builder().pullOperationsDisabled(true).build());
        loadClasses(server, ns);
        assertStatus(CIMStatus.NOT_SUPPORTED, () -> server.openEnumerateInstances(ns, FOO, null));
        assertEquals(0, server.enumerateInstances(ns, FOO).size());
    }

    //--------------------------------------------------------< dispatch >--

    @Test
    public void invokeByWireName() throws Exception {
        loadInstances();
        IntrinsicMethod method = IntrinsicMethod.fromWireName("enumerateinstancenames");
        assertEquals(IntrinsicMethod.ENUMERATE_INSTANCE_NAMES, method);
        @SuppressWarnings("unchecked")
        List<CIMInstanceName> names = (List<CIMInstanceName>) server.invoke(method, ns,
                OperationParameters.create().set("classname", PERSON));
        assertEquals(asList("Gabi", "Mike", "Saara", "Sofi"), keys(names));
        assertStatus(CIMStatus.NOT_SUPPORTED, () -> IntrinsicMethod.fromWireName("Frobnicate"));
    }

    @Test
    public void invokeAppliesDefaults() throws Exception {
        CIMClass localOnly = (CIMClass) server.invoke(IntrinsicMethod.GET_CLASS, ns,
                OperationParameters.create().set("ClassName", FOO_SUB));
        assertEquals(1, localOnly.getProperties().size());

        CIMClass full = (CIMClass) server.invoke(IntrinsicMethod.GET_CLASS, ns,
                OperationParameters.create().set("ClassName", FOO_SUB).set("LocalOnly", false)
                        .set("PropertyList", asList("InstanceID")));
        assertEquals(Collections.singleton("InstanceID"), full.getProperties().keySet());
    }

    @Test
    public void invokeParameterErrors() {
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.invoke(IntrinsicMethod.GET_CLASS, ns,
                OperationParameters.create()));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.invoke(IntrinsicMethod.GET_CLASS, ns,
                OperationParameters.create().set("ClassName", 42)));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> server.invoke(IntrinsicMethod.OPEN_ENUMERATE_INSTANCES,
                ns, OperationParameters.create().set("ClassName", FOO).set("MaxObjectCount", 1.5)));
    }

    @Test
    public void invokeWriteAndPull() throws Exception {
        CIMInstanceName path = (CIMInstanceName) server.invoke(IntrinsicMethod.CREATE_INSTANCE, ns,
                OperationParameters.create().set("NewInstance", person("Ann")));
        server.invoke(IntrinsicMethod.CREATE_INSTANCE, ns,
                OperationParameters.create().set("NewInstance", person("Bob")));

        @SuppressWarnings("unchecked")
        EnumerationResult<CIMInstance> open = (EnumerationResult<CIMInstance>) server.invoke(
                IntrinsicMethod.OPEN_ENUMERATE_INSTANCES, ns,
                OperationParameters.create().set("ClassName", PERSON).set("MaxObjectCount", 1));
        assertEquals(1, open.getItems().size());
        @SuppressWarnings("unchecked")
        EnumerationResult<CIMInstance> pulled = (EnumerationResult<CIMInstance>) server.invoke(
                IntrinsicMethod.PULL_INSTANCES_WITH_PATH, ns,
                OperationParameters.create().set("EnumerationContext", open.getContext()).set("MaxObjectCount", 1L));
        assertTrue(pulled.isEndOfSequence());

        assertNull(server.invoke(IntrinsicMethod.DELETE_INSTANCE, ns,
                OperationParameters.create().set("InstanceName", path)));
        assertEquals(asList("Bob"), keys(server.enumerateInstanceNames(ns, PERSON)));
    }

    //--------------------------------------------------------< snapshots >--

    @Test
    public void snapshotAndRestore() throws Exception {
        loadInstances();
        server.addNamespace("root/other");
        server.registerProvider(new ConstantMethodProvider(), Collections.singletonList(ns));
        byte[] snapshot = server.snapshot();

        server.deleteInstance(ns, personName("Gabi"));
        MockWBEMServer restored = MockWBEMServer.restore(snapshot, ServerSettings.defaults());
        assertEquals(server.getNamespaces(), restored.getNamespaces());
        assertEquals(3, server.enumerateInstanceNames(ns, PERSON).size());
        assertEquals(4, restored.enumerateInstanceNames(ns, PERSON).size());

        MethodResult result = restored.invokeMethod(ns, "DeleteNothing", new CIMClassName(FOO),
                Collections.<CIMParameter>emptyList());
        assertEquals(ns, result.getReturnValue());
    }

    @Test
    public void snapshotWithUnserializableProvider() throws Exception {
        MethodProvider provider = mock(MethodProvider.class);
        when(provider.getProvidedClassNames()).thenReturn(ImmutableSet.of(FOO));
        server.registerProvider(provider, Collections.singletonList(ns));
        assertThrows(IOException.class, () -> server.snapshot());
    }

    @Test
    public void restoreRejectsOtherData() {
        assertThrows(IOException.class, () -> MockWBEMServer.restore(new byte[] {1, 2, 3},
                ServerSettings.defaults()));
    }

    //-------------------------------------------------------------< lite >--

    @Test
    public void liteMode() throws Exception {
        MockWBEMServer lite = new MockWBEMServer(ServerSettings.defaults(), true);
        assertTrue(lite.isLite());
        CIMInstanceName path = fooName(FOO_SUB, "L1");
        lite.createInstance(ns, fooSub("L1", "x").withPath(path));
        lite.createInstance(ns, foo(FOO, "L2", null).withPath(fooName(FOO, "L2")));
        assertEquals(asList("L2"), keys(lite.enumerateInstanceNames(ns, FOO)));
        assertEquals("x", lite.getInstance(ns, path).getPropertyValue("cimfoo_sub"));
        assertStatus(CIMStatus.INVALID_PARAMETER, () -> lite.createInstance(ns, foo(FOO, "L3", null)));
    }

    /**
     * Answers every method with the namespace it was invoked in.
     */
    static final class ConstantMethodProvider implements MethodProvider, Serializable {

        private static final long serialVersionUID = 1L;

        private transient ProviderContext context;

        @Override
        public void init(@NotNull ProviderContext context) {
            this.context = context;
        }

        @NotNull
        @Override
        public Set<String> getProvidedClassNames() {
            return ImmutableSet.of(FOO);
        }

        @Override
        public MethodResult invokeMethod(@NotNull String namespace, @NotNull String methodName,
                                         @NotNull CIMObjectPath objectName,
                                         @NotNull Map<String, CIMParameter> inParams) throws CIMException {
            if (context == null) {
                throw new CIMException(CIMStatus.FAILED, "Not initialized");
            }
            return new MethodResult(namespace);
        }
    }
}
