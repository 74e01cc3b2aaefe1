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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.spi.provider.ProviderType;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;

public class OperationParametersTest {

    private static void assertInvalid(ThrowingRunnable operation) {
        CIMException e = assertThrows(CIMException.class, operation);
        assertEquals(CIMStatus.INVALID_PARAMETER, e.getStatus());
    }

    @Test
    public void namesIgnoreCase() throws Exception {
        OperationParameters params = OperationParameters.create().set("ClassName", "CIM_Foo");
        assertTrue(params.contains("classname"));
        assertEquals("CIM_Foo", params.getString("CLASSNAME"));
        params.set("classNAME", null);
        assertFalse(params.contains("ClassName"));
    }

    @Test
    public void defaults() throws Exception {
        OperationParameters params = OperationParameters.create().set("LocalOnly", false);
        assertFalse(params.getBoolean("LocalOnly", true));
        assertTrue(params.getBoolean("DeepInheritance", true));
        assertNull(params.getInteger("MaxObjectCount"));
        assertNull(params.getStringList("PropertyList"));
    }

    @Test
    public void integers() throws Exception {
        OperationParameters params = OperationParameters.create()
                .set("A", 5L).set("B", 2.0).set("C", 2.5).set("D", Long.MAX_VALUE);
        assertEquals(Integer.valueOf(5), params.getInteger("A"));
        assertEquals(Integer.valueOf(2), params.getInteger("B"));
        assertInvalid(() -> params.getInteger("C"));
        assertInvalid(() -> params.getInteger("D"));
    }

    @Test
    public void typeErrors() throws Exception {
        OperationParameters params = OperationParameters.create()
                .set("LocalOnly", "yes")
                .set("PropertyList", asList("a", 1));
        assertInvalid(() -> params.getBoolean("LocalOnly", true));
        assertInvalid(() -> params.getStringList("PropertyList"));
        assertInvalid(() -> params.getRequired("ClassName", String.class));
        assertEquals(asList("a", "b"), OperationParameters.create().set("P", asList("a", "b"))
                .getStringList("p"));
    }

    @Test
    public void intrinsicMethodNames() throws Exception {
        for (IntrinsicMethod m : IntrinsicMethod.values()) {
            assertEquals(m, IntrinsicMethod.fromWireName(m.getWireName().toUpperCase()));
        }
        assertEquals(ProviderType.INSTANCE_WRITE, IntrinsicMethod.CREATE_INSTANCE.getProviderType());
        assertEquals(ProviderType.ASSOCIATION, IntrinsicMethod.OPEN_REFERENCE_INSTANCES.getProviderType());
        assertNull(IntrinsicMethod.GET_CLASS.getProviderType());
    }
}
