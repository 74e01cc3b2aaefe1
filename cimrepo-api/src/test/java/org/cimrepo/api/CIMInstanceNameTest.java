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
package org.cimrepo.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class CIMInstanceNameTest {

    @Test
    public void equalityIgnoresCaseOfNames() {
        CIMInstanceName a = CIMInstanceName.builder("CIM_Foo").key("InstanceID", "X").namespace("root/cimv2").build();
        CIMInstanceName b = CIMInstanceName.builder("cim_foo").key("instanceid", "X").namespace("/ROOT/CIMV2").build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    public void keyValuesAreCaseSensitive() {
        CIMInstanceName a = CIMInstanceName.builder("CIM_Foo").key("InstanceID", "X").build();
        CIMInstanceName b = CIMInstanceName.builder("CIM_Foo").key("InstanceID", "x").build();
        assertNotEquals(a, b);
    }

    @Test
    public void keyOrderDoesNotMatter() {
        CIMInstanceName a = CIMInstanceName.of("CIM_Foo", ImmutableMap.of("A", 1L, "B", "two"));
        CIMInstanceName b = CIMInstanceName.of("CIM_Foo", ImmutableMap.of("B", "two", "A", 1L));
        assertEquals(a, b);
    }

    @Test
    public void integralKeysCompareByValue() {
        CIMInstanceName asLong = CIMInstanceName.of("TST_Num", ImmutableMap.of("ID", 7L));
        CIMInstanceName asInt = CIMInstanceName.of("TST_Num", ImmutableMap.of("ID", 7));
        CIMInstanceName asShort = CIMInstanceName.builder("TST_Num").key("ID", (short) 7).build();
        CIMInstanceName asBig = CIMInstanceName.builder("TST_Num").key("ID", BigInteger.valueOf(7)).build();
        assertEquals(asLong, asInt);
        assertEquals(asLong.hashCode(), asInt.hashCode());
        assertEquals(asLong, asShort);
        assertEquals(asLong, asBig);
        assertEquals(7L, asInt.getKey("ID"));
        assertNotEquals(asLong, CIMInstanceName.of("TST_Num", ImmutableMap.of("ID", 8)));
    }

    @Test
    public void largeUnsignedKeysStayExact() {
        BigInteger max = new BigInteger("18446744073709551615");
        CIMInstanceName name = CIMInstanceName.builder("TST_Num").key("ID", max).build();
        assertEquals(max, name.getKey("ID"));
        assertEquals(name, CIMInstanceName.builder("TST_Num").key("ID", new BigInteger("18446744073709551615")).build());
    }

    @Test
    public void realKeysCompareByValue() {
        CIMInstanceName asFloat = CIMInstanceName.builder("TST_Real").key("R", 0.5f).build();
        CIMInstanceName asDouble = CIMInstanceName.builder("TST_Real").key("R", 0.5d).build();
        assertEquals(asFloat, asDouble);
    }

    @Test
    public void modelPathDropsNamespaceAndHost() {
        CIMInstanceName full = CIMInstanceName.builder("CIM_Foo").key("InstanceID", "X")
                .namespace("root/cimv2").host("server").build();
        CIMInstanceName model = full.modelPath();
        assertNull(model.getNamespace());
        assertNull(model.getHost());
        assertNotEquals(full, model);
        assertEquals(model, full.withNamespace(null).withHost(null));
        assertSame(model, model.modelPath());
    }

    @Test
    public void rendersWbemUri() {
        CIMInstanceName name = CIMInstanceName.builder("CIM_Foo").key("InstanceID", "X").build();
        assertEquals("CIM_Foo.InstanceID=\"X\"", name.toString());

        CIMInstanceName multi = CIMInstanceName.builder("TST_A").key("Name", "a\"b").key("Active", true)
                .key("Count", 3L).namespace("root/cimv2").host("srv").build();
        assertEquals("//srv/root/cimv2:TST_A.Active=TRUE,Count=3,Name=\"a\\\"b\"", multi.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullKeyValueIsRejected() {
        CIMInstanceName.of("CIM_Foo", java.util.Collections.singletonMap("InstanceID", null));
    }

    @Test
    public void classNamePaths() {
        CIMClassName a = new CIMClassName("CIM_Foo", "root/cimv2");
        assertEquals(a, new CIMClassName("cim_foo", "Root/CIMV2/"));
        assertFalse(a.equals(new CIMClassName("CIM_Foo")));
        assertEquals("/root/cimv2:CIM_Foo", a.toString());
        assertTrue(a.withNamespace(null).getNamespace() == null);
    }
}
