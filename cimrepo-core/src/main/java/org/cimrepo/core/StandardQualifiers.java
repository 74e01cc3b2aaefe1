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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMType;
import org.cimrepo.api.Scope;

/**
 * The DMTF qualifier declarations the repository relies on, for loading
 * into namespaces that are not populated from a schema.
 */
public final class StandardQualifiers {

    public static final List<CIMQualifierDeclaration> DECLARATIONS = ImmutableList.of(
            CIMQualifierDeclaration.builder("Abstract", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.CLASS, Scope.ASSOCIATION, Scope.INDICATION)
                    .overridable(false).toSubclass(false).build(),
            CIMQualifierDeclaration.builder("Aggregate", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.REFERENCE).overridable(false).build(),
            CIMQualifierDeclaration.builder("Aggregation", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.ASSOCIATION).overridable(false).build(),
            CIMQualifierDeclaration.builder("Association", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.ASSOCIATION).overridable(false).build(),
            CIMQualifierDeclaration.builder("Deprecated", CIMType.STRING).array(true)
                    .scopes(Scope.ANY).overridable(false).build(),
            CIMQualifierDeclaration.builder("Description", CIMType.STRING)
                    .scopes(Scope.ANY).translatable(true).build(),
            CIMQualifierDeclaration.builder("EmbeddedInstance", CIMType.STRING)
                    .scopes(Scope.PROPERTY, Scope.METHOD, Scope.PARAMETER).build(),
            CIMQualifierDeclaration.builder("EmbeddedObject", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.PROPERTY, Scope.METHOD, Scope.PARAMETER).overridable(false).build(),
            CIMQualifierDeclaration.builder("In", CIMType.BOOLEAN).value(true)
                    .scopes(Scope.PARAMETER).overridable(false).build(),
            CIMQualifierDeclaration.builder("Indication", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.CLASS, Scope.INDICATION).overridable(false).build(),
            CIMQualifierDeclaration.builder("Key", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.PROPERTY, Scope.REFERENCE).overridable(false).build(),
            CIMQualifierDeclaration.builder("Max", CIMType.UINT32)
                    .scopes(Scope.REFERENCE).build(),
            CIMQualifierDeclaration.builder("Min", CIMType.UINT32).value(0L)
                    .scopes(Scope.REFERENCE).build(),
            CIMQualifierDeclaration.builder("Out", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.PARAMETER).overridable(false).build(),
            CIMQualifierDeclaration.builder("Override", CIMType.STRING)
                    .scopes(Scope.PROPERTY, Scope.REFERENCE, Scope.METHOD).toSubclass(false).build(),
            CIMQualifierDeclaration.builder("Required", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.PROPERTY, Scope.REFERENCE, Scope.METHOD, Scope.PARAMETER)
                    .overridable(false).build(),
            CIMQualifierDeclaration.builder("Static", CIMType.BOOLEAN).value(false)
                    .scopes(Scope.PROPERTY, Scope.METHOD).overridable(false).build(),
            CIMQualifierDeclaration.builder("ValueMap", CIMType.STRING).array(true)
                    .scopes(Scope.PROPERTY, Scope.METHOD, Scope.PARAMETER).build(),
            CIMQualifierDeclaration.builder("Values", CIMType.STRING).array(true)
                    .scopes(Scope.PROPERTY, Scope.METHOD, Scope.PARAMETER).translatable(true).build(),
            CIMQualifierDeclaration.builder("Version", CIMType.STRING)
                    .scopes(Scope.CLASS, Scope.ASSOCIATION, Scope.INDICATION).translatable(true).build());

    private StandardQualifiers() {
    }
}
