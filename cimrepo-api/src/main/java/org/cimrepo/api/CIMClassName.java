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

import java.util.Objects;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Path of a class.
 */
public final class CIMClassName implements CIMObjectPath {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final String namespace;
    private final String host;

    public CIMClassName(@NotNull String className, @Nullable String namespace, @Nullable String host) {
        this.className = checkNotNull(className);
        this.namespace = namespace == null ? null : Names.normalizeNamespace(namespace);
        this.host = host;
    }

    public CIMClassName(@NotNull String className, @Nullable String namespace) {
        this(className, namespace, null);
    }

    public CIMClassName(@NotNull String className) {
        this(className, null, null);
    }

    @NotNull
    @Override
    public String getClassName() {
        return className;
    }

    @Nullable
    @Override
    public String getNamespace() {
        return namespace;
    }

    @Nullable
    @Override
    public String getHost() {
        return host;
    }

    @NotNull
    @Override
    public CIMClassName withNamespace(@Nullable String namespace) {
        return new CIMClassName(className, namespace, host);
    }

    @NotNull
    @Override
    public CIMClassName withHost(@Nullable String host) {
        return new CIMClassName(className, namespace, host);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMClassName)) {
            return false;
        }
        CIMClassName that = (CIMClassName) o;
        return Names.same(className, that.className) && Names.same(namespace, that.namespace)
                && Names.same(host, that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Names.fold(className), namespace == null ? null : Names.fold(namespace));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (host != null) {
            sb.append("//").append(host);
        }
        if (namespace != null) {
            sb.append('/').append(namespace).append(':');
        }
        return sb.append(className).toString();
    }
}
