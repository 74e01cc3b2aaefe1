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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;

import org.cimrepo.commons.Names;
import org.jetbrains.annotations.NotNull;

/**
 * Handle of an open enumeration: an opaque identifier plus the namespace
 * the enumeration was opened against. Both must match for a pull or close
 * to be accepted.
 */
public final class EnumerationContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;

    private final String namespace;

    public EnumerationContext(@NotNull String id, @NotNull String namespace) {
        this.id = checkNotNull(id);
        this.namespace = Names.normalizeNamespace(checkNotNull(namespace));
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getNamespace() {
        return namespace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnumerationContext)) {
            return false;
        }
        EnumerationContext that = (EnumerationContext) o;
        return id.equals(that.id) && Names.same(namespace, that.namespace);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + Names.fold(namespace).hashCode();
    }

    @Override
    public String toString() {
        return "(" + id + ", " + namespace + ")";
    }
}
