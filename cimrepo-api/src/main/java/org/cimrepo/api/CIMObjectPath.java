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

import java.io.Serializable;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Path of a class or an instance; the target of association traversal and
 * method invocation.
 */
public interface CIMObjectPath extends Serializable {

    @NotNull
    String getClassName();

    /**
     * @return the namespace, or {@code null} if the path is relative to the
     *         namespace of the request
     */
    @Nullable
    String getNamespace();

    @Nullable
    String getHost();

    @NotNull
    CIMObjectPath withNamespace(@Nullable String namespace);

    @NotNull
    CIMObjectPath withHost(@Nullable String host);
}
