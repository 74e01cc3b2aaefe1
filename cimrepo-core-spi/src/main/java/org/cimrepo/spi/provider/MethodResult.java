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
package org.cimrepo.spi.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import org.cimrepo.api.CIMParameter;
import org.cimrepo.commons.NocaseMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Return value and output parameters of a method invocation.
 */
public final class MethodResult {

    private final Object returnValue;

    private final Map<String, CIMParameter> outParams;

    public MethodResult(@Nullable Object returnValue, @NotNull Collection<CIMParameter> outParams) {
        this.returnValue = returnValue;
        NocaseMap<CIMParameter> params = new NocaseMap<>();
        for (CIMParameter p : outParams) {
            params.put(p.getName(), p);
        }
        this.outParams = Collections.unmodifiableMap(params);
    }

    public MethodResult(@Nullable Object returnValue) {
        this(returnValue, Collections.emptyList());
    }

    @Nullable
    public Object getReturnValue() {
        return returnValue;
    }

    @NotNull
    public Map<String, CIMParameter> getOutParams() {
        return outParams;
    }

    @Override
    public String toString() {
        return "MethodResult{" + returnValue + ", " + outParams.values() + "}";
    }
}
