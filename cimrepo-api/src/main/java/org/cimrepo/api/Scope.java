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

import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * The kinds of schema elements a qualifier declaration may apply to.
 */
public enum Scope {

    CLASS,
    ASSOCIATION,
    INDICATION,
    PROPERTY,
    REFERENCE,
    METHOD,
    PARAMETER,
    ANY;

    @NotNull
    public static Scope fromName(@NotNull String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
