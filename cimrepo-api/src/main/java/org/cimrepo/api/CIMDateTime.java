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
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A CIM datetime value in its DMTF string form: either a timestamp
 * ({@code yyyymmddhhmmss.mmmmmmsutc}) or an interval
 * ({@code ddddddddhhmmss.mmmmmm:000}).
 */
public final class CIMDateTime implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern TIMESTAMP = Pattern.compile("[0-9*]{14}\\.[0-9*]{6}[+-][0-9]{3}");

    private static final Pattern INTERVAL = Pattern.compile("[0-9*]{14}\\.[0-9*]{6}:000");

    private final String value;

    private CIMDateTime(String value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is neither a
     *         timestamp nor an interval
     */
    @NotNull
    public static CIMDateTime parse(@NotNull String value) {
        checkNotNull(value);
        checkArgument(TIMESTAMP.matcher(value).matches() || INTERVAL.matcher(value).matches(),
                "Invalid CIM datetime value: %s", value);
        return new CIMDateTime(value);
    }

    public boolean isInterval() {
        return value.endsWith(":000");
    }

    @Override
    public boolean equals(Object o) {
        return o == this || o instanceof CIMDateTime && value.equals(((CIMDateTime) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
