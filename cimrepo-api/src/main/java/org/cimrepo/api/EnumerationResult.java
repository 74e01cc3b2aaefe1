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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One batch of an Open or Pull operation.
 *
 * @param <T> {@link CIMInstance} or {@link CIMInstanceName}
 */
public final class EnumerationResult<T> {

    private final List<T> items;

    private final boolean endOfSequence;

    private final EnumerationContext context;

    /**
     * @param context the context to pull the remainder with; must be
     *                {@code null} exactly when {@code endOfSequence}
     */
    public EnumerationResult(@NotNull List<T> items, boolean endOfSequence, @Nullable EnumerationContext context) {
        checkArgument(endOfSequence == (context == null),
                "A context is required unless the sequence has ended");
        this.items = ImmutableList.copyOf(items);
        this.endOfSequence = endOfSequence;
        this.context = context;
    }

    @NotNull
    public List<T> getItems() {
        return items;
    }

    public boolean isEndOfSequence() {
        return endOfSequence;
    }

    @Nullable
    public EnumerationContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "EnumerationResult{" + items.size() + " items, eos=" + endOfSequence + ", context=" + context + "}";
    }
}
