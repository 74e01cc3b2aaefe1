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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters shared by the Open operations.
 */
public final class OpenOptions {

    private static final OpenOptions DEFAULT = builder().build();

    private final String filterQueryLanguage;
    private final String filterQuery;
    private final Integer operationTimeout;
    private final boolean continueOnError;
    private final Integer maxObjectCount;

    private OpenOptions(Builder b) {
        this.filterQueryLanguage = b.filterQueryLanguage;
        this.filterQuery = b.filterQuery;
        this.operationTimeout = b.operationTimeout;
        this.continueOnError = b.continueOnError;
        this.maxObjectCount = b.maxObjectCount;
    }

    /**
     * @return options without filter and timeout, with the default object
     *         count
     */
    @NotNull
    public static OpenOptions defaults() {
        return DEFAULT;
    }

    @NotNull
    public static OpenOptions maxObjectCount(@Nullable Integer maxObjectCount) {
        return builder().maxObjectCount(maxObjectCount).build();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public String getFilterQueryLanguage() {
        return filterQueryLanguage;
    }

    @Nullable
    public String getFilterQuery() {
        return filterQuery;
    }

    @Nullable
    public Integer getOperationTimeout() {
        return operationTimeout;
    }

    /**
     * Accepted for compatibility and ignored: the repository operations
     * either complete or fail as a whole, so there is no later item to
     * continue with.
     */
    public boolean isContinueOnError() {
        return continueOnError;
    }

    /**
     * @return the size of the first batch, or {@code null} for the
     *         configured default
     */
    @Nullable
    public Integer getMaxObjectCount() {
        return maxObjectCount;
    }

    @Override
    public String toString() {
        return "OpenOptions{filterQueryLanguage=" + filterQueryLanguage + ", filterQuery=" + filterQuery
                + ", operationTimeout=" + operationTimeout + ", continueOnError=" + continueOnError
                + ", maxObjectCount=" + maxObjectCount + "}";
    }

    public static final class Builder {

        private String filterQueryLanguage;
        private String filterQuery;
        private Integer operationTimeout;
        private boolean continueOnError;
        private Integer maxObjectCount;

        private Builder() {
        }

        public Builder filterQuery(@Nullable String filterQueryLanguage, @Nullable String filterQuery) {
            this.filterQueryLanguage = filterQueryLanguage;
            this.filterQuery = filterQuery;
            return this;
        }

        public Builder operationTimeout(@Nullable Integer operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder maxObjectCount(@Nullable Integer maxObjectCount) {
            this.maxObjectCount = maxObjectCount;
            return this;
        }

        public OpenOptions build() {
            return new OpenOptions(this);
        }
    }
}
