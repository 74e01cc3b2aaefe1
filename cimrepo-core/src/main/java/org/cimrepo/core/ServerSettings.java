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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.cimrepo.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of a mock WBEM server. {@link #fromSystemProperties()} reads
 * them from {@code cimrepo.*} system properties; {@link #builder()} sets
 * them programmatically, starting from the defaults.
 */
public final class ServerSettings {

    private static final Logger LOG = LoggerFactory.getLogger(ServerSettings.class);

    public static final String DEFAULT_NAMESPACE = "root/cimv2";
    public static final int DEFAULT_MAX_OBJECT_COUNT = 100;
    public static final int OPEN_MAX_TIMEOUT = 40;
    public static final String OBJECT_MANAGER_NAME = "FakeObjectManager";
    public static final String SYSTEM_NAME = "MockSystem_WBEMServerTest";
    public static final String SYSTEM_CREATION_CLASS_NAME = "CIM_ComputerSystem";
    public static final String OBJECT_MANAGER_CREATION_CLASS_NAME = "CIM_ObjectManager";

    private final String defaultNamespace;
    private final int defaultMaxObjectCount;
    private final int openMaxTimeout;
    private final boolean pullOperationsDisabled;
    private final boolean instanceLocalOnly;
    private final String objectManagerName;
    private final String systemName;
    private final String systemCreationClassName;
    private final String objectManagerCreationClassName;

    private ServerSettings(Builder b) {
        this.defaultNamespace = b.defaultNamespace;
        this.defaultMaxObjectCount = b.defaultMaxObjectCount;
        this.openMaxTimeout = b.openMaxTimeout;
        this.pullOperationsDisabled = b.pullOperationsDisabled;
        this.instanceLocalOnly = b.instanceLocalOnly;
        this.objectManagerName = b.objectManagerName;
        this.systemName = b.systemName;
        this.systemCreationClassName = b.systemCreationClassName;
        this.objectManagerCreationClassName = b.objectManagerCreationClassName;
    }

    @NotNull
    public static ServerSettings defaults() {
        return builder().build();
    }

    @NotNull
    public static ServerSettings fromSystemProperties() {
        return builder()
                .defaultNamespace(SystemPropertySupplier.create("cimrepo.defaultNamespace", DEFAULT_NAMESPACE)
                        .loggingTo(LOG).validateWith(ns -> !ns.isEmpty()).get())
                .defaultMaxObjectCount(SystemPropertySupplier.create("cimrepo.maxObjectCount", DEFAULT_MAX_OBJECT_COUNT)
                        .loggingTo(LOG).validateWith(n -> n >= 0).get())
                .openMaxTimeout(SystemPropertySupplier.create("cimrepo.openMaxTimeout", OPEN_MAX_TIMEOUT)
                        .loggingTo(LOG).validateWith(n -> n >= 0).get())
                .pullOperationsDisabled(SystemPropertySupplier.create("cimrepo.disablePullOperations", false)
                        .loggingTo(LOG).get())
                .instanceLocalOnly(SystemPropertySupplier.create("cimrepo.instanceLocalOnly", false)
                        .loggingTo(LOG).get())
                .objectManagerName(SystemPropertySupplier.create("cimrepo.objectManagerName", OBJECT_MANAGER_NAME)
                        .loggingTo(LOG).get())
                .systemName(SystemPropertySupplier.create("cimrepo.systemName", SYSTEM_NAME)
                        .loggingTo(LOG).get())
                .systemCreationClassName(SystemPropertySupplier.create(
                        "cimrepo.systemCreationClassName", SYSTEM_CREATION_CLASS_NAME).loggingTo(LOG).get())
                .objectManagerCreationClassName(SystemPropertySupplier.create(
                        "cimrepo.objectManagerCreationClassName", OBJECT_MANAGER_CREATION_CLASS_NAME)
                        .loggingTo(LOG).get())
                .build();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Namespace used by operations invoked without one.
     */
    @NotNull
    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    /**
     * Number of objects an Open or Pull returns when MaxObjectCount is not
     * given.
     */
    public int getDefaultMaxObjectCount() {
        return defaultMaxObjectCount;
    }

    /**
     * Largest OperationTimeout, in seconds, accepted by Open operations.
     */
    public int getOpenMaxTimeout() {
        return openMaxTimeout;
    }

    public boolean isPullOperationsDisabled() {
        return pullOperationsDisabled;
    }

    /**
     * Whether LocalOnly is honored for instance retrieval. DSP0200 versions
     * disagree on its meaning, so it is ignored unless enabled.
     */
    public boolean isInstanceLocalOnly() {
        return instanceLocalOnly;
    }

    @NotNull
    public String getObjectManagerName() {
        return objectManagerName;
    }

    @NotNull
    public String getSystemName() {
        return systemName;
    }

    @NotNull
    public String getSystemCreationClassName() {
        return systemCreationClassName;
    }

    @NotNull
    public String getObjectManagerCreationClassName() {
        return objectManagerCreationClassName;
    }

    @Override
    public String toString() {
        return "ServerSettings{defaultNamespace=" + defaultNamespace
                + ", defaultMaxObjectCount=" + defaultMaxObjectCount
                + ", openMaxTimeout=" + openMaxTimeout
                + ", pullOperationsDisabled=" + pullOperationsDisabled
                + ", instanceLocalOnly=" + instanceLocalOnly + "}";
    }

    public static final class Builder {

        private String defaultNamespace = DEFAULT_NAMESPACE;
        private int defaultMaxObjectCount = DEFAULT_MAX_OBJECT_COUNT;
        private int openMaxTimeout = OPEN_MAX_TIMEOUT;
        private boolean pullOperationsDisabled;
        private boolean instanceLocalOnly;
        private String objectManagerName = OBJECT_MANAGER_NAME;
        private String systemName = SYSTEM_NAME;
        private String systemCreationClassName = SYSTEM_CREATION_CLASS_NAME;
        private String objectManagerCreationClassName = OBJECT_MANAGER_CREATION_CLASS_NAME;

        private Builder() {
        }

        public Builder defaultNamespace(@NotNull String defaultNamespace) {
            this.defaultNamespace = checkNotNull(defaultNamespace);
            return this;
        }

        public Builder defaultMaxObjectCount(int defaultMaxObjectCount) {
            checkArgument(defaultMaxObjectCount >= 0, "defaultMaxObjectCount must not be negative");
            this.defaultMaxObjectCount = defaultMaxObjectCount;
            return this;
        }

        public Builder openMaxTimeout(int openMaxTimeout) {
            checkArgument(openMaxTimeout >= 0, "openMaxTimeout must not be negative");
            this.openMaxTimeout = openMaxTimeout;
            return this;
        }

        public Builder pullOperationsDisabled(boolean pullOperationsDisabled) {
            this.pullOperationsDisabled = pullOperationsDisabled;
            return this;
        }

        public Builder instanceLocalOnly(boolean instanceLocalOnly) {
            this.instanceLocalOnly = instanceLocalOnly;
            return this;
        }

        public Builder objectManagerName(@NotNull String objectManagerName) {
            this.objectManagerName = checkNotNull(objectManagerName);
            return this;
        }

        public Builder systemName(@NotNull String systemName) {
            this.systemName = checkNotNull(systemName);
            return this;
        }

        public Builder systemCreationClassName(@NotNull String systemCreationClassName) {
            this.systemCreationClassName = checkNotNull(systemCreationClassName);
            return this;
        }

        public Builder objectManagerCreationClassName(@NotNull String objectManagerCreationClassName) {
            this.objectManagerCreationClassName = checkNotNull(objectManagerCreationClassName);
            return this;
        }

        public ServerSettings build() {
            return new ServerSettings(this);
        }
    }
}
