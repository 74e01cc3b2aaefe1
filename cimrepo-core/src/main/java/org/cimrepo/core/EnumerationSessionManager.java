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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.EnumerationContext;
import org.cimrepo.api.EnumerationResult;
import org.cimrepo.commons.Names;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open, Pull and Close of enumeration sessions.
 * <p>
 * An Open operation hands over its complete result. The first batch is
 * returned immediately; if items remain, they are kept in a session under a
 * new random identifier until pulled to the end or closed. A session only
 * accepts pulls of the kind it was opened for and only against the
 * namespace it was opened in.
 */
public class EnumerationSessionManager {

    private static final Logger LOG = LoggerFactory.getLogger(EnumerationSessionManager.class);

    /**
     * The only filter query language that is recognized.
     */
    public static final String FQL = "DMTF:FQL";

    /**
     * The kind of items held by a session, named after the Pull operation
     * that continues it.
     */
    public enum PullType {

        INSTANCES_WITH_PATH("PullInstancesWithPath"),
        INSTANCE_PATHS("PullInstancePaths"),
        INSTANCES("PullInstances");

        private final String operationName;

        PullType(String operationName) {
            this.operationName = operationName;
        }

        @NotNull
        public String getOperationName() {
            return operationName;
        }
    }

    private final Repository repository;

    private final ServerSettings settings;

    private final Map<String, Session> sessions = new HashMap<>();

    public EnumerationSessionManager(@NotNull Repository repository, @NotNull ServerSettings settings) {
        this.repository = checkNotNull(repository);
        this.settings = checkNotNull(settings);
    }

    /**
     * @throws CIMException {@code NOT_SUPPORTED} if pull operations are
     *         disabled
     */
    public void checkEnabled() throws CIMException {
        if (settings.isPullOperationsDisabled()) {
            throw new CIMException(CIMStatus.NOT_SUPPORTED, "Pull operations are disabled");
        }
    }

    /**
     * Checks the parameters common to all Open operations, before the
     * result is computed.
     *
     * @throws CIMException {@code NOT_SUPPORTED} if pull operations are
     *         disabled; {@code INVALID_PARAMETER} for a filter query without
     *         language, a timeout out of range or a negative object count;
     *         {@code QUERY_LANGUAGE_NOT_SUPPORTED} for a language other than
     *         {@link #FQL}; {@code FILTERED_ENUMERATION_NOT_SUPPORTED} for a
     *         filter in {@link #FQL}
     */
    public void checkOpen(@Nullable String filterQueryLanguage, @Nullable String filterQuery,
                          @Nullable Integer operationTimeout, @Nullable Integer maxObjectCount)
            throws CIMException {
        checkEnabled();
        if (filterQuery != null && filterQueryLanguage == null) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "FilterQuery requires a FilterQueryLanguage");
        }
        if (filterQueryLanguage != null) {
            if (!FQL.equals(filterQueryLanguage)) {
                throw new CIMException(CIMStatus.QUERY_LANGUAGE_NOT_SUPPORTED,
                        "Filter query language " + filterQueryLanguage + " is not supported");
            }
            throw new CIMException(CIMStatus.FILTERED_ENUMERATION_NOT_SUPPORTED,
                    "Filtered enumerations are not supported");
        }
        if (operationTimeout != null
                && (operationTimeout < 0 || operationTimeout > settings.getOpenMaxTimeout())) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER, "OperationTimeout " + operationTimeout
                    + " must be between 0 and " + settings.getOpenMaxTimeout());
        }
        checkMaxObjectCount(maxObjectCount);
    }

    /**
     * Returns the first batch of {@code items}, keeping the remainder in a
     * new session if there is one.
     */
    @NotNull
    public synchronized <T> EnumerationResult<T> open(@NotNull String namespace, @NotNull PullType type,
                                                      @NotNull List<T> items, @Nullable Integer maxObjectCount)
            throws CIMException {
        checkEnabled();
        int max = checkMaxObjectCount(maxObjectCount);
        String ns = repository.validateNamespace(namespace);
        if (items.size() <= max) {
            LOG.debug("Open {} in {}: {} items, complete", type, ns, items.size());
            return new EnumerationResult<>(items, true, null);
        }
        Session session = new Session(UUID.randomUUID().toString(), ns, type, items);
        sessions.put(session.id, session);
        List<T> batch = session.next(max);
        LOG.debug("Open {} in {}: {} of {} items, context {}", type, ns, batch.size(), items.size(), session.id);
        return new EnumerationResult<>(batch, false, new EnumerationContext(session.id, ns));
    }

    @NotNull
    public EnumerationResult<CIMInstance> pullInstances(@NotNull EnumerationContext context, boolean withPath,
                                                        @Nullable Integer maxObjectCount) throws CIMException {
        return pull(context, withPath ? PullType.INSTANCES_WITH_PATH : PullType.INSTANCES, maxObjectCount);
    }

    @NotNull
    public EnumerationResult<CIMInstanceName> pullInstancePaths(@NotNull EnumerationContext context,
                                                                @Nullable Integer maxObjectCount)
            throws CIMException {
        return pull(context, PullType.INSTANCE_PATHS, maxObjectCount);
    }

    /**
     * Discards a session.
     *
     * @throws CIMException {@code INVALID_ENUMERATION_CONTEXT} if it does
     *         not exist, also when it has been pulled to the end
     */
    public synchronized void close(@NotNull EnumerationContext context) throws CIMException {
        checkEnabled();
        Session session = lookup(context);
        sessions.remove(session.id);
        LOG.debug("Closed enumeration context {} with {} items left", session.id, session.remaining());
    }

    /**
     * @return the number of open sessions
     */
    public synchronized int size() {
        return sessions.size();
    }

    //-----------------------------------------------------------< private >--

    private synchronized <T> EnumerationResult<T> pull(EnumerationContext context, PullType type,
                                                       Integer maxObjectCount) throws CIMException {
        checkEnabled();
        int max = checkMaxObjectCount(maxObjectCount);
        Session session = lookup(context);
        repository.validateNamespace(session.namespace);
        if (session.type != type) {
            throw new CIMException(CIMStatus.INVALID_ENUMERATION_CONTEXT, "Enumeration context " + session.id
                    + " must be continued with " + session.type.getOperationName() + ", not "
                    + type.getOperationName());
        }
        List<T> batch = session.next(max);
        if (session.remaining() == 0) {
            sessions.remove(session.id);
            LOG.debug("{} {}: {} items, complete", type.getOperationName(), session.id, batch.size());
            return new EnumerationResult<>(batch, true, null);
        }
        LOG.debug("{} {}: {} items, {} left", type.getOperationName(), session.id, batch.size(),
                session.remaining());
        return new EnumerationResult<>(batch, false, context);
    }

    private Session lookup(EnumerationContext context) throws CIMException {
        Session session = sessions.get(context.getId());
        if (session == null) {
            throw new CIMException(CIMStatus.INVALID_ENUMERATION_CONTEXT,
                    "Enumeration context " + context.getId() + " is not open");
        }
        if (!Names.same(session.namespace, context.getNamespace())) {
            throw new CIMException(CIMStatus.INVALID_ENUMERATION_CONTEXT, "Enumeration context "
                    + context.getId() + " was not opened in namespace " + context.getNamespace());
        }
        return session;
    }

    private int checkMaxObjectCount(Integer maxObjectCount) throws CIMException {
        if (maxObjectCount == null) {
            return settings.getDefaultMaxObjectCount();
        }
        if (maxObjectCount < 0) {
            throw new CIMException(CIMStatus.INVALID_PARAMETER,
                    "MaxObjectCount must not be negative: " + maxObjectCount);
        }
        return maxObjectCount;
    }

    private static final class Session {

        private final String id;
        private final String namespace;
        private final PullType type;
        private final List<?> items;
        private int position;

        Session(String id, String namespace, PullType type, List<?> items) {
            this.id = id;
            this.namespace = namespace;
            this.type = type;
            this.items = new ArrayList<>(items);
        }

        @SuppressWarnings("unchecked")
        <T> List<T> next(int max) {
            int end = Math.min(items.size(), position + max);
            List<T> batch = new ArrayList<>((List<T>) items.subList(position, end));
            position = end;
            return batch;
        }

        int remaining() {
            return items.size() - position;
        }
    }
}
