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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import org.cimrepo.api.CIMClass;
import org.cimrepo.api.CIMClassName;
import org.cimrepo.api.CIMException;
import org.cimrepo.api.CIMInstance;
import org.cimrepo.api.CIMInstanceName;
import org.cimrepo.api.CIMObjectPath;
import org.cimrepo.api.CIMParameter;
import org.cimrepo.api.CIMQualifierDeclaration;
import org.cimrepo.api.CIMStatus;
import org.cimrepo.api.EnumerationContext;
import org.cimrepo.api.EnumerationResult;
import org.cimrepo.commons.Names;
import org.cimrepo.core.AssociationEngine;
import org.cimrepo.core.ClassResolver;
import org.cimrepo.core.ClassValidator;
import org.cimrepo.core.EnumerationSessionManager;
import org.cimrepo.core.EnumerationSessionManager.PullType;
import org.cimrepo.core.InstanceEngine;
import org.cimrepo.core.ServerSettings;
import org.cimrepo.core.StandardQualifiers;
import org.cimrepo.plugins.memory.InMemoryRepository;
import org.cimrepo.plugins.provider.DefaultInstanceWriteProvider;
import org.cimrepo.plugins.provider.NamespaceProvider;
import org.cimrepo.plugins.provider.ProviderDispatcher;
import org.cimrepo.plugins.provider.ProviderRegistry;
import org.cimrepo.spi.provider.InstanceWriteProvider;
import org.cimrepo.spi.provider.MethodResult;
import org.cimrepo.spi.provider.Provider;
import org.cimrepo.spi.provider.ProviderContext;
import org.cimrepo.spi.store.ObjectStore;
import org.cimrepo.spi.store.Repository;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory WBEM server: the operation surface a protocol layer decodes
 * requests into, on top of an {@link InMemoryRepository}.
 * <p>
 * All operations are serialized on the server instance. A {@code null}
 * namespace stands for the configured default namespace, which exists from
 * the start.
 * <pre>
 * MockWBEMServer server = new MockWBEMServer();
 * server.addStandardQualifiers(null);
 * server.createClass(null, fooClass);
 * CIMInstanceName path = server.createInstance(null, foo);
 * </pre>
 */
public class MockWBEMServer {

    private static final Logger LOG = LoggerFactory.getLogger(MockWBEMServer.class);

    /**
     * Names recognized as interop namespace, in order of preference.
     */
    public static final List<String> INTEROP_NAMESPACE_NAMES =
            ImmutableList.of("interop", "root/interop", "root/PG_Interop");

    private final ServerSettings settings;

    private final boolean lite;

    private final InMemoryRepository repository;

    private final ProviderRegistry registry;

    private final ClassResolver resolver;

    private final ClassValidator validator;

    private final InstanceEngine instances;

    private final InstanceWriteProvider defaultProvider;

    private final ProviderDispatcher dispatcher;

    private final AssociationEngine associations;

    private final EnumerationSessionManager sessions;

    private final ProviderContext context = new Context();

    public MockWBEMServer() {
        this(ServerSettings.defaults());
    }

    public MockWBEMServer(@NotNull ServerSettings settings) {
        this(settings, false);
    }

    /**
     * @param lite if {@code true}, instances are stored without checking
     *             them against classes, and instance enumerations do not
     *             include subclasses
     */
    public MockWBEMServer(@NotNull ServerSettings settings, boolean lite) {
        this(settings, lite, new InMemoryRepository(), new ProviderRegistry());
        try {
            repository.addNamespace(settings.getDefaultNamespace());
        } catch (CIMException e) {
            throw new IllegalStateException("Cannot create default namespace " + settings.getDefaultNamespace(), e);
        }
    }

    private MockWBEMServer(ServerSettings settings, boolean lite, InMemoryRepository repository,
                           ProviderRegistry registry) {
        this.settings = checkNotNull(settings);
        this.lite = lite;
        this.repository = repository;
        this.registry = registry;
        this.resolver = new ClassResolver(repository);
        this.validator = new ClassValidator(repository, resolver);
        this.instances = new InstanceEngine(repository, resolver, settings, lite);
        this.defaultProvider = new DefaultInstanceWriteProvider(repository, resolver, instances);
        this.dispatcher = new ProviderDispatcher(repository, resolver, instances, registry, defaultProvider);
        this.associations = new AssociationEngine(repository, resolver, instances, registry);
        this.sessions = new EnumerationSessionManager(repository, settings);
    }

    @NotNull
    public ServerSettings getSettings() {
        return settings;
    }

    public boolean isLite() {
        return lite;
    }

    /**
     * @return direct access to the stores, e.g. for bulk loading
     */
    @NotNull
    public Repository getRepository() {
        return repository;
    }

    @NotNull
    public ProviderRegistry getProviderRegistry() {
        return registry;
    }

    //-----------------------------------------------------< namespaces >--

    @NotNull
    public synchronized Set<String> getNamespaces() {
        return repository.getNamespaces();
    }

    public synchronized boolean hasNamespace(@NotNull String namespace) {
        return repository.hasNamespace(namespace);
    }

    /**
     * Adds a namespace and, if a namespace provider is installed, its
     * {@code CIM_Namespace} instance.
     */
    public synchronized void addNamespace(@NotNull String namespace) throws CIMException {
        repository.addNamespace(namespace);
        NamespaceProvider provider = namespaceProvider();
        if (provider != null) {
            provider.namespaceAdded(Names.normalizeNamespace(namespace));
        }
    }

    /**
     * Removes an empty namespace and, if a namespace provider is installed,
     * its {@code CIM_Namespace} instance.
     */
    public synchronized void removeNamespace(@NotNull String namespace) throws CIMException {
        context.removeNamespace(namespace);
        NamespaceProvider provider = namespaceProvider();
        if (provider != null) {
            provider.namespaceRemoved(Names.normalizeNamespace(namespace));
        }
    }

    /**
     * @return the first existing namespace with an interop name, or
     *         {@code null}
     */
    @Nullable
    public synchronized String getInteropNamespace() {
        return context.getInteropNamespace();
    }

    public static boolean isInteropNamespaceName(@Nullable String namespace) {
        if (namespace == null) {
            return false;
        }
        String ns = Names.normalizeNamespace(namespace);
        for (String name : INTEROP_NAMESPACE_NAMES) {
            if (Names.same(name, ns)) {
                return true;
            }
        }
        return false;
    }

    //----------------------------------------------------------< classes >--

    /**
     * @throws CIMException {@code INVALID_CLASS} if the class does not exist
     */
    @NotNull
    public synchronized CIMClass getClass(@Nullable String namespace, @NotNull String className,
                                          boolean localOnly, boolean includeQualifiers, boolean includeClassOrigin,
                                          @Nullable Collection<String> propertyList) throws CIMException {
        String ns = ns(namespace);
        CIMClass resolved = resolver.resolve(ns, className);
        return ClassResolver.filter(resolved, localOnly, includeQualifiers, includeClassOrigin, propertyList);
    }

    /**
     * Returns the subclasses of {@code className} or, if it is
     * {@code null}, the root classes; all descendants if
     * {@code deepInheritance}.
     */
    @NotNull
    public synchronized List<CIMClass> enumerateClasses(@Nullable String namespace, @Nullable String className,
                                                        boolean deepInheritance, boolean localOnly,
                                                        boolean includeQualifiers, boolean includeClassOrigin)
            throws CIMException {
        String ns = ns(namespace);
        List<CIMClass> result = new ArrayList<>();
        for (String name : resolver.getSubclassNames(ns, className, deepInheritance)) {
            result.add(ClassResolver.filter(resolver.resolve(ns, name), localOnly, includeQualifiers,
                    includeClassOrigin, null));
        }
        return result;
    }

    @NotNull
    public synchronized List<String> enumerateClassNames(@Nullable String namespace, @Nullable String className,
                                                         boolean deepInheritance) throws CIMException {
        return resolver.getSubclassNames(ns(namespace), className, deepInheritance);
    }

    /**
     * @throws CIMException {@code ALREADY_EXISTS}, or any failure of the
     *         class validation
     */
    public synchronized void createClass(@Nullable String namespace, @NotNull CIMClass newClass)
            throws CIMException {
        String ns = repository.validateNamespace(ns(namespace));
        ObjectStore<String, CIMClass> classes = repository.getClassStore(ns);
        if (classes.exists(newClass.getClassName())) {
            throw new CIMException(CIMStatus.ALREADY_EXISTS,
                    "Class " + newClass.getClassName() + " already exists in namespace " + ns);
        }
        validator.validate(ns, newClass);
        classes.create(newClass.getClassName(), newClass.withPath(null));
        LOG.debug("Created class {} in {}", newClass.getClassName(), ns);
    }

    /**
     * Replaces a class that has neither subclasses nor instances.
     */
    public synchronized void modifyClass(@Nullable String namespace, @NotNull CIMClass modifiedClass)
            throws CIMException {
        String ns = repository.validateNamespace(ns(namespace));
        String className = modifiedClass.getClassName();
        checkClassUnused(ns, className);
        validator.validate(ns, modifiedClass);
        repository.getClassStore(ns).update(className, modifiedClass.withPath(null));
        LOG.debug("Modified class {} in {}", className, ns);
    }

    /**
     * Deletes a class that has neither subclasses nor instances.
     */
    public synchronized void deleteClass(@Nullable String namespace, @NotNull String className)
            throws CIMException {
        String ns = repository.validateNamespace(ns(namespace));
        checkClassUnused(ns, className);
        repository.getClassStore(ns).delete(className);
        LOG.debug("Deleted class {} in {}", className, ns);
    }

    //-------------------------------------------------------< qualifiers >--

    @NotNull
    public synchronized CIMQualifierDeclaration getQualifier(@Nullable String namespace, @NotNull String name)
            throws CIMException {
        String ns = ns(namespace);
        CIMQualifierDeclaration declaration = repository.getQualifierStore(ns).get(name);
        if (declaration == null) {
            throw new CIMException(CIMStatus.NOT_FOUND,
                    "Qualifier declaration " + name + " not found in namespace " + ns);
        }
        return declaration;
    }

    @NotNull
    public synchronized List<CIMQualifierDeclaration> enumerateQualifiers(@Nullable String namespace)
            throws CIMException {
        return new ArrayList<>(repository.getQualifierStore(ns(namespace)).values());
    }

    /**
     * Creates or replaces a qualifier declaration.
     */
    public synchronized void setQualifier(@Nullable String namespace, @NotNull CIMQualifierDeclaration declaration)
            throws CIMException {
        ObjectStore<String, CIMQualifierDeclaration> store = repository.getQualifierStore(ns(namespace));
        if (store.exists(declaration.getName())) {
            store.update(declaration.getName(), declaration);
        } else {
            store.create(declaration.getName(), declaration);
        }
    }

    public synchronized void deleteQualifier(@Nullable String namespace, @NotNull String name)
            throws CIMException {
        String ns = ns(namespace);
        ObjectStore<String, CIMQualifierDeclaration> store = repository.getQualifierStore(ns);
        if (!store.exists(name)) {
            throw new CIMException(CIMStatus.NOT_FOUND,
                    "Qualifier declaration " + name + " not found in namespace " + ns);
        }
        store.delete(name);
    }

    /**
     * Declares the DMTF standard qualifiers that are not yet declared in
     * the namespace.
     */
    public synchronized void addStandardQualifiers(@Nullable String namespace) throws CIMException {
        ObjectStore<String, CIMQualifierDeclaration> store = repository.getQualifierStore(ns(namespace));
        for (CIMQualifierDeclaration declaration : StandardQualifiers.DECLARATIONS) {
            if (!store.exists(declaration.getName())) {
                store.create(declaration.getName(), declaration);
            }
        }
    }

    //--------------------------------------------------------< instances >--

    @NotNull
    public synchronized CIMInstance getInstance(@Nullable String namespace, @NotNull CIMInstanceName instanceName,
                                                boolean localOnly, boolean includeQualifiers,
                                                boolean includeClassOrigin, @Nullable Collection<String> propertyList)
            throws CIMException {
        return instances.getInstance(ns(namespace), instanceName, localOnly, includeQualifiers,
                includeClassOrigin, propertyList);
    }

    @NotNull
    public synchronized CIMInstance getInstance(@Nullable String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        return getInstance(namespace, instanceName, false, false, false, null);
    }

    @NotNull
    public synchronized List<CIMInstance> enumerateInstances(@Nullable String namespace, @NotNull String className,
                                                             boolean localOnly, boolean deepInheritance,
                                                             boolean includeQualifiers, boolean includeClassOrigin,
                                                             @Nullable Collection<String> propertyList)
            throws CIMException {
        return instances.enumerateInstances(repository.validateNamespace(ns(namespace)), className, localOnly,
                deepInheritance, includeQualifiers, includeClassOrigin, propertyList);
    }

    @NotNull
    public synchronized List<CIMInstance> enumerateInstances(@Nullable String namespace, @NotNull String className)
            throws CIMException {
        return enumerateInstances(namespace, className, false, true, false, false, null);
    }

    @NotNull
    public synchronized List<CIMInstanceName> enumerateInstanceNames(@Nullable String namespace,
                                                                     @NotNull String className) throws CIMException {
        return instances.enumerateInstanceNames(repository.validateNamespace(ns(namespace)), className);
    }

    /**
     * @return the path of the new instance, with namespace
     */
    @NotNull
    public synchronized CIMInstanceName createInstance(@Nullable String namespace, @NotNull CIMInstance newInstance)
            throws CIMException {
        return dispatcher.createInstance(ns(namespace), newInstance);
    }

    /**
     * @param propertyList the properties to modify, or {@code null} for all
     *                     properties of {@code modifiedInstance}
     */
    public synchronized void modifyInstance(@Nullable String namespace, @NotNull CIMInstance modifiedInstance,
                                            @Nullable List<String> propertyList) throws CIMException {
        dispatcher.modifyInstance(ns(namespace), modifiedInstance, propertyList);
    }

    public synchronized void deleteInstance(@Nullable String namespace, @NotNull CIMInstanceName instanceName)
            throws CIMException {
        dispatcher.deleteInstance(ns(namespace), instanceName);
    }

    /**
     * @throws CIMException {@code NOT_SUPPORTED}: no query language is
     *         implemented
     */
    @NotNull
    public synchronized List<CIMInstance> execQuery(@Nullable String namespace, @NotNull String queryLanguage,
                                                    @NotNull String query) throws CIMException {
        repository.validateNamespace(ns(namespace));
        throw new CIMException(CIMStatus.NOT_SUPPORTED, "ExecQuery is not supported: " + queryLanguage);
    }

    //-----------------------------------------------------< associations >--

    @NotNull
    public synchronized List<CIMInstanceName> referenceNames(@Nullable String namespace,
                                                             @NotNull CIMInstanceName objectName,
                                                             @Nullable String resultClass, @Nullable String role)
            throws CIMException {
        return associations.referenceNames(ns(namespace), objectName, resultClass, role);
    }

    @NotNull
    public synchronized List<CIMClassName> referenceNames(@Nullable String namespace, @NotNull CIMClassName objectName,
                                                          @Nullable String resultClass, @Nullable String role)
            throws CIMException {
        return associations.referenceClassNames(ns(namespace), objectName, resultClass, role);
    }

    @NotNull
    public synchronized List<CIMInstance> references(@Nullable String namespace, @NotNull CIMInstanceName objectName,
                                                     @Nullable String resultClass, @Nullable String role,
                                                     boolean includeQualifiers, boolean includeClassOrigin,
                                                     @Nullable Collection<String> propertyList) throws CIMException {
        return associations.references(ns(namespace), objectName, resultClass, role, includeQualifiers,
                includeClassOrigin, propertyList);
    }

    @NotNull
    public synchronized List<CIMClass> references(@Nullable String namespace, @NotNull CIMClassName objectName,
                                                  @Nullable String resultClass, @Nullable String role,
                                                  boolean includeQualifiers, boolean includeClassOrigin,
                                                  @Nullable Collection<String> propertyList) throws CIMException {
        return associations.referenceClasses(ns(namespace), objectName, resultClass, role, includeQualifiers,
                includeClassOrigin, propertyList);
    }

    @NotNull
    public synchronized List<CIMInstanceName> associatorNames(@Nullable String namespace,
                                                              @NotNull CIMInstanceName objectName,
                                                              @Nullable String assocClass,
                                                              @Nullable String resultClass,
                                                              @Nullable String role, @Nullable String resultRole)
            throws CIMException {
        return associations.associatorNames(ns(namespace), objectName, assocClass, resultClass, role, resultRole);
    }

    @NotNull
    public synchronized List<CIMClassName> associatorNames(@Nullable String namespace,
                                                           @NotNull CIMClassName objectName,
                                                           @Nullable String assocClass, @Nullable String resultClass,
                                                           @Nullable String role, @Nullable String resultRole)
            throws CIMException {
        return associations.associatorClassNames(ns(namespace), objectName, assocClass, resultClass, role,
                resultRole);
    }

    @NotNull
    public synchronized List<CIMInstance> associators(@Nullable String namespace, @NotNull CIMInstanceName objectName,
                                                      @Nullable String assocClass, @Nullable String resultClass,
                                                      @Nullable String role, @Nullable String resultRole,
                                                      boolean includeQualifiers, boolean includeClassOrigin,
                                                      @Nullable Collection<String> propertyList)
            throws CIMException {
        return associations.associators(ns(namespace), objectName, assocClass, resultClass, role, resultRole,
                includeQualifiers, includeClassOrigin, propertyList);
    }

    @NotNull
    public synchronized List<CIMClass> associators(@Nullable String namespace, @NotNull CIMClassName objectName,
                                                   @Nullable String assocClass, @Nullable String resultClass,
                                                   @Nullable String role, @Nullable String resultRole,
                                                   boolean includeQualifiers, boolean includeClassOrigin,
                                                   @Nullable Collection<String> propertyList)
            throws CIMException {
        return associations.associatorClasses(ns(namespace), objectName, assocClass, resultClass, role, resultRole,
                includeQualifiers, includeClassOrigin, propertyList);
    }

    //-------------------------------------------------------------< pull >--

    @NotNull
    public synchronized EnumerationResult<CIMInstance> openEnumerateInstances(
            @Nullable String namespace, @NotNull String className, boolean deepInheritance,
            boolean includeClassOrigin, @Nullable Collection<String> propertyList, @NotNull OpenOptions options)
            throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        List<CIMInstance> result = enumerateInstances(ns, className, false, deepInheritance, false,
                includeClassOrigin, propertyList);
        return sessions.open(ns, PullType.INSTANCES_WITH_PATH, result, options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstance> openEnumerateInstances(
            @Nullable String namespace, @NotNull String className, @Nullable Integer maxObjectCount)
            throws CIMException {
        return openEnumerateInstances(namespace, className, true, false, null,
                OpenOptions.maxObjectCount(maxObjectCount));
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstanceName> openEnumerateInstancePaths(
            @Nullable String namespace, @NotNull String className, @NotNull OpenOptions options)
            throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCE_PATHS, enumerateInstanceNames(ns, className),
                options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstance> openReferenceInstances(
            @Nullable String namespace, @NotNull CIMInstanceName instanceName, @Nullable String resultClass,
            @Nullable String role, boolean includeClassOrigin, @Nullable Collection<String> propertyList,
            @NotNull OpenOptions options) throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCES_WITH_PATH,
                references(ns, instanceName, resultClass, role, false, includeClassOrigin, propertyList),
                options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstanceName> openReferenceInstancePaths(
            @Nullable String namespace, @NotNull CIMInstanceName instanceName, @Nullable String resultClass,
            @Nullable String role, @NotNull OpenOptions options) throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCE_PATHS, referenceNames(ns, instanceName, resultClass, role),
                options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstance> openAssociatorInstances(
            @Nullable String namespace, @NotNull CIMInstanceName instanceName, @Nullable String assocClass,
            @Nullable String resultClass, @Nullable String role, @Nullable String resultRole,
            boolean includeClassOrigin, @Nullable Collection<String> propertyList, @NotNull OpenOptions options)
            throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCES_WITH_PATH,
                associators(ns, instanceName, assocClass, resultClass, role, resultRole, false,
                        includeClassOrigin, propertyList),
                options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstanceName> openAssociatorInstancePaths(
            @Nullable String namespace, @NotNull CIMInstanceName instanceName, @Nullable String assocClass,
            @Nullable String resultClass, @Nullable String role, @Nullable String resultRole,
            @NotNull OpenOptions options) throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCE_PATHS,
                associatorNames(ns, instanceName, assocClass, resultClass, role, resultRole),
                options.getMaxObjectCount());
    }

    /**
     * @throws CIMException {@code NOT_SUPPORTED}, as {@link #execQuery}
     */
    @NotNull
    public synchronized EnumerationResult<CIMInstance> openQueryInstances(
            @Nullable String namespace, @NotNull String queryLanguage, @NotNull String query,
            @NotNull OpenOptions options) throws CIMException {
        checkOpen(options);
        String ns = ns(namespace);
        return sessions.open(ns, PullType.INSTANCES, execQuery(ns, queryLanguage, query),
                options.getMaxObjectCount());
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstance> pullInstancesWithPath(@NotNull EnumerationContext context,
                                                                             @Nullable Integer maxObjectCount)
            throws CIMException {
        return sessions.pullInstances(context, true, maxObjectCount);
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstanceName> pullInstancePaths(@NotNull EnumerationContext context,
                                                                             @Nullable Integer maxObjectCount)
            throws CIMException {
        return sessions.pullInstancePaths(context, maxObjectCount);
    }

    @NotNull
    public synchronized EnumerationResult<CIMInstance> pullInstances(@NotNull EnumerationContext context,
                                                                     @Nullable Integer maxObjectCount)
            throws CIMException {
        return sessions.pullInstances(context, false, maxObjectCount);
    }

    public synchronized void closeEnumeration(@NotNull EnumerationContext context) throws CIMException {
        sessions.close(context);
    }

    //----------------------------------------------------------< methods >--

    /**
     * Invokes an extrinsic method through the method provider registered
     * for the class of {@code objectName}.
     */
    @NotNull
    public synchronized MethodResult invokeMethod(@Nullable String namespace, @NotNull String methodName,
                                                  @NotNull CIMObjectPath objectName,
                                                  @NotNull Collection<CIMParameter> inParams) throws CIMException {
        return dispatcher.invokeMethod(ns(namespace), methodName, objectName, inParams);
    }

    //--------------------------------------------------------< providers >--

    /**
     * Registers a provider for its classes in each of {@code namespaces}
     * and initializes it with this server's context.
     */
    public synchronized void registerProvider(@NotNull Provider provider, @NotNull Collection<String> namespaces)
            throws CIMException {
        registry.register(repository, provider, namespaces);
        provider.init(context);
    }

    //--------------------------------------------------------< snapshots >--

    /**
     * Serializes the namespaces with their content and the provider
     * registry.
     *
     * @throws IOException if a registered provider is not serializable
     */
    @NotNull
    public synchronized byte[] snapshot() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ObjectOutputStream oos = new ObjectOutputStream(out)) {
            oos.writeObject(new Snapshot(lite, repository, registry));
        }
        LOG.debug("Snapshot of {} taken, {} bytes", repository, out.size());
        return out.toByteArray();
    }

    /**
     * Creates a server from a {@link #snapshot()}. Restored providers are
     * initialized with the new server's context.
     *
     * @throws IOException if {@code data} is not a snapshot
     */
    @NotNull
    public static MockWBEMServer restore(@NotNull byte[] data, @NotNull ServerSettings settings)
            throws IOException {
        Snapshot snapshot;
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(data))) {
            snapshot = (Snapshot) ois.readObject();
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IOException("Not a repository snapshot", e);
        }
        MockWBEMServer server = new MockWBEMServer(settings, snapshot.lite, snapshot.repository, snapshot.registry);
        for (Provider provider : snapshot.registry.getProviders()) {
            provider.init(server.context);
        }
        LOG.debug("Restored {}", snapshot.repository);
        return server;
    }

    //--------------------------------------------------------< dispatch >--

    /**
     * Performs an intrinsic operation with parameters named as in DSP0200
     * and defaulted as there.
     *
     * @return the result of the operation, or {@code null} for operations
     *         without result
     */
    @Nullable
    public synchronized Object invoke(@NotNull IntrinsicMethod method, @Nullable String namespace,
                                      @NotNull OperationParameters params) throws CIMException {
        LOG.debug("{} in {} with {}", method, namespace, params);
        switch (method) {
            case GET_CLASS:
                return getClass(namespace, params.getRequired("ClassName", String.class),
                        params.getBoolean("LocalOnly", true), params.getBoolean("IncludeQualifiers", true),
                        params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
            case ENUMERATE_CLASSES:
                return enumerateClasses(namespace, params.getString("ClassName"),
                        params.getBoolean("DeepInheritance", false), params.getBoolean("LocalOnly", true),
                        params.getBoolean("IncludeQualifiers", true),
                        params.getBoolean("IncludeClassOrigin", false));
            case ENUMERATE_CLASS_NAMES:
                return enumerateClassNames(namespace, params.getString("ClassName"),
                        params.getBoolean("DeepInheritance", false));
            case CREATE_CLASS:
                createClass(namespace, params.getRequired("NewClass", CIMClass.class));
                return null;
            case MODIFY_CLASS:
                modifyClass(namespace, params.getRequired("ModifiedClass", CIMClass.class));
                return null;
            case DELETE_CLASS:
                deleteClass(namespace, params.getRequired("ClassName", String.class));
                return null;
            case GET_QUALIFIER:
                return getQualifier(namespace, params.getRequired("QualifierName", String.class));
            case ENUMERATE_QUALIFIERS:
                return enumerateQualifiers(namespace);
            case SET_QUALIFIER:
                setQualifier(namespace, params.getRequired("QualifierDeclaration", CIMQualifierDeclaration.class));
                return null;
            case DELETE_QUALIFIER:
                deleteQualifier(namespace, params.getRequired("QualifierName", String.class));
                return null;
            case GET_INSTANCE:
                return getInstance(namespace, params.getRequired("InstanceName", CIMInstanceName.class),
                        params.getBoolean("LocalOnly", false), params.getBoolean("IncludeQualifiers", false),
                        params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
            case ENUMERATE_INSTANCES:
                return enumerateInstances(namespace, params.getRequired("ClassName", String.class),
                        params.getBoolean("LocalOnly", false), params.getBoolean("DeepInheritance", true),
                        params.getBoolean("IncludeQualifiers", false),
                        params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
            case ENUMERATE_INSTANCE_NAMES:
                return enumerateInstanceNames(namespace, params.getRequired("ClassName", String.class));
            case CREATE_INSTANCE:
                return createInstance(namespace, params.getRequired("NewInstance", CIMInstance.class));
            case MODIFY_INSTANCE:
                modifyInstance(namespace, params.getRequired("ModifiedInstance", CIMInstance.class),
                        params.getStringList("PropertyList"));
                return null;
            case DELETE_INSTANCE:
                deleteInstance(namespace, params.getRequired("InstanceName", CIMInstanceName.class));
                return null;
            case EXEC_QUERY:
                return execQuery(namespace, params.getRequired("QueryLanguage", String.class),
                        params.getRequired("Query", String.class));
            case ASSOCIATORS: {
                CIMObjectPath objectName = params.getRequired("ObjectName", CIMObjectPath.class);
                if (objectName instanceof CIMClassName) {
                    return associators(namespace, (CIMClassName) objectName, params.getString("AssocClass"),
                            params.getString("ResultClass"), params.getString("Role"),
                            params.getString("ResultRole"), params.getBoolean("IncludeQualifiers", false),
                            params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
                }
                return associators(namespace, (CIMInstanceName) objectName, params.getString("AssocClass"),
                        params.getString("ResultClass"), params.getString("Role"), params.getString("ResultRole"),
                        params.getBoolean("IncludeQualifiers", false), params.getBoolean("IncludeClassOrigin", false),
                        params.getStringList("PropertyList"));
            }
            case ASSOCIATOR_NAMES: {
                CIMObjectPath objectName = params.getRequired("ObjectName", CIMObjectPath.class);
                if (objectName instanceof CIMClassName) {
                    return associatorNames(namespace, (CIMClassName) objectName, params.getString("AssocClass"),
                            params.getString("ResultClass"), params.getString("Role"),
                            params.getString("ResultRole"));
                }
                return associatorNames(namespace, (CIMInstanceName) objectName, params.getString("AssocClass"),
                        params.getString("ResultClass"), params.getString("Role"), params.getString("ResultRole"));
            }
            case REFERENCES: {
                CIMObjectPath objectName = params.getRequired("ObjectName", CIMObjectPath.class);
                if (objectName instanceof CIMClassName) {
                    return references(namespace, (CIMClassName) objectName, params.getString("ResultClass"),
                            params.getString("Role"), params.getBoolean("IncludeQualifiers", false),
                            params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
                }
                return references(namespace, (CIMInstanceName) objectName, params.getString("ResultClass"),
                        params.getString("Role"), params.getBoolean("IncludeQualifiers", false),
                        params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"));
            }
            case REFERENCE_NAMES: {
                CIMObjectPath objectName = params.getRequired("ObjectName", CIMObjectPath.class);
                if (objectName instanceof CIMClassName) {
                    return referenceNames(namespace, (CIMClassName) objectName, params.getString("ResultClass"),
                            params.getString("Role"));
                }
                return referenceNames(namespace, (CIMInstanceName) objectName, params.getString("ResultClass"),
                        params.getString("Role"));
            }
            case OPEN_ENUMERATE_INSTANCES:
                return openEnumerateInstances(namespace, params.getRequired("ClassName", String.class),
                        params.getBoolean("DeepInheritance", true), params.getBoolean("IncludeClassOrigin", false),
                        params.getStringList("PropertyList"), openOptions(params));
            case OPEN_ENUMERATE_INSTANCE_PATHS:
                return openEnumerateInstancePaths(namespace, params.getRequired("ClassName", String.class),
                        openOptions(params));
            case OPEN_REFERENCE_INSTANCES:
                return openReferenceInstances(namespace, params.getRequired("InstanceName", CIMInstanceName.class),
                        params.getString("ResultClass"), params.getString("Role"),
                        params.getBoolean("IncludeClassOrigin", false), params.getStringList("PropertyList"),
                        openOptions(params));
            case OPEN_REFERENCE_INSTANCE_PATHS:
                return openReferenceInstancePaths(namespace,
                        params.getRequired("InstanceName", CIMInstanceName.class), params.getString("ResultClass"),
                        params.getString("Role"), openOptions(params));
            case OPEN_ASSOCIATOR_INSTANCES:
                return openAssociatorInstances(namespace, params.getRequired("InstanceName", CIMInstanceName.class),
                        params.getString("AssocClass"), params.getString("ResultClass"), params.getString("Role"),
                        params.getString("ResultRole"), params.getBoolean("IncludeClassOrigin", false),
                        params.getStringList("PropertyList"), openOptions(params));
            case OPEN_ASSOCIATOR_INSTANCE_PATHS:
                return openAssociatorInstancePaths(namespace,
                        params.getRequired("InstanceName", CIMInstanceName.class), params.getString("AssocClass"),
                        params.getString("ResultClass"), params.getString("Role"), params.getString("ResultRole"),
                        openOptions(params));
            case OPEN_QUERY_INSTANCES:
                return openQueryInstances(namespace, params.getRequired("FilterQueryLanguage", String.class),
                        params.getRequired("FilterQuery", String.class), OpenOptions.builder()
                                .operationTimeout(params.getInteger("OperationTimeout"))
                                .continueOnError(params.getBoolean("ContinueOnError", false))
                                .maxObjectCount(params.getInteger("MaxObjectCount"))
                                .build());
            case PULL_INSTANCES_WITH_PATH:
                return pullInstancesWithPath(params.getRequired("EnumerationContext", EnumerationContext.class),
                        params.getInteger("MaxObjectCount"));
            case PULL_INSTANCE_PATHS:
                return pullInstancePaths(params.getRequired("EnumerationContext", EnumerationContext.class),
                        params.getInteger("MaxObjectCount"));
            case PULL_INSTANCES:
                return pullInstances(params.getRequired("EnumerationContext", EnumerationContext.class),
                        params.getInteger("MaxObjectCount"));
            case CLOSE_ENUMERATION:
                closeEnumeration(params.getRequired("EnumerationContext", EnumerationContext.class));
                return null;
            default:
                throw new IllegalStateException("Unhandled intrinsic method " + method);
        }
    }

    @Override
    public synchronized String toString() {
        return "MockWBEMServer{" + repository + ", " + registry + "}";
    }

    //-----------------------------------------------------------< private >--

    private String ns(String namespace) {
        return namespace == null ? settings.getDefaultNamespace() : namespace;
    }

    private void checkOpen(OpenOptions options) throws CIMException {
        sessions.checkOpen(options.getFilterQueryLanguage(), options.getFilterQuery(),
                options.getOperationTimeout(), options.getMaxObjectCount());
    }

    private static OpenOptions openOptions(OperationParameters params) throws CIMException {
        return OpenOptions.builder()
                .filterQuery(params.getString("FilterQueryLanguage"), params.getString("FilterQuery"))
                .operationTimeout(params.getInteger("OperationTimeout"))
                .continueOnError(params.getBoolean("ContinueOnError", false))
                .maxObjectCount(params.getInteger("MaxObjectCount"))
                .build();
    }

    private void checkClassUnused(String namespace, String className) throws CIMException {
        if (!resolver.classExists(namespace, className)) {
            throw new CIMException(CIMStatus.NOT_FOUND,
                    "Class " + className + " not found in namespace " + namespace);
        }
        if (!resolver.getSubclassNames(namespace, className, false).isEmpty()) {
            throw new CIMException(CIMStatus.CLASS_HAS_CHILDREN,
                    "Class " + className + " in namespace " + namespace + " has subclasses");
        }
        for (CIMInstanceName name : repository.getInstanceStore(namespace).names()) {
            if (Names.same(name.getClassName(), className)) {
                throw new CIMException(CIMStatus.CLASS_HAS_INSTANCES,
                        "Class " + className + " in namespace " + namespace + " has instances");
            }
        }
    }

    private NamespaceProvider namespaceProvider() {
        String interop = context.getInteropNamespace();
        if (interop == null) {
            return null;
        }
        InstanceWriteProvider provider = registry.getInstanceWriteProvider(interop, NamespaceProvider.CLASS_NAME);
        return provider instanceof NamespaceProvider ? (NamespaceProvider) provider : null;
    }

    private static final class Snapshot implements Serializable {

        private static final long serialVersionUID = 1L;

        private final boolean lite;
        private final InMemoryRepository repository;
        private final ProviderRegistry registry;

        Snapshot(boolean lite, InMemoryRepository repository, ProviderRegistry registry) {
            this.lite = lite;
            this.repository = repository;
            this.registry = registry;
        }
    }

    /**
     * The view of the server given to providers.
     */
    private final class Context implements ProviderContext {

        @NotNull
        @Override
        public Repository getRepository() {
            return repository;
        }

        @NotNull
        @Override
        public CIMClass getResolvedClass(@NotNull String namespace, @NotNull String className)
                throws CIMException {
            return resolver.resolve(namespace, className);
        }

        @NotNull
        @Override
        public InstanceWriteProvider getDefaultInstanceWriteProvider() {
            return defaultProvider;
        }

        @Override
        public void addNamespace(@NotNull String namespace) throws CIMException {
            repository.addNamespace(namespace);
        }

        @Override
        public void removeNamespace(@NotNull String namespace) throws CIMException {
            repository.removeNamespace(namespace);
            registry.removeNamespace(namespace);
        }

        @Nullable
        @Override
        public String getInteropNamespace() {
            for (String name : INTEROP_NAMESPACE_NAMES) {
                if (repository.hasNamespace(name)) {
                    return repository.getNamespaces().stream()
                            .filter(ns -> Names.same(ns, name))
                            .findFirst()
                            .orElse(name);
                }
            }
            return null;
        }
    }
}
