package com.conveyal.trackingauth.components;

import com.conveyal.trackingauth.AuthConfig;
import com.conveyal.trackingauth.authorization.AuthorizationFilter;
import com.conveyal.trackingauth.authorization.AuthorizationRules;
import com.conveyal.trackingauth.authorization.OwnershipHandlers;
import com.conveyal.trackingauth.authorization.PermissionEvaluator;
import com.conveyal.trackingauth.authorization.ResourceResolver;
import com.conveyal.trackingauth.authorization.RouteTable;
import com.conveyal.trackingauth.authorization.SearchResultFilter;
import com.conveyal.trackingauth.authorization.Validators;
import com.conveyal.trackingauth.components.eventbus.AuditLogger;
import com.conveyal.trackingauth.components.eventbus.ErrorLogger;
import com.conveyal.trackingauth.components.eventbus.EventBus;
import com.conveyal.trackingauth.controllers.AdminController;
import com.conveyal.trackingauth.controllers.HttpController;
import com.conveyal.trackingauth.controllers.PermissionController;
import com.conveyal.trackingauth.controllers.SessionController;
import com.conveyal.trackingauth.controllers.TrackingProxyController;
import com.conveyal.trackingauth.controllers.UserController;
import com.conveyal.trackingauth.persistence.PermissionStore;
import com.conveyal.trackingauth.persistence.SessionStore;
import com.conveyal.trackingauth.upstream.ModelRegistryStore;
import com.conveyal.trackingauth.upstream.TrackingStore;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * We are adopting a lightweight dependency injection approach, where we manually wire up our components instead of
 * relying on a framework. This class keeps references to all components of the system in one place, and subclasses
 * decide which implementations are used (e.g. MongoDB or in-memory storage).
 *
 * Outside code should never reference these component fields after construction. Each component holds final
 * references to the other components it needs, passed into its constructor by the wiring-up code.
 *
 * Subclass constructors set the config, the event bus and the stores, then call wireAuthorization() and finally
 * create the HttpApi from the standard controllers.
 */
public abstract class AuthComponents {

    public AuthConfig config;
    public EventBus eventBus;
    public PermissionStore permissionStore;
    public SessionStore sessionStore;
    public TrackingStore trackingStore;
    public ModelRegistryStore modelRegistryStore;
    public Clock clock = Clock.systemUTC();
    /** Verification of user identity. */
    public Authentication authentication;
    public AuthorizationFilter authorizationFilter;
    public HttpApi httpApi;

    /** Event handlers that are not synchronous run on this single background thread. */
    protected static ExecutorService eventExecutor () {
        return Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("event-bus-%d").setDaemon(true).build());
    }

    protected static EventBus standardEventBus () {
        EventBus eventBus = new EventBus(eventExecutor());
        eventBus.addHandlers(new ErrorLogger(), new AuditLogger());
        return eventBus;
    }

    /**
     * Create the authentication method and everything that decides on requests. Fails if the route table is
     * incomplete, so a misconfigured build never starts serving.
     */
    protected void wireAuthorization () {
        authentication = config.authenticationType().create(permissionStore, sessionStore, config, clock);
        PermissionEvaluator evaluator = new PermissionEvaluator(permissionStore, config);
        Validators validators = new Validators(new ResourceResolver(trackingStore), evaluator);
        AuthorizationRules rules = AuthorizationRules.standard(
                validators,
                new OwnershipHandlers(permissionStore, eventBus),
                new SearchResultFilter(evaluator, trackingStore, modelRegistryStore)
        );
        RouteTable routeTable = RouteTable.build(AuthorizationRules.allOperations(), rules);
        authorizationFilter = new AuthorizationFilter(authentication, routeTable, validators, eventBus);
    }

    /**
     * Create the standard list of HttpControllers. This instance should already be initialized with all components
     * except the HttpApi. The proxy to the tracking server comes last because its catch-all routes would shadow any
     * controller registered after it.
     */
    public List<HttpController> standardHttpControllers () {
        List<HttpController> controllers = Lists.newArrayList(
                new UserController(permissionStore, eventBus),
                new PermissionController(permissionStore, eventBus),
                new AdminController(permissionStore, trackingStore, eventBus, config)
        );
        if (authentication instanceof SessionAuthentication) {
            controllers.add(new SessionController((SessionAuthentication) authentication));
        }
        controllers.add(new TrackingProxyController(config));
        return controllers;
    }

}
