package beacon.scheduler.config;

import beacon.scheduler.api.v1.HealthController;
import beacon.scheduler.api.v1.TriggerController;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.repository.TriggerRepository;
import beacon.scheduler.scheduler.Scheduler;
import beacon.scheduler.server.RouterHandler;
import beacon.scheduler.server.SchedulerHttpServer;
import beacon.scheduler.service.TriggerService;
import beacon.scheduler.store.Database;
import beacon.scheduler.worker.TriggerHandler;
import beacon.scheduler.worker.TriggerPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies. Each instance owns its own
 * connection pool, so several can run side by side in one JVM.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * deps.registerHandler(TriggerModule.ALERT, alertEvaluator);
 * deps.startScheduler(); // watchdog and reaper
 * deps.startPoller(); // consume due triggers
 * TriggerService triggerService = deps.triggerService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final Database database;
    private final TriggerRepository triggerRepository;
    private final TriggerService triggerService;

    // Controllers
    private final HealthController healthController;
    private final TriggerController triggerController;

    private final Map<TriggerModule, TriggerHandler> handlers = new EnumMap<>(TriggerModule.class);

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private TriggerPoller poller;
    private SchedulerHttpServer httpServer;

    private Dependencies(SchedulerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.triggerRepository = database.backend().createRepository(database, clock);

        // Services
        this.triggerService = new TriggerService(triggerRepository, config);

        // Controllers
        this.healthController = new HealthController(database, triggerService);
        this.triggerController = new TriggerController(triggerService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(SchedulerConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with the given config and clock.
     */
    public static Dependencies create(SchedulerConfig config, Clock clock) {
        return new Dependencies(config.validate(), clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TriggerRepository triggerRepository() {
        return triggerRepository;
    }

    public TriggerService triggerService() {
        return triggerService;
    }

    public HealthController healthController() {
        return healthController;
    }

    public TriggerController triggerController() {
        return triggerController;
    }

    /**
     * Register the handler for one module. Must be called before
     * {@link #startPoller()}.
     */
    public Dependencies registerHandler(TriggerModule module, TriggerHandler handler) {
        if (poller != null) {
            throw new IllegalStateException("poller already created");
        }
        handlers.put(module, handler);
        return this;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(triggerController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(triggerService, config);
        }
        return scheduler;
    }

    /**
     * Get the poller (creates it if not yet created).
     */
    public TriggerPoller poller() {
        if (poller == null) {
            poller = new TriggerPoller(triggerService, config, handlers, clock);
        }
        return poller;
    }

    /**
     * Start the background timeout watchdog and completion reaper.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Start consuming due triggers with the registered handlers.
     */
    public void startPoller() {
        if (handlers.isEmpty()) {
            log.warn("No trigger handlers registered; due triggers will be returned to WAITING");
        }
        poller().start();
    }

    /**
     * Start the admin HTTP server unless it is disabled (port 0).
     *
     * @return the bound port, or -1 when disabled
     */
    public int startHttpServer() {
        if (!config.isHttpEnabled()) {
            log.info("HTTP server disabled");
            return -1;
        }
        if (httpServer == null) {
            httpServer = new SchedulerHttpServer(routerHandler());
        }
        return httpServer.start(config.httpHost(), config.httpPort());
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        if (poller != null) {
            try {
                poller.stop();
            } catch (Exception e) {
                log.warn("Error stopping poller: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
