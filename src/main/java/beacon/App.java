package beacon;

import beacon.scheduler.config.Dependencies;
import beacon.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone scheduler node.
 *
 * Runs the timeout watchdog, the completion reaper and the admin HTTP API
 * against the configured store. Job executors embed {@link Dependencies}
 * and register their handlers to consume triggers.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        SchedulerConfig config = SchedulerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            shutdown.countDown();
        }, "beacon-shutdown"));

        try {
            deps.startScheduler();
            deps.startHttpServer();
        } catch (RuntimeException e) {
            log.error("Failed to start scheduler node", e);
            deps.close();
            System.exit(1);
        }

        log.info("Beacon scheduler node running");
        shutdown.await();
    }
}
