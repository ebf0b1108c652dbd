package chronobeat;

import chronobeat.config.SchedulerConfig;
import chronobeat.server.ChronobeatServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: starts the HTTP server and the beat, then waits for shutdown.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        SchedulerConfig config = SchedulerConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting chronobeat on port {}...", port);
        if (!ChronobeatServer.start(port, config)) {
            log.error("Chronobeat did not start");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping...");
            ChronobeatServer.stop();
            shutdown.countDown();
        }, "chronobeat-shutdown"));

        shutdown.await();
    }
}
