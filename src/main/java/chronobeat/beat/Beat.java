package chronobeat.beat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the background work:
 * - SchedulerLoop on its own dedicated thread
 * - ResultReaper at a fixed rate on a single-threaded executor
 */
public class Beat implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Beat.class);

    private final SchedulerLoop loop;
    private final ResultReaper resultReaper;
    private final Duration reaperInterval;
    private final ScheduledExecutorService executor;
    private final Thread loopThread;

    private volatile boolean running = false;

    /**
     * @param loop           the beat loop
     * @param resultReaper   reaper for stuck results
     * @param reaperInterval how often the reaper runs
     */
    public Beat(SchedulerLoop loop, ResultReaper resultReaper, Duration reaperInterval) {
        this.loop = loop;
        this.resultReaper = resultReaper;
        this.reaperInterval = reaperInterval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chronobeat-reaper");
            t.setDaemon(true);
            return t;
        });
        this.loopThread = new Thread(loop, "chronobeat-beat");
        this.loopThread.setDaemon(true);
    }

    /**
     * Start the loop and the reaper.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Beat already running");
            return;
        }

        running = true;

        loopThread.start();

        long reaperIntervalMs = reaperInterval.toMillis();
        executor.scheduleAtFixedRate(
                resultReaper,
                reaperIntervalMs, // initial delay
                reaperIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Result reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Beat started");
    }

    /**
     * Stop gracefully: the loop flushes pending bookkeeping before exiting.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        loop.stop();
        executor.shutdown();

        try {
            if (!loop.awaitStopped(Duration.ofSeconds(5))) {
                loopThread.interrupt();
                log.warn("Beat loop forcefully stopped");
            }
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Result reaper forcefully stopped");
            } else {
                log.info("Beat stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            loopThread.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public SchedulerLoop loop() {
        return loop;
    }

    public ResultReaper resultReaper() {
        return resultReaper;
    }
}
