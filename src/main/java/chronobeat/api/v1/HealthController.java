package chronobeat.api.v1;

import chronobeat.api.Controller;
import chronobeat.api.v1.dto.HealthResponse;
import chronobeat.beat.Beat;
import chronobeat.beat.SchedulerLoop;
import chronobeat.server.RouterHandler;
import chronobeat.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * GET /api/v1/health: database reachability plus a snapshot of the beat loop.
 * Answers 503 when the database cannot be reached.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final Beat beat;

    public HealthController(Database database, Beat beat) {
        this.database = database;
        this.beat = beat;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            SchedulerLoop loop = beat.loop();
            String beatState = beat.isRunning() ? loop.state().name() : "STOPPED";

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    beatState,
                    loop.cache().size(),
                    loop.cache().pendingCount(),
                    loop.dispatchUnavailable(),
                    loop.lastCycleAt());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Could not assemble health snapshot", e);
            return ControllerResponse.unavailable("health check failed");
        }
    }

    private static String formatUptime() {
        Duration up = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return String.format("%dh %02dm", up.toHours(), up.toMinutesPart());
    }
}
