package chronobeat.server;

import chronobeat.api.Controller;
import chronobeat.api.Controller.ControllerResponse;
import chronobeat.config.SchedulerConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Routes requests on the admin surface ({@code /api/v1}) and the worker surface
 * ({@code /internal/v1}) to the first registered {@link Controller} that claims them.
 * When a worker key is configured, the worker surface requires it in
 * {@value #WORKER_KEY_HEADER}. Unclaimed paths get a JSON 404.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String WORKER_KEY_HEADER = "X-Chronobeat-Key";
    private static final String WORKER_PREFIX = "/internal/";

    private final List<Controller> controllers = new ArrayList<>();
    private final SchedulerConfig config;

    public RouterHandler(SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Add a controller; earlier registrations win when two match the same path.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Route added: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = stripQuery(req.uri());
        send(ctx, route(ctx, req, method, path));
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path) {
        try {
            if (!workerKeyAccepted(req, path)) {
                log.warn("Rejected {} {}: missing or wrong worker key", method, path);
                return ControllerResponse.forbidden("forbidden");
            }
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No route for {} {}", method, path);
            return ControllerResponse.notFound("not found");
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Request {} {} failed", method, path, e);
            return ControllerResponse.error("internal error");
        }
    }

    static String stripQuery(String uri) {
        int q = uri.indexOf('?');
        return q < 0 ? uri : uri.substring(0, q);
    }

    private boolean workerKeyAccepted(FullHttpRequest req, String path) {
        if (!config.hasWorkerKey() || !path.startsWith(WORKER_PREFIX)) {
            return true;
        }
        return config.workerKey().equals(req.headers().get(WORKER_KEY_HEADER));
    }

    private void send(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] payload = response.body() == null
                ? new byte[0]
                : response.body().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(payload));
        out.headers()
                .set(CONTENT_TYPE, response.contentType() + "; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, payload.length);
        ctx.writeAndFlush(out).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Could not write {} response: {}", response.status().code(),
                        String.valueOf(future.cause()));
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error from {}", ctx.channel().remoteAddress(), cause);
        if (ctx.channel().isActive()) {
            send(ctx, ControllerResponse.error("channel error"));
        }
        ctx.close();
    }

    /**
     * JSON mapper shared by the controllers; ISO-8601 timestamps, java.time registered.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
