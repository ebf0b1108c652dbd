package chronobeat.api.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.v1.dto.IntervalRequest;
import chronobeat.api.v1.dto.IntervalResponse;
import chronobeat.model.IntervalSchedule;
import chronobeat.service.ScheduleAdminService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for interval schedules (public API).
 *
 * GET /api/v1/schedules/intervals - List intervals
 * POST /api/v1/schedules/intervals - Create an interval
 * GET /api/v1/schedules/intervals/{id} - Get an interval
 * PUT /api/v1/schedules/intervals/{id} - Replace an interval
 * DELETE /api/v1/schedules/intervals/{id} - Delete an unused interval
 */
public class IntervalController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(IntervalController.class);

    private static final Pattern INTERVALS_PATTERN = Pattern.compile("^/api/v1/schedules/intervals$");
    private static final Pattern INTERVAL_BY_ID_PATTERN = Pattern.compile("^/api/v1/schedules/intervals/([^/]+)$");

    private final ScheduleAdminService adminService;

    public IntervalController(ScheduleAdminService adminService) {
        this.adminService = adminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (INTERVALS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (INTERVAL_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (INTERVALS_PATTERN.matcher(path).matches()) {
                if (method.equals(HttpMethod.POST)) {
                    return handleCreate(req);
                }
                List<IntervalResponse> intervals = adminService.listIntervals().stream()
                        .map(IntervalResponse::from)
                        .toList();
                return ApiSupport.ok(intervals);
            }

            Matcher byId = INTERVAL_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                long id = ApiSupport.parseId(byId.group(1));
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(req, id);
                }
                if (method.equals(HttpMethod.DELETE)) {
                    return adminService.deleteInterval(id)
                            ? ControllerResponse.noContent()
                            : ControllerResponse.notFound("interval not found");
                }
                Optional<IntervalSchedule> interval = adminService.getInterval(id);
                if (interval.isEmpty()) {
                    return ControllerResponse.notFound("interval not found");
                }
                return ApiSupport.ok(IntervalResponse.from(interval.get()));
            }

            return ControllerResponse.notFound("unknown interval endpoint");

        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Interval request " + path);
        }
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        IntervalRequest request = ApiSupport.readBody(req, IntervalRequest.class);
        request.validate();

        IntervalSchedule created = adminService.createInterval(request.every(), request.period());
        return ApiSupport.created(IntervalResponse.from(created));
    }

    private ControllerResponse handleUpdate(FullHttpRequest req, long id) throws Exception {
        IntervalRequest request = ApiSupport.readBody(req, IntervalRequest.class);
        request.validate();

        Optional<IntervalSchedule> updated = adminService.updateInterval(id, request.every(), request.period());
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("interval not found");
        }
        return ApiSupport.ok(IntervalResponse.from(updated.get()));
    }
}
