package chronobeat.api.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.v1.dto.StatisticsResponse;
import chronobeat.service.ScheduleAdminService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /api/v1/statistics
 */
public class StatisticsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StatisticsController.class);

    private final ScheduleAdminService adminService;

    public StatisticsController(ScheduleAdminService adminService) {
        this.adminService = adminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/statistics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ApiSupport.ok(StatisticsResponse.from(adminService.getTaskStatistics()));
        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Statistics");
        }
    }
}
