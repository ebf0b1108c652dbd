package chronobeat.api.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.v1.dto.CrontabRequest;
import chronobeat.api.v1.dto.CrontabResponse;
import chronobeat.model.CrontabSchedule;
import chronobeat.service.ScheduleAdminService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for crontab schedules (public API).
 * Same shape as the interval endpoints under /api/v1/schedules/crontabs.
 */
public class CrontabController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CrontabController.class);

    private static final Pattern CRONTABS_PATTERN = Pattern.compile("^/api/v1/schedules/crontabs$");
    private static final Pattern CRONTAB_BY_ID_PATTERN = Pattern.compile("^/api/v1/schedules/crontabs/([^/]+)$");

    private final ScheduleAdminService adminService;

    public CrontabController(ScheduleAdminService adminService) {
        this.adminService = adminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (CRONTABS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (CRONTAB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (CRONTABS_PATTERN.matcher(path).matches()) {
                if (method.equals(HttpMethod.POST)) {
                    CrontabRequest request = ApiSupport.readBody(req, CrontabRequest.class);
                    CrontabSchedule created = adminService.createCrontab(request.toModel());
                    return ApiSupport.created(CrontabResponse.from(created));
                }
                return ApiSupport.ok(adminService.listCrontabs().stream().map(CrontabResponse::from).toList());
            }

            Matcher byId = CRONTAB_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                long id = ApiSupport.parseId(byId.group(1));

                if (method.equals(HttpMethod.PUT)) {
                    CrontabRequest request = ApiSupport.readBody(req, CrontabRequest.class);
                    Optional<CrontabSchedule> updated = adminService.updateCrontab(id, request.toModel());
                    return updated.isPresent()
                            ? ApiSupport.ok(CrontabResponse.from(updated.get()))
                            : ControllerResponse.notFound("crontab not found");
                }
                if (method.equals(HttpMethod.DELETE)) {
                    return adminService.deleteCrontab(id)
                            ? ControllerResponse.noContent()
                            : ControllerResponse.notFound("crontab not found");
                }

                Optional<CrontabSchedule> crontab = adminService.getCrontab(id);
                return crontab.isPresent()
                        ? ApiSupport.ok(CrontabResponse.from(crontab.get()))
                        : ControllerResponse.notFound("crontab not found");
            }

            return ControllerResponse.notFound("unknown crontab endpoint");

        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Crontab request " + path);
        }
    }
}
