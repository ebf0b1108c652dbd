package chronobeat.api.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.v1.dto.PageResponse;
import chronobeat.api.v1.dto.TaskResultResponse;
import chronobeat.model.TaskResult;
import chronobeat.model.TaskResultStatus;
import chronobeat.service.TaskResultService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task results (public API).
 *
 * GET /api/v1/results?taskName=&status=&offset=&limit= - List results, newest first
 * GET /api/v1/results/{id} - Get one result
 * POST /api/v1/results/cleanup?days= - Delete finished results older than N days
 */
public class TaskResultController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskResultController.class);

    private static final Pattern RESULTS_PATTERN = Pattern.compile("^/api/v1/results$");
    private static final Pattern CLEANUP_PATTERN = Pattern.compile("^/api/v1/results/cleanup$");
    private static final Pattern RESULT_BY_ID_PATTERN = Pattern.compile("^/api/v1/results/([^/]+)$");

    private final TaskResultService resultService;

    public TaskResultController(TaskResultService resultService) {
        this.resultService = resultService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return CLEANUP_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RESULTS_PATTERN.matcher(path).matches()
                    || (RESULT_BY_ID_PATTERN.matcher(path).matches() && !CLEANUP_PATTERN.matcher(path).matches());
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLEANUP_PATTERN.matcher(path).matches()) {
                Integer days = ApiSupport.intParam(ApiSupport.query(req), "days");
                int deleted = resultService.cleanup(days);
                return ApiSupport.ok(Map.of("deleted", deleted));
            }

            if (RESULTS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher byId = RESULT_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                Optional<TaskResult> result = resultService.findById(byId.group(1));
                if (result.isEmpty()) {
                    return ControllerResponse.notFound("result not found");
                }
                return ApiSupport.ok(TaskResultResponse.from(result.get()));
            }

            return ControllerResponse.notFound("unknown result endpoint");

        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Result request " + path);
        }
    }

    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        Map<String, List<String>> query = ApiSupport.query(req);
        String taskName = ApiSupport.param(query, "taskName");
        TaskResultStatus status = parseStatus(ApiSupport.param(query, "status"));
        int offset = PeriodicTaskController.pageOffset(ApiSupport.intParam(query, "offset"));
        int limit = PeriodicTaskController.pageLimit(ApiSupport.intParam(query, "limit"));

        List<TaskResultResponse> results = resultService.find(taskName, status, offset, limit).stream()
                .map(TaskResultResponse::from)
                .toList();
        return ApiSupport.ok(new PageResponse<>(results, resultService.count(taskName, status), offset, limit));
    }

    private static TaskResultStatus parseStatus(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TaskResultStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
