package chronobeat.api.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.v1.dto.PageResponse;
import chronobeat.api.v1.dto.TaskRequest;
import chronobeat.api.v1.dto.TaskResponse;
import chronobeat.model.PeriodicTask;
import chronobeat.service.ScheduleAdminService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for periodic tasks (public API).
 *
 * GET /api/v1/tasks?enabled=&offset=&limit= - List tasks
 * POST /api/v1/tasks - Create a task
 * GET|PUT|DELETE /api/v1/tasks/{id} - Read, partially update, delete
 * POST /api/v1/tasks/{id}/enable, /disable - Toggle scheduling
 * POST /api/v1/tasks/{id}/run - Dispatch now, outside the schedule
 */
public class PeriodicTaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskController.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_ACTION_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/(enable|disable|run)$");

    private final ScheduleAdminService adminService;

    public PeriodicTaskController(ScheduleAdminService adminService) {
        this.adminService = adminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST) && TASK_ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (TASKS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher action = TASK_ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                return handleAction(ApiSupport.parseId(action.group(1)), action.group(2));
            }

            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                long id = ApiSupport.parseId(byId.group(1));
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(req, id);
                }
                if (method.equals(HttpMethod.DELETE)) {
                    return adminService.deleteTask(id)
                            ? ControllerResponse.noContent()
                            : ControllerResponse.notFound("task not found");
                }
                return respond(adminService.getTask(id));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Task request " + path);
        }
    }

    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        Map<String, List<String>> query = ApiSupport.query(req);
        Boolean enabled = ApiSupport.boolParam(query, "enabled");
        int offset = pageOffset(ApiSupport.intParam(query, "offset"));
        int limit = pageLimit(ApiSupport.intParam(query, "limit"));

        List<TaskResponse> tasks = adminService.listTasks(enabled, offset, limit).stream()
                .map(TaskResponse::from)
                .toList();
        return ApiSupport.ok(new PageResponse<>(tasks, adminService.countTasks(enabled), offset, limit));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        TaskRequest request = ApiSupport.readBody(req, TaskRequest.class);
        request.validate();

        PeriodicTask created = adminService.createTask(request.toFields());
        return ApiSupport.created(TaskResponse.from(created));
    }

    private ControllerResponse handleUpdate(FullHttpRequest req, long id) throws Exception {
        TaskRequest request = ApiSupport.readBody(req, TaskRequest.class);
        request.validate();

        return respond(adminService.updateTask(id, request.toFields()));
    }

    private ControllerResponse handleAction(long id, String action) throws Exception {
        switch (action) {
            case "enable":
                return respond(adminService.enableTask(id));
            case "disable":
                return respond(adminService.disableTask(id));
            default:
                Optional<String> dispatchId = adminService.runTaskNow(id);
                if (dispatchId.isEmpty()) {
                    return ControllerResponse.notFound("task not found");
                }
                return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                        "{\"dispatchId\":\"" + dispatchId.get() + "\"}");
        }
    }

    private static ControllerResponse respond(Optional<PeriodicTask> task) throws Exception {
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ApiSupport.ok(TaskResponse.from(task.get()));
    }

    static int pageOffset(Integer offset) {
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return offset;
    }

    static int pageLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
