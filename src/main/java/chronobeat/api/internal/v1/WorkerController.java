package chronobeat.api.internal.v1;

import chronobeat.api.ApiSupport;
import chronobeat.api.Controller;
import chronobeat.api.internal.v1.dto.ClaimResultsRequest;
import chronobeat.api.internal.v1.dto.ClaimResultsResponse;
import chronobeat.api.internal.v1.dto.CompleteResultRequest;
import chronobeat.api.internal.v1.dto.FailResultRequest;
import chronobeat.api.internal.v1.dto.OperationResponse;
import chronobeat.model.ResultCompleteOutcome;
import chronobeat.model.ResultFailOutcome;
import chronobeat.model.TaskResult;
import chronobeat.server.RouterHandler;
import chronobeat.service.TaskResultService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the worker protocol (internal API).
 *
 * POST /internal/v1/results/claim - Claim dispatched tasks
 * POST /internal/v1/results/{id}/complete - Report success (idempotent)
 * POST /internal/v1/results/{id}/fail - Report failure (idempotent)
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/results/claim$");
    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/internal/v1/results/([^/]+)/complete$");
    private static final Pattern FAIL_PATTERN = Pattern.compile("^/internal/v1/results/([^/]+)/fail$");

    private final TaskResultService resultService;

    public WorkerController(TaskResultService resultService) {
        this.resultService = resultService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches() ||
                COMPLETE_PATTERN.matcher(path).matches() ||
                FAIL_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(req);
            }

            Matcher completeMatcher = COMPLETE_PATTERN.matcher(path);
            if (completeMatcher.matches()) {
                return handleComplete(req, completeMatcher.group(1));
            }

            Matcher failMatcher = FAIL_PATTERN.matcher(path);
            if (failMatcher.matches()) {
                return handleFail(req, failMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown results endpoint");

        } catch (Exception e) {
            return ApiSupport.failure(e, log, "Worker request " + path);
        }
    }

    private ControllerResponse handleClaim(FullHttpRequest req) throws Exception {
        ClaimResultsRequest request = ApiSupport.readBody(req, ClaimResultsRequest.class);
        request.validate();

        List<TaskResult> claimed = resultService.claim(request.workerId(), request.queue(),
                request.maxResultsOrDefault());
        if (!claimed.isEmpty()) {
            log.debug("Worker {} claimed {} result(s)", request.workerId(), claimed.size());
        }

        return ApiSupport.ok(ClaimResultsResponse.from(claimed));
    }

    private ControllerResponse handleComplete(FullHttpRequest req, String resultId) throws Exception {
        CompleteResultRequest request = ApiSupport.readBody(req, CompleteResultRequest.class);
        request.validate();

        String resultJson = request.result() == null || request.result().isNull()
                ? null
                : RouterHandler.mapper().writeValueAsString(request.result());

        ResultCompleteOutcome outcome = resultService.complete(resultId, request.workerId(), resultJson);

        return switch (outcome) {
            case COMPLETED, ALREADY_DONE -> ApiSupport.ok(OperationResponse.accepted());
            case NOT_FOUND -> operationError(HttpResponseStatus.NOT_FOUND, OperationResponse.unknownResult());
            case WRONG_WORKER -> operationError(HttpResponseStatus.CONFLICT, OperationResponse.heldByAnotherWorker());
        };
    }

    private ControllerResponse handleFail(FullHttpRequest req, String resultId) throws Exception {
        FailResultRequest request = ApiSupport.readBody(req, FailResultRequest.class);
        request.validate();

        ResultFailOutcome outcome = resultService.fail(resultId, request.workerId(), request.traceback(),
                request.isRetriable());

        return switch (outcome) {
            case RETRY -> ApiSupport.ok(OperationResponse.failureRecorded(true));
            case FAILED -> ApiSupport.ok(OperationResponse.failureRecorded(false));
            case ALREADY_TERMINAL -> ApiSupport.ok(OperationResponse.accepted());
            case NOT_FOUND -> operationError(HttpResponseStatus.NOT_FOUND, OperationResponse.unknownResult());
            case WRONG_WORKER -> operationError(HttpResponseStatus.CONFLICT, OperationResponse.heldByAnotherWorker());
        };
    }

    private static ControllerResponse operationError(HttpResponseStatus status, OperationResponse body)
            throws Exception {
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(body));
    }
}
