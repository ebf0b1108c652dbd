package chronobeat.api;

import chronobeat.api.Controller.ControllerResponse;
import chronobeat.exception.DispatchUnavailableException;
import chronobeat.exception.ScheduleInUseException;
import chronobeat.exception.ValidationException;
import chronobeat.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Request parsing and error mapping shared by the controllers.
 */
public final class ApiSupport {

    private ApiSupport() {
    }

    /**
     * Deserialize the request body.
     *
     * @throws IllegalArgumentException if the body is empty or not valid JSON
     *                                  for the target type
     */
    public static <T> T readBody(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return RouterHandler.mapper().readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid request body: " + e.getOriginalMessage());
        }
    }

    public static ControllerResponse ok(Object body) throws JsonProcessingException {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(body));
    }

    public static ControllerResponse created(Object body) throws JsonProcessingException {
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.mapper().writeValueAsString(body));
    }

    public static Map<String, List<String>> query(FullHttpRequest req) {
        return new QueryStringDecoder(req.uri()).parameters();
    }

    public static String param(Map<String, List<String>> query, String name) {
        List<String> values = query.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    public static Integer intParam(Map<String, List<String>> query, String name) {
        String value = param(query, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
        }
    }

    public static Boolean boolParam(Map<String, List<String>> query, String name) {
        String value = param(query, name);
        if (value == null) {
            return null;
        }
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(name + " must be true or false, got '" + value + "'");
    }

    public static long parseId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid id: " + raw);
        }
    }

    /**
     * Map a failure to a response. Input errors become 400, a schedule still in
     * use 409, an unreachable execution system 503; anything else is logged and
     * answered with 500.
     */
    public static ControllerResponse failure(Exception e, Logger log, String operation) {
        if (e instanceof ValidationException || e instanceof IllegalArgumentException) {
            return ControllerResponse.badRequest(e.getMessage());
        }
        if (e instanceof ScheduleInUseException) {
            return ControllerResponse.conflict(e.getMessage());
        }
        if (e instanceof DispatchUnavailableException) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return ControllerResponse.unavailable(e.getMessage());
        }
        log.error("{} failed", operation, e);
        return ControllerResponse.error("internal error");
    }
}
