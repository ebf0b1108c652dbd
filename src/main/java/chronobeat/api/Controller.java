package chronobeat.api;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One slice of the HTTP surface. The router asks each registered controller
 * whether it owns a method and path, then hands the request to the first that does.
 */
public interface Controller {

    /**
     * @param path request path with the query string removed
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Produce the reply for a request this controller claimed. Failures the
     * caller can act on are returned as error responses rather than thrown.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Status, content type and body of a reply. Error bodies have the shape
     * {@code {"error": "..."}}.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, JSON, "");
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse forbidden(String message) {
            return failure(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse conflict(String message) {
            return failure(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse unavailable(String message) {
            return failure(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        private static ControllerResponse failure(HttpResponseStatus status, String message) {
            char[] quoted = JsonStringEncoder.getInstance().quoteAsString(message == null ? "" : message);
            return new ControllerResponse(status, JSON, "{\"error\":\"" + new String(quoted) + "\"}");
        }
    }
}
