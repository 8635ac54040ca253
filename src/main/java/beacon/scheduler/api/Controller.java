package beacon.scheduler.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One admin route. The router asks each controller in turn whether it owns
 * a request and hands the first match the request with its query string
 * already stripped from {@code path}.
 */
public interface Controller {

    boolean matches(HttpMethod method, String path);

    /**
     * Serve a request this controller matched. Throwing
     * {@code TriggerNotFoundException} or {@code IllegalArgumentException}
     * is enough to produce a 404 or 400.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /** Status, content type and body written back by the router. */
    record ControllerResponse(HttpResponseStatus status, String contentType, String body) {

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

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        private static ControllerResponse failure(HttpResponseStatus status, String message) {
            String escaped = message == null ? "" : message
                    .replace("\\", "\\\\")
                    .replace("\"", "\\\"")
                    .replace("\n", "\\n")
                    .replace("\r", "\\r");
            return new ControllerResponse(status, JSON, "{\"error\":\"" + escaped + "\"}");
        }
    }
}
