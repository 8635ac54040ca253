package beacon.scheduler.server;

import beacon.scheduler.api.Controller;
import beacon.scheduler.api.Controller.ControllerResponse;
import beacon.scheduler.exception.TriggerNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches admin requests to the first controller whose route matches.
 * Unmatched paths get a JSON 404. Trigger lookups that miss map to 404 and
 * rejected arguments to 400.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> routes = new CopyOnWriteArrayList<>();

    public RouterHandler registerController(Controller controller) {
        routes.add(controller);
        log.debug("Route added: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();

        ControllerResponse response;
        try {
            response = dispatch(ctx, req, method, path);
        } catch (TriggerNotFoundException e) {
            response = ControllerResponse.notFound(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Request failed: {} {}", method, path, e);
            response = ControllerResponse.error(e.toString());
        }
        send(ctx, response);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        for (Controller route : routes) {
            if (route.matches(method, path)) {
                return route.handle(ctx, req, path);
            }
        }
        log.debug("No route for {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    private void send(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body() == null
                ? new byte[0]
                : response.body().getBytes(StandardCharsets.UTF_8);
        try {
            FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            out.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            out.headers().setInt(CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(out);
        } catch (Exception e) {
            log.error("Could not write {} response", response.status(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Admin channel error, closing connection", cause);
        ctx.close();
    }

    /** Mapper shared by the controllers; writes Instants as ISO-8601 strings. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
