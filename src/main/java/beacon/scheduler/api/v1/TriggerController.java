package beacon.scheduler.api.v1;

import beacon.scheduler.api.Controller;
import beacon.scheduler.api.v1.dto.TriggerResponse;
import beacon.scheduler.exception.TriggerNotFoundException;
import beacon.scheduler.model.Trigger;
import beacon.scheduler.model.TriggerKey;
import beacon.scheduler.model.TriggerModule;
import beacon.scheduler.server.RouterHandler;
import beacon.scheduler.service.TriggerService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for trigger inspection (administrative API).
 * None of these endpoints take part in leasing.
 *
 * GET /api/v1/triggers?org=&module= - List triggers
 * GET /api/v1/triggers/{org}/{module}/{key} - Get one trigger
 * DELETE /api/v1/triggers/{org}/{module}/{key} - Delete one trigger
 */
public class TriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private static final Pattern TRIGGERS_PATTERN = Pattern.compile("^/api/v1/triggers$");
    private static final Pattern TRIGGER_BY_KEY_PATTERN = Pattern.compile("^/api/v1/triggers/([^/]+)/([^/]+)/([^/]+)$");

    private final TriggerService triggerService;

    public TriggerController(TriggerService triggerService) {
        this.triggerService = triggerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return TRIGGERS_PATTERN.matcher(path).matches() ||
                    TRIGGER_BY_KEY_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return TRIGGER_BY_KEY_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TRIGGERS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher keyMatcher = TRIGGER_BY_KEY_PATTERN.matcher(path);
            if (keyMatcher.matches()) {
                TriggerKey key = TriggerKey.of(
                        QueryStringDecoder.decodeComponent(keyMatcher.group(1)),
                        TriggerModule.parse(QueryStringDecoder.decodeComponent(keyMatcher.group(2))),
                        QueryStringDecoder.decodeComponent(keyMatcher.group(3)));

                if (req.method().equals(HttpMethod.DELETE)) {
                    triggerService.delete(key);
                    return ControllerResponse.noContent();
                }
                return handleGet(key);
            }

            return ControllerResponse.notFound("unknown trigger endpoint");

        } catch (TriggerNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Trigger controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/triggers?org=&module=
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String org = first(params, "org");
        String module = first(params, "module");

        Optional<TriggerModule> moduleFilter = module != null
                ? Optional.of(TriggerModule.parse(module))
                : Optional.empty();

        List<Trigger> triggers = org != null
                ? triggerService.listByOrg(org, moduleFilter)
                : triggerService.list(moduleFilter);

        List<TriggerResponse> items = triggers.stream()
                .map(TriggerResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", items.size(),
                "triggers", items);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/triggers/{org}/{module}/{key}
     */
    private ControllerResponse handleGet(TriggerKey key) throws Exception {
        Trigger trigger = triggerService.get(key);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TriggerResponse.from(trigger)));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
