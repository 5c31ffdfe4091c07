package nexa.taskapi.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import nexa.taskapi.api.Controller;
import nexa.taskapi.api.v1.dto.HealthResponse;
import nexa.taskapi.config.TaskApiConfig;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Liveness only: the database is not probed.
 */
public class HealthController implements Controller {

    private final HealthResponse response =
            HealthResponse.healthy(TaskApiConfig.SERVICE_NAME, TaskApiConfig.SERVICE_VERSION);

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(response);
    }
}
