package nexa.taskapi.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import nexa.taskapi.api.Controller;
import nexa.taskapi.api.v1.dto.RootResponse;

/**
 * Welcome endpoint.
 * GET /
 */
public class RootController implements Controller {

    private static final RootResponse WELCOME =
            new RootResponse("Welcome to Nexa Task API", "/api/v1/health");

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && ("/".equals(path) || path.isEmpty());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(WELCOME);
    }
}
