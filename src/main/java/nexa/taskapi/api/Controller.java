package nexa.taskapi.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import nexa.taskapi.api.v1.dto.ErrorResponse;
import nexa.taskapi.util.Jsons;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     * @throws RequestValidationException if the request body is invalid
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller. The body is always JSON.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(Object value) {
            return json(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            return new ControllerResponse(status, "application/json", Jsons.toJson(value));
        }

        public static ControllerResponse notFound(String detail) {
            return json(HttpResponseStatus.NOT_FOUND, ErrorResponse.message(detail));
        }

        public static ControllerResponse unprocessable(RequestValidationException e) {
            return json(HttpResponseStatus.UNPROCESSABLE_ENTITY, ErrorResponse.validation(e.errors()));
        }

        public static ControllerResponse error(String detail) {
            return json(HttpResponseStatus.INTERNAL_SERVER_ERROR, ErrorResponse.message(detail));
        }
    }
}
