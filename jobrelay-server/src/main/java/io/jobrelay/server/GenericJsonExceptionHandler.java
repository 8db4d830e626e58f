package io.jobrelay.server;

import java.util.HashMap;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import static io.jobrelay.client.JobRelayJson.objectMapper;

/**
 * Renders an exception as <code>{"message": ..., "status": ...}</code>.
 * Register an anonymous subclass per exception type.
 */
@Provider
public abstract class GenericJsonExceptionHandler<T extends Throwable>
        implements ExceptionMapper<T>
{
    private static final ObjectMapper messageMapper = objectMapper();

    public static Response toResponse(Response.Status status, String message)
    {
        return toResponse(status.getStatusCode(), message);
    }

    public static Response toResponse(int statusCode, String message)
    {
        return responseBuilder(statusCode, message).build();
    }

    public static Response.ResponseBuilder responseBuilder(int statusCode, String message)
    {
        HashMap<String, Object> map = new HashMap<>();
        map.put("message", message);
        map.put("status", statusCode);

        try {
            return Response.status(statusCode)
                .type("application/json")
                .entity(messageMapper.writeValueAsString(map));
        }
        catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
    }

    private final int statusCode;

    public GenericJsonExceptionHandler(int statusCode)
    {
        this.statusCode = statusCode;
    }

    public GenericJsonExceptionHandler(Response.Status status)
    {
        this(status.getStatusCode());
    }

    @Override
    public Response toResponse(T exception)
    {
        return toResponse(statusCode, exception.getMessage());
    }

    public Response toResponse(String message)
    {
        return toResponse(statusCode, message);
    }
}
