package io.jobrelay.server.rs;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.Response;
import io.jobrelay.server.GenericJsonExceptionHandler;

/**
 * Base of resources acting on behalf of a caller. The caller id is set by an
 * authenticating front end in the {@value #CALLER_HEADER} header.
 */
public abstract class AuthenticatedResource
{
    public static final String CALLER_HEADER = "X-JobRelay-User";

    protected static String requireCaller(String callerHeader)
    {
        if (callerHeader == null || callerHeader.trim().isEmpty()) {
            throw new WebApplicationException(
                    GenericJsonExceptionHandler.toResponse(Response.Status.UNAUTHORIZED, CALLER_HEADER + " header is required"));
        }
        return callerHeader.trim();
    }
}
