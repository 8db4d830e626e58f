package io.jobrelay.server.rs;

import javax.ws.rs.Consumes;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.Response;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.client.api.RestCommandReply;
import io.jobrelay.core.dispatch.EventDispatcher;
import io.jobrelay.core.dispatch.JobCommandHandler;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.server.ServerConfig;

/**
 * Entry points that start job runs. All of them go through {@link EventDispatcher}.
 */
@Path("/")
@Produces("application/json")
public class TriggerResource
        extends AuthenticatedResource
{
    // POST /api/jobs/{id}/run                 # run a job now
    // POST /api/webhooks/{id}                 # run a job from a webhook
    // POST /api/commands                      # chat command such as "/job run 3"

    public static final String SECRET_HEADER = "X-JobRelay-Secret";

    private final EventDispatcher dispatcher;
    private final JobCommandHandler commandHandler;
    private final int retryAfterSeconds;

    @Inject
    public TriggerResource(EventDispatcher dispatcher, JobCommandHandler commandHandler, ServerConfig serverConfig)
    {
        this.dispatcher = dispatcher;
        this.commandHandler = commandHandler;
        this.retryAfterSeconds = serverConfig.getRetryAfterSeconds();
    }

    @POST
    @Path("/api/jobs/{id}/run")
    public Response runJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        return toResponse(id, dispatcher.manual(id, callerId));
    }

    @POST
    @Path("/api/webhooks/{id}")
    public Response webhook(
            @PathParam("id") long id,
            @HeaderParam(SECRET_HEADER) String secretHeader,
            @QueryParam("secret") String secretParam)
        throws ResourceNotFoundException, AccessDeniedException
    {
        Optional<String> secret = Optional.fromNullable(secretHeader).or(Optional.fromNullable(secretParam));
        return toResponse(id, dispatcher.webhook(id, secret));
    }

    @POST
    @Consumes("text/plain")
    @Path("/api/commands")
    public RestCommandReply command(@HeaderParam(CALLER_HEADER) String caller, String text)
    {
        String callerId = requireCaller(caller);
        return RestCommandReply.builder()
            .reply(commandHandler.handle(callerId, text == null ? "" : text))
            .build();
    }

    private Response toResponse(long jobId, TriggerResult result)
    {
        Response.ResponseBuilder builder;
        switch (result.getStatus()) {
            case ACCEPTED:
                builder = Response.status(Response.Status.ACCEPTED);
                break;
            case REJECTED:
                builder = Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .header(HttpHeaders.RETRY_AFTER, retryAfterSeconds);
                break;
            default:
                // ALREADY_RUNNING, DISABLED and SKIPPED are not errors
                builder = Response.ok();
                break;
        }
        return builder
            .type("application/json")
            .entity(RestModels.triggerResult(jobId, result))
            .build();
    }
}
