package io.jobrelay.server.rs;

import java.time.Instant;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.POST;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.Response;
import com.google.inject.Inject;
import io.jobrelay.client.api.RestJob;
import io.jobrelay.client.api.RestJobCollection;
import io.jobrelay.client.api.RestJobDeletion;
import io.jobrelay.client.api.RestJobRequest;
import io.jobrelay.client.api.RestJobRunCollection;
import io.jobrelay.core.chain.DependencyCycleException;
import io.jobrelay.core.job.JobManager;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;

@Path("/")
@Produces("application/json")
public class JobResource
        extends AuthenticatedResource
{
    // GET    /api/jobs                               # list jobs of the caller
    // POST   /api/jobs                               # register a job
    // GET    /api/jobs/{id}                          # show a job
    // PUT    /api/jobs/{id}                          # update a job
    // DELETE /api/jobs/{id}                          # delete a job, or disable it if other jobs chain to it
    // POST   /api/jobs/{id}/enable                   # enable a job
    // POST   /api/jobs/{id}/disable                  # disable a job
    // PUT    /api/jobs/{id}/dependents/{childId}     # run childId after id completes
    // DELETE /api/jobs/{id}/dependents/{childId}     # remove the chaining edge
    // GET    /api/jobs/{id}/runs                     # run history, newest first

    private static final int MAX_RUNS_PAGE_SIZE = 100;

    private final JobManager jobManager;

    @Inject
    public JobResource(JobManager jobManager)
    {
        this.jobManager = jobManager;
    }

    @GET
    @Path("/api/jobs")
    public RestJobCollection getJobs(@HeaderParam(CALLER_HEADER) String caller)
    {
        String callerId = requireCaller(caller);
        return RestModels.jobCollection(jobManager.getJobs(callerId), Instant.now());
    }

    @POST
    @Consumes("application/json")
    @Path("/api/jobs")
    public Response createJob(@HeaderParam(CALLER_HEADER) String caller, RestJobRequest request)
        throws ResourceConflictException
    {
        String callerId = requireCaller(caller);
        StoredJob job = jobManager.createJob(RestModels.newJob(callerId, request));
        return Response.status(Response.Status.CREATED)
            .entity(RestModels.job(job, Instant.now()))
            .build();
    }

    @GET
    @Path("/api/jobs/{id}")
    public RestJob getJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        return RestModels.job(jobManager.getJob(callerId, id), Instant.now());
    }

    @PUT
    @Consumes("application/json")
    @Path("/api/jobs/{id}")
    public RestJob updateJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id, RestJobRequest request)
        throws ResourceNotFoundException, AccessDeniedException, ResourceConflictException
    {
        String callerId = requireCaller(caller);
        StoredJob current = jobManager.getJob(callerId, id);
        StoredJob updated = jobManager.updateJob(callerId, id, RestModels.mergeJob(current, request));
        return RestModels.job(updated, Instant.now());
    }

    @DELETE
    @Path("/api/jobs/{id}")
    public RestJobDeletion deleteJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        return RestModels.deletion(id, jobManager.deleteJob(callerId, id));
    }

    @POST
    @Path("/api/jobs/{id}/enable")
    public RestJob enableJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        return RestModels.job(jobManager.enableJob(callerId, id), Instant.now());
    }

    @POST
    @Path("/api/jobs/{id}/disable")
    public RestJob disableJob(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        return RestModels.job(jobManager.disableJob(callerId, id), Instant.now());
    }

    @PUT
    @Path("/api/jobs/{id}/dependents/{childId}")
    public RestJob addDependent(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id, @PathParam("childId") long childId)
        throws ResourceNotFoundException, AccessDeniedException, DependencyCycleException
    {
        String callerId = requireCaller(caller);
        jobManager.addDependent(callerId, id, childId);
        return RestModels.job(jobManager.getJob(callerId, id), Instant.now());
    }

    @DELETE
    @Path("/api/jobs/{id}/dependents/{childId}")
    public RestJob removeDependent(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") long id, @PathParam("childId") long childId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        jobManager.removeDependent(callerId, id, childId);
        return RestModels.job(jobManager.getJob(callerId, id), Instant.now());
    }

    @GET
    @Path("/api/jobs/{id}/runs")
    public RestJobRunCollection getRuns(
            @HeaderParam(CALLER_HEADER) String caller,
            @PathParam("id") long id,
            @QueryParam("limit") @DefaultValue("20") int limit)
        throws ResourceNotFoundException, AccessDeniedException
    {
        String callerId = requireCaller(caller);
        int pageSize = Math.max(1, Math.min(limit, MAX_RUNS_PAGE_SIZE));
        return RestModels.runCollection(jobManager.getRuns(callerId, id, pageSize));
    }
}
