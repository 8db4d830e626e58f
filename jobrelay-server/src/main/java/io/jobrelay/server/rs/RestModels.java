package io.jobrelay.server.rs;

import java.time.Instant;
import java.util.List;
import com.google.common.collect.ImmutableList;
import io.jobrelay.client.api.RestJob;
import io.jobrelay.client.api.RestJobCollection;
import io.jobrelay.client.api.RestJobDeletion;
import io.jobrelay.client.api.RestJobRequest;
import io.jobrelay.client.api.RestJobRun;
import io.jobrelay.client.api.RestJobRunCollection;
import io.jobrelay.client.api.RestTriggerResult;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.core.chain.JobDeletion;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.job.ImmutableJob;
import io.jobrelay.core.job.Job;
import io.jobrelay.core.job.JobRun;
import io.jobrelay.core.job.StoredJob;

import static java.util.stream.Collectors.toList;

public final class RestModels
{
    private RestModels()
    { }

    public static RestJob job(StoredJob job, Instant now)
    {
        return RestJob.builder()
            .id(job.getId())
            .name(job.getName())
            .ownerId(job.getOwnerId())
            .scriptRef(job.getScriptRef())
            .enabled(job.getEnabled())
            .dueTime(job.getDueTime())
            .recurrence(job.getRecurrence())
            .watchedPath(job.getWatchedPath())
            .dependents(ImmutableList.sortedCopyOf(job.getDependents()))
            .lastRunAt(job.getLastRunAt())
            .lastRunFinishedAt(job.getLastRunFinishedAt())
            .running(job.isRunning(now))
            .notifyOnSuccess(job.getNotifyOnSuccess())
            .notifyOnFailure(job.getNotifyOnFailure())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .build();
    }

    public static RestJobCollection jobCollection(List<StoredJob> jobs, Instant now)
    {
        return RestJobCollection.builder()
            .jobs(jobs.stream().map(job -> job(job, now)).collect(toList()))
            .build();
    }

    public static RestJobRun run(JobRun run)
    {
        return RestJobRun.builder()
            .runId(run.getRunId())
            .jobId(run.getJobId())
            .source(run.getSource().toConfigString())
            .status(run.getStatus().name())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .output(run.getOutput())
            .error(run.getError())
            .build();
    }

    public static RestJobRunCollection runCollection(List<JobRun> runs)
    {
        return RestJobRunCollection.builder()
            .runs(runs.stream().map(RestModels::run).collect(toList()))
            .build();
    }

    public static RestTriggerResult triggerResult(long jobId, TriggerResult result)
    {
        return RestTriggerResult.builder()
            .jobId(jobId)
            .result(result.getStatus().name())
            .runId(result.getRunId())
            .retryable(result.isRetryable())
            .build();
    }

    public static RestJobDeletion deletion(long jobId, JobDeletion deletion)
    {
        return RestJobDeletion.builder()
            .jobId(jobId)
            .softDeleted(deletion == JobDeletion.SOFT_DELETED)
            .build();
    }

    /**
     * Builds a new job owned by the caller.
     */
    public static Job newJob(String ownerId, RestJobRequest request)
    {
        if (!request.getName().isPresent()) {
            throw new ConfigException("Job name is required");
        }
        if (!request.getScriptRef().isPresent()) {
            throw new ConfigException("Job scriptRef is required");
        }
        ImmutableJob.Builder builder = Job.jobBuilder()
            .ownerId(ownerId)
            .name(request.getName().get())
            .scriptRef(request.getScriptRef().get())
            .recurrence(request.getRecurrence())
            .dueTime(request.getDueTime())
            .watchedPath(request.getWatchedPath())
            .webhookSecret(request.getWebhookSecret());
        setFlags(builder, request);
        return builder.build();
    }

    /**
     * Applies the present fields of the request on top of the current definition.
     */
    public static Job mergeJob(StoredJob current, RestJobRequest request)
    {
        ImmutableJob.Builder builder = Job.jobBuilder()
            .from((Job) current);
        if (request.getName().isPresent()) {
            builder.name(request.getName().get());
        }
        if (request.getScriptRef().isPresent()) {
            builder.scriptRef(request.getScriptRef().get());
        }
        if (request.getWatchedPath().isPresent()) {
            builder.watchedPath(request.getWatchedPath());
        }
        if (request.getWebhookSecret().isPresent()) {
            builder.webhookSecret(request.getWebhookSecret());
        }
        if (request.getRecurrence().isPresent()) {
            builder.recurrence(request.getRecurrence());
            // recomputed from the new rule unless given explicitly
            builder.dueTime(request.getDueTime());
        }
        else if (request.getDueTime().isPresent()) {
            builder.dueTime(request.getDueTime());
        }
        setFlags(builder, request);
        return builder.build();
    }

    private static void setFlags(ImmutableJob.Builder builder, RestJobRequest request)
    {
        if (request.getEnabled().isPresent()) {
            builder.enabled(request.getEnabled().get());
        }
        if (request.getNotifyOnSuccess().isPresent()) {
            builder.notifyOnSuccess(request.getNotifyOnSuccess().get());
        }
        if (request.getNotifyOnFailure().isPresent()) {
            builder.notifyOnFailure(request.getNotifyOnFailure().get());
        }
    }
}
