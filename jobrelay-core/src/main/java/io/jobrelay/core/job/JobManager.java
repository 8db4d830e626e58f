package io.jobrelay.core.job;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.core.chain.ChainResolver;
import io.jobrelay.core.chain.DependencyCycleException;
import io.jobrelay.core.chain.JobDeletion;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.core.schedule.RecurrenceScheduler;
import io.jobrelay.core.watch.FileWatchState;
import io.jobrelay.core.watch.WatchedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration actions of job owners. Every method takes the caller's id and
 * refuses to touch jobs owned by someone else.
 */
public class JobManager
{
    private static final Logger logger = LoggerFactory.getLogger(JobManager.class);

    private final JobStore store;
    private final RecurrenceScheduler recurrenceScheduler;
    private final ChainResolver chainResolver;
    private final FileWatchState fileWatchState;

    @Inject
    public JobManager(
            JobStore store,
            RecurrenceScheduler recurrenceScheduler,
            ChainResolver chainResolver,
            FileWatchState fileWatchState)
    {
        this.store = store;
        this.recurrenceScheduler = recurrenceScheduler;
        this.chainResolver = chainResolver;
        this.fileWatchState = fileWatchState;
    }

    /**
     * Registers a job. A recurring job without an explicit dueTime is due at
     * the first occurrence of its rule.
     *
     * @throws io.jobrelay.client.config.ConfigException if the recurrence rule is invalid
     */
    public StoredJob createJob(Job job)
        throws ResourceConflictException
    {
        Instant now = Instant.now();
        Job normalized = withInitialDueTime(job, now);
        StoredJob stored = store.createJob(normalized, now);
        logger.info("Created job id={} '{}' for {}", stored.getId(), stored.getName(), stored.getOwnerId());

        if (!stored.getWatchedPath().isPresent()) {
            return stored;
        }
        recordBaseline(stored.getId(), stored.getWatchedPath().get());
        try {
            return store.getJobById(stored.getId());
        }
        catch (ResourceNotFoundException ex) {
            logger.debug("Job id={} was deleted right after it was created", stored.getId());
            return stored;
        }
    }

    public StoredJob getJob(String callerId, long jobId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        StoredJob job = store.getJobById(jobId);
        checkOwner(job, callerId);
        return job;
    }

    public List<StoredJob> getJobs(String callerId)
    {
        return store.getJobsByOwner(callerId);
    }

    /**
     * Replaces the definition of a job. The owner can't be changed.
     */
    public StoredJob updateJob(String callerId, long jobId, Job definition)
        throws ResourceNotFoundException, AccessDeniedException, ResourceConflictException
    {
        if (!definition.getOwnerId().equals(callerId)) {
            throw new AccessDeniedException("Job owner can't be changed to " + definition.getOwnerId());
        }
        Instant now = Instant.now();
        StoredJob before = getJob(callerId, jobId);
        Job normalized = withInitialDueTime(definition, now);

        StoredJob updated = store.updateJobById(jobId, (controlStore, job) -> {
            JobControl control = new JobControl(controlStore, job);
            control.updateDefinition(normalized);
            return control.get();
        });
        logger.info("Updated job id={}", jobId);

        if (updated.getWatchedPath().isPresent() && !updated.getWatchedPath().equals(before.getWatchedPath())) {
            recordBaseline(jobId, updated.getWatchedPath().get());
        }
        return store.getJobById(jobId);
    }

    /**
     * Enables a job. A recurring job whose dueTime already passed is moved to
     * the first occurrence after now instead of firing for the time it was off.
     */
    public StoredJob enableJob(String callerId, long jobId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, jobId);
        Instant now = Instant.now();
        return store.updateJobById(jobId, (controlStore, job) -> {
            JobControl control = new JobControl(controlStore, job);
            Optional<Instant> dueTime = job.getDueTime();
            if (job.getRecurrence().isPresent() && (!dueTime.isPresent() || dueTime.get().isBefore(now))) {
                dueTime = recurrenceScheduler.firstDueTime(job.getRecurrence().get(), now);
            }
            control.enableJob(dueTime);
            logger.info("Enabled job id={}. Next due time: {}", jobId, dueTime.orNull());
            return control.get();
        });
    }

    /**
     * Disables a job. A run already in progress is not interrupted.
     */
    public StoredJob disableJob(String callerId, long jobId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, jobId);
        return store.updateJobById(jobId, (controlStore, job) -> {
            JobControl control = new JobControl(controlStore, job);
            control.disableJob();
            logger.info("Disabled job id={}", jobId);
            return control.get();
        });
    }

    public JobDeletion deleteJob(String callerId, long jobId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, jobId);
        return chainResolver.deleteOrDisable(jobId);
    }

    public void addDependent(String callerId, long parentId, long childId)
        throws ResourceNotFoundException, AccessDeniedException, DependencyCycleException
    {
        getJob(callerId, parentId);
        getJob(callerId, childId);
        chainResolver.addDependent(parentId, childId);
    }

    public void removeDependent(String callerId, long parentId, long childId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, parentId);
        chainResolver.removeDependent(parentId, childId);
    }

    public List<JobRun> getRuns(String callerId, long jobId, int limit)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, jobId);
        return store.getRuns(jobId, limit);
    }

    public List<TriggerEvent> getTriggerEvents(String callerId, long jobId, int limit)
        throws ResourceNotFoundException, AccessDeniedException
    {
        getJob(callerId, jobId);
        return store.getTriggerEvents(jobId, limit);
    }

    private Job withInitialDueTime(Job job, Instant now)
    {
        if (!job.getRecurrence().isPresent()) {
            return job;
        }
        // validates the rule even when dueTime is given
        Optional<Instant> first = recurrenceScheduler.firstDueTime(job.getRecurrence().get(), now);
        if (job.getDueTime().isPresent()) {
            return job;
        }
        return ImmutableJob.builder()
            .from(job)
            .dueTime(first)
            .build();
    }

    // the file as it exists at registration is not a change
    private void recordBaseline(long jobId, String path)
    {
        try {
            Optional<Instant> mtime = WatchedFiles.readModifiedTime(path);
            if (mtime.isPresent()) {
                fileWatchState.advance(jobId, mtime.get());
            }
        }
        catch (IOException ex) {
            logger.warn("Failed to read modification time of {} watched by job id={}", path, jobId, ex);
        }
        catch (ResourceNotFoundException ex) {
            logger.debug("Job id={} was deleted before its watched path was recorded", jobId);
        }
    }

    private static void checkOwner(StoredJob job, String callerId)
        throws AccessDeniedException
    {
        if (!job.getOwnerId().equals(callerId)) {
            throw new AccessDeniedException("Job id=" + job.getId() + " is not owned by " + callerId);
        }
    }
}
