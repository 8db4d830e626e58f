package io.jobrelay.core.job;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;

/**
 * Durable record of jobs and their scheduling fields.
 * <p>
 * Any method may throw {@link io.jobrelay.core.repository.StoreUnavailableException}.
 */
public interface JobStore
{
    StoredJob createJob(Job job, Instant now)
        throws ResourceConflictException;

    StoredJob getJobById(long jobId)
        throws ResourceNotFoundException;

    List<StoredJob> getJobs(int pageSize, Optional<Long> lastId);

    List<StoredJob> getJobsByOwner(String ownerId);

    // enabled jobs whose dueTime is same or before currentTime, earliest first
    List<StoredJob> getDueJobs(Instant currentTime, int limit);

    // enabled jobs with a watchedPath
    List<StoredJob> getWatchedJobs();

    // jobs that list jobId as one of their dependents
    List<StoredJob> getParents(long jobId);

    interface JobUpdateAction <T, E extends Exception>
    {
        T call(JobControlStore store, StoredJob storedJob)
            throws ResourceNotFoundException, E;
    }

    // runs func while holding the job's lock
    <T, E extends Exception> T updateJobById(long jobId, JobUpdateAction<T, E> func)
        throws ResourceNotFoundException, E;

    /**
     * Atomically replaces the lease when the current lease equals expected.
     *
     * @return false if another holder changed the lease in between
     */
    boolean compareAndSetLease(long jobId, Optional<ExecutionLease> expected, Optional<ExecutionLease> update)
        throws ResourceNotFoundException;

    void deleteJobById(long jobId)
        throws ResourceNotFoundException;

    void putRun(JobRun run);

    // latest first
    List<JobRun> getRuns(long jobId, int limit);

    void putTriggerEvent(TriggerEvent event);

    // latest first
    List<TriggerEvent> getTriggerEvents(long jobId, int limit);
}
