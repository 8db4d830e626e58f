package io.jobrelay.core.job;

import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;

public class JobControl
{
    private final JobControlStore store;
    private StoredJob job;

    public JobControl(JobControlStore store, StoredJob job)
    {
        this.store = store;
        this.job = job;
    }

    public StoredJob get()
    {
        return job;
    }

    public void updateDefinition(Job definition)
        throws ResourceNotFoundException, ResourceConflictException
    {
        store.updateDefinition(job.getId(), definition);
        job = store.getJobById(job.getId());
    }

    public void enableJob(Optional<Instant> dueTime)
        throws ResourceNotFoundException
    {
        store.updateEnabled(job.getId(), true);
        store.updateDueTime(job.getId(), dueTime);
        job = store.getJobById(job.getId());
    }

    public void disableJob()
        throws ResourceNotFoundException
    {
        store.updateEnabled(job.getId(), false);
        job = store.getJobById(job.getId());
    }

    public void updateDueTime(Optional<Instant> dueTime)
        throws ResourceNotFoundException
    {
        store.updateDueTime(job.getId(), dueTime);
        job = store.getJobById(job.getId());
    }

    public boolean advanceLastSeenMtime(Instant mtime)
        throws ResourceNotFoundException
    {
        boolean advanced = store.advanceLastSeenMtime(job.getId(), mtime);
        job = store.getJobById(job.getId());
        return advanced;
    }

    public void markRunStarted(Instant startedAt)
        throws ResourceNotFoundException
    {
        store.updateLastRunAt(job.getId(), startedAt);
        job = store.getJobById(job.getId());
    }

    public void markRunFinished(Instant finishedAt)
        throws ResourceNotFoundException
    {
        store.updateLastRunFinishedAt(job.getId(), finishedAt);
        job = store.getJobById(job.getId());
    }
}
