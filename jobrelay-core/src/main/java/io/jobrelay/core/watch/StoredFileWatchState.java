package io.jobrelay.core.watch;

import java.time.Instant;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.core.job.JobControl;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.repository.ResourceNotFoundException;

/**
 * Keeps the last seen mtime in the job record itself.
 */
public class StoredFileWatchState
        implements FileWatchState
{
    private final JobStore store;

    @Inject
    public StoredFileWatchState(JobStore store)
    {
        this.store = store;
    }

    @Override
    public Optional<Instant> getLastSeenMtime(long jobId)
        throws ResourceNotFoundException
    {
        return store.getJobById(jobId).getLastSeenMtime();
    }

    @Override
    public boolean advance(long jobId, Instant mtime)
        throws ResourceNotFoundException
    {
        return store.updateJobById(jobId, (controlStore, job) ->
                new JobControl(controlStore, job).advanceLastSeenMtime(mtime));
    }
}
