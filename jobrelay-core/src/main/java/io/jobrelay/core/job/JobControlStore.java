package io.jobrelay.core.job;

import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;

/**
 * Field level updates applied while the job's row is locked.
 */
public interface JobControlStore
{
    StoredJob getJobById(long jobId)
        throws ResourceNotFoundException;

    void updateDefinition(long jobId, Job definition)
        throws ResourceNotFoundException, ResourceConflictException;

    void updateEnabled(long jobId, boolean enabled)
        throws ResourceNotFoundException;

    void updateDueTime(long jobId, Optional<Instant> dueTime)
        throws ResourceNotFoundException;

    // ignored unless mtime is newer than the stored value
    boolean advanceLastSeenMtime(long jobId, Instant mtime)
        throws ResourceNotFoundException;

    void updateLastRunAt(long jobId, Instant startedAt)
        throws ResourceNotFoundException;

    void updateLastRunFinishedAt(long jobId, Instant finishedAt)
        throws ResourceNotFoundException;

    void addDependent(long jobId, long dependentId)
        throws ResourceNotFoundException;

    void removeDependent(long jobId, long dependentId)
        throws ResourceNotFoundException;
}
