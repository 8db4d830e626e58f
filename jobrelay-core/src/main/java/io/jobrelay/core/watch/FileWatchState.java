package io.jobrelay.core.watch;

import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.core.repository.ResourceNotFoundException;

/**
 * Last observed modification time of each job's watched path.
 * Read and written only by the trigger poller.
 */
public interface FileWatchState
{
    Optional<Instant> getLastSeenMtime(long jobId)
        throws ResourceNotFoundException;

    /**
     * Records mtime if it is newer than the last observed value.
     *
     * @return true if the value moved forward
     */
    boolean advance(long jobId, Instant mtime)
        throws ResourceNotFoundException;
}
