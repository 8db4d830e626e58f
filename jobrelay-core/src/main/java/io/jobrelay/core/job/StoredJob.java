package io.jobrelay.core.job;

import java.time.Instant;
import java.util.Set;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredJob.class)
@JsonDeserialize(as = ImmutableStoredJob.class)
public abstract class StoredJob
        extends Job
{
    public abstract long getId();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    // ids of jobs triggered when this job completes
    public abstract Set<Long> getDependents();

    public abstract Optional<Instant> getLastSeenMtime();

    public abstract Optional<Instant> getLastRunAt();

    public abstract Optional<Instant> getLastRunFinishedAt();

    public abstract Optional<ExecutionLease> getExecutionLease();

    public boolean isRunning(Instant now)
    {
        return getExecutionLease().isPresent() && getExecutionLease().get().isActive(now);
    }
}
