package io.jobrelay.core.job;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.jobrelay.client.config.Config;
import org.immutables.value.Value;

/**
 * Definition of a job as registered by its owner.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableJob.class)
public abstract class Job
{
    public abstract String getName();

    public abstract String getOwnerId();

    public abstract String getScriptRef();

    @Value.Default
    public boolean getEnabled()
    {
        return true;
    }

    public abstract Optional<Instant> getDueTime();

    public abstract Optional<Config> getRecurrence();

    public abstract Optional<String> getWatchedPath();

    public abstract Optional<String> getWebhookSecret();

    @Value.Default
    public boolean getNotifyOnSuccess()
    {
        return false;
    }

    @Value.Default
    public boolean getNotifyOnFailure()
    {
        return true;
    }

    @Value.Check
    protected void check()
    {
        if (getName().trim().isEmpty()) {
            throw new IllegalArgumentException("Job name must not be empty");
        }
        if (getOwnerId().trim().isEmpty()) {
            throw new IllegalArgumentException("Job owner must not be empty");
        }
        if (getScriptRef().trim().isEmpty()) {
            throw new IllegalArgumentException("Job script must not be empty");
        }
    }

    public static ImmutableJob.Builder jobBuilder()
    {
        return ImmutableJob.builder();
    }
}
