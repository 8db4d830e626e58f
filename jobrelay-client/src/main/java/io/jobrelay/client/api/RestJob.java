package io.jobrelay.client.api;

import java.time.Instant;
import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.jobrelay.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJob.class)
public interface RestJob
{
    long getId();

    String getName();

    String getOwnerId();

    String getScriptRef();

    boolean getEnabled();

    Optional<Instant> getDueTime();

    Optional<Config> getRecurrence();

    Optional<String> getWatchedPath();

    List<Long> getDependents();

    Optional<Instant> getLastRunAt();

    Optional<Instant> getLastRunFinishedAt();

    boolean getRunning();

    boolean getNotifyOnSuccess();

    boolean getNotifyOnFailure();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    static ImmutableRestJob.Builder builder()
    {
        return ImmutableRestJob.builder();
    }
}
