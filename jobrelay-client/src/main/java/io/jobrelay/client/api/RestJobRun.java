package io.jobrelay.client.api;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobRun.class)
public interface RestJobRun
{
    String getRunId();

    long getJobId();

    String getSource();

    String getStatus();

    Instant getStartedAt();

    Optional<Instant> getFinishedAt();

    Optional<String> getOutput();

    Optional<String> getError();

    static ImmutableRestJobRun.Builder builder()
    {
        return ImmutableRestJobRun.builder();
    }
}
