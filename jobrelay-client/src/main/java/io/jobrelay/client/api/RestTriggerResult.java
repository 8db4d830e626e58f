package io.jobrelay.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestTriggerResult.class)
public interface RestTriggerResult
{
    long getJobId();

    // ACCEPTED, ALREADY_RUNNING, DISABLED or REJECTED
    String getResult();

    Optional<String> getRunId();

    boolean getRetryable();

    static ImmutableRestTriggerResult.Builder builder()
    {
        return ImmutableRestTriggerResult.builder();
    }
}
