package io.jobrelay.core.job;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.jobrelay.spi.TriggerSource;
import org.immutables.value.Value;

/**
 * Audit record of a trigger received from outside the engine.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTriggerEvent.class)
@JsonDeserialize(as = ImmutableTriggerEvent.class)
public interface TriggerEvent
{
    long getJobId();

    TriggerSource getSource();

    Optional<String> getCallerId();

    Instant getReceivedAt();

    static TriggerEvent of(long jobId, TriggerSource source, Optional<String> callerId, Instant receivedAt)
    {
        return ImmutableTriggerEvent.builder()
            .jobId(jobId)
            .source(source)
            .callerId(callerId)
            .receivedAt(receivedAt)
            .build();
    }
}
