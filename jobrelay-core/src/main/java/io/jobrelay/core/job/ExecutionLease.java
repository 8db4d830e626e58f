package io.jobrelay.core.job;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Time-bounded claim on a job. While active, no other run of the job may start.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableExecutionLease.class)
@JsonDeserialize(as = ImmutableExecutionLease.class)
public interface ExecutionLease
{
    String getHolderId();

    Instant getExpiresAt();

    default boolean isActive(Instant now)
    {
        return getExpiresAt().isAfter(now);
    }

    static ExecutionLease of(String holderId, Instant expiresAt)
    {
        return ImmutableExecutionLease.builder()
            .holderId(holderId)
            .expiresAt(expiresAt)
            .build();
    }
}
