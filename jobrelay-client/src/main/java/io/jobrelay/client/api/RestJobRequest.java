package io.jobrelay.client.api;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import io.jobrelay.client.config.Config;
import org.immutables.value.Value;

/**
 * Body of job create and update requests. On update, absent fields keep their current value.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobRequest.class)
public interface RestJobRequest
{
    Optional<String> getName();

    Optional<String> getScriptRef();

    Optional<Config> getRecurrence();

    Optional<Instant> getDueTime();

    Optional<String> getWatchedPath();

    Optional<Boolean> getEnabled();

    Optional<Boolean> getNotifyOnSuccess();

    Optional<Boolean> getNotifyOnFailure();

    Optional<String> getWebhookSecret();

    static ImmutableRestJobRequest.Builder builder()
    {
        return ImmutableRestJobRequest.builder();
    }
}
